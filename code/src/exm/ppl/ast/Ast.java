/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ppl.ast;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.Expression.BinaryOp;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Expression.Literal;
import exm.ppl.ast.Expression.LiteralKind;
import exm.ppl.ast.Expression.Range;
import exm.ppl.ast.Expression.UnaryOp;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.ast.Statement.Assignment;
import exm.ppl.ast.Statement.Factor;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.If;
import exm.ppl.ast.Statement.LoopControl;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Return;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.common.lang.Operators.BinaryOperator;
import exm.ppl.common.lang.Operators.UnaryOperator;

/**
 * Factory methods used by the parser to build trees.  Expressions built
 * without a position take that of their enclosing statement in
 * diagnostics.
 */
public class Ast {

  public static SourcePos at(int line) {
    return new SourcePos(line, 0);
  }

  public static SourcePos at(int line, int column) {
    return new SourcePos(line, column);
  }

  public static Program program(String name, List<String> params,
                                Statement... body) {
    return new Program(at(1), name, params, Arrays.asList(body));
  }

  public static List<String> params(String... names) {
    return ImmutableList.copyOf(names);
  }

  public static List<Statement> block(Statement... stmts) {
    return ImmutableList.copyOf(stmts);
  }

  /* Expressions */

  public static Literal lit(long value) {
    return new Literal(SourcePos.NONE, LiteralKind.INT, Long.toString(value));
  }

  public static Literal lit(double value) {
    return new Literal(SourcePos.NONE, LiteralKind.FLOAT,
                       Double.toString(value));
  }

  public static Literal lit(boolean value) {
    return new Literal(SourcePos.NONE, LiteralKind.BOOL,
                       Boolean.toString(value));
  }

  public static VariableRef var(String name) {
    return new VariableRef(SourcePos.NONE, name);
  }

  public static VariableRef var(SourcePos pos, String name) {
    return new VariableRef(pos, name);
  }

  public static Index index(Expression base, Expression... indices) {
    return new Index(SourcePos.NONE, base, Arrays.asList(indices));
  }

  /**
   * Shorthand for indexing a named variable
   */
  public static Index index(String base, Expression... indices) {
    return index(var(base), indices);
  }

  public static BinaryOp binary(BinaryOperator op, Expression left,
                                Expression right) {
    return new BinaryOp(SourcePos.NONE, op, left, right);
  }

  public static BinaryOp plus(Expression left, Expression right) {
    return binary(BinaryOperator.PLUS, left, right);
  }

  public static BinaryOp minus(Expression left, Expression right) {
    return binary(BinaryOperator.MINUS, left, right);
  }

  public static BinaryOp times(Expression left, Expression right) {
    return binary(BinaryOperator.MULTIPLY, left, right);
  }

  public static BinaryOp divide(Expression left, Expression right) {
    return binary(BinaryOperator.DIVIDE, left, right);
  }

  public static BinaryOp eq(Expression left, Expression right) {
    return binary(BinaryOperator.EQ, left, right);
  }

  public static BinaryOp neq(Expression left, Expression right) {
    return binary(BinaryOperator.NEQ, left, right);
  }

  public static BinaryOp and(Expression left, Expression right) {
    return binary(BinaryOperator.AND, left, right);
  }

  public static UnaryOp unary(UnaryOperator op, Expression operand) {
    return new UnaryOp(SourcePos.NONE, op, operand);
  }

  public static UnaryOp negate(Expression operand) {
    return unary(UnaryOperator.NEGATE, operand);
  }

  public static Call call(String function, Expression... args) {
    return new Call(SourcePos.NONE, function, Arrays.asList(args));
  }

  public static Call call(SourcePos pos, String function,
                          Expression... args) {
    return new Call(pos, function, Arrays.asList(args));
  }

  /**
   * start:1:stop
   */
  public static Range range(Expression start, Expression stop) {
    return new Range(SourcePos.NONE, start, lit(1), stop);
  }

  public static Range range(Expression start, Expression step,
                            Expression stop) {
    return new Range(SourcePos.NONE, start, step, stop);
  }

  /**
   * The full slice ":"
   */
  public static Range slice() {
    return new Range(SourcePos.NONE, null, null, null);
  }

  public static Range slice(Expression start, Expression stop) {
    return new Range(SourcePos.NONE, start, null, stop);
  }

  /* Statements */

  public static Assignment assign(SourcePos pos, Expression target,
                                  Expression value) {
    return new Assignment(pos, target, value);
  }

  public static Assignment assign(SourcePos pos, String target,
                                  Expression value) {
    return assign(pos, var(pos, target), value);
  }

  public static Sample sample(SourcePos pos, Expression target,
                              Expression distribution) {
    return new Sample(pos, target, distribution);
  }

  public static Sample sample(SourcePos pos, String target,
                              Expression distribution) {
    return sample(pos, var(pos, target), distribution);
  }

  public static Observe observe(SourcePos pos, Expression subject,
                                Expression distribution) {
    return new Observe(pos, subject, distribution);
  }

  public static Factor factor(SourcePos pos, Expression value) {
    return new Factor(pos, value);
  }

  public static If ifThen(SourcePos pos, Expression condition,
                          Statement... thenBlock) {
    return new If(pos, condition, Arrays.asList(thenBlock),
                  ImmutableList.<Statement>of());
  }

  public static If ifElse(SourcePos pos, Expression condition,
                List<Statement> thenBlock, List<Statement> elseBlock) {
    return new If(pos, condition, thenBlock, elseBlock);
  }

  public static For forLoop(SourcePos pos, String loopVar, Range range,
                            Statement... body) {
    return new For(pos, loopVar, range, Arrays.asList(body));
  }

  public static Return ret(SourcePos pos, Expression value) {
    return new Return(pos, value);
  }

  public static LoopControl cont(SourcePos pos) {
    return new LoopControl(pos, Statement.Kind.CONTINUE);
  }

  public static LoopControl brk(SourcePos pos) {
    return new LoopControl(pos, Statement.Kind.BREAK);
  }
}
