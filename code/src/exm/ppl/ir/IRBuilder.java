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
package exm.ppl.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.BinaryOp;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Expression.Literal;
import exm.ppl.ast.Expression.UnaryOp;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.ast.Program;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.Assignment;
import exm.ppl.ast.Statement.Factor;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.If;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Return;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.Builtins;
import exm.ppl.common.lang.Builtins.Builtin;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.DistributionDescriptor.ParamRole;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Role;
import exm.ppl.common.lang.Shape;
import exm.ppl.common.lang.Symbol;
import exm.ppl.common.lang.Symbol.SymbolKind;
import exm.ppl.common.lang.ValueType;
import exm.ppl.frontend.ExprTypes;
import exm.ppl.frontend.LogHelper;
import exm.ppl.frontend.SymbolTable;

/**
 * Lowers a resolved program with no lint errors to IR.
 *
 * Final roles are fixed here: a sampled name is observed if it is a
 * model input or the subject of an observe, else latent.  Containers
 * declared implicitly by indexed writes get an explicit allocation
 * before their loop.
 */
public class IRBuilder {

  private final SymbolTable table;
  private final Map<Symbol, Role> roles = new HashMap<Symbol, Role>();

  /** Enclosing loops, outermost first */
  private final List<For> loops = new ArrayList<For>();

  private int observeCount = 0;
  private int factorCount = 0;

  private IRBuilder(SymbolTable table) {
    this.table = table;
  }

  /**
   * @throws CodegenError if a construct cannot be lowered, e.g. a name
   *            outside the distribution catalog
   */
  public static IRProgram build(Program program, SymbolTable table)
                                          throws CodegenError {
    IRBuilder builder = new IRBuilder(table);
    builder.finalizeRoles();
    List<IRStatement> body = builder.lowerBlock(program.body());

    Map<String, Role> paramRoles = new LinkedHashMap<String, Role>();
    for (Symbol sym: table.symbols()) {
      if (sym.kind() == SymbolKind.PARAMETER) {
        paramRoles.put(sym.name(), builder.roles.get(sym));
      }
    }
    IRProgram ir = new IRProgram(program.name(), program.params(), body,
                                 paramRoles);
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(0, "IR for " + program.name() + ":\n" + ir);
    }
    return ir;
  }

  private void finalizeRoles() {
    for (Symbol sym: table.symbols()) {
      Role role;
      if (sym.isSampled()) {
        boolean observed = sym.isObserved() ||
                           sym.kind() == SymbolKind.PARAMETER;
        role = observed ? Role.OBSERVED : Role.LATENT;
      } else if (sym.kind() == SymbolKind.PARAMETER) {
        role = sym.isObserved() ? Role.OBSERVED : Role.DETERMINISTIC;
      } else if (sym.role() != null) {
        role = sym.role();
      } else {
        role = Role.DETERMINISTIC;
      }
      roles.put(sym, role);
      LogHelper.trace(sym.scopeDepth(), sym.name() + ": " + role);
    }
  }

  private List<IRStatement> lowerBlock(List<Statement> block)
                                            throws CodegenError {
    List<IRStatement> result = new ArrayList<IRStatement>();
    for (Statement stmt: block) {
      lowerStatement(stmt, result);
    }
    return result;
  }

  private void lowerStatement(Statement stmt, List<IRStatement> out)
                                                throws CodegenError {
    switch (stmt.kind()) {
      case ASSIGNMENT: {
        Assignment a = (Assignment)stmt;
        IRExpr target = lowerExpr(a.target(), stmt);
        IRExpr value;
        if (ExprTypes.isAllocation(a.value())) {
          Symbol sym = table.baseSymbol(a.target());
          value = lowerAllocation((Call)a.value(), stmt,
                                  sym != null && holdsIntegers(sym));
        } else {
          value = lowerExpr(a.value(), stmt);
        }
        out.add(new IRStatement.Assign(stmt.pos(), target, value));
        break;
      }
      case SAMPLE: {
        Sample s = (Sample)stmt;
        Symbol sym = table.target(stmt);
        if (sym == null) {
          throw new CodegenError(stmt.pos(), "sample",
                                 "Cannot sample into " + s.target());
        }
        out.add(new IRStatement.Sample(stmt.pos(),
                lowerExpr(s.target(), stmt),
                lowerDistribution(s.distribution(), stmt),
                roles.get(sym), addressFor(s.target(), stmt)));
        break;
      }
      case OBSERVE: {
        Observe o = (Observe)stmt;
        AddressTemplate address;
        if (table.baseSymbol(o.subject()) != null) {
          address = addressFor(o.subject(), stmt);
        } else {
          address = new AddressTemplate("__observe" + observeCount,
                                        unreferencedLoopVars(
                                            new ArrayList<IRExpr>()));
        }
        observeCount++;
        out.add(new IRStatement.Observe(stmt.pos(),
                lowerExpr(o.subject(), stmt),
                lowerDistribution(o.distribution(), stmt), address));
        break;
      }
      case FACTOR: {
        Factor f = (Factor)stmt;
        AddressTemplate address = new AddressTemplate(
            "__factor" + factorCount,
            unreferencedLoopVars(new ArrayList<IRExpr>()));
        factorCount++;
        out.add(new IRStatement.Factor(stmt.pos(),
                lowerExpr(f.value(), stmt), address));
        break;
      }
      case IF: {
        If i = (If)stmt;
        out.add(new IRStatement.If(stmt.pos(),
                lowerExpr(i.condition(), stmt),
                lowerBlock(i.thenBlock()), lowerBlock(i.elseBlock())));
        break;
      }
      case FOR:
        lowerFor((For)stmt, out);
        break;
      case RETURN: {
        Return r = (Return)stmt;
        IRExpr value = r.value() == null ? null : lowerExpr(r.value(), stmt);
        out.add(new IRStatement.Return(stmt.pos(), value));
        break;
      }
      case CONTINUE:
        out.add(new IRStatement.LoopControl(stmt.pos(),
                                            IRStatement.Kind.CONTINUE));
        break;
      case BREAK:
        out.add(new IRStatement.LoopControl(stmt.pos(),
                                            IRStatement.Kind.BREAK));
        break;
      default:
        throw new PPLRuntimeError("Unexpected statement kind: " +
                                  stmt.kind());
    }
  }

  private void lowerFor(For loop, List<IRStatement> out)
                                        throws CodegenError {
    for (Symbol sym: table.implicitDeclarations(loop)) {
      out.add(implicitAllocation(sym, loop));
    }

    Expression.Range range = loop.range();
    if (range.stop() == null) {
      throw new CodegenError(loop.pos(), "for",
          "Loop over " + loop.loopVar() + " has no upper bound");
    }
    IRExpr start = range.start() == null ? IRExpr.Literal.intLit(0) :
                                           lowerExpr(range.start(), loop);
    IRExpr step = range.step() == null ? IRExpr.Literal.intLit(1) :
                                         lowerExpr(range.step(), loop);
    IRExpr stop = lowerExpr(range.stop(), loop);

    loops.add(loop);
    List<IRStatement> body = lowerBlock(loop.body());
    loops.remove(loops.size() - 1);
    out.add(new IRStatement.For(loop.pos(), loop.loopVar(),
                                new IRExpr.Range(start, step, stop), body));
  }

  /**
   * Allocation of a container declared by x[i] = ... in a loop
   */
  private IRStatement implicitAllocation(Symbol sym, For loop)
                                                throws CodegenError {
    Shape shape = sym.shape();
    Builtin alloc;
    switch (shape.kind()) {
      case VECTOR:
        alloc = Builtin.VECTOR;
        break;
      case MATRIX:
        alloc = Builtin.MATRIX;
        break;
      default:
        throw new CodegenError(sym.declaration().pos(), sym.name(),
            "Cannot allocate " + sym.name() + " with shape " + shape);
    }
    List<IRExpr> dims = new ArrayList<IRExpr>();
    for (int i = 0; i < shape.rank(); i++) {
      Expression dim = shape.dim(i);
      if (dim == null) {
        throw new CodegenError(sym.declaration().pos(), sym.name(),
            "Cannot determine dimension " + i + " of " + sym.name());
      }
      dims.add(lowerExpr(dim, loop));
    }
    LogHelper.debug(loops.size(), loop.pos(), "allocate " + sym.name() +
                    " before loop over " + loop.loopVar());
    return new IRStatement.Assign(loop.pos(), new IRExpr.Var(sym.name(),
        false), new IRExpr.Call(alloc, dims, holdsIntegers(sym)));
  }

  private static boolean holdsIntegers(Symbol sym) {
    return sym.isSampled() && sym.isDiscreteOrigin();
  }

  private IRExpr lowerAllocation(Call call, Statement stmt,
                                 boolean integerElements)
                                          throws CodegenError {
    Builtin b = Builtins.lookup(call.function());
    return new IRExpr.Call(b, lowerArgs(call.args(), stmt),
                           integerElements);
  }

  private List<IRExpr> lowerArgs(List<Expression> args, Statement stmt)
                                              throws CodegenError {
    List<IRExpr> result = new ArrayList<IRExpr>(args.size());
    for (Expression arg: args) {
      result.add(lowerExpr(arg, stmt));
    }
    return result;
  }

  private IRExpr.Distribution lowerDistribution(Expression expr,
                            Statement stmt) throws CodegenError {
    if (expr.kind() != Expression.Kind.CALL) {
      throw new CodegenError(expr.pos().orElse(stmt.pos()), expr.toString(),
                             "Expected a distribution, found " + expr);
    }
    Call call = (Call)expr;
    DistributionDescriptor d = Distributions.lookup(call.function());
    if (d == null) {
      throw new CodegenError(expr.pos().orElse(stmt.pos()), call.function(),
                             "Unknown distribution " + call.function());
    }
    if (call.args().size() != d.arity()) {
      throw new CodegenError(expr.pos().orElse(stmt.pos()), d.name(),
          d.signature() + " called with " + call.args().size() +
          " argument(s)");
    }
    List<IRExpr> args = new ArrayList<IRExpr>();
    for (int i = 0; i < d.arity(); i++) {
      Expression arg = call.args().get(i);
      if (d.params().get(i).role == ParamRole.DISTRIBUTION) {
        args.add(lowerDistribution(arg, stmt));
      } else {
        args.add(lowerExpr(arg, stmt));
      }
    }
    return new IRExpr.Distribution(d, args);
  }

  private IRExpr lowerExpr(Expression expr, Statement stmt)
                                      throws CodegenError {
    switch (expr.kind()) {
      case LITERAL: {
        Literal lit = (Literal)expr;
        switch (lit.literalKind()) {
          case INT:
            return new IRExpr.Literal(ValueType.INT, lit.text());
          case FLOAT:
            return new IRExpr.Literal(ValueType.REAL, lit.text());
          case BOOL:
            return new IRExpr.Literal(ValueType.BOOL, lit.text());
          default:
            throw new PPLRuntimeError("Unknown literal kind " +
                                      lit.literalKind());
        }
      }
      case VARIABLE_REF: {
        VariableRef ref = (VariableRef)expr;
        Symbol sym = table.lookup(ref);
        if (sym == null) {
          throw new CodegenError(ref.pos().orElse(stmt.pos()), ref.name(),
                                 "Undefined variable " + ref.name());
        }
        return new IRExpr.Var(ref.name(), roles.get(sym) == Role.LATENT);
      }
      case INDEX: {
        Index index = (Index)expr;
        List<IndexComponent> components = new ArrayList<IndexComponent>();
        for (Expression component: index.indices()) {
          if (component.kind() == Expression.Kind.RANGE) {
            components.add(IndexComponent.slice(
                lowerRange((Expression.Range)component, stmt)));
          } else {
            components.add(new IndexComponent(lowerExpr(component, stmt),
                true, ExprTypes.requiresTruncation(component, table)));
          }
        }
        return new IRExpr.Index(lowerExpr(index.base(), stmt), components);
      }
      case BINARY_OP: {
        BinaryOp op = (BinaryOp)expr;
        return new IRExpr.Binary(op.op(), lowerExpr(op.left(), stmt),
                                 lowerExpr(op.right(), stmt));
      }
      case UNARY_OP: {
        UnaryOp op = (UnaryOp)expr;
        return new IRExpr.Unary(op.op(), lowerExpr(op.operand(), stmt));
      }
      case CALL: {
        Call call = (Call)expr;
        Builtin b = Builtins.lookup(call.function());
        if (b != null) {
          return new IRExpr.Call(b, lowerArgs(call.args(), stmt));
        } else if (Distributions.isDistribution(call.function())) {
          throw new CodegenError(expr.pos().orElse(stmt.pos()),
              call.function(), "Distribution " + call.function() +
              " used outside of ~");
        }
        throw new CodegenError(expr.pos().orElse(stmt.pos()),
              call.function(), "Unknown function " + call.function());
      }
      case RANGE:
        return lowerRange((Expression.Range)expr, stmt);
      default:
        throw new PPLRuntimeError("Unexpected expression kind: " +
                                  expr.kind());
    }
  }

  private IRExpr.Range lowerRange(Expression.Range range, Statement stmt)
                                                  throws CodegenError {
    return new IRExpr.Range(
        range.start() == null ? null : lowerExpr(range.start(), stmt),
        range.step() == null ? null : lowerExpr(range.step(), stmt),
        range.stop() == null ? null : lowerExpr(range.stop(), stmt));
  }

  /**
   * Address of a sampled target or observed subject: the base name,
   * non-slice index expressions outermost first, then loop indices
   */
  private AddressTemplate addressFor(Expression target, Statement stmt)
                                                  throws CodegenError {
    List<IRExpr> components = new ArrayList<IRExpr>();
    Expression root = target;
    while (root.kind() == Expression.Kind.INDEX) {
      Index index = (Index)root;
      List<IRExpr> level = new ArrayList<IRExpr>();
      for (Expression component: index.indices()) {
        if (component.kind() != Expression.Kind.RANGE) {
          level.add(lowerExpr(component, stmt));
        }
      }
      components.addAll(0, level);
      root = index.base();
    }
    String name = ((VariableRef)root).name();
    return new AddressTemplate(name, unreferencedLoopVars(components));
  }

  /**
   * @return components followed by enclosing loop indices none of them
   *         reads, so that each iteration gets a distinct address
   */
  private List<IRExpr> unreferencedLoopVars(List<IRExpr> components) {
    List<IRExpr> result = new ArrayList<IRExpr>(components);
    for (For loop: loops) {
      boolean referenced = false;
      for (IRExpr c: components) {
        if (c.references(loop.loopVar())) {
          referenced = true;
        }
      }
      if (!referenced) {
        result.add(new IRExpr.Var(loop.loopVar(), false));
      }
    }
    return result;
  }
}
