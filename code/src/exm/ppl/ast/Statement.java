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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.Expression.Range;

/**
 * Statement node of the source language.  The set of subclasses is
 * closed: consumers switch over {@link Kind}.
 */
public abstract class Statement {

  public static enum Kind {
    ASSIGNMENT,
    SAMPLE,
    OBSERVE,
    FACTOR,
    IF,
    FOR,
    RETURN,
    CONTINUE,
    BREAK,
  }

  private final SourcePos pos;

  protected Statement(SourcePos pos) {
    this.pos = pos;
  }

  public abstract Kind kind();

  public SourcePos pos() {
    return pos;
  }

  /**
   * @return expressions directly owned by this statement, not including
   *        those of nested blocks
   */
  public abstract List<Expression> expressions();

  /**
   * @return nested statement blocks, empty for simple statements
   */
  public List<List<Statement>> blocks() {
    return ImmutableList.of();
  }

  abstract void appendTo(StringBuilder sb, int depth);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, 0);
    return sb.toString();
  }

  static void indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
  }

  static void appendBlock(StringBuilder sb, List<Statement> block,
                          int depth) {
    if (block.isEmpty()) {
      indent(sb, depth);
      sb.append("pass\n");
    }
    for (Statement stmt: block) {
      stmt.appendTo(sb, depth);
    }
  }

  /**
   * target = value, where target is a variable or an indexed element
   */
  public static class Assignment extends Statement {
    private final Expression target;
    private final Expression value;

    public Assignment(SourcePos pos, Expression target, Expression value) {
      super(pos);
      this.target = target;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGNMENT;
    }

    public Expression target() {
      return target;
    }

    public Expression value() {
      return value;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.of(target, value);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append(target).append(" = ").append(value).append("\n");
    }
  }

  /**
   * target ~ Distribution(args): binds the target to a random choice
   */
  public static class Sample extends Statement {
    private final Expression target;
    private final Expression distribution;

    public Sample(SourcePos pos, Expression target, Expression distribution) {
      super(pos);
      this.target = target;
      this.distribution = distribution;
    }

    @Override
    public Kind kind() {
      return Kind.SAMPLE;
    }

    public Expression target() {
      return target;
    }

    public Expression distribution() {
      return distribution;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.of(target, distribution);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append(target).append(" ~ ").append(distribution).append("\n");
    }
  }

  /**
   * observe subject ~ Distribution(args): constrains the subject, which
   * holds data, to have been drawn from the distribution
   */
  public static class Observe extends Statement {
    private final Expression subject;
    private final Expression distribution;

    public Observe(SourcePos pos, Expression subject,
                   Expression distribution) {
      super(pos);
      this.subject = subject;
      this.distribution = distribution;
    }

    @Override
    public Kind kind() {
      return Kind.OBSERVE;
    }

    public Expression subject() {
      return subject;
    }

    public Expression distribution() {
      return distribution;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.of(subject, distribution);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append("observe ").append(subject).append(" ~ ")
        .append(distribution).append("\n");
    }
  }

  /**
   * factor(value): adds value to the model's log density
   */
  public static class Factor extends Statement {
    private final Expression value;

    public Factor(SourcePos pos, Expression value) {
      super(pos);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.FACTOR;
    }

    public Expression value() {
      return value;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.of(value);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append("factor(").append(value).append(")\n");
    }
  }

  public static class If extends Statement {
    private final Expression condition;
    private final ImmutableList<Statement> thenBlock;
    private final ImmutableList<Statement> elseBlock;

    public If(SourcePos pos, Expression condition, List<Statement> thenBlock,
              List<Statement> elseBlock) {
      super(pos);
      this.condition = condition;
      this.thenBlock = ImmutableList.copyOf(thenBlock);
      this.elseBlock = ImmutableList.copyOf(elseBlock);
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    public Expression condition() {
      return condition;
    }

    public ImmutableList<Statement> thenBlock() {
      return thenBlock;
    }

    /**
     * @return else block, empty if there was none
     */
    public ImmutableList<Statement> elseBlock() {
      return elseBlock;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.of(condition);
    }

    @Override
    public List<List<Statement>> blocks() {
      return ImmutableList.<List<Statement>>of(thenBlock, elseBlock);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append("if ").append(condition).append(":\n");
      appendBlock(sb, thenBlock, depth + 1);
      if (!elseBlock.isEmpty()) {
        indent(sb, depth);
        sb.append("else:\n");
        appendBlock(sb, elseBlock, depth + 1);
      }
    }
  }

  /**
   * for loopVar in start:step:stop
   */
  public static class For extends Statement {
    private final String loopVar;
    private final Range range;
    private final ImmutableList<Statement> body;

    public For(SourcePos pos, String loopVar, Range range,
               List<Statement> body) {
      super(pos);
      this.loopVar = loopVar;
      this.range = range;
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public Kind kind() {
      return Kind.FOR;
    }

    public String loopVar() {
      return loopVar;
    }

    public Range range() {
      return range;
    }

    public ImmutableList<Statement> body() {
      return body;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.<Expression>of(range);
    }

    @Override
    public List<List<Statement>> blocks() {
      return ImmutableList.<List<Statement>>of(body);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append("for ").append(loopVar).append(" in ").append(range)
        .append(":\n");
      appendBlock(sb, body, depth + 1);
    }
  }

  public static class Return extends Statement {
    private final Expression value;

    /**
     * @param value returned value, null for a bare return
     */
    public Return(SourcePos pos, Expression value) {
      super(pos);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    public Expression value() {
      return value;
    }

    @Override
    public List<Expression> expressions() {
      if (value == null) {
        return ImmutableList.of();
      }
      return ImmutableList.of(value);
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append("return");
      if (value != null) {
        sb.append(" ").append(value);
      }
      sb.append("\n");
    }
  }

  /**
   * continue or break, depending on the kind
   */
  public static class LoopControl extends Statement {
    private final Kind kind;

    public LoopControl(SourcePos pos, Kind kind) {
      super(pos);
      assert(kind == Kind.CONTINUE || kind == Kind.BREAK);
      this.kind = kind;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public List<Expression> expressions() {
      return ImmutableList.of();
    }

    @Override
    void appendTo(StringBuilder sb, int depth) {
      indent(sb, depth);
      sb.append(kind == Kind.CONTINUE ? "continue" : "break").append("\n");
    }
  }
}
