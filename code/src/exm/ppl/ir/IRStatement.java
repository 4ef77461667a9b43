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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.SourcePos;
import exm.ppl.common.lang.Role;

/**
 * Lowered statement.  Random choices carry their address template and
 * final role.
 */
public abstract class IRStatement {

  public static enum Kind {
    ASSIGN,
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

  protected IRStatement(SourcePos pos) {
    this.pos = pos;
  }

  public abstract Kind kind();

  public SourcePos pos() {
    return pos;
  }

  /**
   * @return nested blocks, empty for simple statements
   */
  public List<List<IRStatement>> blocks() {
    return ImmutableList.of();
  }

  /**
   * Debug rendering
   */
  public abstract void prettyPrint(StringBuilder sb, String indent);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    return sb.toString();
  }

  static void prettyPrintBlock(StringBuilder sb, List<IRStatement> block,
                               String indent) {
    for (IRStatement stmt: block) {
      stmt.prettyPrint(sb, indent + "  ");
    }
  }

  public static class Assign extends IRStatement {
    private final IRExpr target;
    private final IRExpr value;

    public Assign(SourcePos pos, IRExpr target, IRExpr value) {
      super(pos);
      this.target = target;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    public IRExpr target() {
      return target;
    }

    public IRExpr value() {
      return value;
    }

    /**
     * @return true for container allocation
     */
    public boolean isAllocation() {
      return value.kind() == IRExpr.Kind.CALL &&
             ((IRExpr.Call)value).function().isAllocation();
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append(target).append(" = ").append(value)
        .append("\n");
    }
  }

  /**
   * A random choice bound to a target.  Observed samples draw a value
   * supplied as data.
   */
  public static class Sample extends IRStatement {
    private final IRExpr target;
    private final IRExpr.Distribution distribution;
    private final Role role;
    private final AddressTemplate address;

    public Sample(SourcePos pos, IRExpr target,
                  IRExpr.Distribution distribution, Role role,
                  AddressTemplate address) {
      super(pos);
      assert(role == Role.LATENT || role == Role.OBSERVED);
      this.target = target;
      this.distribution = distribution;
      this.role = role;
      this.address = address;
    }

    @Override
    public Kind kind() {
      return Kind.SAMPLE;
    }

    public IRExpr target() {
      return target;
    }

    public IRExpr.Distribution distribution() {
      return distribution;
    }

    public Role role() {
      return role;
    }

    public boolean isObserved() {
      return role == Role.OBSERVED;
    }

    public AddressTemplate address() {
      return address;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append(target).append(" ~ ").append(distribution)
        .append(" @ ").append(address).append(" (")
        .append(role.toString().toLowerCase()).append(")\n");
    }
  }

  public static class Observe extends IRStatement {
    private final IRExpr subject;
    private final IRExpr.Distribution distribution;
    private final AddressTemplate address;

    public Observe(SourcePos pos, IRExpr subject,
                   IRExpr.Distribution distribution,
                   AddressTemplate address) {
      super(pos);
      this.subject = subject;
      this.distribution = distribution;
      this.address = address;
    }

    @Override
    public Kind kind() {
      return Kind.OBSERVE;
    }

    public IRExpr subject() {
      return subject;
    }

    public IRExpr.Distribution distribution() {
      return distribution;
    }

    public AddressTemplate address() {
      return address;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("observe ").append(subject).append(" ~ ")
        .append(distribution).append(" @ ").append(address).append("\n");
    }
  }

  public static class Factor extends IRStatement {
    private final IRExpr value;
    private final AddressTemplate address;

    public Factor(SourcePos pos, IRExpr value, AddressTemplate address) {
      super(pos);
      this.value = value;
      this.address = address;
    }

    @Override
    public Kind kind() {
      return Kind.FACTOR;
    }

    public IRExpr value() {
      return value;
    }

    public AddressTemplate address() {
      return address;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("factor ").append(value).append(" @ ")
        .append(address).append("\n");
    }
  }

  public static class If extends IRStatement {
    private final IRExpr condition;
    private final ImmutableList<IRStatement> thenBlock;
    private final ImmutableList<IRStatement> elseBlock;

    public If(SourcePos pos, IRExpr condition, List<IRStatement> thenBlock,
              List<IRStatement> elseBlock) {
      super(pos);
      this.condition = condition;
      this.thenBlock = ImmutableList.copyOf(thenBlock);
      this.elseBlock = ImmutableList.copyOf(elseBlock);
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    public IRExpr condition() {
      return condition;
    }

    public ImmutableList<IRStatement> thenBlock() {
      return thenBlock;
    }

    public ImmutableList<IRStatement> elseBlock() {
      return elseBlock;
    }

    @Override
    public List<List<IRStatement>> blocks() {
      return ImmutableList.<List<IRStatement>>of(thenBlock, elseBlock);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("if ").append(condition).append("\n");
      prettyPrintBlock(sb, thenBlock, indent);
      if (!elseBlock.isEmpty()) {
        sb.append(indent).append("else\n");
        prettyPrintBlock(sb, elseBlock, indent);
      }
    }
  }

  /**
   * Loop over a range with start, step and exclusive stop all present
   */
  public static class For extends IRStatement {
    private final String loopVar;
    private final IRExpr.Range range;
    private final ImmutableList<IRStatement> body;

    public For(SourcePos pos, String loopVar, IRExpr.Range range,
               List<IRStatement> body) {
      super(pos);
      assert(range.start() != null && range.step() != null &&
             range.stop() != null);
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

    public IRExpr.Range range() {
      return range;
    }

    public ImmutableList<IRStatement> body() {
      return body;
    }

    @Override
    public List<List<IRStatement>> blocks() {
      return ImmutableList.<List<IRStatement>>of(body);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("for ").append(loopVar).append(" in ")
        .append(range).append("\n");
      prettyPrintBlock(sb, body, indent);
    }
  }

  public static class Return extends IRStatement {
    private final IRExpr value;

    /**
     * @param value null for a bare return
     */
    public Return(SourcePos pos, IRExpr value) {
      super(pos);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    public IRExpr value() {
      return value;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("return");
      if (value != null) {
        sb.append(" ").append(value);
      }
      sb.append("\n");
    }
  }

  public static class LoopControl extends IRStatement {
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
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append(kind.toString().toLowerCase()).append("\n");
    }
  }
}
