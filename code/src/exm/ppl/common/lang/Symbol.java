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
package exm.ppl.common.lang;

import exm.ppl.ast.Expression.Range;
import exm.ppl.ast.Statement;

/**
 * A declared name.  Created and filled in by the scope resolver; every
 * later phase treats it as read-only.
 */
public class Symbol {

  public static enum SymbolKind {
    /** Model input */
    PARAMETER,
    /** Bound by a for loop */
    LOOP_INDEX,
    /** Declared by an assignment or sample in the model body */
    LOCAL,
  }

  private final String name;
  private final SymbolKind kind;
  private final Statement declaration;
  private final int scopeDepth;

  private final Shape shape;
  /** null until the first sample or assignment fixes it */
  private Role role;
  private ValueType valueType = ValueType.UNKNOWN;
  /** null until the first write, then true iff every write was discrete */
  private Boolean discreteOrigin = null;
  private boolean sampled = false;
  private boolean observed = false;
  private int writeCount = 0;
  private Long constantValue = null;

  /** Range of a loop index */
  private Range loopRange = null;
  /** Outermost loop whose indexed writes declared this container */
  private Statement.For implicitLoop = null;

  public Symbol(String name, SymbolKind kind, Statement declaration,
                Shape shape, int scopeDepth) {
    this.name = name;
    this.kind = kind;
    this.declaration = declaration;
    this.shape = shape;
    this.scopeDepth = scopeDepth;
  }

  public String name() {
    return name;
  }

  public SymbolKind kind() {
    return kind;
  }

  /**
   * @return declaring statement, null for parameters
   */
  public Statement declaration() {
    return declaration;
  }

  public int scopeDepth() {
    return scopeDepth;
  }

  public Shape shape() {
    return shape;
  }

  /**
   * @return role fixed by the first sample or assignment, null if none
   *         yet (parameters, or containers not yet written)
   */
  public Role role() {
    return role;
  }

  public void setRole(Role role) {
    assert(this.role == null || this.role == role) :
          name + " role already " + this.role;
    this.role = role;
  }

  public ValueType valueType() {
    return valueType;
  }

  public void setValueType(ValueType valueType) {
    this.valueType = valueType;
  }

  /**
   * @return true if every value stored was drawn from a discrete
   *          distribution
   */
  public boolean isDiscreteOrigin() {
    return discreteOrigin != null && discreteOrigin;
  }

  public void recordWrite(boolean discreteSample) {
    writeCount++;
    if (discreteOrigin == null) {
      discreteOrigin = discreteSample;
    } else {
      discreteOrigin = discreteOrigin && discreteSample;
    }
  }

  public boolean isSampled() {
    return sampled;
  }

  public void markSampled() {
    this.sampled = true;
  }

  /**
   * @return true if an observe statement constrains this name
   */
  public boolean isObserved() {
    return observed;
  }

  public void markObserved() {
    this.observed = true;
  }

  /**
   * @return compile-time integer value if the symbol was assigned a
   *         constant exactly once, otherwise null
   */
  public Long constantValue() {
    return writeCount == 1 ? constantValue : null;
  }

  public void setConstantValue(Long constantValue) {
    this.constantValue = constantValue;
  }

  public Range loopRange() {
    return loopRange;
  }

  public void setLoopRange(Range loopRange) {
    this.loopRange = loopRange;
  }

  public Statement.For implicitLoop() {
    return implicitLoop;
  }

  public void setImplicitLoop(Statement.For implicitLoop) {
    this.implicitLoop = implicitLoop;
  }

  @Override
  public String toString() {
    return name + ": " + kind.toString().toLowerCase() + " " + shape +
           " role=" + role;
  }
}
