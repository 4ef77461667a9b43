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

/**
 * Builtin, non-random functions of the source language
 */
public class Builtins {

  public static enum Builtin {
    /** Vector(length[, fill]) */
    VECTOR("Vector", 1, 2, Shape.Kind.VECTOR, ValueType.REAL),
    /** Matrix(rows, cols[, fill]) */
    MATRIX("Matrix", 2, 3, Shape.Kind.MATRIX, ValueType.REAL),
    LEN("len", 1, 1, Shape.Kind.SCALAR, ValueType.INT),
    ABS("abs", 1, 1, Shape.Kind.SCALAR, null),
    MIN("min", 2, 2, Shape.Kind.SCALAR, null),
    MAX("max", 2, 2, Shape.Kind.SCALAR, null),
    SUM("sum", 1, 1, Shape.Kind.SCALAR, null),
    EXP("exp", 1, 1, Shape.Kind.SCALAR, ValueType.REAL),
    LOG("log", 1, 1, Shape.Kind.SCALAR, ValueType.REAL),
    SQRT("sqrt", 1, 1, Shape.Kind.SCALAR, ValueType.REAL),
    FLOOR("floor", 1, 1, Shape.Kind.SCALAR, ValueType.INT),
    ROUND("round", 1, 1, Shape.Kind.SCALAR, ValueType.INT);

    private final String sourceName;
    private final int minArgs;
    private final int maxArgs;
    private final Shape.Kind resultShape;
    /** null if the result has the type of the arguments */
    private final ValueType resultType;

    private Builtin(String sourceName, int minArgs, int maxArgs,
                    Shape.Kind resultShape, ValueType resultType) {
      this.sourceName = sourceName;
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
      this.resultShape = resultShape;
      this.resultType = resultType;
    }

    public String sourceName() {
      return sourceName;
    }

    public int minArgs() {
      return minArgs;
    }

    public int maxArgs() {
      return maxArgs;
    }

    public Shape.Kind resultShape() {
      return resultShape;
    }

    public ValueType resultType() {
      return resultType;
    }

    public boolean isAllocation() {
      return this == VECTOR || this == MATRIX;
    }

    /**
     * @return number of leading arguments giving dimensions
     */
    public int allocationRank() {
      return resultShape.rank();
    }
  }

  /**
   * @return builtin, or null if there is none of that name
   */
  public static Builtin lookup(String name) {
    for (Builtin b: Builtin.values()) {
      if (b.sourceName.equals(name)) {
        return b;
      }
    }
    return null;
  }
}
