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
 * Operators permitted in the source language.
 */
public class Operators {

  public static enum OpCategory {
    ARITHMETIC,
    COMPARISON,
    BOOLEAN,
  }

  public static enum BinaryOperator {
    PLUS("+", OpCategory.ARITHMETIC),
    MINUS("-", OpCategory.ARITHMETIC),
    MULTIPLY("*", OpCategory.ARITHMETIC),
    DIVIDE("/", OpCategory.ARITHMETIC),
    FLOOR_DIVIDE("//", OpCategory.ARITHMETIC),
    MODULO("%", OpCategory.ARITHMETIC),
    POWER("**", OpCategory.ARITHMETIC),
    EQ("==", OpCategory.COMPARISON),
    NEQ("!=", OpCategory.COMPARISON),
    LT("<", OpCategory.COMPARISON),
    LTE("<=", OpCategory.COMPARISON),
    GT(">", OpCategory.COMPARISON),
    GTE(">=", OpCategory.COMPARISON),
    AND("and", OpCategory.BOOLEAN),
    OR("or", OpCategory.BOOLEAN);

    private final String symbol;
    private final OpCategory category;

    private BinaryOperator(String symbol, OpCategory category) {
      this.symbol = symbol;
      this.category = category;
    }

    /** Source-language spelling */
    public String symbol() {
      return symbol;
    }

    public OpCategory category() {
      return category;
    }

    /**
     * @return true if an element-wise application to tensors gives the
     *    same values as applying it element by element
     */
    public boolean isElementwise() {
      return category == OpCategory.ARITHMETIC;
    }
  }

  public static enum UnaryOperator {
    PLUS("+"),
    NEGATE("-"),
    NOT("not");

    private final String symbol;

    private UnaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }
}
