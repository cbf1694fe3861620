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
package exm.lowc.common.lang;

/**
 * Operators of the source language
 */
public class Operators {

  /**
   * Binary arithmetic operators on integer values
   */
  public static enum ArithOp {
    ADD("+", null),
    MUL("*", "*"),
    DIV("/", "/"),
    MOD("%", "%");

    private final String symbol;
    private final String builtinName;

    private ArithOp(String symbol, String builtinName) {
      this.symbol = symbol;
      this.builtinName = builtinName;
    }

    public String symbol() {
      return symbol;
    }

    /**
     * @return name of the builtin function implementing this operator,
     *        or null if it is a primitive of the target
     */
    public String builtinName() {
      return builtinName;
    }
  }

  /**
   * Relational operators, lowered into compares on flags
   */
  public static enum RelOp {
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">=");

    private final String symbol;

    private RelOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }
}
