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

import java.util.Set;

import com.google.common.base.Objects;

import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.lang.Operators.RelOp;

/**
 * A boolean expression.  Source programs use comparisons combined with
 * and/or/not.  After lowering, comparisons are replaced with formulas
 * over flags, the named boolean states set by an IR compare.
 */
public class BoolExpr {
  public static enum BoolKind {
    COMPARE, AND, OR, NOT, FLAG
  }

  public final BoolKind kind;

  private final Expr lhs;
  private final RelOp relOp;
  private final Expr rhs;
  private final BoolExpr left;
  private final BoolExpr right;
  private final String flag;

  private BoolExpr(BoolKind kind, Expr lhs, RelOp relOp, Expr rhs,
      BoolExpr left, BoolExpr right, String flag) {
    this.kind = kind;
    this.lhs = lhs;
    this.relOp = relOp;
    this.rhs = rhs;
    this.left = left;
    this.right = right;
    this.flag = flag;
  }

  public static BoolExpr compare(Expr lhs, RelOp relOp, Expr rhs) {
    assert(lhs != null && relOp != null && rhs != null);
    return new BoolExpr(BoolKind.COMPARE, lhs, relOp, rhs, null, null, null);
  }

  public static BoolExpr and(BoolExpr left, BoolExpr right) {
    return new BoolExpr(BoolKind.AND, null, null, null, left, right, null);
  }

  public static BoolExpr or(BoolExpr left, BoolExpr right) {
    return new BoolExpr(BoolKind.OR, null, null, null, left, right, null);
  }

  public static BoolExpr not(BoolExpr operand) {
    return new BoolExpr(BoolKind.NOT, null, null, null, operand, null, null);
  }

  /**
   * Reference to the flag set by a compare of the cell with the same name
   */
  public static BoolExpr flag(String name) {
    assert(name != null);
    return new BoolExpr(BoolKind.FLAG, null, null, null, null, null, name);
  }

  public BoolKind kind() {
    return kind;
  }

  public Expr getLhs() {
    checkKind(BoolKind.COMPARE);
    return lhs;
  }

  public RelOp getRelOp() {
    checkKind(BoolKind.COMPARE);
    return relOp;
  }

  public Expr getRhs() {
    checkKind(BoolKind.COMPARE);
    return rhs;
  }

  /**
   * @return left operand of and/or, or the operand of not
   */
  public BoolExpr getLeft() {
    if (kind != BoolKind.AND && kind != BoolKind.OR &&
        kind != BoolKind.NOT) {
      throw new LowcRuntimeError("getLeft for " + kind);
    }
    return left;
  }

  public BoolExpr getRight() {
    if (kind != BoolKind.AND && kind != BoolKind.OR) {
      throw new LowcRuntimeError("getRight for " + kind);
    }
    return right;
  }

  public String getFlag() {
    checkKind(BoolKind.FLAG);
    return flag;
  }

  private void checkKind(BoolKind expected) {
    if (kind != expected) {
      throw new LowcRuntimeError("Expected " + expected + " but got " +
                                 kind + ": " + this);
    }
  }

  /**
   * Add names of all flags read by this formula
   * @param names accumulator
   * @throws LowcRuntimeError if an unlowered compare remains
   */
  public void collectReadFlags(Set<String> names) {
    switch (kind) {
      case FLAG:
        names.add(flag);
        break;
      case AND:
      case OR:
        left.collectReadFlags(names);
        right.collectReadFlags(names);
        break;
      case NOT:
        left.collectReadFlags(names);
        break;
      case COMPARE:
        throw new LowcRuntimeError("Compare " + this + " should have been " +
                                   "lowered before analysis");
      default:
        throw new LowcRuntimeError("Unknown kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, lhs, relOp, rhs, left, right, flag);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BoolExpr)) {
      return false;
    }
    BoolExpr other = (BoolExpr) obj;
    return kind == other.kind && relOp == other.relOp &&
        Objects.equal(lhs, other.lhs) && Objects.equal(rhs, other.rhs) &&
        Objects.equal(left, other.left) && Objects.equal(right, other.right) &&
        Objects.equal(flag, other.flag);
  }

  @Override
  public String toString() {
    switch (kind) {
      case COMPARE:
        return lhs + " " + relOp.symbol() + " " + rhs;
      case AND:
        return "(" + left + " && " + right + ")";
      case OR:
        return "(" + left + " || " + right + ")";
      case NOT:
        return "!" + left;
      case FLAG:
        return "flag(" + flag + ")";
      default:
        throw new LowcRuntimeError("Unknown kind " + kind);
    }
  }
}
