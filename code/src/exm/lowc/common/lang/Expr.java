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

import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.lang.Operators.ArithOp;

/**
 * An integer-valued expression.  Used both in source programs and,
 * once calls have been inlined and operators lowered, as the right hand
 * side of IR assignments.
 */
public class Expr {
  public static enum ExprKind {
    IDENT, INT_LIT, BINARY_OP, CALL
  }

  public final ExprKind kind;

  /** Identifier name, or function name for calls */
  private final String name;
  private final long intLit;
  private final Expr lhs;
  private final ArithOp op;
  private final Expr rhs;
  private final ImmutableList<Expr> args;

  /**
   * Private constructors so that it can only be build using static builder
   * methods (below)
   */
  private Expr(ExprKind kind, String name, long intLit, Expr lhs,
      ArithOp op, Expr rhs, ImmutableList<Expr> args) {
    this.kind = kind;
    this.name = name;
    this.intLit = intLit;
    this.lhs = lhs;
    this.op = op;
    this.rhs = rhs;
    this.args = args;
  }

  public static Expr ident(String name) {
    assert(name != null);
    return new Expr(ExprKind.IDENT, name, -1, null, null, null, null);
  }

  public static Expr intLit(long v) {
    return new Expr(ExprKind.INT_LIT, null, v, null, null, null, null);
  }

  public static Expr binaryOp(Expr lhs, ArithOp op, Expr rhs) {
    assert(lhs != null && op != null && rhs != null);
    return new Expr(ExprKind.BINARY_OP, null, -1, lhs, op, rhs, null);
  }

  public static Expr add(Expr lhs, Expr rhs) {
    return binaryOp(lhs, ArithOp.ADD, rhs);
  }

  public static Expr call(String function, List<Expr> args) {
    assert(function != null);
    return new Expr(ExprKind.CALL, function, -1, null, null, null,
                    ImmutableList.copyOf(args));
  }

  public static Expr call(String function, Expr ...args) {
    return call(function, ImmutableList.copyOf(args));
  }

  public ExprKind kind() {
    return kind;
  }

  public String getName() {
    if (kind == ExprKind.IDENT) {
      return name;
    } else {
      throw new LowcRuntimeError("getName for non-identifier: " + this);
    }
  }

  public long getIntLit() {
    if (kind == ExprKind.INT_LIT) {
      return intLit;
    } else {
      throw new LowcRuntimeError("getIntLit for non-literal: " + this);
    }
  }

  public Expr getLhs() {
    checkKind(ExprKind.BINARY_OP);
    return lhs;
  }

  public ArithOp getOp() {
    checkKind(ExprKind.BINARY_OP);
    return op;
  }

  public Expr getRhs() {
    checkKind(ExprKind.BINARY_OP);
    return rhs;
  }

  public String getFunction() {
    checkKind(ExprKind.CALL);
    return name;
  }

  public List<Expr> getArgs() {
    checkKind(ExprKind.CALL);
    return args;
  }

  private void checkKind(ExprKind expected) {
    if (kind != expected) {
      throw new LowcRuntimeError("Expected " + expected + " expression but"
                                  + " got " + kind + ": " + this);
    }
  }

  public boolean isIntLit() {
    return kind == ExprKind.INT_LIT;
  }

  /**
   * Add names of all variables read by this expression
   * @param vars accumulator
   * @throws LowcRuntimeError if a call remains in the expression
   */
  public void collectReadVars(Set<String> vars) {
    switch (kind) {
      case IDENT:
        vars.add(name);
        break;
      case INT_LIT:
        break;
      case BINARY_OP:
        lhs.collectReadVars(vars);
        rhs.collectReadVars(vars);
        break;
      case CALL:
        throw new LowcRuntimeError("Call to " + name + " should have been " +
                                   "inlined before analysis");
      default:
        throw new LowcRuntimeError("Unknown kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, name, intLit, lhs, op, rhs, args);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Expr)) {
      return false;
    }
    Expr other = (Expr) obj;
    return kind == other.kind && intLit == other.intLit &&
        Objects.equal(name, other.name) && Objects.equal(lhs, other.lhs) &&
        op == other.op && Objects.equal(rhs, other.rhs) &&
        Objects.equal(args, other.args);
  }

  @Override
  public String toString() {
    switch (kind) {
      case IDENT:
        return name;
      case INT_LIT:
        return Long.toString(intLit);
      case BINARY_OP:
        return "(" + lhs + " " + op.symbol() + " " + rhs + ")";
      case CALL:
        return name + "(" + StringUtils.join(args, ", ") + ")";
      default:
        throw new LowcRuntimeError("Unknown kind " + kind);
    }
  }
}
