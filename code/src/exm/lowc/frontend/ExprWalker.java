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
package exm.lowc.frontend;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.lowc.common.NameGenerator;
import exm.lowc.common.Settings;
import exm.lowc.common.exceptions.InvalidOptionException;
import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.exceptions.UserException;
import exm.lowc.common.lang.BoolExpr;
import exm.lowc.common.lang.Expr;
import exm.lowc.common.lang.Operators.ArithOp;
import exm.lowc.common.lang.Operators.RelOp;
import exm.lowc.common.util.Pair;
import exm.lowc.ic.tree.ICTree;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Untagged;

/**
 * Lowers expressions.  Each lowering returns the instructions that must run
 * first (the prelude) together with the lowered expression, which contains
 * only renamed identifiers, literals and additions, or for booleans only
 * formulas over flags.
 */
public class ExprWalker {

  private final Logger logger;
  private final ASTWalker walker;
  private final NameGenerator names;

  /**
   * Multiplications by constants up to this are expanded into additions
   */
  private final long mulUnrollLimit;

  public ExprWalker(Logger logger, ASTWalker walker, NameGenerator names) {
    this.logger = logger;
    this.walker = walker;
    this.names = names;
    try {
      this.mulUnrollLimit = Settings.getLong(Settings.OPT_MUL_UNROLL_LIMIT);
    } catch (InvalidOptionException e) {
      throw new LowcRuntimeError(e.getMessage());
    }
  }

  public Pair<List<Instruction<Untagged>>, Expr> lower(Context context,
                                    Expr expr) throws UserException {
    switch (expr.kind()) {
      case IDENT:
        return noPrelude(Expr.ident(context.lookupVar(expr.getName())));
      case INT_LIT:
        return noPrelude(expr);
      case CALL:
        return lowerCall(context, expr);
      case BINARY_OP:
        return lowerBinaryOp(context, expr);
      default:
        throw new LowcRuntimeError("Unknown expression kind " + expr.kind());
    }
  }

  /**
   * Inline call, storing its first result in a new variable
   */
  private Pair<List<Instruction<Untagged>>, Expr> lowerCall(Context context,
                                    Expr call) throws UserException {
    String result = names.fresh();
    Instruction<Untagged> inlined = walker.inlineCall(context,
                                          ImmutableList.of(result), call);
    List<Instruction<Untagged>> prelude = new ArrayList<Instruction<Untagged>>();
    prelude.add(inlined);
    return Pair.create(prelude, Expr.ident(result));
  }

  private Pair<List<Instruction<Untagged>>, Expr> lowerBinaryOp(
            Context context, Expr expr) throws UserException {
    switch (expr.getOp()) {
      case ADD: {
        Pair<List<Instruction<Untagged>>, Expr> lhs =
                                      lower(context, expr.getLhs());
        Pair<List<Instruction<Untagged>>, Expr> rhs =
                                      lower(context, expr.getRhs());
        List<Instruction<Untagged>> prelude = concat(lhs.val1, rhs.val1);
        return Pair.create(prelude, Expr.add(lhs.val2, rhs.val2));
      }
      case MUL:
        if (expr.getLhs().isIntLit()) {
          return lowerConstMul(context, expr, expr.getLhs().getIntLit(),
                               expr.getRhs());
        } else if (expr.getRhs().isIntLit()) {
          return lowerConstMul(context, expr, expr.getRhs().getIntLit(),
                               expr.getLhs());
        }
        return lowerAsBuiltin(context, expr);
      case DIV:
      case MOD:
        return lowerAsBuiltin(context, expr);
      default:
        throw new LowcRuntimeError("Unknown operator " + expr.getOp());
    }
  }

  /**
   * Multiplication of operand by constant n: expand into n - 1 additions
   * when n is small and positive.
   */
  private Pair<List<Instruction<Untagged>>, Expr> lowerConstMul(
        Context context, Expr mul, long n, Expr operand) throws UserException {
    if (n == 0) {
      // Operand must still be well formed
      lower(context, operand);
      return noPrelude(Expr.intLit(0));
    } else if (n < 0 || n > mulUnrollLimit) {
      logger.trace("Not expanding multiplication by " + n);
      return lowerAsBuiltin(context, mul);
    }
    Expr sum = operand;
    for (long i = 1; i < n; i++) {
      sum = Expr.add(operand, sum);
    }
    return lower(context, sum);
  }

  private Pair<List<Instruction<Untagged>>, Expr> lowerAsBuiltin(
            Context context, Expr expr) throws UserException {
    ArithOp op = expr.getOp();
    assert(op.builtinName() != null);
    return lowerCall(context, Expr.call(op.builtinName(),
                                        expr.getLhs(), expr.getRhs()));
  }

  /**
   * Lower boolean expression into formula over flags.  Each comparison
   * evaluates both sides into two new variables a and b and compares them,
   * which sets flag a if lhs is greater and flag b if lhs is less.
   */
  public Pair<List<Instruction<Untagged>>, BoolExpr> lowerBool(
          Context context, BoolExpr expr) throws UserException {
    switch (expr.kind()) {
      case COMPARE: {
        String a = names.fresh();
        String b = names.fresh();
        Pair<List<Instruction<Untagged>>, Expr> lhs =
                                        lower(context, expr.getLhs());
        Pair<List<Instruction<Untagged>>, Expr> rhs =
                                        lower(context, expr.getRhs());
        List<Instruction<Untagged>> prelude = concat(lhs.val1, rhs.val1);
        prelude.add(ICTree.assign(a, lhs.val2));
        prelude.add(ICTree.assign(b, rhs.val2));
        prelude.add(ICTree.compare(a, b));
        return Pair.create(prelude, relFormula(expr.getRelOp(), a, b));
      }
      case AND:
      case OR: {
        Pair<List<Instruction<Untagged>>, BoolExpr> left =
                                    lowerBool(context, expr.getLeft());
        Pair<List<Instruction<Untagged>>, BoolExpr> right =
                                    lowerBool(context, expr.getRight());
        List<Instruction<Untagged>> prelude = concat(left.val1, right.val1);
        BoolExpr combined = expr.kind() == BoolExpr.BoolKind.AND ?
                              BoolExpr.and(left.val2, right.val2) :
                              BoolExpr.or(left.val2, right.val2);
        return Pair.create(prelude, combined);
      }
      case NOT: {
        Pair<List<Instruction<Untagged>>, BoolExpr> operand =
                                    lowerBool(context, expr.getLeft());
        return Pair.create(operand.val1, BoolExpr.not(operand.val2));
      }
      case FLAG:
        throw new LowcRuntimeError("Flag " + expr.getFlag() + " can't " +
                                   "appear in a source program");
      default:
        throw new LowcRuntimeError("Unknown boolean kind " + expr.kind());
    }
  }

  /**
   * Formula for relation between a and b after compare(a, b)
   */
  public static BoolExpr relFormula(RelOp op, String a, String b) {
    BoolExpr greater = BoolExpr.flag(a);
    BoolExpr less = BoolExpr.flag(b);
    switch (op) {
      case EQ:
        return BoolExpr.and(BoolExpr.not(greater), BoolExpr.not(less));
      case NEQ:
        return BoolExpr.or(greater, less);
      case LT:
        return less;
      case LTE:
        return BoolExpr.not(greater);
      case GT:
        return greater;
      case GTE:
        return BoolExpr.not(less);
      default:
        throw new LowcRuntimeError("Unknown relational operator " + op);
    }
  }

  private static <T> Pair<List<Instruction<Untagged>>, T> noPrelude(T val) {
    return Pair.create((List<Instruction<Untagged>>)
                        new ArrayList<Instruction<Untagged>>(), val);
  }

  private static List<Instruction<Untagged>> concat(
        List<Instruction<Untagged>> first, List<Instruction<Untagged>> second) {
    List<Instruction<Untagged>> result =
        new ArrayList<Instruction<Untagged>>(first.size() + second.size());
    result.addAll(first);
    result.addAll(second);
    return result;
  }
}
