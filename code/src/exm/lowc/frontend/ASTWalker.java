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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.lowc.ast.SourceTree.Conditional;
import exm.lowc.ast.SourceTree.Function;
import exm.lowc.ast.SourceTree.FunctionDef;
import exm.lowc.ast.SourceTree.Loop;
import exm.lowc.ast.SourceTree.MultiAssign;
import exm.lowc.ast.SourceTree.Return;
import exm.lowc.ast.SourceTree.ScopedBinding;
import exm.lowc.ast.SourceTree.Sequence;
import exm.lowc.ast.SourceTree.Statement;
import exm.lowc.common.Logging;
import exm.lowc.common.NameGenerator;
import exm.lowc.common.exceptions.ArityMismatchException;
import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.exceptions.UserException;
import exm.lowc.common.lang.BoolExpr;
import exm.lowc.common.lang.Builtins;
import exm.lowc.common.lang.Expr;
import exm.lowc.common.lang.Expr.ExprKind;
import exm.lowc.common.util.Pair;
import exm.lowc.frontend.Context.DefinedFunction;
import exm.lowc.ic.tree.ICTree;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Untagged;

/**
 * Walks a normalised source tree and produces untagged intermediate code.
 * Every call is inlined, so the output has no calls or returns.  Variables
 * are renamed where needed so that inlined bodies never capture or clobber
 * variables of the caller.
 */
public class ASTWalker {

  private final Logger logger;
  private final NameGenerator names;
  private final ExprWalker exprWalker;

  public ASTWalker(Logger logger, NameGenerator names) {
    this.logger = logger;
    this.names = names;
    this.exprWalker = new ExprWalker(logger, this, names);
  }

  /**
   * Result of lowering a program
   */
  public static class LoweredProgram {
    public final Instruction<Untagged> code;

    /**
     * Target names of the variables declared at the top level of the
     * program, including inside top-level conditionals.  These hold
     * its results.
     */
    public final Set<String> outputs;

    LoweredProgram(Instruction<Untagged> code, Set<String> outputs) {
      this.code = code;
      this.outputs = Collections.unmodifiableSet(outputs);
    }
  }

  /**
   * Lower a whole program
   * @param program program, already normalised
   * @param builtins functions callable from program
   * @return untagged intermediate code
   * @throws UserException if a name can't be resolved or a call has the
   *        wrong number of arguments or results
   */
  public LoweredProgram lower(Statement program, Builtins builtins)
                                                throws UserException {
    Set<String> outputs = new LinkedHashSet<String>();
    Instruction<Untagged> code = walk(Context.createRoot(builtins), program,
                                      outputs);
    return new LoweredProgram(code, outputs);
  }

  public Instruction<Untagged> walk(Context context, Statement stmt)
                                                throws UserException {
    return walk(context, stmt, null);
  }

  /**
   * @param outputs if not null, statement is at the top level of the
   *        program: add target names of declared variables
   */
  private Instruction<Untagged> walk(Context context, Statement stmt,
                    Set<String> outputs) throws UserException {
    switch (stmt.type()) {
      case NOP:
        return ICTree.<Untagged>seq();
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        return ICTree.seq(walk(context, seq.first(), outputs),
                          walk(context, seq.second(), outputs));
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)stmt;
        if (context.isFunctionDefined(def.name())) {
          Logging.uniqueWarn("Function " + def.name() + " shadows an " +
                             "earlier definition of the same name");
        }
        logger.trace("Defining function " + def.function());
        return walk(context.defineFunction(def.function()), def.rest(),
                    outputs);
      }
      case SCOPED_BINDING:
        return walkBinding(context, (ScopedBinding)stmt, outputs);
      case MULTI_ASSIGN:
        return walkAssign(context, (MultiAssign)stmt);
      case RETURN:
        return walkReturn(context, (Return)stmt);
      case CONDITIONAL:
        return walkConditional(context, (Conditional)stmt, outputs);
      case LOOP:
        return walkLoop(context, (Loop)stmt);
      default:
        throw new LowcRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  private Instruction<Untagged> walkBinding(Context context,
                        ScopedBinding binding, Set<String> outputs)
                        throws UserException {
    Pair<List<Instruction<Untagged>>, Expr> init =
                                exprWalker.lower(context, binding.init());
    // Only need new name if it would shadow another variable
    String target;
    if (context.isVarBound(binding.name())) {
      target = names.fresh();
      logger.trace("Renaming shadowing variable " + binding.name() +
                   " to " + target);
    } else {
      target = binding.name();
    }

    if (outputs != null) {
      outputs.add(target);
    }

    List<Instruction<Untagged>> result = init.val1;
    result.add(ICTree.assign(target, init.val2));
    result.add(walk(context.bindVar(binding.name(), target),
                    binding.rest(), outputs));
    return ICTree.seq(result);
  }

  private Instruction<Untagged> walkAssign(Context context,
                        MultiAssign assign) throws UserException {
    Expr value = assign.value();
    List<String> targets = new ArrayList<String>(assign.names().size());
    for (String name: assign.names()) {
      targets.add(context.lookupVar(name));
    }

    if (value.kind() == ExprKind.CALL) {
      return inlineCall(context, targets, value);
    }

    if (targets.isEmpty()) {
      throw new LowcRuntimeError("Assignment of " + value + " to nothing");
    } else if (targets.size() > 1) {
      throw ArityMismatchException.tooManyOutputs(value.toString(), 1,
                                                  targets.size());
    }
    Pair<List<Instruction<Untagged>>, Expr> lowered =
                                  exprWalker.lower(context, value);
    List<Instruction<Untagged>> result = lowered.val1;
    result.add(ICTree.assign(targets.get(0), lowered.val2));
    return ICTree.seq(result);
  }

  /**
   * Inline a call
   * @param context context of call site
   * @param targets target variables receiving the results, in order
   * @param call the call expression
   * @return code for the inlined call
   * @throws UserException
   */
  public Instruction<Untagged> inlineCall(Context context,
        List<String> targets, Expr call) throws UserException {
    DefinedFunction callee = context.lookupFunction(call.getFunction());
    Function f = callee.function;
    List<Expr> args = call.getArgs();
    if (args.size() != f.params().size()) {
      throw ArityMismatchException.wrongArgCount(f.name(),
                                    f.params().size(), args.size());
    }
    int slots = f.returnSlots();
    if (targets.size() > slots) {
      throw ArityMismatchException.tooManyOutputs(f.name(), slots,
                                                  targets.size());
    }

    List<Instruction<Untagged>> result = new ArrayList<Instruction<Untagged>>();

    // Evaluate arguments in caller's scope into fresh variables
    Map<String, String> paramBindings = new LinkedHashMap<String, String>();
    for (int i = 0; i < args.size(); i++) {
      Pair<List<Instruction<Untagged>>, Expr> arg =
                                    exprWalker.lower(context, args.get(i));
      String argVar = names.fresh();
      result.addAll(arg.val1);
      result.add(ICTree.assign(argVar, arg.val2));
      paramBindings.put(f.params().get(i), argVar);
    }

    // Results are defined even if the body doesn't return
    for (String target: targets) {
      result.add(ICTree.assign(target, Expr.intLit(0)));
    }

    if (logger.isTraceEnabled()) {
      logger.trace("Inlining " + f + " params: " + paramBindings +
                   " results: " + targets);
    }
    Context calleeContext = context.enterCall(callee, paramBindings, targets);
    result.add(walk(calleeContext, f.body()));
    return ICTree.seq(result);
  }

  /**
   * Write each returned value to the variable the caller assigned it to
   */
  private Instruction<Untagged> walkReturn(Context context, Return ret)
                                                throws UserException {
    List<Instruction<Untagged>> result = new ArrayList<Instruction<Untagged>>();
    for (int i = 0; i < ret.values().size(); i++) {
      // Lowered even if discarded so that errors in it are reported
      Pair<List<Instruction<Untagged>>, Expr> value =
                              exprWalker.lower(context, ret.values().get(i));
      String target = context.returnTarget(i);
      if (target == null) {
        continue;
      }
      result.addAll(value.val1);
      result.add(ICTree.assign(target, value.val2));
    }
    return ICTree.seq(result);
  }

  private Instruction<Untagged> walkConditional(Context context,
        Conditional cond, Set<String> outputs) throws UserException {
    Pair<List<Instruction<Untagged>>, BoolExpr> condition =
                        exprWalker.lowerBool(context, cond.condition());
    List<Instruction<Untagged>> result = condition.val1;
    result.add(ICTree.conditional(condition.val2,
                                  walk(context, cond.thenBlock(), outputs),
                                  walk(context, cond.elseBlock(), outputs)));
    return ICTree.seq(result);
  }

  /**
   * Code computing the condition is run before the loop and again at
   * the end of each iteration.
   */
  private Instruction<Untagged> walkLoop(Context context, Loop loop)
                                                throws UserException {
    Pair<List<Instruction<Untagged>>, BoolExpr> condition =
                        exprWalker.lowerBool(context, loop.condition());
    List<Instruction<Untagged>> body = new ArrayList<Instruction<Untagged>>();
    body.add(walk(context, loop.body()));
    body.addAll(condition.val1);

    List<Instruction<Untagged>> result =
                  new ArrayList<Instruction<Untagged>>(condition.val1);
    result.add(ICTree.loop(condition.val2, ICTree.seq(body)));
    return ICTree.seq(result);
  }
}
