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
package exm.lowc.ic.opt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.lowc.common.Settings;
import exm.lowc.common.exceptions.InvalidOptionException;
import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.util.Pair;
import exm.lowc.ic.tree.ICTree;
import exm.lowc.ic.tree.ICTree.Assign;
import exm.lowc.ic.tree.ICTree.Compare;
import exm.lowc.ic.tree.ICTree.Conditional;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Loop;
import exm.lowc.ic.tree.ICTree.Parallel;
import exm.lowc.ic.tree.ICTree.Sequence;
import exm.lowc.ic.tree.LiveSet;

/**
 * Backward liveness analysis.  Works out, for each instruction, the set of
 * variables whose value may still be read after it, attaches that set as
 * the instruction's tag and removes assignments to variables that are
 * never read again.
 *
 * Flags and cells share names: a formula reading flag x keeps x live.
 */
public class LivenessAnalysis {

  private final Logger logger;

  /** If false, dead assignments are tagged rather than removed */
  private final boolean removeDeadStores;

  /** If true, compare(a, b) reads cells a and b */
  private final boolean compareReadsCells;

  public LivenessAnalysis(Logger logger) {
    this.logger = logger;
    try {
      this.removeDeadStores = Settings.getBoolean(Settings.OPT_DEAD_STORE_ELIM);
      this.compareReadsCells =
            Settings.getBoolean(Settings.LIVENESS_COMPARE_READS_CELLS);
    } catch (InvalidOptionException e) {
      throw new LowcRuntimeError(e.getMessage());
    }
  }

  public LivenessAnalysis(Logger logger, boolean removeDeadStores,
                          boolean compareReadsCells) {
    this.logger = logger;
    this.removeDeadStores = removeDeadStores;
    this.compareReadsCells = compareReadsCells;
  }

  /**
   * Analyse a whole program.  Any existing tags are replaced.
   * @param program flattened intermediate code, with no calls or compares
   *        left in expressions
   * @param liveOut variables that are read after the program finishes
   * @return program with every instruction tagged and dead stores removed
   */
  public Instruction<LiveSet> analyse(Instruction<?> program,
                                      Set<String> liveOut) {
    Pair<Instruction<LiveSet>, Set<String>> result =
                  analyseInstruction(program, new HashSet<String>(liveOut));
    if (logger.isTraceEnabled()) {
      logger.trace("Live at program entry: " + result.val2);
    }
    if (result.val1 == null) {
      return ICTree.<LiveSet>seq();
    }
    return result.val1;
  }

  /**
   * @param inst
   * @param liveAfter variables live after inst.  Not modified.
   * @return the tagged instruction, or null if it was removed, and the
   *        variables live before it
   */
  public Pair<Instruction<LiveSet>, Set<String>> analyseInstruction(
                          Instruction<?> inst, Set<String> liveAfter) {
    switch (inst.type()) {
      case ASSIGN:
        return analyseAssign((Assign<?>)inst, liveAfter);
      case COMPARE:
        return analyseCompare((Compare<?>)inst, liveAfter);
      case CONDITIONAL:
        return analyseConditional((Conditional<?>)inst, liveAfter);
      case LOOP:
        return analyseLoop((Loop<?>)inst, liveAfter);
      case SEQUENCE:
        return analyseSequence((Sequence<?>)inst, liveAfter);
      case PARALLEL:
        return analyseParallel((Parallel<?>)inst, liveAfter);
      default:
        throw new LowcRuntimeError("Unknown instruction type " + inst.type());
    }
  }

  private Pair<Instruction<LiveSet>, Set<String>> analyseAssign(
                                    Assign<?> assign, Set<String> liveAfter) {
    if (removeDeadStores && !liveAfter.contains(assign.var())) {
      logger.trace("Removing dead assignment to " + assign.var());
      return Pair.create(null, liveAfter);
    }
    Set<String> liveBefore = new HashSet<String>(liveAfter);
    liveBefore.remove(assign.var());
    assign.value().collectReadVars(liveBefore);
    Instruction<LiveSet> tagged = new Assign<LiveSet>(assign.var(),
                                    assign.value(), LiveSet.of(liveAfter));
    return Pair.create(tagged, liveBefore);
  }

  private Pair<Instruction<LiveSet>, Set<String>> analyseCompare(
                                 Compare<?> compare, Set<String> liveAfter) {
    Set<String> liveBefore = liveAfter;
    if (compareReadsCells) {
      liveBefore = new HashSet<String>(liveAfter);
      liveBefore.add(compare.lhs());
      liveBefore.add(compare.rhs());
    }
    Instruction<LiveSet> tagged = new Compare<LiveSet>(compare.lhs(),
                                    compare.rhs(), LiveSet.of(liveAfter));
    return Pair.create(tagged, liveBefore);
  }

  private Pair<Instruction<LiveSet>, Set<String>> analyseConditional(
                              Conditional<?> cond, Set<String> liveAfter) {
    Pair<Instruction<LiveSet>, Set<String>> thenRes =
                            analyseInstruction(cond.thenBlock(), liveAfter);
    Pair<Instruction<LiveSet>, Set<String>> elseRes =
                            analyseInstruction(cond.elseBlock(), liveAfter);

    Set<String> liveBefore = new HashSet<String>(thenRes.val2);
    liveBefore.addAll(elseRes.val2);
    cond.condition().collectReadFlags(liveBefore);

    Instruction<LiveSet> tagged = new Conditional<LiveSet>(cond.condition(),
        orEmpty(thenRes.val1), orEmpty(elseRes.val1), LiveSet.of(liveAfter));
    return Pair.create(tagged, liveBefore);
  }

  /**
   * Variables live at the top of the loop are those read by the
   * condition, those live after the loop, and those live at the top of the
   * body given what is live at the top of the loop.  Iterate until this
   * stops growing.
   */
  private Pair<Instruction<LiveSet>, Set<String>> analyseLoop(
                                        Loop<?> loop, Set<String> liveAfter) {
    Set<String> base = new HashSet<String>(liveAfter);
    loop.condition().collectReadFlags(base);

    Set<String> live = base;
    int iterations = 0;
    while (true) {
      Set<String> next = new HashSet<String>(base);
      next.addAll(analyseInstruction(loop.body(), live).val2);
      iterations++;
      if (next.equals(live)) {
        break;
      }
      live = next;
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Loop liveness converged after " + iterations +
                   " iteration(s): " + live);
    }

    Instruction<LiveSet> body =
                  orEmpty(analyseInstruction(loop.body(), live).val1);
    Instruction<LiveSet> tagged = new Loop<LiveSet>(loop.condition(), body,
                                                    LiveSet.of(live));
    return Pair.create(tagged, live);
  }

  private Pair<Instruction<LiveSet>, Set<String>> analyseSequence(
                                   Sequence<?> seq, Set<String> liveAfter) {
    List<Instruction<LiveSet>> result = new ArrayList<Instruction<LiveSet>>();
    Set<String> live = liveAfter;
    List<? extends Instruction<?>> insts = seq.instructions();
    for (int i = insts.size() - 1; i >= 0; i--) {
      Pair<Instruction<LiveSet>, Set<String>> res =
                                      analyseInstruction(insts.get(i), live);
      if (res.val1 != null) {
        result.add(res.val1);
      }
      live = res.val2;
    }
    Collections.reverse(result);
    return Pair.create((Instruction<LiveSet>)new Sequence<LiveSet>(result),
                       live);
  }

  /**
   * Branches are independent, so each sees the same live set after
   */
  private Pair<Instruction<LiveSet>, Set<String>> analyseParallel(
                                   Parallel<?> par, Set<String> liveAfter) {
    List<Instruction<LiveSet>> branches = new ArrayList<Instruction<LiveSet>>();
    Set<String> liveBefore = new HashSet<String>();
    for (Instruction<?> branch: par.branches()) {
      Pair<Instruction<LiveSet>, Set<String>> res =
                                      analyseInstruction(branch, liveAfter);
      if (res.val1 != null) {
        branches.add(res.val1);
      }
      liveBefore.addAll(res.val2);
    }
    return Pair.create((Instruction<LiveSet>)new Parallel<LiveSet>(branches),
                       liveBefore);
  }

  private static Instruction<LiveSet> orEmpty(Instruction<LiveSet> inst) {
    if (inst == null) {
      return ICTree.<LiveSet>seq();
    }
    return inst;
  }
}
