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

import exm.lowc.ast.SourceTree.Conditional;
import exm.lowc.ast.SourceTree.FunctionDef;
import exm.lowc.ast.SourceTree.Loop;
import exm.lowc.ast.SourceTree.ScopedBinding;
import exm.lowc.ast.SourceTree.Sequence;
import exm.lowc.ast.SourceTree.Statement;
import exm.lowc.ast.SourceTree.StatementType;
import exm.lowc.common.exceptions.LowcRuntimeError;

/**
 * Rearranges the source tree so that returns can be inlined: any code
 * following a conditional is moved into both of its branches, and code
 * that can never run because a return precedes it is removed.
 *
 * After {@link #precompile(Statement)} a sequence never starts with a
 * sequence, a conditional or a nop, and never ends with a nop.
 */
public class Normaliser {

  /**
   * Make the code tree ready for inlining.
   */
  public static Statement precompile(Statement stmt) {
    return removeDeadBranches(absorbBranches(leftify(stmt)));
  }

  /**
   * Rewrite (a; b); c into a; (b; c) everywhere in the tree.
   */
  public static Statement leftify(Statement stmt) {
    switch (stmt.type()) {
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        Statement first = seq.first();
        Statement second = seq.second();
        while (first.type() == StatementType.SEQUENCE) {
          Sequence inner = (Sequence)first;
          second = new Sequence(inner.second(), second);
          first = inner.first();
        }
        return new Sequence(leftify(first), leftify(second));
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)stmt;
        return new FunctionDef(def.name(), def.params(), leftify(def.body()),
                               leftify(def.rest()));
      }
      case LOOP: {
        Loop loop = (Loop)stmt;
        return new Loop(loop.condition(), leftify(loop.body()));
      }
      case CONDITIONAL: {
        Conditional cond = (Conditional)stmt;
        return new Conditional(cond.condition(), leftify(cond.thenBlock()),
                               leftify(cond.elseBlock()));
      }
      case SCOPED_BINDING: {
        ScopedBinding binding = (ScopedBinding)stmt;
        return new ScopedBinding(binding.name(), binding.init(),
                                 leftify(binding.rest()));
      }
      case MULTI_ASSIGN:
      case RETURN:
      case NOP:
        return stmt;
      default:
        throw new LowcRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  /**
   * Move instructions that follow a conditional into both of its branches.
   * Strictly this only needs to be done when a branch returns, but doing
   * it everywhere keeps the tree uniform.  Nops in sequences are dropped.
   */
  public static Statement absorbBranches(Statement stmt) {
    switch (stmt.type()) {
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        return join(absorbBranches(seq.first()),
                    absorbBranches(seq.second()));
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)stmt;
        return new FunctionDef(def.name(), def.params(),
                absorbBranches(def.body()), absorbBranches(def.rest()));
      }
      case LOOP: {
        Loop loop = (Loop)stmt;
        return new Loop(loop.condition(), absorbBranches(loop.body()));
      }
      case CONDITIONAL: {
        Conditional cond = (Conditional)stmt;
        return new Conditional(cond.condition(),
                               absorbBranches(cond.thenBlock()),
                               absorbBranches(cond.elseBlock()));
      }
      case SCOPED_BINDING: {
        ScopedBinding binding = (ScopedBinding)stmt;
        return new ScopedBinding(binding.name(), binding.init(),
                                 absorbBranches(binding.rest()));
      }
      case MULTI_ASSIGN:
      case RETURN:
      case NOP:
        return stmt;
      default:
        throw new LowcRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  /**
   * Sequence two already-absorbed statements, pushing the tail into the
   * branches of a conditional and keeping the spine right-leaning.
   */
  private static Statement join(Statement head, Statement tail) {
    if (head.type() == StatementType.NOP) {
      return tail;
    } else if (tail.type() == StatementType.NOP) {
      return head;
    }

    switch (head.type()) {
      case SEQUENCE: {
        Sequence seq = (Sequence)head;
        return join(seq.first(), join(seq.second(), tail));
      }
      case CONDITIONAL: {
        Conditional cond = (Conditional)head;
        return new Conditional(cond.condition(),
                               join(cond.thenBlock(), tail),
                               join(cond.elseBlock(), tail));
      }
      default:
        return new Sequence(head, tail);
    }
  }

  /**
   * Check if a branch of the code tree can return.
   */
  public static boolean returns(Statement stmt) {
    switch (stmt.type()) {
      case RETURN:
        return true;
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        return returns(seq.first()) || returns(seq.second());
      }
      case CONDITIONAL: {
        Conditional cond = (Conditional)stmt;
        return returns(cond.thenBlock()) || returns(cond.elseBlock());
      }
      case LOOP:
        return returns(((Loop)stmt).body());
      case SCOPED_BINDING:
        return returns(((ScopedBinding)stmt).rest());
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)stmt;
        return returns(def.body()) || returns(def.rest());
      }
      case MULTI_ASSIGN:
      case NOP:
        return false;
      default:
        throw new LowcRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  /**
   * Remove code that follows a statement that can return.  The tree should
   * have had branches absorbed beforehand.
   */
  public static Statement removeDeadBranches(Statement stmt) {
    switch (stmt.type()) {
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        if (returns(seq.first())) {
          return removeDeadBranches(seq.first());
        }
        return new Sequence(removeDeadBranches(seq.first()),
                            removeDeadBranches(seq.second()));
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)stmt;
        return new FunctionDef(def.name(), def.params(),
                removeDeadBranches(def.body()), removeDeadBranches(def.rest()));
      }
      case LOOP: {
        Loop loop = (Loop)stmt;
        return new Loop(loop.condition(), removeDeadBranches(loop.body()));
      }
      case CONDITIONAL: {
        Conditional cond = (Conditional)stmt;
        return new Conditional(cond.condition(),
                               removeDeadBranches(cond.thenBlock()),
                               removeDeadBranches(cond.elseBlock()));
      }
      case SCOPED_BINDING: {
        ScopedBinding binding = (ScopedBinding)stmt;
        return new ScopedBinding(binding.name(), binding.init(),
                                 removeDeadBranches(binding.rest()));
      }
      case MULTI_ASSIGN:
      case RETURN:
      case NOP:
        return stmt;
      default:
        throw new LowcRuntimeError("Unknown statement type " + stmt.type());
    }
  }
}
