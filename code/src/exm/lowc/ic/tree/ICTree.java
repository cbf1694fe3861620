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
package exm.lowc.ic.tree;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.lang.BoolExpr;
import exm.lowc.common.lang.Expr;

/**
 * This has the definitions for the flat target intermediate code.
 *
 * There is no call or return and no scoping: only assignment to numeric
 * cells, compares setting flags, conditionals and loops guarded by formulas
 * over flags, and sequential or parallel composition.
 *
 * Every instruction apart from sequences and parallel blocks carries a
 * tag of type T.  The walker produces {@link Untagged} trees, and liveness
 * analysis rebuilds them with a {@link LiveSet} on every instruction.
 * Trees are immutable.
 */
public class ICTree {

  public static final String INDENT = "  ";

  /**
   * Placeholder tag for instructions not yet analysed
   */
  public static enum Untagged {
    UNTAGGED;
  }

  public static enum InstructionType {
    SEQUENCE,
    PARALLEL,
    ASSIGN,
    COMPARE,
    CONDITIONAL,
    LOOP,
  }

  public static abstract class Instruction<T> {
    public abstract InstructionType type();

    /**
     * @return tag attached to this instruction
     * @throws LowcRuntimeError for sequences and parallel blocks,
     *         which have no tag
     */
    public abstract T tag();

    public abstract void prettyPrint(StringBuilder sb, String indent);

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb, "");
      return sb.toString();
    }
  }

  private static <T> void appendTag(StringBuilder sb, T tag) {
    if (tag != Untagged.UNTAGGED) {
      sb.append(" # live: " + tag);
    }
  }

  public static <T> Sequence<T> seq(List<? extends Instruction<T>> instructions) {
    return new Sequence<T>(instructions);
  }

  @SafeVarargs
  public static <T> Sequence<T> seq(Instruction<T> ...instructions) {
    return new Sequence<T>(ImmutableList.copyOf(instructions));
  }

  public static Assign<Untagged> assign(String var, Expr value) {
    return new Assign<Untagged>(var, value, Untagged.UNTAGGED);
  }

  public static Compare<Untagged> compare(String lhs, String rhs) {
    return new Compare<Untagged>(lhs, rhs, Untagged.UNTAGGED);
  }

  public static Conditional<Untagged> conditional(BoolExpr condition,
        Instruction<Untagged> thenBlock, Instruction<Untagged> elseBlock) {
    return new Conditional<Untagged>(condition, thenBlock, elseBlock,
                                     Untagged.UNTAGGED);
  }

  public static Loop<Untagged> loop(BoolExpr condition,
                                    Instruction<Untagged> body) {
    return new Loop<Untagged>(condition, body, Untagged.UNTAGGED);
  }

  /**
   * Instructions executed in order
   */
  public static class Sequence<T> extends Instruction<T> {
    private final ImmutableList<Instruction<T>> instructions;

    public Sequence(List<? extends Instruction<T>> instructions) {
      this.instructions = ImmutableList.copyOf(instructions);
    }

    @Override
    public InstructionType type() {
      return InstructionType.SEQUENCE;
    }

    @Override
    public T tag() {
      throw new LowcRuntimeError("Sequence has no tag");
    }

    public List<Instruction<T>> instructions() {
      return instructions;
    }

    public boolean isEmpty() {
      return instructions.isEmpty();
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      if (instructions.isEmpty()) {
        sb.append(indent + "skip\n");
      }
      for (Instruction<T> inst: instructions) {
        inst.prettyPrint(sb, indent);
      }
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), instructions);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Sequence)) {
        return false;
      }
      return instructions.equals(((Sequence<?>)obj).instructions);
    }
  }

  /**
   * Independent branches that a downstream executor may run in any order
   */
  public static class Parallel<T> extends Instruction<T> {
    private final ImmutableList<Instruction<T>> branches;

    public Parallel(List<? extends Instruction<T>> branches) {
      this.branches = ImmutableList.copyOf(branches);
    }

    @Override
    public InstructionType type() {
      return InstructionType.PARALLEL;
    }

    @Override
    public T tag() {
      throw new LowcRuntimeError("Parallel has no tag");
    }

    public List<Instruction<T>> branches() {
      return branches;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "parallel {\n");
      boolean first = true;
      for (Instruction<T> branch: branches) {
        if (!first) {
          sb.append(indent + "} || {\n");
        }
        first = false;
        branch.prettyPrint(sb, indent + INDENT);
      }
      sb.append(indent + "}\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), branches);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Parallel)) {
        return false;
      }
      return branches.equals(((Parallel<?>)obj).branches);
    }
  }

  /**
   * Write value of expression to a numeric cell
   */
  public static class Assign<T> extends Instruction<T> {
    private final String var;
    private final Expr value;
    private final T tag;

    public Assign(String var, Expr value, T tag) {
      assert(var != null && value != null && tag != null);
      this.var = var;
      this.value = value;
      this.tag = tag;
    }

    @Override
    public InstructionType type() {
      return InstructionType.ASSIGN;
    }

    @Override
    public T tag() {
      return tag;
    }

    public String var() {
      return var;
    }

    public Expr value() {
      return value;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + var + " := " + value);
      appendTag(sb, tag);
      sb.append("\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), var, value, tag);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Assign)) {
        return false;
      }
      Assign<?> other = (Assign<?>)obj;
      return var.equals(other.var) && value.equals(other.value) &&
             tag.equals(other.tag);
    }
  }

  /**
   * Compare two numeric cells.  Sets flag lhs when the lhs cell is greater
   * and flag rhs when the lhs cell is less; neither when they are equal.
   * Flag x and cell x are referred to by the same name x, and liveness
   * treats them as one variable.
   */
  public static class Compare<T> extends Instruction<T> {
    private final String lhs;
    private final String rhs;
    private final T tag;

    public Compare(String lhs, String rhs, T tag) {
      assert(lhs != null && rhs != null && tag != null);
      this.lhs = lhs;
      this.rhs = rhs;
      this.tag = tag;
    }

    @Override
    public InstructionType type() {
      return InstructionType.COMPARE;
    }

    @Override
    public T tag() {
      return tag;
    }

    public String lhs() {
      return lhs;
    }

    public String rhs() {
      return rhs;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "compare(" + lhs + ", " + rhs + ")");
      appendTag(sb, tag);
      sb.append("\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), lhs, rhs, tag);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Compare)) {
        return false;
      }
      Compare<?> other = (Compare<?>)obj;
      return lhs.equals(other.lhs) && rhs.equals(other.rhs) &&
             tag.equals(other.tag);
    }
  }

  public static class Conditional<T> extends Instruction<T> {
    private final BoolExpr condition;
    private final Instruction<T> thenBlock;
    private final Instruction<T> elseBlock;
    private final T tag;

    public Conditional(BoolExpr condition, Instruction<T> thenBlock,
                       Instruction<T> elseBlock, T tag) {
      assert(condition != null && thenBlock != null && elseBlock != null);
      assert(tag != null);
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock;
      this.tag = tag;
    }

    @Override
    public InstructionType type() {
      return InstructionType.CONDITIONAL;
    }

    @Override
    public T tag() {
      return tag;
    }

    public BoolExpr condition() {
      return condition;
    }

    public Instruction<T> thenBlock() {
      return thenBlock;
    }

    public Instruction<T> elseBlock() {
      return elseBlock;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "if (" + condition + ") {");
      appendTag(sb, tag);
      sb.append("\n");
      thenBlock.prettyPrint(sb, indent + INDENT);
      sb.append(indent + "} else {\n");
      elseBlock.prettyPrint(sb, indent + INDENT);
      sb.append(indent + "}\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), condition, thenBlock, elseBlock, tag);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Conditional)) {
        return false;
      }
      Conditional<?> other = (Conditional<?>)obj;
      return condition.equals(other.condition) &&
             thenBlock.equals(other.thenBlock) &&
             elseBlock.equals(other.elseBlock) && tag.equals(other.tag);
    }
  }

  public static class Loop<T> extends Instruction<T> {
    private final BoolExpr condition;
    private final Instruction<T> body;
    private final T tag;

    public Loop(BoolExpr condition, Instruction<T> body, T tag) {
      assert(condition != null && body != null && tag != null);
      this.condition = condition;
      this.body = body;
      this.tag = tag;
    }

    @Override
    public InstructionType type() {
      return InstructionType.LOOP;
    }

    @Override
    public T tag() {
      return tag;
    }

    public BoolExpr condition() {
      return condition;
    }

    public Instruction<T> body() {
      return body;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "while (" + condition + ") {");
      appendTag(sb, tag);
      sb.append("\n");
      body.prettyPrint(sb, indent + INDENT);
      sb.append(indent + "}\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), condition, body, tag);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Loop)) {
        return false;
      }
      Loop<?> other = (Loop<?>)obj;
      return condition.equals(other.condition) && body.equals(other.body) &&
             tag.equals(other.tag);
    }
  }
}
