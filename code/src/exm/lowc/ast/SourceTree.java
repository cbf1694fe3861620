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
package exm.lowc.ast;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.lang.BoolExpr;
import exm.lowc.common.lang.Expr;

/**
 * Source program tree, as handed over by a parser.  Trees are immutable:
 * passes over them build new trees.
 */
public class SourceTree {

  public static enum StatementType {
    SEQUENCE,
    FUNCTION_DEF,
    CONDITIONAL,
    LOOP,
    SCOPED_BINDING,
    MULTI_ASSIGN,
    RETURN,
    NOP,
  }

  public static abstract class Statement {
    public abstract StatementType type();

    /**
     * Print statement, with nested statements indented further
     * @param sb
     * @param indent
     */
    public abstract void prettyPrint(StringBuilder sb, String indent);

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb, "");
      return sb.toString();
    }
  }

  public static final String INDENT = "  ";

  public static Statement seq(Statement first, Statement second) {
    return new Sequence(first, second);
  }

  /**
   * Right-nested sequence of several statements
   */
  public static Statement seq(Statement ...stmts) {
    if (stmts.length == 0) {
      return Nop.NOP;
    }
    Statement result = stmts[stmts.length - 1];
    for (int i = stmts.length - 2; i >= 0; i--) {
      result = new Sequence(stmts[i], result);
    }
    return result;
  }

  public static class Sequence extends Statement {
    private final Statement first;
    private final Statement second;

    public Sequence(Statement first, Statement second) {
      assert(first != null && second != null);
      this.first = first;
      this.second = second;
    }

    @Override
    public StatementType type() {
      return StatementType.SEQUENCE;
    }

    public Statement first() {
      return first;
    }

    public Statement second() {
      return second;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      first.prettyPrint(sb, indent);
      second.prettyPrint(sb, indent);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), first, second);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Sequence)) {
        return false;
      }
      Sequence other = (Sequence)obj;
      return first.equals(other.first) && second.equals(other.second);
    }
  }

  /**
   * Definition of function, which can be called from rest.
   * The function can't call itself.
   */
  public static class FunctionDef extends Statement {
    private final Function function;
    private final Statement rest;

    public FunctionDef(String name, List<String> params, Statement body,
                       Statement rest) {
      this(new Function(name, params, body), rest);
    }

    public FunctionDef(Function function, Statement rest) {
      assert(function != null && rest != null);
      this.function = function;
      this.rest = rest;
    }

    @Override
    public StatementType type() {
      return StatementType.FUNCTION_DEF;
    }

    public Function function() {
      return function;
    }

    public String name() {
      return function.name();
    }

    public List<String> params() {
      return function.params();
    }

    public Statement body() {
      return function.body();
    }

    public Statement rest() {
      return rest;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "function " + function.name() + "(" +
                StringUtils.join(function.params(), ", ") + ") {\n");
      function.body().prettyPrint(sb, indent + INDENT);
      sb.append(indent + "}\n");
      rest.prettyPrint(sb, indent);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), function, rest);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FunctionDef)) {
        return false;
      }
      FunctionDef other = (FunctionDef)obj;
      return function.equals(other.function) && rest.equals(other.rest);
    }
  }

  public static class Conditional extends Statement {
    private final BoolExpr condition;
    private final Statement thenBlock;
    private final Statement elseBlock;

    public Conditional(BoolExpr condition, Statement thenBlock,
                       Statement elseBlock) {
      assert(condition != null && thenBlock != null && elseBlock != null);
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock;
    }

    @Override
    public StatementType type() {
      return StatementType.CONDITIONAL;
    }

    public BoolExpr condition() {
      return condition;
    }

    public Statement thenBlock() {
      return thenBlock;
    }

    public Statement elseBlock() {
      return elseBlock;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "if (" + condition + ") {\n");
      thenBlock.prettyPrint(sb, indent + INDENT);
      sb.append(indent + "} else {\n");
      elseBlock.prettyPrint(sb, indent + INDENT);
      sb.append(indent + "}\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), condition, thenBlock, elseBlock);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Conditional)) {
        return false;
      }
      Conditional other = (Conditional)obj;
      return condition.equals(other.condition) &&
             thenBlock.equals(other.thenBlock) &&
             elseBlock.equals(other.elseBlock);
    }
  }

  public static class Loop extends Statement {
    private final BoolExpr condition;
    private final Statement body;

    public Loop(BoolExpr condition, Statement body) {
      assert(condition != null && body != null);
      this.condition = condition;
      this.body = body;
    }

    @Override
    public StatementType type() {
      return StatementType.LOOP;
    }

    public BoolExpr condition() {
      return condition;
    }

    public Statement body() {
      return body;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "while (" + condition + ") {\n");
      body.prettyPrint(sb, indent + INDENT);
      sb.append(indent + "}\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), condition, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Loop)) {
        return false;
      }
      Loop other = (Loop)obj;
      return condition.equals(other.condition) && body.equals(other.body);
    }
  }

  /**
   * Declares a new variable, visible in rest only.  Shadows any
   * variable of the same name in the enclosing scope.
   */
  public static class ScopedBinding extends Statement {
    private final String name;
    private final Expr init;
    private final Statement rest;

    public ScopedBinding(String name, Expr init, Statement rest) {
      assert(name != null && init != null && rest != null);
      this.name = name;
      this.init = init;
      this.rest = rest;
    }

    @Override
    public StatementType type() {
      return StatementType.SCOPED_BINDING;
    }

    public String name() {
      return name;
    }

    public Expr init() {
      return init;
    }

    public Statement rest() {
      return rest;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "var " + name + " = " + init + ";\n");
      rest.prettyPrint(sb, indent);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), name, init, rest);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ScopedBinding)) {
        return false;
      }
      ScopedBinding other = (ScopedBinding)obj;
      return name.equals(other.name) && init.equals(other.init) &&
             rest.equals(other.rest);
    }
  }

  /**
   * Assign the results of an expression or a call, in order, to
   * already-declared variables.
   */
  public static class MultiAssign extends Statement {
    private final ImmutableList<String> names;
    private final Expr value;

    public MultiAssign(List<String> names, Expr value) {
      assert(names != null && value != null);
      this.names = ImmutableList.copyOf(names);
      this.value = value;
    }

    public MultiAssign(String name, Expr value) {
      this(ImmutableList.of(name), value);
    }

    @Override
    public StatementType type() {
      return StatementType.MULTI_ASSIGN;
    }

    public List<String> names() {
      return names;
    }

    public Expr value() {
      return value;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + StringUtils.join(names, ", ") + " := " + value +
                ";\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), names, value);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof MultiAssign)) {
        return false;
      }
      MultiAssign other = (MultiAssign)obj;
      return names.equals(other.names) && value.equals(other.value);
    }
  }

  public static class Return extends Statement {
    private final ImmutableList<Expr> values;

    public Return(List<Expr> values) {
      this.values = ImmutableList.copyOf(values);
    }

    public Return(Expr ...values) {
      this(ImmutableList.copyOf(values));
    }

    @Override
    public StatementType type() {
      return StatementType.RETURN;
    }

    public List<Expr> values() {
      return values;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "return " + StringUtils.join(values, ", ") + ";\n");
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type(), values);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Return)) {
        return false;
      }
      return values.equals(((Return)obj).values);
    }
  }

  public static class Nop extends Statement {
    public static final Nop NOP = new Nop();

    private Nop() {
    }

    @Override
    public StatementType type() {
      return StatementType.NOP;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent + "nop;\n");
    }

    @Override
    public int hashCode() {
      return type().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Nop;
    }
  }

  /**
   * A function available for inlining: either defined in the program
   * or supplied as a builtin.
   */
  public static class Function {
    private final String name;
    private final ImmutableList<String> params;
    private final Statement body;

    public Function(String name, List<String> params, Statement body) {
      assert(name != null && params != null && body != null);
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    public String name() {
      return name;
    }

    public List<String> params() {
      return params;
    }

    public Statement body() {
      return body;
    }

    /**
     * @return number of values the function can return: the largest
     *      number of values in any of its own return statements
     */
    public int returnSlots() {
      return maxReturnArity(body);
    }

    private static int maxReturnArity(Statement stmt) {
      switch (stmt.type()) {
        case RETURN:
          return ((Return)stmt).values().size();
        case SEQUENCE: {
          Sequence seq = (Sequence)stmt;
          return Math.max(maxReturnArity(seq.first()),
                          maxReturnArity(seq.second()));
        }
        case CONDITIONAL: {
          Conditional cond = (Conditional)stmt;
          return Math.max(maxReturnArity(cond.thenBlock()),
                          maxReturnArity(cond.elseBlock()));
        }
        case LOOP:
          return maxReturnArity(((Loop)stmt).body());
        case SCOPED_BINDING:
          return maxReturnArity(((ScopedBinding)stmt).rest());
        case FUNCTION_DEF:
          // Returns in the nested body belong to the nested function
          return maxReturnArity(((FunctionDef)stmt).rest());
        case MULTI_ASSIGN:
        case NOP:
          return 0;
        default:
          throw new LowcRuntimeError("Unknown statement type " +
                                     stmt.type());
      }
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(name, params, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Function)) {
        return false;
      }
      Function other = (Function)obj;
      return name.equals(other.name) && params.equals(other.params) &&
             body.equals(other.body);
    }

    @Override
    public String toString() {
      return name + "(" + StringUtils.join(params, ", ") + ")";
    }
  }
}
