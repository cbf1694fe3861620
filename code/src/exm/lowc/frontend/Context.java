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

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;

import exm.lowc.ast.SourceTree.Function;
import exm.lowc.common.exceptions.UndefinedFunctionException;
import exm.lowc.common.exceptions.UndefinedVariableException;
import exm.lowc.common.lang.Builtins;
import exm.lowc.common.util.HierarchicalMap;

/**
 * Tracks what is in scope at a point in the source tree while inlining:
 * the target name each source variable was renamed to, the functions that
 * can be called, and where the return values of the call currently being
 * inlined must be written.
 *
 * A context is never modified once created.  Binding a name creates a
 * child context, so a binding made while walking one branch can't be seen
 * from a sibling branch or from the enclosing scope.
 */
public class Context {

  /**
   * A function together with the functions that were visible where it was
   * defined.  The body is inlined against that scope, so a function can
   * only call functions defined before it and never itself.
   */
  public static class DefinedFunction {
    public final Function function;
    public final HierarchicalMap<String, DefinedFunction> scope;

    DefinedFunction(Function function,
                    HierarchicalMap<String, DefinedFunction> scope) {
      this.function = function;
      this.scope = scope;
    }

    @Override
    public String toString() {
      return function.toString();
    }
  }

  /** source variable name -> target variable name */
  private final HierarchicalMap<String, String> variables;

  /** function name -> function */
  private final HierarchicalMap<String, DefinedFunction> functions;

  /**
   * Target variables receiving return slot i of the call being inlined.
   * Slots past the end are discarded by the caller.  Empty outside of
   * any call.
   */
  private final ImmutableList<String> returnTargets;

  private Context(HierarchicalMap<String, String> variables,
                  HierarchicalMap<String, DefinedFunction> functions,
                  ImmutableList<String> returnTargets) {
    this.variables = variables;
    this.functions = functions;
    this.returnTargets = returnTargets;
  }

  /**
   * Create top-level context with no variables.  Each builtin can call
   * the builtins registered before it.
   */
  public static Context createRoot(Builtins builtins) {
    HierarchicalMap<String, DefinedFunction> functions =
                        new HierarchicalMap<String, DefinedFunction>();
    for (Function f: builtins.functions()) {
      functions = functions.extend(f.name(), new DefinedFunction(f, functions));
    }
    return new Context(new HierarchicalMap<String, String>(), functions,
                       ImmutableList.<String>of());
  }

  public boolean isVarBound(String name) {
    return variables.containsKey(name);
  }

  /**
   * @param name source variable name
   * @return target variable name
   * @throws UndefinedVariableException
   */
  public String lookupVar(String name) throws UndefinedVariableException {
    String target = variables.get(name);
    if (target == null) {
      throw UndefinedVariableException.fromName(name);
    }
    return target;
  }

  /**
   * @return new context where name refers to target
   */
  public Context bindVar(String name, String target) {
    return new Context(variables.extend(name, target), functions,
                       returnTargets);
  }

  public DefinedFunction lookupFunction(String name)
                                     throws UndefinedFunctionException {
    DefinedFunction f = functions.get(name);
    if (f == null) {
      throw UndefinedFunctionException.unknownFunction(name);
    }
    return f;
  }

  public boolean isFunctionDefined(String name) {
    return functions.containsKey(name);
  }

  /**
   * @return new context in which function can be called, shadowing any
   *        previous function of the same name
   */
  public Context defineFunction(Function function) {
    DefinedFunction def = new DefinedFunction(function, functions);
    return new Context(variables, functions.extend(function.name(), def),
                       returnTargets);
  }

  /**
   * Context for inlining the body of a call.
   * @param callee the function being called
   * @param paramBindings parameter name -> target variable holding argument
   * @param targets where each return value of the call should go
   */
  public Context enterCall(DefinedFunction callee,
        Map<String, String> paramBindings, List<String> targets) {
    HierarchicalMap<String, String> calleeVars = variables.makeChildMap();
    for (Entry<String, String> e: paramBindings.entrySet()) {
      calleeVars.put(e.getKey(), e.getValue());
    }
    return new Context(calleeVars, callee.scope,
                       ImmutableList.copyOf(targets));
  }

  /**
   * @param slot index of returned value
   * @return the target variable the value should be written to, or null
   *        if the caller discards it
   */
  public String returnTarget(int slot) {
    if (slot < returnTargets.size()) {
      return returnTargets.get(slot);
    }
    return null;
  }

  @Override
  public String toString() {
    return "vars: " + variables + " functions: " + functions +
           " returns: " + returnTargets;
  }
}
