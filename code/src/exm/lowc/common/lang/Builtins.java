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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.lowc.ast.SourceTree.Function;
import exm.lowc.ast.SourceTree.Statement;

/**
 * Functions supplied from outside the program, available to every call.
 * Non-constant multiplication, division and modulo are lowered to calls
 * to builtins named after the operator, so a program using them needs
 * those builtins registered here.
 */
public class Builtins {

  private final Map<String, Function> functions =
                          new LinkedHashMap<String, Function>();

  public static Builtins empty() {
    return new Builtins();
  }

  /**
   * Register function, replacing any builtin of the same name
   * @return this, for chaining
   */
  public Builtins define(Function function) {
    functions.put(function.name(), function);
    return this;
  }

  public Builtins define(String name, List<String> params, Statement body) {
    return define(new Function(name, params, body));
  }

  public Collection<Function> functions() {
    return Collections.unmodifiableCollection(functions.values());
  }

  @Override
  public String toString() {
    return functions.values().toString();
  }
}
