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

package exm.lowc.common.exceptions;

/**
 * Wrong number of arguments passed to a function, or more
 * results requested than the function returns.
 */
public class ArityMismatchException
extends UserException
{
  private final String function;

  public ArityMismatchException(String function, String msg)
  {
    super(msg);
    this.function = function;
  }

  public static ArityMismatchException wrongArgCount(String function,
                                          int expected, int actual) {
    return new ArityMismatchException(function, "function " + function +
        " expects " + expected + " argument(s) but was called with " + actual);
  }

  public static ArityMismatchException tooManyOutputs(String function,
                                          int slots, int assigned) {
    return new ArityMismatchException(function, "function " + function +
        " returns " + slots + " value(s) but " + assigned +
        " variable(s) were assigned");
  }

  public String getFunction() {
    return function;
  }

  private static final long serialVersionUID = 1L;
}
