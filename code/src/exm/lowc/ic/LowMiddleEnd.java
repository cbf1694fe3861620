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
package exm.lowc.ic;

import java.util.Set;

import org.apache.log4j.Logger;

import exm.lowc.common.Settings;
import exm.lowc.common.exceptions.InvalidOptionException;
import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.ic.opt.Flattener;
import exm.lowc.ic.opt.LivenessAnalysis;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Untagged;
import exm.lowc.ic.tree.LiveSet;

/**
 * Holds the intermediate code produced by the front end and runs the
 * passes over it that prepare it for an emitter.
 */
public class LowMiddleEnd {

  private final Logger logger;

  private Instruction<Untagged> program;

  public LowMiddleEnd(Logger logger, Instruction<Untagged> program) {
    this.logger = logger;
    this.program = program;
    logIC("IC from front end", program);
  }

  public Instruction<Untagged> getProgram() {
    return program;
  }

  /**
   * Remove nested sequences from the program
   */
  public void flatten() {
    logger.debug("Pass: flatten sequences");
    program = Flattener.flatten(program);
    logIC("IC after flattening", program);
  }

  /**
   * Tag program with liveness information.  Should be flattened first.
   * @param liveOut variables read after the program finishes
   * @return tagged program
   */
  public Instruction<LiveSet> analyseLiveness(Set<String> liveOut) {
    logger.debug("Pass: liveness analysis, live out: " + liveOut);
    Instruction<LiveSet> tagged =
                    new LivenessAnalysis(logger).analyse(program, liveOut);
    logIC("IC after liveness analysis", tagged);
    return tagged;
  }

  private void logIC(String title, Instruction<?> ic) {
    boolean enabled;
    try {
      enabled = Settings.getBoolean(Settings.IC_LOG);
    } catch (InvalidOptionException e) {
      throw new LowcRuntimeError(e.getMessage());
    }
    if (enabled && logger.isTraceEnabled()) {
      logger.trace(title + ":\n" + ic);
    }
  }
}
