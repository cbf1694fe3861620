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
package exm.lowc.ui;

import java.util.Set;

import org.apache.log4j.Logger;

import exm.lowc.ast.SourceTree.Function;
import exm.lowc.ast.SourceTree.Statement;
import exm.lowc.common.Logging;
import exm.lowc.common.NameGenerator;
import exm.lowc.common.Settings;
import exm.lowc.common.exceptions.InvalidOptionException;
import exm.lowc.common.exceptions.UserException;
import exm.lowc.common.lang.Builtins;
import exm.lowc.frontend.ASTWalker;
import exm.lowc.frontend.ASTWalker.LoweredProgram;
import exm.lowc.frontend.Normaliser;
import exm.lowc.ic.LowMiddleEnd;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.LiveSet;

/**
 * This is the main entry point to the compiler.  It takes a parsed
 * program and the builtin functions, and produces flat intermediate
 * code tagged with liveness for an emitter.
 *
 * Compilation either succeeds completely or throws: no partial output
 * is produced.
 */
public class LowCompiler {

  private final Logger logger;

  public LowCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Load settings from system properties and set up logging from them
   * @return compiler logging to the configured destination
   * @throws InvalidOptionException if a setting has an invalid value
   */
  public static LowCompiler fromSettings() throws InvalidOptionException {
    Settings.initProperties();
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    Logger logger = Logging.setupLogging(logfile, trace);
    if (logger.isDebugEnabled()) {
      for (String key: Settings.getKeys()) {
        logger.debug("Setting " + key + "=" + Settings.get(key));
      }
    }
    return new LowCompiler(logger);
  }

  /**
   * Compile program.  Variables declared at the top level of the program
   * are treated as its outputs and are live at the end.
   * @param program
   * @param builtins
   * @return tagged intermediate code
   * @throws UserException
   */
  public Instruction<LiveSet> compile(Statement program, Builtins builtins)
                                                  throws UserException {
    return compile(program, builtins, null);
  }

  /**
   * @param liveOut variables live at end of program.  If null, use the
   *        top-level variables of the program
   */
  public Instruction<LiveSet> compile(Statement program, Builtins builtins,
                            Set<String> liveOut) throws UserException {
    logger.debug("Compilation starting");
    Logging.clearEmitted();
    try {
      Statement normalised = Normaliser.precompile(program);
      if (logger.isTraceEnabled()) {
        logger.trace("Normalised program:\n" + normalised);
      }

      // Fresh names are unique within this run only
      ASTWalker walker = new ASTWalker(logger, new NameGenerator());
      LoweredProgram lowered = walker.lower(normalised,
                                            normaliseBuiltins(builtins));

      LowMiddleEnd intermediate = new LowMiddleEnd(logger, lowered.code);
      intermediate.flatten();
      Instruction<LiveSet> result = intermediate.analyseLiveness(
                      liveOut != null ? liveOut : lowered.outputs);
      logger.debug("Compilation done");
      return result;
    } catch (UserException e) {
      logger.debug("Compilation failed: " + e.getMessage());
      throw e;
    }
  }

  private static Builtins normaliseBuiltins(Builtins builtins) {
    Builtins result = Builtins.empty();
    for (Function f: builtins.functions()) {
      result.define(f.name(), f.params(), Normaliser.precompile(f.body()));
    }
    return result;
  }
}
