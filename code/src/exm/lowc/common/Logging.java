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

package exm.lowc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.util.Pair;

public class Logging
{
  private static final String LOWC_LOGGER_NAME = "exm.lowc";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted.  Cleared at the start of each compilation.
   */
  static final Set<Pair<org.apache.log4j.Level, String>> emitted =
       new HashSet<Pair<org.apache.log4j.Level, String>>();

  public static Logger getLowcLogger()
  {
    return Logger.getLogger(LOWC_LOGGER_NAME);
  }

  /**
   * Configure project logger.
   * @param logfile if empty or null, log warnings to console only
   * @param trace log at trace level to the file
   * @return the project logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger lowcLogger = getLowcLogger();
    lowcLogger.removeAllAppenders();
    lowcLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (StringUtils.isBlank(logfile)) {
      // Even if logging is disabled, this must be valid:
      lowcLogger.addAppender(new ConsoleAppender(layout,
                                  ConsoleAppender.SYSTEM_ERR));
      lowcLogger.setLevel(Level.WARN);
    } else {
      try {
        lowcLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new LowcRuntimeError("Could not open log file " + logfile +
                                   ": " + e.getMessage());
      }
      lowcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    return lowcLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(org.apache.log4j.Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  /**
   * Forget emitted messages so they can be reported again
   */
  public static void clearEmitted()
  {
    emitted.clear();
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getLowcLogger().warn(msg);
    else
      getLowcLogger().debug("Duplicate Warning: " + msg);
  }
}
