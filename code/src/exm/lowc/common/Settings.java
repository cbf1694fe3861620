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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.lowc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.  Defaults are set here and may be
 * overridden by Java system properties of the same name.
 * */
public class Settings
{
  /** Largest constant multiplier expanded into repeated additions */
  public static final String OPT_MUL_UNROLL_LIMIT = "lowc.opt.mul-unroll-limit";
  /* If false, liveness still tags instructions but removes nothing */
  public static final String OPT_DEAD_STORE_ELIM = "lowc.opt.dead-store-elim";
  /** Whether a compare keeps its two numeric operands alive */
  public static final String LIVENESS_COMPARE_READS_CELLS =
                                  "lowc.liveness.compare-reads-cells";

  public static final String LOG_FILE = "lowc.log.file";
  public static final String LOG_TRACE = "lowc.log.trace";
  /** Log the IR after every pass */
  public static final String IC_LOG = "lowc.ic.log";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(OPT_MUL_UNROLL_LIMIT, "64");
    defaults.setProperty(OPT_DEAD_STORE_ELIM, "true");
    defaults.setProperty(LIVENESS_COMPARE_READS_CELLS, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(IC_LOG, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set for key, reverting to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(OPT_DEAD_STORE_ELIM);
    getBoolean(LIVENESS_COMPARE_READS_CELLS);
    getBoolean(LOG_TRACE);
    getBoolean(IC_LOG);
    long limit = getLong(OPT_MUL_UNROLL_LIMIT);
    if (limit < 1) {
      throw new InvalidOptionException("Option " + OPT_MUL_UNROLL_LIMIT +
                                " must be at least 1, was " + limit);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key)
        throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    strVal = strVal.trim();
    if (strVal.equalsIgnoreCase("true")) {
      return true;
    } else if (strVal.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option "
          + key + ": " + strVal);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }
}
