package exm.lowc.common;

import exm.lowc.common.util.Counters;

/**
 * Source of fresh variable names for one lowering run.  Names are drawn
 * from a single increasing sequence, so no two calls return the same name.
 *
 * Not thread safe: concurrent runs must each use their own generator.
 */
public class NameGenerator {

  public static final String FRESH_PREFIX = "_";

  private final Counters<String> counters = new Counters<String>();

  /**
   * @return a name not returned before by this generator
   */
  public String fresh() {
    return FRESH_PREFIX + counters.increment(FRESH_PREFIX);
  }

  /**
   * @return number of names generated so far with the default prefix
   */
  public long generated() {
    return counters.getCount(FRESH_PREFIX);
  }
}
