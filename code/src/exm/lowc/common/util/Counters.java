package exm.lowc.common.util;

import java.util.HashMap;

/**
 * Maintain counts for objects
 *
 * @param <K> must implement equals() and hashcode()
 */
public class Counters<K> {
  private final HashMap<K, Long> map = new HashMap<K, Long>();

  public long increment(K key) {
    return add(key, 1);
  }

  public long add(K key, long incr) {
    Long count = map.get(key);
    if (count == null) {
      count = incr;
    } else {
      count += incr;
    }
    map.put(key, count);
    return count;
  }

  public long getCount(K key) {
    Long res = map.get(key);
    return res == null ? 0 : res;
  }

  @Override
  public String toString() {
    return map.toString();
  }
}
