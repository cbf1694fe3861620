package exm.lowc.common.util;

import java.util.HashMap;
import java.util.Map.Entry;

/**
 * A map that allows cheap creation of nested scopes.  If a lookup fails
 * in the current map, then it sees if the key is in the parent map.
 *
 * Bindings can only be added while building a scope: once a child has been
 * created from a map, the map is frozen, so additions made in one child
 * are never visible to the parent or to sibling children.
 */
public class HierarchicalMap<K, V> {
  private final HashMap<K, V> map;
  private final HierarchicalMap<K, V> parent;

  /** Set once a child map refers to this one */
  private boolean frozen;

  public HierarchicalMap() {
    this(null);
  }

  private HierarchicalMap(HierarchicalMap<K, V> parent) {
    this.map = new HashMap<K, V>();
    this.parent = parent;
    this.frozen = false;
  }

  public HierarchicalMap<K, V> makeChildMap() {
    frozen = true;
    return new HierarchicalMap<K,V>(this);
  }

  /**
   * Create child map with a single extra binding
   */
  public HierarchicalMap<K, V> extend(K key, V value) {
    HierarchicalMap<K, V> child = makeChildMap();
    child.put(key, value);
    return child;
  }

  public boolean containsKey(K key) {
    return map.containsKey(key)
        || (parent != null && parent.containsKey(key));
  }

  public V get(K key) {
    if (map.containsKey(key)) {
      return map.get(key);
    } else if (parent != null) {
      return parent.get(key);
    } else {
      return null;
    }
  }

  public V put(K key, V value) {
    if (frozen) {
      throw new IllegalStateException("Cannot add " + key + " to map " +
                                      "after child scope was created");
    }
    return map.put(key, value);
  }

  public boolean isEmpty() {
    return map.isEmpty() && (parent == null || parent.isEmpty());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("{");
    boolean first = true;
    HierarchicalMap<K, V> curr = this;
    while (curr != null) {
      for (Entry<K, V> e: curr.map.entrySet()) {
        if (first) {
          first = false;
        } else {
          sb.append(",");
        }
        sb.append(e.getKey());
        sb.append(":");
        sb.append(e.getValue());
      }
      curr = curr.parent;
    }
    sb.append("}");
    return sb.toString();
  }

}
