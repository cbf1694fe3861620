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
package exm.lowc.ic.tree;

import java.util.Collection;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSortedSet;

/**
 * Immutable set of variable names live after an instruction.  Attached
 * as the tag of instructions by liveness analysis.
 */
public class LiveSet {
  private static final LiveSet EMPTY =
              new LiveSet(ImmutableSortedSet.<String>of());

  private final ImmutableSortedSet<String> names;

  private LiveSet(ImmutableSortedSet<String> names) {
    this.names = names;
  }

  public static LiveSet empty() {
    return EMPTY;
  }

  public static LiveSet of(Collection<String> names) {
    return new LiveSet(ImmutableSortedSet.copyOf(names));
  }

  public static LiveSet of(String ...names) {
    return new LiveSet(ImmutableSortedSet.copyOf(names));
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  public Set<String> names() {
    return names;
  }

  public int size() {
    return names.size();
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LiveSet)) {
      return false;
    }
    return names.equals(((LiveSet)obj).names);
  }

  @Override
  public String toString() {
    return "{" + StringUtils.join(names, ", ") + "}";
  }
}
