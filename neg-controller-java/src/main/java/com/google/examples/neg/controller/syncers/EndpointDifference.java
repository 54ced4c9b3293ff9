// Copyright 2024 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.examples.neg.controller.syncers;

import com.google.examples.neg.controller.types.NetworkEndpointSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;

/**
 * Determines which endpoints must be added to and removed from each zone to move the current
 * state to the target state.
 */
public final class EndpointDifference {

  private EndpointDifference() {}

  /**
   * Endpoints to add and to remove, by zone. Zones without changes are absent. For every zone, the
   * two sets are disjoint.
   *
   * @param <S> endpoint set type
   */
  public record ZoneDifference<S>(@NotNull Map<String, S> toAdd, @NotNull Map<String, S> toRemove) {

    public boolean isEmpty() {
      return toAdd.isEmpty() && toRemove.isEmpty();
    }
  }

  /** Difference of sets of encoded endpoints, see {@link EndpointCodec}. */
  @NotNull
  public static ZoneDifference<Set<String>> calculateDifference(
      @NotNull Map<String, ? extends Set<String>> targetMap,
      @NotNull Map<String, ? extends Set<String>> currentMap) {
    return calculate(targetMap, currentMap, HashSet::new);
  }

  @NotNull
  public static ZoneDifference<NetworkEndpointSet> calculateNetworkEndpointDifference(
      @NotNull Map<String, NetworkEndpointSet> targetMap,
      @NotNull Map<String, NetworkEndpointSet> currentMap) {
    return calculate(targetMap, currentMap, NetworkEndpointSet::new);
  }

  /**
   * Computes <code>target[zone] - current[zone]</code> for the zones of the target, and <code>
   * current[zone] - target[zone]</code> for the zones of the current state. A zone missing from
   * one side is treated as empty.
   *
   * @param newSet creates the empty result sets
   */
  @NotNull
  static <E, S extends Set<E>> ZoneDifference<S> calculate(
      @NotNull Map<String, ? extends Set<E>> targetMap,
      @NotNull Map<String, ? extends Set<E>> currentMap,
      @NotNull Supplier<S> newSet) {
    return new ZoneDifference<>(
        subtract(targetMap, currentMap, newSet), subtract(currentMap, targetMap, newSet));
  }

  private static <E, S extends Set<E>> Map<String, S> subtract(
      Map<String, ? extends Set<E>> minuend,
      Map<String, ? extends Set<E>> subtrahend,
      Supplier<S> newSet) {
    Map<String, S> result = new HashMap<>();
    for (Map.Entry<String, ? extends Set<E>> entry : minuend.entrySet()) {
      Set<E> other = subtrahend.get(entry.getKey());
      S diff = newSet.get();
      for (E endpoint : entry.getValue()) {
        if (other == null || !other.contains(endpoint)) {
          diff.add(endpoint);
        }
      }
      if (!diff.isEmpty()) {
        result.put(entry.getKey(), diff);
      }
    }
    return result;
  }
}
