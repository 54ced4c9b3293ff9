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

import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.neg.controller.syncers.EndpointDifference.ZoneDifference;
import com.google.examples.neg.controller.types.NetworkEndpoint;
import com.google.examples.neg.controller.types.NetworkEndpointSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests for {@link EndpointDifference}. */
public class EndpointDifferenceTest {

  @Test
  void addAndRemoveAcrossZones() {
    Map<String, Set<String>> target = Map.of("a", Set.of("e1", "e3"), "b", Set.of());
    Map<String, Set<String>> current = Map.of("a", Set.of("e1"), "b", Set.of("e2"));

    ZoneDifference<Set<String>> difference =
        EndpointDifference.calculateDifference(target, current);

    assertEquals(Map.of("a", Set.of("e3")), difference.toAdd());
    assertEquals(Map.of("b", Set.of("e2")), difference.toRemove());
    assertFalse(difference.isEmpty());
  }

  @Test
  void zoneMissingFromCurrentIsEmpty() {
    var difference =
        EndpointDifference.calculateDifference(Map.of("a", Set.of("e1", "e2")), Map.of());
    assertEquals(Map.of("a", Set.of("e1", "e2")), difference.toAdd());
    assertTrue(difference.toRemove().isEmpty());
  }

  @Test
  void zoneMissingFromTargetIsEmpty() {
    var difference =
        EndpointDifference.calculateDifference(Map.of(), Map.of("c", Set.of("e9")));
    assertTrue(difference.toAdd().isEmpty());
    assertEquals(Map.of("c", Set.of("e9")), difference.toRemove());
  }

  @Test
  void equalStatesHaveNoDifference() {
    Map<String, Set<String>> state = Map.of("a", Set.of("e1"), "b", Set.of("e2", "e3"));
    assertTrue(EndpointDifference.calculateDifference(state, state).isEmpty());
  }

  @Test
  void zonesWithoutChangesAreAbsent() {
    var difference =
        EndpointDifference.calculateDifference(
            Map.of("a", Set.of("e1"), "b", Set.of()), Map.of("a", Set.of("e1"), "b", Set.of()));
    assertFalse(difference.toAdd().containsKey("a"));
    assertFalse(difference.toAdd().containsKey("b"));
    assertFalse(difference.toRemove().containsKey("a"));
    assertFalse(difference.toRemove().containsKey("b"));
  }

  @Test
  void applyingTheDifferenceReachesTheTarget() {
    Map<String, Set<String>> target =
        Map.of("a", Set.of("e1", "e2", "e5"), "b", Set.of("e3"), "c", Set.of());
    Map<String, Set<String>> current =
        Map.of("a", Set.of("e1", "e4"), "b", Set.of("e3", "e6"), "d", Set.of("e7"));

    var difference = EndpointDifference.calculateDifference(target, current);

    Set<String> zones = new HashSet<>(target.keySet());
    zones.addAll(current.keySet());
    for (String zone : zones) {
      Set<String> toAdd = difference.toAdd().getOrDefault(zone, Set.of());
      Set<String> toRemove = difference.toRemove().getOrDefault(zone, Set.of());
      assertTrue(
          toAdd.stream().noneMatch(toRemove::contains), "add and remove overlap in " + zone);

      Set<String> applied = new HashSet<>(current.getOrDefault(zone, Set.of()));
      applied.removeAll(toRemove);
      applied.addAll(toAdd);
      assertEquals(target.getOrDefault(zone, Set.of()), applied, "zone " + zone);
    }
  }

  @Test
  void networkEndpointDifference() {
    var e1 = new NetworkEndpoint("10.0.0.1", "80", "n1");
    var e2 = new NetworkEndpoint("10.0.0.2", "80", "n2");
    var e3 = new NetworkEndpoint("10.0.0.3", "80", "n1");
    Map<String, NetworkEndpointSet> target = new HashMap<>();
    target.put("a", NetworkEndpointSet.of(e1, e3));
    target.put("b", new NetworkEndpointSet());
    Map<String, NetworkEndpointSet> current = new HashMap<>();
    current.put("a", NetworkEndpointSet.of(e1));
    current.put("b", NetworkEndpointSet.of(e2));

    ZoneDifference<NetworkEndpointSet> difference =
        EndpointDifference.calculateNetworkEndpointDifference(target, current);

    assertEquals(Map.of("a", Set.of(e3)), difference.toAdd());
    assertEquals(Map.of("b", Set.of(e2)), difference.toRemove());
  }
}
