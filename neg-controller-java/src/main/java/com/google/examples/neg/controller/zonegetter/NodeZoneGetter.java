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

package com.google.examples.neg.controller.zonegetter;

import com.google.examples.neg.controller.types.ZoneGetter;
import com.google.examples.neg.controller.types.ZoneLookupException;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.models.V1Node;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/** Reads the zones of Kubernetes Nodes from their topology labels. */
public class NodeZoneGetter implements ZoneGetter {

  /** Well-known Node label that contains the zone. */
  static final String LABEL_ZONE = "topology.kubernetes.io/zone";

  /** Deprecated Node label that contains the zone, used if {@link #LABEL_ZONE} is missing. */
  static final String LABEL_ZONE_BETA = "failure-domain.beta.kubernetes.io/zone";

  private final Indexer<V1Node> nodeStore;

  public NodeZoneGetter(@NotNull Indexer<V1Node> nodeStore) {
    this.nodeStore = nodeStore;
  }

  @Override
  @NotNull
  public String getZoneForNode(@NotNull String nodeName) {
    V1Node node;
    try {
      // Nodes are cluster-scoped, so the store key is the name.
      node = nodeStore.getByKey(nodeName);
    } catch (RuntimeException e) {
      throw new ZoneLookupException("Failed to retrieve node \"" + nodeName + "\"", e);
    }
    if (node == null) {
      throw new ZoneLookupException("Node \"" + nodeName + "\" not found");
    }
    return zone(node)
        .orElseThrow(
            () -> new ZoneLookupException("Node \"" + nodeName + "\" does not have a zone label"));
  }

  @Override
  @NotNull
  public List<String> listZones() {
    try {
      return nodeStore.list().stream()
          .map(NodeZoneGetter::zone)
          .flatMap(Optional::stream)
          .distinct()
          .sorted()
          .toList();
    } catch (RuntimeException e) {
      throw new ZoneLookupException("Failed to list nodes", e);
    }
  }

  @NotNull
  private static Optional<String> zone(@Nullable V1Node node) {
    if (node == null || node.getMetadata() == null || node.getMetadata().getLabels() == null) {
      return Optional.empty();
    }
    Map<String, String> labels = node.getMetadata().getLabels();
    String zone = Objects.requireNonNullElse(labels.get(LABEL_ZONE), "");
    if (zone.isEmpty()) {
      zone = Objects.requireNonNullElse(labels.get(LABEL_ZONE_BETA), "");
    }
    return zone.isEmpty() ? Optional.empty() : Optional.of(zone);
  }
}
