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

import com.google.examples.neg.controller.types.EndpointPodMap;
import com.google.examples.neg.controller.types.NamespacedName;
import com.google.examples.neg.controller.types.NetworkEndpoint;
import com.google.examples.neg.controller.types.NetworkEndpointSet;
import com.google.examples.neg.controller.types.ZoneGetter;
import com.google.examples.neg.controller.types.ZoneLookupException;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.models.CoreV1EndpointPort;
import io.kubernetes.client.openapi.models.V1EndpointAddress;
import io.kubernetes.client.openapi.models.V1EndpointSubset;
import io.kubernetes.client.openapi.models.V1Endpoints;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.kubernetes.client.openapi.models.V1Pod;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates the addresses of a Kubernetes Endpoints object into the desired NEG endpoints, grouped
 * by zone.
 */
public class ZoneNetworkEndpointMapper {
  private static final Logger LOG = LoggerFactory.getLogger(ZoneNetworkEndpointMapper.class);

  private static final String POD_KIND = "Pod";

  private final ZoneGetter zoneGetter;
  private final Indexer<V1Pod> podStore;

  public ZoneNetworkEndpointMapper(
      @NotNull ZoneGetter zoneGetter, @Nullable Indexer<V1Pod> podStore) {
    this.zoneGetter = zoneGetter;
    this.podStore = podStore;
  }

  /**
   * Desired NEG endpoints.
   *
   * @param endpointsByZone endpoint sets by zone. A zone is present if it has at least one
   *     candidate address, even if every address of the zone was excluded.
   * @param endpointPodMap the pod behind each endpoint
   */
  public record ZoneNetworkEndpoints(
      @NotNull Map<String, NetworkEndpointSet> endpointsByZone,
      @NotNull EndpointPodMap endpointPodMap) {}

  /**
   * Maps the addresses of the Endpoints object to zones.
   *
   * <p>Ready addresses are always included. Not-ready addresses are included only if their pod
   * exists and is not terminating.
   *
   * @param endpoints the Endpoints object of the Service, or null if it does not exist (yet)
   * @param targetPort target port of the Service port, either a number or a port name
   * @param subsetLabels optional label selector that pods must match
   * @throws ZoneLookupException if the zone of any address' node cannot be determined
   */
  @NotNull
  public ZoneNetworkEndpoints toZoneNetworkEndpointMap(
      @Nullable V1Endpoints endpoints, @NotNull String targetPort, @Nullable String subsetLabels) {
    var result = new ZoneNetworkEndpoints(new HashMap<>(), new EndpointPodMap());
    if (endpoints == null) {
      LOG.error("Endpoints object is null");
      return result;
    }
    if (endpoints.getSubsets() == null) {
      return result;
    }
    int targetPortNum = parsePort(targetPort);
    for (V1EndpointSubset subset : endpoints.getSubsets()) {
      String matchPort = findMatchPort(subset, targetPort, targetPortNum);
      if (matchPort == null) {
        continue;
      }
      processAddresses(endpoints, subset.getAddresses(), matchPort, subsetLabels, true, result);
      processAddresses(
          endpoints, subset.getNotReadyAddresses(), matchPort, subsetLabels, false, result);
    }
    return result;
  }

  /**
   * Service specs allow the target port to be a named port. Returns the port to use in the NEG, or
   * null if the subset does not contain the target port.
   */
  @Nullable
  private static String findMatchPort(
      @NotNull V1EndpointSubset subset, @NotNull String targetPort, int targetPortNum) {
    if (subset.getPorts() == null) {
      return null;
    }
    for (CoreV1EndpointPort port : subset.getPorts()) {
      if (targetPortNum != 0) {
        if (port.getPort() != null && port.getPort() == targetPortNum) {
          return targetPort;
        }
      } else if (targetPort.equals(port.getName()) && port.getPort() != null) {
        return String.valueOf(port.getPort());
      }
    }
    return null;
  }

  /** Returns 0 if the target port is not a number. */
  private static int parsePort(@NotNull String targetPort) {
    try {
      return Integer.parseInt(targetPort);
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private void processAddresses(
      @NotNull V1Endpoints endpoints,
      @Nullable List<V1EndpointAddress> addresses,
      @NotNull String matchPort,
      @Nullable String subsetLabels,
      boolean includeAllEndpoints,
      @NotNull ZoneNetworkEndpoints result) {
    if (addresses == null) {
      return;
    }
    String endpointsKey = endpointsKey(endpoints);
    for (V1EndpointAddress address : addresses) {
      V1ObjectReference targetRef = address.getTargetRef();
      if (subsetLabels != null && !subsetLabels.isEmpty()) {
        if (targetRef == null || !POD_KIND.equals(targetRef.getKind())) {
          LOG.info(
              "Endpoint {} in Endpoints {} does not have a Pod as the TargetRef object. Skipping",
              address.getIp(),
              endpointsKey);
          continue;
        }
        if (!PodFilters.shouldPodBeInSubset(
            podStore, podNamespace(endpoints, targetRef), targetRef.getName(), subsetLabels)) {
          continue;
        }
      }
      String nodeName = address.getNodeName();
      if (nodeName == null) {
        LOG.info(
            "Endpoint {} in Endpoints {} does not have an associated node. Skipping",
            address.getIp(),
            endpointsKey);
        continue;
      }
      if (targetRef == null) {
        LOG.info(
            "Endpoint {} in Endpoints {} does not have an associated pod. Skipping",
            address.getIp(),
            endpointsKey);
        continue;
      }
      String zone;
      try {
        zone = zoneGetter.getZoneForNode(nodeName);
      } catch (ZoneLookupException e) {
        throw new ZoneLookupException(
            "Failed to retrieve associated zone of node \"" + nodeName + "\"", e);
      }
      NetworkEndpointSet zoneEndpoints =
          result.endpointsByZone().computeIfAbsent(zone, z -> new NetworkEndpointSet());

      String namespace = podNamespace(endpoints, targetRef);
      if (includeAllEndpoints
          || PodFilters.shouldPodBeInNeg(podStore, namespace, targetRef.getName())) {
        var networkEndpoint = new NetworkEndpoint(address.getIp(), matchPort, nodeName);
        zoneEndpoints.add(networkEndpoint);
        result.endpointPodMap().put(
            networkEndpoint, new NamespacedName(namespace, targetRef.getName()));
      }
    }
  }

  /** Target references without a namespace refer to the namespace of the Endpoints object. */
  @NotNull
  private static String podNamespace(
      @NotNull V1Endpoints endpoints, @NotNull V1ObjectReference targetRef) {
    if (targetRef.getNamespace() != null) {
      return targetRef.getNamespace();
    }
    return endpoints.getMetadata() == null
        ? ""
        : Objects.requireNonNullElse(endpoints.getMetadata().getNamespace(), "");
  }

  @NotNull
  private static String endpointsKey(@NotNull V1Endpoints endpoints) {
    if (endpoints.getMetadata() == null) {
      return "<unknown>";
    }
    return NamespacedName.key(
        Objects.requireNonNullElse(endpoints.getMetadata().getNamespace(), ""),
        Objects.requireNonNullElse(endpoints.getMetadata().getName(), ""));
  }
}
