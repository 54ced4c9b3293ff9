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

import com.google.examples.neg.controller.config.NegFeatures;
import com.google.examples.neg.controller.syncers.EndpointDifference.ZoneDifference;
import com.google.examples.neg.controller.syncers.ZoneNetworkEndpointMapper.ZoneNetworkEndpoints;
import com.google.examples.neg.controller.types.EndpointPodMap;
import com.google.examples.neg.controller.types.NamespacedName;
import com.google.examples.neg.controller.types.NegSyncerKey;
import com.google.examples.neg.controller.types.NetworkEndpoint;
import com.google.examples.neg.controller.types.NetworkEndpointGroupCloud;
import com.google.examples.neg.controller.types.NetworkEndpointSet;
import com.google.examples.neg.controller.types.ZoneGetter;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.models.V1Endpoints;
import io.kubernetes.client.openapi.models.V1Pod;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs reconciliation passes for the NEG of one Service port.
 *
 * <p>Not thread-safe. The caller runs at most one {@link #sync()} per {@link NegSyncerKey} at a
 * time, and uses {@link SyncRetryPolicy} to schedule retries of failed passes.
 */
public class NegSyncer {
  private static final Logger LOG = LoggerFactory.getLogger(NegSyncer.class);

  private final NegSyncerKey key;
  private final ZoneGetter zoneGetter;
  private final NetworkEndpointGroupCloud cloud;
  private final Indexer<V1Endpoints> endpointsStore;
  private final NegEnsurer ensurer;
  private final ZoneNetworkEndpointMapper mapper;
  private final ExistingEndpointsRetriever retriever;
  private final EndpointBatcher batcher;
  private final boolean createHybridNeg;

  public NegSyncer(
      @NotNull NegSyncerKey key,
      @NotNull ZoneGetter zoneGetter,
      @NotNull NetworkEndpointGroupCloud cloud,
      @NotNull Indexer<V1Endpoints> endpointsStore,
      @Nullable Indexer<V1Pod> podStore,
      @NotNull NegEnsurer ensurer,
      @NotNull NegFeatures features) {
    this.key = key;
    this.zoneGetter = zoneGetter;
    this.cloud = cloud;
    this.endpointsStore = endpointsStore;
    this.ensurer = ensurer;
    this.mapper = new ZoneNetworkEndpointMapper(zoneGetter, podStore);
    this.retriever = new ExistingEndpointsRetriever(zoneGetter, cloud);
    this.batcher = new EndpointBatcher(features.createHybridNeg());
    this.createHybridNeg = features.createHybridNeg();
  }

  /**
   * Outcome of a successful pass.
   *
   * @param endpointsAttached number of endpoints attached, across all zones
   * @param endpointsDetached number of endpoints detached, across all zones
   * @param batches number of attach and detach API calls
   * @param endpointPodMap the pod behind each desired endpoint
   */
  public record SyncResult(
      int endpointsAttached,
      int endpointsDetached,
      int batches,
      @NotNull EndpointPodMap endpointPodMap) {}

  /**
   * Ensures the NEG exists in every zone, and attaches and detaches endpoints until the NEG
   * matches the Endpoints of the Service.
   *
   * @throws com.google.examples.neg.controller.types.NegException on the first failure, the
   *     remaining work of the pass is skipped
   */
  @NotNull
  public SyncResult sync() {
    for (String zone : zoneGetter.listZones()) {
      ensurer.ensureNetworkEndpointGroup(
          key.namespace(), key.name(), key.negName(), zone, key.servicePortName());
    }

    V1Endpoints endpoints =
        endpointsStore.getByKey(NamespacedName.key(key.namespace(), key.name()));
    ZoneNetworkEndpoints desired =
        mapper.toZoneNetworkEndpointMap(endpoints, key.targetPort(), key.subsetLabels());
    Map<String, NetworkEndpointSet> targetMap =
        createHybridNeg ? withoutNodes(desired.endpointsByZone()) : desired.endpointsByZone();
    Map<String, NetworkEndpointSet> currentMap =
        retriever.retrieveExistingZoneNetworkEndpointMap(key.negName());

    ZoneDifference<NetworkEndpointSet> difference =
        EndpointDifference.calculateNetworkEndpointDifference(targetMap, currentMap);
    if (difference.isEmpty()) {
      LOG.debug("NEG {} is in sync", key);
      return new SyncResult(0, 0, 0, desired.endpointPodMap());
    }

    int batches = 0;
    int attached = 0;
    for (Map.Entry<String, NetworkEndpointSet> entry : difference.toAdd().entrySet()) {
      NetworkEndpointSet toAdd = entry.getValue();
      while (!toAdd.isEmpty()) {
        var batch = batcher.makeEndpointBatch(toAdd);
        LOG.info(
            "Attaching {} endpoints to NEG {} in zone {}",
            batch.size(),
            key.negName(),
            entry.getKey());
        cloud.attachNetworkEndpoints(key.negName(), entry.getKey(), batch.values());
        attached += batch.size();
        batches++;
      }
    }
    int detached = 0;
    for (Map.Entry<String, NetworkEndpointSet> entry : difference.toRemove().entrySet()) {
      NetworkEndpointSet toRemove = entry.getValue();
      while (!toRemove.isEmpty()) {
        var batch = batcher.makeEndpointBatch(toRemove);
        LOG.info(
            "Detaching {} endpoints from NEG {} in zone {}",
            batch.size(),
            key.negName(),
            entry.getKey());
        cloud.detachNetworkEndpoints(key.negName(), entry.getKey(), batch.values());
        detached += batch.size();
        batches++;
      }
    }
    return new SyncResult(attached, detached, batches, desired.endpointPodMap());
  }

  /** Hybrid NEG endpoints are identified by IP address and port only. */
  private static Map<String, NetworkEndpointSet> withoutNodes(
      Map<String, NetworkEndpointSet> endpointsByZone) {
    Map<String, NetworkEndpointSet> result = new HashMap<>();
    endpointsByZone.forEach(
        (zone, endpoints) -> {
          var projected = new NetworkEndpointSet();
          for (NetworkEndpoint endpoint : endpoints) {
            projected.add(new NetworkEndpoint(endpoint.ip(), endpoint.port(), ""));
          }
          result.put(zone, projected);
        });
    return result;
  }
}
