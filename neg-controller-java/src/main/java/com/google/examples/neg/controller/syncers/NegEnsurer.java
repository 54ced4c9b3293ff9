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

import static com.google.examples.neg.controller.cloud.ResourceIds.equalResourceIds;

import com.google.cloud.compute.v1.NetworkEndpointGroup;
import com.google.cloud.compute.v1.NetworkEndpointGroup.NetworkEndpointType;
import com.google.examples.neg.controller.types.NamespacedName;
import com.google.examples.neg.controller.types.NegEventRecorder;
import com.google.examples.neg.controller.types.NetworkEndpointGroupCloud;
import io.kubernetes.client.extended.event.EventType;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.models.V1Service;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensures that a zonal NEG exists and belongs to the network and subnetwork of the cluster.
 *
 * <p>NEGs are never updated in place. A NEG in the wrong network or subnetwork is deleted and
 * created again. If the process stops between the delete and the create, the next call finds no
 * NEG and creates it.
 */
public class NegEnsurer {
  private static final Logger LOG = LoggerFactory.getLogger(NegEnsurer.class);

  static final String IP_PORT_NETWORK_ENDPOINT_TYPE = NetworkEndpointType.GCE_VM_IP_PORT.name();

  static final String PRIVATE_IP_PORT_NETWORK_ENDPOINT_TYPE =
      NetworkEndpointType.NON_GCP_PRIVATE_IP_PORT.name();

  static final String EVENT_REASON_CREATE = "Create";
  static final String EVENT_REASON_DELETE = "Delete";

  /** Result of {@link #ensureNetworkEndpointGroup}. */
  public enum Outcome {
    /** The NEG existed with the expected configuration. */
    UNCHANGED,
    /** The NEG did not exist and was created. */
    CREATED,
    /** The NEG existed with the wrong configuration, and was deleted and created again. */
    RECREATED
  }

  private final NetworkEndpointGroupCloud cloud;
  private final Indexer<V1Service> serviceStore;
  private final NegEventRecorder recorder;
  private final boolean createHybridNeg;

  /**
   * @param serviceStore used to look up the Service for events, events are skipped if null
   * @param recorder records Service events, events are skipped if null
   * @param createHybridNeg create NEGs of type <code>NON_GCP_PRIVATE_IP_PORT</code> without a
   *     subnetwork
   */
  public NegEnsurer(
      @NotNull NetworkEndpointGroupCloud cloud,
      @Nullable Indexer<V1Service> serviceStore,
      @Nullable NegEventRecorder recorder,
      boolean createHybridNeg) {
    this.cloud = cloud;
    this.serviceStore = serviceStore;
    this.recorder = recorder;
    this.createHybridNeg = createHybridNeg;
  }

  /**
   * Ensures the NEG is configured correctly in the zone. Safe to call repeatedly.
   *
   * @param negServicePortName human-readable Service port, used in event messages
   * @throws com.google.examples.neg.controller.types.CloudException if the NEG cannot be deleted
   *     or created
   */
  @NotNull
  public Outcome ensureNetworkEndpointGroup(
      @NotNull String svcNamespace,
      @NotNull String svcName,
      @NotNull String negName,
      @NotNull String zone,
      @NotNull String negServicePortName) {
    NetworkEndpointGroup neg = null;
    try {
      neg = cloud.getNetworkEndpointGroup(negName, zone);
    } catch (RuntimeException e) {
      // Most likely caused by a NEG that does not exist.
      LOG.debug("Error while retrieving NEG {} in zone {}", negName, zone, e);
    }

    if (neg != null && matchesCluster(neg)) {
      return Outcome.UNCHANGED;
    }

    boolean recreate = neg != null;
    if (recreate) {
      LOG.info(
          "NEG {} in {} does not match network and subnetwork of the cluster. Deleting NEG.",
          negName,
          zone);
      cloud.deleteNetworkEndpointGroup(negName, zone);
      recordEvent(
          svcNamespace,
          svcName,
          EVENT_REASON_DELETE,
          "Deleted NEG \"%s\" for %s in \"%s\".",
          negName,
          negServicePortName,
          zone);
    }

    LOG.info("Creating NEG {} for {} in {}.", negName, negServicePortName, zone);
    cloud.createNetworkEndpointGroup(newNetworkEndpointGroup(negName), zone);
    recordEvent(
        svcNamespace,
        svcName,
        EVENT_REASON_CREATE,
        "Created NEG \"%s\" for %s in \"%s\".",
        negName,
        negServicePortName,
        zone);
    return recreate ? Outcome.RECREATED : Outcome.CREATED;
  }

  /** Hybrid NEGs have no subnetwork. */
  private boolean matchesCluster(@NotNull NetworkEndpointGroup neg) {
    String expectedSubnetwork = createHybridNeg ? "" : cloud.subnetworkUrl();
    return equalResourceIds(neg.getNetwork(), cloud.networkUrl())
        && equalResourceIds(neg.getSubnetwork(), expectedSubnetwork);
  }

  @NotNull
  private NetworkEndpointGroup newNetworkEndpointGroup(@NotNull String negName) {
    var builder = NetworkEndpointGroup.newBuilder().setName(negName).setNetwork(cloud.networkUrl());
    if (createHybridNeg) {
      builder.setNetworkEndpointType(PRIVATE_IP_PORT_NETWORK_ENDPOINT_TYPE);
    } else {
      builder
          .setNetworkEndpointType(IP_PORT_NETWORK_ENDPOINT_TYPE)
          .setSubnetwork(cloud.subnetworkUrl());
    }
    return builder.build();
  }

  private void recordEvent(
      String svcNamespace, String svcName, String reason, String format, String... args) {
    if (recorder == null || serviceStore == null) {
      return;
    }
    V1Service service = getService(svcNamespace, svcName);
    if (service != null) {
      recorder.event(service, EventType.Normal, reason, format, args);
    }
  }

  @Nullable
  private V1Service getService(String namespace, String name) {
    String key = NamespacedName.key(namespace, name);
    try {
      return serviceStore.getByKey(key);
    } catch (RuntimeException e) {
      LOG.error("Failed to retrieve service {} from store", key, e);
      return null;
    }
  }
}
