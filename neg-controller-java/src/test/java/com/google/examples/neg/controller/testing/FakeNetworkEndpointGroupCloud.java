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

package com.google.examples.neg.controller.testing;

import com.google.cloud.compute.v1.NetworkEndpoint;
import com.google.cloud.compute.v1.NetworkEndpointGroup;
import com.google.cloud.compute.v1.NetworkEndpointWithHealthStatus;
import com.google.examples.neg.controller.types.CloudException;
import com.google.examples.neg.controller.types.NetworkEndpointGroupCloud;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/** In-memory NEGs, keyed by zone and name. */
public class FakeNetworkEndpointGroupCloud implements NetworkEndpointGroupCloud {

  public static final String NETWORK_URL = "projects/test-project/global/networks/default";
  public static final String SUBNETWORK_URL =
      "projects/test-project/regions/us-central1/subnetworks/default";

  private final Map<ZonedName, NetworkEndpointGroup> negs = new HashMap<>();
  private final Map<ZonedName, Set<NetworkEndpoint>> endpoints = new HashMap<>();

  public int getCalls;
  public int createCalls;
  public int deleteCalls;
  public final List<Integer> attachBatchSizes = new ArrayList<>();
  public final List<Integer> detachBatchSizes = new ArrayList<>();

  /** When set, thrown by the matching operation. */
  public RuntimeException getError;
  public RuntimeException createError;
  public RuntimeException deleteError;
  public RuntimeException listError;

  private record ZonedName(String zone, String name) {}

  /** Adds a NEG directly, without counting a create call. */
  public void put(@NotNull NetworkEndpointGroup neg, @NotNull String zone) {
    negs.put(new ZonedName(zone, neg.getName()), neg);
  }

  /** Attaches endpoints directly, without counting an attach call. */
  public void putEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> added) {
    endpoints.computeIfAbsent(new ZonedName(zone, name), k -> new LinkedHashSet<>()).addAll(added);
  }

  @Nullable
  public NetworkEndpointGroup neg(@NotNull String name, @NotNull String zone) {
    return negs.get(new ZonedName(zone, name));
  }

  @NotNull
  public Set<NetworkEndpoint> endpoints(@NotNull String name, @NotNull String zone) {
    return endpoints.getOrDefault(new ZonedName(zone, name), Set.of());
  }

  @Override
  @Nullable
  public NetworkEndpointGroup getNetworkEndpointGroup(@NotNull String name, @NotNull String zone) {
    getCalls++;
    if (getError != null) {
      throw getError;
    }
    return negs.get(new ZonedName(zone, name));
  }

  @Override
  public void createNetworkEndpointGroup(@NotNull NetworkEndpointGroup neg, @NotNull String zone) {
    createCalls++;
    if (createError != null) {
      throw createError;
    }
    var key = new ZonedName(zone, neg.getName());
    if (negs.containsKey(key)) {
      throw new CloudException("NEG " + neg.getName() + " already exists in zone " + zone);
    }
    negs.put(key, neg);
  }

  @Override
  public void deleteNetworkEndpointGroup(@NotNull String name, @NotNull String zone) {
    deleteCalls++;
    if (deleteError != null) {
      throw deleteError;
    }
    var key = new ZonedName(zone, name);
    if (negs.remove(key) == null) {
      throw new CloudException("NEG " + name + " not found in zone " + zone);
    }
    endpoints.remove(key);
  }

  @Override
  public void attachNetworkEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> added) {
    var key = new ZonedName(zone, name);
    if (!negs.containsKey(key)) {
      throw new CloudException("NEG " + name + " not found in zone " + zone);
    }
    attachBatchSizes.add(added.size());
    endpoints.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(added);
  }

  @Override
  public void detachNetworkEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> removed) {
    var key = new ZonedName(zone, name);
    if (!negs.containsKey(key)) {
      throw new CloudException("NEG " + name + " not found in zone " + zone);
    }
    detachBatchSizes.add(removed.size());
    endpoints.getOrDefault(key, new LinkedHashSet<>()).removeAll(removed);
  }

  @Override
  @NotNull
  public List<NetworkEndpointWithHealthStatus> listNetworkEndpoints(
      @NotNull String name, @NotNull String zone, boolean showHealthStatus) {
    if (listError != null) {
      throw listError;
    }
    return endpoints(name, zone).stream()
        .map(ne -> NetworkEndpointWithHealthStatus.newBuilder().setNetworkEndpoint(ne).build())
        .toList();
  }

  @Override
  @NotNull
  public String networkUrl() {
    return NETWORK_URL;
  }

  @Override
  @NotNull
  public String subnetworkUrl() {
    return SUBNETWORK_URL;
  }
}
