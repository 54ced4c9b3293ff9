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

package com.google.examples.neg.controller.cloud;

import com.google.api.gax.longrunning.OperationFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.compute.v1.NetworkEndpoint;
import com.google.cloud.compute.v1.NetworkEndpointGroup;
import com.google.cloud.compute.v1.NetworkEndpointGroupsAttachEndpointsRequest;
import com.google.cloud.compute.v1.NetworkEndpointGroupsClient;
import com.google.cloud.compute.v1.NetworkEndpointGroupsDetachEndpointsRequest;
import com.google.cloud.compute.v1.NetworkEndpointGroupsListEndpointsRequest;
import com.google.cloud.compute.v1.NetworkEndpointGroupsListEndpointsRequest.HealthStatus;
import com.google.cloud.compute.v1.NetworkEndpointWithHealthStatus;
import com.google.cloud.compute.v1.Operation;
import com.google.common.collect.ImmutableList;
import com.google.examples.neg.controller.config.ControllerConfig;
import com.google.examples.neg.controller.types.CloudException;
import com.google.examples.neg.controller.types.NetworkEndpointGroupCloud;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zonal NEG operations using the Compute Engine API.
 *
 * <p>Mutating calls wait for the zonal operation to complete.
 */
public class GceNetworkEndpointGroupCloud implements NetworkEndpointGroupCloud, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(GceNetworkEndpointGroupCloud.class);

  private final NetworkEndpointGroupsClient client;
  private final String projectId;
  private final String networkUrl;
  private final String subnetworkUrl;

  public GceNetworkEndpointGroupCloud(
      @NotNull NetworkEndpointGroupsClient client,
      @NotNull String projectId,
      @NotNull String networkUrl,
      @NotNull String subnetworkUrl) {
    this.client = client;
    this.projectId = projectId;
    this.networkUrl = networkUrl;
    this.subnetworkUrl = subnetworkUrl;
  }

  /** Creates a client using Application Default Credentials. */
  @NotNull
  public static GceNetworkEndpointGroupCloud create(@NotNull ControllerConfig config) {
    try {
      return new GceNetworkEndpointGroupCloud(
          NetworkEndpointGroupsClient.create(),
          config.projectId(),
          config.networkUrl(),
          config.subnetworkUrl());
    } catch (IOException e) {
      throw new CloudException("Could not create Compute Engine NEG client", e);
    }
  }

  @Override
  @Nullable
  public NetworkEndpointGroup getNetworkEndpointGroup(@NotNull String name, @NotNull String zone) {
    try {
      return client.get(projectId, zone, name);
    } catch (NotFoundException e) {
      LOG.debug("NEG {} not found in zone {}", name, zone);
      return null;
    } catch (ApiException e) {
      throw new CloudException("Failed to get NEG " + name + " in zone " + zone, e);
    }
  }

  @Override
  public void createNetworkEndpointGroup(@NotNull NetworkEndpointGroup neg, @NotNull String zone) {
    await(
        "create NEG " + neg.getName() + " in zone " + zone,
        () -> client.insertAsync(projectId, zone, neg));
  }

  @Override
  public void deleteNetworkEndpointGroup(@NotNull String name, @NotNull String zone) {
    await(
        "delete NEG " + name + " in zone " + zone,
        () -> client.deleteAsync(projectId, zone, name));
  }

  @Override
  public void attachNetworkEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> endpoints) {
    var request =
        NetworkEndpointGroupsAttachEndpointsRequest.newBuilder()
            .addAllNetworkEndpoints(endpoints)
            .build();
    await(
        "attach " + endpoints.size() + " endpoints to NEG " + name + " in zone " + zone,
        () -> client.attachNetworkEndpointsAsync(projectId, zone, name, request));
  }

  @Override
  public void detachNetworkEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> endpoints) {
    var request =
        NetworkEndpointGroupsDetachEndpointsRequest.newBuilder()
            .addAllNetworkEndpoints(endpoints)
            .build();
    await(
        "detach " + endpoints.size() + " endpoints from NEG " + name + " in zone " + zone,
        () -> client.detachNetworkEndpointsAsync(projectId, zone, name, request));
  }

  @Override
  @NotNull
  public List<NetworkEndpointWithHealthStatus> listNetworkEndpoints(
      @NotNull String name, @NotNull String zone, boolean showHealthStatus) {
    HealthStatus healthStatus = showHealthStatus ? HealthStatus.SHOW : HealthStatus.SKIP;
    var request =
        NetworkEndpointGroupsListEndpointsRequest.newBuilder()
            .setHealthStatus(healthStatus.name())
            .build();
    try {
      return ImmutableList.copyOf(
          client.listNetworkEndpoints(projectId, zone, name, request).iterateAll());
    } catch (ApiException e) {
      throw new CloudException("Failed to list endpoints of NEG " + name + " in zone " + zone, e);
    }
  }

  @Override
  @NotNull
  public String networkUrl() {
    return networkUrl;
  }

  @Override
  @NotNull
  public String subnetworkUrl() {
    return subnetworkUrl;
  }

  @Override
  public void close() {
    client.close();
  }

  private void await(
      @NotNull String description,
      @NotNull Supplier<OperationFuture<Operation, Operation>> operation) {
    try {
      Operation result = operation.get().get();
      if (result.hasError() && result.getError().getErrorsCount() > 0) {
        throw new CloudException(
            "Failed to " + description + ": " + result.getError().getErrors(0).getMessage());
      }
      LOG.debug("Completed operation {} to {}", result.getName(), description);
    } catch (ApiException e) {
      throw new CloudException("Failed to " + description, e);
    } catch (ExecutionException e) {
      throw new CloudException("Failed to " + description, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CloudException("Interrupted while waiting to " + description, e);
    }
  }
}
