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

package com.google.examples.neg.controller.types;

import com.google.cloud.compute.v1.NetworkEndpoint;
import com.google.cloud.compute.v1.NetworkEndpointGroup;
import com.google.cloud.compute.v1.NetworkEndpointWithHealthStatus;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Zonal Network Endpoint Group operations of the cloud API.
 *
 * <p>All methods block until the underlying cloud operation has completed, and throw {@link
 * CloudException} on failure.
 */
public interface NetworkEndpointGroupCloud {

  /** Returns the NEG, or null if it does not exist. */
  @Nullable
  NetworkEndpointGroup getNetworkEndpointGroup(@NotNull String name, @NotNull String zone);

  void createNetworkEndpointGroup(@NotNull NetworkEndpointGroup neg, @NotNull String zone);

  void deleteNetworkEndpointGroup(@NotNull String name, @NotNull String zone);

  void attachNetworkEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> endpoints);

  void detachNetworkEndpoints(
      @NotNull String name, @NotNull String zone, @NotNull Collection<NetworkEndpoint> endpoints);

  @NotNull
  List<NetworkEndpointWithHealthStatus> listNetworkEndpoints(
      @NotNull String name, @NotNull String zone, boolean showHealthStatus);

  /** URL of the VPC network of the cluster. */
  @NotNull
  String networkUrl();

  /** URL of the subnetwork of the cluster. */
  @NotNull
  String subnetworkUrl();
}
