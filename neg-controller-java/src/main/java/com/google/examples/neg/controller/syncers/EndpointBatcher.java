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

import com.google.examples.neg.controller.types.NetworkEndpoint;
import com.google.examples.neg.controller.types.NetworkEndpointSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/** Splits endpoint sets into batches that fit in a single attach or detach API call. */
public class EndpointBatcher {

  /** Maximum number of endpoints in one attach or detach call. */
  public static final int MAX_NETWORK_ENDPOINTS_PER_BATCH = 500;

  private final boolean createHybridNeg;

  /**
   * @param createHybridNeg omit the instance of the endpoints, as required by <code>
   *     NON_GCP_PRIVATE_IP_PORT</code> NEGs
   */
  public EndpointBatcher(boolean createHybridNeg) {
    this.createHybridNeg = createHybridNeg;
  }

  /**
   * Removes up to {@link #MAX_NETWORK_ENDPOINTS_PER_BATCH} endpoints from the set and returns them
   * with their cloud API representation. Call repeatedly until the set is empty.
   *
   * @throws EndpointEncodingException if the port of an endpoint is not a number
   */
  @NotNull
  public Map<NetworkEndpoint, com.google.cloud.compute.v1.NetworkEndpoint> makeEndpointBatch(
      @NotNull NetworkEndpointSet endpoints) {
    Map<NetworkEndpoint, com.google.cloud.compute.v1.NetworkEndpoint> endpointBatch =
        new LinkedHashMap<>();
    for (int i = 0; i < MAX_NETWORK_ENDPOINTS_PER_BATCH; i++) {
      Optional<NetworkEndpoint> popped = endpoints.popAny();
      if (popped.isEmpty()) {
        break;
      }
      NetworkEndpoint networkEndpoint = popped.get();
      int portNum;
      try {
        portNum = Integer.parseInt(networkEndpoint.port());
      } catch (NumberFormatException e) {
        throw new EndpointEncodingException(
            "Failed to decode endpoint port " + networkEndpoint, e);
      }
      var builder =
          com.google.cloud.compute.v1.NetworkEndpoint.newBuilder()
              .setIpAddress(networkEndpoint.ip())
              .setPort(portNum);
      if (!createHybridNeg) {
        builder.setInstance(networkEndpoint.node());
      }
      endpointBatch.put(networkEndpoint, builder.build());
    }
    return endpointBatch;
  }
}
