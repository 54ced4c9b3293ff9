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

import com.google.cloud.compute.v1.NetworkEndpointWithHealthStatus;
import com.google.examples.neg.controller.types.NetworkEndpoint;
import com.google.examples.neg.controller.types.NetworkEndpointGroupCloud;
import com.google.examples.neg.controller.types.NetworkEndpointSet;
import com.google.examples.neg.controller.types.ZoneGetter;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lists the endpoints that are currently attached to a NEG, in every zone of the cluster. */
public class ExistingEndpointsRetriever {
  private static final Logger LOG = LoggerFactory.getLogger(ExistingEndpointsRetriever.class);

  private final ZoneGetter zoneGetter;
  private final NetworkEndpointGroupCloud cloud;

  public ExistingEndpointsRetriever(
      @NotNull ZoneGetter zoneGetter, @NotNull NetworkEndpointGroupCloud cloud) {
    this.zoneGetter = zoneGetter;
    this.cloud = cloud;
  }

  /**
   * Returns the attached endpoints by zone. Every known zone is present in the result, with an
   * empty set if the NEG in that zone has no endpoints.
   *
   * @throws com.google.examples.neg.controller.types.ZoneLookupException if zones cannot be listed
   * @throws com.google.examples.neg.controller.types.CloudException if endpoints cannot be listed
   */
  @NotNull
  public Map<String, NetworkEndpointSet> retrieveExistingZoneNetworkEndpointMap(
      @NotNull String negName) {
    Map<String, NetworkEndpointSet> zoneNetworkEndpointMap = new HashMap<>();
    for (String zone : zoneGetter.listZones()) {
      var zoneEndpoints = new NetworkEndpointSet();
      zoneNetworkEndpointMap.put(zone, zoneEndpoints);
      for (NetworkEndpointWithHealthStatus ne : cloud.listNetworkEndpoints(negName, zone, false)) {
        var endpoint = ne.getNetworkEndpoint();
        zoneEndpoints.add(
            new NetworkEndpoint(
                endpoint.getIpAddress(),
                String.valueOf(endpoint.getPort()),
                endpoint.getInstance()));
      }
      LOG.debug("NEG {} in zone {} has {} endpoints", negName, zone, zoneEndpoints.size());
    }
    return zoneNetworkEndpointMap;
  }
}
