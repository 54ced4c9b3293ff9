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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps network endpoints to the pods that back them.
 *
 * <p>If the same endpoint is recorded twice, the last pod wins.
 */
public class EndpointPodMap {

  private final Map<NetworkEndpoint, NamespacedName> pods = new HashMap<>();

  public void put(@NotNull NetworkEndpoint endpoint, @NotNull NamespacedName pod) {
    pods.put(endpoint, pod);
  }

  @Nullable
  public NamespacedName get(@NotNull NetworkEndpoint endpoint) {
    return pods.get(endpoint);
  }

  public int size() {
    return pods.size();
  }

  public boolean isEmpty() {
    return pods.isEmpty();
  }

  @NotNull
  public Map<NetworkEndpoint, NamespacedName> asMap() {
    return Collections.unmodifiableMap(pods);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EndpointPodMap)) {
      return false;
    }
    return pods.equals(((EndpointPodMap) o).pods);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pods);
  }

  @Override
  public String toString() {
    return pods.toString();
  }
}
