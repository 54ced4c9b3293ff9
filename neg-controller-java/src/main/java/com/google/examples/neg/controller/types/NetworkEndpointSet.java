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

import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A mutable set of network endpoints, typically the endpoints of one NEG in one zone.
 *
 * <p>Not thread-safe. {@link #popAny()} removes elements, so a set that is being drained into
 * batches must not be shared between concurrent callers.
 */
public class NetworkEndpointSet extends AbstractSet<NetworkEndpoint> {

  private final Set<NetworkEndpoint> endpoints = new LinkedHashSet<>();

  public NetworkEndpointSet() {}

  public NetworkEndpointSet(@NotNull Collection<NetworkEndpoint> endpoints) {
    this.endpoints.addAll(endpoints);
  }

  @NotNull
  public static NetworkEndpointSet of(@NotNull NetworkEndpoint... endpoints) {
    return new NetworkEndpointSet(List.of(endpoints));
  }

  @Override
  public boolean add(@NotNull NetworkEndpoint networkEndpoint) {
    return endpoints.add(networkEndpoint);
  }

  @Override
  public boolean remove(Object o) {
    return endpoints.remove(o);
  }

  @Override
  public boolean contains(Object o) {
    return endpoints.contains(o);
  }

  @Override
  @NotNull
  public Iterator<NetworkEndpoint> iterator() {
    return endpoints.iterator();
  }

  @Override
  public int size() {
    return endpoints.size();
  }

  /**
   * Returns a new set with the endpoints of this set that are not in {@code other}. A null {@code
   * other} is treated as the empty set.
   */
  @NotNull
  public NetworkEndpointSet difference(@Nullable Set<NetworkEndpoint> other) {
    var result = new NetworkEndpointSet();
    for (NetworkEndpoint endpoint : endpoints) {
      if (other == null || !other.contains(endpoint)) {
        result.add(endpoint);
      }
    }
    return result;
  }

  /** Removes and returns an arbitrary endpoint, or an empty Optional if the set is empty. */
  @NotNull
  public Optional<NetworkEndpoint> popAny() {
    Iterator<NetworkEndpoint> it = endpoints.iterator();
    if (!it.hasNext()) {
      return Optional.empty();
    }
    NetworkEndpoint endpoint = it.next();
    it.remove();
    return Optional.of(endpoint);
  }
}
