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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.examples.neg.controller.types.NetworkEndpoint;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Encodes network endpoints as flat strings, for use as set members and map keys.
 *
 * <p>No escaping is performed. IP addresses, node names and ports never contain {@link
 * #SEPARATOR}.
 */
public final class EndpointCodec {

  static final String SEPARATOR = "||";

  private static final Joiner JOINER = Joiner.on(SEPARATOR);
  private static final Splitter SPLITTER = Splitter.on(SEPARATOR);

  private EndpointCodec() {}

  /** Encodes ip, node and port into a single string. */
  @NotNull
  public static String encode(@NotNull String ip, @NotNull String node, @NotNull String port) {
    return JOINER.join(ip, node, port);
  }

  @NotNull
  public static String encode(@NotNull NetworkEndpoint endpoint) {
    return encode(endpoint.ip(), endpoint.node(), endpoint.port());
  }

  /**
   * Decodes a string produced by {@link #encode(String, String, String)}.
   *
   * @throws IllegalArgumentException if the string does not contain exactly three fields
   */
  @NotNull
  public static NetworkEndpoint decode(@NotNull String encoded) {
    List<String> fields = SPLITTER.splitToList(encoded);
    if (fields.size() != 3) {
      throw new IllegalArgumentException("Not an encoded endpoint: " + encoded);
    }
    return new NetworkEndpoint(fields.get(0), fields.get(2), fields.get(1));
  }
}
