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

package com.google.examples.neg.controller.config;

import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Contains flags to enable and disable NEG features.
 *
 * @param createHybridNeg create NEGs of type <code>NON_GCP_PRIVATE_IP_PORT</code>, whose endpoints
 *     are identified by IP address and port only, instead of <code>GCE_VM_IP_PORT</code>
 */
public record NegFeatures(boolean createHybridNeg) {

  /**
   * Constructor used after parsing a YAML file (or similar) to a Map.
   *
   * <p>The map keys must match the instance variable names in this class.
   *
   * <p>Missing or null flags default to false.
   *
   * @param features NEG feature toggles
   */
  public NegFeatures(@NotNull Map<String, Boolean> features) {
    this(Objects.requireNonNullElse(features.get("createHybridNeg"), Boolean.FALSE));
  }
}
