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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Identifies the NEG of one Service port, and how to populate it.
 *
 * @param namespace namespace of the Service
 * @param name name of the Service
 * @param servicePortName human-readable Service port, used in event messages
 * @param targetPort target port of the Service port, either a number or a named container port
 * @param subsetLabels optional label selector that restricts the NEG to a subset of the pods, e.g.,
 *     <code>version=v2</code>. Null or empty disables subset filtering.
 * @param negName name of the NEG in every zone
 */
public record NegSyncerKey(
    @NotNull String namespace,
    @NotNull String name,
    @NotNull String servicePortName,
    @NotNull String targetPort,
    @Nullable String subsetLabels,
    @NotNull String negName) {

  @Override
  public String toString() {
    return "%s/%s-%s-%s".formatted(namespace, name, servicePortName, negName);
  }
}
