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

/** Namespace and name of a Kubernetes object, e.g., a Pod. */
public record NamespacedName(@NotNull String namespace, @NotNull String name) {

  /** Returns the informer cache key, in the format <code>namespace/name</code>. */
  @NotNull
  public String key() {
    return key(namespace, name);
  }

  @NotNull
  public static String key(@NotNull String namespace, @NotNull String name) {
    return namespace + "/" + name;
  }

  @Override
  public String toString() {
    return key();
  }
}
