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

import io.kubernetes.client.extended.event.EventType;
import io.kubernetes.client.openapi.models.V1Service;
import org.jetbrains.annotations.NotNull;

/** Records Kubernetes events about NEG lifecycle changes on the owning Service. */
public interface NegEventRecorder {

  /**
   * Records an event. Fire and forget, failures are not reported to the caller.
   *
   * @param format message format, see {@link String#format(String, Object...)}
   */
  void event(
      @NotNull V1Service service,
      @NotNull EventType type,
      @NotNull String reason,
      @NotNull String format,
      String... args);
}
