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

package com.google.examples.neg.controller.events;

import com.google.examples.neg.controller.types.NegEventRecorder;
import io.kubernetes.client.extended.event.EventType;
import io.kubernetes.client.extended.event.legacy.EventRecorder;
import io.kubernetes.client.openapi.models.V1Service;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Records NEG events using the event broadcaster of the Kubernetes Java client. */
public class KubernetesEventRecorder implements NegEventRecorder {
  private static final Logger LOG = LoggerFactory.getLogger(KubernetesEventRecorder.class);

  private final EventRecorder recorder;

  public KubernetesEventRecorder(@NotNull EventRecorder recorder) {
    this.recorder = recorder;
  }

  @Override
  public void event(
      @NotNull V1Service service,
      @NotNull EventType type,
      @NotNull String reason,
      @NotNull String format,
      String... args) {
    LOG.debug("Recording {} event {}: {}", type, reason, String.format(format, (Object[]) args));
    recorder.event(service, type, reason, format, args);
  }
}
