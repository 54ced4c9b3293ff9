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

import com.google.examples.neg.controller.labels.LabelSelector;
import com.google.examples.neg.controller.labels.LabelSelectorException;
import com.google.examples.neg.controller.types.NamespacedName;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.models.V1Pod;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether pods should be represented in a NEG.
 *
 * <p>Both filters fail closed: a pod that cannot be found, or a selector that cannot be parsed,
 * excludes the pod rather than failing the reconciliation of the whole NEG.
 */
public final class PodFilters {
  private static final Logger LOG = LoggerFactory.getLogger(PodFilters.class);

  private PodFilters() {}

  /** Returns true if the pod exists and is not in graceful termination. */
  public static boolean shouldPodBeInNeg(
      @Nullable Indexer<V1Pod> podStore, @NotNull String namespace, @NotNull String name) {
    V1Pod pod = getPod(podStore, namespace, name);
    if (pod == null) {
      return false;
    }
    // A deletion timestamp means the pod is in graceful termination.
    return pod.getMetadata() == null || pod.getMetadata().getDeletionTimestamp() == null;
  }

  /**
   * Returns true if the pod exists and its labels match the subset selector.
   *
   * <p>Callers skip this check when subset filtering is disabled, as the empty selector matches
   * every pod.
   */
  public static boolean shouldPodBeInSubset(
      @Nullable Indexer<V1Pod> podStore,
      @NotNull String namespace,
      @NotNull String name,
      @NotNull String subsetLabels) {
    V1Pod pod = getPod(podStore, namespace, name);
    if (pod == null) {
      return false;
    }
    LabelSelector selector;
    try {
      selector = LabelSelector.parse(subsetLabels);
    } catch (LabelSelectorException e) {
      LOG.error("Failed to parse the subset selector [{}]", subsetLabels, e);
      return false;
    }
    return selector.matches(pod.getMetadata() == null ? null : pod.getMetadata().getLabels());
  }

  @Nullable
  private static V1Pod getPod(
      @Nullable Indexer<V1Pod> podStore, @NotNull String namespace, @NotNull String name) {
    if (podStore == null) {
      return null;
    }
    String key = NamespacedName.key(namespace, name);
    try {
      return podStore.getByKey(key);
    } catch (RuntimeException e) {
      LOG.error("Failed to retrieve pod {} from pod store", key, e);
      return null;
    }
  }
}
