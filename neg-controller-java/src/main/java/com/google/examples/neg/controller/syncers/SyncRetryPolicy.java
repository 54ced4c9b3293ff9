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

import com.google.examples.neg.controller.types.NegSyncerKey;
import io.kubernetes.client.extended.workqueue.ratelimiter.ItemExponentialFailureRateLimiter;
import io.kubernetes.client.extended.workqueue.ratelimiter.RateLimiter;
import java.time.Duration;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff for failed NEG syncs, per NEG.
 *
 * <p>Each NEG is retried at most {@link #MAX_RETRIES} times, following the kube-controller-manager
 * convention. After that the failure is handed back to the caller for reporting.
 */
public class SyncRetryPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(SyncRetryPolicy.class);

  public static final int MAX_RETRIES = 15;
  public static final Duration MIN_RETRY_DELAY = Duration.ofSeconds(5);
  public static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(600);

  private final RateLimiter<NegSyncerKey> rateLimiter;

  public SyncRetryPolicy() {
    this(new ItemExponentialFailureRateLimiter<>(MIN_RETRY_DELAY, MAX_RETRY_DELAY));
  }

  SyncRetryPolicy(@NotNull RateLimiter<NegSyncerKey> rateLimiter) {
    this.rateLimiter = rateLimiter;
  }

  /**
   * Records a failed sync.
   *
   * @return the delay before the next attempt, or an empty Optional if the retry budget of the NEG
   *     is exhausted. In that case the failure count is reset.
   */
  @NotNull
  public Optional<Duration> onFailure(@NotNull NegSyncerKey key, @Nullable Throwable error) {
    int retries = rateLimiter.numRequeues(key);
    if (retries >= MAX_RETRIES) {
      LOG.error("Dropping NEG {} out of the queue after {} retries", key, retries, error);
      rateLimiter.forget(key);
      return Optional.empty();
    }
    Duration delay = rateLimiter.when(key);
    LOG.warn(
        "Failed to sync NEG {}, retry {}/{} in {}", key, retries + 1, MAX_RETRIES, delay, error);
    return Optional.of(delay);
  }

  /** Resets the failure count of the NEG. */
  public void onSuccess(@NotNull NegSyncerKey key) {
    rateLimiter.forget(key);
  }

  /** Number of failures since the last success or exhaustion. */
  public int retries(@NotNull NegSyncerKey key) {
    return rateLimiter.numRequeues(key);
  }
}
