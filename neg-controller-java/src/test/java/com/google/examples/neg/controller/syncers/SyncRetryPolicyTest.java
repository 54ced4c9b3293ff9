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

import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.neg.controller.types.CloudException;
import com.google.examples.neg.controller.types.NegSyncerKey;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for {@link SyncRetryPolicy}. */
public class SyncRetryPolicyTest {

  private static final NegSyncerKey KEY =
      new NegSyncerKey("ns", "greeter", "ns/greeter:80", "http", null, "k8s1-greeter-neg");
  private static final NegSyncerKey OTHER_KEY =
      new NegSyncerKey("ns", "other", "ns/other:80", "8080", null, "k8s1-other-neg");

  private static final RuntimeException ERROR = new CloudException("backend unavailable");

  @Test
  void exponentialBackoff() {
    var policy = new SyncRetryPolicy();
    assertEquals(Optional.of(Duration.ofSeconds(5)), policy.onFailure(KEY, ERROR));
    assertEquals(Optional.of(Duration.ofSeconds(10)), policy.onFailure(KEY, ERROR));
    assertEquals(Optional.of(Duration.ofSeconds(20)), policy.onFailure(KEY, ERROR));
    assertEquals(3, policy.retries(KEY));
  }

  @Test
  void delayIsCapped() {
    var policy = new SyncRetryPolicy();
    for (int i = 0; i < SyncRetryPolicy.MAX_RETRIES; i++) {
      Duration delay = policy.onFailure(KEY, ERROR).orElseThrow();
      assertTrue(delay.compareTo(SyncRetryPolicy.MIN_RETRY_DELAY) >= 0);
      assertTrue(delay.compareTo(SyncRetryPolicy.MAX_RETRY_DELAY) <= 0);
    }
  }

  @Test
  void givesUpAfterMaxRetries() {
    var policy = new SyncRetryPolicy();
    for (int i = 0; i < SyncRetryPolicy.MAX_RETRIES; i++) {
      assertTrue(policy.onFailure(KEY, ERROR).isPresent(), "retry " + i);
    }
    assertEquals(Optional.empty(), policy.onFailure(KEY, ERROR));
    assertEquals(0, policy.retries(KEY));
    assertEquals(Optional.of(Duration.ofSeconds(5)), policy.onFailure(KEY, ERROR));
  }

  @Test
  void successResetsBackoff() {
    var policy = new SyncRetryPolicy();
    policy.onFailure(KEY, ERROR);
    policy.onFailure(KEY, ERROR);
    policy.onSuccess(KEY);
    assertEquals(0, policy.retries(KEY));
    assertEquals(Optional.of(Duration.ofSeconds(5)), policy.onFailure(KEY, null));
  }

  @Test
  void negsAreTrackedSeparately() {
    var policy = new SyncRetryPolicy();
    policy.onFailure(KEY, ERROR);
    policy.onFailure(KEY, ERROR);
    assertEquals(Optional.of(Duration.ofSeconds(5)), policy.onFailure(OTHER_KEY, ERROR));
    assertEquals(2, policy.retries(KEY));
    assertEquals(1, policy.retries(OTHER_KEY));
  }
}
