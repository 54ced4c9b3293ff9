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

import static com.google.examples.neg.controller.testing.TestObjects.NAMESPACE;
import static com.google.examples.neg.controller.testing.TestObjects.SERVICE;
import static com.google.examples.neg.controller.testing.TestObjects.service;
import static org.junit.jupiter.api.Assertions.*;

import com.google.cloud.compute.v1.NetworkEndpointGroup;
import com.google.examples.neg.controller.syncers.NegEnsurer.Outcome;
import com.google.examples.neg.controller.testing.FakeNetworkEndpointGroupCloud;
import com.google.examples.neg.controller.testing.RecordingEventRecorder;
import com.google.examples.neg.controller.testing.RecordingEventRecorder.Event;
import com.google.examples.neg.controller.types.CloudException;
import io.kubernetes.client.extended.event.EventType;
import io.kubernetes.client.informer.cache.Cache;
import io.kubernetes.client.openapi.models.V1Service;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link NegEnsurer}. */
public class NegEnsurerTest {

  private static final String NEG = "k8s1-greeter-neg";
  private static final String ZONE = "us-central1-a";
  private static final String PORT_NAME = "ns/greeter:80";

  private FakeNetworkEndpointGroupCloud cloud;
  private Cache<V1Service> serviceStore;
  private RecordingEventRecorder recorder;
  private NegEnsurer ensurer;

  @BeforeEach
  void setUp() {
    cloud = new FakeNetworkEndpointGroupCloud();
    serviceStore = new Cache<>();
    serviceStore.add(service());
    recorder = new RecordingEventRecorder();
    ensurer = new NegEnsurer(cloud, serviceStore, recorder, false);
  }

  private Outcome ensure() {
    return ensurer.ensureNetworkEndpointGroup(NAMESPACE, SERVICE, NEG, ZONE, PORT_NAME);
  }

  @Test
  void createsMissingNeg() {
    assertEquals(Outcome.CREATED, ensure());

    NetworkEndpointGroup neg = cloud.neg(NEG, ZONE);
    assertNotNull(neg);
    assertEquals(NEG, neg.getName());
    assertEquals("GCE_VM_IP_PORT", neg.getNetworkEndpointType());
    assertEquals(FakeNetworkEndpointGroupCloud.NETWORK_URL, neg.getNetwork());
    assertEquals(FakeNetworkEndpointGroupCloud.SUBNETWORK_URL, neg.getSubnetwork());
    assertEquals(
        List.of(
            new Event(
                NAMESPACE + "/" + SERVICE,
                EventType.Normal,
                "Create",
                "Created NEG \"k8s1-greeter-neg\" for ns/greeter:80 in \"us-central1-a\".")),
        recorder.events);
  }

  @Test
  void idempotent() {
    assertEquals(Outcome.CREATED, ensure());
    assertEquals(Outcome.UNCHANGED, ensure());
    assertEquals(Outcome.UNCHANGED, ensure());
    assertEquals(1, cloud.createCalls);
    assertEquals(0, cloud.deleteCalls);
    assertEquals(1, recorder.events.size());
  }

  @Test
  void matchingNegWithFullUrlsIsUnchanged() {
    cloud.put(
        NetworkEndpointGroup.newBuilder()
            .setName(NEG)
            .setNetwork(
                "https://www.googleapis.com/compute/v1/"
                    + FakeNetworkEndpointGroupCloud.NETWORK_URL)
            .setSubnetwork(
                "https://www.googleapis.com/compute/v1/"
                    + FakeNetworkEndpointGroupCloud.SUBNETWORK_URL)
            .build(),
        ZONE);

    assertEquals(Outcome.UNCHANGED, ensure());
    assertEquals(0, cloud.createCalls);
    assertTrue(recorder.events.isEmpty());
  }

  @Test
  void recreatesNegInWrongSubnetwork() {
    cloud.put(
        NetworkEndpointGroup.newBuilder()
            .setName(NEG)
            .setNetwork(FakeNetworkEndpointGroupCloud.NETWORK_URL)
            .setSubnetwork("projects/test-project/regions/us-central1/subnetworks/other")
            .build(),
        ZONE);

    assertEquals(Outcome.RECREATED, ensure());

    assertEquals(1, cloud.deleteCalls);
    assertEquals(1, cloud.createCalls);
    assertEquals(
        FakeNetworkEndpointGroupCloud.SUBNETWORK_URL, cloud.neg(NEG, ZONE).getSubnetwork());
    assertEquals(2, recorder.events.size());
    assertEquals("Delete", recorder.events.get(0).reason());
    assertEquals(
        "Deleted NEG \"k8s1-greeter-neg\" for ns/greeter:80 in \"us-central1-a\".",
        recorder.events.get(0).message());
    assertEquals("Create", recorder.events.get(1).reason());
  }

  @Test
  void recreatesNegInWrongNetwork() {
    cloud.put(
        NetworkEndpointGroup.newBuilder()
            .setName(NEG)
            .setNetwork("projects/test-project/global/networks/other")
            .setSubnetwork(FakeNetworkEndpointGroupCloud.SUBNETWORK_URL)
            .build(),
        ZONE);

    assertEquals(Outcome.RECREATED, ensure());
    assertEquals(FakeNetworkEndpointGroupCloud.NETWORK_URL, cloud.neg(NEG, ZONE).getNetwork());
    assertEquals(Outcome.UNCHANGED, ensure());
  }

  @Test
  void getErrorIsTreatedAsMissing() {
    cloud.getError = new CloudException("permission denied");
    assertEquals(Outcome.CREATED, ensure());
    assertEquals(1, cloud.createCalls);
  }

  @Test
  void createErrorPropagates() {
    cloud.createError = new CloudException("quota exceeded");
    assertThrows(CloudException.class, this::ensure);
    assertTrue(recorder.events.isEmpty());
  }

  @Test
  void deleteErrorPropagatesWithoutCreate() {
    cloud.put(NetworkEndpointGroup.newBuilder().setName(NEG).build(), ZONE);
    cloud.deleteError = new CloudException("resource in use");

    assertThrows(CloudException.class, this::ensure);
    assertEquals(0, cloud.createCalls);
  }

  @Test
  void crashAfterDeleteIsRecoveredByNextCall() {
    cloud.put(NetworkEndpointGroup.newBuilder().setName(NEG).build(), ZONE);
    cloud.createError = new CloudException("interrupted");
    assertThrows(CloudException.class, this::ensure);
    assertNull(cloud.neg(NEG, ZONE));

    cloud.createError = null;
    assertEquals(Outcome.CREATED, ensure());
    assertNotNull(cloud.neg(NEG, ZONE));
  }

  @Test
  void hybridNegHasNoSubnetwork() {
    var hybridEnsurer = new NegEnsurer(cloud, serviceStore, recorder, true);

    assertEquals(
        Outcome.CREATED,
        hybridEnsurer.ensureNetworkEndpointGroup(NAMESPACE, SERVICE, NEG, ZONE, PORT_NAME));
    NetworkEndpointGroup neg = cloud.neg(NEG, ZONE);
    assertEquals("NON_GCP_PRIVATE_IP_PORT", neg.getNetworkEndpointType());
    assertEquals("", neg.getSubnetwork());

    assertEquals(
        Outcome.UNCHANGED,
        hybridEnsurer.ensureNetworkEndpointGroup(NAMESPACE, SERVICE, NEG, ZONE, PORT_NAME));
  }

  @Test
  void noEventsWithoutRecorderOrService() {
    var withoutRecorder = new NegEnsurer(cloud, serviceStore, null, false);
    assertEquals(
        Outcome.CREATED,
        withoutRecorder.ensureNetworkEndpointGroup(NAMESPACE, SERVICE, NEG, ZONE, PORT_NAME));

    assertEquals(
        Outcome.CREATED,
        ensurer.ensureNetworkEndpointGroup(
            NAMESPACE, "deleted-service", NEG, "us-central1-b", PORT_NAME));
    assertTrue(recorder.events.isEmpty());
  }
}
