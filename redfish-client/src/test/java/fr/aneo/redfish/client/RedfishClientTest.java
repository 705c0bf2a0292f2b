/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.redfish.client;

import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.job.JobState;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.storage.InitializeType;
import fr.aneo.redfish.client.testutils.ManualMonotonicClock;
import fr.aneo.redfish.client.testutils.RedfishTransportMock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static fr.aneo.redfish.client.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class RedfishClientTest {
  private static final String VOLUME = volumePath(CONTROLLER_1, "Disk.Virtual.0:RAID.Integrated.1-1");

  private RedfishTransportMock transport;
  private RedfishClient client;

  @BeforeEach
  void setUp() {
    transport = new RedfishTransportMock();
    var clock = new ManualMonotonicClock();
    client = new RedfishClient(transport, new Poller(clock, clock, Duration.ofSeconds(5)));
  }

  @Test
  @DisplayName("should share one resource cache between generic and service accessors")
  void should_share_one_resource_cache_between_generic_and_service_accessors() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"));

    // When
    client.get(RedfishPaths.SYSTEM);
    client.getCached(RedfishPaths.SYSTEM);
    client.services().system().resetSystem("GracefulRestart");

    // Then
    assertThat(transport.gets(RedfishPaths.SYSTEM)).hasSize(1);
    assertThat(transport.posts()).hasSize(1);
  }

  @Test
  @DisplayName("should invoke actions by name")
  void should_invoke_actions_by_name() {
    // Given
    transport.onGet(RedfishPaths.MANAGER, manager());

    // When
    client.invokeAction(RedfishPaths.MANAGER, "#Manager.Reset", Map.of("ResetType", "GracefulRestart"));

    // Then
    assertThat(transport.posts()).singleElement()
                                 .satisfies(post -> assertThat(post.path()).isEqualTo(RedfishPaths.MANAGER + "/Actions/Manager.Reset"));
  }

  @Test
  @DisplayName("should initialize a volume and wait for its job to finish")
  void should_initialize_a_volume_and_wait_for_its_job_to_finish() {
    // Given
    transport.onGet(VOLUME, volume(VOLUME, "os"))
             .onPost(VOLUME + "/Actions/Volume.Initialize", RedfishPaths.JOBS + "/JID_471269252011")
             .onGet(RedfishPaths.JOBS + "/JID_471269252011",
                    job("JID_471269252011", "Task successfully scheduled."),
                    job("JID_471269252011", "Job in progress."),
                    job("JID_471269252011", "Job completed successfully."));

    // When
    var jobId = client.services().storage().initializeVolume(VOLUME, InitializeType.FAST);
    var job = client.services().jobs().waitForJobState(jobId.asString(), JobState.FINISHED, Duration.ofMinutes(10));

    // Then
    assertThat(jobId.path()).isEqualTo(RedfishPaths.JOBS + "/JID_471269252011");
    assertThat(client.services().jobs().jobState(job)).isEqualTo(JobState.FINISHED);
  }

  @Test
  @DisplayName("should close the transport")
  void should_close_the_transport() {
    // When
    client.close();

    // Then
    assertThat(transport.closed).isTrue();
  }
}
