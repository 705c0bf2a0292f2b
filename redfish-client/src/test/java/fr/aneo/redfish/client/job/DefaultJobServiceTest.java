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
package fr.aneo.redfish.client.job;

import fr.aneo.redfish.client.exception.RedfishTimeoutException;
import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.resource.ResourceRef;
import fr.aneo.redfish.client.testutils.ManualMonotonicClock;
import fr.aneo.redfish.client.testutils.RedfishTransportMock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static fr.aneo.redfish.client.TestDataFactory.collection;
import static fr.aneo.redfish.client.TestDataFactory.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultJobServiceTest {
  private static final String JOB_1 = RedfishPaths.JOBS + "/JID_100000000001";
  private static final String JOB_2 = RedfishPaths.JOBS + "/JID_100000000002";
  private static final String JOB_3 = RedfishPaths.JOBS + "/JID_100000000003";

  private RedfishTransportMock transport;
  private ManualMonotonicClock clock;
  private DefaultJobService jobService;

  @BeforeEach
  void setUp() {
    transport = new RedfishTransportMock();
    clock = new ManualMonotonicClock();
    jobService = new DefaultJobService(new ResourceCache(transport), new Poller(clock, clock, Duration.ofSeconds(5)));
  }

  @Test
  @DisplayName("should list jobs from the cached jobs collection")
  void should_list_jobs_from_the_cached_jobs_collection() {
    // Given
    transport.onGet(RedfishPaths.JOBS, collection(JOB_1, JOB_2));

    // When
    var first = jobService.listJobs();
    var second = jobService.listJobs();

    // Then
    assertThat(first).extracting(ResourceRef::id).containsExactly("JID_100000000001", "JID_100000000002");
    assertThat(second).isEqualTo(first);
    assertThat(transport.gets(RedfishPaths.JOBS)).hasSize(1);
  }

  @Test
  @DisplayName("should fetch each job fresh when listing details")
  void should_fetch_each_job_fresh_when_listing_details() {
    // Given
    transport.onGet(RedfishPaths.JOBS, collection(JOB_1))
             .onGet(JOB_1, job("JID_100000000001", "Job in progress."), job("JID_100000000001", "Job completed successfully."));

    // When
    var first = jobService.listJobDetails();
    var second = jobService.listJobDetails();

    // Then
    assertThat(jobService.jobState(first.get(0))).isEqualTo(JobState.RUNNING);
    assertThat(jobService.jobState(second.get(0))).isEqualTo(JobState.FINISHED);
    assertThat(transport.gets(JOB_1)).hasSize(2);
  }

  @Test
  @DisplayName("should filter job details by classified state")
  void should_filter_job_details_by_classified_state() {
    // Given
    transport.onGet(RedfishPaths.JOBS, collection(JOB_1, JOB_2, JOB_3))
             .onGet(JOB_1, job("JID_100000000001", "Job completed successfully."))
             .onGet(JOB_2, job("JID_100000000002", "Job failed."))
             .onGet(JOB_3, job("JID_100000000003", "Task successfully scheduled."));

    // When
    var jobs = jobService.listJobDetails(Set.of(JobState.FAILED, JobState.SCHEDULED));

    // Then
    assertThat(jobs).extracting(job -> job.requireString("Id"))
                    .containsExactly("JID_100000000002", "JID_100000000003");
  }

  @Test
  @DisplayName("should resolve bare job ids and job paths to the same job")
  void should_resolve_bare_job_ids_and_job_paths_to_the_same_job() {
    // Given
    transport.onGet(JOB_1, job("JID_100000000001", "Job in progress."));

    // When
    var byId = jobService.getJob("JID_100000000001");
    var byPath = jobService.getJob(JOB_1);

    // Then
    assertThat(byId).isEqualTo(byPath);
    assertThat(byId.path()).isEqualTo(JOB_1);
  }

  @Test
  @DisplayName("should return the job document once the job reaches the wanted state")
  void should_return_the_job_document_once_the_job_reaches_the_wanted_state() {
    // Given
    transport.onGet(JOB_1,
                    job("JID_100000000001", "Task successfully scheduled."),
                    job("JID_100000000001", "Job in progress."),
                    job("JID_100000000001", "Job completed successfully."));

    // When
    var job = jobService.waitForJobState("JID_100000000001", JobState.FINISHED, Duration.ofMinutes(5));

    // Then
    assertThat(job.requireString("Message")).isEqualTo("Job completed successfully.");
    assertThat(transport.gets(JOB_1)).hasSize(3);
    assertThat(clock.sleeps()).isEqualTo(2);
  }

  @Test
  @DisplayName("should time out when the job never reaches the wanted state")
  void should_time_out_when_the_job_never_reaches_the_wanted_state() {
    // Given
    transport.onGet(JOB_1, job("JID_100000000001", "Job in progress."));

    // When / Then
    assertThatThrownBy(() -> jobService.waitForJobState(JOB_1, JobState.FINISHED, Duration.ofSeconds(10)))
      .isInstanceOf(RedfishTimeoutException.class)
      .hasMessageContaining(JOB_1);
    assertThat(transport.gets(JOB_1)).hasSize(3);
  }

  @Test
  @DisplayName("should reject blank job identifiers")
  void should_reject_blank_job_identifiers() {
    assertThatThrownBy(() -> jobService.getJob(" "))
      .isInstanceOf(IllegalArgumentException.class);
    assertThat(transport.requests).isEmpty();
  }
}
