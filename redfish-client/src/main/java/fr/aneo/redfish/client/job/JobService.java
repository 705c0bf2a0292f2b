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
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceRef;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Service API to inspect and wait for controller jobs.
 * <p>
 * Jobs are identified either by a bare identifier ({@code JID_123456}) or by their full path;
 * every method accepting a job identifier accepts both forms. Job documents are always fetched
 * fresh since their status changes over time.
 *
 * @see JobState
 */
public interface JobService {

  /**
   * Lists the jobs known to the controller.
   *
   * @return references to the members of the jobs collection
   */
  List<ResourceRef> listJobs();

  /**
   * Lists the jobs known to the controller with their full documents.
   *
   * @return the job documents, each freshly fetched
   */
  List<Resource> listJobDetails();

  /**
   * Lists the jobs whose classified state is one of {@code states}.
   *
   * @param states the states to keep
   * @return the matching job documents, each freshly fetched
   */
  List<Resource> listJobDetails(Set<JobState> states);

  /**
   * Fetches a job.
   *
   * @param jobIdOrPath a bare job id or the path of a job
   * @return the job document
   */
  Resource getJob(String jobIdOrPath);

  /**
   * Classifies a job document from its {@code Message} field.
   *
   * @param job a job document
   * @return the job state; {@link JobState#UNKNOWN} when the message is missing or unrecognized
   */
  JobState jobState(Resource job);

  /**
   * Waits until a job reaches a state.
   *
   * @param jobIdOrPath a bare job id or the path of a job
   * @param state       the state to wait for
   * @param timeout     the maximum time to wait, or {@code null} to wait without bound
   * @return the job document that reported {@code state}
   * @throws RedfishTimeoutException if the job does not reach {@code state} in time
   */
  Resource waitForJobState(String jobIdOrPath, JobState state, Duration timeout);
}
