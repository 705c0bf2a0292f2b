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

import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.resource.ResourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

public class DefaultJobService implements JobService {
  private static final Logger logger = LoggerFactory.getLogger(DefaultJobService.class);
  private static final String MESSAGE = "Message";

  private final ResourceCache cache;
  private final Poller poller;

  public DefaultJobService(ResourceCache cache, Poller poller) {
    this.cache = requireNonNull(cache, "cache must not be null");
    this.poller = requireNonNull(poller, "poller must not be null");
  }

  @Override
  public List<ResourceRef> listJobs() {
    return cache.getCached(RedfishPaths.JOBS).members();
  }

  @Override
  public List<Resource> listJobDetails() {
    return listJobs().stream()
                     .map(job -> cache.get(job.path()))
                     .collect(toList());
  }

  @Override
  public List<Resource> listJobDetails(Set<JobState> states) {
    requireNonNull(states, "states must not be null");

    return listJobDetails().stream()
                           .filter(job -> states.contains(jobState(job)))
                           .collect(toList());
  }

  @Override
  public Resource getJob(String jobIdOrPath) {
    return cache.get(RedfishPaths.jobPath(jobIdOrPath));
  }

  @Override
  public JobState jobState(Resource job) {
    requireNonNull(job, "job must not be null");
    return JobState.fromMessage(job.string(MESSAGE).orElse(null));
  }

  @Override
  public Resource waitForJobState(String jobIdOrPath, JobState state, Duration timeout) {
    requireNonNull(state, "state must not be null");
    var path = RedfishPaths.jobPath(jobIdOrPath);

    logger.info("Waiting for job {} to reach state {}", path, state);
    return poller.waitUntil(
      () -> cache.get(path),
      job -> {
        var current = jobState(job);
        logger.debug("want {}, have {}", state, current);
        return current == state;
      },
      timeout,
      "job " + path + " to reach state " + state
    );
  }
}
