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

import fr.aneo.redfish.client.resource.RedfishPaths;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable identifier of a controller job, such as {@code JID_123456789012}.
 * <p>
 * Job identifiers are assigned by the controller when an action schedules work and are reported
 * as the last segment of the job path in the response {@code Location} header.
 *
 * @see JobService
 */
public final class JobId {
  private final String id;

  private JobId(String id) {
    this.id = id;
  }

  /**
   * Returns the string representation of this job identifier.
   *
   * @return the job identifier as a string
   */
  public String asString() {
    return id;
  }

  /**
   * Returns the path of the job resource.
   *
   * @return the job path under the jobs collection
   */
  public String path() {
    return RedfishPaths.jobPath(id);
  }

  /**
   * Creates a job identifier from the given string.
   *
   * @param id the identifier assigned by the controller
   * @return a new JobId instance wrapping the given identifier
   * @throws NullPointerException if id is null
   */
  public static JobId from(String id) {
    return new JobId(requireNonNull(id, "id must not be null"));
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (JobId) obj;
    return Objects.equals(this.id, that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "JobId{" +
      "id='" + id + '\'' +
      '}';
  }
}
