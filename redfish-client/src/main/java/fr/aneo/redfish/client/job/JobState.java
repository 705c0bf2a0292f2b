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

import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * State of a controller job, derived from its free-text status message.
 * <p>
 * The controller does not report a machine-readable state for every job type, only a
 * human-readable {@code Message}. The message is classified as follows, in priority order:
 * <ol>
 *   <li>a message containing "failed", in any case, is {@link #FAILED}: failure messages are
 *       free text and do not follow the fixed vocabulary of the other states;</li>
 *   <li>a message equal to one of the entries of the message table maps to that entry's state;</li>
 *   <li>any other message, or no message at all, is {@link #UNKNOWN}.</li>
 * </ol>
 * The set of messages emitted by controllers is externally controlled; new messages fall into
 * {@link #UNKNOWN} until added to the table.
 */
public enum JobState {
  UNKNOWN,
  SCHEDULED,
  RUNNING,
  FINISHED,
  FAILED;

  private static final String FAILED_MARKER = "failed";

  private static final Map<String, JobState> MESSAGES = Map.of(
    "Task successfully scheduled.", SCHEDULED,
    "Job in progress.", RUNNING,
    "Job completed successfully.", FINISHED
  );

  /**
   * Classifies a job status message.
   *
   * @param message the job's {@code Message} field; may be {@code null}
   * @return the job state; never {@code null}
   */
  public static JobState fromMessage(String message) {
    if (message == null) return UNKNOWN;
    if (message.toLowerCase(Locale.ROOT).contains(FAILED_MARKER)) return FAILED;

    return MESSAGES.getOrDefault(message, UNKNOWN);
  }

  /**
   * Parses a state name as typed by an operator, ignoring case (e.g. {@code "finished"}).
   *
   * @param name the state name
   * @return the matching state
   * @throws IllegalArgumentException if no state has this name
   */
  public static JobState fromName(String name) {
    requireNonNull(name, "name must not be null");
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown job state: " + name, e);
    }
  }
}
