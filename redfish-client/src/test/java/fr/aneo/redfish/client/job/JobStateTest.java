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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateTest {

  @ParameterizedTest
  @CsvSource({
    "'Task successfully scheduled.', SCHEDULED",
    "'Job in progress.',             RUNNING",
    "'Job completed successfully.',  FINISHED"
  })
  @DisplayName("should classify known job messages")
  void should_classify_known_job_messages(String message, JobState expected) {
    assertThat(JobState.fromMessage(message)).isEqualTo(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "Job failed.",
    "Failed to initialize virtual disk.",
    "Task successfully scheduled. Job FAILED later.",
    "Job completed successfully but some steps failed"
  })
  @DisplayName("should classify any message mentioning failure as failed")
  void should_classify_any_message_mentioning_failure_as_failed(String message) {
    assertThat(JobState.fromMessage(message)).isEqualTo(JobState.FAILED);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"Job completed successfully", "job in progress.", "Scheduled", "New"})
  @DisplayName("should classify missing or unrecognized messages as unknown")
  void should_classify_missing_or_unrecognized_messages_as_unknown(String message) {
    assertThat(JobState.fromMessage(message)).isEqualTo(JobState.UNKNOWN);
  }

  @Test
  @DisplayName("should parse state names ignoring case")
  void should_parse_state_names_ignoring_case() {
    assertThat(JobState.fromName("finished")).isEqualTo(JobState.FINISHED);
    assertThat(JobState.fromName("Running")).isEqualTo(JobState.RUNNING);
    assertThat(JobState.fromName(" FAILED ")).isEqualTo(JobState.FAILED);
  }

  @Test
  @DisplayName("should reject unknown state names")
  void should_reject_unknown_state_names() {
    assertThatThrownBy(() -> JobState.fromName("completed"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("completed");
  }
}
