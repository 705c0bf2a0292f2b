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
package fr.aneo.redfish.client.exception;

import java.time.Duration;

/**
 * Thrown when a wait does not observe the expected state before its deadline.
 * <p>
 * This is distinct from an operation failure: the controller accepted the request, but the
 * managed resource did not reach the requested state in time and may still be transitioning.
 */
public class RedfishTimeoutException extends RedfishException {
  private final Duration timeout;

  public RedfishTimeoutException(String message, Duration timeout) {
    super(message);
    this.timeout = timeout;
  }

  /**
   * @return the timeout that was exceeded
   */
  public Duration timeout() {
    return timeout;
  }
}
