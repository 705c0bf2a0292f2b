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

/**
 * Base exception for all errors raised by the Redfish client.
 * <p>
 * Every failure surfaced by the client, whether detected locally before a request is sent or
 * reported by the management controller, is an instance of this unchecked exception. Callers
 * that only need to know that an operation failed can catch this type; callers that report
 * different outcomes (for instance "failed" versus "did not complete in time") catch the
 * dedicated subclasses.
 */
public class RedfishException extends RuntimeException {

  /**
   * Creates a new Redfish exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public RedfishException(String message) {
    super(message);
  }

  /**
   * Creates a new Redfish exception with the specified error message and cause.
   * <p>
   * This constructor is typically used to wrap lower-level exceptions
   * with additional context about the Redfish operation that failed.
   * </p>
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause the underlying cause of this exception; may be {@code null}
   */
  public RedfishException(String message, Throwable cause) {
    super(message, cause);
  }
}
