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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when the management controller answers a request with an HTTP error status.
 * <p>
 * Redfish services describe failures in an {@code error} object whose
 * {@code @Message.ExtendedInfo} array holds one entry per problem. Those entries are exposed,
 * in the order given by the server, through {@link #errors()}. When the response has no body,
 * or the body cannot be parsed, the list is empty and only the HTTP context is available.
 */
public class OperationFailedException extends RedfishException {
  private final String method;
  private final String path;
  private final int statusCode;
  private final String responseBody;
  private final List<ExtendedMessage> errors;

  public OperationFailedException(String method, String path, int statusCode, String responseBody, List<ExtendedMessage> errors) {
    super(statusCode + " error for " + method + " " + path);
    this.method = method;
    this.path = path;
    this.statusCode = statusCode;
    this.responseBody = responseBody == null ? "" : responseBody;
    this.errors = List.copyOf(requireNonNull(errors, "errors must not be null"));
  }

  /**
   * @return the HTTP method of the failed request
   */
  public String method() {
    return method;
  }

  /**
   * @return the resource path of the failed request
   */
  public String path() {
    return path;
  }

  /**
   * @return the HTTP status code returned by the server
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * @return the raw response body, empty if the server sent none
   */
  public String responseBody() {
    return responseBody;
  }

  /**
   * Returns the vendor messages describing the failure.
   *
   * @return an immutable list of messages in server order; never {@code null}, possibly empty
   */
  public List<ExtendedMessage> errors() {
    return errors;
  }

  /**
   * One entry of a Redfish {@code @Message.ExtendedInfo} array.
   *
   * @param messageId the registry message identifier (e.g. {@code Base.1.8.PropertyValueNotInList})
   * @param message   the human-readable message
   */
  public record ExtendedMessage(String messageId, String message) {
  }
}
