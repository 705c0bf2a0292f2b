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
 * Thrown when a successful response carries a body that is not JSON.
 */
public class UnexpectedContentTypeException extends RedfishException {
  private final String contentType;

  public UnexpectedContentTypeException(String contentType) {
    super("unexpected content type " + contentType);
    this.contentType = contentType;
  }

  /**
   * Returns the content type reported by the server.
   *
   * @return the raw {@code Content-Type} header value, or {@code null} if the header was absent
   */
  public String contentType() {
    return contentType;
  }
}
