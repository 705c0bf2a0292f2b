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
package fr.aneo.redfish.client.transport;

import com.google.gson.JsonObject;
import fr.aneo.redfish.client.exception.OperationFailedException;
import fr.aneo.redfish.client.exception.UnexpectedContentTypeException;
import fr.aneo.redfish.client.resource.Resource;

/**
 * Authenticated request/response layer over the Redfish REST API.
 * <p>
 * A transport is bound to one management controller endpoint and one set of credentials. It
 * accepts absolute but unqualified resource paths (e.g. {@code /redfish/v1/Systems/System.Embedded.1})
 * and refuses fully qualified URLs: it is not a general purpose HTTP client.
 * <p>
 * Responses are decoded into {@link Resource} instances carrying the response {@code Location}
 * header. A transport performs no caching; see {@link fr.aneo.redfish.client.resource.ResourceCache}.
 */
public interface RedfishTransport extends AutoCloseable {

  /**
   * Sends a request and decodes the JSON response.
   *
   * @param method  the HTTP method
   * @param path    an absolute, unqualified resource path
   * @param payload the JSON body to send, or {@code null} for none
   * @return the decoded response; an empty body decodes to an empty resource
   * @throws IllegalArgumentException       if {@code path} is a fully qualified URL or is not absolute
   * @throws OperationFailedException       if the server answers with a non-2xx status
   * @throws UnexpectedContentTypeException if a successful response is not JSON
   * @throws fr.aneo.redfish.client.exception.RedfishException if the request cannot be performed
   */
  Resource request(HttpMethod method, String path, JsonObject payload);

  /**
   * Fetches a resource with a {@code GET} request.
   *
   * @param path an absolute, unqualified resource path
   * @return the decoded resource
   */
  default Resource fetch(String path) {
    return request(HttpMethod.GET, path, null);
  }

  /**
   * Sends a JSON payload with a {@code POST} request, as used to invoke actions.
   *
   * @param path    the action target path
   * @param payload the JSON body
   * @return the decoded response, whose {@link Resource#location()} holds any created resource path
   */
  default Resource invoke(String path, JsonObject payload) {
    return request(HttpMethod.POST, path, payload);
  }

  /**
   * Releases the underlying connections.
   */
  @Override
  void close();
}
