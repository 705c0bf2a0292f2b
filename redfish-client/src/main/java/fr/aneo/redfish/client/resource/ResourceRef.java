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
package fr.aneo.redfish.client.resource;

import static java.util.Objects.requireNonNull;

/**
 * Reference to a member of a Redfish collection.
 * <p>
 * Collections list their members as {@code {"@odata.id": "<path>"}} links. A reference keeps
 * the opaque path, which is what the client fetches, together with the short identifier that
 * operators use, derived from the last path segment.
 *
 * @param path the path of the member resource
 * @param id   the short identifier of the member
 */
public record ResourceRef(String path, String id) {

  public ResourceRef {
    requireNonNull(path, "path must not be null");
    requireNonNull(id, "id must not be null");
  }

  /**
   * Creates a reference from a member path, deriving the identifier from its last segment.
   *
   * @param path the member path
   * @return a new reference
   */
  public static ResourceRef of(String path) {
    return new ResourceRef(path, RedfishPaths.lastSegment(path));
  }
}
