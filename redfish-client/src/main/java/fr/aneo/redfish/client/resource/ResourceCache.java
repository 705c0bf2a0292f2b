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

import fr.aneo.redfish.client.transport.RedfishTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Per-session cache of the last fetched representation of each resource.
 * <p>
 * Resources describing point-in-time state (the system, jobs) are read with {@link #get(String)},
 * which always goes to the network. Resources that do not change during a session (storage
 * topology, action metadata) are read with {@link #getCached(String)} to avoid redundant round
 * trips during multi-step operations.
 * <p>
 * Entries are only created or replaced by a fetch and never expire; choosing between the two
 * access modes is the caller's decision.
 * <p>
 * This class is not thread-safe. A cache belongs to a single client instance used by one caller
 * at a time.
 */
public final class ResourceCache {
  private static final Logger logger = LoggerFactory.getLogger(ResourceCache.class);

  private final RedfishTransport transport;
  private final Map<String, Resource> entries = new HashMap<>();

  public ResourceCache(RedfishTransport transport) {
    this.transport = requireNonNull(transport, "transport must not be null");
  }

  /**
   * Fetches a resource and stores it, replacing any cached copy.
   * <p>
   * Always performs exactly one request.
   *
   * @param path the resource path
   * @return the freshly fetched resource
   */
  public Resource get(String path) {
    logger.debug("get {}", path);
    var resource = transport.fetch(path);
    entries.put(path, resource);
    return resource;
  }

  /**
   * Returns the cached copy of a resource, fetching and storing it on a miss.
   * <p>
   * Performs zero or one request.
   *
   * @param path the resource path
   * @return the cached or freshly fetched resource
   */
  public Resource getCached(String path) {
    var cached = entries.get(path);
    if (cached != null) {
      logger.debug("get {} from cache", path);
      return cached;
    }
    return get(path);
  }
}
