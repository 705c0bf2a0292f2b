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
package fr.aneo.redfish.client;

import fr.aneo.redfish.client.action.ActionInvoker;
import fr.aneo.redfish.client.exception.RedfishException;
import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.transport.ApacheHttpTransport;
import fr.aneo.redfish.client.transport.RedfishTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The main entry point for interacting with a Redfish management controller.
 * <p>
 * A client is a session bound to one controller: it owns the HTTP connection pool and a private
 * cache of the resources read through it. Resources considered stable for the lifetime of the
 * session (collections, action metadata) are served from that cache; anything whose state
 * changes over time is fetched fresh.
 * <p>
 * A client is meant to be used by a single thread. Waits on jobs and power states block the
 * calling thread.
 * <p>
 * <strong>Resource Management:</strong> This client implements {@link AutoCloseable} and should
 * be used with try-with-resources:
 * <pre>{@code
 * var config = RedfishConfig.builder()
 *   .host("idrac.example.com")
 *   .credentials("root", "calvin")
 *   .build();
 *
 * try (var client = new RedfishClient(config)) {
 *   var jobId = client.services().storage().initializeVolume(volumePath, InitializeType.FAST);
 *   client.services().jobs().waitForJobState(jobId.asString(), JobState.FINISHED, Duration.ofMinutes(10));
 * }
 * }</pre>
 *
 * @see RedfishConfig
 * @see Services
 */
public class RedfishClient implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RedfishClient.class);

  private final RedfishTransport transport;
  private final ResourceCache cache;
  private final ActionInvoker actionInvoker;
  private final Services services;

  /**
   * Constructs a new client for the controller described by {@code config}.
   *
   * @param config the connection configuration
   * @throws NullPointerException if {@code config} is null
   */
  public RedfishClient(RedfishConfig config) {
    this(new ApacheHttpTransport(requireNonNull(config, "config must not be null")), new Poller());
    logger.debug("Created Redfish client for {}", config);
  }

  RedfishClient(RedfishTransport transport, Poller poller) {
    this.transport = requireNonNull(transport, "transport must not be null");
    this.cache = new ResourceCache(transport);
    this.actionInvoker = new ActionInvoker(cache, transport);
    this.services = new DefaultServices(cache, actionInvoker, requireNonNull(poller, "poller must not be null"));
  }

  /**
   * Fetches a resource from the controller and refreshes the session cache with it.
   *
   * @param path an absolute resource path, e.g. {@code /redfish/v1/Systems/System.Embedded.1}
   * @return the resource
   * @throws IllegalArgumentException if {@code path} is not an absolute path
   * @throws RedfishException         if the request fails
   */
  public Resource get(String path) {
    return cache.get(path);
  }

  /**
   * Returns the cached copy of a resource, fetching it on first access.
   *
   * @param path an absolute resource path
   * @return the resource
   * @see #get(String)
   */
  public Resource getCached(String path) {
    return cache.getCached(path);
  }

  /**
   * Invokes a named action on a resource after validating its parameters.
   *
   * @param path       the path of the resource advertising the action
   * @param actionName the action name, e.g. {@code #ComputerSystem.Reset}
   * @param parameters parameter values by name
   * @return the decoded response
   * @see ActionInvoker#invokeAction(String, String, Map)
   */
  public Resource invokeAction(String path, String actionName, Map<String, String> parameters) {
    return actionInvoker.invokeAction(path, actionName, parameters);
  }

  /**
   * @return the service facades of this session
   */
  public Services services() {
    return services;
  }

  /**
   * Closes this client and releases its connections.
   * <p>
   * After calling this method, the client should not be used for any operations.
   */
  @Override
  public void close() {
    transport.close();
  }
}
