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
package fr.aneo.redfish.client.action;

import com.google.gson.JsonObject;
import fr.aneo.redfish.client.exception.ActionNotFoundException;
import fr.aneo.redfish.client.exception.InvalidParameterValueException;
import fr.aneo.redfish.client.exception.UnknownParameterException;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.transport.RedfishTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Invokes named actions on Redfish resources after validating their parameters.
 * <p>
 * The action metadata is read from the cached copy of the resource: it is considered stable for
 * the lifetime of a session. Every supplied parameter is checked against the values the resource
 * advertises for it, and an invalid invocation fails before any request is posted, so operator
 * mistakes are reported immediately and never retried.
 */
public final class ActionInvoker {
  private static final Logger logger = LoggerFactory.getLogger(ActionInvoker.class);

  private final ResourceCache cache;
  private final RedfishTransport transport;

  public ActionInvoker(ResourceCache cache, RedfishTransport transport) {
    this.cache = requireNonNull(cache, "cache must not be null");
    this.transport = requireNonNull(transport, "transport must not be null");
  }

  /**
   * Invokes an action on a resource.
   *
   * @param path       the path of the resource advertising the action
   * @param actionName the action name, e.g. {@code #Manager.Reset}
   * @param parameters parameter values by name; may be empty
   * @return the decoded response, whose {@link Resource#location()} holds the path of any created job
   * @throws ActionNotFoundException        if the resource does not advertise {@code actionName}
   * @throws UnknownParameterException      if a parameter is not advertised for the action
   * @throws InvalidParameterValueException if a value is not among the advertised allowed values
   */
  public Resource invokeAction(String path, String actionName, Map<String, String> parameters) {
    requireNonNull(path, "path must not be null");
    requireNonNull(actionName, "actionName must not be null");
    requireNonNull(parameters, "parameters must not be null");

    logger.debug("trying to execute action {} on {}", actionName, path);
    var resource = cache.getCached(path);
    var action = ActionDescriptor.find(resource, actionName)
                                 .orElseThrow(() -> new ActionNotFoundException(path, actionName));

    var payload = new JsonObject();
    parameters.forEach((name, value) -> {
      var allowed = action.allowedValues(name)
                          .orElseThrow(() -> new UnknownParameterException(actionName, name));
      if (!allowed.contains(value)) {
        throw new InvalidParameterValueException(name, value, allowed);
      }
      payload.addProperty(name, value);
    });

    logger.info("Executing {} on {} with {}", actionName, path, parameters);
    return transport.invoke(action.target(), payload);
  }
}
