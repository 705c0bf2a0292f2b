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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import fr.aneo.redfish.client.exception.RedfishException;
import fr.aneo.redfish.client.resource.Resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Description of an action advertised by a resource.
 * <p>
 * Redfish resources list their actions under the {@code Actions} field. Each entry names the
 * target path to post to and, for each parameter, the values the server currently accepts:
 * <pre>{@code
 * "Actions": {
 *   "#ComputerSystem.Reset": {
 *     "target": "/redfish/v1/Systems/System.Embedded.1/Actions/ComputerSystem.Reset",
 *     "ResetType@Redfish.AllowableValues": ["On", "ForceOff", "GracefulShutdown"]
 *   }
 * }
 * }</pre>
 * The allowed values are server supplied and may vary with the controller firmware, so they are
 * read from each fetched resource rather than declared statically.
 *
 * @param name            the action name, e.g. {@code #ComputerSystem.Reset}
 * @param target          the path the action is posted to
 * @param allowableValues allowed values per parameter name
 */
public record ActionDescriptor(String name, String target, Map<String, Set<String>> allowableValues) {
  private static final String ACTIONS = "Actions";
  private static final String TARGET = "target";
  private static final String ALLOWABLE_VALUES_SUFFIX = "@Redfish.AllowableValues";

  public ActionDescriptor {
    requireNonNull(name, "name must not be null");
    requireNonNull(target, "target must not be null");
    allowableValues = Collections.unmodifiableMap(new LinkedHashMap<>(allowableValues));
  }

  /**
   * Looks up an action in the metadata of a resource.
   *
   * @param resource the resource advertising the action
   * @param name     the action name
   * @return the descriptor, or empty if the resource does not advertise the action
   * @throws RedfishException if the action entry is malformed
   */
  public static Optional<ActionDescriptor> find(Resource resource, String name) {
    requireNonNull(resource, "resource must not be null");
    requireNonNull(name, "name must not be null");

    var actions = resource.field(ACTIONS)
                          .filter(JsonElement::isJsonObject)
                          .map(JsonElement::getAsJsonObject);
    if (actions.isEmpty() || !actions.get().has(name) || !actions.get().get(name).isJsonObject()) {
      return Optional.empty();
    }

    return Optional.of(from(resource.path(), name, actions.get().getAsJsonObject(name)));
  }

  /**
   * Returns the values the server accepts for a parameter.
   *
   * @param parameter the parameter name
   * @return the allowed values in server order, or empty if the parameter is not advertised
   */
  public Optional<Set<String>> allowedValues(String parameter) {
    return Optional.ofNullable(allowableValues.get(parameter));
  }

  private static ActionDescriptor from(String path, String name, JsonObject json) {
    var target = json.get(TARGET);
    if (target == null || !target.isJsonPrimitive()) {
      throw new RedfishException("action " + name + " on " + path + " has no target");
    }

    var allowableValues = new LinkedHashMap<String, Set<String>>();
    for (var entry : json.entrySet()) {
      if (!entry.getKey().endsWith(ALLOWABLE_VALUES_SUFFIX) || !entry.getValue().isJsonArray()) continue;

      var parameter = entry.getKey().substring(0, entry.getKey().length() - ALLOWABLE_VALUES_SUFFIX.length());
      var values = new LinkedHashSet<String>();
      for (var value : entry.getValue().getAsJsonArray()) {
        if (value.isJsonNull()) continue;
        if (!value.isJsonPrimitive()) {
          throw new RedfishException("action " + name + " on " + path + " lists a malformed allowed value for " + parameter + ": " + value);
        }
        values.add(value.getAsString());
      }
      allowableValues.put(parameter, Collections.unmodifiableSet(values));
    }

    return new ActionDescriptor(name, target.getAsString(), allowableValues);
  }
}
