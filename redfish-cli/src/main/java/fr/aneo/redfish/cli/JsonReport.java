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
package fr.aneo.redfish.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Result of a command as printed on standard output:
 * <pre>{@code
 * {
 *   "changed": true,
 *   "redfish": { "job": { "id": "JID_123456" } }
 * }
 * }</pre>
 * {@code changed} tells whether the command modified the controller.
 */
final class JsonReport {
  static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private final boolean changed;
  private final JsonObject redfish = new JsonObject();

  private JsonReport(boolean changed) {
    this.changed = changed;
  }

  static JsonReport unchanged() {
    return new JsonReport(false);
  }

  static JsonReport changed() {
    return new JsonReport(true);
  }

  JsonReport with(String key, JsonElement value) {
    redfish.add(key, value);
    return this;
  }

  JsonReport with(String key, String value) {
    redfish.addProperty(key, value);
    return this;
  }

  String toJson() {
    var root = new JsonObject();
    root.addProperty("changed", changed);
    root.add("redfish", redfish);
    return GSON.toJson(root);
  }
}
