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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fr.aneo.redfish.client.exception.OperationFailedException.ExtendedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts vendor messages from a Redfish error response body.
 * <p>
 * The expected shape is:
 * <pre>{@code
 * {
 *   "error": {
 *     "code": "Base.1.8.GeneralError",
 *     "@Message.ExtendedInfo": [
 *       {"MessageId": "IDRAC.2.8.SYS011", "Message": "Pending configuration values are already committed."}
 *     ]
 *   }
 * }
 * }</pre>
 */
final class RedfishErrors {
  private static final Logger logger = LoggerFactory.getLogger(RedfishErrors.class);

  private RedfishErrors() {
  }

  /**
   * Returns the {@code (MessageId, Message)} pairs of an error body in server order.
   *
   * @param body the raw response body, possibly empty
   * @return the messages; empty if the body is absent, unparsable or has no extended info
   */
  static List<ExtendedMessage> extendedMessages(String body) {
    if (body == null || body.isBlank()) return List.of();

    JsonElement root;
    try {
      root = JsonParser.parseString(body);
    } catch (JsonParseException e) {
      logger.debug("Error response body is not JSON, reporting no extended messages");
      return List.of();
    }

    if (!root.isJsonObject() || !isObject(root.getAsJsonObject(), "error")) return List.of();

    var error = root.getAsJsonObject().getAsJsonObject("error");
    if (!error.has("@Message.ExtendedInfo") || !error.get("@Message.ExtendedInfo").isJsonArray()) return List.of();

    var messages = new ArrayList<ExtendedMessage>();
    for (JsonElement info : error.getAsJsonArray("@Message.ExtendedInfo")) {
      if (!info.isJsonObject()) continue;
      var entry = info.getAsJsonObject();
      messages.add(new ExtendedMessage(stringOrEmpty(entry, "MessageId"), stringOrEmpty(entry, "Message")));
    }
    return List.copyOf(messages);
  }

  private static boolean isObject(JsonObject parent, String field) {
    return parent.has(field) && parent.get(field).isJsonObject();
  }

  private static String stringOrEmpty(JsonObject entry, String field) {
    var value = entry.get(field);
    return value != null && value.isJsonPrimitive() ? value.getAsString() : "";
  }
}
