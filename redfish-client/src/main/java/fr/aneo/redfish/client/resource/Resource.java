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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import fr.aneo.redfish.client.exception.RedfishException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Read-only view of a Redfish resource as last fetched from the management controller.
 * <p>
 * A resource is an untyped, server-defined JSON document identified by its path. The client
 * does not model resource schemas; fields are read by name ({@code PowerState}, {@code Id},
 * {@code Name}, {@code Members}, {@code Actions}, ...). Instances are immutable: the document
 * is copied on construction and every accessor returning JSON returns a copy.
 * <p>
 * A resource also carries the {@code Location} header of the response it was decoded from.
 * Actions that schedule asynchronous work report the path of the created job there; for any
 * other response the location is the empty string.
 */
public final class Resource {
  private static final String MEMBERS = "Members";
  private static final String ODATA_ID = "@odata.id";

  private final String path;
  private final JsonObject body;
  private final String location;

  private Resource(String path, JsonObject body, String location) {
    this.path = path;
    this.body = body;
    this.location = location;
  }

  /**
   * Creates a resource from a decoded response body.
   *
   * @param path     the path the document was fetched from
   * @param body     the decoded document; {@code null} is treated as an empty document
   * @param location the {@code Location} header of the response; {@code null} is treated as empty
   * @return a new resource holding a private copy of {@code body}
   */
  public static Resource of(String path, JsonObject body, String location) {
    requireNonNull(path, "path must not be null");
    return new Resource(path, body == null ? new JsonObject() : body.deepCopy(), location == null ? "" : location);
  }

  public static Resource of(String path, JsonObject body) {
    return of(path, body, "");
  }

  public String path() {
    return path;
  }

  /**
   * Returns the {@code Location} header of the response this resource was decoded from.
   *
   * @return the location, or the empty string if the response carried none
   */
  public String location() {
    return location;
  }

  public boolean has(String field) {
    return body.has(field) && !body.get(field).isJsonNull();
  }

  public boolean isEmpty() {
    return body.size() == 0;
  }

  /**
   * Returns a copy of the named field.
   *
   * @param field the field name
   * @return the field value, or empty if absent or JSON null
   */
  public Optional<JsonElement> field(String field) {
    return has(field) ? Optional.of(body.get(field).deepCopy()) : Optional.empty();
  }

  /**
   * Returns the named field as a string.
   *
   * @param field the field name
   * @return the value, or empty if the field is absent or not a JSON string
   */
  public Optional<String> string(String field) {
    if (!has(field)) return Optional.empty();

    var value = body.get(field);
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) return Optional.empty();
    return Optional.of(value.getAsString());
  }

  /**
   * Returns the named string field, failing if it is missing.
   *
   * @param field the field name
   * @return the value
   * @throws RedfishException if the field is absent or not a string
   */
  public String requireString(String field) {
    return string(field).orElseThrow(() -> new RedfishException("resource " + path + " has no string field " + field));
  }

  /**
   * Returns the references listed in this collection's {@code Members} array.
   *
   * @return the member references in server order
   * @throws RedfishException if this resource is not a collection
   */
  public List<ResourceRef> members() {
    if (!has(MEMBERS) || !body.get(MEMBERS).isJsonArray()) {
      throw new RedfishException("resource " + path + " has no " + MEMBERS);
    }

    var members = new ArrayList<ResourceRef>();
    for (JsonElement member : body.getAsJsonArray(MEMBERS)) {
      var id = member.isJsonObject() ? member.getAsJsonObject().get(ODATA_ID) : null;
      if (id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isString()) {
        throw new RedfishException("malformed member in " + path + ": " + member);
      }
      members.add(ResourceRef.of(id.getAsString()));
    }
    return List.copyOf(members);
  }

  /**
   * Returns a copy of the whole document.
   *
   * @return a mutable deep copy of the document
   */
  public JsonObject json() {
    return body.deepCopy();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (Resource) obj;
    return Objects.equals(this.path, that.path)
      && Objects.equals(this.body, that.body)
      && Objects.equals(this.location, that.location);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, body, location);
  }

  @Override
  public String toString() {
    return "Resource{" +
      "path='" + path + '\'' +
      ", location='" + location + '\'' +
      ", body=" + body +
      '}';
  }
}
