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

import java.util.Set;

/**
 * Thrown when an action parameter value is outside the set of values the server currently accepts.
 * <p>
 * The allowed values are read from the resource's own action metadata, so the check happens
 * before any request is sent.
 */
public class InvalidParameterValueException extends RedfishException {
  private final String parameter;
  private final String value;
  private final Set<String> allowedValues;

  public InvalidParameterValueException(String parameter, String value, Set<String> allowedValues) {
    super(value + ": invalid value for " + parameter + " (allowed: " + allowedValues + ")");
    this.parameter = parameter;
    this.value = value;
    this.allowedValues = Set.copyOf(allowedValues);
  }

  public String parameter() {
    return parameter;
  }

  public String value() {
    return value;
  }

  public Set<String> allowedValues() {
    return allowedValues;
  }
}
