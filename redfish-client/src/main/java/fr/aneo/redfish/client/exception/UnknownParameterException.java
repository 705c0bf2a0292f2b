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

/**
 * Thrown when an action is invoked with a parameter the server does not advertise for it.
 */
public class UnknownParameterException extends RedfishException {
  private final String actionName;
  private final String parameter;

  public UnknownParameterException(String actionName, String parameter) {
    super("action " + actionName + " has no parameter " + parameter);
    this.actionName = actionName;
    this.parameter = parameter;
  }

  public String actionName() {
    return actionName;
  }

  public String parameter() {
    return parameter;
  }
}
