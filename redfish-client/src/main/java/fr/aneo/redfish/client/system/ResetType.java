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
package fr.aneo.redfish.client.system;

/**
 * Reset types accepted by the {@code #ComputerSystem.Reset} and {@code #Manager.Reset} actions.
 * <p>
 * Not every controller supports every type; the values a resource accepts are the ones it
 * advertises, and are checked before the action is posted. Other advertised types can be
 * requested by their wire value through {@link SystemService#resetSystem(String)}.
 */
public enum ResetType {
  ON("On"),
  FORCE_OFF("ForceOff"),
  GRACEFUL_SHUTDOWN("GracefulShutdown"),
  GRACEFUL_RESTART("GracefulRestart");

  private final String wireValue;

  ResetType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
