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
package fr.aneo.redfish.client.storage;

/**
 * Initialization mode of a volume, as accepted by the {@code #Volume.Initialize} action.
 */
public enum InitializeType {
  /**
   * Clears metadata only.
   */
  FAST("Fast"),
  /**
   * Overwrites the whole volume.
   */
  SLOW("Slow");

  private final String wireValue;

  InitializeType(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * @return the value sent as the {@code InitializeType} parameter
   */
  public String wireValue() {
    return wireValue;
  }
}
