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
 * Well-known values of the {@code PowerState} field of a computer system.
 * <p>
 * Power states are open-ended strings compared by equality; controllers may report transitional
 * values such as {@code PoweringOn} that are not listed here.
 */
public final class PowerState {
  public static final String ON = "On";
  public static final String OFF = "Off";

  private PowerState() {
  }
}
