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
 * How the power-off half of a power cycle was achieved.
 */
public enum PowerCycleOutcome {
  /**
   * The system was already off; it was only powered on.
   */
  ALREADY_OFF,
  /**
   * The system reported neither On nor Off, such as a transitional state; it was powered on
   * without a shutdown.
   */
  POWERED_ON,
  /**
   * The system shut down gracefully before being powered on.
   */
  GRACEFUL,
  /**
   * The graceful shutdown timed out and the system was forced off before being powered on.
   */
  FORCED
}
