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

import fr.aneo.redfish.client.exception.RedfishTimeoutException;
import fr.aneo.redfish.client.resource.Resource;

import java.time.Duration;

/**
 * Service API for the computer system: inspection, reset actions and power-state transitions.
 */
public interface SystemService {

  /**
   * Default time allowed to each phase of a power cycle.
   */
  Duration DEFAULT_POWER_CYCLE_TIMEOUT = Duration.ofSeconds(300);

  /**
   * Fetches the computer system document.
   *
   * @return the freshly fetched system
   */
  Resource getSystem();

  /**
   * Requests a reset of the computer system.
   *
   * @param resetType the reset type wire value; must be one the system advertises
   */
  void resetSystem(String resetType);

  /**
   * Requests a reset of the computer system.
   *
   * @param resetType the reset type; must be one the system advertises
   */
  default void resetSystem(ResetType resetType) {
    resetSystem(resetType.wireValue());
  }

  /**
   * Waits until the system reports {@code powerState}.
   *
   * @param powerState the power state to wait for, e.g. {@link PowerState#OFF}
   * @param timeout    the maximum time to wait, or {@code null} to wait without bound
   * @return the system document that reported {@code powerState}
   * @throws RedfishTimeoutException if the system does not reach {@code powerState} in time
   */
  Resource waitForPowerState(String powerState, Duration timeout);

  /**
   * Power-cycles the system with the {@link #DEFAULT_POWER_CYCLE_TIMEOUT default timeout}.
   *
   * @return how the system was powered off
   * @see #powerCycle(Duration)
   */
  default PowerCycleOutcome powerCycle() {
    return powerCycle(DEFAULT_POWER_CYCLE_TIMEOUT);
  }

  /**
   * Power-cycles the system: a graceful shutdown escalated to a forced power-off when it does
   * not complete in time, followed by a power-on.
   * <p>
   * Each wait is given its own {@code timeout}, so the whole operation may take up to three
   * times {@code timeout}.
   *
   * @param timeout time allowed to each phase, or {@code null} to wait without bound
   * @return how the system was powered off
   * @throws RedfishTimeoutException if the forced power-off or the power-on does not complete in time
   */
  PowerCycleOutcome powerCycle(Duration timeout);
}
