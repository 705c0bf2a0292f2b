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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Drives a system through a power cycle.
 * <p>
 * A running system is first asked to shut down gracefully. If it is still on once the timeout
 * elapses, it is forced off and given a second, independent window of the same length. A second
 * timeout aborts the cycle: the system is never reset a third time. The system is then powered
 * on and must report {@code On} within the timeout.
 * <p>
 * A system that reports a state other than {@code On} or {@code Off} is sent straight to the
 * power-on step.
 */
final class PowerCycleOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(PowerCycleOrchestrator.class);
  private static final String POWER_STATE = "PowerState";

  private final SystemService system;

  PowerCycleOrchestrator(SystemService system) {
    this.system = requireNonNull(system, "system must not be null");
  }

  PowerCycleOutcome powerCycle(Duration timeout) {
    var current = system.getSystem().string(POWER_STATE).orElse(null);
    logger.info("Power cycling system (current state: {}, timeout: {})", current, timeout);

    PowerCycleOutcome outcome;
    if (PowerState.OFF.equals(current)) {
      outcome = PowerCycleOutcome.ALREADY_OFF;
    } else if (PowerState.ON.equals(current)) {
      outcome = powerOff(timeout);
    } else {
      logger.warn("System reports power state {}, powering on without shutdown", current);
      outcome = PowerCycleOutcome.POWERED_ON;
    }

    system.resetSystem(ResetType.ON);
    system.waitForPowerState(PowerState.ON, timeout);
    logger.info("System powered on ({})", outcome);
    return outcome;
  }

  private PowerCycleOutcome powerOff(Duration timeout) {
    system.resetSystem(ResetType.GRACEFUL_SHUTDOWN);
    try {
      system.waitForPowerState(PowerState.OFF, timeout);
      return PowerCycleOutcome.GRACEFUL;
    } catch (RedfishTimeoutException e) {
      logger.warn("Graceful shutdown did not complete in time, forcing power off");
    }

    system.resetSystem(ResetType.FORCE_OFF);
    system.waitForPowerState(PowerState.OFF, timeout);
    return PowerCycleOutcome.FORCED;
  }
}
