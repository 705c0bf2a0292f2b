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

import fr.aneo.redfish.client.action.ActionInvoker;
import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

import static java.util.Objects.requireNonNull;

public class DefaultSystemService implements SystemService {
  private static final Logger logger = LoggerFactory.getLogger(DefaultSystemService.class);

  static final String RESET_ACTION = "#ComputerSystem.Reset";
  private static final String POWER_STATE = "PowerState";

  private final ResourceCache cache;
  private final ActionInvoker actionInvoker;
  private final Poller poller;

  public DefaultSystemService(ResourceCache cache, ActionInvoker actionInvoker, Poller poller) {
    this.cache = requireNonNull(cache, "cache must not be null");
    this.actionInvoker = requireNonNull(actionInvoker, "actionInvoker must not be null");
    this.poller = requireNonNull(poller, "poller must not be null");
  }

  @Override
  public Resource getSystem() {
    return cache.get(RedfishPaths.SYSTEM);
  }

  @Override
  public void resetSystem(String resetType) {
    requireNonNull(resetType, "resetType must not be null");
    actionInvoker.invokeAction(RedfishPaths.SYSTEM, RESET_ACTION, Map.of("ResetType", resetType));
  }

  @Override
  public Resource waitForPowerState(String powerState, Duration timeout) {
    requireNonNull(powerState, "powerState must not be null");

    logger.info("Waiting for system power state {}", powerState);
    return poller.waitUntil(
      this::getSystem,
      system -> {
        var current = system.string(POWER_STATE).orElse(null);
        logger.debug("want {}, have {}", powerState, current);
        return powerState.equals(current);
      },
      timeout,
      "system power state " + powerState
    );
  }

  @Override
  public PowerCycleOutcome powerCycle(Duration timeout) {
    return new PowerCycleOrchestrator(this).powerCycle(timeout);
  }
}
