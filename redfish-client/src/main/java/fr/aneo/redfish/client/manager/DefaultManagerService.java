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
package fr.aneo.redfish.client.manager;

import fr.aneo.redfish.client.action.ActionInvoker;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.system.ResetType;

import java.util.Map;

import static java.util.Objects.requireNonNull;

public class DefaultManagerService implements ManagerService {
  static final String RESET_ACTION = "#Manager.Reset";

  private final ResourceCache cache;
  private final ActionInvoker actionInvoker;

  public DefaultManagerService(ResourceCache cache, ActionInvoker actionInvoker) {
    this.cache = requireNonNull(cache, "cache must not be null");
    this.actionInvoker = requireNonNull(actionInvoker, "actionInvoker must not be null");
  }

  @Override
  public Resource getManager() {
    return cache.get(RedfishPaths.MANAGER);
  }

  @Override
  public void resetManager() {
    actionInvoker.invokeAction(RedfishPaths.MANAGER, RESET_ACTION, Map.of("ResetType", ResetType.GRACEFUL_RESTART.wireValue()));
  }
}
