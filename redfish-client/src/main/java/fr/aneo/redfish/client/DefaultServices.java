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
package fr.aneo.redfish.client;

import fr.aneo.redfish.client.action.ActionInvoker;
import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.job.DefaultJobService;
import fr.aneo.redfish.client.job.JobService;
import fr.aneo.redfish.client.manager.DefaultManagerService;
import fr.aneo.redfish.client.manager.ManagerService;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.storage.DefaultStorageService;
import fr.aneo.redfish.client.storage.StorageService;
import fr.aneo.redfish.client.system.DefaultSystemService;
import fr.aneo.redfish.client.system.SystemService;

import static java.util.Objects.requireNonNull;

/**
 * Default {@link Services} implementation wiring the session cache and action invoker to the
 * service facades.
 */
final class DefaultServices implements Services {
  private final SystemService systemService;
  private final ManagerService managerService;
  private final StorageService storageService;
  private final JobService jobService;

  DefaultServices(ResourceCache cache, ActionInvoker actionInvoker, Poller poller) {
    requireNonNull(cache, "cache must not be null");
    requireNonNull(actionInvoker, "actionInvoker must not be null");
    requireNonNull(poller, "poller must not be null");

    this.systemService = new DefaultSystemService(cache, actionInvoker, poller);
    this.managerService = new DefaultManagerService(cache, actionInvoker);
    this.storageService = new DefaultStorageService(cache, actionInvoker);
    this.jobService = new DefaultJobService(cache, poller);
  }

  @Override
  public SystemService system() {
    return systemService;
  }

  @Override
  public ManagerService manager() {
    return managerService;
  }

  @Override
  public StorageService storage() {
    return storageService;
  }

  @Override
  public JobService jobs() {
    return jobService;
  }
}
