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

import fr.aneo.redfish.client.job.JobService;
import fr.aneo.redfish.client.manager.ManagerService;
import fr.aneo.redfish.client.storage.StorageService;
import fr.aneo.redfish.client.system.SystemService;

/**
 * Facade interface providing access to the Redfish client service components.
 * <p>
 * All services of one {@link RedfishClient} share its transport and its resource cache:
 * <ul>
 *   <li><strong>{@link SystemService}:</strong> computer system inspection, resets and power cycling</li>
 *   <li><strong>{@link ManagerService}:</strong> management controller inspection and restart</li>
 *   <li><strong>{@link StorageService}:</strong> storage controllers, volumes and volume initialization</li>
 *   <li><strong>{@link JobService}:</strong> controller jobs and waits for job completion</li>
 * </ul>
 *
 * @see RedfishClient#services()
 */
public interface Services {

  SystemService system();

  ManagerService manager();

  StorageService storage();

  JobService jobs();
}
