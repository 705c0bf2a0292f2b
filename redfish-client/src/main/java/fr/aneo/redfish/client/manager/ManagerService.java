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

import fr.aneo.redfish.client.resource.Resource;

/**
 * Service API for the management controller itself.
 */
public interface ManagerService {

  /**
   * Fetches the manager document.
   *
   * @return the freshly fetched manager
   */
  Resource getManager();

  /**
   * Requests a graceful restart of the management controller.
   * <p>
   * The controller drops its connections while restarting; subsequent requests fail until it is
   * back.
   */
  void resetManager();
}
