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

import fr.aneo.redfish.client.exception.JobSchedulingFailedException;
import fr.aneo.redfish.client.exception.OperationInProgressException;
import fr.aneo.redfish.client.job.JobId;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceRef;

import java.util.List;
import java.util.Optional;

/**
 * Service API for storage controllers and their volumes (virtual disks).
 * <p>
 * Storage topology does not change during a session: controller and volume collections are
 * fetched once and then served from the session cache. Lookups that answer point-in-time
 * questions about a volume fetch the volume itself fresh.
 */
public interface StorageService {

  /**
   * Lists the storage controllers of the system.
   *
   * @return references to the members of the storage collection
   */
  List<ResourceRef> listStorageControllers();

  /**
   * Lists the volumes of a storage controller.
   *
   * @param controller the storage controller
   * @return references to the controller's volumes
   */
  List<ResourceRef> listVolumes(ResourceRef controller);

  /**
   * Lists the volumes of every storage controller.
   *
   * @return volume references in controller order, then in member order
   */
  List<ResourceRef> listAllVolumes();

  /**
   * Lists the documents of every volume of every storage controller.
   *
   * @return the volume documents, in the order of {@link #listAllVolumes()}
   */
  List<Resource> listAllVolumeDetails();

  /**
   * Finds the first volume whose {@code Name} equals {@code name}.
   *
   * @param name the volume name
   * @return the freshly fetched volume, or empty if no volume has that name
   */
  Optional<Resource> findVolumeByName(String name);

  /**
   * Finds the first volume whose {@code Id} equals {@code id}.
   *
   * @param id the volume identifier, e.g. {@code Disk.Virtual.0:RAID.Integrated.1-1}
   * @return the freshly fetched volume, or empty if no volume has that identifier
   */
  Optional<Resource> findVolumeById(String id);

  /**
   * Fetches a volume given either its path or its identifier.
   *
   * @param idOrPath the volume path, or a bare volume identifier
   * @return the freshly fetched volume, or empty if no volume has that identifier
   */
  Optional<Resource> getVolume(String idOrPath);

  /**
   * Schedules the initialization of a volume.
   *
   * @param volumePath the volume path
   * @param type       the initialization mode
   * @return the identifier of the scheduled job
   * @throws OperationInProgressException if the volume already reports a running operation
   * @throws JobSchedulingFailedException if the controller did not report a job
   */
  JobId initializeVolume(String volumePath, InitializeType type);
}
