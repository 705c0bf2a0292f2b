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

import fr.aneo.redfish.client.action.ActionInvoker;
import fr.aneo.redfish.client.exception.JobSchedulingFailedException;
import fr.aneo.redfish.client.exception.OperationInProgressException;
import fr.aneo.redfish.client.job.JobId;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.resource.ResourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

public class DefaultStorageService implements StorageService {
  private static final Logger logger = LoggerFactory.getLogger(DefaultStorageService.class);

  static final String INITIALIZE_ACTION = "#Volume.Initialize";
  private static final String JOB_ID_MARKER = "JID";

  private final ResourceCache cache;
  private final ActionInvoker actionInvoker;

  public DefaultStorageService(ResourceCache cache, ActionInvoker actionInvoker) {
    this.cache = requireNonNull(cache, "cache must not be null");
    this.actionInvoker = requireNonNull(actionInvoker, "actionInvoker must not be null");
  }

  @Override
  public List<ResourceRef> listStorageControllers() {
    return cache.getCached(RedfishPaths.STORAGE).members();
  }

  @Override
  public List<ResourceRef> listVolumes(ResourceRef controller) {
    requireNonNull(controller, "controller must not be null");
    return cache.getCached(RedfishPaths.volumesOf(controller.path())).members();
  }

  @Override
  public List<ResourceRef> listAllVolumes() {
    var volumes = new ArrayList<ResourceRef>();
    for (var controller : listStorageControllers()) {
      volumes.addAll(listVolumes(controller));
    }
    return List.copyOf(volumes);
  }

  @Override
  public List<Resource> listAllVolumeDetails() {
    return listAllVolumes().stream()
                           .map(volume -> cache.getCached(volume.path()))
                           .collect(toList());
  }

  @Override
  public Optional<Resource> findVolumeByName(String name) {
    requireNonNull(name, "name must not be null");
    return findVolume("Name", name);
  }

  @Override
  public Optional<Resource> findVolumeById(String id) {
    requireNonNull(id, "id must not be null");
    return findVolume("Id", id);
  }

  @Override
  public Optional<Resource> getVolume(String idOrPath) {
    requireNonNull(idOrPath, "idOrPath must not be null");
    if (RedfishPaths.isAbsolute(idOrPath)) {
      return Optional.of(cache.get(idOrPath));
    }
    return findVolumeById(idOrPath);
  }

  @Override
  public JobId initializeVolume(String volumePath, InitializeType type) {
    requireNonNull(volumePath, "volumePath must not be null");
    requireNonNull(type, "type must not be null");

    logger.debug("initialize volume {} ({})", volumePath, type);
    var volume = cache.get(volumePath);
    var operations = volume.field("Operations");
    if (operations.isPresent() && operations.get().isJsonArray() && operations.get().getAsJsonArray().size() > 0) {
      throw new OperationInProgressException(volumePath);
    }

    var response = actionInvoker.invokeAction(volumePath, INITIALIZE_ACTION, Map.of("InitializeType", type.wireValue()));
    if (!response.location().contains(JOB_ID_MARKER)) {
      throw new JobSchedulingFailedException("failed to allocate job id for initialization of " + volumePath);
    }

    var jobId = JobId.from(RedfishPaths.lastSegment(response.location()));
    logger.info("Initialization of {} scheduled as {}", volumePath, jobId.asString());
    return jobId;
  }

  private Optional<Resource> findVolume(String field, String value) {
    for (var volume : listAllVolumes()) {
      var detail = cache.get(volume.path());
      if (detail.string(field).filter(value::equals).isPresent()) {
        return Optional.of(detail);
      }
    }
    return Optional.empty();
  }
}
