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
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.resource.ResourceRef;
import fr.aneo.redfish.client.testutils.RedfishTransportMock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static fr.aneo.redfish.client.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultStorageServiceTest {
  private static final String V1 = volumePath(CONTROLLER_1, "Disk.Virtual.0:RAID.Integrated.1-1");
  private static final String V2 = volumePath(CONTROLLER_1, "Disk.Virtual.1:RAID.Integrated.1-1");
  private static final String V3 = volumePath(CONTROLLER_2, "Disk.Virtual.0:AHCI.Embedded.1-1");

  private RedfishTransportMock transport;
  private DefaultStorageService storageService;

  @BeforeEach
  void setUp() {
    transport = new RedfishTransportMock()
      .onGet(RedfishPaths.STORAGE, collection(CONTROLLER_1, CONTROLLER_2))
      .onGet(RedfishPaths.volumesOf(CONTROLLER_1), collection(V1, V2))
      .onGet(RedfishPaths.volumesOf(CONTROLLER_2), collection(V3))
      .onGet(V1, volume(V1, "os"))
      .onGet(V2, volume(V2, "data"))
      .onGet(V3, volume(V3, "scratch"));

    var cache = new ResourceCache(transport);
    storageService = new DefaultStorageService(cache, new ActionInvoker(cache, transport));
  }

  @Test
  @DisplayName("should list storage controllers")
  void should_list_storage_controllers() {
    assertThat(storageService.listStorageControllers())
      .extracting(ResourceRef::id)
      .containsExactly("RAID.Integrated.1-1", "AHCI.Embedded.1-1");
  }

  @Test
  @DisplayName("should list all volumes in controller order then member order")
  void should_list_all_volumes_in_controller_order_then_member_order() {
    // When
    var volumes = storageService.listAllVolumes();

    // Then
    assertThat(volumes).containsExactly(
      new ResourceRef(V1, "Disk.Virtual.0:RAID.Integrated.1-1"),
      new ResourceRef(V2, "Disk.Virtual.1:RAID.Integrated.1-1"),
      new ResourceRef(V3, "Disk.Virtual.0:AHCI.Embedded.1-1")
    );
  }

  @Test
  @DisplayName("should read storage topology from cache")
  void should_read_storage_topology_from_cache() {
    // When
    storageService.listAllVolumes();
    storageService.listAllVolumes();
    storageService.listAllVolumeDetails();
    storageService.listAllVolumeDetails();

    // Then
    assertThat(transport.gets(RedfishPaths.STORAGE)).hasSize(1);
    assertThat(transport.gets(RedfishPaths.volumesOf(CONTROLLER_1))).hasSize(1);
    assertThat(transport.gets(V1)).hasSize(1);
  }

  @Test
  @DisplayName("should list volume details for every controller")
  void should_list_volume_details_for_every_controller() {
    assertThat(storageService.listAllVolumeDetails())
      .extracting(volume -> volume.requireString("Name"))
      .containsExactly("os", "data", "scratch");
  }

  @Test
  @DisplayName("should find volumes by name and by id with fresh documents")
  void should_find_volumes_by_name_and_by_id_with_fresh_documents() {
    // When
    var byName = storageService.findVolumeByName("data");
    var byId = storageService.findVolumeById("Disk.Virtual.0:AHCI.Embedded.1-1");

    // Then
    assertThat(byName).hasValueSatisfying(volume -> assertThat(volume.path()).isEqualTo(V2));
    assertThat(byId).hasValueSatisfying(volume -> assertThat(volume.requireString("Name")).isEqualTo("scratch"));
  }

  @Test
  @DisplayName("should report missing volumes as empty")
  void should_report_missing_volumes_as_empty() {
    assertThat(storageService.findVolumeByName("missing")).isEmpty();
    assertThat(storageService.findVolumeById("Disk.Virtual.9:RAID.Integrated.1-1")).isEmpty();
    assertThat(storageService.getVolume("Disk.Virtual.9:RAID.Integrated.1-1")).isEmpty();
  }

  @Test
  @DisplayName("should get volumes by path or by id")
  void should_get_volumes_by_path_or_by_id() {
    assertThat(storageService.getVolume(V3)).hasValueSatisfying(volume -> assertThat(volume.requireString("Name")).isEqualTo("scratch"));
    assertThat(storageService.getVolume("Disk.Virtual.0:RAID.Integrated.1-1")).hasValueSatisfying(volume -> assertThat(volume.path()).isEqualTo(V1));
  }

  @Test
  @DisplayName("should schedule initialization and return the created job id")
  void should_schedule_initialization_and_return_the_created_job_id() {
    // Given
    transport.onPost(V1 + "/Actions/Volume.Initialize", RedfishPaths.JOBS + "/JID_471269252011");

    // When
    var jobId = storageService.initializeVolume(V1, InitializeType.SLOW);

    // Then
    assertThat(jobId).isEqualTo(JobId.from("JID_471269252011"));
    assertThat(transport.posts()).singleElement().satisfies(post -> {
      assertThat(post.path()).isEqualTo(V1 + "/Actions/Volume.Initialize");
      assertThat(post.payload().get("InitializeType").getAsString()).isEqualTo("Slow");
    });
  }

  @Test
  @DisplayName("should refuse to initialize a volume with a running operation")
  void should_refuse_to_initialize_a_volume_with_a_running_operation() {
    // Given
    transport.onGet(V1, volumeWithRunningOperation(V1, "os"));
    storageService.listAllVolumeDetails();

    // When / Then
    assertThatThrownBy(() -> storageService.initializeVolume(V1, InitializeType.FAST))
      .isInstanceOf(OperationInProgressException.class)
      .hasMessageContaining(V1);
    assertThat(transport.posts()).isEmpty();
  }

  @Test
  @DisplayName("should fail when the controller does not report a job")
  void should_fail_when_the_controller_does_not_report_a_job() {
    // Given
    transport.onPost(V1 + "/Actions/Volume.Initialize", "");

    // When / Then
    assertThatThrownBy(() -> storageService.initializeVolume(V1, InitializeType.FAST))
      .isInstanceOf(JobSchedulingFailedException.class)
      .hasMessageContaining("failed to allocate job id");
  }
}
