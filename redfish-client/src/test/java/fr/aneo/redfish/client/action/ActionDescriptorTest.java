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
package fr.aneo.redfish.client.action;

import fr.aneo.redfish.client.exception.RedfishException;
import fr.aneo.redfish.client.resource.RedfishPaths;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static fr.aneo.redfish.client.TestDataFactory.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionDescriptorTest {

  @Test
  @DisplayName("should read target and allowable values per parameter")
  void should_read_target_and_allowable_values_per_parameter() {
    // Given
    var volume = resource("/redfish/v1/Systems/System.Embedded.1/Storage/RAID.Integrated.1-1/Volumes/Disk.Virtual.0", "{"
      + "\"Actions\": {\"#Volume.Initialize\": {"
      + "  \"target\": \"/redfish/v1/Systems/System.Embedded.1/Storage/RAID.Integrated.1-1/Volumes/Disk.Virtual.0/Actions/Volume.Initialize\","
      + "  \"InitializeType@Redfish.AllowableValues\": [\"Fast\", \"Slow\"],"
      + "  \"@Redfish.ActionInfo\": \"/redfish/v1/ActionInfo\""
      + "}}}");

    // When
    var action = ActionDescriptor.find(volume, "#Volume.Initialize");

    // Then
    assertThat(action).isPresent();
    assertThat(action.get().target()).endsWith("/Actions/Volume.Initialize");
    assertThat(action.get().allowableValues()).containsOnlyKeys("InitializeType");
    assertThat(action.get().allowedValues("InitializeType")).hasValueSatisfying(values -> assertThat(values).containsExactly("Fast", "Slow"));
    assertThat(action.get().allowedValues("Other")).isEmpty();
  }

  @Test
  @DisplayName("should not find actions on resources without actions")
  void should_not_find_actions_on_resources_without_actions() {
    assertThat(ActionDescriptor.find(resource(RedfishPaths.SYSTEM, "{}"), "#ComputerSystem.Reset")).isEmpty();
    assertThat(ActionDescriptor.find(resource(RedfishPaths.SYSTEM, "{\"Actions\": {}}"), "#ComputerSystem.Reset")).isEmpty();
  }

  @Test
  @DisplayName("should fail on actions without target")
  void should_fail_on_actions_without_target() {
    // Given
    var system = resource(RedfishPaths.SYSTEM, "{\"Actions\": {\"#ComputerSystem.Reset\": {}}}");

    // When / Then
    assertThatThrownBy(() -> ActionDescriptor.find(system, "#ComputerSystem.Reset"))
      .isInstanceOf(RedfishException.class)
      .hasMessageContaining("target");
  }

  @Test
  @DisplayName("should skip null allowable values")
  void should_skip_null_allowable_values() {
    // Given
    var system = resource(RedfishPaths.SYSTEM, "{\"Actions\": {\"#ComputerSystem.Reset\": {"
      + "\"target\": \"/redfish/v1/Systems/System.Embedded.1/Actions/ComputerSystem.Reset\","
      + "\"ResetType@Redfish.AllowableValues\": [\"On\", null, \"ForceOff\"]"
      + "}}}");

    // When
    var action = ActionDescriptor.find(system, "#ComputerSystem.Reset");

    // Then
    assertThat(action).isPresent();
    assertThat(action.get().allowedValues("ResetType")).hasValueSatisfying(values -> assertThat(values).containsExactly("On", "ForceOff"));
  }

  @Test
  @DisplayName("should fail on structured allowable values")
  void should_fail_on_structured_allowable_values() {
    // Given
    var system = resource(RedfishPaths.SYSTEM, "{\"Actions\": {\"#ComputerSystem.Reset\": {"
      + "\"target\": \"/redfish/v1/Systems/System.Embedded.1/Actions/ComputerSystem.Reset\","
      + "\"ResetType@Redfish.AllowableValues\": [\"On\", {\"Value\": \"ForceOff\"}]"
      + "}}}");

    // When / Then
    assertThatThrownBy(() -> ActionDescriptor.find(system, "#ComputerSystem.Reset"))
      .isInstanceOf(RedfishException.class)
      .hasMessageContaining("malformed allowed value for ResetType");
  }
}
