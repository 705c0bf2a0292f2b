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
import fr.aneo.redfish.client.exception.InvalidParameterValueException;
import fr.aneo.redfish.client.exception.RedfishTimeoutException;
import fr.aneo.redfish.client.internal.poll.Poller;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.ResourceCache;
import fr.aneo.redfish.client.testutils.ManualMonotonicClock;
import fr.aneo.redfish.client.testutils.RedfishTransportMock;
import fr.aneo.redfish.client.testutils.RedfishTransportMock.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static fr.aneo.redfish.client.TestDataFactory.action;
import static fr.aneo.redfish.client.TestDataFactory.system;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static java.util.stream.Collectors.toList;

class DefaultSystemServiceTest {
  private static final String RESET_TARGET = RedfishPaths.SYSTEM + "/Actions/ComputerSystem.Reset";

  private RedfishTransportMock transport;
  private ManualMonotonicClock clock;
  private DefaultSystemService systemService;

  @BeforeEach
  void setUp() {
    transport = new RedfishTransportMock();
    clock = new ManualMonotonicClock();
    var cache = new ResourceCache(transport);
    systemService = new DefaultSystemService(cache, new ActionInvoker(cache, transport), new Poller(clock, clock, Duration.ofSeconds(5)));
  }

  @Test
  @DisplayName("should fetch the system fresh on every call")
  void should_fetch_the_system_fresh_on_every_call() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"), system("Off"));

    // When
    var first = systemService.getSystem();
    var second = systemService.getSystem();

    // Then
    assertThat(first.string("PowerState")).contains("On");
    assertThat(second.string("PowerState")).contains("Off");
  }

  @Test
  @DisplayName("should post the requested reset type")
  void should_post_the_requested_reset_type() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"));

    // When
    systemService.resetSystem(ResetType.GRACEFUL_RESTART);

    // Then
    assertThat(resetTypes()).containsExactly("GracefulRestart");
  }

  @Test
  @DisplayName("should reject reset types the system does not advertise")
  void should_reject_reset_types_the_system_does_not_advertise() {
    // Given
    var system = system("On");
    system.add("Actions", action("#ComputerSystem.Reset", RESET_TARGET, "ResetType", "On", "ForceOff"));
    transport.onGet(RedfishPaths.SYSTEM, system);

    // When / Then
    assertThatThrownBy(() -> systemService.resetSystem(ResetType.GRACEFUL_SHUTDOWN))
      .isInstanceOf(InvalidParameterValueException.class);
    assertThat(transport.posts()).isEmpty();
  }

  @Test
  @DisplayName("should wait for a power state")
  void should_wait_for_a_power_state() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"), system("PoweringOff"), system("Off"));

    // When
    var system = systemService.waitForPowerState(PowerState.OFF, Duration.ofMinutes(1));

    // Then
    assertThat(system.string("PowerState")).contains("Off");
    assertThat(clock.sleeps()).isEqualTo(2);
  }

  @Test
  @DisplayName("should shut down gracefully then power on")
  void should_shut_down_gracefully_then_power_on() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"), system("On"), system("Off"), system("On"));

    // When
    var outcome = systemService.powerCycle(Duration.ofMinutes(1));

    // Then
    assertThat(outcome).isEqualTo(PowerCycleOutcome.GRACEFUL);
    assertThat(resetTypes()).containsExactly("GracefulShutdown", "On");
  }

  @Test
  @DisplayName("should only power on a system that is already off")
  void should_only_power_on_a_system_that_is_already_off() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("Off"), system("On"));

    // When
    var outcome = systemService.powerCycle();

    // Then
    assertThat(outcome).isEqualTo(PowerCycleOutcome.ALREADY_OFF);
    assertThat(resetTypes()).containsExactly("On");
  }

  @Test
  @DisplayName("should force the system off when the graceful shutdown times out")
  void should_force_the_system_off_when_the_graceful_shutdown_times_out() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"), system("On"), system("On"), system("On"), system("Off"), system("On"));

    // When
    var outcome = systemService.powerCycle(Duration.ofSeconds(10));

    // Then
    assertThat(outcome).isEqualTo(PowerCycleOutcome.FORCED);
    assertThat(resetTypes()).containsExactly("GracefulShutdown", "ForceOff", "On");
  }

  @Test
  @DisplayName("should fail after exactly two resets when the system never powers off")
  void should_fail_after_exactly_two_resets_when_the_system_never_powers_off() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"));

    // When / Then
    assertThatThrownBy(() -> systemService.powerCycle(Duration.ofSeconds(1)))
      .isInstanceOf(RedfishTimeoutException.class);
    assertThat(resetTypes()).containsExactly("GracefulShutdown", "ForceOff");
  }

  @Test
  @DisplayName("should issue exactly two resets when neither graceful nor forced power off completes within ten seconds")
  void should_issue_exactly_two_resets_when_neither_graceful_nor_forced_power_off_completes_within_ten_seconds() {
    // Given
    transport.onGet(RedfishPaths.SYSTEM, system("On"));

    // When / Then
    assertThatThrownBy(() -> systemService.powerCycle(Duration.ofSeconds(10)))
      .isInstanceOf(RedfishTimeoutException.class);
    assertThat(resetTypes()).containsExactly("GracefulShutdown", "ForceOff");
    assertThat(clock.elapsed()).isEqualTo(Duration.ofSeconds(20));
  }

  private List<String> resetTypes() {
    assertThat(transport.posts()).extracting(Request::path).containsOnly(RESET_TARGET);
    return transport.posts().stream()
                    .map(Request::payload)
                    .map(payload -> payload.get("ResetType").getAsString())
                    .collect(toList());
  }
}
