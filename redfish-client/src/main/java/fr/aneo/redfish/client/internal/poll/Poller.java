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
package fr.aneo.redfish.client.internal.poll;

import fr.aneo.redfish.client.exception.RedfishException;
import fr.aneo.redfish.client.exception.RedfishTimeoutException;
import fr.aneo.redfish.client.internal.time.MonotonicClock;
import fr.aneo.redfish.client.internal.time.Sleeper;
import fr.aneo.redfish.client.internal.time.SystemMonotonicClock;
import fr.aneo.redfish.client.internal.time.ThreadSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Fixed-interval polling loop: "wait until a condition holds, else time out".
 * <p>
 * Job and power-state transitions of a management controller take tens of seconds to minutes,
 * so polls are spaced by a constant interval without backoff. The loop blocks the calling thread.
 * <p>
 * A bounded wait gives up as soon as another poll would start after the deadline: the loop never
 * sleeps past the timeout only to poll once more. A condition that already holds on the first
 * poll returns without sleeping. An interrupted wait restores the interrupt flag and fails.
 */
public final class Poller {
  private static final Logger logger = LoggerFactory.getLogger(Poller.class);

  /**
   * Delay between two polls.
   */
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

  private final MonotonicClock clock;
  private final Sleeper sleeper;
  private final Duration interval;

  public Poller() {
    this(SystemMonotonicClock.INSTANCE, ThreadSleeper.INSTANCE, DEFAULT_INTERVAL);
  }

  public Poller(MonotonicClock clock, Sleeper sleeper, Duration interval) {
    this.clock = requireNonNull(clock, "clock must not be null");
    this.sleeper = requireNonNull(sleeper, "sleeper must not be null");
    this.interval = requireNonNull(interval, "interval must not be null");
    if (interval.isNegative() || interval.isZero()) throw new IllegalArgumentException("interval must be positive");
  }

  /**
   * Polls until {@code condition} holds for the polled value.
   *
   * @param poll        fetches the current value; called once per poll
   * @param condition   the condition to wait for
   * @param timeout     the maximum time to wait, or {@code null} to wait without bound
   * @param description what is being waited for, used in log and error messages
   * @param <T>         the polled value type
   * @return the first polled value satisfying {@code condition}
   * @throws RedfishTimeoutException  if the condition does not hold within {@code timeout}
   * @throws RedfishException         if the thread is interrupted while waiting
   * @throws IllegalArgumentException if {@code timeout} is negative
   */
  public <T> T waitUntil(Supplier<T> poll, Predicate<? super T> condition, Duration timeout, String description) {
    requireNonNull(poll, "poll must not be null");
    requireNonNull(condition, "condition must not be null");
    if (timeout != null && timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative");

    logger.debug("Waiting for {} (timeout: {})", description, timeout == null ? "none" : timeout);
    var start = clock.nowNanos();

    while (true) {
      var value = poll.get();
      if (condition.test(value)) return value;

      if (timeout != null) {
        var elapsed = Duration.ofNanos(clock.nowNanos() - start);
        if (elapsed.plus(interval).compareTo(timeout) > 0) {
          throw new RedfishTimeoutException("Timeout waiting for " + description + " after " + elapsed.toSeconds() + "s", timeout);
        }
      }

      try {
        sleeper.sleep(interval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RedfishException("Interrupted while waiting for " + description, e);
      }
    }
  }
}
