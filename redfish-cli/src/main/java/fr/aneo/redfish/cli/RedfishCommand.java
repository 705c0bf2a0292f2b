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
package fr.aneo.redfish.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import fr.aneo.redfish.client.RedfishClient;
import fr.aneo.redfish.client.RedfishConfig;
import fr.aneo.redfish.client.exception.RedfishException;
import fr.aneo.redfish.client.job.JobState;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.Resource;
import fr.aneo.redfish.client.storage.InitializeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

@Command(
  name = "redfish",
  mixinStandardHelpOptions = true,
  description = "Inspect and operate a server through its Redfish management controller",
  subcommands = {
    RedfishCommand.SystemCommand.class,
    RedfishCommand.ManagerCommand.class,
    RedfishCommand.ResourceCommand.class,
    RedfishCommand.ListDisksCommand.class,
    RedfishCommand.DiskInfoCommand.class,
    RedfishCommand.InitDiskCommand.class,
    RedfishCommand.ListJobsCommand.class,
    RedfishCommand.JobInfoCommand.class,
    RedfishCommand.WaitForJobCommand.class,
    RedfishCommand.ResetSystemCommand.class,
    RedfishCommand.RebootSystemCommand.class,
    RedfishCommand.ResetManagerCommand.class
  }
)
public final class RedfishCommand implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(RedfishCommand.class);

  @Spec
  CommandSpec spec;

  @Option(names = {"--host"}, defaultValue = "${env:REDFISH_HOST}", description = "Controller host[:port] (env: REDFISH_HOST)")
  String host;

  @Option(names = {"--username"}, defaultValue = "${env:REDFISH_USERNAME}", description = "Account name (env: REDFISH_USERNAME)")
  String username;

  @Option(names = {"--password"}, defaultValue = "${env:REDFISH_PASSWORD}", description = "Account password (env: REDFISH_PASSWORD)")
  String password;

  @Option(names = {"--no-verify"}, description = "Do not validate the controller TLS certificate")
  boolean noVerify;

  @Option(names = {"--timeout"}, description = "Per-request timeout in seconds")
  Long timeout;

  private final Function<RedfishConfig, RedfishClient> clientFactory;

  RedfishCommand(Function<RedfishConfig, RedfishClient> clientFactory) {
    this.clientFactory = requireNonNull(clientFactory, "clientFactory must not be null");
  }

  @Override
  public void run() {
    throw new ParameterException(spec.commandLine(), "Missing required subcommand");
  }

  RedfishClient connect() {
    var builder = RedfishConfig.builder()
                               .host(host)
                               .credentials(username, password)
                               .sslValidation(!noVerify);
    if (timeout != null) builder.requestTimeout(Duration.ofSeconds(timeout));

    var config = builder.build();
    logger.debug("Connecting to {}", config);
    return clientFactory.apply(config);
  }

  int print(JsonReport report) {
    var out = spec.commandLine().getOut();
    out.println(report.toJson());
    out.flush();
    return ExitCodes.OK;
  }

  private static Duration seconds(Long value) {
    return value == null ? null : Duration.ofSeconds(value);
  }

  private static JsonArray toJsonArray(List<Resource> resources) {
    var array = new JsonArray();
    resources.forEach(resource -> array.add(resource.json()));
    return array;
  }

  @Command(name = "system", description = "Show the computer system")
  static final class SystemCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var system = client.services().system().getSystem();
        return parent.print(JsonReport.unchanged().with("system", system.json()));
      }
    }
  }

  @Command(name = "manager", description = "Show the management controller")
  static final class ManagerCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var manager = client.services().manager().getManager();
        return parent.print(JsonReport.unchanged().with("manager", manager.json()));
      }
    }
  }

  @Command(name = "resource", description = "Show any resource by path")
  static final class ResourceCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--path"}, required = true, description = "Resource path, e.g. /redfish/v1/Chassis")
    String path;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var resource = client.get(path);
        return parent.print(JsonReport.unchanged().with("resource", resource.json()));
      }
    }
  }

  @Command(name = "list-disks", description = "List the virtual disks of every storage controller")
  static final class ListDisksCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--detail"}, description = "Print each disk document instead of its path")
    boolean detail;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var storage = client.services().storage();
        var disks = new JsonArray();
        if (detail) {
          disks = toJsonArray(storage.listAllVolumeDetails());
        } else {
          for (var volume : storage.listAllVolumes()) {
            disks.add(volume.path());
          }
        }
        return parent.print(JsonReport.unchanged().with("disks", disks));
      }
    }
  }

  @Command(name = "disk-info", description = "Show a virtual disk")
  static final class DiskInfoCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--disk"}, required = true, description = "Disk path or identifier")
    String disk;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var volume = client.services().storage().getVolume(disk)
                           .orElseThrow(() -> new RedfishException("No virtual disk " + disk));
        return parent.print(JsonReport.unchanged().with("disk", volume.json()));
      }
    }
  }

  @Command(name = "init-disk", description = "Schedule the initialization of a virtual disk")
  static final class InitDiskCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--disk"}, required = true, description = "Disk path or identifier")
    String disk;

    @Option(names = {"--slow"}, description = "Overwrite the whole disk instead of clearing metadata")
    boolean slow;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var storage = client.services().storage();
        var path = RedfishPaths.isAbsolute(disk)
          ? disk
          : storage.getVolume(disk).orElseThrow(() -> new RedfishException("No virtual disk " + disk)).path();

        var jobId = storage.initializeVolume(path, slow ? InitializeType.SLOW : InitializeType.FAST);

        var job = new JsonObject();
        job.addProperty("id", jobId.asString());
        return parent.print(JsonReport.changed().with("job", job));
      }
    }
  }

  @Command(name = "list-jobs", description = "List controller jobs")
  static final class ListJobsCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"--detail"}, description = "Print each job document instead of its path")
    boolean detail;

    @Option(names = {"--state"}, description = "Keep only jobs in this state (repeatable; requires --detail)")
    List<String> states;

    @Override
    public Integer call() {
      var hasStates = states != null && !states.isEmpty();
      if (hasStates && !detail) {
        throw new ParameterException(spec.commandLine(), "filtering by state requires --detail");
      }

      try (var client = parent.connect()) {
        var jobService = client.services().jobs();
        JsonArray jobs;
        if (!detail) {
          jobs = new JsonArray();
          for (var job : jobService.listJobs()) {
            jobs.add(job.path());
          }
        } else if (hasStates) {
          var wanted = EnumSet.noneOf(JobState.class);
          states.forEach(state -> wanted.add(JobState.fromName(state)));
          jobs = toJsonArray(jobService.listJobDetails(wanted));
        } else {
          jobs = toJsonArray(jobService.listJobDetails());
        }
        return parent.print(JsonReport.unchanged().with("jobs", jobs));
      }
    }
  }

  @Command(name = "job-info", description = "Show a controller job")
  static final class JobInfoCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--job"}, required = true, description = "Job path or identifier, e.g. JID_123456")
    String job;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var document = client.services().jobs().getJob(job);
        return parent.print(JsonReport.unchanged().with("job", document.json()));
      }
    }
  }

  @Command(name = "wait-for-job", description = "Wait until a controller job reaches a state")
  static final class WaitForJobCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--job"}, required = true, description = "Job path or identifier")
    String job;

    @Option(names = {"--state"}, required = true, description = "State to wait for: scheduled, running, finished, failed or unknown")
    String state;

    @Option(names = {"--wait-timeout"}, description = "Maximum wait in seconds (default: no limit)")
    Long waitTimeout;

    @Override
    public Integer call() {
      var target = JobState.fromName(state);
      try (var client = parent.connect()) {
        var document = client.services().jobs().waitForJobState(job, target, seconds(waitTimeout));
        return parent.print(JsonReport.unchanged().with("job", document.json()));
      }
    }
  }

  @Command(name = "reset-system", description = "Reset the computer system")
  static final class ResetSystemCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--reset-type"}, required = true, description = "Reset type advertised by the system, e.g. GracefulRestart")
    String resetType;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        client.services().system().resetSystem(resetType);
        return parent.print(JsonReport.changed().with("resetType", resetType));
      }
    }
  }

  @Command(name = "reboot-system", description = "Power-cycle the computer system, forcing it off if needed")
  static final class RebootSystemCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Option(names = {"--wait-timeout"}, description = "Time allowed to each power transition in seconds (default: 300)")
    Long waitTimeout;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        var system = client.services().system();
        var outcome = waitTimeout == null ? system.powerCycle() : system.powerCycle(seconds(waitTimeout));
        return parent.print(JsonReport.changed().with("outcome", outcome.name()));
      }
    }
  }

  @Command(name = "reset-manager", description = "Gracefully restart the management controller")
  static final class ResetManagerCommand implements Callable<Integer> {
    @ParentCommand
    RedfishCommand parent;

    @Override
    public Integer call() {
      try (var client = parent.connect()) {
        client.services().manager().resetManager();
        return parent.print(JsonReport.changed());
      }
    }
  }
}
