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

import fr.aneo.redfish.client.RedfishClient;
import fr.aneo.redfish.client.RedfishConfig;
import picocli.CommandLine;

import java.util.function.Function;

public final class Main {
  private Main() {
  }

  public static void main(String[] args) {
    int code = newCommandLine(RedfishClient::new).execute(args);
    System.exit(code);
  }

  static CommandLine newCommandLine(Function<RedfishConfig, RedfishClient> clientFactory) {
    return new CommandLine(new RedfishCommand(clientFactory))
      .setExecutionExceptionHandler(new ErrorReportHandler());
  }
}
