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
import fr.aneo.redfish.client.exception.InvalidParameterValueException;
import fr.aneo.redfish.client.exception.OperationFailedException;
import fr.aneo.redfish.client.exception.RedfishTimeoutException;
import fr.aneo.redfish.client.exception.UnknownParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Translates a failed command into a JSON error report on standard error and an exit code.
 * <p>
 * Invalid operator input exits with {@link ExitCodes#USAGE}, waits that did not complete with
 * {@link ExitCodes#TIMEOUT}, and every other failure with {@link ExitCodes#FAILURE}. Errors
 * reported by the controller are listed in order under {@code errors}.
 */
final class ErrorReportHandler implements IExecutionExceptionHandler {
  private static final Logger logger = LoggerFactory.getLogger(ErrorReportHandler.class);

  @Override
  public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
    logger.debug("Command {} failed", commandLine.getCommandName(), ex);

    var report = new JsonObject();
    report.addProperty("failed", true);
    int exitCode;

    if (ex instanceof RedfishTimeoutException) {
      report.addProperty("msg", "did not complete in time: " + ex.getMessage());
      exitCode = ExitCodes.TIMEOUT;
    } else if (ex instanceof IllegalArgumentException
      || ex instanceof InvalidParameterValueException
      || ex instanceof UnknownParameterException) {
      report.addProperty("msg", ex.getMessage());
      exitCode = ExitCodes.USAGE;
    } else if (ex instanceof OperationFailedException) {
      var failure = (OperationFailedException) ex;
      report.addProperty("msg", failure.getMessage());
      report.add("errors", errors(failure));
      exitCode = ExitCodes.FAILURE;
    } else {
      report.addProperty("msg", ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
      exitCode = ExitCodes.FAILURE;
    }

    commandLine.getErr().println(JsonReport.GSON.toJson(report));
    commandLine.getErr().flush();
    return exitCode;
  }

  private static JsonArray errors(OperationFailedException failure) {
    var errors = new JsonArray();
    for (var message : failure.errors()) {
      var error = new JsonObject();
      error.addProperty("MessageId", message.messageId());
      error.addProperty("Message", message.message());
      errors.add(error);
    }
    return errors;
  }
}
