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
package fr.aneo.redfish.client.resource;

import static java.util.Objects.requireNonNull;

/**
 * Well-known resource paths of the management controller and helpers to derive paths from them.
 * <p>
 * All paths are absolute but unqualified: they start with the API root and never carry a
 * scheme or host. The base endpoint is owned by the transport.
 */
public final class RedfishPaths {

  public static final String API_ROOT = "/redfish/v1";
  public static final String SYSTEM = API_ROOT + "/Systems/System.Embedded.1";
  public static final String MANAGER = API_ROOT + "/Managers/iDRAC.Embedded.1";
  public static final String STORAGE = SYSTEM + "/Storage";
  public static final String JOBS = MANAGER + "/Jobs";

  private RedfishPaths() {
  }

  /**
   * Resolves a job identifier to the path of the job resource.
   * <p>
   * An identifier that already is an absolute path is returned unchanged; a bare job id
   * such as {@code JID_123456} is joined under {@link #JOBS}. Resolution is idempotent.
   *
   * @param jobIdOrPath a bare job id or the path of a job
   * @return the path of the job resource
   * @throws NullPointerException     if {@code jobIdOrPath} is null
   * @throws IllegalArgumentException if {@code jobIdOrPath} is blank
   */
  public static String jobPath(String jobIdOrPath) {
    requireNonNull(jobIdOrPath, "jobIdOrPath must not be null");
    if (jobIdOrPath.isBlank()) throw new IllegalArgumentException("job identifier must not be blank");

    return isAbsolute(jobIdOrPath) ? jobIdOrPath : JOBS + "/" + jobIdOrPath;
  }

  /**
   * Returns the path of the volume collection of a storage controller.
   *
   * @param controllerPath the path of the storage controller
   * @return the path of the controller's {@code Volumes} collection
   */
  public static String volumesOf(String controllerPath) {
    requireNonNull(controllerPath, "controllerPath must not be null");
    return stripTrailingSlash(controllerPath) + "/Volumes";
  }

  /**
   * Returns the last segment of a path, which Redfish uses as the short identifier of a member.
   *
   * @param path a resource path
   * @return the final path segment, ignoring a trailing slash
   */
  public static String lastSegment(String path) {
    requireNonNull(path, "path must not be null");
    var trimmed = stripTrailingSlash(path);
    return trimmed.substring(trimmed.lastIndexOf('/') + 1);
  }

  /**
   * @param path a resource path or identifier
   * @return true if {@code path} is an absolute path
   */
  public static boolean isAbsolute(String path) {
    return path != null && path.startsWith("/");
  }

  private static String stripTrailingSlash(String path) {
    return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
  }
}
