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
package fr.aneo.redfish.client;

import com.google.common.net.HostAndPort;

import java.time.Duration;

/**
 * Immutable connection configuration for a management controller.
 * <p>
 * Use {@link #builder()} to create instances:
 * <pre>{@code
 * var config = RedfishConfig.builder()
 *   .host("idrac.example.com")
 *   .credentials("root", "calvin")
 *   .withoutSslValidation()
 *   .build();
 * }</pre>
 * The host is an address without scheme, optionally followed by a port; the client always talks
 * HTTPS to it.
 */
public final class RedfishConfig {

  private final String host;
  private final String username;
  private final String password;
  private final boolean sslValidation;
  private final Duration requestTimeout;

  private RedfishConfig(Builder builder) {
    this.host = builder.host.trim();
    this.username = builder.username;
    this.password = builder.password;
    this.sslValidation = builder.sslValidation;
    this.requestTimeout = builder.requestTimeout;
  }

  /**
   * Returns the management controller address.
   *
   * @return the host, optionally with a port (e.g. "idrac.example.com" or "10.0.0.5:8443")
   */
  public String host() {
    return host;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  /**
   * Returns whether TLS certificates presented by the controller are validated.
   *
   * @return true if certificates and host names are verified, false otherwise
   */
  public boolean sslValidation() {
    return sslValidation;
  }

  /**
   * Returns the timeout applied to connecting and to waiting for each response.
   *
   * @return the request timeout, or null to use the HTTP client defaults
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * Creates a new builder for constructing a {@link RedfishConfig}.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "RedfishConfig{" +
      "host='" + host + '\'' +
      ", username='" + username + '\'' +
      ", password='" + (password != null ? "***" : null) + '\'' +
      ", sslValidation=" + sslValidation +
      ", requestTimeout=" + requestTimeout +
      '}';
  }

  /**
   * Builder for {@link RedfishConfig}.
   * <p>
   * Use fluent methods to configure the connection parameters, then call {@link #build()}
   * to create an immutable configuration instance.
   */
  public static final class Builder {
    private String host;
    private String username;
    private String password;
    private boolean sslValidation = true;
    private Duration requestTimeout;

    private Builder() {
    }

    /**
     * Sets the management controller address (required).
     *
     * @param host the host name or IP address, optionally followed by {@code :port}; no scheme
     * @return this builder
     */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    /**
     * Sets the HTTP basic credentials (required).
     *
     * @param username the account name
     * @param password the account password
     * @return this builder
     */
    public Builder credentials(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    /**
     * Disables TLS certificate and host name validation.
     * <p>
     * <strong>Security Warning:</strong> only use this for controllers presenting self-signed
     * certificates on a trusted management network.
     *
     * @return this builder
     */
    public Builder withoutSslValidation() {
      this.sslValidation = false;
      return this;
    }

    /**
     * Sets whether TLS certificates are validated.
     *
     * @param sslValidation true to validate certificates (the default)
     * @return this builder
     */
    public Builder sslValidation(boolean sslValidation) {
      this.sslValidation = sslValidation;
      return this;
    }

    /**
     * Sets the connect and response timeout of every request.
     *
     * @param requestTimeout the timeout, or null for the HTTP client defaults
     * @return this builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Builds the immutable {@link RedfishConfig} instance.
     *
     * @return a new {@link RedfishConfig} instance
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public RedfishConfig build() {
      validate();
      return new RedfishConfig(this);
    }

    private void validate() {
      if (host == null || host.isBlank())
        throw new IllegalArgumentException("host is required");

      if (host.contains("://"))
        throw new IllegalArgumentException("host must not include a scheme: " + host);

      try {
        var hostAndPort = HostAndPort.fromString(host.trim());
        if (hostAndPort.getHost().isEmpty())
          throw new IllegalArgumentException("host is required");
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid host: " + host, e);
      }

      if (username == null || username.isBlank())
        throw new IllegalArgumentException("username is required");

      if (password == null)
        throw new IllegalArgumentException("password is required");

      if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero()))
        throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }
}
