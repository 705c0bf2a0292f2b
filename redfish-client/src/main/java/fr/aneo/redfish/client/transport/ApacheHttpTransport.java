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
package fr.aneo.redfish.client.transport;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fr.aneo.redfish.client.RedfishConfig;
import fr.aneo.redfish.client.exception.OperationFailedException;
import fr.aneo.redfish.client.exception.RedfishException;
import fr.aneo.redfish.client.exception.UnexpectedContentTypeException;
import fr.aneo.redfish.client.resource.RedfishPaths;
import fr.aneo.redfish.client.resource.Resource;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * {@link RedfishTransport} backed by the Apache HttpClient 5 classic API.
 * <p>
 * Requests are sent to {@code https://<host>} with preemptive HTTP basic authentication and a
 * JSON content type. Management controllers commonly present self-signed certificates; when
 * {@link RedfishConfig#sslValidation()} is disabled the transport trusts any certificate and
 * skips host name verification, once, at construction time, without per-request warnings.
 * <p>
 * Automatic retries of the underlying client are disabled: a failed request is reported to the
 * caller, never silently repeated.
 */
public final class ApacheHttpTransport implements RedfishTransport {
  private static final Logger logger = LoggerFactory.getLogger(ApacheHttpTransport.class);
  private static final String APPLICATION_JSON = "application/json";

  private final URI baseUri;
  private final String authorization;
  private final CloseableHttpClient httpClient;

  /**
   * Creates a transport for the management controller described by {@code config}.
   *
   * @param config the connection configuration
   * @throws NullPointerException if config is null
   */
  public ApacheHttpTransport(RedfishConfig config) {
    this(URI.create("https://" + requireNonNull(config, "config must not be null").host()), config);
  }

  ApacheHttpTransport(URI baseUri, RedfishConfig config) {
    this.baseUri = requireNonNull(baseUri, "baseUri must not be null");
    this.authorization = basicAuthorization(config.username(), config.password());
    this.httpClient = createHttpClient(config);
  }

  @Override
  public Resource request(HttpMethod method, String path, JsonObject payload) {
    requireNonNull(method, "method must not be null");
    validatePath(path);

    var request = new HttpUriRequestBase(method.name(), resolve(path));
    request.setHeader(HttpHeaders.AUTHORIZATION, authorization);
    request.setHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON);
    request.setHeader(HttpHeaders.ACCEPT, APPLICATION_JSON);
    if (payload != null) {
      request.setEntity(new StringEntity(payload.toString(), ContentType.APPLICATION_JSON));
    }

    logger.debug("{} {}", method, path);
    try {
      return httpClient.execute(request, response -> decode(method, path, response));
    } catch (IOException e) {
      throw new RedfishException(method + " " + path + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    httpClient.close(CloseMode.GRACEFUL);
  }

  private Resource decode(HttpMethod method, String path, ClassicHttpResponse response) throws IOException, ParseException {
    var code = response.getCode();
    var body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), UTF_8);

    if (code < 200 || code >= 300) {
      logger.debug("{} {} returned {}", method, path, code);
      throw new OperationFailedException(method.name(), path, code, body, RedfishErrors.extendedMessages(body));
    }

    var contentTypeHeader = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);
    var contentType = contentTypeHeader == null ? null : contentTypeHeader.getValue();
    if (!isJson(contentType) && !(contentType == null && body.isBlank())) {
      throw new UnexpectedContentTypeException(contentType);
    }

    var locationHeader = response.getFirstHeader(HttpHeaders.LOCATION);
    var location = locationHeader == null ? "" : locationHeader.getValue();

    return Resource.of(path, body.isBlank() ? new JsonObject() : parseObject(path, body), location);
  }

  private static JsonObject parseObject(String path, String body) {
    try {
      var element = JsonParser.parseString(body);
      if (!element.isJsonObject()) {
        throw new RedfishException("response for " + path + " is not a JSON object");
      }
      return element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new RedfishException("response for " + path + " is not valid JSON", e);
    }
  }

  private static boolean isJson(String contentType) {
    if (contentType == null) return false;
    var mimeType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return mimeType.equals(APPLICATION_JSON);
  }

  private static void validatePath(String path) {
    requireNonNull(path, "path must not be null");
    if (path.contains("://")) {
      throw new IllegalArgumentException("this client cannot fetch fully qualified urls: " + path);
    }
    if (!RedfishPaths.isAbsolute(path)) {
      throw new IllegalArgumentException("path must be absolute: " + path);
    }
    if (path.startsWith("//")) {
      throw new IllegalArgumentException("this client cannot fetch network-path references: " + path);
    }
    if (!path.startsWith("/redfish")) {
      logger.warn("{} does not look like a redfish path", path);
    }
  }

  private URI resolve(String path) {
    URI uri;
    try {
      uri = baseUri.resolve(path);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid path: " + path, e);
    }
    if (!Objects.equals(uri.getScheme(), baseUri.getScheme()) || !Objects.equals(uri.getRawAuthority(), baseUri.getRawAuthority())) {
      throw new IllegalArgumentException("path " + path + " does not resolve to " + baseUri);
    }
    return uri;
  }

  private static String basicAuthorization(String username, String password) {
    var credentials = username + ":" + password;
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(UTF_8));
  }

  private static CloseableHttpClient createHttpClient(RedfishConfig config) {
    var connectionManager = PoolingHttpClientConnectionManagerBuilder.create();
    var clientBuilder = HttpClients.custom().disableAutomaticRetries();

    if (!config.sslValidation()) {
      logger.debug("TLS certificate validation disabled for {}", config.host());
      connectionManager.setSSLSocketFactory(trustAllSocketFactory());
    }

    if (config.requestTimeout() != null) {
      var timeout = Timeout.ofMilliseconds(config.requestTimeout().toMillis());
      connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                                                                   .setConnectTimeout(timeout)
                                                                   .setSocketTimeout(timeout)
                                                                   .build());
      clientBuilder.setDefaultRequestConfig(RequestConfig.custom()
                                                         .setResponseTimeout(timeout)
                                                         .build());
    }

    return clientBuilder.setConnectionManager(connectionManager.build()).build();
  }

  private static SSLConnectionSocketFactory trustAllSocketFactory() {
    try {
      var sslContext = SSLContexts.custom()
                                  .loadTrustMaterial(TrustAllStrategy.INSTANCE)
                                  .build();
      return SSLConnectionSocketFactoryBuilder.create()
                                              .setSslContext(sslContext)
                                              .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                                              .build();
    } catch (GeneralSecurityException e) {
      throw new RedfishException("Unable to configure TLS without certificate validation", e);
    }
  }
}
