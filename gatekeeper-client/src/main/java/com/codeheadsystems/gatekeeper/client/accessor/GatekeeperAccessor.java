package com.codeheadsystems.gatekeeper.client.accessor;

import com.codeheadsystems.gatekeeper.client.exceptions.GatekeeperAccessorException;
import com.codeheadsystems.gatekeeper.client.model.ServerConnectionInfo;
import com.codeheadsystems.gatekeeper.model.BasicLoginResponse;
import com.codeheadsystems.gatekeeper.model.BearerLoginResponse;
import com.codeheadsystems.gatekeeper.model.ErrorResponse;
import com.codeheadsystems.gatekeeper.model.LoginRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the endpoints exposed by a gatekeeper server.
 * <p>
 * The {@code endpoint} in {@link ServerConnectionInfo} is the <em>base URL</em> of the server
 * (e.g. {@code http://host:8080}); path segments are appended per call.
 * <p>
 * A 401 response is surfaced as a {@link SecurityException} carrying the server's message. Other
 * error statuses, I/O errors and interruptions are wrapped in
 * {@link GatekeeperAccessorException}.
 */
@Singleton
public class GatekeeperAccessor {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;

  /**
   * Instantiates a new gatekeeper accessor.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the server connection
   */
  @Inject
  public GatekeeperAccessor(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final ServerConnectionInfo connectionInfo) {
    log.info("GatekeeperAccessor({})", connectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  /**
   * {@code Authorization} header value for a bearer token.
   *
   * @param token the token
   * @return the header value
   */
  public static String bearer(final String token) {
    return "Bearer " + token;
  }

  /**
   * {@code Authorization} header value for Basic credentials.
   *
   * @param username the username
   * @param password the password
   * @return the header value
   */
  public static String basic(final String username, final String password) {
    String pair = username + ":" + password;
    return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Registers a new account.
   *
   * @param request the request
   * @return the registration response
   */
  public RegistrationResponse register(final RegistrationRequest request) {
    log.debug("register({})", request.username());
    return post(uri("/auth/register"), request, RegistrationResponse.class);
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  /**
   * Logs in against a bearer-scheme server and returns the issued token.
   *
   * @param request the request
   * @return the login response
   * @throws SecurityException if the credentials are rejected
   */
  public BearerLoginResponse loginBearer(final LoginRequest request) {
    log.debug("loginBearer({})", request.username());
    return post(uri("/auth/login"), request, BearerLoginResponse.class);
  }

  /**
   * Logs in against a basic-scheme server.
   *
   * @param request the request
   * @return the login response
   * @throws SecurityException if the credentials are rejected
   */
  public BasicLoginResponse loginBasic(final LoginRequest request) {
    log.debug("loginBasic({})", request.username());
    return post(uri("/auth/login"), request, BasicLoginResponse.class);
  }

  // ── Protected resources ───────────────────────────────────────────────────

  /**
   * Calls a protected GET endpoint.
   *
   * @param path          the path below the base URL, e.g. {@code /api/whoami}
   * @param authorization the {@code Authorization} header value, see {@link #bearer(String)} and
   *                      {@link #basic(String, String)}
   * @param responseType  the response type
   * @param <T>           the response type
   * @return the response
   * @throws SecurityException if the server answers 401
   */
  public <T> T get(final String path, final String authorization, final Class<T> responseType) {
    log.debug("get({})", path);
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri(path))
        .header("Accept", "application/json")
        .GET();
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return send(builder.build(), responseType);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI uri(final String path) {
    URI base = connectionInfo.endpoint();
    return base.resolve(base.getPath() + path);
  }

  private <T> T post(final URI uri, final Object body, final Class<T> responseType) {
    String requestBody;
    try {
      requestBody = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new GatekeeperAccessorException("Cannot serialize request for " + uri, e);
    }
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody))
        .build();
    return send(request, responseType);
  }

  private <T> T send(final HttpRequest request, final Class<T> responseType) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(request.uri(), response);
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new GatekeeperAccessorException("HTTP request failed for " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GatekeeperAccessorException("HTTP request interrupted for " + request.uri(), e);
    }
  }

  private void checkStatus(final URI uri, final HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 400) {
      return;
    }
    String message = errorMessage(response.body())
        .orElse("Server returned HTTP " + statusCode + " for " + uri);
    if (statusCode == 401) {
      throw new SecurityException(message);
    }
    throw new GatekeeperAccessorException(statusCode, message);
  }

  private Optional<String> errorMessage(final String body) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(body, ErrorResponse.class))
          .map(ErrorResponse::message);
    } catch (JsonProcessingException e) {
      log.debug("Error body is not an ErrorResponse: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
