package com.codeheadsystems.gatekeeper.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gatekeeper.model.BearerLoginResponse;
import com.codeheadsystems.gatekeeper.model.ErrorResponse;
import com.codeheadsystems.gatekeeper.model.LoginRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationResponse;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.exception.PersistenceException;
import com.codeheadsystems.gatekeeper.server.exception.RegistrationException;
import com.codeheadsystems.gatekeeper.server.manager.GatekeeperAuthManager;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthResourceTest {

  private static final GatekeeperSettings SETTINGS = GatekeeperSettings.defaults("test_salt",
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8));

  @Mock private GatekeeperAuthManager manager;
  private AuthResource resource;

  @BeforeEach
  void setUp() {
    when(manager.settings()).thenReturn(SETTINGS);
    resource = new AuthResource(manager);
  }

  @Test
  void register_success_returnsCreated() {
    RegistrationRequest request = new RegistrationRequest("alice", "secret1");
    when(manager.register(request))
        .thenReturn(new RegistrationResponse("User registered successfully", "alice"));

    Response response = resource.register(request);

    assertThat(response.getStatus()).isEqualTo(201);
    assertThat(response.getEntity()).isEqualTo(
        new RegistrationResponse("User registered successfully", "alice"));
  }

  @Test
  void register_validationFailure_isBadRequestWithMessage() {
    RegistrationRequest request = new RegistrationRequest("alice", "secret1");
    when(manager.register(request)).thenThrow(RegistrationException.duplicateUsername());

    assertError(() -> resource.register(request), 400, "Username already exists");
  }

  @Test
  void register_persistenceFailure_isServerErrorWithGenericMessage() {
    RegistrationRequest request = new RegistrationRequest("alice", "secret1");
    when(manager.register(request)).thenThrow(new PersistenceException(
        PersistenceException.Reason.WRITE_FAILED, "Cannot write /var/data/users.json", null));

    assertError(() -> resource.register(request), 500, "Failed to save user data");
  }

  @Test
  void register_nullBody_isBadRequest() {
    assertError(() -> resource.register(null), 400, "Missing request body");
  }

  @Test
  void login_success_returnsManagerResponse() {
    BearerLoginResponse expected = new BearerLoginResponse("jwt", "bearer", "alice", 1800);
    when(manager.login(any(LoginRequest.class))).thenReturn(expected);

    assertThat(resource.login(new LoginRequest("alice", "secret1"))).isEqualTo(expected);
  }

  @Test
  void login_failure_isUnauthorizedWithChallenge() {
    when(manager.login(any(LoginRequest.class)))
        .thenThrow(new AuthFailureException(AuthFailureException.Reason.UNKNOWN_USER));

    assertThatThrownBy(() -> resource.login(new LoginRequest("mallory", "secret1")))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> {
          Response response = ((WebApplicationException) e).getResponse();
          assertThat(response.getStatus()).isEqualTo(401);
          assertThat(response.getHeaderString(HttpHeaders.WWW_AUTHENTICATE))
              .isEqualTo("Bearer realm=\"gatekeeper\"");
          assertThat(response.getEntity())
              .isEqualTo(new ErrorResponse(401, "Invalid credentials"));
        });
  }

  @Test
  void login_missingField_isBadRequest() {
    when(manager.login(any(LoginRequest.class)))
        .thenThrow(new IllegalArgumentException("Missing required field: password"));

    assertError(() -> resource.login(new LoginRequest("alice", null)), 400,
        "Missing required field: password");
  }

  private static void assertError(Runnable call, int status, String message) {
    assertThatThrownBy(call::run)
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> {
          Response response = ((WebApplicationException) e).getResponse();
          assertThat(response.getStatus()).isEqualTo(status);
          assertThat(response.getEntity()).isEqualTo(new ErrorResponse(status, message));
        });
  }
}
