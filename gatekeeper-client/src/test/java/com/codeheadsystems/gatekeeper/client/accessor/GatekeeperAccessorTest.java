package com.codeheadsystems.gatekeeper.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gatekeeper.client.exceptions.GatekeeperAccessorException;
import com.codeheadsystems.gatekeeper.client.model.ServerConnectionInfo;
import com.codeheadsystems.gatekeeper.model.BasicLoginResponse;
import com.codeheadsystems.gatekeeper.model.BearerLoginResponse;
import com.codeheadsystems.gatekeeper.model.LoginRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GatekeeperAccessorTest {

  private static final URI BASE_URI = URI.create("http://localhost:8080");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private GatekeeperAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new GatekeeperAccessor(httpClient, new ObjectMapper(),
        new ServerConnectionInfo(BASE_URI));
  }

  // ── Registration ─────────────────────────────────────────────────────────

  @Test
  @SuppressWarnings("unchecked")
  void register_success_postsToRegisterEndpoint() throws Exception {
    respond(201, "{\"message\":\"User registered successfully\",\"username\":\"alice\"}");

    RegistrationResponse response = accessor.register(new RegistrationRequest("alice", "secret1"));

    assertThat(response.username()).isEqualTo("alice");
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().uri()).isEqualTo(URI.create("http://localhost:8080/auth/register"));
    assertThat(captor.getValue().method()).isEqualTo("POST");
  }

  @Test
  void register_badRequest_carriesServerMessageAndStatus() throws Exception {
    respond(400, "{\"code\":400,\"message\":\"Username already exists\"}");

    assertThatThrownBy(() -> accessor.register(new RegistrationRequest("alice", "secret1")))
        .isInstanceOf(GatekeeperAccessorException.class)
        .hasMessage("Username already exists")
        .satisfies(e -> assertThat(((GatekeeperAccessorException) e).statusCode()).isEqualTo(400));
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  @Test
  void loginBearer_success_returnsToken() throws Exception {
    respond(200, "{\"token\":\"abc.def.ghi\",\"tokenType\":\"bearer\",\"username\":\"alice\","
        + "\"expiresInSeconds\":1800}");

    BearerLoginResponse response = accessor.loginBearer(new LoginRequest("alice", "secret1"));

    assertThat(response.token()).isEqualTo("abc.def.ghi");
    assertThat(response.expiresInSeconds()).isEqualTo(1800);
  }

  @Test
  void loginBasic_success_returnsRole() throws Exception {
    respond(200, "{\"message\":\"Login successful\",\"username\":\"alice\",\"role\":\"customer\"}");

    BasicLoginResponse response = accessor.loginBasic(new LoginRequest("alice", "secret1"));

    assertThat(response.role()).isEqualTo("customer");
    assertThat(response.profile()).isNull();
  }

  @Test
  void login_unauthorized_throwsSecurityException() throws Exception {
    respond(401, "{\"code\":401,\"message\":\"Invalid credentials\"}");

    assertThatThrownBy(() -> accessor.loginBearer(new LoginRequest("alice", "wrong")))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Invalid credentials");
  }

  // ── Protected resources ───────────────────────────────────────────────────

  @Test
  @SuppressWarnings("unchecked")
  void get_sendsAuthorizationHeader() throws Exception {
    respond(200, "{\"username\":\"alice\"}");

    Map<String, Object> body = accessor.get("/api/whoami", GatekeeperAccessor.bearer("tok"), Map.class);

    assertThat(body).containsEntry("username", "alice");
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().headers().firstValue("Authorization")).hasValue("Bearer tok");
  }

  @Test
  void get_forbiddenWithoutJsonBody_usesStatusMessage() throws Exception {
    respond(403, "Forbidden");

    assertThatThrownBy(() -> accessor.get("/api/admin/whoami", null, Map.class))
        .isInstanceOf(GatekeeperAccessorException.class)
        .hasMessageContaining("HTTP 403")
        .satisfies(e -> assertThat(((GatekeeperAccessorException) e).statusCode()).isEqualTo(403));
  }

  @Test
  @SuppressWarnings("unchecked")
  void ioException_isWrapped() throws Exception {
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> accessor.loginBearer(new LoginRequest("alice", "secret1")))
        .isInstanceOf(GatekeeperAccessorException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void basic_encodesUsernameAndPassword() {
    assertThat(GatekeeperAccessor.basic("alice", "secret1")).isEqualTo("Basic YWxpY2U6c2VjcmV0MQ==");
  }

  @SuppressWarnings("unchecked")
  private void respond(int status, String body) throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(status);
    when(httpResponse.body()).thenReturn(body);
  }
}
