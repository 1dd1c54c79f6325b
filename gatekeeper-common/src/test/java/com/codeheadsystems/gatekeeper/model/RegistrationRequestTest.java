package com.codeheadsystems.gatekeeper.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class RegistrationRequestTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void deserialize_usesSnakeCaseFullName() throws Exception {
    String json = "{\"username\":\"john_doe\",\"password\":\"secure123\","
        + "\"email\":\"john@example.com\",\"full_name\":\"John Doe\"}";

    RegistrationRequest req = mapper.readValue(json, RegistrationRequest.class);

    assertThat(req.username()).isEqualTo("john_doe");
    assertThat(req.fullName()).isEqualTo("John Doe");
    assertThat(req.email()).isEqualTo("john@example.com");
    assertThat(req.role()).isNull();
  }

  @Test
  void requireUsername_null_throwsIAE() {
    RegistrationRequest req = new RegistrationRequest(null, "secret1");
    assertThatThrownBy(req::requireUsername)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing required field: username");
  }

  @Test
  void requirePassword_emptyIsNotMissing() {
    RegistrationRequest req = new RegistrationRequest("alice", "");
    assertThat(req.requirePassword()).isEmpty();
  }

  @Test
  void toString_doesNotContainPassword() {
    RegistrationRequest req = new RegistrationRequest("alice", "secret1");
    assertThat(req.toString()).contains("alice").doesNotContain("secret1");
  }
}
