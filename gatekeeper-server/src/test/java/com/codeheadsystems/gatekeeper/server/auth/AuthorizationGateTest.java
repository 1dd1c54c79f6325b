package com.codeheadsystems.gatekeeper.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException.Reason;
import com.codeheadsystems.gatekeeper.server.model.AuthContext;
import com.codeheadsystems.gatekeeper.server.model.Role;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthorizationGateTest {

  private static final AuthContext ADMIN = new AuthContext("root", Role.ADMIN, Map.of());
  private static final AuthContext CUSTOMER = new AuthContext("alice", Role.CUSTOMER, Map.of());
  private static final AuthContext NO_ROLE = new AuthContext("bob", null, Map.of());

  private final AuthorizationGate gate = new AuthorizationGate();

  @Test
  void noRequiredRole_allowsAnyAuthenticatedIdentity() {
    assertThat(gate.isAllowed(ADMIN, null)).isTrue();
    assertThat(gate.isAllowed(CUSTOMER, null)).isTrue();
    assertThat(gate.isAllowed(NO_ROLE, null)).isTrue();
  }

  @Test
  void requiredRole_allowsOnlyThatRole() {
    assertThat(gate.isAllowed(ADMIN, Role.ADMIN)).isTrue();
    assertThat(gate.isAllowed(CUSTOMER, Role.ADMIN)).isFalse();
    assertThat(gate.isAllowed(NO_ROLE, Role.ADMIN)).isFalse();
  }

  @Test
  void authorize_denied_isForbidden() {
    assertThatThrownBy(() -> gate.authorize(CUSTOMER, Role.ADMIN))
        .isInstanceOf(AuthFailureException.class)
        .hasMessage("Insufficient permissions")
        .satisfies(e -> {
          AuthFailureException failure = (AuthFailureException) e;
          assertThat(failure.reason()).isEqualTo(Reason.FORBIDDEN);
          assertThat(failure.category().status()).isEqualTo(403);
        });
  }

  @Test
  void authorize_allowed_returnsNormally() {
    assertThatCode(() -> gate.authorize(ADMIN, Role.ADMIN)).doesNotThrowAnyException();
  }
}
