package com.codeheadsystems.gatekeeper.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.codeheadsystems.gatekeeper.server.exception.PersistenceException;
import com.codeheadsystems.gatekeeper.server.exception.RegistrationException;
import com.codeheadsystems.gatekeeper.server.exception.RegistrationException.Reason;
import com.codeheadsystems.gatekeeper.server.hash.SaltedSha256PasswordHasher;
import com.codeheadsystems.gatekeeper.server.model.Account;
import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import com.codeheadsystems.gatekeeper.server.model.Role;
import com.codeheadsystems.gatekeeper.server.store.InMemoryCredentialStore;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegistrationManagerTest {

  private static final GatekeeperSettings SETTINGS = GatekeeperSettings.defaults("test_salt",
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8));

  private final SaltedSha256PasswordHasher hasher = new SaltedSha256PasswordHasher("test_salt");

  private InMemoryCredentialStore store;
  private RegistrationManager manager;

  @BeforeEach
  void setUp() {
    store = new InMemoryCredentialStore();
    manager = new RegistrationManager(store, hasher, SETTINGS);
  }

  @Test
  void register_storesDigestNotPassword() {
    Account account = manager.register("alice", "secret1", null, Map.of("email", "a@example.com"));

    assertThat(account.username()).isEqualTo("alice");
    assertThat(account.profile()).containsEntry("email", "a@example.com");
    CredentialRecord record = store.find("alice").orElseThrow();
    assertThat(record.passwordHash()).isEqualTo(hasher.hash("secret1"));
    assertThat(record.passwordHash()).doesNotContain("secret1");
  }

  @Test
  void register_notRoleAware_ignoresRequestedRole() {
    Account account = manager.register("alice", "secret1", Role.ADMIN, null);

    assertThat(account.role()).isNull();
    assertThat(store.find("alice").orElseThrow().role()).isNull();
  }

  @Test
  void register_roleAware_defaultsToCustomer() {
    manager = new RegistrationManager(store, hasher, SETTINGS.withRoleAware(true));

    assertThat(manager.register("alice", "secret1", null, null).role()).isEqualTo(Role.CUSTOMER);
    assertThat(manager.register("root", "secret1", Role.ADMIN, null).role()).isEqualTo(Role.ADMIN);
  }

  @Test
  void register_duplicateUsername_winsOverEveryOtherRule() {
    manager.register("alice", "secret1", null, null);

    // "alice" with a too-short password still reports the duplicate first
    assertRejected("alice", "x", Reason.DUPLICATE_USERNAME, "Username already exists");
  }

  @Test
  void register_shortUsername_winsOverShortPassword() {
    assertRejected("ab", "x", Reason.USERNAME_TOO_SHORT,
        "Username must be at least 3 characters long");
  }

  @Test
  void register_usernameLengthIsMeasuredTrimmed() {
    assertRejected("  ab  ", "secret1", Reason.USERNAME_TOO_SHORT,
        "Username must be at least 3 characters long");
  }

  @Test
  void register_shortPassword_isRejected() {
    assertRejected("alice", "12345", Reason.PASSWORD_TOO_SHORT,
        "Password must be at least 6 characters long");
    assertRejected("alice", "", Reason.PASSWORD_TOO_SHORT,
        "Password must be at least 6 characters long");
  }

  @Test
  void register_boundaryLengths_areAccepted() {
    assertThat(manager.register("abc", "123456", null, null).username()).isEqualTo("abc");
  }

  @Test
  void register_usernameIsStoredUntrimmed() {
    manager.register(" alice ", "secret1", null, null);

    assertThat(store.load()).containsOnlyKeys(" alice ");
  }

  @Test
  void register_rejected_writesNothing() {
    assertRejected("ab", "secret1", Reason.USERNAME_TOO_SHORT,
        "Username must be at least 3 characters long");

    assertThat(store.load()).isEmpty();
  }

  @Test
  @SuppressWarnings("unchecked")
  void register_storeFailure_propagates() {
    InMemoryCredentialStore failing = spy(new InMemoryCredentialStore());
    doThrow(new PersistenceException(PersistenceException.Reason.WRITE_FAILED, "disk full", null))
        .when(failing).update(any(Function.class));
    manager = new RegistrationManager(failing, hasher, SETTINGS);

    assertThatThrownBy(() -> manager.register("alice", "secret1", null, null))
        .isInstanceOf(PersistenceException.class);
  }

  @Test
  void register_concurrentDistinctUsers_allPresent() throws Exception {
    int threads = 20;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Account>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        String username = "user" + i;
        futures.add(executor.submit(() -> {
          start.await();
          return manager.register(username, "secret1", null, null);
        }));
      }
      start.countDown();
      for (Future<Account> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(store.load()).hasSize(threads);
  }

  @Test
  void register_concurrentSameUser_exactlyOneWins() throws Exception {
    int threads = 10;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    int duplicates = 0;
    try {
      List<Future<Account>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          return manager.register("alice", "secret1", null, null);
        }));
      }
      start.countDown();
      for (Future<Account> future : futures) {
        try {
          future.get();
        } catch (ExecutionException e) {
          assertThat(e.getCause()).isInstanceOf(RegistrationException.class);
          duplicates++;
        }
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(duplicates).isEqualTo(threads - 1);
    assertThat(store.load()).hasSize(1);
  }

  @Test
  void bootstrapAdministrator_createsOnceAndLeavesExistingAlone() {
    assertThat(manager.bootstrapAdministrator("admin", "admin123")).isTrue();
    assertThat(store.find("admin").orElseThrow().role()).isEqualTo(Role.ADMIN);

    String digest = store.find("admin").orElseThrow().passwordHash();
    assertThat(manager.bootstrapAdministrator("admin", "changed!")).isFalse();
    assertThat(store.find("admin").orElseThrow().passwordHash()).isEqualTo(digest);
  }

  private void assertRejected(String username, String password, Reason reason, String message) {
    assertThatThrownBy(() -> manager.register(username, password, null, null))
        .isInstanceOf(RegistrationException.class)
        .hasMessage(message)
        .satisfies(e -> assertThat(((RegistrationException) e).reason()).isEqualTo(reason));
  }
}
