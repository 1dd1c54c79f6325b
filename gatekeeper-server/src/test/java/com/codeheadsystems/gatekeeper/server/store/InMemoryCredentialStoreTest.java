package com.codeheadsystems.gatekeeper.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryCredentialStoreTest {

  private InMemoryCredentialStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryCredentialStore();
  }

  @Test
  void load_returnsUnmodifiableSnapshot() {
    store.save(Map.of("alice", new CredentialRecord("alice", "abc", null, null)));

    Map<String, CredentialRecord> loaded = store.load();
    assertThatThrownBy(() -> loaded.remove("alice"))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThat(store.find("alice")).isPresent();
  }

  @Test
  void update_returnsMutationResult() {
    Integer size = store.update(records -> {
      records.put("alice", new CredentialRecord("alice", "abc", null, null));
      return records.size();
    });

    assertThat(size).isEqualTo(1);
    assertThat(store.isReadable()).isTrue();
  }

  @Test
  void concurrentUpdates_loseNothing() throws Exception {
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        String username = "user" + i;
        futures.add(executor.submit(() -> {
          start.await();
          return store.update(records ->
              records.put(username, new CredentialRecord(username, "digest", null, null)));
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(store.load()).hasSize(threads);
  }
}
