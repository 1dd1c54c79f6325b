package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore}. Each save swaps in a fresh immutable snapshot,
 * so readers never observe a half-applied write.
 * <p>
 * All accounts are lost on restart. Suitable for development and tests only.
 */
public class InMemoryCredentialStore extends AbstractCredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private volatile Map<String, CredentialRecord> snapshot = Map.of();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore, accounts will NOT survive restarts. "
        + "Use JsonFileCredentialStore for anything that must persist.");
  }

  @Override
  protected Map<String, CredentialRecord> readDocument() {
    return snapshot;
  }

  @Override
  protected void writeDocument(Map<String, CredentialRecord> records) {
    snapshot = Map.copyOf(records);
    log.debug("Stored {} credential record(s)", records.size());
  }
}
