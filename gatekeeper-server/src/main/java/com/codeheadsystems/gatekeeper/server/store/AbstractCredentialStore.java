package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.exception.PersistenceException;
import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base {@link CredentialStore} that owns the locking discipline. Subclasses only read and write
 * the raw document.
 */
public abstract class AbstractCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(AbstractCredentialStore.class);

  private final ReentrantLock writeLock = new ReentrantLock();

  /**
   * Reads the whole document.
   *
   * @return the mapping; empty if the backing resource does not exist yet
   * @throws PersistenceException with {@code READ_FAILED} if it exists but cannot be read
   */
  protected abstract Map<String, CredentialRecord> readDocument();

  /**
   * Replaces the whole document. Either the new document is fully in place afterwards, or the
   * previous one is untouched.
   *
   * @param records the new mapping
   * @throws PersistenceException with {@code WRITE_FAILED} on failure
   */
  protected abstract void writeDocument(Map<String, CredentialRecord> records);

  @Override
  public void start() {
    log.debug("start()");
  }

  @Override
  public void stop() {
    log.debug("stop()");
  }

  @Override
  public Map<String, CredentialRecord> load() {
    try {
      return Collections.unmodifiableMap(readDocument());
    } catch (PersistenceException e) {
      log.error("Error loading credential document, treating it as empty: {}", e.getMessage());
      return Map.of();
    }
  }

  @Override
  public void save(Map<String, CredentialRecord> records) {
    writeLock.lock();
    try {
      writeDocument(new LinkedHashMap<>(records));
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public <T> T update(Function<Map<String, CredentialRecord>, T> mutation) {
    writeLock.lock();
    try {
      Map<String, CredentialRecord> working = new LinkedHashMap<>(readDocument());
      T result = mutation.apply(working);
      writeDocument(working);
      return result;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public boolean isReadable() {
    try {
      readDocument();
      return true;
    } catch (PersistenceException e) {
      log.debug("Credential document not readable: {}", e.getMessage());
      return false;
    }
  }
}
