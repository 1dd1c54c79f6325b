package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Whole-document storage for credential records, keyed by username.
 * <p>
 * Every write replaces the entire collection; there is no per-record update. Implementations must
 * be thread-safe:
 * <ul>
 *   <li>readers ({@link #load()}, {@link #find(String)}) never block on writers and always see
 *       the last completely saved document;</li>
 *   <li>writers ({@link #save(Map)}, {@link #update(Function)}) are serialized behind a single
 *       whole-document lock, so concurrent read-modify-write cycles cannot lose updates.</li>
 * </ul>
 */
public interface CredentialStore {

  /**
   * Opens the store. Called once at process start.
   */
  void start();

  /**
   * Closes the store. Called once at shutdown.
   */
  void stop();

  /**
   * Loads the whole document.
   * <p>
   * A missing or unreadable backing resource yields an empty mapping instead of an error, so an
   * empty result is not proof that no users exist. Use {@link #update(Function)} for anything that
   * writes back.
   *
   * @return an unmodifiable mapping of username to record
   */
  Map<String, CredentialRecord> load();

  /**
   * Looks up one record in the current document.
   *
   * @param username the username, case-sensitive
   * @return the record, or empty if absent
   */
  default Optional<CredentialRecord> find(String username) {
    return Optional.ofNullable(load().get(username));
  }

  /**
   * Replaces the whole document.
   *
   * @param records the complete new mapping
   * @throws com.codeheadsystems.gatekeeper.server.exception.PersistenceException if the document
   *                                                                             cannot be written
   */
  void save(Map<String, CredentialRecord> records);

  /**
   * Runs a read-modify-write cycle under the writer lock: reads the current document, hands a
   * mutable copy to {@code mutation}, and saves the copy if the mutation returns normally. If the
   * mutation throws, nothing is written and the exception propagates.
   *
   * @param mutation changes the mapping in place and returns a result for the caller
   * @param <T>      the result type
   * @return the mutation's result
   * @throws com.codeheadsystems.gatekeeper.server.exception.PersistenceException if the existing
   *                                                                             document cannot be
   *                                                                             read or the new one
   *                                                                             cannot be written
   */
  <T> T update(Function<Map<String, CredentialRecord>, T> mutation);

  /**
   * Whether the backing resource can currently be read.
   *
   * @return true if a read would succeed
   */
  boolean isReadable();
}
