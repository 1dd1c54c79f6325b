package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.exception.PersistenceException;
import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} persisted as a single JSON object keyed by username.
 * <p>
 * Saves write the complete document to a temporary file in the same directory and then rename it
 * over the target, so a reader sees either the previous document or the new one and a failed save
 * leaves the previous document intact.
 * <p>
 * A zero-length file is treated like a missing one. A file that exists but is not a JSON object of
 * credential entries is unreadable: {@link #load()} reports it as empty, and
 * {@link #update(java.util.function.Function)} refuses to overwrite it.
 */
public class JsonFileCredentialStore extends AbstractCredentialStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileCredentialStore.class);
  private static final TypeReference<LinkedHashMap<String, StoredCredential>> DOCUMENT_TYPE =
      new TypeReference<>() {
      };

  private final Path path;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new JSON file credential store.
   *
   * @param path         the document location
   * @param objectMapper the mapper used for the document
   */
  public JsonFileCredentialStore(Path path, ObjectMapper objectMapper) {
    this.path = path.toAbsolutePath();
    this.objectMapper = objectMapper;
  }

  /**
   * The document location.
   *
   * @return the absolute path
   */
  public Path path() {
    return path;
  }

  @Override
  public void start() {
    Path parent = path.getParent();
    try {
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      throw new PersistenceException(PersistenceException.Reason.WRITE_FAILED,
          "Cannot create directory for credential document: " + parent, e);
    }
    log.info("Credential document at {} ({})", path, Files.exists(path) ? "existing" : "new");
  }

  @Override
  public void stop() {
    log.info("Closing credential document at {}", path);
  }

  @Override
  protected Map<String, CredentialRecord> readDocument() {
    try {
      if (!Files.exists(path) || Files.size(path) == 0) {
        return new LinkedHashMap<>();
      }
      LinkedHashMap<String, StoredCredential> document = objectMapper.readValue(path.toFile(), DOCUMENT_TYPE);
      if (document == null) {
        throw new IOException("Credential document is null");
      }
      Map<String, CredentialRecord> records = new LinkedHashMap<>();
      for (Map.Entry<String, StoredCredential> entry : document.entrySet()) {
        StoredCredential stored = entry.getValue();
        if (stored == null || !stored.hasPasswordHash()) {
          throw new IOException("Entry without password_hash: " + entry.getKey());
        }
        records.put(entry.getKey(), stored.toRecord(entry.getKey()));
      }
      return records;
    } catch (IOException | IllegalArgumentException e) {
      throw new PersistenceException(PersistenceException.Reason.READ_FAILED,
          "Cannot read credential document " + path + ": " + e.getMessage(), e);
    }
  }

  @Override
  protected void writeDocument(Map<String, CredentialRecord> records) {
    Map<String, StoredCredential> document = new LinkedHashMap<>();
    records.forEach((username, record) -> document.put(username, StoredCredential.from(record)));

    Path temp = null;
    try {
      temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
      moveIntoPlace(temp);
      log.debug("Saved {} credential record(s) to {}", records.size(), path);
    } catch (IOException e) {
      deleteQuietly(temp);
      log.error("Error saving credential document {}: {}", path, e.getMessage());
      throw new PersistenceException(PersistenceException.Reason.WRITE_FAILED,
          "Cannot write credential document " + path, e);
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to replace", path);
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not delete temporary credential file {}: {}", temp, e.getMessage());
    }
  }
}
