package com.codeheadsystems.gatekeeper.server.exception;

/**
 * Thrown when the credential document cannot be read for a mutation or cannot be written.
 * Never retried: the triggering request fails with a server error.
 */
public class PersistenceException extends RuntimeException {

  /**
   * Message shown to clients for any persistence failure.
   */
  public static final String EXTERNAL_MESSAGE = "Failed to save user data";

  private final Reason reason;

  /**
   * Instantiates a new persistence exception.
   *
   * @param reason  read or write
   * @param message internal description
   * @param cause   the underlying failure
   */
  public PersistenceException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /**
   * Read or write.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Which side of the store failed.
   */
  public enum Reason {
    READ_FAILED,
    WRITE_FAILED
  }
}
