package com.codeheadsystems.gatekeeper.server.exception;

/**
 * Thrown when a presented credential, token or permission check fails.
 * <p>
 * The {@link Reason} is for logs and for picking the HTTP status; it must never reach the client
 * as-is. {@link #getMessage()} only ever returns the uniform external message of the reason's
 * {@link Category}, so an unknown username and a wrong password are indistinguishable from the
 * outside.
 */
public class AuthFailureException extends SecurityException {

  private final Reason reason;

  /**
   * Instantiates a new auth failure.
   *
   * @param reason why authentication or authorization failed
   */
  public AuthFailureException(Reason reason) {
    super(reason.category().externalMessage());
    this.reason = reason;
  }

  /**
   * Instantiates a new auth failure with an underlying cause.
   *
   * @param reason why authentication or authorization failed
   * @param cause  the cause
   */
  public AuthFailureException(Reason reason, Throwable cause) {
    super(reason.category().externalMessage(), cause);
    this.reason = reason;
  }

  /**
   * The internal reason.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * The externally visible category.
   *
   * @return the category
   */
  public Category category() {
    return reason.category();
  }

  /**
   * Why a request could not be authenticated or authorized.
   */
  public enum Reason {
    UNKNOWN_USER(Category.INVALID_CREDENTIALS),
    BAD_SECRET(Category.INVALID_CREDENTIALS),
    EXPIRED(Category.INVALID_TOKEN),
    MALFORMED_OR_UNSIGNED(Category.INVALID_TOKEN),
    FORBIDDEN(Category.FORBIDDEN);

    private final Category category;

    Reason(Category category) {
      this.category = category;
    }

    /**
     * The externally visible category.
     *
     * @return the category
     */
    public Category category() {
      return category;
    }
  }

  /**
   * What the client is allowed to learn about a failure.
   */
  public enum Category {
    INVALID_CREDENTIALS(401, "Invalid credentials"),
    INVALID_TOKEN(401, "Could not validate credentials"),
    FORBIDDEN(403, "Insufficient permissions");

    private final int status;
    private final String externalMessage;

    Category(int status, String externalMessage) {
      this.status = status;
      this.externalMessage = externalMessage;
    }

    /**
     * The HTTP status for this category.
     *
     * @return 401 or 403
     */
    public int status() {
      return status;
    }

    /**
     * The message shown to clients.
     *
     * @return the message
     */
    public String externalMessage() {
      return externalMessage;
    }
  }
}
