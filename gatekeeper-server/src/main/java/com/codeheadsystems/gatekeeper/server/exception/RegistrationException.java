package com.codeheadsystems.gatekeeper.server.exception;

/**
 * Thrown when a registration request fails validation. The message is safe to show to clients.
 */
public class RegistrationException extends IllegalArgumentException {

  private final Reason reason;

  /**
   * Instantiates a new registration exception.
   *
   * @param reason  the rule that was violated
   * @param message the client-facing message
   */
  public RegistrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Duplicate username.
   *
   * @return the exception
   */
  public static RegistrationException duplicateUsername() {
    return new RegistrationException(Reason.DUPLICATE_USERNAME, "Username already exists");
  }

  /**
   * Username below the configured minimum.
   *
   * @param minLength the configured minimum
   * @return the exception
   */
  public static RegistrationException usernameTooShort(int minLength) {
    return new RegistrationException(Reason.USERNAME_TOO_SHORT,
        "Username must be at least " + minLength + " characters long");
  }

  /**
   * Password below the configured minimum.
   *
   * @param minLength the configured minimum
   * @return the exception
   */
  public static RegistrationException passwordTooShort(int minLength) {
    return new RegistrationException(Reason.PASSWORD_TOO_SHORT,
        "Password must be at least " + minLength + " characters long");
  }

  /**
   * The violated rule.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Registration rules, in the order they are checked.
   */
  public enum Reason {
    DUPLICATE_USERNAME,
    USERNAME_TOO_SHORT,
    PASSWORD_TOO_SHORT
  }
}
