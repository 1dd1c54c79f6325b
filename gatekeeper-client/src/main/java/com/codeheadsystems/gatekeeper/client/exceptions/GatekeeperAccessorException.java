package com.codeheadsystems.gatekeeper.client.exceptions;

/**
 * Thrown when a gatekeeper server call fails for a reason other than rejected credentials.
 */
public class GatekeeperAccessorException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new accessor exception for a transport failure.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GatekeeperAccessorException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * Instantiates a new accessor exception for an HTTP error status.
   *
   * @param statusCode the HTTP status
   * @param message    the message, including the server's error text when present
   */
  public GatekeeperAccessorException(final int statusCode, final String message) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * The HTTP status returned by the server, or -1 if no response was received.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }
}
