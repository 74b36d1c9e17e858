package org.devops.customers.exception;

/**
 * Thrown when the database times out or reports a transient resource failure.
 * The request may succeed if retried. Rendered as HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

  /**
   * @param message The error message.
   * @param cause   The timeout or transient failure.
   */
  public ServiceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
