package org.devops.customers.exception;

/**
 * Thrown when a customer operation fails for a reason the caller cannot fix,
 * typically a non-transient data access error. Rendered as HTTP 500.
 */
public class CustomerServiceException extends RuntimeException {

  public CustomerServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
