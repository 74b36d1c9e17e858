package org.devops.customers.exception;

/**
 * Thrown when the store rejects a write because it breaks a table constraint.
 * Rendered as HTTP 409 - Conflict.
 */
public class CustomerConflictException extends RuntimeException {

  /**
   * @param message The error message.
   * @param cause   The constraint violation reported by the store.
   */
  public CustomerConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
