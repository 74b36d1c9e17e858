package org.devops.customers.exception;

/**
 * Thrown when no customer row exists for the requested id.
 * Rendered as HTTP 404 - Not Found.
 */
public class CustomerNotFoundException extends RuntimeException {

  /**
   * @param id The customer id that was looked up.
   */
  public CustomerNotFoundException(Long id) {
    super("Customer with id '" + id + "' was not found.");
  }
}
