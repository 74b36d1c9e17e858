package org.devops.customers.rest;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.devops.customers.domain.Customer;
import org.devops.customers.domain.CustomerQuery;
import org.devops.customers.service.CustomerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * REST controller for the Customer resource and its collection.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class CustomerController implements CustomerAPI {

  private final CustomerService customerService;

  @Override
  public ResponseEntity<Customer> getCustomer(Long id) {
    log.debug("REST request to get Customer: {}", id);
    return ResponseEntity.ok(customerService.findById(id));
  }

  @Override
  public ResponseEntity<List<Customer>> listCustomers(
      String name,
      String address,
      String email,
      String phoneNumber,
      LocalDate memberSince,
      String status) {
    log.info("REST request for customer list");
    CustomerQuery query = CustomerQuery.builder()
        .name(name)
        .address(address)
        .email(email)
        .phoneNumber(phoneNumber)
        .memberSince(memberSince)
        .status(status)
        .build();
    return ResponseEntity.ok(customerService.findCustomers(query));
  }

  /**
   * Creates a new customer and answers with the location of the new resource.
   */
  @Override
  public ResponseEntity<Customer> createCustomer(Customer customer) {
    log.debug("REST request to create Customer: {}", customer);
    var result = customerService.create(customer);
    URI location = ServletUriComponentsBuilder.fromCurrentContextPath()
        .path(ApiConstants.ApiPath.CUSTOMERS + ApiConstants.ApiPath.ID_PATH_VAR)
        .buildAndExpand(result.id())
        .toUri();
    return ResponseEntity.created(location).body(result);
  }

  @Override
  public ResponseEntity<Customer> updateCustomer(Long id, Customer customer) {
    log.debug("REST request to update Customer {}: {}", id, customer);
    return ResponseEntity.ok(customerService.update(id, customer));
  }

  /**
   * Deletes a customer. Always answers 204, whether or not the customer existed.
   */
  @Override
  public ResponseEntity<Void> deleteCustomer(Long id) {
    log.debug("REST request to delete Customer: {}", id);
    customerService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<Customer> suspendCustomer(Long id) {
    log.debug("REST request to suspend Customer: {}", id);
    return ResponseEntity.ok(customerService.suspend(id));
  }
}
