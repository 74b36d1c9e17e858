package org.devops.customers.service;

import io.hypersistence.tsid.TSID;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.devops.customers.domain.Customer;
import org.devops.customers.domain.CustomerEntity;
import org.devops.customers.domain.CustomerQuery;
import org.devops.customers.domain.CustomerRepository;
import org.devops.customers.exception.CustomerConflictException;
import org.devops.customers.exception.CustomerNotFoundException;
import org.devops.customers.exception.CustomerServiceException;
import org.devops.customers.exception.ServiceUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service layer for managing Customer records.
 * Every public method is a single transactional operation against the customers table.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

  public static final String SUSPENDED = "suspended";

  private final CustomerRepository customerRepository;
  private final Validator validator;

  /**
   * Retrieve a customer by their ID.
   *
   * @param id The ID of the customer to retrieve
   * @return The Customer object if found
   * @throws CustomerNotFoundException if no customer is found with the given ID
   */
  public Customer findById(Long id) {
    log.info("Finding customer by ID: {}", id);
    try {
      Customer customer = toCustomer(loadEntity(id));
      log.debug("Retrieved customer details: {}", customer);
      return customer;
    } catch (RuntimeException e) {
      return translateAndThrow(e, "Error retrieving customer with ID: " + id);
    }
  }

  /**
   * List customers, narrowed by at most one criterion. The first non-blank criterion of
   * name, address, email, phone number, member-since date and status is applied as an exact
   * match; the rest are ignored.
   *
   * @param query The listing criteria, may be empty
   * @return Matching customers ordered by ID
   */
  public List<Customer> findCustomers(CustomerQuery query) {
    CustomerQuery criteria = query == null ? CustomerQuery.none() : query;
    try {
      List<CustomerEntity> entities;
      if (StringUtils.isNotBlank(criteria.name())) {
        log.info("Find by name: {}", criteria.name());
        entities = customerRepository.findByNameOrderByIdAsc(criteria.name());
      } else if (StringUtils.isNotBlank(criteria.address())) {
        log.info("Find by address: {}", criteria.address());
        entities = customerRepository.findByAddressOrderByIdAsc(criteria.address());
      } else if (StringUtils.isNotBlank(criteria.email())) {
        log.info("Find by email: {}", criteria.email());
        entities = customerRepository.findByEmailOrderByIdAsc(criteria.email());
      } else if (StringUtils.isNotBlank(criteria.phoneNumber())) {
        log.info("Find by phone number: {}", criteria.phoneNumber());
        entities = customerRepository.findByPhoneNumberOrderByIdAsc(criteria.phoneNumber());
      } else if (criteria.memberSince() != null) {
        log.info("Find by member_since: {}", criteria.memberSince());
        entities = customerRepository.findByMemberSinceOrderByIdAsc(criteria.memberSince());
      } else if (StringUtils.isNotBlank(criteria.status())) {
        log.info("Find by status: {}", criteria.status());
        entities = customerRepository.findByStatusOrderByIdAsc(criteria.status());
      } else {
        log.info("Find all");
        entities = customerRepository.findAll(Sort.by(Sort.Direction.ASC, "id"));
      }
      List<Customer> customers = entities.stream().map(this::toCustomer).toList();
      log.info("Returning {} customers", customers.size());
      return customers;
    } catch (RuntimeException e) {
      return translateAndThrow(e, "Error listing customers");
    }
  }

  /**
   * Create a new customer. Any ID carried by the input is discarded and a new one generated.
   *
   * @param customer The customer to create
   * @return The created Customer with its assigned ID
   * @throws IllegalArgumentException if the customer is null
   */
  @Transactional
  public Customer create(Customer customer) {
    log.info("Starting customer creation process");
    log.debug("Input customer data: {}", customer);
    if (customer == null) {
      throw new IllegalArgumentException("Customer must not be null.");
    }

    try {
      Long customerId = TSID.Factory.getTsid().toLong();
      log.debug("Generated new customer ID: {}", customerId);

      CustomerEntity entity = new CustomerEntity();
      entity.setId(customerId);
      applyFields(entity, customer);

      var saved = toCustomer(customerRepository.saveAndFlush(entity));
      log.info("Customer with new id [{}] saved", saved.id());
      return saved;
    } catch (RuntimeException e) {
      return translateAndThrow(e, "Error creating customer");
    }
  }

  /**
   * Replace every mutable field of an existing customer. The ID is never changed, whatever the
   * body says. The customer is looked up before the body is checked, so a missing customer is
   * reported ahead of an invalid body.
   *
   * @param id The ID of the customer to update
   * @param inboundCustomer The replacement field values
   * @return The updated Customer
   * @throws CustomerNotFoundException if the customer does not exist
   * @throws ConstraintViolationException if the replacement values are not valid
   */
  @Transactional
  public Customer update(Long id, Customer inboundCustomer) {
    log.info("Request to update customer with ID: {}", id);
    log.debug("Update request data: {}", inboundCustomer);

    try {
      CustomerEntity existing = loadEntity(id);
      if (inboundCustomer == null) {
        throw new IllegalArgumentException("Customer must not be null.");
      }
      validate(inboundCustomer);
      if (inboundCustomer.id() != null && !inboundCustomer.id().equals(id)) {
        log.warn("Ignoring body ID {} on update of customer {}", inboundCustomer.id(), id);
      }
      applyFields(existing, inboundCustomer);
      var updated = toCustomer(customerRepository.saveAndFlush(existing));
      log.info("Customer with ID: {} updated", id);
      return updated;
    } catch (RuntimeException e) {
      return translateAndThrow(e, "Error updating customer with ID: " + id);
    }
  }

  /**
   * Mark a customer as suspended. No other field changes.
   *
   * @param id The ID of the customer to suspend
   * @return The suspended Customer
   * @throws CustomerNotFoundException if the customer does not exist
   */
  @Transactional
  public Customer suspend(Long id) {
    log.info("Request to suspend customer with ID: {}", id);
    try {
      CustomerEntity existing = loadEntity(id);
      existing.setStatus(SUSPENDED);
      var suspended = toCustomer(customerRepository.saveAndFlush(existing));
      log.info("Customer with ID: {} suspended", id);
      return suspended;
    } catch (RuntimeException e) {
      return translateAndThrow(e, "Error suspending customer with ID: " + id);
    }
  }

  /**
   * Delete a customer by their ID. Deleting an ID that does not exist is not an error.
   *
   * @param id The ID of the customer to delete
   */
  @Transactional
  public void delete(Long id) {
    log.info("Request to delete customer with ID: {}", id);
    try {
      customerRepository.findById(id)
          .ifPresentOrElse(
              entity -> {
                customerRepository.delete(entity);
                log.info("Customer with ID: {} deleted", id);
              },
              () -> log.info("Customer with ID: {} not present, nothing to delete", id));
    } catch (RuntimeException e) {
      translateAndThrow(e, "Error deleting customer with ID: " + id);
    }
  }

  private CustomerEntity loadEntity(Long id) {
    return customerRepository.findById(id)
        .orElseThrow(() -> new CustomerNotFoundException(id));
  }

  private void validate(Customer customer) {
    Set<ConstraintViolation<Customer>> violations = validator.validate(customer);
    if (!violations.isEmpty()) {
      log.info("Rejecting customer with {} invalid field(s)", violations.size());
      throw new ConstraintViolationException(violations);
    }
  }

  private void applyFields(CustomerEntity entity, Customer customer) {
    entity.setName(customer.name());
    entity.setAddress(customer.address());
    entity.setEmail(customer.email());
    entity.setPhoneNumber(customer.phoneNumber());
    entity.setMemberSince(customer.memberSince());
    entity.setStatus(customer.status());
  }

  private Customer toCustomer(CustomerEntity entity) {
    return Customer.builder()
        .id(entity.getId())
        .name(entity.getName())
        .address(entity.getAddress())
        .email(entity.getEmail())
        .phoneNumber(entity.getPhoneNumber())
        .memberSince(entity.getMemberSince())
        .status(entity.getStatus())
        .build();
  }

  /**
   * Translates Spring data access exceptions into application-specific exceptions so the
   * ControllerAdvice can render them with the right HTTP status. Application exceptions and
   * argument errors are rethrown unchanged.
   *
   * @param e The exception to translate
   * @param contextMessage A message providing context about the operation
   * @return Never returns - always throws an exception
   */
  private <T> T translateAndThrow(RuntimeException e, String contextMessage) {
    if (e instanceof CustomerNotFoundException
        || e instanceof CustomerConflictException
        || e instanceof ServiceUnavailableException
        || e instanceof CustomerServiceException
        || e instanceof IllegalArgumentException
        || e instanceof ConstraintViolationException) {
      log.debug("{}: {}", contextMessage, e.getMessage());
      throw e;
    }

    RuntimeException translated;
    if (e instanceof DataIntegrityViolationException) {
      log.warn("Data integrity violation: {}", contextMessage);
      translated = new CustomerConflictException(contextMessage + ". Possible constraint violation.", e);
    } else if (e instanceof QueryTimeoutException) {
      log.error("Database query timeout: {}", contextMessage);
      translated = new ServiceUnavailableException(contextMessage + " due to query timing out.", e);
    } else if (e instanceof TransientDataAccessResourceException) {
      log.error("Transient database error: {}", contextMessage);
      translated = new ServiceUnavailableException(
          contextMessage + " due to a transient resource issue.", e);
    } else if (e instanceof DataAccessException) {
      log.error("Database access error: {}", contextMessage, e);
      translated = new CustomerServiceException(contextMessage + " due to data access error.", e);
    } else {
      log.error("Unexpected error: {}", contextMessage, e);
      translated = new CustomerServiceException(contextMessage + " due to unexpected error.", e);
    }

    log.debug("Translated {} to {}", e.getClass().getSimpleName(), translated.getClass().getSimpleName());
    throw translated;
  }
}
