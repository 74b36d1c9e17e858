package org.devops.customers.rest;

import static org.devops.customers.rest.ApiConstants.ApiPath.CUSTOMERS;
import static org.devops.customers.rest.ApiConstants.ApiPath.ID_PATH_VAR;
import static org.devops.customers.rest.ApiConstants.ApiPath.SUSPEND;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import org.devops.customers.domain.Customer;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Customers", description = "Create, read, update, delete and list customers.")
@RequestMapping(
    value = CUSTOMERS,
    produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public interface CustomerAPI {

  @Operation(summary = "Retrieve a customer by ID")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Customer found successfully"),
        @ApiResponse(responseCode = "404", description = "Customer not found"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
      })
  @GetMapping(value = ID_PATH_VAR)
  ResponseEntity<Customer> getCustomer(
      @Parameter(description = "The Customer identifier") @PathVariable Long id);

  @Operation(
      summary = "List customers",
      description = "Returns every customer, or only those matching the first supplied filter "
          + "in the order name, address, email, phone_number, member_since, status.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "List of customers"),
      @ApiResponse(responseCode = "400", description = "Invalid member_since date")
  })
  @GetMapping({"", "/"})
  ResponseEntity<List<Customer>> listCustomers(
      @RequestParam(value = ApiConstants.QueryParam.NAME, required = false) String name,
      @RequestParam(value = ApiConstants.QueryParam.ADDRESS, required = false) String address,
      @RequestParam(value = ApiConstants.QueryParam.EMAIL, required = false) String email,
      @RequestParam(value = ApiConstants.QueryParam.PHONE_NUMBER, required = false)
          String phoneNumber,
      @RequestParam(value = ApiConstants.QueryParam.MEMBER_SINCE, required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate memberSince,
      @RequestParam(value = ApiConstants.QueryParam.STATUS, required = false) String status);

  @Operation(summary = "Create a new customer")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Customer created successfully"),
        @ApiResponse(responseCode = "400", description = "The posted data was not valid"),
        @ApiResponse(responseCode = "415", description = "Content-Type is not application/json"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
      })
  @PostMapping(value = {"", "/"}, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Customer> createCustomer(@Valid @RequestBody Customer customer);

  /**
   * The body is validated by the service after the customer is found, so an unknown id answers
   * 404 whatever the body holds.
   */
  @Operation(summary = "Replace an existing customer")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Customer updated successfully"),
        @ApiResponse(responseCode = "400", description = "The posted Customer data was not valid"),
        @ApiResponse(responseCode = "404", description = "Customer not found"),
        @ApiResponse(responseCode = "415", description = "Content-Type is not application/json")
      })
  @PutMapping(value = ID_PATH_VAR, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Customer> updateCustomer(
      @PathVariable Long id, @RequestBody(required = false) Customer customer);

  @Operation(summary = "Delete a customer")
  @ApiResponse(responseCode = "204", description = "Customer deleted, or was never there")
  @DeleteMapping(value = ID_PATH_VAR)
  ResponseEntity<Void> deleteCustomer(@PathVariable Long id);

  @Operation(summary = "Suspend a customer's account")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Customer suspended"),
      @ApiResponse(responseCode = "404", description = "Customer not found")
  })
  @PutMapping(value = ID_PATH_VAR + SUSPEND)
  ResponseEntity<Customer> suspendCustomer(@PathVariable Long id);
}
