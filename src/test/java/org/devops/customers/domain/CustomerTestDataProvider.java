package org.devops.customers.domain;

import io.hypersistence.tsid.TSID;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.TimeUnit;
import net.datafaker.Faker;

public class CustomerTestDataProvider {
  private static final Faker faker = new Faker();

  /** A valid customer as a client would post it, without an id. */
  public static Customer createNewCustomer() {
    return Customer.builder()
        .name(faker.name().fullName())
        .address(faker.address().fullAddress())
        .email(faker.internet().emailAddress())
        .phoneNumber(faker.numerify("###-###-####"))
        .memberSince(randomMemberSince())
        .status("active")
        .build();
  }

  /** A valid customer as the service would return it, with an assigned id. */
  public static Customer createSavedCustomer() {
    return createNewCustomer().toBuilder()
        .id(TSID.Factory.getTsid().toLong())
        .build();
  }

  /** A replacement body for an existing customer: every mutable field differs from the original. */
  public static Customer createReplacementFor(Customer original) {
    return Customer.builder()
        .id(original.id())
        .name(original.name() + " Jr")
        .address(faker.address().fullAddress())
        .email("updated." + faker.internet().emailAddress())
        .phoneNumber(faker.numerify("###-###-####"))
        .memberSince(original.memberSince().minusDays(1))
        .status("inactive")
        .build();
  }

  public static Customer createCustomerWithMissingName(Customer customer) {
    return customer.toBuilder().name(null).build();
  }

  public static Customer createCustomerWithBlankAddress(Customer customer) {
    return customer.toBuilder().address("   ").build();
  }

  public static Customer createCustomerWithInvalidEmail(Customer customer) {
    return customer.toBuilder().email("not-an-email").build();
  }

  public static Customer createCustomerWithMissingMemberSince(Customer customer) {
    return customer.toBuilder().memberSince(null).build();
  }

  public static CustomerEntity createCustomerEntity(Customer customer) {
    CustomerEntity entity = new CustomerEntity();
    entity.setId(customer.id());
    entity.setName(customer.name());
    entity.setAddress(customer.address());
    entity.setEmail(customer.email());
    entity.setPhoneNumber(customer.phoneNumber());
    entity.setMemberSince(customer.memberSince());
    entity.setStatus(customer.status());
    return entity;
  }

  public static CustomerEntity createSavedCustomerEntity() {
    return createCustomerEntity(createSavedCustomer());
  }

  private static LocalDate randomMemberSince() {
    return faker.date().past(3650, TimeUnit.DAYS)
        .toInstant()
        .atZone(ZoneId.of("UTC"))
        .toLocalDate();
  }
}
