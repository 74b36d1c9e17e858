package org.devops.customers.domain;

import java.time.LocalDate;
import lombok.Builder;

/**
 * Optional listing criteria. Only one criterion is ever applied: the first one set, in declaration
 * order.
 */
@Builder
public record CustomerQuery(
    String name,
    String address,
    String email,
    String phoneNumber,
    LocalDate memberSince,
    String status
) {

  public static CustomerQuery none() {
    return CustomerQuery.builder().build();
  }
}
