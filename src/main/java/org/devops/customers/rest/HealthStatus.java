package org.devops.customers.rest;

public record HealthStatus(
    int status,
    String message
) {

  public static HealthStatus healthy() {
    return new HealthStatus(200, "Healthy");
  }
}
