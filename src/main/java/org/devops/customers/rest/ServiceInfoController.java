package org.devops.customers.rest;

import static org.devops.customers.rest.ApiConstants.ApiPath.CUSTOMERS;
import static org.devops.customers.rest.ApiConstants.ApiPath.HEALTH;
import static org.devops.customers.rest.ApiConstants.ApiPath.ROOT;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Service root and liveness endpoints. Only GET is mapped on the root, so any other verb is
 * answered with 405 by the {@link ExceptionTranslator}.
 */
@Tag(name = "Service", description = "Service metadata and liveness.")
@RestController
@Slf4j
public class ServiceInfoController {

  private final String serviceName;
  private final String serviceVersion;

  public ServiceInfoController(
      @Value("${customers.service.name}") String serviceName,
      @Value("${customers.service.version}") String serviceVersion) {
    this.serviceName = serviceName;
    this.serviceVersion = serviceVersion;
  }

  @Operation(summary = "Service metadata")
  @GetMapping(value = ROOT, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ServiceInfo> index() {
    log.info("Request for Root URL");
    String customersUrl = ServletUriComponentsBuilder.fromCurrentContextPath()
        .path(CUSTOMERS)
        .toUriString();
    return ResponseEntity.ok(new ServiceInfo(serviceName, serviceVersion, customersUrl));
  }

  @Operation(summary = "Liveness check")
  @GetMapping(value = HEALTH, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<HealthStatus> health() {
    return ResponseEntity.ok(HealthStatus.healthy());
  }
}
