package org.devops.customers.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Value("${customers.service.name}")
  private String serviceName;

  @Value("${customers.service.version}")
  private String serviceVersion;

  @Bean
  public OpenAPI customersOpenApi() {
    return new OpenAPI()
        .info(new Info()
            .title(serviceName)
            .version(serviceVersion)
            .description("Create, Read, Update and Delete Customers from the customer store."));
  }
}
