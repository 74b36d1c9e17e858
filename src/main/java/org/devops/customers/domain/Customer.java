package org.devops.customers.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import lombok.Builder;

/**
 * Customer as exchanged over the REST API. The id is assigned by the service and is ignored when
 * present in a request body.
 */
@Builder(toBuilder = true)
public record Customer(
    Long id,

    @NotBlank(message = "name is required")
    @Size(max = 64)
    String name,

    @NotBlank(message = "address is required")
    @Size(max = 256)
    String address,

    @NotBlank(message = "email is required")
    @Email(message = "email must be a well-formed email address")
    @Size(max = 128)
    String email,

    @JsonProperty("phone_number")
    @NotBlank(message = "phone_number is required")
    @Size(max = 32)
    String phoneNumber,

    @JsonProperty("member_since")
    @NotNull(message = "member_since is required")
    LocalDate memberSince,

    @NotBlank(message = "status is required")
    @Size(max = 32)
    String status
) {}
