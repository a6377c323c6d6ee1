package com.flagship.invoice_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateClientRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255)
    @JsonProperty("name")
    String name;

    @Email(message = "Email must be a valid address")
    @JsonProperty("email")
    String email;

    @Size(max = 255)
    @JsonProperty("company")
    String company;

    @Size(max = 1000)
    @JsonProperty("address")
    String address;

    @Size(max = 64)
    @JsonProperty("phone")
    String phone;
}
