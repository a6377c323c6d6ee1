package com.flagship.invoice_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.client.Client;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ClientResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("company")
    String company;

    @JsonProperty("address")
    String address;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ClientResponse from(Client client) {
        return ClientResponse.builder()
            .id(client.getId())
            .name(client.getName())
            .email(client.getEmail())
            .company(client.getCompany())
            .address(client.getAddress())
            .phone(client.getPhone())
            .createdAt(client.getCreatedAt())
            .build();
    }
}
