package com.flagship.invoice_ledger.client;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Client {
    UUID id;
    UUID ownerId;
    String name;
    String email;
    String company;
    String address;
    String phone;
    Instant createdAt;
}
