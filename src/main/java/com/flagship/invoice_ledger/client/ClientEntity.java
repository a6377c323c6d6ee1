package com.flagship.invoice_ledger.client;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "clients",
    indexes = @Index(name = "idx_clients_owner", columnList = "owner_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClientEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 255)
    private String email;

    @Column(length = 255)
    private String company;

    @Column(length = 1000)
    private String address;

    @Column(length = 64)
    private String phone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static ClientEntity create(UUID ownerId, String name, String email, String company, String address, String phone) {
        return new ClientEntity(UUID.randomUUID(), ownerId, name, email, company, address, phone, null);
    }

    Client toDomain() {
        return new Client(id, ownerId, name, email, company, address, phone, createdAt);
    }
}
