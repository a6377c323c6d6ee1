package com.flagship.invoice_ledger.subscription;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for an owner's subscription.
 *
 * The usage counters are read here but only ever incremented by
 * {@link QuotaEnforcer} with a conditional UPDATE. {@code @DynamicUpdate} keeps
 * plan changes from writing the counter columns back.
 */
@Entity
@Table(name = "subscriptions")
@DynamicUpdate
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SubscriptionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, unique = true)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubscriptionPlan plan;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubscriptionStatus status;

    @Column(name = "monthly_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal monthlyPrice;

    @Column(name = "invoice_limit", nullable = false)
    private int invoiceLimit;

    @Column(name = "client_limit", nullable = false)
    private int clientLimit;

    @Column(name = "invoices_sent", nullable = false, insertable = false, updatable = false)
    private int invoicesSent;

    @Column(name = "clients_created", nullable = false, insertable = false, updatable = false)
    private int clientsCreated;

    @Column(name = "current_period_start")
    private Instant currentPeriodStart;

    @Column(name = "current_period_end")
    private Instant currentPeriodEnd;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Assigns a plan and copies its limits. Counters are kept, so a downgrade
     * below current usage blocks further reservations until the next period.
     */
    void changePlan(SubscriptionPlan newPlan) {
        this.plan = newPlan;
        this.invoiceLimit = newPlan.getInvoiceLimit();
        this.clientLimit = newPlan.getClientLimit();
        this.monthlyPrice = newPlan.getMonthlyPrice();
    }

    void changeStatus(SubscriptionStatus newStatus) {
        this.status = newStatus;
    }

    Subscription toDomain() {
        return new Subscription(
            id,
            ownerId,
            plan,
            status,
            monthlyPrice,
            invoiceLimit,
            clientLimit,
            invoicesSent,
            clientsCreated,
            currentPeriodStart,
            currentPeriodEnd,
            createdAt,
            updatedAt
        );
    }
}
