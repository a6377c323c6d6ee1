package com.flagship.invoice_ledger.subscription;

import com.flagship.invoice_ledger.exception.NoSubscriptionException;
import com.flagship.invoice_ledger.ledger.LedgerTransactions;
import com.flagship.invoice_ledger.ledger.event.SubscriptionPlanChangedEvent;
import com.flagship.invoice_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Subscription lifecycle: provisioning, plan changes, cancellation.
 *
 * Plan changes take the subscription row lock, so they serialize with quota
 * reservations and a reservation never sees half-updated limits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private static final String PROVISION_SQL = """
        INSERT INTO subscriptions (id, owner_id, plan, status, monthly_price, invoice_limit, client_limit,
                                   current_period_start, current_period_end, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (owner_id) DO NOTHING
        """;

    private final SubscriptionRepository subscriptionRepository;
    private final LedgerTransactions transactions;
    private final OutboxService outboxService;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Creates the FREE subscription for an owner. Calling it again returns the
     * existing subscription unchanged.
     */
    public Subscription provision(UUID ownerId) {
        return transactions.write("provisionSubscription", () -> {
            Instant now = Instant.now(clock);
            Timestamp start = Timestamp.from(now);
            SubscriptionPlan plan = SubscriptionPlan.FREE;
            int inserted = jdbcTemplate.update(PROVISION_SQL,
                UUID.randomUUID(), ownerId, plan.name(), SubscriptionStatus.ACTIVE.name(),
                plan.getMonthlyPrice(), plan.getInvoiceLimit(), plan.getClientLimit(),
                start, Timestamp.from(now.plus(30, ChronoUnit.DAYS)), start, start);
            if (inserted == 1) {
                log.info("Subscription provisioned: ownerId={}, plan={}", ownerId, plan);
            }
            return load(ownerId);
        });
    }

    @Transactional(readOnly = true)
    public Subscription findSubscription(UUID ownerId) {
        return load(ownerId);
    }

    @Transactional(readOnly = true)
    public UsageLimits checkLimits(UUID ownerId) {
        return UsageLimits.of(load(ownerId));
    }

    /**
     * Switches plan and copies the new limits. Usage counters are not reset.
     */
    public Subscription updatePlan(UUID ownerId, SubscriptionPlan newPlan) {
        return transactions.write("updatePlan", () -> {
            SubscriptionEntity subscription = lockForUpdate(ownerId);
            SubscriptionPlan previous = subscription.getPlan();
            subscription.changePlan(newPlan);
            subscription.changeStatus(SubscriptionStatus.ACTIVE);
            subscriptionRepository.flush();

            Subscription updated = subscription.toDomain();
            if (previous != newPlan) {
                outboxService.record(SubscriptionPlanChangedEvent.of(previous, updated));
            }
            log.info("Subscription plan changed: ownerId={}, from={}, to={}", ownerId, previous, newPlan);
            return updated;
        });
    }

    public Subscription cancel(UUID ownerId) {
        return changeStatus(ownerId, SubscriptionStatus.CANCELLED, "cancelSubscription");
    }

    public Subscription reactivate(UUID ownerId) {
        return changeStatus(ownerId, SubscriptionStatus.ACTIVE, "reactivateSubscription");
    }

    private Subscription changeStatus(UUID ownerId, SubscriptionStatus status, String operation) {
        return transactions.write(operation, () -> {
            SubscriptionEntity subscription = lockForUpdate(ownerId);
            subscription.changeStatus(status);
            subscriptionRepository.flush();
            log.info("Subscription status changed: ownerId={}, status={}", ownerId, status);
            return subscription.toDomain();
        });
    }

    private SubscriptionEntity lockForUpdate(UUID ownerId) {
        return subscriptionRepository.findByOwnerIdForUpdate(ownerId)
            .orElseThrow(() -> new NoSubscriptionException(ownerId));
    }

    private Subscription load(UUID ownerId) {
        return subscriptionRepository.findByOwnerId(ownerId)
            .map(SubscriptionEntity::toDomain)
            .orElseThrow(() -> new NoSubscriptionException(ownerId));
    }
}
