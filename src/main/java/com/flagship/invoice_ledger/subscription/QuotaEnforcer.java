package com.flagship.invoice_ledger.subscription;

import com.flagship.invoice_ledger.exception.NoSubscriptionException;
import com.flagship.invoice_ledger.exception.QuotaExceededException;
import com.flagship.invoice_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Reserves one unit of an owner's plan quota.
 *
 * The check and the increment are one conditional UPDATE:
 *
 *   UPDATE subscriptions SET counter = counter + 1
 *   WHERE owner_id = ? AND counter < limit
 *
 * Concurrent reservations serialize on the subscription row, and the one that
 * sees counter == limit matches no row. N concurrent callers with k units left
 * therefore get exactly min(N, k) grants. The increment joins the caller's
 * transaction, so if the resource creation that follows fails, the unit is
 * released by the same rollback.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaEnforcer {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;

    @Transactional(propagation = Propagation.MANDATORY)
    public Reservation reserve(UUID ownerId, QuotaResource resource) {
        String counter = resource.getCounterColumn();
        String limit = resource.getLimitColumn();

        List<Reservation> granted = jdbcTemplate.query(
            "UPDATE subscriptions SET " + counter + " = " + counter + " + 1, updated_at = CURRENT_TIMESTAMP"
                + " WHERE owner_id = ? AND " + counter + " < " + limit
                + " RETURNING " + counter + " AS used, " + limit + " AS quota_limit",
            (rs, rowNum) -> new Reservation(ownerId, resource, rs.getInt("used"), rs.getInt("quota_limit")),
            ownerId);

        if (!granted.isEmpty()) {
            Reservation reservation = granted.get(0);
            metrics.recordQuotaReservation(resource, "granted");
            log.debug("Quota reserved: ownerId={}, resource={}, used={}, limit={}",
                ownerId, resource, reservation.getUsed(), reservation.getLimit());
            return reservation;
        }

        List<Integer> limits = jdbcTemplate.query(
            "SELECT " + limit + " FROM subscriptions WHERE owner_id = ?",
            (rs, rowNum) -> rs.getInt(1),
            ownerId);
        if (limits.isEmpty()) {
            metrics.recordQuotaReservation(resource, "no_subscription");
            log.warn("Quota reservation without subscription: ownerId={}, resource={}", ownerId, resource);
            throw new NoSubscriptionException(ownerId);
        }

        metrics.recordQuotaReservation(resource, "rejected");
        log.warn("Quota exhausted: ownerId={}, resource={}, limit={}", ownerId, resource, limits.get(0));
        throw new QuotaExceededException(resource.getLabel(), limits.get(0));
    }
}
