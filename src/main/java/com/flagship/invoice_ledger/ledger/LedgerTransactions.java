package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.exception.ContentionException;
import com.flagship.invoice_ledger.exception.LedgerException;
import com.flagship.invoice_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Transaction boundary for every ledger mutation.
 *
 * Each write runs in its own transaction that first sets
 * {@code SET LOCAL lock_timeout}, so waiting on an invoice or subscription row
 * lock is bounded. Lock timeouts, deadlocks and optimistic version conflicts
 * surface as Spring's {@link ConcurrencyFailureException}; they are translated
 * into a retryable {@link ContentionException} here, outside the transaction,
 * so failures raised at commit are caught as well. Nothing is committed when
 * this happens.
 */
@Component
@Slf4j
public class LedgerTransactions {

    private final TransactionTemplate writeTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;
    private final long lockTimeoutMs;

    public LedgerTransactions(PlatformTransactionManager transactionManager,
                              JdbcTemplate jdbcTemplate,
                              LedgerMetrics metrics,
                              @Value("${ledger.lock-timeout-ms:2000}") long lockTimeoutMs) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Runs {@code work} in a new write transaction and records its latency.
     *
     * @throws ContentionException if a lock could not be acquired in time or a
     *                             concurrent writer won a version race
     */
    public <T> T write(String operation, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        String outcome = "success";
        try {
            return writeTemplate.execute(status -> {
                boundLockWait();
                return work.get();
            });
        } catch (ConcurrencyFailureException e) {
            outcome = "contention";
            metrics.recordContention(operation);
            log.warn("Contention during {}: {}", operation, e.getMostSpecificCause().getMessage());
            throw new ContentionException(operation, e);
        } catch (LedgerException e) {
            outcome = e.getKind().name();
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            metrics.recordLatency(operation, outcome, System.currentTimeMillis() - startTime);
        }
    }

    public void run(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }

    private void boundLockWait() {
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
    }
}
