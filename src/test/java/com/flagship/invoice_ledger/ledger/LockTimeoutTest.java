package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.LedgerIntegrationTestSupport;
import com.flagship.invoice_ledger.exception.ContentionException;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceQueryService;
import com.flagship.invoice_ledger.invoice.InvoiceRepository;
import com.flagship.invoice_ledger.payment.PaymentQueryService;
import com.flagship.invoice_ledger.subscription.QuotaResource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A writer that cannot get its row lock within ledger.lock-timeout-ms gives up
 * with a retryable CONTENTION error and leaves nothing behind.
 */
class LockTimeoutTest extends LedgerIntegrationTestSupport {

    @DynamicPropertySource
    static void lockTimeout(DynamicPropertyRegistry registry) {
        registry.add("ledger.lock-timeout-ms", () -> "200");
    }

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private InvoiceRepository invoiceRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private InvoiceQueryService invoiceQueryService;

    @Autowired
    private PaymentQueryService paymentQueryService;

    private ExecutorService executor;
    private CountDownLatch locked;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        locked = new CountDownLatch(1);
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    /**
     * Runs {@code lock} in a transaction on another thread and keeps that
     * transaction open until {@link #release} is counted down.
     */
    private Future<?> holdLock(Runnable lock) throws InterruptedException {
        TransactionTemplate holder = new TransactionTemplate(transactionManager);
        Future<?> future = executor.submit(() -> holder.executeWithoutResult(status -> {
            lock.run();
            locked.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertTrue(locked.await(10, TimeUnit.SECONDS), "lock holder did not start");
        return future;
    }

    @Test
    @DisplayName("Payment on a locked invoice times out as retryable contention")
    void testApplyPayment_LockTimeout() throws Exception {
        printTestHeader("Lock Timeout: Apply Payment");

        UUID ownerId = newOwner();
        Invoice invoice = createWorkedExample(ownerId, newClient(ownerId));
        Future<?> holder = holdLock(() -> invoiceRepository.findByIdForUpdate(invoice.getId()).orElseThrow());

        long started = System.currentTimeMillis();
        ContentionException error = assertThrows(ContentionException.class,
                () -> ledgerService.applyPayment(invoice.getId(), ownerId, payment("50.00"), "lock-timeout-1"));
        long waited = System.currentTimeMillis() - started;
        printOutput("Error", error.getMessage());
        printOutput("Waited ms", waited);

        release.countDown();
        holder.get(10, TimeUnit.SECONDS);

        assertTrue(error.isRetryable());
        assertTrue(waited < 5000, "gave up after the lock timeout, not the holder");
        Invoice after = invoiceQueryService.findInvoice(invoice.getId(), ownerId);
        assertEquals(0, after.getAmountPaid().compareTo(BigDecimal.ZERO));
        assertEquals(0, paymentQueryService.paymentsForInvoice(invoice.getId(), ownerId).size());

        // The same request goes through once the lock is free
        ledgerService.applyPayment(invoice.getId(), ownerId, payment("50.00"), "lock-timeout-1");
        assertEquals(1, paymentQueryService.paymentsForInvoice(invoice.getId(), ownerId).size());
        printSuccess("Timed out cleanly and succeeded on retry");
    }

    @Test
    @DisplayName("Quota reservation on a locked subscription times out without consuming a unit")
    void testReserveQuota_LockTimeout() throws Exception {
        printTestHeader("Lock Timeout: Reserve Quota");

        UUID ownerId = newOwner();
        Future<?> holder = holdLock(() -> jdbcTemplate.queryForList(
                "SELECT owner_id FROM subscriptions WHERE owner_id = ? FOR UPDATE", ownerId));

        ContentionException error = assertThrows(ContentionException.class,
                () -> ledgerService.reserveQuota(ownerId, QuotaResource.INVOICE));
        printOutput("Error", error.getMessage());

        release.countDown();
        holder.get(10, TimeUnit.SECONDS);

        assertTrue(error.isRetryable());
        assertEquals(0, subscriptionService.findSubscription(ownerId).getInvoicesSent());

        ledgerService.reserveQuota(ownerId, QuotaResource.INVOICE);
        assertEquals(1, subscriptionService.findSubscription(ownerId).getInvoicesSent());
        printSuccess("Counter untouched by the timed-out reservation");
    }
}
