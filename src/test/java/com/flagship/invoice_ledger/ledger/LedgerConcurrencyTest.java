package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.LedgerIntegrationTestSupport;
import com.flagship.invoice_ledger.exception.ContentionException;
import com.flagship.invoice_ledger.exception.PaymentExceedsAmountDueException;
import com.flagship.invoice_ledger.exception.QuotaExceededException;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceFilter;
import com.flagship.invoice_ledger.invoice.InvoiceQueryService;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;
import com.flagship.invoice_ledger.payment.PaymentQueryService;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races on shared balances and counters. Every thread is released at once by a
 * start latch; the database row lock or conditional update decides the winners.
 */
class LedgerConcurrencyTest extends LedgerIntegrationTestSupport {

    @DynamicPropertySource
    static void lockTimeout(DynamicPropertyRegistry registry) {
        registry.add("ledger.lock-timeout-ms", () -> "10000");
    }

    @Autowired
    private InvoiceQueryService invoiceQueryService;

    @Autowired
    private PaymentQueryService paymentQueryService;

    @Test
    @DisplayName("Concurrent payments never push amountPaid past the total")
    void testConcurrentPayments_NeverOverpay() throws InterruptedException {
        printTestHeader("Concurrent Payments on One Invoice");

        UUID ownerId = newOwner();
        Invoice invoice = createWorkedExample(ownerId, newClient(ownerId));
        int threads = 10;
        printInput("Invoice total", invoice.getTotal());
        printInput("Concurrent payments of 50.00", threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.applyPayment(invoice.getId(), ownerId, payment("50.00"), null);
                    applied.incrementAndGet();
                } catch (PaymentExceedsAmountDueException | ContentionException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    e.printStackTrace();
                    unexpected.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        Invoice after = invoiceQueryService.findInvoice(invoice.getId(), ownerId);
        printOutput("Applied", applied.get());
        printOutput("Rejected", rejected.get());
        printOutput("amountPaid", after.getAmountPaid());

        assertEquals(0, unexpected.get());
        assertEquals(5, applied.get(), "Only five 50.00 payments fit into 275.00");
        assertEquals(new BigDecimal("250.00"), after.getAmountPaid());
        assertEquals(new BigDecimal("25.00"), after.getAmountDue());
        assertEquals(0, paymentQueryService.completedTotal(invoice.getId(), ownerId).compareTo(after.getAmountPaid()));
        printSuccess("No lost update and no overpayment");
    }

    @Test
    @DisplayName("Concurrent requests with one idempotency key create one payment")
    void testConcurrentDuplicateKey_SinglePayment() throws InterruptedException {
        printTestHeader("Concurrent Duplicate Idempotency Key");

        UUID ownerId = newOwner();
        Invoice invoice = createWorkedExample(ownerId, newClient(ownerId));
        String key = "pay-" + UUID.randomUUID();
        int threads = 8;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        Set<UUID> paymentIds = ConcurrentHashMap.newKeySet();
        AtomicInteger replays = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    PaymentReceipt receipt = ledgerService.applyPayment(invoice.getId(), ownerId, payment("100.00"), key);
                    paymentIds.add(receipt.getPayment().getId());
                    if (receipt.isReplayed()) {
                        replays.incrementAndGet();
                    }
                } catch (Exception e) {
                    e.printStackTrace();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Distinct payments", paymentIds.size());
        printOutput("Replays", replays.get());

        assertEquals(1, paymentIds.size());
        assertEquals(threads - 1, replays.get());
        assertEquals(1, paymentQueryService.paymentsForInvoice(invoice.getId(), ownerId).size());
        assertEquals(new BigDecimal("100.00"), invoiceQueryService.findInvoice(invoice.getId(), ownerId).getAmountPaid());
        printSuccess("Duplicate requests returned the original payment");
    }

    @Test
    @DisplayName("N concurrent invoice creations with a limit of k succeed exactly min(N, k) times")
    void testConcurrentInvoiceCreation_RespectsQuota() throws InterruptedException {
        printTestHeader("Quota Race");

        UUID ownerId = newOwner(SubscriptionPlan.FREE);
        UUID clientId = newClient(ownerId);
        int limit = SubscriptionPlan.FREE.getInvoiceLimit();
        int threads = 12;
        printInput("Invoice limit", limit);
        printInput("Concurrent creations", threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger quotaExceeded = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    createWorkedExample(ownerId, clientId);
                    created.incrementAndGet();
                } catch (QuotaExceededException e) {
                    quotaExceeded.incrementAndGet();
                } catch (Exception e) {
                    e.printStackTrace();
                    unexpected.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Created", created.get());
        printOutput("Quota exceeded", quotaExceeded.get());

        assertEquals(0, unexpected.get());
        assertEquals(Math.min(threads, limit), created.get());
        assertEquals(threads - limit, quotaExceeded.get());
        assertEquals(limit, subscriptionService.findSubscription(ownerId).getInvoicesSent());
        assertEquals(limit, invoiceQueryService.listInvoices(ownerId,
                InvoiceFilter.none()).size());
        printSuccess("Counter stopped exactly at the limit");
    }

    @Test
    @DisplayName("Concurrent views and a payment on one invoice all land")
    void testConcurrentViewAndPayment() throws InterruptedException {
        UUID ownerId = newOwner();
        Invoice invoice = createWorkedExample(ownerId, newClient(ownerId));
        ledgerService.sendInvoice(invoice.getId(), ownerId);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(4);
        AtomicInteger failures = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.markViewed(invoice.getId());
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        executor.submit(() -> {
            try {
                start.await();
                ledgerService.applyPayment(invoice.getId(), ownerId, payment("275.00"), null);
            } catch (Exception e) {
                failures.incrementAndGet();
            } finally {
                done.countDown();
            }
        });
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        Invoice after = invoiceQueryService.findInvoice(invoice.getId(), ownerId);
        assertEquals(0, failures.get());
        assertEquals(InvoiceStatus.PAID, after.getStatus());
        assertEquals(new BigDecimal("275.00"), after.getAmountPaid());
    }
}
