package com.flagship.invoice_ledger.observability;

import com.flagship.invoice_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and publish counters.
 *
 * Gauges read cached values refreshed on a schedule, so a Prometheus scrape
 * never queries the database:
 * - ledger.outbox.backlog: events waiting to be published
 * - ledger.outbox.oldest.age.seconds: how long the oldest of them has waited
 * - ledger.outbox.dead_letter: events that exhausted their retries
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    private final AtomicLong backlog = new AtomicLong();
    private final AtomicLong oldestAgeSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    void registerGauges() {
        Gauge.builder("ledger.outbox.backlog", backlog, AtomicLong::get)
                .description("Unpublished ledger events in the outbox")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.oldest.age.seconds", oldestAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.dead_letter", deadLetters, AtomicLong::get)
                .description("Ledger events that exceeded the publish retry limit")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refresh() {
        try {
            backlog.set(outboxRepository.countUnpublished());
            oldestAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));
            deadLetters.set(outboxRepository.countDeadLetters(maxRetries));
            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                    backlog.get(), oldestAgeSeconds.get(), deadLetters.get());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordPublished(String eventType) {
        meterRegistry.counter("ledger.outbox.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordPublishFailed(String eventType) {
        meterRegistry.counter("ledger.outbox.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordDeadLettered(String eventType) {
        meterRegistry.counter("ledger.outbox.dead_lettered", "event_type", eventType).increment();
    }
}
