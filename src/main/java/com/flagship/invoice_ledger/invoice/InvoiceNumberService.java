package com.flagship.invoice_ledger.invoice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Assigns sequential per-owner invoice numbers (INV-0001, INV-0002, ...).
 *
 * The counter row is bumped with a single upsert, so concurrent creations for the
 * same owner serialize on that row and never receive the same number. Numbers
 * consumed by a rolled-back transaction are rolled back with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceNumberService {

    private static final String NEXT_NUMBER_SQL = """
        INSERT INTO invoice_counters (owner_id, next_number)
        VALUES (?, 2)
        ON CONFLICT (owner_id)
        DO UPDATE SET next_number = invoice_counters.next_number + 1
        RETURNING next_number - 1
        """;

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public String assignNumber(UUID ownerId) {
        Integer number = jdbcTemplate.queryForObject(NEXT_NUMBER_SQL, Integer.class, ownerId);
        String formatted = format(number);
        log.debug("Assigned invoice number: ownerId={}, number={}", ownerId, formatted);
        return formatted;
    }

    static String format(int number) {
        return String.format("INV-%04d", number);
    }
}
