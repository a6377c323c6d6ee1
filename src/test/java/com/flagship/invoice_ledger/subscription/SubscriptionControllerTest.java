package com.flagship.invoice_ledger.subscription;

import com.flagship.invoice_ledger.LedgerIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class SubscriptionControllerTest extends LedgerIntegrationTestSupport {

    private static final String ACCOUNT_HEADER = "X-Account-Id";

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Account without a subscription gets 402 until it is provisioned")
    void testProvision() throws Exception {
        printTestHeader("API: Provision Subscription");

        UUID ownerId = UUID.randomUUID();

        mockMvc.perform(get("/api/subscription/limits").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.kind").value("NO_SUBSCRIPTION"));

        mockMvc.perform(post("/api/subscription").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("FREE"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.invoices_sent").value(0));

        mockMvc.perform(get("/api/subscription/limits").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.can_create_invoice").value(true))
                .andExpect(jsonPath("$.invoices_remaining").value(5));

        printSuccess("FREE plan provisioned");
    }

    @Test
    @DisplayName("Reservations count against the plan and fail with 402 once exhausted")
    void testReservations() throws Exception {
        UUID ownerId = newOwner();

        for (int i = 1; i <= 5; i++) {
            mockMvc.perform(post("/api/subscription/reservations")
                            .header(ACCOUNT_HEADER, ownerId.toString())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\": \"INVOICE\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.used").value(i))
                    .andExpect(jsonPath("$.remaining").value(5 - i));
        }

        mockMvc.perform(post("/api/subscription/reservations")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resource\": \"INVOICE\"}"))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.kind").value("QUOTA_EXCEEDED"));
    }

    @Test
    @DisplayName("Plan change raises the limit and keeps usage")
    void testChangePlan() throws Exception {
        UUID ownerId = newOwner();
        ledgerService.reserveQuota(ownerId, QuotaResource.INVOICE);

        mockMvc.perform(put("/api/subscription/plan")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan\": \"BASIC\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("BASIC"))
                .andExpect(jsonPath("$.invoices_sent").value(1));

        mockMvc.perform(post("/api/subscription/cancel").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/subscription/reactivate").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }
}
