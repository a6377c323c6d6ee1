package com.flagship.invoice_ledger.invoice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.LedgerIntegrationTestSupport;
import com.flagship.invoice_ledger.invoice.dto.CreateInvoiceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Invoice endpoints over HTTP: JSON shape, account scoping and error mapping.
 */
@AutoConfigureMockMvc
class InvoiceControllerTest extends LedgerIntegrationTestSupport {

    private static final String ACCOUNT_HEADER = "X-Account-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID ownerId;
    private UUID clientId;

    @BeforeEach
    void setUp() {
        ownerId = newOwner();
        clientId = newClient(ownerId);
    }

    private MvcResult createViaApi() throws Exception {
        return mockMvc.perform(post("/api/invoices")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(workedExample(clientId))))
                .andReturn();
    }

    private UUID createdId() throws Exception {
        JsonNode body = objectMapper.readTree(createViaApi().getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    @Test
    @DisplayName("POST /api/invoices returns 201 with derived amounts in snake_case")
    void testCreate_Returns201() throws Exception {
        printTestHeader("API: Create Invoice");

        MvcResult result = createViaApi();
        String json = result.getResponse().getContentAsString();
        printOutput("Response", json);

        assertEquals(201, result.getResponse().getStatus());
        JsonNode body = objectMapper.readTree(json);
        assertEquals("INV-0001", body.get("invoice_number").asText());
        assertEquals("DRAFT", body.get("status").asText());
        assertEquals("DRAFT", body.get("display_status").asText());
        assertEquals("250.00", body.get("subtotal").asText());
        assertEquals("25.00", body.get("tax_amount").asText());
        assertEquals("275.00", body.get("total").asText());
        assertEquals("275.00", body.get("amount_due").asText());
        assertEquals(2, body.get("items").size());

        printSuccess("Invoice created with server-computed totals");
    }

    @Test
    @DisplayName("Missing account header is a 400")
    void testMissingAccountHeader() throws Exception {
        mockMvc.perform(post("/api/invoices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(workedExample(clientId))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("Another account's invoice is a 404")
    void testForeignInvoice_NotFound() throws Exception {
        UUID invoiceId = createdId();

        mockMvc.perform(get("/api/invoices/" + invoiceId)
                        .header(ACCOUNT_HEADER, UUID.randomUUID().toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Exhausted invoice quota is a 402")
    void testQuotaExceeded_Returns402() throws Exception {
        printTestHeader("API: Quota Exceeded");

        for (int i = 0; i < 5; i++) {
            assertEquals(201, createViaApi().getResponse().getStatus());
        }

        MvcResult sixth = createViaApi();
        printOutput("Sixth create", sixth.getResponse().getContentAsString());

        assertEquals(402, sixth.getResponse().getStatus());
        assertEquals("QUOTA_EXCEEDED", objectMapper.readTree(sixth.getResponse().getContentAsString())
                .get("kind").asText());
        printSuccess("Sixth invoice refused on the FREE plan");
    }

    @Test
    @DisplayName("Overpaying or paying a paid invoice is a 409")
    void testPaymentConflicts_Return409() throws Exception {
        UUID invoiceId = createdId();

        mockMvc.perform(post("/api/invoices/" + invoiceId + "/payments")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 300.00, \"method\": \"CASH\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("PAYMENT_EXCEEDS_AMOUNT_DUE"));

        mockMvc.perform(post("/api/invoices/" + invoiceId + "/mark-paid")
                        .header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAID"));

        mockMvc.perform(post("/api/invoices/" + invoiceId + "/payments")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1.00, \"method\": \"CASH\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVOICE_ALREADY_PAID"));

        mockMvc.perform(delete("/api/invoices/" + invoiceId)
                        .header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVOICE_IMMUTABLE"));
    }

    @Test
    @DisplayName("A patch cannot set derived fields")
    void testPatchDerivedField_Rejected() throws Exception {
        UUID invoiceId = createdId();

        mockMvc.perform(patch("/api/invoices/" + invoiceId)
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount_paid\": 275.00}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(patch("/api/invoices/" + invoiceId)
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"discount_amount\": 50.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(220.00));
    }

    @Test
    @DisplayName("Invalid status edge is a 409, unknown status a 400")
    void testStatusChange_Errors() throws Exception {
        UUID invoiceId = createdId();

        mockMvc.perform(post("/api/invoices/" + invoiceId + "/status")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"VIEWED\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVALID_STATUS_TRANSITION"));

        mockMvc.perform(post("/api/invoices/" + invoiceId + "/status")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"ARCHIVED\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Public view link marks a sent invoice viewed without an account header")
    void testPublicView() throws Exception {
        printTestHeader("API: Public View Link");

        UUID invoiceId = createdId();

        mockMvc.perform(get("/api/invoices/" + invoiceId + "/view"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/invoices/" + invoiceId + "/send")
                        .header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SENT"));

        mockMvc.perform(get("/api/invoices/" + invoiceId + "/view"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("VIEWED"))
                .andExpect(jsonPath("$.viewed_at").isNotEmpty());

        printSuccess("Draft hidden, sent invoice marked viewed");
    }

    @Test
    @DisplayName("Preview computes totals without storing anything")
    void testPreview() throws Exception {
        mockMvc.perform(post("/api/invoices/preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"description": "Design", "quantity": 2, "rate": 100.00},
                                           {"description": "Hosting", "quantity": 1, "rate": 50.00}],
                                 "discount_amount": 0, "tax_rate": 10}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(275.00));

        mockMvc.perform(get("/api/invoices").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("Negative quantity is a 400 with kind INVALID_LINE_ITEM")
    void testInvalidLineItem() throws Exception {
        mockMvc.perform(post("/api/invoices/preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"description\": \"Bad\", \"quantity\": -1, \"rate\": 10}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_LINE_ITEM"));
    }

    @Test
    @DisplayName("Notes longer than the column and over-precise rates are a 400")
    void testOversizedInput_Rejected() throws Exception {
        printTestHeader("API: Oversized Input");

        CreateInvoiceRequest longNotes = workedExample(clientId).toBuilder()
                .notes("n".repeat(2001))
                .build();
        MvcResult result = mockMvc.perform(post("/api/invoices")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(longNotes)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.details.notes").exists())
                .andReturn();
        printOutput("Long notes", result.getResponse().getContentAsString());

        mockMvc.perform(post("/api/invoices")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(workedExample(clientId).toBuilder()
                                .items(List.of(item("d".repeat(501), "1", "10")))
                                .build())))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/invoices/preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"description\": \"Hours\", \"quantity\": 1, \"rate\": 0.12345}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_LINE_ITEM"));

        mockMvc.perform(get("/api/invoices").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(jsonPath("$.length()").value(0));
        printSuccess("Nothing stored for rejected input");
    }
}
