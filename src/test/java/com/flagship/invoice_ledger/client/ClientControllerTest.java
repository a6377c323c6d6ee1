package com.flagship.invoice_ledger.client;

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
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ClientControllerTest extends LedgerIntegrationTestSupport {

    private static final String ACCOUNT_HEADER = "X-Account-Id";

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Clients are created per account and listed by name")
    void testCreateAndList() throws Exception {
        UUID ownerId = newOwner();

        mockMvc.perform(post("/api/clients")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Zephyr Labs\", \"email\": \"ap@zephyr.test\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Zephyr Labs"));
        mockMvc.perform(post("/api/clients")
                        .header(ACCOUNT_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Acme Co\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/clients").header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("Acme Co"));

        mockMvc.perform(get("/api/clients").header(ACCOUNT_HEADER, UUID.randomUUID().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("A client is only visible to its own account")
    void testGetById() throws Exception {
        UUID ownerId = newOwner();
        UUID clientId = newClient(ownerId);

        mockMvc.perform(get("/api/clients/" + clientId).header(ACCOUNT_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(clientId.toString()))
                .andExpect(jsonPath("$.name").value("Northwind Studio"));

        mockMvc.perform(get("/api/clients/" + clientId).header(ACCOUNT_HEADER, UUID.randomUUID().toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Blank name is a validation error")
    void testBlankName() throws Exception {
        mockMvc.perform(post("/api/clients")
                        .header(ACCOUNT_HEADER, newOwner().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.name").exists());
    }
}
