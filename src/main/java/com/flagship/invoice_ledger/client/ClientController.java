package com.flagship.invoice_ledger.client;

import com.flagship.invoice_ledger.client.dto.ClientResponse;
import com.flagship.invoice_ledger.client.dto.CreateClientRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/clients")
@RequiredArgsConstructor
public class ClientController {

    private static final String ACCOUNT_HEADER = "X-Account-Id";

    private final ClientService clientService;

    @PostMapping
    public ResponseEntity<ClientResponse> createClient(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @Valid @RequestBody CreateClientRequest request) {
        Client client = clientService.createClient(ownerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ClientResponse.from(client));
    }

    @GetMapping
    public ResponseEntity<List<ClientResponse>> listClients(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(clientService.listClients(ownerId).stream().map(ClientResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ClientResponse> getClient(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ClientResponse.from(clientService.findClient(id, ownerId)));
    }
}
