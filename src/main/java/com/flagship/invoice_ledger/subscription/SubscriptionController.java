package com.flagship.invoice_ledger.subscription;

import com.flagship.invoice_ledger.ledger.LedgerService;
import com.flagship.invoice_ledger.subscription.dto.ChangePlanRequest;
import com.flagship.invoice_ledger.subscription.dto.ReservationResponse;
import com.flagship.invoice_ledger.subscription.dto.ReserveQuotaRequest;
import com.flagship.invoice_ledger.subscription.dto.SubscriptionResponse;
import com.flagship.invoice_ledger.subscription.dto.UsageLimitsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/subscription")
@RequiredArgsConstructor
public class SubscriptionController {

    private static final String ACCOUNT_HEADER = "X-Account-Id";

    private final SubscriptionService subscriptionService;
    private final LedgerService ledgerService;

    /**
     * Creates the FREE subscription for the account, or returns the existing one.
     */
    @PostMapping
    public ResponseEntity<SubscriptionResponse> provision(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.provision(ownerId)));
    }

    @GetMapping
    public ResponseEntity<SubscriptionResponse> getSubscription(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.findSubscription(ownerId)));
    }

    @PutMapping("/plan")
    public ResponseEntity<SubscriptionResponse> changePlan(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @Valid @RequestBody ChangePlanRequest request) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.updatePlan(ownerId, request.getPlan())));
    }

    @PostMapping("/cancel")
    public ResponseEntity<SubscriptionResponse> cancel(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.cancel(ownerId)));
    }

    @PostMapping("/reactivate")
    public ResponseEntity<SubscriptionResponse> reactivate(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.reactivate(ownerId)));
    }

    @GetMapping("/limits")
    public ResponseEntity<UsageLimitsResponse> limits(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(UsageLimitsResponse.from(subscriptionService.checkLimits(ownerId)));
    }

    @PostMapping("/reservations")
    public ResponseEntity<ReservationResponse> reserve(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @Valid @RequestBody ReserveQuotaRequest request) {
        Reservation reservation = ledgerService.reserveQuota(ownerId, request.getResource());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReservationResponse.from(reservation));
    }
}
