package com.autopilot.api.controller;

import com.autopilot.api.dto.request.ResetRequest;
import com.autopilot.api.dto.response.ResetResponse;
import com.autopilot.core.engine.ModeScheduler;
import com.autopilot.domain.enums.HaltReason;
import com.autopilot.exception.ConflictException;
import com.autopilot.exception.InvalidRequestException;
import com.autopilot.exception.ResourceNotFoundException;
import com.autopilot.observability.AccountSnapshot;
import com.autopilot.observability.SnapshotPublisher;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-account risk state and the manual circuit-breaker override.
 *
 * <ul>
 *   <li>GET /risk/accounts -- risk view of every account from the last snapshot</li>
 *   <li>GET /risk/accounts/{id} -- one account</li>
 *   <li>POST /risk/accounts/{id}/reset -- queue a breaker reset (requires "CONFIRM")</li>
 * </ul>
 */
@RestController
@RequestMapping("/risk/accounts")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private static final String CONFIRMATION = "CONFIRM";

    private final ModeScheduler modeScheduler;
    private final SnapshotPublisher snapshotPublisher;

    public RiskController(ModeScheduler modeScheduler, SnapshotPublisher snapshotPublisher) {
        this.modeScheduler = modeScheduler;
        this.snapshotPublisher = snapshotPublisher;
    }

    @GetMapping
    public ResponseEntity<List<AccountSnapshot>> getAccounts() {
        return ResponseEntity.ok(snapshotPublisher.current().getAccounts());
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountSnapshot> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(findAccount(accountId));
    }

    @PostMapping("/{accountId}/reset")
    public ResponseEntity<ResetResponse> resetCircuitBreaker(
            @PathVariable String accountId, @Valid @RequestBody ResetRequest request) {
        if (!CONFIRMATION.equals(request.getConfirm())) {
            throw new InvalidRequestException("Circuit-breaker reset requires 'confirm': 'CONFIRM' in request body");
        }
        AccountSnapshot account = findAccount(accountId);
        if (account.getHaltReason() == HaltReason.EMERGENCY_STOP) {
            throw new ConflictException(
                    "Account " + accountId + " is halted by an emergency stop and cannot be reset",
                    HaltReason.EMERGENCY_STOP.name());
        }

        String requestedBy = request.getRequestedBy() != null && !request.getRequestedBy().isBlank()
                ? request.getRequestedBy()
                : "api";
        log.warn("Circuit-breaker reset requested for {} by {}", accountId, requestedBy);
        modeScheduler.requestManualReset(accountId, requestedBy);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ResetResponse.builder()
                        .accountId(accountId)
                        .queued(true)
                        .requestedBy(requestedBy)
                        .build());
    }

    private AccountSnapshot findAccount(String accountId) {
        return snapshotPublisher.current().getAccounts().stream()
                .filter(a -> a.getAccountId().equals(accountId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }
}
