package com.flagship.wager_ledger.api;

import com.flagship.wager_ledger.api.dto.SignalRequest;
import com.flagship.wager_ledger.api.dto.SignalResponse;
import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.settlement.SettlementEngine;
import com.flagship.wager_ledger.settlement.SettlementOutcome;
import com.flagship.wager_ledger.settlement.SignalKind;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Outcome signals relayed from the chat layer: a reaction added to or removed from a
 * posted wager artifact.
 *
 * The engine's outcome is returned as-is; NOT_FOUND and STALE_STATE are normal results
 * of reactions on unrelated messages or repeated clicks, not client errors.
 */
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Slf4j
public class SignalController {

    private final SettlementEngine settlementEngine;

    @PostMapping
    public ResponseEntity<SignalResponse> signalAdded(@Valid @RequestBody SignalRequest request) {
        SignalKind kind = parseKind(request.getKind());
        log.info("Signal added: kind={}, artifactRef={}, correlationId={}",
                kind, request.getArtifactRef(), CorrelationContext.getCorrelationId());
        SettlementOutcome outcome = settlementEngine.onOutcomeSignalAdded(
                request.getArtifactRef(), kind, request.getActorId());
        return ResponseEntity.ok(new SignalResponse(request.getArtifactRef(), kind, outcome));
    }

    @DeleteMapping
    public ResponseEntity<SignalResponse> signalRemoved(@Valid @RequestBody SignalRequest request) {
        SignalKind kind = parseKind(request.getKind());
        log.info("Signal removed: kind={}, artifactRef={}", kind, request.getArtifactRef());
        SettlementOutcome outcome = settlementEngine.onOutcomeSignalRemoved(
                request.getArtifactRef(), kind, request.getActorId());
        return ResponseEntity.ok(new SignalResponse(request.getArtifactRef(), kind, outcome));
    }

    private static SignalKind parseKind(String kind) {
        return SignalKind.fromName(kind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown signal kind: " + kind));
    }
}
