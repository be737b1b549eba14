package com.flagship.wager_ledger.api;

import com.flagship.wager_ledger.api.dto.StartSessionRequest;
import com.flagship.wager_ledger.api.dto.WizardInputRequest;
import com.flagship.wager_ledger.api.dto.WizardOutcomeResponse;
import com.flagship.wager_ledger.wager.WagerType;
import com.flagship.wager_ledger.wizard.SessionHandle;
import com.flagship.wager_ledger.wizard.WizardController;
import com.flagship.wager_ledger.wizard.WizardOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * HTTP entry point for the placement wizard, driven by the chat layer.
 *
 * Wizard rejections are part of the conversation and come back as 200 with an ERROR
 * outcome; only unknown sessions (404) and foreign owners (403) change the status code.
 */
@RestController
@RequestMapping("/api/wizard/sessions")
@RequiredArgsConstructor
@Slf4j
public class WizardApiController {

    private final WizardController wizardController;

    @PostMapping
    public ResponseEntity<WizardOutcomeResponse> startSession(@Valid @RequestBody StartSessionRequest request) {
        WagerType type = request.getWagerType() != null ? request.getWagerType() : WagerType.STRAIGHT;
        SessionHandle handle = wizardController.createSession(request.getOwnerId(), request.getGroupId(), type);
        WizardOutcome outcome = wizardController.current(handle);
        return ResponseEntity.status(HttpStatus.CREATED).body(WizardOutcomeResponse.from(outcome));
    }

    @PostMapping("/{id}/inputs")
    public ResponseEntity<WizardOutcomeResponse> submitInput(
            @PathVariable("id") UUID sessionId,
            @Valid @RequestBody WizardInputRequest request) {
        WizardOutcome outcome = wizardController.advance(
                new SessionHandle(sessionId, request.getOwnerId()), request.toInput());
        return respond(outcome);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WizardOutcomeResponse> currentPrompt(
            @PathVariable("id") UUID sessionId,
            @RequestParam("owner_id") String ownerId) {
        return respond(wizardController.current(new SessionHandle(sessionId, ownerId)));
    }

    private ResponseEntity<WizardOutcomeResponse> respond(WizardOutcome outcome) {
        HttpStatus status = HttpStatus.OK;
        if (WizardOutcome.SESSION_NOT_FOUND.equals(outcome.getErrorCode())) {
            status = HttpStatus.NOT_FOUND;
        } else if (WizardOutcome.NOT_SESSION_OWNER.equals(outcome.getErrorCode())) {
            status = HttpStatus.FORBIDDEN;
        }
        return ResponseEntity.status(status).body(WizardOutcomeResponse.from(outcome));
    }
}
