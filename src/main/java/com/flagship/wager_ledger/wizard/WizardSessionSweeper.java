package com.flagship.wager_ledger.wizard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Expires idle wizard sessions even when their owner never sends another input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WizardSessionSweeper {

    private final WizardController wizardController;

    @Scheduled(fixedDelayString = "${wizard.sweep-interval-ms:30000}")
    public void sweep() {
        try {
            int expired = wizardController.expireIdleSessions();
            if (expired > 0) {
                log.info("Expired {} idle wager sessions, {} still open", expired, wizardController.openSessionCount());
            }
        } catch (Exception e) {
            log.error("Error while sweeping idle wager sessions", e);
        }
    }
}
