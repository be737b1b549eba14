package com.flagship.wager_ledger.wizard;

import com.flagship.wager_ledger.ledger.WagerLedger;
import com.flagship.wager_ledger.ledger.WagerNotFoundException;
import com.flagship.wager_ledger.outbox.OutboxService;
import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.event.WagerPostedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Records a successful post: CONFIRMED → POSTED plus the WagerPosted outbox event, in one
 * transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WagerPostingService {

    private final WagerLedger ledger;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public Wager recordPosted(UUID wagerId, String artifactRef) {
        ledger.markPosted(wagerId, artifactRef);
        Wager posted = ledger.findById(wagerId).orElseThrow(() -> new WagerNotFoundException(wagerId));
        outboxService.saveEvent(WagerPostedEvent.fromWager(posted, clock.instant()));
        log.info("Wager {} posted as {}", wagerId, artifactRef);
        return posted;
    }
}
