package com.flagship.wager_ledger.consumer;

import com.flagship.wager_ledger.presenter.Presenter;
import com.flagship.wager_ledger.wager.WagerStatus;
import com.flagship.wager_ledger.wager.event.WagerSettledEvent;
import com.flagship.wager_ledger.wager.event.WagerSettlementReversedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Posts a result notice next to the wager artifact when it is settled or a settlement is
 * retracted. Called only once per event by {@link WagerEventConsumer}.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WagerNoticeHandler {

    private final Presenter presenter;

    public void onWagerSettled(WagerSettledEvent event) {
        WagerStatus status = WagerStatus.valueOf(event.getSettledStatus());
        String message = String.format("Bet %s: <@%s> %s", resultWord(status), event.getOwnerId(),
                unitsText(status, event.getResultValue()));
        presenter.publishNotice(event.getDestination(), message);
        log.info("Published {} notice for wager {}", status, event.getWagerId());
    }

    public void onSettlementReversed(WagerSettlementReversedEvent event) {
        String message = String.format("Result retracted for <@%s>'s bet (was %s). Bet is pending again.",
                event.getOwnerId(), resultWord(WagerStatus.valueOf(event.getReversedStatus())).toLowerCase());
        presenter.publishNotice(event.getDestination(), message);
        log.info("Published reversal notice for wager {}", event.getWagerId());
    }

    static String resultWord(WagerStatus status) {
        return switch (status) {
            case SETTLED_WON -> "Won";
            case SETTLED_LOST -> "Lost";
            case SETTLED_PUSH -> "Push";
            case VOIDED -> "Cancelled";
            default -> status.name();
        };
    }

    static String unitsText(WagerStatus status, BigDecimal resultValue) {
        if (status == WagerStatus.VOIDED || resultValue == null) {
            return "no units moved";
        }
        return String.format(Locale.ROOT, "%+.2f units", resultValue);
    }
}
