package com.flagship.wager_ledger.wizard;

import com.flagship.wager_ledger.wager.WagerType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class WizardSettings {
    List<String> leagues;
    Duration straightTimeout;
    Duration parlayTimeout;
    int maxOddsMagnitude;

    public Duration timeoutFor(WagerType type) {
        return type == WagerType.PARLAY ? parlayTimeout : straightTimeout;
    }
}
