package com.flagship.wager_ledger.config;

import com.flagship.wager_ledger.wager.StakePolicy;
import com.flagship.wager_ledger.wizard.WizardSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Community-level settings for the placement wizard and the clock every engine reads.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StakePolicy stakePolicy(
            @Value("${wager.stake.min:0.5}") BigDecimal min,
            @Value("${wager.stake.max:3.0}") BigDecimal max,
            @Value("${wager.stake.increment:0.5}") BigDecimal increment) {
        log.info("Stake policy: {} to {} units in steps of {}", min, max, increment);
        return new StakePolicy(min, max, increment);
    }

    @Bean
    public WizardSettings wizardSettings(
            @Value("${wizard.leagues:NFL,NBA,MLB,NHL,NCAAF,NCAAB}") List<String> leagues,
            @Value("${wizard.timeout.straight:PT10M}") Duration straightTimeout,
            @Value("${wizard.timeout.parlay:PT30M}") Duration parlayTimeout,
            @Value("${wager.odds.max-magnitude:10000}") int maxOddsMagnitude) {
        return WizardSettings.builder()
                .leagues(List.copyOf(leagues))
                .straightTimeout(straightTimeout)
                .parlayTimeout(parlayTimeout)
                .maxOddsMagnitude(maxOddsMagnitude)
                .build();
    }
}
