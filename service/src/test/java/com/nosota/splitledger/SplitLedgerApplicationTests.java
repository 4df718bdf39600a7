package com.nosota.splitledger;

import com.nosota.splitledger.tests.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;

import java.time.Clock;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class SplitLedgerApplicationTests extends TestBase {

    @Autowired
    private Clock clock;

    @Value("${split-ledger.itemized.extreme-percentage-threshold}")
    private String extremePercentageThreshold;

    @Value("${split-ledger.rounding.deterministic-seed}")
    private long deterministicSeed;

    @Test
    void contextLoads() {
        assertThat(itemizedCalculator).isNotNull();
        assertThat(settlementAggregator).isNotNull();
    }

    @Test
    void fixedClockReplacesSystemClock() {
        assertThat(LocalDateTime.now(clock)).isEqualTo(TestClockConfig.FIXED_TIME);
    }

    @Test
    void testProfileOverridesDefaults() {
        // application.yml default, kept by the test profile
        assertThat(extremePercentageThreshold).isEqualTo("50");
        // overridden in application-test.yml
        assertThat(deterministicSeed).isEqualTo(7L);
    }
}
