package com.premiergroup.ad_autopilot.service.loop;

import com.premiergroup.ad_autopilot.TestProperties;
import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ControlLoopSettingsTest {

    private final AdAccount live = AdAccount.builder().id(1L).name("Live").customerId(1L).build();
    private final AdAccount dry = AdAccount.builder().id(2L).name("Dry").customerId(2L).dryRun(true).build();

    @Test
    void defaultsComeFromProperties() {
        ControlLoopSettings settings = ControlLoopSettings.of(TestProperties.defaults(), live, null);

        assertThat(settings.dryRun()).isFalse();
        assertThat(settings.maxDailyBudget()).isEqualByComparingTo("1000");
        assertThat(settings.replayWait()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void accountFlagOrGlobalSwitchTurnsOnDryRun() {
        AutopilotProperties global = TestProperties.with(Map.of("autopilot.dispatch.dry-run", "true"));

        assertThat(ControlLoopSettings.of(TestProperties.defaults(), dry, null).dryRun()).isTrue();
        assertThat(ControlLoopSettings.of(global, live, null).dryRun()).isTrue();
    }

    @Test
    void explicitOverrideWins() {
        assertThat(ControlLoopSettings.of(TestProperties.defaults(), dry, false).dryRun()).isFalse();
        assertThat(ControlLoopSettings.of(TestProperties.defaults(), live, true).dryRun()).isTrue();
        assertThat(ControlLoopSettings.of(TestProperties.defaults(), null, null).dryRun()).isFalse();
    }
}
