package com.memberassist.orchestrator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowSettingsTest {

    @Test
    void backoffDoublesAndIsCapped() {
        WorkflowSettings settings = WorkflowSettings.defaults()
                .withRetry(5, Duration.ofMillis(100), Duration.ofMillis(1000));

        assertThat(settings.backoffFor(0)).isEqualTo(Duration.ZERO);
        assertThat(settings.backoffFor(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(settings.backoffFor(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(settings.backoffFor(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(settings.backoffFor(4)).isEqualTo(Duration.ofMillis(1000));
        assertThat(settings.backoffFor(60)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThatThrownBy(() -> WorkflowSettings.defaults().withThresholds(4.0, 6.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkflowSettings.defaults().withThresholds(11.0, 5.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requiresAtLeastOneAttempt() {
        assertThatThrownBy(() -> WorkflowSettings.defaults().withRetry(0, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void propertiesConvertWithDefaults() {
        WorkflowSettings settings = new OrchestratorProperties().toWorkflowSettings();

        assertThat(settings).isEqualTo(WorkflowSettings.defaults());
    }
}
