package com.vigilant.core.config;

import com.vigilant.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MonitoringConfig")
class MonitoringConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should match the documented defaults")
        void shouldHaveDefaults() {
            MonitoringConfig config = MonitoringConfig.defaults();

            assertThat(config.getIngestionInterval()).isEqualTo(Duration.ofSeconds(5));
            assertThat(config.getThreatDetectionInterval()).isEqualTo(Duration.ofSeconds(10));
            assertThat(config.getCorrelationInterval()).isEqualTo(Duration.ofSeconds(15));
            assertThat(config.getCorrelationWindow()).isEqualTo(Duration.ofHours(1));
            assertThat(config.getMaxAutoResponsesPerHour()).isEqualTo(50);
            assertThat(config.getAutoResponseMinRiskScore()).isEqualTo(60);
            assertThat(config.getCorrelationRiskThreshold()).isEqualTo(70);
        }

        @Test
        @DisplayName("Should build from bound properties")
        void shouldBuildFromProperties() {
            VigilantProperties properties = new VigilantProperties();
            properties.getMonitor().setIngestionInterval(Duration.ofSeconds(2));
            properties.getMonitor().setMaxAutoResponsesPerHour(7);

            MonitoringConfig config = MonitoringConfig.from(properties);

            assertThat(config.getIngestionInterval()).isEqualTo(Duration.ofSeconds(2));
            assertThat(config.getMaxAutoResponsesPerHour()).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("Severity buckets")
    class Buckets {

        @Test
        @DisplayName("Should map risk scores to severities at the thresholds")
        void shouldBucketRisk() {
            MonitoringConfig config = MonitoringConfig.defaults();

            assertThat(config.severityFor(95)).isEqualTo(Severity.CRITICAL);
            assertThat(config.severityFor(90)).isEqualTo(Severity.CRITICAL);
            assertThat(config.severityFor(75)).isEqualTo(Severity.HIGH);
            assertThat(config.severityFor(50)).isEqualTo(Severity.MEDIUM);
            assertThat(config.severityFor(49)).isEqualTo(Severity.LOW);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject non-positive intervals")
        void shouldRejectZeroInterval() {
            MonitoringConfig config = MonitoringConfig.defaults().toBuilder()
                    .ingestionInterval(Duration.ZERO)
                    .build();

            assertThatThrownBy(config::validate)
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("ingestionInterval");
        }

        @Test
        @DisplayName("Should reject thresholds out of order")
        void shouldRejectThresholdOrder() {
            MonitoringConfig config = MonitoringConfig.defaults().toBuilder()
                    .highThreshold(95)
                    .build();

            assertThatThrownBy(config::validate)
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("medium <= high <= critical");
        }

        @Test
        @DisplayName("Should reject scores outside 0..100")
        void shouldRejectScoreRange() {
            MonitoringConfig config = MonitoringConfig.defaults().toBuilder()
                    .reportingThreshold(101)
                    .build();

            assertThatThrownBy(config::validate).isInstanceOf(InvalidConfigurationException.class);
        }
    }
}
