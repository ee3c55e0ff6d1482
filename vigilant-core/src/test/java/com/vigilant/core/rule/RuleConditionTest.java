package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleCondition")
class RuleConditionTest {

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Should compare numbers by value")
        void shouldCompareNumbers() {
            RuleCondition<ThreatField> gt = RuleCondition.of(ThreatField.RISK_SCORE, ConditionOperator.GREATER_THAN, 85);

            assertThat(gt.test(86)).isTrue();
            assertThat(gt.test(85)).isFalse();
            assertThat(gt.test(null)).isFalse();
        }

        @Test
        @DisplayName("Should test membership with in and not_in")
        void shouldTestMembership() {
            RuleCondition<EventField> in = RuleCondition.of(EventField.ACTION, ConditionOperator.IN,
                    List.of("EXPORT", "DOWNLOAD"));
            RuleCondition<EventField> notIn = RuleCondition.of(EventField.ACTION, ConditionOperator.NOT_IN,
                    List.of("EXPORT"));

            assertThat(in.test("DOWNLOAD")).isTrue();
            assertThat(in.test("VIEW")).isFalse();
            assertThat(notIn.test("VIEW")).isTrue();
            assertThat(notIn.test(null)).isTrue();
        }

        @Test
        @DisplayName("Should match substrings and collection elements with contains")
        void shouldMatchContains() {
            RuleCondition<EventField> onString = RuleCondition.of(EventField.ACTION, ConditionOperator.CONTAINS,
                    "PERMISSION");
            RuleCondition<ThreatField> onList = RuleCondition.of(ThreatField.AFFECTED_RESOURCES,
                    ConditionOperator.CONTAINS, "user_42");

            assertThat(onString.test("PERMISSION_CHANGE")).isTrue();
            assertThat(onString.test("LOGIN")).isFalse();
            assertThat(onList.test(List.of("tenant_1", "user_42"))).isTrue();
        }

        @Test
        @DisplayName("Should search with regex")
        void shouldMatchRegex() {
            RuleCondition<EventField> regex = RuleCondition.of(EventField.IP_ADDRESS, ConditionOperator.REGEX,
                    "^10\\.0\\.");

            assertThat(regex.test("10.0.3.4")).isTrue();
            assertThat(regex.test("192.168.0.1")).isFalse();
        }

        @Test
        @DisplayName("Should classify SAME conditions as grouping or distinct")
        void shouldRecognizeSame() {
            assertThat(RuleCondition.same(EventField.ACTOR_ID).isGroupingCondition()).isTrue();
            assertThat(RuleCondition.distinct(EventField.IP_ADDRESS).isDistinctCondition()).isTrue();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject a scalar value for in")
        void shouldRejectScalarForIn() {
            assertThatThrownBy(() -> RuleCondition.of(EventField.ACTION, ConditionOperator.IN, "EXPORT"))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("requires a list value");
        }

        @Test
        @DisplayName("Should reject greater_than on a text field")
        void shouldRejectNumericOperatorOnTextField() {
            assertThatThrownBy(() -> RuleCondition.of(EventField.ACTION, ConditionOperator.GREATER_THAN, 3))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("numeric field");
        }

        @Test
        @DisplayName("Should reject an invalid regex at load time")
        void shouldRejectBadRegex() {
            assertThatThrownBy(() -> RuleCondition.of(EventField.ACTION, ConditionOperator.REGEX, "(["))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("Invalid regex");
        }

        @Test
        @DisplayName("Should reject SAME with operators other than equals and not_equals")
        void shouldRejectSameWithContains() {
            assertThatThrownBy(() -> RuleCondition.of(EventField.ACTOR_ID, ConditionOperator.CONTAINS,
                    RuleCondition.SAME))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Should resolve field aliases and reject unknown fields")
        void shouldResolveFields() {
            assertThat(EventField.fromName("userId")).isEqualTo(EventField.ACTOR_ID);
            assertThat(EventField.fromName("propertyId")).isEqualTo(EventField.TENANT_ID);
            assertThatThrownBy(() -> EventField.fromName("shoeSize"))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> ConditionOperator.fromName("approximately"))
                    .isInstanceOf(InvalidConfigurationException.class);
        }
    }
}
