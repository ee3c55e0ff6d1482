package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.model.ActionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Rule stores")
class RuleStoreTest {

    private CorrelationRuleStore correlationRules;
    private ResponseRuleStore responseRules;

    @BeforeEach
    void setUp() {
        correlationRules = new CorrelationRuleStore(DefaultRules.correlationRules());
        responseRules = new ResponseRuleStore(DefaultRules.responseRules());
    }

    private static CorrelationRule.Builder correlationRule(String id) {
        return CorrelationRule.builder()
                .id(id)
                .name("Export burst")
                .timeWindow(Duration.ofMinutes(10))
                .minEvents(3)
                .maxEvents(30)
                .conditions(List.of(
                        RuleCondition.of(EventField.ACTION, ConditionOperator.EQUALS, "EXPORT"),
                        RuleCondition.same(EventField.ACTOR_ID)));
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should load the built-in rule sets")
        void shouldLoadDefaults() {
            assertThat(correlationRules.size()).isEqualTo(6);
            assertThat(responseRules.size()).isEqualTo(6);
            assertThat(correlationRules.get("coordinated_brute_force")).isPresent();
            assertThat(responseRules.get("critical_brute_force")).isPresent();
        }

        @Test
        @DisplayName("Should reject duplicate ids in the initial set")
        void shouldRejectDuplicateInitialIds() {
            CorrelationRule rule = correlationRule("dup").build();

            assertThatThrownBy(() -> new CorrelationRuleStore(List.of(rule, rule)))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("Mutation")
    class Mutation {

        @Test
        @DisplayName("Should add, update and delete a rule")
        void shouldManageRuleLifecycle() {
            correlationRules.add(correlationRule("export_burst").build());
            correlationRules.update(correlationRule("export_burst").minEvents(5).build());

            assertThat(correlationRules.get("export_burst")).get()
                    .extracting(CorrelationRule::getMinEvents).isEqualTo(5);

            correlationRules.delete("export_burst");
            assertThat(correlationRules.get("export_burst")).isEmpty();
        }

        @Test
        @DisplayName("Should reject adding an existing id")
        void shouldRejectExistingId() {
            assertThatThrownBy(() -> correlationRules.add(correlationRule("coordinated_brute_force").build()))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("already exists");
        }

        @Test
        @DisplayName("Should report unknown ids on update and delete")
        void shouldRejectUnknownIds() {
            assertThatThrownBy(() -> correlationRules.update(correlationRule("missing").build()))
                    .isInstanceOf(RuleNotFoundException.class);
            assertThatThrownBy(() -> responseRules.delete("missing"))
                    .isInstanceOf(RuleNotFoundException.class);
        }

        @Test
        @DisplayName("Should leave the store unchanged when a rule is invalid")
        void shouldRejectInvalidRule() {
            int before = correlationRules.size();

            assertThatThrownBy(() -> correlationRules.add(correlationRule("bad").minEvents(10).maxEvents(2).build()))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("maxEvents");
            assertThatThrownBy(() -> correlationRules.add(correlationRule("bad").timeWindow(Duration.ZERO).build()))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThat(correlationRules.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("Should require at least one action on a response rule")
        void shouldRequireActions() {
            ResponseRule noActions = ResponseRule.builder().id("empty").name("Empty").build();

            assertThatThrownBy(() -> responseRules.add(noActions))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("action");
        }

        @Test
        @DisplayName("Should return a snapshot that later writes do not change")
        void shouldReturnSnapshot() {
            List<ResponseRule> snapshot = responseRules.list();

            responseRules.add(ResponseRule.builder()
                    .id("log_everything")
                    .name("Log everything")
                    .actions(List.of(RuleAction.of(ActionType.LOG, Map.of())))
                    .build());

            assertThat(snapshot).hasSize(6);
            assertThat(responseRules.list()).hasSize(7);
        }
    }
}
