package com.touchline.unit.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.touchline.condition.ConditionTreeValidator;
import com.touchline.core.engine.AlertEngineConfig;
import com.touchline.domain.model.AlertRule;
import com.touchline.entity.AlertRuleEntity;
import com.touchline.exception.StoreUnavailableException;
import com.touchline.repository.jpa.AlertRuleJpaRepository;
import com.touchline.store.JpaRuleStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class JpaRuleStoreTest {

    private static final String LEAF_JSON =
            "{\"@type\":\"LEAF\",\"signal\":\"GOALS\",\"team\":\"Arsenal\",\"operator\":\"GREATER_THAN\",\"value\":1}";

    @Mock
    private AlertRuleJpaRepository alertRuleJpaRepository;

    private JpaRuleStore jpaRuleStore;

    @BeforeEach
    void setUp() {
        jpaRuleStore = new JpaRuleStore(alertRuleJpaRepository, new ConditionTreeValidator(new AlertEngineConfig()));
    }

    private AlertRuleEntity entity(long id, String tree) {
        return AlertRuleEntity.builder().id(id).name("rule " + id).conditionTree(tree).active(true).build();
    }

    @Test
    void loadActiveRules_mapsValidRows() {
        when(alertRuleJpaRepository.findByActiveTrue()).thenReturn(List.of(entity(1, LEAF_JSON)));

        List<AlertRule> rules = jpaRuleStore.loadActiveRules();

        assertThat(rules).extracting(AlertRule::getId).containsExactly(1L);
    }

    @Test
    void loadActiveRules_skipsInvalidAndUnreadableRows() {
        String notWithTwoChildren = "{\"@type\":\"COMPOSITE\",\"logic\":\"NOT\",\"children\":[" + LEAF_JSON + ","
                + LEAF_JSON + "]}";
        when(alertRuleJpaRepository.findByActiveTrue()).thenReturn(List.of(
                entity(1, LEAF_JSON), entity(2, notWithTwoChildren), entity(3, "{broken"), entity(4, LEAF_JSON)));

        List<AlertRule> rules = jpaRuleStore.loadActiveRules();

        assertThat(rules).extracting(AlertRule::getId).containsExactly(1L, 4L);
    }

    @Test
    void loadActiveRules_loadsSequenceTriggersWithoutTypeProperty() {
        String sequences = "[{\"timeLimitSeconds\":1200,\"events\":["
                + "{\"signal\":\"SCORE_DIFFERENCE\",\"team\":\"Arsenal\",\"operator\":\"LESS_THAN_OR_EQUAL\",\"value\":-1},"
                + "{\"signal\":\"SCORE_DIFFERENCE\",\"team\":\"Arsenal\",\"operator\":\"GREATER_THAN_OR_EQUAL\",\"value\":1}]}]";
        AlertRuleEntity comeback = entity(7, LEAF_JSON);
        comeback.setSequences(sequences);
        when(alertRuleJpaRepository.findByActiveTrue()).thenReturn(List.of(comeback));

        List<AlertRule> rules = jpaRuleStore.loadActiveRules();

        assertThat(rules).singleElement().satisfies(rule -> {
            assertThat(rule.getId()).isEqualTo(7L);
            assertThat(rule.getSequences()).singleElement()
                    .satisfies(sequence -> assertThat(sequence.getDistinctTriggerCount()).isEqualTo(2));
        });
    }

    @Test
    void loadActiveRules_databaseDown_throwsStoreUnavailable() {
        when(alertRuleJpaRepository.findByActiveTrue())
                .thenThrow(new DataAccessResourceFailureException("Communications link failure"));

        assertThatThrownBy(() -> jpaRuleStore.loadActiveRules())
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("alert_rules");
    }

    @Test
    void verifyAvailable_databaseDown_throwsStoreUnavailable() {
        when(alertRuleJpaRepository.count()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> jpaRuleStore.verifyAvailable()).isInstanceOf(StoreUnavailableException.class);
    }
}
