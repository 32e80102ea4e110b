package org.helmsman.runtime.conditions;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.errors.ErrorKind;
import org.helmsman.runtime.model.Condition;
import org.helmsman.runtime.model.ConditionLogic;
import org.helmsman.runtime.model.EventSeverity;
import org.helmsman.runtime.model.Operator;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link ConditionEvaluator}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private SystemState state;

    @BeforeEach
    void setUp() {
        state = HarborFixtures.twoVessels();
    }

    @Test
    void comparesPathAgainstLiteral() {
        ConditionEvaluation evaluation = evaluator.evaluate(Condition.of("agents.tugboat.speed", ">", 5), state);

        assertThat(evaluation.result()).isTrue();
        assertThat(evaluation.leftValue()).isEqualTo(Value.number(8));
        assertThat(evaluation.rightValue()).isEqualTo(Value.number(5));
        assertThat(evaluation.message()).contains("agents.tugboat.speed").endsWith("-> true");
        assertThat(evaluation.failed()).isFalse();
    }

    @Test
    void comparesTwoAgents() {
        ConditionEvaluation evaluation = evaluator.evaluate(
                Condition.of("agents.tugboat.speed", ">", "agents.cargo_ship.speed"), state);

        assertThat(evaluation.result()).isTrue();
        assertThat(evaluation.rightValue()).isEqualTo(Value.number(6));
    }

    @Test
    void membershipUsesTypedEquality() {
        assertThat(evaluator.evaluate(Condition.of("environment.zone", "in",
                List.of("harbour_entry", "no_wake_zone")), state).result()).isTrue();
        assertThat(evaluator.evaluate(Condition.of("environment.zone", "in",
                List.of("docking_zone")), state).result()).isFalse();
    }

    @Test
    void equalityIsTyped() {
        assertThat(ConditionEvaluator.typedEquals(Value.number(1), Value.number(1.0))).isTrue();
        assertThat(ConditionEvaluator.typedEquals(Value.number(1), Value.text("1"))).isFalse();
        assertThat(ConditionEvaluator.typedEquals(Value.bool(true), Value.number(1))).isFalse();
        assertThat(ConditionEvaluator.typedEquals(Value.absent(), Value.bool(false))).isTrue();
        assertThat(ConditionEvaluator.typedEquals(Value.absent(), Value.absent())).isTrue();
        assertThat(ConditionEvaluator.typedEquals(Value.absent(), Value.bool(true))).isFalse();
    }

    @Test
    void numericTextCoercesForOrdering() {
        assertThat(ConditionEvaluator.compare(Value.text("12.5"), Operator.GT, Value.number(10))).isTrue();
    }

    @Test
    void orderingOnTextIsRecordedAsTypeMismatch() {
        ConditionEvaluation evaluation = evaluator.evaluate(Condition.of("environment.zone", "<", 3), state);

        assertThat(evaluation.result()).isFalse();
        assertThat(evaluation.failure().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
        assertThat(evaluation.message()).contains("error");
    }

    @Test
    void unknownPathIsRecordedNotThrown() {
        ConditionEvaluation evaluation = evaluator.evaluate(Condition.of("agents.tugboat.draft", ">", 3), state);

        assertThat(evaluation.failed()).isTrue();
        assertThat(evaluation.failure().kind()).isEqualTo(ErrorKind.UNKNOWN_PATH);
    }

    @Test
    void andOrAndEmptySets() {
        List<Condition> mixed = List.of(
                Condition.of("agents.tugboat.speed", ">", 5),
                Condition.of("environment.visibility", "<", 0.5));

        assertThat(evaluator.evaluateAll(mixed, ConditionLogic.AND, state).satisfied()).isFalse();
        assertThat(evaluator.evaluateAll(mixed, ConditionLogic.OR, state).satisfied()).isTrue();
        assertThat(evaluator.evaluateAll(List.of(), ConditionLogic.AND, state).satisfied()).isTrue();
    }

    @Test
    void everyConditionIsEvaluatedEvenAfterTheOutcomeIsKnown() {
        ConditionSetEvaluation set = evaluator.evaluateAll(List.of(
                Condition.of("agents.tugboat.speed", ">", 5),
                Condition.of("environment.visibility", "<", 0.5),
                Condition.of("environment.wind_speed", "<", 20)), ConditionLogic.OR, state);

        assertThat(set.evaluations()).hasSize(3);
        assertThat(set.conditionsMet()).hasSize(2);
    }

    @Test
    void failedConditionMakesSetUnsatisfiedEvenUnderOr() {
        ConditionSetEvaluation set = evaluator.evaluateAll(List.of(
                Condition.of("agents.tugboat.speed", ">", 5),
                Condition.of("agents.tugboat.draft", ">", 1)), ConditionLogic.OR, state);

        assertThat(set.satisfied()).isFalse();
        assertThat(set.failure()).isNotNull();
    }

    @Test
    void reportsObservedEvents() {
        state.events().spawn("fog_rule", "fog_detected", Map.of(), EventSeverity.WARNING);

        ConditionSetEvaluation set = evaluator.evaluateAll(
                List.of(Condition.of("events.fog_detected", "==", true)), ConditionLogic.AND, state);

        assertThat(set.satisfied()).isTrue();
        assertThat(set.observedEvents()).containsExactly("fog_detected");
    }

    @Test
    void absentEventIsNotTrue() {
        ConditionSetEvaluation set = evaluator.evaluateAll(
                List.of(Condition.of("events.fog_detected", "==", true)), ConditionLogic.AND, state);

        assertThat(set.satisfied()).isFalse();
        assertThat(set.failure()).isNull();
        assertThat(set.observedEvents()).isEmpty();
    }

    @Test
    void expressionOperandsAreEvaluated() {
        ConditionEvaluation evaluation = evaluator.evaluate(
                Condition.of("agents.tugboat.speed", "==", "{{agents.cargo_ship.speed + 2}}"), state);

        assertThat(evaluation.result()).isTrue();
    }
}
