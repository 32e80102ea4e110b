package org.helmsman.runtime.conflicts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.ActionType;
import org.helmsman.runtime.model.Rule;
import org.helmsman.runtime.model.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link ConflictPolicy}, {@link ConflictStrategy}, {@link MergeFunction} and
 * {@link ClampRange}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConflictPolicyTest {

    @Test
    void actionHintBeatsRuleHints() {
        Rule keeper = Rule.builder("keeper").metadata("conflict_strategy", "merge").build();
        Rule incoming = Rule.builder("incoming").metadata("conflict_strategy", "priority").build();
        Action action = Action.builder(ActionType.SET).target("environment.zone").value("x")
                .metadata("conflict_strategy", "last-write-wins").build();

        ConflictStrategy strategy = ConflictPolicy.defaults().select(write(keeper, Action.set("environment.zone", "y")),
                write(incoming, action));

        assertThat(strategy).isEqualTo(ConflictStrategy.LAST_WRITE_WINS);
    }

    @Test
    void incomingRuleHintBeatsKeeperRuleHint() {
        Rule keeper = Rule.builder("keeper").metadata("conflict_strategy", "merge").build();
        Rule incoming = Rule.builder("incoming").metadata("conflict_strategy", "manual_review").build();

        assertThat(ConflictPolicy.defaults().select(write(keeper), write(incoming)))
                .isEqualTo(ConflictStrategy.MANUAL_REVIEW);
    }

    @Test
    void configuredListsApplyBeforeDefault() {
        ConflictPolicy policy = new ConflictPolicy(ConflictStrategy.PRIORITY, MergeFunction.AVERAGE, 0,
                Set.of("a", "b"), Set.of("b"));
        Rule a = Rule.builder("a").build();
        Rule b = Rule.builder("b").build();
        Rule c = Rule.builder("c").build();

        assertThat(policy.select(write(a), write(b))).isEqualTo(ConflictStrategy.MANUAL_REVIEW);
        assertThat(policy.select(write(a), write(c))).isEqualTo(ConflictStrategy.MERGE);
        assertThat(policy.select(write(c), write(Rule.builder("d").build()))).isEqualTo(ConflictStrategy.PRIORITY);
    }

    @Test
    void escalationNeedsPositiveThreshold() {
        assertThat(ConflictPolicy.defaults().escalates(5, 5)).isFalse();
        ConflictPolicy policy = new ConflictPolicy(ConflictStrategy.PRIORITY, MergeFunction.AVERAGE, 10, Set.of(),
                Set.of());
        assertThat(policy.escalates(50, 45)).isTrue();
        assertThat(policy.escalates(50, 40)).isFalse();
    }

    @Test
    void rejectsNegativeThreshold() {
        assertThatThrownBy(() -> new ConflictPolicy(ConflictStrategy.PRIORITY, MergeFunction.AVERAGE, -1, Set.of(),
                Set.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void strategyNamesAreLenient() {
        assertThat(ConflictStrategy.parse("last-write-wins")).isEqualTo(ConflictStrategy.LAST_WRITE_WINS);
        assertThat(ConflictStrategy.parse(" Merge ")).isEqualTo(ConflictStrategy.MERGE);
        assertThatThrownBy(() -> ConflictStrategy.parse("coin_flip")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeFunctions() {
        assertThat(MergeFunction.AVERAGE.apply(4, 8)).isEqualTo(6.0);
        assertThat(MergeFunction.MIN.apply(4, 8)).isEqualTo(4.0);
        assertThat(MergeFunction.MAX.apply(4, 8)).isEqualTo(8.0);
        assertThat(MergeFunction.parse("max")).isEqualTo(MergeFunction.MAX);
    }

    @Test
    void clampRanges() {
        ClampRange range = new ClampRange(0, 10);

        assertThat(range.clamp(12)).isEqualTo(10.0);
        assertThat(range.clamp(-1)).isEqualTo(0.0);
        assertThat(range.intersect(new ClampRange(2, 8))).isEqualTo(new ClampRange(2, 8));
        assertThat(range.intersect(new ClampRange(11, 12))).isNull();
        assertThatThrownBy(() -> new ClampRange(5, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static PendingWrite write(Rule rule) {
        return write(rule, Action.set("environment.zone", "x"));
    }

    private static PendingWrite write(Rule rule, Action action) {
        return new PendingWrite("environment.zone", rule, action, Value.text("x"), null);
    }
}
