package org.helmsman.runtime.conditions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.errors.InvalidActionException;
import org.helmsman.runtime.errors.TypeMismatchException;
import org.helmsman.runtime.errors.UnknownPathException;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link ValueExpression}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ValueExpressionTest {

    private final SystemState state = HarborFixtures.twoVessels();

    @Test
    void honoursOperatorPrecedenceAndParentheses() {
        assertThat(ValueExpression.evaluate("2 + 3 * 4", state)).isEqualTo(Value.number(14));
        assertThat(ValueExpression.evaluate("(2 + 3) * 4", state)).isEqualTo(Value.number(20));
        assertThat(ValueExpression.evaluate("10 / 4 - 1", state)).isEqualTo(Value.number(1.5));
        assertThat(ValueExpression.evaluate("-3 + 5", state)).isEqualTo(Value.number(2));
    }

    @Test
    void resolvesPathsInArithmetic() {
        assertThat(ValueExpression.evaluate("agents.cargo_ship.speed + 2", state)).isEqualTo(Value.number(8));
        assertThat(ValueExpression.evaluate("agents.tugboat.speed - agents.cargo_ship.speed", state))
                .isEqualTo(Value.number(2));
    }

    @Test
    void loneOperandKeepsItsType() {
        assertThat(ValueExpression.evaluate("environment.zone", state)).isEqualTo(Value.text("harbour_entry"));
        assertThat(ValueExpression.evaluate("true", state)).isEqualTo(Value.bool(true));
    }

    @Test
    void divisionByZeroIsInvalid() {
        assertThatThrownBy(() -> ValueExpression.evaluate("agents.tugboat.speed / 0", state))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("Division by zero");
    }

    @Test
    void arithmeticOnTextIsTypeMismatch() {
        assertThatThrownBy(() -> ValueExpression.evaluate("environment.zone + 1", state))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void unknownNamesAreUnknownPaths() {
        assertThatThrownBy(() -> ValueExpression.evaluate("agents.tugboat.draft * 2", state))
                .isInstanceOf(UnknownPathException.class);
        assertThatThrownBy(() -> ValueExpression.evaluate("speed + 1", state))
                .isInstanceOf(UnknownPathException.class);
    }

    @Test
    void malformedExpressionsAreInvalid() {
        assertThatThrownBy(() -> ValueExpression.evaluate("(1 + 2", state))
                .isInstanceOf(InvalidActionException.class);
        assertThatThrownBy(() -> ValueExpression.evaluate("1 +", state))
                .isInstanceOf(InvalidActionException.class);
        assertThatThrownBy(() -> ValueExpression.evaluate("1 2", state))
                .isInstanceOf(InvalidActionException.class);
        assertThatThrownBy(() -> ValueExpression.evaluate("1 % 2", state))
                .isInstanceOf(InvalidActionException.class);
        assertThatThrownBy(() -> ValueExpression.evaluate("   ", state))
                .isInstanceOf(InvalidActionException.class);
    }
}
