package org.helmsman.runtime.conditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.FieldPath;
import org.helmsman.runtime.path.IStateReader;
import org.helmsman.runtime.path.PathResolver;

/**
 * Turns a declared operand into a concrete value.
 * <p>
 * Text of the form {@code {{expression}}} is evaluated as a {@link ValueExpression}; text that is
 * syntactically a field path is resolved; everything else is a literal. Sequence elements are
 * resolved one by one.
 */
public final class OperandResolver {

    private static final Pattern EXPRESSION = Pattern.compile("^\\s*\\{\\{(.+)}}\\s*$", Pattern.DOTALL);

    private OperandResolver() {
    }

    /**
     * @param operand The declared operand.
     * @param reader The state to resolve against.
     * @return the resolved value.
     * @throws org.helmsman.runtime.errors.EngineException if a path or expression cannot be resolved.
     */
    public static Value resolve(Value operand, IStateReader reader) {
        if (operand instanceof Value.TextValue text) {
            Optional<String> expression = expressionOf(text.value());
            if (expression.isPresent()) {
                return ValueExpression.evaluate(expression.get(), reader);
            }
            if (FieldPath.isPath(text.value())) {
                return PathResolver.resolve(reader, text.value());
            }
            return operand;
        }
        if (operand instanceof Value.ListValue list) {
            List<Value> resolved = new ArrayList<>(list.elements().size());
            for (Value element : list.elements()) {
                resolved.add(resolve(element, reader));
            }
            return new Value.ListValue(resolved);
        }
        return operand;
    }

    /**
     * @return the event type if the operand is an {@code events.*} path, otherwise empty.
     */
    public static Optional<String> eventTypeOf(Value operand) {
        if (operand instanceof Value.TextValue text) {
            return FieldPath.tryParse(text.value())
                    .filter(path -> path.container() == FieldPath.Container.EVENTS)
                    .map(FieldPath::key);
        }
        return Optional.empty();
    }

    /**
     * @return the inner expression if the text is wrapped in {@code {{ }}}.
     */
    public static Optional<String> expressionOf(String text) {
        Matcher matcher = EXPRESSION.matcher(text);
        return matcher.matches() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }
}
