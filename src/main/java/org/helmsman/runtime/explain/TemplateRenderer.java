package org.helmsman.runtime.explain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.helmsman.runtime.conditions.ValueExpression;
import org.helmsman.runtime.errors.EngineException;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.IStateReader;

/**
 * Expands {@code {{name}}} placeholders in explanation templates and log messages.
 * <p>
 * A placeholder is looked up in the captured values first, then evaluated as a
 * {@link ValueExpression} against the state (so {@code {{agents.tugboat.speed}}} and
 * {@code {{agents.tugboat.speed * 2}}} both work). A placeholder that resolves neither way is left
 * in the text verbatim and reported as unresolved; rendering never throws.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private TemplateRenderer() {
    }

    /**
     * Result of a rendering.
     *
     * @param text The expanded text.
     * @param unresolved The placeholders left verbatim, as written (e.g. {@code {{foo}}}).
     */
    public record Rendered(String text, List<String> unresolved) {
        public Rendered {
            unresolved = List.copyOf(unresolved);
        }
    }

    /**
     * @param template The template, may be empty.
     * @param captured Values captured during rule evaluation, by placeholder name.
     * @param reader The state used for placeholders that were not captured.
     * @return the expansion.
     */
    public static Rendered render(String template, Map<String, Value> captured, IStateReader reader) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        List<String> unresolved = new ArrayList<>();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement;
            Value value = captured.get(name);
            if (value == null) {
                value = tryEvaluate(name, reader);
            }
            if (value == null) {
                replacement = matcher.group();
                unresolved.add(matcher.group());
            } else {
                replacement = value.render();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return new Rendered(out.toString(), unresolved);
    }

    private static Value tryEvaluate(String expression, IStateReader reader) {
        try {
            Value value = ValueExpression.evaluate(expression, reader);
            return value.isAbsent() ? null : value;
        } catch (EngineException e) {
            // placeholder stays verbatim and is reported by the caller
            return null;
        }
    }
}
