package org.helmsman.runtime.conditions;

import java.util.ArrayList;
import java.util.List;

import org.helmsman.runtime.errors.InvalidActionException;
import org.helmsman.runtime.errors.TypeMismatchException;
import org.helmsman.runtime.errors.UnknownPathException;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.FieldPath;
import org.helmsman.runtime.path.IStateReader;
import org.helmsman.runtime.path.PathResolver;

/**
 * Small arithmetic language used inside {@code {{...}}} operands and explanation placeholders.
 * <p>
 * Grammar:
 * <pre>
 *   expr   := term (('+' | '-') term)*
 *   term   := factor (('*' | '/') factor)*
 *   factor := '-' factor | '(' expr ')' | number | path | 'true' | 'false'
 * </pre>
 * A lone operand evaluates to its value of any type, so {@code {{environment.zone}}} yields text.
 * As soon as an operator is involved every operand must be numeric.
 */
public final class ValueExpression {

    private final String source;
    private final List<String> tokens;
    private final IStateReader reader;
    private int pos;

    private ValueExpression(String source, IStateReader reader) {
        this.source = source;
        this.tokens = tokenize(source);
        this.reader = reader;
    }

    /**
     * Evaluates an expression against a state.
     *
     * @param expression The expression text without the surrounding braces.
     * @param reader The state to resolve paths against.
     * @return the result.
     * @throws InvalidActionException if the expression is malformed or divides by zero.
     * @throws UnknownPathException if a path does not exist.
     * @throws TypeMismatchException if an arithmetic operand is not a number.
     */
    public static Value evaluate(String expression, IStateReader reader) {
        ValueExpression parser = new ValueExpression(expression, reader);
        if (parser.tokens.isEmpty()) {
            throw new InvalidActionException("Empty expression");
        }
        Value result = parser.expr();
        if (parser.pos < parser.tokens.size()) {
            throw new InvalidActionException("Unexpected '" + parser.tokens.get(parser.pos)
                    + "' in expression '" + expression + "'");
        }
        return result;
    }

    private Value expr() {
        Value left = term();
        while (peek("+") || peek("-")) {
            String op = tokens.get(pos++);
            double l = number(left);
            double r = number(term());
            left = Value.number(op.equals("+") ? l + r : l - r);
        }
        return left;
    }

    private Value term() {
        Value left = factor();
        while (peek("*") || peek("/")) {
            String op = tokens.get(pos++);
            double l = number(left);
            double r = number(factor());
            if (op.equals("/")) {
                if (r == 0.0) {
                    throw new InvalidActionException("Division by zero in expression '" + source + "'");
                }
                left = Value.number(l / r);
            } else {
                left = Value.number(l * r);
            }
        }
        return left;
    }

    private Value factor() {
        if (pos >= tokens.size()) {
            throw new InvalidActionException("Unexpected end of expression '" + source + "'");
        }
        String token = tokens.get(pos++);
        if (token.equals("-")) {
            return Value.number(-number(factor()));
        }
        if (token.equals("(")) {
            Value inner = expr();
            if (!peek(")")) {
                throw new InvalidActionException("Missing ')' in expression '" + source + "'");
            }
            pos++;
            return inner;
        }
        if (Character.isDigit(token.charAt(0))) {
            try {
                return Value.number(Double.parseDouble(token));
            } catch (NumberFormatException e) {
                throw new InvalidActionException("Malformed number '" + token + "' in expression '" + source + "'", e);
            }
        }
        if (token.equals("true") || token.equals("false")) {
            return Value.bool(Boolean.parseBoolean(token));
        }
        if (FieldPath.isPath(token)) {
            return PathResolver.resolve(reader, token);
        }
        if (isIdentifierStart(token.charAt(0))) {
            throw new UnknownPathException("'" + token + "' is not a field path");
        }
        throw new InvalidActionException("Unexpected '" + token + "' in expression '" + source + "'");
    }

    private double number(Value value) {
        if (value instanceof Value.NumberValue number) {
            return number.value();
        }
        throw new TypeMismatchException("Arithmetic requires numbers, got " + value.typeName()
                + " '" + value.render() + "' in expression '" + source + "'");
    }

    private boolean peek(String token) {
        return pos < tokens.size() && tokens.get(pos).equals(token);
    }

    private static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if ("+-*/()".indexOf(c) >= 0) {
                out.add(String.valueOf(c));
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                out.add(text.substring(start, i));
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < text.length() && (isIdentifierStart(text.charAt(i))
                        || Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                out.add(text.substring(start, i));
            } else {
                throw new InvalidActionException("Unexpected character '" + c + "' in expression '" + text + "'");
            }
        }
        return out;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }
}
