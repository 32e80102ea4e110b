package org.helmsman.runtime.input;

import java.util.Objects;

import org.helmsman.runtime.model.Value;

/**
 * An external input, applied at the start of the next tick.
 *
 * @param type The input type, e.g. {@code adjust_speed} or {@code set_field}.
 * @param subject What the input is about: an agent id, a path, or null.
 * @param value The payload value; absent for inputs that carry none.
 */
public record InputCommand(String type, String subject, Value value) {

    public InputCommand {
        Objects.requireNonNull(type, "type");
        value = value == null ? Value.absent() : value;
    }

    /**
     * @return a raw write of {@code value} to {@code path}.
     */
    public static InputCommand setField(String path, Object value) {
        return new InputCommand(InputTranslator.SET_FIELD, path, Value.of(value));
    }

    public static InputCommand of(String type, String subject, Object value) {
        return new InputCommand(type, subject, Value.of(value));
    }

    @Override
    public String toString() {
        return type + (subject == null ? "" : "(" + subject + ")")
                + (value.isAbsent() ? "" : " = " + value.render());
    }
}
