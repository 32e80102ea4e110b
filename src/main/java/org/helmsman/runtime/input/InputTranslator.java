package org.helmsman.runtime.input;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.IStateReader;

/**
 * Registry of {@link IInputHandler}s by input type.
 * <p>
 * Built-in types:
 * <ul>
 *   <li>{@code set_field}: writes the value to the path named by the subject</li>
 *   <li>{@code adjust_speed}: {@code agents.{subject}.speed}</li>
 *   <li>{@code change_angle}: {@code agents.{subject}.heading}</li>
 *   <li>{@code activate_docking_mode}: {@code environment.docking_mode = true}</li>
 *   <li>{@code sensor_update_distance}: {@code global_metrics.{subject}}, by default
 *       {@code tugboat_cargo_distance}</li>
 *   <li>{@code emergency_stop}: speed 0 for the subject agent, or for every agent</li>
 * </ul>
 */
public class InputTranslator {

    public static final String SET_FIELD = "set_field";
    public static final String ADJUST_SPEED = "adjust_speed";
    public static final String CHANGE_ANGLE = "change_angle";
    public static final String ACTIVATE_DOCKING_MODE = "activate_docking_mode";
    public static final String SENSOR_UPDATE_DISTANCE = "sensor_update_distance";
    public static final String EMERGENCY_STOP = "emergency_stop";

    static final String DEFAULT_DISTANCE_METRIC = "tugboat_cargo_distance";

    private final Map<String, IInputHandler> handlers = new LinkedHashMap<>();

    /**
     * Creates a translator with the built-in handlers.
     */
    public InputTranslator() {
        register(handler(SET_FIELD, (command, state) ->
                List.of(new PathWrite(requireSubject(command), command.value()))));
        register(handler(ADJUST_SPEED, (command, state) ->
                List.of(new PathWrite("agents." + requireSubject(command) + ".speed", requireNumber(command)))));
        register(handler(CHANGE_ANGLE, (command, state) ->
                List.of(new PathWrite("agents." + requireSubject(command) + ".heading", requireNumber(command)))));
        register(handler(ACTIVATE_DOCKING_MODE, (command, state) ->
                List.of(new PathWrite("environment.docking_mode", Value.bool(true)))));
        register(handler(SENSOR_UPDATE_DISTANCE, (command, state) -> {
            String metric = command.subject() == null ? DEFAULT_DISTANCE_METRIC : command.subject();
            return List.of(new PathWrite("global_metrics." + metric, requireNumber(command)));
        }));
        register(handler(EMERGENCY_STOP, (command, state) -> {
            List<PathWrite> writes = new ArrayList<>();
            if (command.subject() != null) {
                writes.add(new PathWrite("agents." + command.subject() + ".speed", Value.number(0)));
            } else {
                for (String agentId : state.agentIds()) {
                    writes.add(new PathWrite("agents." + agentId + ".speed", Value.number(0)));
                }
            }
            return writes;
        }));
    }

    /**
     * Registers a handler, replacing any handler of the same type.
     */
    public void register(IInputHandler handler) {
        handlers.put(handler.type(), handler);
    }

    public Set<String> types() {
        return handlers.keySet();
    }

    /**
     * @param command The input.
     * @param state The state the writes will be applied to.
     * @return the writes the input translates to.
     * @throws IllegalArgumentException if the type is unknown or the input is malformed.
     */
    public List<PathWrite> translate(InputCommand command, IStateReader state) {
        IInputHandler handler = handlers.get(command.type());
        if (handler == null) {
            throw new IllegalArgumentException("Unknown input type: " + command.type());
        }
        return handler.translate(command, state);
    }

    private static String requireSubject(InputCommand command) {
        if (command.subject() == null || command.subject().isBlank()) {
            throw new IllegalArgumentException("Input '" + command.type() + "' requires a subject");
        }
        return command.subject();
    }

    private static Value requireNumber(InputCommand command) {
        if (!(command.value() instanceof Value.NumberValue)) {
            throw new IllegalArgumentException("Input '" + command.type() + "' requires a numeric value, got "
                    + command.value().typeName());
        }
        return command.value();
    }

    private interface Translation {
        List<PathWrite> apply(InputCommand command, IStateReader state);
    }

    private static IInputHandler handler(String type, Translation translation) {
        return new IInputHandler() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public List<PathWrite> translate(InputCommand command, IStateReader state) {
                return translation.apply(command, state);
            }
        };
    }
}
