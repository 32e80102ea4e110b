package org.helmsman.runtime.input;

import java.util.List;

import org.helmsman.runtime.path.IStateReader;

/**
 * Translates one named input type into direct state writes.
 * <p>
 * Handlers are registered with an {@link InputTranslator}. They must not mutate state themselves;
 * the engine applies the returned writes at the start of the next tick.
 */
public interface IInputHandler {

    /**
     * @return the input type this handler accepts, e.g. {@code adjust_speed}.
     */
    String type();

    /**
     * @param command The input.
     * @param state The state the writes will be applied to.
     * @return the writes, in application order.
     * @throws IllegalArgumentException if the input is malformed.
     */
    List<PathWrite> translate(InputCommand command, IStateReader state);
}
