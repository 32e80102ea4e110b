package org.helmsman.runtime.input;

import java.util.List;

/**
 * How an input was applied.
 *
 * @param command The input.
 * @param paths The paths it wrote.
 * @param applied False if it was rejected; its writes are then rolled back.
 * @param message Description of the outcome.
 */
public record InputRecord(InputCommand command, List<String> paths, boolean applied, String message) {

    public InputRecord {
        paths = List.copyOf(paths);
    }
}
