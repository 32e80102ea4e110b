package org.helmsman.runtime.input;

import org.helmsman.runtime.model.Value;

/**
 * A direct state write produced by translating an input.
 *
 * @param path The target path.
 * @param value The value to write.
 */
public record PathWrite(String path, Value value) {
}
