package org.helmsman.runtime.errors;

/**
 * Classifies the failures the engine can record on an explanation.
 */
public enum ErrorKind {
    UNKNOWN_PATH,
    UNKNOWN_AGENT,
    TYPE_MISMATCH,
    INVALID_ACTION,
    READ_ONLY_PATH,
    UNMERGEABLE_CONFLICT,
    RULE_CHAIN_OVERFLOW
}
