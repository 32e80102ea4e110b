package org.helmsman.runtime.actions;

import org.helmsman.runtime.model.Value;

/**
 * A value a rule suggests for a path without writing it.
 *
 * @param tick The tick.
 * @param ruleId The recommending rule.
 * @param target The path the recommendation is about.
 * @param value The recommended value.
 */
public record Recommendation(long tick, String ruleId, String target, Value value) {
}
