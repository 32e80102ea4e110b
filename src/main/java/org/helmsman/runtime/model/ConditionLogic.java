package org.helmsman.runtime.model;

/**
 * How the conditions of a rule are combined.
 */
public enum ConditionLogic {
    AND,
    OR
}
