package me.golemcore.deck.domain.model;

/**
 * Classifies tool failures so the loop and the model can tell them apart.
 */
public enum ToolFailureKind {
    /** Tool name is not part of the active catalog. */
    POLICY_DENIED,
    /** Required input is missing or has the wrong type. */
    INVALID_INPUT,
    /** Handler ran and failed. */
    EXECUTION_FAILED
}
