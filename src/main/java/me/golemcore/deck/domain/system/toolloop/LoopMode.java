package me.golemcore.deck.domain.system.toolloop;

/**
 * How a loop treats a model response without tool calls.
 */
public enum LoopMode {
    /** Free text is the answer to the user. */
    CONVERSATION,
    /** Tool use is required; free text is an anomaly and ends the session as failed. */
    GENERATION
}
