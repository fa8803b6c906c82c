package me.golemcore.deck.domain.system.toolloop;

/**
 * Runs the bounded query-model, dispatch-tools, append, repeat cycle over one
 * transcript.
 */
public interface ToolLoopSystem {

    /**
     * Never throws: every failure is reported through the returned status.
     */
    ToolLoopResult run(ToolLoopRequest request);
}
