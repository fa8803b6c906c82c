package me.golemcore.deck.domain.model;

/**
 * Kinds of progress events relayed to a streaming client.
 */
public enum ProgressEventType {

    TOOL_DISPATCHED("tool_dispatched"),
    RASTERIZATION_PROGRESS("rasterization_progress"),
    ASSEMBLY_PROGRESS("assembly_progress"),
    COMPLETED("complete"),
    FAILED("error"),
    KEEPALIVE("keepalive");

    private final String wireName;

    ProgressEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
