package me.golemcore.deck.domain.model;

/**
 * Receives progress events from the loop and the export pipeline. Called on
 * the thread doing the work.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = event -> {
    };

    void onEvent(ProgressEvent event);
}
