package me.golemcore.deck.domain.model;

import java.util.List;

/**
 * A user message for one chat turn, with optional reference images.
 */
public record ChatRequest(String text, List<ImageAttachment> images) {

    public ChatRequest {
        images = images != null ? List.copyOf(images) : List.of();
    }

    public static ChatRequest text(String text) {
        return new ChatRequest(text, List.of());
    }
}
