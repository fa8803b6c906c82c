package me.golemcore.deck.domain.model;

/**
 * A reference image supplied with a user message, already base64 encoded.
 */
public record ImageAttachment(String name, String mimeType, String base64Data) {
}
