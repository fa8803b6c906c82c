package me.golemcore.deck.domain.model;

import java.util.List;

/**
 * Artifacts produced by the export pipeline. An empty result means no
 * presentation was written.
 */
public record ExportResult(String presentationFile, List<String> screenshots) {

    public ExportResult {
        screenshots = screenshots != null ? List.copyOf(screenshots) : List.of();
    }

    public static ExportResult empty() {
        return new ExportResult(null, List.of());
    }

    public boolean hasPresentation() {
        return presentationFile != null;
    }
}
