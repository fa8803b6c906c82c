package me.golemcore.deck.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed catalog of tool names the model may call. Anything outside this enum
 * is answered as an unknown tool.
 */
public enum ToolName {

    CREATE_FOLDER("create_folder", ToolScope.GENERATION),
    CREATE_FILE("create_file", ToolScope.GENERATION),
    READ_FILE("read_file", ToolScope.GENERATION),
    UPDATE_FILE("update_file", ToolScope.GENERATION),
    LIST_FILES("list_files", ToolScope.GENERATION),
    RETURN_PRESENTATION_RESULT("return_presentation_result", ToolScope.GENERATION),
    GENERATE_PRESENTATION("generate_presentation", ToolScope.CONVERSATION);

    private final String wireName;
    private final ToolScope scope;

    ToolName(String wireName, ToolScope scope) {
        this.wireName = wireName;
        this.scope = scope;
    }

    public String wireName() {
        return wireName;
    }

    public ToolScope scope() {
        return scope;
    }

    public static Optional<ToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(tool -> tool.wireName.equals(name))
                .findFirst();
    }

    /**
     * Which loop a tool belongs to.
     */
    public enum ToolScope {
        CONVERSATION, GENERATION
    }
}
