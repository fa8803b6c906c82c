package me.golemcore.deck.domain.system.toolloop;

import lombok.Builder;
import lombok.Data;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.domain.service.ToolRegistry;

import java.util.List;

/**
 * Input of one loop run. The transcript is appended to in place and belongs to
 * this run until it returns.
 */
@Data
@Builder
public class ToolLoopRequest {

    private String systemPrompt;
    private List<Message> transcript;
    private ToolRegistry tools;
    private LoopMode mode;
    private int maxIterations;
    private String model;
    private Integer maxTokens;

    @Builder.Default
    private ProgressListener listener = ProgressListener.NOOP;
}
