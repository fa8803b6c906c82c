package me.golemcore.deck.domain.system.toolloop;

import me.golemcore.deck.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, HistoryWriter historyWriter) {
        return new DefaultToolLoopSystem(llmPort, historyWriter);
    }
}
