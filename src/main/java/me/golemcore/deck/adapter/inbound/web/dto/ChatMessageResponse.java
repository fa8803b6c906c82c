package me.golemcore.deck.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {
    private String sessionId;
    private String response;
    private boolean success;
    private boolean hasPresentation;
    private String presentationFileName;
}
