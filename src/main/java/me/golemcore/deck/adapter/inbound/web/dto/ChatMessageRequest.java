package me.golemcore.deck.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageRequest {
    private String sessionId;
    private String message;
    @Builder.Default
    private List<ImageAttachmentDto> images = new ArrayList<>();
}
