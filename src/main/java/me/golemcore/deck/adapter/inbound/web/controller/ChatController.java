package me.golemcore.deck.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.adapter.inbound.web.dto.ChatMessageRequest;
import me.golemcore.deck.adapter.inbound.web.dto.ChatMessageResponse;
import me.golemcore.deck.adapter.inbound.web.dto.ImageAttachmentDto;
import me.golemcore.deck.adapter.inbound.web.dto.ResetRequest;
import me.golemcore.deck.domain.model.ChatReply;
import me.golemcore.deck.domain.model.ChatRequest;
import me.golemcore.deck.domain.model.ImageAttachment;
import me.golemcore.deck.domain.model.ProgressEvent;
import me.golemcore.deck.domain.model.ProgressEventType;
import me.golemcore.deck.domain.service.ChatSessionService;
import me.golemcore.deck.domain.service.ProgressRelayService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat endpoints: blocking and streamed turns, presentation download, reset.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String SESSION_HEADER = "X-Session-Id";
    private static final MediaType PPTX_MEDIA_TYPE = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.presentationml.presentation");

    private final ChatSessionService chatSessionService;
    private final ProgressRelayService progressRelayService;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatMessageResponse>> chat(@RequestBody ChatMessageRequest request) {
        ChatRequest chatRequest = toChatRequest(request);
        String sessionId = resolveSessionId(request.getSessionId());

        return Mono.fromCallable(() -> chatSessionService.chat(sessionId, chatRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .map(reply -> ResponseEntity.ok(toResponse(sessionId, reply)));
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>> chatStream(
            @RequestBody ChatMessageRequest request) {
        ChatRequest chatRequest = toChatRequest(request);
        String sessionId = resolveSessionId(request.getSessionId());

        Flux<ServerSentEvent<Map<String, Object>>> events = progressRelayService
                .runStreamed(sessionId, chatRequest)
                .map(ChatController::toServerSentEvent);
        return ResponseEntity.ok()
                .header(SESSION_HEADER, sessionId)
                .body(events);
    }

    @GetMapping("/download")
    public Mono<ResponseEntity<Resource>> download(@RequestParam String sessionId) {
        Path file = chatSessionService.latestPresentation(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No presentation available"));

        return Mono.just(ResponseEntity.ok()
                .contentType(PPTX_MEDIA_TYPE)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(file.getFileName().toString())
                        .build()
                        .toString())
                .body(new FileSystemResource(file)));
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<Map<String, Object>>> reset(@RequestBody ResetRequest request) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "sessionId is required");
        }
        chatSessionService.reset(request.getSessionId());
        return Mono.just(ResponseEntity.ok(Map.of("success", true)));
    }

    private static ChatRequest toChatRequest(ChatMessageRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        List<ImageAttachment> images = new ArrayList<>();
        if (request.getImages() != null) {
            for (ImageAttachmentDto image : request.getImages()) {
                images.add(new ImageAttachment(image.getName(), image.getMimeType(), image.getData()));
            }
        }
        return new ChatRequest(request.getMessage(), images);
    }

    private static String resolveSessionId(String sessionId) {
        return sessionId != null && !sessionId.isBlank() ? sessionId : ChatSessionService.newSessionId();
    }

    private static ChatMessageResponse toResponse(String sessionId, ChatReply reply) {
        String fileName = reply.getPresentationFile() != null
                ? Path.of(reply.getPresentationFile()).getFileName().toString()
                : null;
        return ChatMessageResponse.builder()
                .sessionId(sessionId)
                .response(reply.getText())
                .success(reply.isSuccess())
                .hasPresentation(fileName != null)
                .presentationFileName(fileName)
                .build();
    }

    static ServerSentEvent<Map<String, Object>> toServerSentEvent(ProgressEvent event) {
        if (event.type() == ProgressEventType.KEEPALIVE) {
            return ServerSentEvent.<Map<String, Object>>builder()
                    .comment("keepalive")
                    .build();
        }
        String kind = event.type().wireName();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", kind);
        data.put("data", event.payload());
        return ServerSentEvent.<Map<String, Object>>builder()
                .event(kind)
                .data(data)
                .build();
    }
}
