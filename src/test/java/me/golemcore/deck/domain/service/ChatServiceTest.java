package me.golemcore.deck.domain.service;

import me.golemcore.deck.domain.loop.ChatTurnContextHolder;
import me.golemcore.deck.domain.model.ChatReply;
import me.golemcore.deck.domain.model.ChatRequest;
import me.golemcore.deck.domain.model.ChatSession;
import me.golemcore.deck.domain.model.ChatTurnContext;
import me.golemcore.deck.domain.model.ContentPart;
import me.golemcore.deck.domain.model.GenerationResult;
import me.golemcore.deck.domain.model.ImageAttachment;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.domain.system.toolloop.LoopMode;
import me.golemcore.deck.domain.system.toolloop.ToolLoopRequest;
import me.golemcore.deck.domain.system.toolloop.ToolLoopResult;
import me.golemcore.deck.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String PNG_BASE64 = "iVBORw0KGgo=";

    private ToolLoopSystem toolLoopSystem;
    private ToolRegistry tools;
    private DeckProperties properties;
    private ChatService service;
    private ChatSession session;

    @BeforeEach
    void setUp() {
        toolLoopSystem = mock(ToolLoopSystem.class);
        tools = new ToolRegistry(List.of());
        properties = new DeckProperties();
        service = new ChatService(toolLoopSystem, tools, new PromptCatalog(), properties,
                Clock.fixed(NOW, ZoneId.of("UTC")));
        session = ChatSession.create("sess-1", Instant.parse("2026-02-13T00:00:00Z"));
    }

    private ToolLoopRequest capturedRequest() {
        ArgumentCaptor<ToolLoopRequest> captor = ArgumentCaptor.forClass(ToolLoopRequest.class);
        verify(toolLoopSystem).run(captor.capture());
        return captor.getValue();
    }

    // ==================== Loop wiring ====================

    @Test
    void shouldRunConversationLoopOverSessionTranscript() {
        when(toolLoopSystem.run(any())).thenReturn(ToolLoopResult.answered("What is the topic?", 1));

        ChatReply reply = service.sendMessage(session, ChatRequest.text("I need a deck"), ProgressListener.NOOP);

        assertTrue(reply.isSuccess());
        assertEquals("What is the topic?", reply.getText());
        ToolLoopRequest request = capturedRequest();
        assertEquals(LoopMode.CONVERSATION, request.getMode());
        assertEquals(10, request.getMaxIterations());
        assertEquals(properties.getLlm().getChatModel(), request.getModel());
        assertEquals(16000, request.getMaxTokens());
        assertSame(session.getMessages(), request.getTranscript());
        assertSame(tools, request.getTools());
        assertEquals(NOW, session.getUpdatedAt());
    }

    @Test
    void shouldAppendPlainUserMessageWithoutImages() {
        when(toolLoopSystem.run(any())).thenReturn(ToolLoopResult.answered("ok", 1));

        service.sendMessage(session, ChatRequest.text("hello"), ProgressListener.NOOP);

        Message user = session.getMessages().get(0);
        assertTrue(user.isUserMessage());
        assertEquals("hello", user.getContent());
        assertFalse(user.hasParts());
    }

    @Test
    void shouldPlaceImagesBeforeTextAndSkipUnsupportedOnes() {
        when(toolLoopSystem.run(any())).thenReturn(ToolLoopResult.answered("ok", 1));
        ChatRequest request = new ChatRequest("use this logo", List.of(
                new ImageAttachment("logo.png", null, PNG_BASE64),
                new ImageAttachment("notes.pdf", "application/pdf", "JVBERi0="),
                new ImageAttachment("brand.webp", "IMAGE/WEBP", "UklGRg=="),
                new ImageAttachment("empty.png", "image/png", "")));

        service.sendMessage(session, request, ProgressListener.NOOP);

        List<ContentPart> parts = session.getMessages().get(0).getParts();
        assertEquals(3, parts.size());
        assertEquals(ContentPart.image("image/png", PNG_BASE64), parts.get(0));
        assertEquals("image/webp", parts.get(1).mimeType());
        assertEquals(ContentPart.text("use this logo"), parts.get(2));
    }

    @Test
    void shouldExposeTurnContextDuringLoopAndClearItAfterwards() {
        ProgressListener listener = event -> {
        };
        when(toolLoopSystem.run(any())).thenAnswer(invocation -> {
            ChatTurnContext context = ChatTurnContextHolder.get();
            assertSame(listener, context.getListener());
            context.setPresentationFile("/work/exports/Deck.pptx");
            return ToolLoopResult.answered("Your deck is ready", 2);
        });

        ChatReply reply = service.sendMessage(session, ChatRequest.text("go"), listener);

        assertEquals("/work/exports/Deck.pptx", reply.getPresentationFile());
        assertEquals("/work/exports/Deck.pptx", session.getLatestPresentation());
        assertNull(ChatTurnContextHolder.get());
    }

    // ==================== Outcomes ====================

    @Test
    void shouldReturnFixedAnswerWhenBudgetIsExhausted() {
        when(toolLoopSystem.run(any())).thenReturn(ToolLoopResult.budgetExceeded(LoopMode.CONVERSATION, 10));

        ChatReply reply = service.sendMessage(session, ChatRequest.text("go"), ProgressListener.NOOP);

        assertFalse(reply.isSuccess());
        assertEquals(ToolLoopResult.BUDGET_EXCEEDED_ANSWER, reply.getText());
    }

    @Test
    void shouldPrefixErrorWhenLoopFails() {
        when(toolLoopSystem.run(any())).thenReturn(ToolLoopResult.failed(LoopMode.CONVERSATION, "LLM down", 1));

        ChatReply reply = service.sendMessage(session, ChatRequest.text("go"), ProgressListener.NOOP);

        assertFalse(reply.isSuccess());
        assertEquals("Error: LLM down", reply.getText());
    }

    @Test
    void shouldUseGenerationMessageWhenLoopCompletes() {
        when(toolLoopSystem.run(any())).thenReturn(ToolLoopResult.completed(
                GenerationResult.builder().success(true).message("Created 5 slides").build(), 1));

        ChatReply reply = service.sendMessage(session, ChatRequest.text("go"), ProgressListener.NOOP);

        assertTrue(reply.isSuccess());
        assertEquals("Created 5 slides", reply.getText());
    }

    @Test
    void shouldNeverThrowWhenLoopThrows() {
        when(toolLoopSystem.run(any())).thenThrow(new IllegalStateException("unexpected"));

        ChatReply reply = service.sendMessage(session, ChatRequest.text("go"), ProgressListener.NOOP);

        assertFalse(reply.isSuccess());
        assertEquals("Error: unexpected", reply.getText());
        assertNull(ChatTurnContextHolder.get());
    }

    // ==================== Image types ====================

    @Test
    void shouldResolveMimeTypeFromDeclaredTypeOrExtension() {
        assertEquals("image/jpeg", ChatService.resolveMimeType(new ImageAttachment("a.JPG", null, "x")));
        assertEquals("image/gif", ChatService.resolveMimeType(new ImageAttachment("a", "image/gif", "x")));
        assertEquals("image/png",
                ChatService.resolveMimeType(new ImageAttachment("a.png", "application/octet-stream", "x")));
        assertNull(ChatService.resolveMimeType(new ImageAttachment("a.bmp", "image/bmp", "x")));
        assertNull(ChatService.resolveMimeType(new ImageAttachment(null, null, "x")));
    }
}
