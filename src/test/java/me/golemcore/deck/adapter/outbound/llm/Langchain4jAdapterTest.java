package me.golemcore.deck.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.deck.domain.model.ContentPart;
import me.golemcore.deck.domain.model.LlmRequest;
import me.golemcore.deck.domain.model.LlmResponse;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ToolDefinition;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String MODEL = "claude-sonnet-4-5";
    private static final String RETURN_RESULT = "return_presentation_result";

    private ChatModel chatModel;
    private DeckProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        properties = new DeckProperties();
        adapter = new Langchain4jAdapter(properties, new ObjectMapper(), chatModel);
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello"))
                .finishReason(FinishReason.STOP)
                .build());
    }

    private static ToolDefinition returnResultDefinition() {
        return ToolDefinition.builder()
                .name(RETURN_RESULT)
                .description("Return the final result")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "success", Map.of("type", "boolean"),
                                "slide_count", Map.of("type", "integer"),
                                "slide_files", Map.of("type", "array", "items", Map.of("type", "string"))),
                        "required", List.of("success", "slide_count", "slide_files")))
                .build();
    }

    private ChatRequest capturedRequest() {
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        return captor.getValue();
    }

    private static LlmRequest.LlmRequestBuilder baseRequest(List<Message> messages) {
        return LlmRequest.builder()
                .model(MODEL)
                .systemPrompt("You are a presentation assistant")
                .messages(messages)
                .maxTokens(4000);
    }

    // ==================== Request options ====================

    @Test
    void shouldForceToolUseWhenRequired() {
        adapter.chat(baseRequest(List.of(Message.builder().role(Message.ROLE_USER).content("go").build()))
                .tools(List.of(returnResultDefinition()))
                .toolUseRequired(true)
                .build()).join();

        ChatRequest request = capturedRequest();
        assertEquals(ToolChoice.REQUIRED, request.toolChoice());
        assertEquals(MODEL, request.modelName());
        assertEquals(4000, request.maxOutputTokens());
        assertEquals(1, request.toolSpecifications().size());
    }

    @Test
    void shouldLeaveToolChoiceOpenInConversation() {
        adapter.chat(baseRequest(List.of(Message.builder().role(Message.ROLE_USER).content("hi").build()))
                .tools(List.of(returnResultDefinition()))
                .build()).join();

        assertNull(capturedRequest().toolChoice());
    }

    @Test
    void shouldConvertToolSchemaTypes() {
        adapter.chat(baseRequest(List.of(Message.builder().role(Message.ROLE_USER).content("go").build()))
                .tools(List.of(returnResultDefinition()))
                .build()).join();

        ToolSpecification spec = capturedRequest().toolSpecifications().get(0);
        assertEquals(RETURN_RESULT, spec.name());
        assertInstanceOf(JsonBooleanSchema.class, spec.parameters().properties().get("success"));
        assertInstanceOf(JsonIntegerSchema.class, spec.parameters().properties().get("slide_count"));
        assertInstanceOf(JsonArraySchema.class, spec.parameters().properties().get("slide_files"));
        assertEquals(List.of("success", "slide_count", "slide_files"), spec.parameters().required());
    }

    // ==================== Message conversion ====================

    @Test
    void shouldConvertTranscriptWithToolTurnsAndImages() {
        List<Message> transcript = new ArrayList<>();
        transcript.add(Message.builder()
                .role(Message.ROLE_USER)
                .content("use this logo")
                .parts(List.of(ContentPart.image("image/png", "iVBORw0KGgo="), ContentPart.text("use this logo")))
                .build());
        transcript.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(
                        Message.ToolCall.builder().id("c1").name("create_file")
                                .arguments(Map.of("file_path", "slides/slide_1.html", "content", "x")).build(),
                        Message.ToolCall.builder().id("c2").name("list_files").arguments(Map.of()).build()))
                .build());
        transcript.add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolResults(List.of(
                        Message.ToolResultEntry.builder().toolCallId("c1").toolName("create_file")
                                .content("Successfully created file").build(),
                        Message.ToolResultEntry.builder().toolCallId("c2").toolName("list_files")
                                .content("Error: boom").error(true).build()))
                .build());
        transcript.add(Message.builder().role(Message.ROLE_ASSISTANT).content("").build());

        adapter.chat(baseRequest(transcript).build()).join();

        List<ChatMessage> messages = capturedRequest().messages();
        assertEquals(6, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));

        UserMessage user = (UserMessage) messages.get(1);
        assertInstanceOf(ImageContent.class, user.contents().get(0));
        assertInstanceOf(TextContent.class, user.contents().get(1));

        AiMessage assistant = (AiMessage) messages.get(2);
        assertEquals(2, assistant.toolExecutionRequests().size());
        assertEquals("c1", assistant.toolExecutionRequests().get(0).id());

        ToolExecutionResultMessage first = (ToolExecutionResultMessage) messages.get(3);
        ToolExecutionResultMessage second = (ToolExecutionResultMessage) messages.get(4);
        assertEquals("c1", first.id());
        assertEquals("c2", second.id());
        assertEquals("Error: boom", second.text());

        assertEquals("(no text)", ((AiMessage) messages.get(5)).text());
    }

    // ==================== Response conversion ====================

    @Test
    void shouldParseToolCallsFromResponse() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("toolu_1")
                        .name("create_file")
                        .arguments("{\"file_path\":\"slides/slide_1.html\",\"content\":\"<html/>\"}")
                        .build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());

        LlmResponse response = adapter.chat(baseRequest(List.of(
                Message.builder().role(Message.ROLE_USER).content("go").build())).build()).join();

        assertTrue(response.hasToolCalls());
        Message.ToolCall call = response.getToolCalls().get(0);
        assertEquals("toolu_1", call.getId());
        assertEquals("slides/slide_1.html", call.getArguments().get("file_path"));
        assertEquals("TOOL_EXECUTION", response.getFinishReason());
    }

    @Test
    void shouldReturnTextResponse() {
        LlmResponse response = adapter.chat(baseRequest(List.of(
                Message.builder().role(Message.ROLE_USER).content("hi").build())).build()).join();

        assertEquals("Hello", response.getContent());
        assertFalse(response.hasToolCalls());
        assertEquals(MODEL, response.getModel());
    }

    @Test
    void shouldWrapProviderFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("overloaded"));

        CompletionException error = assertThrows(CompletionException.class, () -> adapter.chat(
                baseRequest(List.of(Message.builder().role(Message.ROLE_USER).content("hi").build())).build())
                .join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("LLM chat failed: overloaded", error.getCause().getMessage());
    }

    // ==================== Availability ====================

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        Langchain4jAdapter unconfigured = new Langchain4jAdapter(new DeckProperties(), new ObjectMapper());

        assertFalse(unconfigured.isAvailable());
        assertThrows(CompletionException.class, () -> unconfigured.chat(
                baseRequest(List.of(Message.builder().role(Message.ROLE_USER).content("hi").build())).build())
                .join());
    }

    @Test
    void shouldReportConfiguredProvider() {
        assertEquals("anthropic", adapter.getProviderId());
        assertTrue(adapter.isAvailable());
    }
}
