package com.openforge.physiomate.research;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.agent.dispatch.ToolDispatcher;
import com.openforge.physiomate.agent.tool.Substep;
import com.openforge.physiomate.agent.tool.ToolRegistry;
import com.openforge.physiomate.agent.tool.ToolSpec;
import com.openforge.physiomate.config.AgentLoopProperties;
import com.openforge.physiomate.config.AppConfig;
import com.openforge.physiomate.llm.ChatModel;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.ChatResponse;
import com.openforge.physiomate.llm.model.Message;
import com.openforge.physiomate.llm.model.ToolCall;
import com.openforge.physiomate.llm.model.ToolFunction;
import com.openforge.physiomate.prompt.PromptTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResearchAgentTest {

    private final ObjectMapper mapper = new AppConfig().objectMapper();
    private final List<Substep> substeps = new CopyOnWriteArrayList<>();

    private ExecutorService toolExecutor;
    private ExecutorService subAgentExecutor;
    private ChatModel chatModel;
    private ResearchAgent agent;

    @BeforeEach
    void setUp() {
        toolExecutor     = Executors.newFixedThreadPool(2);
        subAgentExecutor = Executors.newCachedThreadPool();
        chatModel        = mock(ChatModel.class);

        ToolRegistry tools = ToolRegistry.builder()
                .register(ToolSpec.internal(fn("search_by_condition"), "Searching by condition",
                        inv -> "[1] (score: 0.812, source: rotator_cuff.pdf)\nRotator cuff tendinopathy...\n"))
                .build();
        ToolDispatcher dispatcher = new ToolDispatcher(mapper, toolExecutor, subAgentExecutor,
                AgentLoopProperties.defaults());
        agent = new ResearchAgent(chatModel, tools, dispatcher,
                new PromptTemplates("coordinator prompt", "research prompt"),
                new ResearchProperties(3, 5), AgentLoopProperties.defaults());
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
        subAgentExecutor.shutdownNow();
    }

    private ToolFunction fn(String name) {
        return new ToolFunction(name, name, mapper.createObjectNode().put("type", "object"));
    }

    private static ChatResponse reply(Message message) {
        return new ChatResponse("r", "chat.completion", 0L, "test-model",
                List.of(new ChatResponse.Choice(0, message, "stop")), null);
    }

    private static ChatResponse toolReply(String id, String name, String args) {
        return reply(Message.assistantToolCalls(null, List.of(ToolCall.function(id, name, args))));
    }

    @Test
    void searchesThenSummarizesAndReportsSubsteps() {
        when(chatModel.chat(any()))
                .thenReturn(toolReply("c1", "search_by_condition", "{\"condition\":\"rotator cuff\"}"))
                .thenReturn(reply(Message.assistantText("Evidence supports progressive loading.")));

        String answer = agent.research("shoulder pain overhead", "rehab", substeps::add);

        assertEquals("Evidence supports progressive loading.", answer);
        assertEquals(2, substeps.size());
        assertFalse(substeps.get(0).complete());
        assertTrue(substeps.get(1).complete());
        assertEquals(substeps.get(0).id(), substeps.get(1).id());
        assertEquals("search_by_condition", substeps.get(0).toolName());
        assertEquals("Searching by condition", substeps.get(0).label());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel, times(2)).chat(captor.capture());
        List<Message> first = captor.getAllValues().get(0).messages();
        assertEquals("research prompt", first.get(0).content());
        assertEquals("shoulder pain overhead\n\nFocus: rehab", first.get(1).content());
        List<Message> second = captor.getAllValues().get(1).messages();
        assertEquals(4, second.size());
        assertEquals("c1", second.get(3).toolCallId());
        assertTrue(second.get(3).content().contains("rotator_cuff.pdf"));
    }

    @Test
    void unknownNestedToolIsReportedWithoutSubsteps() {
        when(chatModel.chat(any()))
                .thenReturn(toolReply("c1", "delete_everything", "{}"))
                .thenReturn(reply(Message.assistantText("Nothing found.")));

        String answer = agent.research("knee", null, substeps::add);

        assertEquals("Nothing found.", answer);
        assertTrue(substeps.isEmpty());
    }

    @Test
    void stepBudgetExhaustionReturnsMarker() {
        when(chatModel.chat(any())).thenReturn(toolReply("", "search_by_condition", "{}"));

        String answer = agent.research("hip", "", substeps::add);

        assertEquals(ResearchAgent.STEP_LIMIT_TEXT, answer);
        verify(chatModel, times(3)).chat(any());
        assertEquals(6, substeps.size());
    }

    @Test
    void stepBudgetExhaustionKeepsLastText() {
        when(chatModel.chat(any())).thenReturn(reply(
                Message.assistantToolCalls("Partial: eccentric loading helps.",
                        List.of(ToolCall.function("c", "search_by_condition", "{}")))));

        assertEquals("Partial: eccentric loading helps.", agent.research("achilles", null, substeps::add));
    }

    @Test
    void emptyAnswerBecomesNoFindings() {
        when(chatModel.chat(any())).thenReturn(reply(Message.assistantText("  ")));

        assertEquals("No findings.", agent.research("wrist", null, substeps::add));
    }
}
