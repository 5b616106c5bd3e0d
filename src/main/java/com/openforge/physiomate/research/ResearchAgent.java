package com.openforge.physiomate.research;

import com.openforge.physiomate.agent.AgentInvocation;
import com.openforge.physiomate.agent.dispatch.ToolDispatcher;
import com.openforge.physiomate.agent.event.EventEmitter;
import com.openforge.physiomate.agent.event.EventType;
import com.openforge.physiomate.agent.stream.ToolCallRequest;
import com.openforge.physiomate.agent.tool.Substep;
import com.openforge.physiomate.agent.tool.SubstepListener;
import com.openforge.physiomate.agent.tool.ToolRegistry;
import com.openforge.physiomate.config.AgentLoopProperties;
import com.openforge.physiomate.llm.ChatModel;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.ChatResponse;
import com.openforge.physiomate.llm.model.Message;
import com.openforge.physiomate.llm.model.ToolCall;
import com.openforge.physiomate.prompt.PromptTemplates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Research sub-agent behind the coordinator's "research" tool.
 *
 * Runs its own non-streaming tool loop over the knowledge-base tools and
 * returns the synthesized answer. Each nested tool execution is reported to
 * the caller as a substep pair; nothing else leaves this class until the
 * final text.
 *
 * Loop shape:
 *   for step in 1..maxSteps:
 *     chat(history, research tools)
 *     no tool calls → return text
 *     otherwise     → dispatch each call, append results, continue
 */
@Slf4j
@Component
@EnableConfigurationProperties(ResearchProperties.class)
public class ResearchAgent {

    static final String STEP_LIMIT_TEXT = "Research incomplete: step limit reached.";

    private final ChatModel           chatModel;
    private final ToolRegistry        tools;
    private final ToolDispatcher      dispatcher;
    private final PromptTemplates     prompts;
    private final ResearchProperties  properties;
    private final AgentLoopProperties loopProperties;
    private final AtomicLong          runCounter = new AtomicLong();

    public ResearchAgent(ChatModel chatModel,
                         @Qualifier("researchToolRegistry") ToolRegistry tools,
                         ToolDispatcher dispatcher,
                         PromptTemplates prompts,
                         ResearchProperties properties,
                         AgentLoopProperties loopProperties) {
        this.chatModel      = chatModel;
        this.tools          = tools;
        this.dispatcher     = dispatcher;
        this.prompts        = prompts;
        this.properties     = properties;
        this.loopProperties = loopProperties;
    }

    /**
     * @param query    the clinical question
     * @param focus    optional area to concentrate on; blank for none
     * @param substeps receives started/completed notifications for every nested tool
     */
    public String research(String query, String focus, SubstepListener substeps) {
        String runId = "research-" + runCounter.incrementAndGet();
        String userText = focus == null || focus.isBlank() ? query : query + "\n\nFocus: " + focus.strip();

        AgentInvocation invocation = new AgentInvocation(runId,
                List.of(Message.system(prompts.research()), Message.user(userText)),
                substepBridge(substeps));

        log.info("[Research:{}] Started. query='{}' focus='{}'", runId, query, focus);
        String lastText = "";

        for (int step = 1; step <= properties.maxSteps(); step++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("Research cancelled");
            }
            ChatRequest request = ChatRequest.withTools(null, invocation.history(), tools.declarations(),
                    loopProperties.maxTokens());
            ChatResponse response = chatModel.chat(request);
            Message reply = response.firstMessage();

            if (reply.content() != null && !reply.content().isBlank()) {
                lastText = reply.content();
            }
            if (!reply.hasToolCalls()) {
                log.info("[Research:{}] Finished in {} step(s).", runId, step);
                return lastText.isBlank() ? "No findings." : lastText;
            }

            List<ToolCallRequest> calls = toRequests(reply.toolCalls(), step);
            invocation.append(Message.assistantToolCalls(reply.content(),
                    calls.stream().map(ToolCallRequest::toToolCall).toList()));
            log.debug("[Research:{}] Step {} requested {} tool call(s)", runId, step, calls.size());
            for (ToolCallRequest call : calls) {
                dispatcher.dispatch(call, tools, invocation);
            }
        }

        log.warn("[Research:{}] Step limit ({}) reached.", runId, properties.maxSteps());
        return lastText.isBlank() ? STEP_LIMIT_TEXT : lastText;
    }

    /** Ids missing from the response become {@code research_<step>_<index>}. */
    private static List<ToolCallRequest> toRequests(List<ToolCall> toolCalls, int step) {
        List<ToolCallRequest> calls = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall tc = toolCalls.get(i);
            String id = tc.id() == null || tc.id().isEmpty() ? "research_%d_%d".formatted(step, i) : tc.id();
            String name = tc.function() == null || tc.function().name() == null ? "" : tc.function().name();
            String args = tc.function() == null ? "" : tc.function().arguments();
            calls.add(new ToolCallRequest(i, id, name, args, false));
        }
        return calls;
    }

    /**
     * Turns the dispatcher's step events into substep notifications; every
     * other event of the nested run stays private.
     */
    private static EventEmitter substepBridge(SubstepListener substeps) {
        return event -> {
            if (event.type() == EventType.STEP) {
                substeps.onSubstep(Substep.started(event.id(), event.tool(), event.label()));
            } else if (event.type() == EventType.STEP_COMPLETE) {
                substeps.onSubstep(Substep.completed(event.id(), event.tool(), event.label()));
            }
        };
    }
}
