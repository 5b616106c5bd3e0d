package com.openforge.physiomate.agent;

import com.openforge.physiomate.agent.dispatch.ToolDispatcher;
import com.openforge.physiomate.agent.event.AgentEvent;
import com.openforge.physiomate.agent.event.EventEmitter;
import com.openforge.physiomate.agent.stream.ToolCallRequest;
import com.openforge.physiomate.agent.tool.ToolRegistry;
import com.openforge.physiomate.config.AgentLoopProperties;
import com.openforge.physiomate.llm.ChatModel;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.Message;
import com.openforge.physiomate.llm.model.StreamingChunk;
import com.openforge.physiomate.llm.model.Tool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * The agent's turn loop.
 *
 * State machine:
 *   STREAMING     → DONE            stream ended without tool calls
 *   STREAMING     → TOOLS_PENDING   at least one finalized tool call
 *   TOOLS_PENDING → STREAMING       calls dispatched, turn budget left
 *   TOOLS_PENDING → DONE            turn budget spent (forced, not an error)
 *   any           → FAILED          unhandled exception, folded into the result
 *
 * Per turn:
 *   1. THINK: emit the "Thinking" step, request a streamed completion
 *   2. STREAM: forward content as text_delta, accumulate tool-call deltas
 *   3. DECIDE: no calls? done. Otherwise record the assistant message
 *   4. ACT: dispatch each call in index order
 *
 * Whatever happens, exactly one done event is emitted and it is the last one.
 */
@Slf4j
@Service
public class TurnController {

    static final String THINKING_LABEL = "Thinking";
    static final String APOLOGY =
            "Sorry, something went wrong while I was working on that. Please try again.";

    enum TurnState { STREAMING, TOOLS_PENDING, DONE, FAILED }

    private final ChatModel           chatModel;
    private final ToolRegistry        registry;
    private final ToolDispatcher      dispatcher;
    private final AgentLoopProperties properties;

    public TurnController(ChatModel chatModel,
                          @Qualifier("coordinatorToolRegistry") ToolRegistry registry,
                          ToolDispatcher dispatcher,
                          AgentLoopProperties properties) {
        this.chatModel  = chatModel;
        this.registry   = registry;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    public SessionResult run(List<Message> history, String model, EventEmitter emitter) {
        return run(UUID.randomUUID().toString().substring(0, 8), history, model, emitter);
    }

    /**
     * Runs the loop to completion on the calling thread.
     *
     * @param history conversation so far, system prompt first; copied, never mutated
     * @param model   model id; blank lets the provider configuration decide
     */
    public SessionResult run(String invocationId, List<Message> history, String model, EventEmitter emitter) {
        AgentInvocation invocation = new AgentInvocation(invocationId, history, emitter);
        List<Tool> tools = registry.declarations();
        int maxTurns = Math.max(1, properties.maxTurns());

        TurnState state = TurnState.STREAMING;
        Error fatal = null;
        int turn = 0;
        log.info("[Turn:{}] Loop started. history={} tools={}", invocationId, history.size(), tools.size());

        try {
            while (state == TurnState.STREAMING) {
                turn++;
                AgentTurnState turnState = streamTurn(invocation, model, tools, turn);
                List<ToolCallRequest> calls = turnState.finishToolCalls();

                if (calls.isEmpty()) {
                    log.debug("[Turn:{}] Turn {} ended without tool calls (finish_reason={})",
                            invocationId, turn, turnState.finishReason());
                    state = TurnState.DONE;
                    continue;
                }

                state = TurnState.TOOLS_PENDING;
                log.info("[Turn:{}] Turn {} requested {} tool call(s)", invocationId, turn, calls.size());
                invocation.append(Message.assistantToolCalls(turnState.text(),
                        calls.stream().map(ToolCallRequest::toToolCall).toList()));

                for (ToolCallRequest call : calls) {
                    dispatcher.dispatch(call, registry, invocation);
                }

                if (turn >= maxTurns) {
                    log.warn("[Turn:{}] Max turns ({}) reached, ending with the text so far", invocationId, maxTurns);
                    state = TurnState.DONE;
                } else {
                    state = TurnState.STREAMING;
                }
            }
        } catch (Exception e) {
            log.error("[Turn:{}] Unhandled exception in turn {}: {}", invocationId, turn, e.getMessage(), e);
            state = TurnState.FAILED;
        } catch (Error e) {
            // rethrown once done is out
            log.error("[Turn:{}] Fatal error in turn {}: {}", invocationId, turn, e, e);
            state = TurnState.FAILED;
            fatal = e;
        }

        String finalText = invocation.text();
        if (state == TurnState.FAILED && finalText.isBlank()) {
            finalText = APOLOGY;
        }

        SessionResult result = new SessionResult(finalText, invocation.actions(), invocation.toolThread(),
                turn, state == TurnState.FAILED);
        invocation.emit(AgentEvent.done(result));
        log.info("[Turn:{}] Loop finished: state={} turns={} actions={}",
                invocationId, state, turn, result.actions().size());
        if (fatal != null) {
            throw fatal;
        }
        return result;
    }

    // ── One streamed turn ────────────────────────────────────────────────────

    private AgentTurnState streamTurn(AgentInvocation invocation, String model, List<Tool> tools, int turn) {
        AgentTurnState turnState = new AgentTurnState(turn, properties.maxArgumentChars());
        ThinkingStep thinking = new ThinkingStep(invocation);

        ChatRequest request = ChatRequest.withTools(model, invocation.history(), tools, properties.maxTokens())
                .toBuilder()
                .temperature(properties.temperature())
                .build();

        try {
            chatModel.streamChat(request, chunk -> onChunk(chunk, turnState, invocation, thinking));
        } finally {
            thinking.resolve();
        }
        return turnState;
    }

    private void onChunk(StreamingChunk chunk, AgentTurnState turnState,
                         AgentInvocation invocation, ThinkingStep thinking) {
        StreamingChunk.ChunkChoice choice = chunk.firstChoice();
        if (choice == null) return;
        if (choice.finishReason() != null) {
            turnState.finishReason(choice.finishReason());
        }

        StreamingChunk.DeltaMessage delta = choice.delta();
        if (delta == null) return;

        String content = delta.content();
        boolean hasContent   = content != null && !content.isEmpty();
        boolean hasToolCalls = delta.toolCalls() != null && !delta.toolCalls().isEmpty();
        if (hasContent || hasToolCalls) {
            thinking.resolve();
        }

        if (hasContent) {
            turnState.appendText(content);
            invocation.appendText(content);
            invocation.emit(AgentEvent.textDelta(content));
        }
        if (hasToolCalls) {
            turnState.acceptToolCalls(delta.toolCalls());
        }
    }

    /** The per-turn progress indicator; resolved at most once. */
    private static final class ThinkingStep {

        private final AgentInvocation invocation;
        private final String id;
        private boolean resolved;

        ThinkingStep(AgentInvocation invocation) {
            this.invocation = invocation;
            this.id = invocation.nextStepId();
            invocation.emit(AgentEvent.step(id, THINKING_LABEL, null));
        }

        void resolve() {
            if (resolved) return;
            resolved = true;
            invocation.emit(AgentEvent.stepComplete(id, THINKING_LABEL, null));
        }
    }
}
