package com.openforge.physiomate.agent.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.physiomate.agent.ActionRecord;
import com.openforge.physiomate.agent.AgentInvocation;
import com.openforge.physiomate.agent.event.AgentEvent;
import com.openforge.physiomate.agent.stream.ToolCallRequest;
import com.openforge.physiomate.agent.tool.AsyncToolCallable;
import com.openforge.physiomate.agent.tool.SubstepListener;
import com.openforge.physiomate.agent.tool.ToolCallable;
import com.openforge.physiomate.agent.tool.ToolInvocation;
import com.openforge.physiomate.agent.tool.ToolRegistry;
import com.openforge.physiomate.agent.tool.ToolSpec;
import com.openforge.physiomate.config.AgentLoopProperties;
import com.openforge.physiomate.llm.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Executes or defers the finalized tool calls of a turn.
 *
 * Routing per call:
 *   unknown name  → "Error: Unknown tool '<name>'" tool message, nothing else
 *   over ceiling  → "Error: Tool call limit reached (<n>)" tool message
 *   INTERNAL      → step, run callable, step_complete, tool message with result
 *   ACTION        → step, record action, step_complete, acknowledgment tool message
 *
 * Callers dispatch the calls of a turn one after another; this class never
 * runs two of them in parallel. The only concurrency is a sub-agent tool
 * running beside the drain loop that forwards its substeps.
 *
 * Blocking callables are submitted as plain executor tasks, so interrupting
 * the dispatching thread cancels them with an interrupt of their own.
 */
@Slf4j
@Component
public class ToolDispatcher {

    static final int SUBSTEP_CHANNEL_CAPACITY = 256;

    private final ObjectMapper        objectMapper;
    private final ExecutorService     toolExecutor;
    private final ExecutorService     subAgentExecutor;
    private final AgentLoopProperties properties;
    private final int                 channelCapacity;

    @Autowired
    public ToolDispatcher(ObjectMapper objectMapper,
                          @Qualifier("toolExecutor") ExecutorService toolExecutor,
                          @Qualifier("agentExecutor") ExecutorService subAgentExecutor,
                          AgentLoopProperties properties) {
        this(objectMapper, toolExecutor, subAgentExecutor, properties, SUBSTEP_CHANNEL_CAPACITY);
    }

    ToolDispatcher(ObjectMapper objectMapper, ExecutorService toolExecutor, ExecutorService subAgentExecutor,
                   AgentLoopProperties properties, int channelCapacity) {
        this.objectMapper     = objectMapper;
        this.toolExecutor     = toolExecutor;
        this.subAgentExecutor = subAgentExecutor;
        this.properties       = properties;
        this.channelCapacity  = channelCapacity;
    }

    /**
     * Resolves and handles one call, appending exactly one tool message to
     * the invocation. Never throws for tool-level problems; only an
     * interrupted wait escapes, as {@link CancellationException}.
     */
    public void dispatch(ToolCallRequest call, ToolRegistry registry, AgentInvocation invocation) {
        ToolSpec spec = registry.find(call.name()).orElse(null);
        if (spec == null) {
            log.warn("[Dispatcher:{}] Unknown tool '{}' (call {})", invocation.id(), call.name(), call.id());
            invocation.append(Message.toolResult(call.id(), unknownToolMessage(call.name())));
            return;
        }
        if (!invocation.reserveToolCall(properties.maxToolCalls())) {
            log.warn("[Dispatcher:{}] Tool call ceiling {} reached, refusing '{}'",
                    invocation.id(), properties.maxToolCalls(), call.name());
            invocation.append(Message.toolResult(call.id(),
                    "Error: Tool call limit reached (%d)".formatted(properties.maxToolCalls())));
            return;
        }

        ObjectNode params = parseArguments(call, invocation.id());
        String stepId = invocation.nextStepId();
        invocation.emit(AgentEvent.step(stepId, spec.stepLabel(), spec.name()));

        String content;
        switch (spec.kind()) {
            case ACTION -> {
                invocation.addAction(new ActionRecord(spec.name(), params));
                content = "Action '%s' dispatched to client.".formatted(spec.name());
                log.info("[Dispatcher:{}] Action '{}' queued for client", invocation.id(), spec.name());
            }
            case INTERNAL -> {
                log.info("[Dispatcher:{}] Executing tool '{}' args={}", invocation.id(), spec.name(), params);
                content = spec.emitsSubsteps()
                        ? runWithSubsteps(spec, call, params, invocation)
                        : runDirect(spec, call, params);
            }
            default -> throw new IllegalStateException("Unhandled tool kind " + spec.kind());
        }

        invocation.emit(AgentEvent.stepComplete(stepId, spec.stepLabel() + " complete", spec.name()));
        invocation.append(Message.toolResult(call.id(), content));
    }

    public static String unknownToolMessage(String name) {
        return "Error: Unknown tool '%s'".formatted(name);
    }

    // ── Arguments ────────────────────────────────────────────────────────────

    /**
     * Structural parse only. Empty, truncated, malformed or non-object
     * argument text all become an empty object.
     */
    ObjectNode parseArguments(ToolCallRequest call, String invocationId) {
        String text = call.argumentsText();
        if (call.argumentsTruncated() || text == null || text.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node instanceof ObjectNode object) {
                return object;
            }
            log.warn("[Dispatcher:{}] Arguments of '{}' are not a JSON object, using {{}}",
                    invocationId, call.name());
        } catch (JsonProcessingException e) {
            log.warn("[Dispatcher:{}] Malformed arguments for '{}', using {{}}: {}",
                    invocationId, call.name(), e.getOriginalMessage());
        }
        return objectMapper.createObjectNode();
    }

    // ── Execution ────────────────────────────────────────────────────────────

    private String runDirect(ToolSpec spec, ToolCallRequest call, ObjectNode params) {
        ToolInvocation toolInvocation = new ToolInvocation(call.id(), params, SubstepListener.NOOP);
        Future<String> task = start(spec.callable(), toolInvocation, toolExecutor);
        return awaitResult(spec, task);
    }

    /**
     * Launches the sub-agent in the background and forwards its substeps as
     * they arrive: wait on the channel with a short timeout, repeat until the
     * task completes, then drain whatever is still buffered before reading
     * the result.
     *
     * A full channel makes the sub-agent wait for the drain loop rather than
     * lose an event. The wait ends when the drain loop takes the next event,
     * or when cancellation interrupts the sub-agent.
     */
    private String runWithSubsteps(ToolSpec spec, ToolCallRequest call, ObjectNode params,
                                   AgentInvocation invocation) {
        BlockingQueue<AgentEvent> channel = new ArrayBlockingQueue<>(channelCapacity);
        SubstepListener listener = substep -> {
            try {
                channel.put(AgentEvent.substep(call.id(), substep));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Dispatcher:{}] Interrupted forwarding substep {} of '{}'",
                        invocation.id(), substep.id(), spec.name());
            }
        };

        ToolInvocation toolInvocation = new ToolInvocation(call.id(), params, listener);
        Future<String> task = start(spec.callable(), toolInvocation, subAgentExecutor);
        long pollMillis = Math.max(1L, properties.substepPollInterval().toMillis());

        try {
            while (!task.isDone()) {
                AgentEvent event = channel.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (event != null) {
                    invocation.emit(event);
                }
            }
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while draining '" + spec.name() + "'");
        }

        List<AgentEvent> remaining = new ArrayList<>();
        channel.drainTo(remaining);
        remaining.forEach(invocation::emit);

        return awaitResult(spec, task);
    }

    private static Future<String> start(ToolCallable callable, ToolInvocation toolInvocation,
                                        ExecutorService executor) {
        if (callable instanceof AsyncToolCallable async) {
            try {
                CompletableFuture<String> future = async.callAsync(toolInvocation);
                return future != null ? future : CompletableFuture.completedFuture("");
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return executor.submit(() -> callable.call(toolInvocation));
    }

    private String awaitResult(ToolSpec spec, Future<String> task) {
        try {
            String result = task.get();
            return result == null ? "" : result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Dispatcher] Tool '{}' failed: {}", spec.name(), cause.toString());
            return "Tool error: " + describe(cause);
        } catch (CancellationException e) {
            return "Tool error: cancelled";
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for '" + spec.name() + "'");
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
