package com.localllm.agent.core;

import com.localllm.agent.config.AgentProperties;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.TurnCancelledException;
import com.localllm.agent.llm.LlmEvent;
import com.localllm.agent.llm.LlmRuntime;
import com.localllm.agent.llm.LlmStream;
import com.localllm.agent.model.Message;
import com.localllm.agent.model.ToolCall;
import com.localllm.agent.observability.TurnTrace;
import com.localllm.agent.tool.ToolNamespace;
import com.localllm.agent.transport.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ReAct (Reason → Act → Observe) loop for one user turn.
 *
 * Per-turn flow:
 * 1. Stream the LLM over history + new messages, forwarding tokens to the sink
 * 2. If the reply requests tools, run them (in order, or concurrently when independent)
 * 3. Feed the results back as tool messages and repeat, up to max-iterations
 *
 * Cancellation is checked at every token read and before every tool call.
 * Nothing is written to the caller's history here; the produced messages are
 * returned so a retried turn never duplicates them.
 */
@Service
@Slf4j
public class AgentTurnRunner {

    static final String MAX_ITERATIONS_MESSAGE =
            "I was unable to complete the task within the allowed steps.";

    private final LlmRuntime llmRuntime;
    private final Executor toolExecutor;
    private final int maxIterations;

    public AgentTurnRunner(LlmRuntime llmRuntime,
                           @Qualifier("toolTaskExecutor") Executor toolExecutor,
                           AgentProperties properties) {
        this.llmRuntime = llmRuntime;
        this.toolExecutor = toolExecutor;
        this.maxIterations = properties.getTurn().getMaxIterations();
    }

    public TurnOutcome run(List<Message> history, Message userMessage,
                           ToolNamespace namespace, TurnSink sink, TurnState state) {
        String conversationId = state.conversationId();
        TurnTrace trace = new TurnTrace();

        List<Message> messages = new ArrayList<>(history);
        List<Message> produced = new ArrayList<>();
        append(messages, produced, userMessage);

        log.info("Turn started [conversationId={}, tools={}, historySize={}]",
                conversationId, namespace.toolNames().size(), history.size());
        try {
            for (int i = 0; i < maxIterations; i++) {
                state.checkpoint();
                trace.nextIteration();
                log.debug("Turn iteration {}/{} [conversationId={}]", i + 1, maxIterations, conversationId);

                StringBuilder text = new StringBuilder();
                List<LlmEvent.ToolCallBatch> batches = streamReply(messages, namespace, sink, state, text, trace);

                if (batches.isEmpty()) {
                    append(messages, produced, Message.assistant(text.toString()));
                    log.info("Turn complete [conversationId={}, iterations={}, toolCalls={}, latency={}ms]",
                            conversationId, i + 1, trace.toolCalls(), trace.elapsedMs());
                    return new TurnOutcome(produced, text.toString(), i + 1, false);
                }

                for (LlmEvent.ToolCallBatch batch : batches) {
                    append(messages, produced, Message.builder()
                            .role(Message.Role.assistant)
                            .content(text.length() > 0 ? text.toString() : null)
                            .toolCalls(batch.calls())
                            .build());
                    text.setLength(0);
                    List<ToolResult> results = executeBatch(batch, namespace, sink, state, trace);
                    for (int c = 0; c < batch.calls().size(); c++) {
                        append(messages, produced, Message.toolResult(batch.calls().get(c), results.get(c).content()));
                    }
                }
            }
        } catch (TurnCancelledException e) {
            log.info("Turn cancelled [conversationId={}, iterations={}, latency={}ms]",
                    conversationId, trace.getIterations(), trace.elapsedMs());
            throw e;
        }

        log.warn("Turn hit max iterations ({}) [conversationId={}]", maxIterations, conversationId);
        state.markOutputEmitted();
        sink.onToken(MAX_ITERATIONS_MESSAGE);
        append(messages, produced, Message.assistant(MAX_ITERATIONS_MESSAGE));
        return new TurnOutcome(produced, MAX_ITERATIONS_MESSAGE, maxIterations, true);
    }

    private List<LlmEvent.ToolCallBatch> streamReply(List<Message> messages, ToolNamespace namespace,
                                                     TurnSink sink, TurnState state,
                                                     StringBuilder text, TurnTrace trace) {
        List<LlmEvent.ToolCallBatch> batches = new ArrayList<>();
        try (LlmStream stream = llmRuntime.stream(messages, namespace.definitions())) {
            state.onCancel(stream::cancel);
            try {
                while (stream.hasNext()) {
                    state.checkpoint();
                    LlmEvent event = stream.next();
                    if (event instanceof LlmEvent.TextToken token) {
                        state.markOutputEmitted();
                        text.append(token.text());
                        trace.addToken();
                        sink.onToken(token.text());
                    } else if (event instanceof LlmEvent.ToolCallBatch batch) {
                        batches.add(batch);
                    }
                }
            } finally {
                state.clearOnCancel();
            }
        }
        state.checkpoint();
        return batches;
    }

    private List<ToolResult> executeBatch(LlmEvent.ToolCallBatch batch, ToolNamespace namespace,
                                          TurnSink sink, TurnState state, TurnTrace trace) {
        AtomicBoolean aborted = new AtomicBoolean();
        if (!batch.independent() || batch.calls().size() < 2) {
            List<ToolResult> results = new ArrayList<>();
            for (ToolCall call : batch.calls()) {
                results.add(executeTool(call, namespace, sink, state, trace, aborted));
            }
            return results;
        }

        log.debug("Running {} independent tool calls concurrently [conversationId={}]",
                batch.calls().size(), state.conversationId());
        List<CompletableFuture<ToolResult>> futures = batch.calls().stream()
                .map(call -> CompletableFuture.supplyAsync(
                        () -> executeTool(call, namespace, sink, state, trace, aborted), toolExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            // no sibling may outlive the turn
            aborted.set(true);
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .handle((ignored, failure) -> null)
                    .join();
            if (e.getCause() instanceof AgentException ae) {
                throw ae;
            }
            throw new AgentException("Tool execution failed", e.getCause());
        }
    }

    private ToolResult executeTool(ToolCall call, ToolNamespace namespace, TurnSink sink,
                                   TurnState state, TurnTrace trace, AtomicBoolean aborted) {
        ensureRunnable(state, aborted);
        state.markOutputEmitted();
        sink.onToolCallStarted(call.getId(), call.getToolName(), call.getArguments());
        log.info("LLM requested tool [tool={}, callId={}, conversationId={}]",
                call.getToolName(), call.getId(), state.conversationId());

        long start = System.currentTimeMillis();
        ToolResult result;
        if (call.getArgumentError() != null) {
            log.warn("Tool call has unparseable arguments [tool={}, callId={}, conversationId={}]",
                    call.getToolName(), call.getId(), state.conversationId());
            result = ToolResult.failure("Tool '" + call.getToolName() + "' was not called: "
                    + call.getArgumentError() + ". Send the arguments as a valid JSON object.");
        } else {
            result = namespace.invokeByQualifiedName(call.getToolName(), call.getArguments());
        }
        trace.recordToolCall(call.getToolName(), System.currentTimeMillis() - start, result.error());

        ensureRunnable(state, aborted);
        sink.onToolCallResult(call.getId(), call.getToolName(), result);
        return result;
    }

    private static void ensureRunnable(TurnState state, AtomicBoolean aborted) {
        state.checkpoint();
        if (aborted.get()) {
            throw new TurnCancelledException(state.conversationId());
        }
    }

    private static void append(List<Message> messages, List<Message> produced, Message message) {
        messages.add(message);
        produced.add(message);
    }
}
