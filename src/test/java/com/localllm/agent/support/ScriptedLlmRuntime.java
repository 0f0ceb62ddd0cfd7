package com.localllm.agent.support;

import com.localllm.agent.llm.LlmEvent;
import com.localllm.agent.llm.LlmRuntime;
import com.localllm.agent.llm.LlmStream;
import com.localllm.agent.model.Message;
import com.localllm.agent.model.ToolCall;
import com.localllm.agent.tool.ToolDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * LLM runtime that replays queued replies. When the queue is empty the
 * last reply is repeated. {@link #endless()} yields tokens until cancelled.
 */
public class ScriptedLlmRuntime implements LlmRuntime {

    private final Deque<Supplier<LlmStream>> replies = new ArrayDeque<>();
    private final List<List<Message>> requests = new ArrayList<>();
    private final List<ScriptedStream> streams = new ArrayList<>();
    private Supplier<LlmStream> last;

    public static LlmEvent token(String text) {
        return new LlmEvent.TextToken(text);
    }

    public static LlmEvent toolCalls(boolean independent, ToolCall... calls) {
        return new LlmEvent.ToolCallBatch(List.of(calls), independent);
    }

    public static ToolCall call(String id, String tool) {
        return ToolCall.builder().id(id).toolName(tool).arguments(Map.of()).build();
    }

    public ScriptedLlmRuntime reply(LlmEvent... events) {
        List<LlmEvent> script = Arrays.asList(events);
        return enqueue(() -> new ScriptedStream(script.iterator(), 0));
    }

    public ScriptedLlmRuntime endless() {
        return enqueue(() -> new ScriptedStream(new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public LlmEvent next() {
                return token("tick ");
            }
        }, 10));
    }

    public ScriptedLlmRuntime fail(RuntimeException failure) {
        return enqueue(() -> {
            throw failure;
        });
    }

    private ScriptedLlmRuntime enqueue(Supplier<LlmStream> reply) {
        replies.add(reply);
        return this;
    }

    @Override
    public synchronized LlmStream stream(List<Message> messages, List<ToolDefinition> tools) {
        requests.add(List.copyOf(messages));
        Supplier<LlmStream> next = replies.isEmpty() ? last : replies.poll();
        if (next == null) {
            throw new IllegalStateException("no scripted reply");
        }
        last = next;
        LlmStream stream = next.get();
        streams.add((ScriptedStream) stream);
        return stream;
    }

    @Override
    public String modelName() {
        return "scripted";
    }

    public synchronized List<List<Message>> requests() {
        return List.copyOf(requests);
    }

    public synchronized ScriptedStream lastStream() {
        return streams.get(streams.size() - 1);
    }

    public static final class ScriptedStream implements LlmStream {

        private final Iterator<LlmEvent> events;
        private final long delayMs;
        private volatile boolean cancelled;
        private volatile boolean closed;

        ScriptedStream(Iterator<LlmEvent> events, long delayMs) {
            this.events = events;
            this.delayMs = delayMs;
        }

        @Override
        public boolean hasNext() {
            if (cancelled || closed) {
                return false;
            }
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return !cancelled && events.hasNext();
        }

        @Override
        public LlmEvent next() {
            if (!hasNextUnchecked()) {
                throw new NoSuchElementException();
            }
            return events.next();
        }

        private boolean hasNextUnchecked() {
            return !cancelled && events.hasNext();
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public void close() {
            closed = true;
        }

        public boolean isClosed() {
            return closed;
        }
    }
}
