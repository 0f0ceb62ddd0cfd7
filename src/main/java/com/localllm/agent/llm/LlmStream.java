package com.localllm.agent.llm;

import java.util.Iterator;

/**
 * Lazy event stream of one LLM reply. Not restartable.
 * {@link #cancel()} may be called from any thread and makes {@link #hasNext()}
 * return false promptly.
 */
public interface LlmStream extends Iterator<LlmEvent>, AutoCloseable {

    void cancel();

    boolean isCancelled();

    @Override
    void close();
}
