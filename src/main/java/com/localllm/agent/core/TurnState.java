package com.localllm.agent.core;

import com.localllm.agent.exception.TurnCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation flag and output marker shared between a running turn and the
 * gateway thread that may cancel it.
 */
@Slf4j
public class TurnState {

    private final String conversationId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean outputEmitted = new AtomicBoolean();
    private final AtomicReference<Runnable> onCancel = new AtomicReference<>();

    public TurnState(String conversationId) {
        this.conversationId = conversationId;
    }

    public String conversationId() {
        return conversationId;
    }

    /** Sets the flag and aborts whatever blocking read is registered. Idempotent. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            Runnable hook = onCancel.getAndSet(null);
            if (hook != null) {
                try {
                    hook.run();
                } catch (RuntimeException e) {
                    log.warn("Cancel hook failed [conversationId={}]: {}", conversationId, e.getMessage());
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Registers the abort action for the current blocking read; runs it at once if already cancelled. */
    public void onCancel(Runnable hook) {
        onCancel.set(hook);
        if (cancelled.get()) {
            Runnable pending = onCancel.getAndSet(null);
            if (pending != null) {
                pending.run();
            }
        }
    }

    public void clearOnCancel() {
        onCancel.set(null);
    }

    public void checkpoint() {
        if (cancelled.get()) {
            throw new TurnCancelledException(conversationId);
        }
    }

    public void markOutputEmitted() {
        outputEmitted.set(true);
    }

    public boolean isOutputEmitted() {
        return outputEmitted.get();
    }
}
