package com.localllm.agent.session;

import com.localllm.agent.core.TurnState;
import com.localllm.agent.gateway.ConversationChannel;
import com.localllm.agent.model.Message;
import com.localllm.agent.tool.CapabilityAggregator;
import com.localllm.agent.tool.ToolNamespace;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live state of one conversation. Does not own connection lifetime: the
 * current {@link ToolNamespace} holds the leases.
 */
@Slf4j
public class ConversationSession {

    private final String id;
    private final ConversationChannel channel;
    private final int historyLimit;
    private List<Message> history;
    private final Object namespaceLock = new Object();

    private ToolNamespace namespace;
    private StreamingState streamingState = StreamingState.IDLE;
    private TurnState currentTurn;
    private volatile Instant lastActivity = Instant.now();
    private volatile Instant detachedSince;

    public ConversationSession(String id, ConversationChannel channel, List<Message> history, int historyLimit) {
        this.id = id;
        this.channel = channel;
        this.historyLimit = historyLimit;
        this.history = new ArrayList<>(HistoryWindow.apply(history, historyLimit));
    }

    public String id() {
        return id;
    }

    public ConversationChannel channel() {
        return channel;
    }

    // ─── Turn lifecycle ─────────────────────────────────────────────────────

    /** Returns null when a turn is already running. */
    public synchronized TurnState tryBeginTurn() {
        if (streamingState != StreamingState.IDLE) {
            return null;
        }
        streamingState = StreamingState.GENERATING;
        currentTurn = new TurnState(id);
        touch();
        return currentTurn;
    }

    public synchronized void endTurn(TurnState turn) {
        if (currentTurn == turn) {
            currentTurn = null;
            streamingState = StreamingState.IDLE;
        }
        touch();
    }

    /** Returns false when there is nothing to cancel. */
    public synchronized boolean requestCancel() {
        if (streamingState != StreamingState.GENERATING || currentTurn == null) {
            return false;
        }
        streamingState = StreamingState.CANCELLING;
        currentTurn.cancel();
        return true;
    }

    public synchronized StreamingState streamingState() {
        return streamingState;
    }

    // ─── History ────────────────────────────────────────────────────────────

    public synchronized List<Message> historySnapshot() {
        return List.copyOf(history);
    }

    /** Appends and re-applies the window, so the prompt sent to the LLM stays bounded. */
    public synchronized void appendHistory(List<Message> messages) {
        history.addAll(messages);
        if (history.size() > historyLimit) {
            history = new ArrayList<>(HistoryWindow.apply(history, historyLimit));
        }
    }

    // ─── Tools ──────────────────────────────────────────────────────────────

    /**
     * Returns the namespace for {@code selection}, rebuilding it when the
     * selection changed or a selected provider was unavailable when it was
     * built, so a recovered provider rejoins on the next turn. The new namespace is built before the old one is
     * closed so providers in both selections keep their connection.
     * A null selection keeps the current one.
     */
    public ToolNamespace namespaceFor(List<String> selection, CapabilityAggregator aggregator) {
        synchronized (namespaceLock) {
            List<String> wanted = selection != null ? selection
                    : namespace != null ? namespace.selection() : List.of();
            if (namespace != null && namespace.selection().equals(wanted)
                    && namespace.connectedProviders().containsAll(wanted)) {
                return namespace;
            }
            ToolNamespace next = aggregator.buildNamespace(wanted);
            ToolNamespace previous = namespace;
            namespace = next;
            if (previous != null) {
                previous.close();
                log.info("Namespace rebuilt [conversationId={}, selection={}, connected={}]",
                        id, next.selection(), next.connectedProviders());
            }
            return next;
        }
    }

    // ─── Attachment ─────────────────────────────────────────────────────────

    public void touch() {
        lastActivity = Instant.now();
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public Instant detachedSince() {
        return detachedSince;
    }

    public void markAttached() {
        detachedSince = null;
        touch();
    }

    public void markDetached() {
        detachedSince = Instant.now();
    }

    /** Cancels any running turn and releases the namespace. */
    public void destroy() {
        requestCancel();
        synchronized (namespaceLock) {
            if (namespace != null) {
                namespace.close();
                namespace = null;
            }
        }
    }
}
