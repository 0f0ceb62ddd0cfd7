package com.localllm.agent.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.config.AgentProperties;
import com.localllm.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed conversation history.
 *
 * Design decisions:
 * - Key pattern: agent:conversation:{conversationId}:messages
 * - Redis LIST, one JSON message per element: RPUSH + LTRIM keeps appends cheap
 *   and bounds the stored window; the window never starts on a tool result
 * - TTL reset on every write; idle conversations expire automatically
 * - Appends run on the history executor; a failed write is logged and dropped so
 *   streaming never waits on Redis
 */
@Component
@Slf4j
public class RedisConversationHistoryStore implements ConversationHistoryStore {

    private static final String KEY_PREFIX = "agent:conversation:";
    private static final String KEY_SUFFIX = ":messages";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AgentProperties.Session settings;

    public RedisConversationHistoryStore(StringRedisTemplate redisTemplate,
                                         ObjectMapper objectMapper,
                                         AgentProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.getSession();
    }

    @Override
    @Async("historyTaskExecutor")
    public void append(String conversationId, List<Message> messages) {
        if (messages.isEmpty()) {
            return;
        }
        String key = buildKey(conversationId);
        try {
            List<String> encoded = new ArrayList<>(messages.size());
            for (Message message : messages) {
                encoded.add(objectMapper.writeValueAsString(message));
            }
            redisTemplate.opsForList().rightPushAll(key, encoded);
            trimToWindow(key);
            redisTemplate.expire(key, settings.getHistoryTtl());
            log.debug("Appended {} messages to history [conversationId={}]", messages.size(), conversationId);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize history [conversationId={}]", conversationId, e);
        } catch (DataAccessException e) {
            log.error("History write failed [conversationId={}]: {}", conversationId, e.getMessage());
        }
    }

    /** Returns an empty list when the conversation is unknown, expired, or Redis is unreachable. */
    @Override
    public List<Message> load(String conversationId) {
        List<String> raw;
        try {
            raw = redisTemplate.opsForList().range(buildKey(conversationId), 0, -1);
        } catch (DataAccessException e) {
            log.warn("History load failed, starting empty [conversationId={}]: {}", conversationId, e.getMessage());
            return new ArrayList<>();
        }
        if (raw == null || raw.isEmpty()) {
            log.debug("No stored history [conversationId={}]", conversationId);
            return new ArrayList<>();
        }
        List<Message> messages = new ArrayList<>(raw.size());
        for (String json : raw) {
            try {
                messages.add(objectMapper.readValue(json, Message.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable history entry [conversationId={}]", conversationId);
            }
        }
        log.debug("Loaded {} messages [conversationId={}]", messages.size(), conversationId);
        return messages;
    }

    @Override
    public void clear(String conversationId) {
        try {
            redisTemplate.delete(buildKey(conversationId));
            log.info("Cleared history [conversationId={}]", conversationId);
        } catch (DataAccessException e) {
            log.warn("History clear failed [conversationId={}]: {}", conversationId, e.getMessage());
        }
    }

    /**
     * Keeps the last history-limit entries, moving the cut forward past any
     * tool results whose assistant tool_calls entry would be cut off.
     */
    private void trimToWindow(String key) {
        int limit = settings.getHistoryLimit();
        Long size = redisTemplate.opsForList().size(key);
        if (size == null || size <= limit) {
            return;
        }
        List<String> window = redisTemplate.opsForList().range(key, -limit, -1);
        int orphans = window != null ? countLeadingToolResults(window) : 0;
        if (window != null && orphans >= window.size()) {
            redisTemplate.delete(key);
            return;
        }
        redisTemplate.opsForList().trim(key, -(limit - orphans), -1);
    }

    private int countLeadingToolResults(List<String> window) {
        int count = 0;
        for (String json : window) {
            try {
                if (objectMapper.readValue(json, Message.class).getRole() != Message.Role.tool) {
                    break;
                }
            } catch (JsonProcessingException e) {
                // unreadable entries are skipped on load, so one is as good a boundary as any
                break;
            }
            count++;
        }
        return count;
    }

    private String buildKey(String conversationId) {
        return KEY_PREFIX + conversationId + KEY_SUFFIX;
    }
}
