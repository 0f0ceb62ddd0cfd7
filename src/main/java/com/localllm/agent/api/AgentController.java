package com.localllm.agent.api;

import com.localllm.agent.llm.LlmRuntime;
import com.localllm.agent.session.ConversationSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * GET /api/v1/agent/health
 *
 * Conversations themselves run over the WebSocket at /ws/conversations/{conversationId}.
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
public class AgentController {

    private final LlmRuntime llmRuntime;
    private final ConversationSessionManager sessionManager;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "model", llmRuntime.modelName(),
                "activeConversations", sessionManager.activeSessions()));
    }
}
