package com.localllm.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the active LLM runtime based on llm.provider (LLM_PROVIDER).
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean
    public LlmRuntime llmRuntime(LlmProperties props, CloseableHttpClient agentHttpClient, ObjectMapper objectMapper) {
        LlmProperties.Endpoint endpoint = props.active();
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", props.getProvider().toUpperCase());
        log.info("  Model               : {}", endpoint.getModel());
        log.info("  Base URL            : {}", endpoint.getBaseUrl());
        log.info("================================================================");
        logKey(props.getProvider(), endpoint.getApiKey());
        return new OpenAiCompatibleLlmRuntime(props, agentHttpClient, objectMapper);
    }

    private void logKey(String provider, String key) {
        if ("ollama".equalsIgnoreCase(provider)) {
            return;
        }
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY", provider.toUpperCase(), provider.toUpperCase());
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
