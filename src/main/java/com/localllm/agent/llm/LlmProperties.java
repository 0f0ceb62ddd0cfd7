package com.localllm.agent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * LLM endpoint settings, bound under "llm".
 * {@code provider} picks which endpoint block is active.
 */
@Component
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    private String provider = "ollama";
    /** Longest silence tolerated between two streamed chunks. */
    private Duration readTimeout = Duration.ofMinutes(2);
    private boolean parallelToolCalls = true;

    private Endpoint ollama = new Endpoint("http://localhost:11434/v1", "ollama", "qwen2.5:14b");
    private Endpoint openai = new Endpoint("https://api.openai.com/v1", "", "gpt-4o-mini");
    private Endpoint groq = new Endpoint("https://api.groq.com/openai/v1", "", "llama-3.3-70b-versatile");

    @Data
    public static class Endpoint {
        private String baseUrl;
        private String apiKey;
        private String model;
        private int maxTokens = 4096;
        private double temperature = 0.2;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, String apiKey, String model) {
            this.baseUrl = baseUrl;
            this.apiKey = apiKey;
            this.model = model;
        }
    }

    public Endpoint active() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openai;
            case "groq" -> groq;
            default -> ollama;
        };
    }
}
