package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.provider.EnvironmentResolver;
import com.localllm.agent.provider.ProviderConfig;
import lombok.RequiredArgsConstructor;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.stereotype.Component;

/** Picks the adapter for a provider's transport kind. Returned transports are not yet connected. */
@Component
@RequiredArgsConstructor
public class TransportFactory {

    private final ObjectMapper objectMapper;
    private final CloseableHttpClient agentHttpClient;
    private final EnvironmentResolver environmentResolver;

    public ToolTransport create(ProviderConfig config) {
        return switch (config.getTransport()) {
            case STDIO -> new StdioTransport(config, objectMapper, environmentResolver);
            case STREAMABLE_HTTP -> new StreamableHttpTransport(config, objectMapper, agentHttpClient, environmentResolver);
            case SSE -> new SseTransport(config, objectMapper, agentHttpClient, environmentResolver);
        };
    }
}
