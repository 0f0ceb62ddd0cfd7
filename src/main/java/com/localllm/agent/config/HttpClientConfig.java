package com.localllm.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One pooled Apache HttpClient shared by the HTTP tool transports and the
 * LLM runtime client. Response timeouts are set per request because they
 * differ per provider and are disabled for long-lived event streams.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient agentHttpClient(AgentProperties properties) {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(200)
                .setMaxConnPerRoute(50)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(properties.getSupervisor().getConnectTimeout().toMillis()))
                        .build())
                .build();

        log.info("Pooled HttpClient configured [maxTotal=200, maxPerRoute=50]");
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .disableAutomaticRetries()
                .build();
    }
}
