package com.localllm.agent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.provider.TransportKind;
import com.localllm.agent.supervisor.ConnectionStatus;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/** Provider as shown by the admin API. Placeholder values are shown unresolved. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderResponse {

    private String id;
    private String name;
    private String description;
    private String transport;
    private boolean builtIn;
    private boolean enabled;
    private int timeout;
    private String command;
    private List<String> args;
    private Map<String, String> env;
    private String url;
    private Map<String, String> headers;
    private ConnectionStatus status;

    public static ProviderResponse from(ProviderConfig config, ConnectionStatus status) {
        boolean stdio = config.getTransport() == TransportKind.STDIO;
        return ProviderResponse.builder()
                .id(config.getId())
                .name(config.getName())
                .description(config.getDescription())
                .transport(config.getTransport().wireName())
                .builtIn(config.isBuiltIn())
                .enabled(config.isEnabled())
                .timeout(config.getTimeoutSeconds())
                .command(stdio ? config.getCommand() : null)
                .args(stdio ? config.getArgs() : null)
                .env(stdio ? config.getEnv() : null)
                .url(stdio ? null : config.getUrl())
                .headers(stdio ? null : config.getHeaders())
                .status(status)
                .build();
    }
}
