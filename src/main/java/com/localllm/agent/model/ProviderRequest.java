package com.localllm.agent.model;

import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.provider.TransportKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

/** Body of POST /api/v1/providers. Transport-specific rules are checked by the registry. */
@Data
public class ProviderRequest {

    @NotBlank(message = "id must not be blank")
    private String id;

    private String name;
    private String description;

    @NotNull(message = "transport is required")
    private TransportKind transport;

    private Boolean enabled;

    @Min(value = 1, message = "timeout must be at least 1 second")
    @Max(value = 300, message = "timeout must be at most 300 seconds")
    private Integer timeout;

    private String command;
    private List<String> args;
    private Map<String, String> env;
    private String url;
    private Map<String, String> headers;

    public ProviderConfig toConfig() {
        ProviderConfig.ProviderConfigBuilder b = ProviderConfig.builder()
                .id(id.trim())
                .name(name != null && !name.isBlank() ? name : id.trim())
                .transport(transport)
                .command(command)
                .url(url);
        if (description != null) b.description(description);
        if (enabled != null)     b.enabled(enabled);
        if (timeout != null)     b.timeoutSeconds(timeout);
        if (args != null)        b.args(List.copyOf(args));
        if (env != null)         b.env(Map.copyOf(env));
        if (headers != null)     b.headers(Map.copyOf(headers));
        return b.build();
    }
}
