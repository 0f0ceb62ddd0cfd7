package com.localllm.agent.model;

import com.localllm.agent.provider.ProviderPatch;
import com.localllm.agent.provider.TransportKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;
import java.util.Map;

/** Body of PATCH /api/v1/providers/{id}. Absent fields stay unchanged. */
@Data
public class ProviderUpdateRequest {

    private String name;
    private String description;
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

    public ProviderPatch toPatch() {
        return ProviderPatch.builder()
                .name(name)
                .description(description)
                .transport(transport)
                .enabled(enabled)
                .timeoutSeconds(timeout)
                .command(command)
                .args(args)
                .env(env)
                .url(url)
                .headers(headers)
                .build();
    }
}
