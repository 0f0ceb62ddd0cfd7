package com.localllm.agent.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a provider. Null fields are left unchanged.
 * Switching transport kind requires clearing the other kind's fields,
 * which is why the HTTP and stdio groups can be explicitly emptied by
 * passing an empty string / empty collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderPatch {

    private String name;
    private String description;
    private TransportKind transport;
    private Boolean enabled;
    private Integer timeoutSeconds;
    private String command;
    private List<String> args;
    private Map<String, String> env;
    private String url;
    private Map<String, String> headers;

    public ProviderConfig applyTo(ProviderConfig current) {
        ProviderConfig.ProviderConfigBuilder b = current.toBuilder();
        if (name != null)           b.name(name);
        if (description != null)    b.description(description);
        if (transport != null)      b.transport(transport);
        if (enabled != null)        b.enabled(enabled);
        if (timeoutSeconds != null) b.timeoutSeconds(timeoutSeconds);
        if (command != null)        b.command(command.isEmpty() ? null : command);
        if (args != null)           b.args(List.copyOf(args));
        if (env != null)            b.env(Map.copyOf(env));
        if (url != null)            b.url(url.isEmpty() ? null : url);
        if (headers != null)        b.headers(Map.copyOf(headers));
        return b.build();
    }

    /** True when the patch touches anything a live connection depends on. */
    public boolean affectsConnection() {
        return transport != null || enabled != null || timeoutSeconds != null
                || command != null || args != null || env != null
                || url != null || headers != null;
    }
}
