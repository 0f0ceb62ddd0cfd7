package com.localllm.agent.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of one entry under {@code mcpServers} in the provider
 * config file. Kept apart from {@link ProviderConfig} so the file format
 * can stay lenient (legacy entries, unknown keys) while the domain object
 * stays strict.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderConfigEntry {

    private String name;
    private String description;
    private String transport;
    private Boolean enabled;
    private Integer timeout;
    private String command;
    private List<String> args;
    private Map<String, String> env;
    private String url;
    private Map<String, String> headers;

    public static ProviderConfigEntry from(ProviderConfig config) {
        ProviderConfigEntry e = new ProviderConfigEntry();
        e.setName(config.getName());
        e.setDescription(config.getDescription());
        e.setTransport(config.getTransport().wireName());
        e.setEnabled(config.isEnabled());
        e.setTimeout(config.getTimeoutSeconds());
        if (config.getTransport() == TransportKind.STDIO) {
            e.setCommand(config.getCommand());
            e.setArgs(config.getArgs());
            e.setEnv(new LinkedHashMap<>(config.getEnv()));
        } else {
            e.setUrl(config.getUrl());
            e.setHeaders(new LinkedHashMap<>(config.getHeaders()));
        }
        return e;
    }

    /**
     * Overlays this entry onto {@code base} (a built-in default) or builds a
     * fresh config when {@code base} is null. Missing transport is inferred
     * from which connection field is present.
     */
    public ProviderConfig toConfig(String id, ProviderConfig base) {
        ProviderConfig.ProviderConfigBuilder b = base != null
                ? base.toBuilder()
                : ProviderConfig.builder().id(id).name(id);

        TransportKind kind = inferTransport(base);
        b.transport(kind);
        if (name != null)        b.name(name);
        if (description != null) b.description(description);
        if (enabled != null)     b.enabled(enabled);
        if (timeout != null)     b.timeoutSeconds(timeout);

        if (kind == TransportKind.STDIO) {
            if (command != null) b.command(command.trim());
            if (args != null)    b.args(List.copyOf(args));
            if (env != null)     b.env(Map.copyOf(env));
            b.url(null).headers(Map.of());
        } else {
            if (url != null)     b.url(url.trim());
            if (headers != null) b.headers(Map.copyOf(headers));
            b.command(null).args(List.of()).env(Map.of());
        }
        return b.build();
    }

    private TransportKind inferTransport(ProviderConfig base) {
        if (transport != null && !transport.isBlank()) {
            return TransportKind.fromWire(transport);
        }
        if (command != null && !command.isBlank()) {
            return TransportKind.STDIO;
        }
        if (url != null && !url.isBlank()) {
            return TransportKind.STREAMABLE_HTTP;
        }
        return base != null ? base.getTransport() : TransportKind.STDIO;
    }
}
