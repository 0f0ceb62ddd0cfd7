package com.localllm.agent.provider;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration of one tool-provider.
 *
 * String values may hold unresolved {@code ${VAR}} / {@code ${VAR:-default}}
 * placeholders. They stay unresolved here and in the config file; the
 * transport resolves them at connect time.
 *
 * Which field group is populated depends on {@link #transport}:
 * stdio uses command/args/env, the HTTP kinds use url/headers.
 * {@link ProviderConfigValidator} enforces that exactly one group is set.
 */
@Value
@Builder(toBuilder = true)
public class ProviderConfig {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    String id;
    String name;

    @Builder.Default
    String description = "";

    TransportKind transport;

    boolean builtIn;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    // stdio
    String command;

    @Builder.Default
    List<String> args = List.of();

    @Builder.Default
    Map<String, String> env = Map.of();

    // streamable_http / sse
    String url;

    @Builder.Default
    Map<String, String> headers = Map.of();

    public Duration callTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
