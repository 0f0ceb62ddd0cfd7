package com.localllm.agent.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.localllm.agent.exception.ProviderValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * The three transport shapes a tool-provider can speak.
 * Closed set: adding a kind means adding an adapter in TransportFactory.
 */
public enum TransportKind {

    STDIO("stdio"),
    STREAMABLE_HTTP("streamable_http"),
    SSE("sse");

    private final String wireName;

    TransportKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isHttp() {
        return this != STDIO;
    }

    /**
     * Parses the config-file value. Accepts the legacy type names older
     * config files used: "python" ran a stdio server, "http" was the
     * request/response HTTP transport.
     */
    @JsonCreator
    public static TransportKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ProviderValidationException("transport must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "python":
                return STDIO;
            case "http":
                return STREAMABLE_HTTP;
            default:
                return Arrays.stream(values())
                        .filter(k -> k.wireName.equals(normalized))
                        .findFirst()
                        .orElseThrow(() -> new ProviderValidationException(
                                "Unknown transport '" + value + "'. Use one of: stdio, streamable_http, sse"));
        }
    }
}
