package com.localllm.agent.provider;

import com.localllm.agent.exception.ProviderValidationException;

import java.util.regex.Pattern;

/**
 * Enforces the transport invariant and the basic field rules.
 * Runs before anything is persisted; a config that fails here never
 * reaches the config file.
 */
public final class ProviderConfigValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");
    private static final int MIN_TIMEOUT_SECONDS = 1;
    private static final int MAX_TIMEOUT_SECONDS = 300;

    private ProviderConfigValidator() {
    }

    public static ProviderConfig validate(ProviderConfig config) {
        if (config == null) {
            throw new ProviderValidationException("Provider config is required");
        }
        String id = config.getId();
        if (id == null || id.isBlank()) {
            throw new ProviderValidationException("Provider id must not be blank");
        }
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new ProviderValidationException(
                    "Provider id '" + id + "' may only contain letters, digits, '.', '_' and '-'");
        }
        if (config.getTransport() == null) {
            throw new ProviderValidationException("transport is required (provider: " + id + ")");
        }
        if (config.getTimeoutSeconds() < MIN_TIMEOUT_SECONDS || config.getTimeoutSeconds() > MAX_TIMEOUT_SECONDS) {
            throw new ProviderValidationException(
                    "timeout must be between 1 and 300 seconds (provider: " + id + ")");
        }

        boolean hasCommand = config.getCommand() != null && !config.getCommand().isBlank();
        boolean hasUrl = config.getUrl() != null && !config.getUrl().isBlank();

        if (config.getTransport() == TransportKind.STDIO) {
            if (!hasCommand) {
                throw new ProviderValidationException(
                        "stdio transport requires 'command' (provider: " + id + ")");
            }
            if (hasUrl || !config.getHeaders().isEmpty()) {
                throw new ProviderValidationException(
                        "stdio transport must not set 'url' or 'headers' (provider: " + id + ")");
            }
        } else {
            String kind = config.getTransport().wireName();
            if (!hasUrl) {
                throw new ProviderValidationException(
                        kind + " transport requires 'url' (provider: " + id + ")");
            }
            if (hasCommand || !config.getArgs().isEmpty() || !config.getEnv().isEmpty()) {
                throw new ProviderValidationException(
                        kind + " transport must not set 'command', 'args' or 'env' (provider: " + id + ")");
            }
            String url = config.getUrl().trim();
            // a placeholder may expand to the scheme, so only literal urls are checked
            if (!url.startsWith("${") && !(url.startsWith("http://") || url.startsWith("https://"))) {
                throw new ProviderValidationException(
                        "url must start with http:// or https:// (provider: " + id + ")");
            }
        }
        return config;
    }
}
