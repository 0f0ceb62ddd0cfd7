package com.localllm.agent.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${VAR}} and {@code ${VAR:-default}} placeholders against
 * the process environment.
 *
 * Only called at connect time. Configs at rest keep the literal
 * placeholder so secrets never land in the config file.
 */
@Component
@Slf4j
public class EnvironmentResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}:]+)(?::-([^}]*))?}");

    private final Function<String, String> environment;

    @Autowired
    public EnvironmentResolver() {
        this(System::getenv);
    }

    public EnvironmentResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    public String resolve(String value) {
        if (value == null || value.indexOf("${") < 0) {
            return value;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            String fallback = matcher.group(2);
            String resolved = environment.apply(name);
            if (resolved == null) {
                if (fallback == null) {
                    log.warn("Environment variable [{}] is not set and has no default; using empty string", name);
                }
                resolved = fallback != null ? fallback : "";
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public List<String> resolveAll(List<String> values) {
        return values.stream().map(this::resolve).toList();
    }

    public Map<String, String> resolveAll(Map<String, String> values) {
        Map<String, String> resolved = new LinkedHashMap<>();
        values.forEach((k, v) -> resolved.put(k, resolve(v)));
        return resolved;
    }
}
