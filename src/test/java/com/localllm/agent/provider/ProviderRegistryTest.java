package com.localllm.agent.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.ImmutableProviderException;
import com.localllm.agent.exception.ProviderNotFoundException;
import com.localllm.agent.exception.ProviderValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Object> events = new ArrayList<>();
    private Path configFile;

    @BeforeEach
    void setUp() {
        configFile = dir.resolve("mcp_config.json");
    }

    private ProviderRegistry registry(boolean includeBuiltIns) {
        ProviderRegistry registry = new ProviderRegistry(
                new ProviderConfigStore(configFile, objectMapper), events::add, includeBuiltIns);
        registry.init();
        return registry;
    }

    private static ProviderConfig docs() {
        return ProviderConfig.builder()
                .id("docs")
                .name("Docs")
                .transport(TransportKind.STREAMABLE_HTTP)
                .url("https://docs.example.com/mcp")
                .headers(Map.of("Authorization", "Bearer ${API_KEY}"))
                .build();
    }

    private JsonNode readFile() throws Exception {
        return objectMapper.readTree(configFile.toFile());
    }

    @Test
    void init_missingFile_startsWithBuiltInsOnly() {
        ProviderRegistry registry = registry(true);

        assertThat(registry.list()).extracting(ProviderConfig::getId)
                .containsExactly("mssql", "analytics-management", "data-analytics");
        assertThat(registry.list()).allMatch(ProviderConfig::isBuiltIn);
    }

    @Test
    void add_thenGet_returnsNewConfigAndPersistsIt() throws Exception {
        ProviderRegistry registry = registry(false);

        registry.add(docs());

        assertThat(registry.get("docs").getUrl()).isEqualTo("https://docs.example.com/mcp");
        assertThat(registry.get("docs").isBuiltIn()).isFalse();
        assertThat(readFile().path("mcpServers").path("docs").path("transport").asText())
                .isEqualTo("streamable_http");
        assertThat(events).containsExactly(new ProviderChangedEvent("docs", ProviderChangedEvent.Change.ADDED));
    }

    @Test
    void add_headerPlaceholder_isPersistedLiterally() throws Exception {
        ProviderRegistry registry = registry(false);

        registry.add(docs());

        assertThat(readFile().path("mcpServers").path("docs").path("headers").path("Authorization").asText())
                .isEqualTo("Bearer ${API_KEY}");
    }

    @Test
    void add_duplicateId_rejected() {
        ProviderRegistry registry = registry(false);
        registry.add(docs());

        assertThatThrownBy(() -> registry.add(docs()))
                .isInstanceOf(ProviderValidationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void add_invalidConfig_neverPersisted() {
        ProviderRegistry registry = registry(false);
        ProviderConfig invalid = ProviderConfig.builder().id("bad").transport(TransportKind.STDIO).build();

        assertThatThrownBy(() -> registry.add(invalid)).isInstanceOf(ProviderValidationException.class);

        assertThat(Files.exists(configFile)).isFalse();
        assertThat(registry.find("bad")).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void update_thenGet_reflectsPatch() throws Exception {
        ProviderRegistry registry = registry(false);
        registry.add(docs());
        events.clear();

        registry.update("docs", ProviderPatch.builder().timeoutSeconds(90).description("API docs").build());

        assertThat(registry.get("docs").getTimeoutSeconds()).isEqualTo(90);
        assertThat(registry.get("docs").getDescription()).isEqualTo("API docs");
        assertThat(readFile().path("mcpServers").path("docs").path("timeout").asInt()).isEqualTo(90);
        assertThat(events).containsExactly(new ProviderChangedEvent("docs", ProviderChangedEvent.Change.UPDATED));
    }

    @Test
    void update_invalidResult_leavesPreviousConfig() {
        ProviderRegistry registry = registry(false);
        registry.add(docs());

        assertThatThrownBy(() -> registry.update("docs", ProviderPatch.builder().transport(TransportKind.STDIO).build()))
                .isInstanceOf(ProviderValidationException.class);

        assertThat(registry.get("docs").getTransport()).isEqualTo(TransportKind.STREAMABLE_HTTP);
    }

    @Test
    void update_unknownProvider_throwsNotFound() {
        ProviderRegistry registry = registry(false);

        assertThatThrownBy(() -> registry.update("nope", ProviderPatch.builder().name("x").build()))
                .isInstanceOf(ProviderNotFoundException.class);
    }

    @Test
    void remove_userProvider_goneFromRegistryAndFile() throws Exception {
        ProviderRegistry registry = registry(false);
        registry.add(docs());

        registry.remove("docs");

        assertThat(registry.find("docs")).isEmpty();
        assertThat(readFile().path("mcpServers").has("docs")).isFalse();
    }

    @Test
    void remove_builtIn_rejectedAndStillPresent() {
        ProviderRegistry registry = registry(true);

        assertThatThrownBy(() -> registry.remove("mssql")).isInstanceOf(ImmutableProviderException.class);
        assertThat(registry.get("mssql")).isNotNull();
    }

    @Test
    void setEnabled_builtIn_allowedAndOverridesDefault() {
        ProviderRegistry registry = registry(true);

        registry.setEnabled("mssql", false);

        assertThat(registry.get("mssql").isEnabled()).isFalse();
        assertThat(registry.get("mssql").isBuiltIn()).isTrue();
        assertThat(registry(true).get("mssql").isEnabled()).isFalse();
    }

    @Test
    void setEnabled_unchanged_publishesNothing() {
        ProviderRegistry registry = registry(false);
        registry.add(docs());
        events.clear();

        registry.setEnabled("docs", true);

        assertThat(events).isEmpty();
    }

    @Test
    void init_legacyEntries_inferTransport() throws Exception {
        Files.writeString(configFile, """
                {
                  "$schema": "./schema.json",
                  "mcpServers": {
                    "legacy-py": { "type": "python", "transport": "python", "command": "uv", "args": ["run", "server.py"] },
                    "no-transport": { "url": "http://localhost:9000/mcp" },
                    "legacy-http": { "transport": "http", "url": "http://localhost:9001/mcp" }
                  }
                }
                """);

        ProviderRegistry registry = registry(false);

        assertThat(registry.get("legacy-py").getTransport()).isEqualTo(TransportKind.STDIO);
        assertThat(registry.get("no-transport").getTransport()).isEqualTo(TransportKind.STREAMABLE_HTTP);
        assertThat(registry.get("legacy-http").getTransport()).isEqualTo(TransportKind.STREAMABLE_HTTP);
    }

    @Test
    void init_invalidEntry_skippedOthersLoaded() throws Exception {
        Files.writeString(configFile, """
                {"mcpServers": {
                  "broken": { "transport": "stdio" },
                  "unknown-kind": { "transport": "carrier-pigeon", "url": "http://x" },
                  "ok": { "transport": "sse", "url": "http://localhost:9000/sse" }
                }}
                """);

        ProviderRegistry registry = registry(false);

        assertThat(registry.list()).extracting(ProviderConfig::getId).containsExactly("ok");
    }

    @Test
    void init_corruptFile_fails() throws Exception {
        Files.writeString(configFile, "{ not json");

        assertThatThrownBy(() -> registry(false)).isInstanceOf(AgentException.class);
    }

    @Test
    void save_preservesOtherTopLevelKeys() throws Exception {
        Files.writeString(configFile, """
                {"_documentation": "keep me", "mcpServers": {}}
                """);
        ProviderRegistry registry = registry(false);

        registry.add(docs());

        assertThat(readFile().path("_documentation").asText()).isEqualTo("keep me");
        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("mcp_config.json");
        }
    }

    @Test
    void reload_externalEdit_reportsChangedProviders() throws Exception {
        ProviderRegistry registry = registry(false);
        registry.add(docs());
        registry.add(ProviderConfig.builder().id("local").transport(TransportKind.STDIO).command("node").build());
        events.clear();

        Files.writeString(configFile, """
                {"mcpServers": {
                  "docs": { "transport": "streamable_http", "url": "https://docs.example.com/v2/mcp" },
                  "fresh": { "transport": "sse", "url": "http://localhost:9000/sse" }
                }}
                """);

        List<String> changed = registry.reload();

        assertThat(changed).containsExactlyInAnyOrder("docs", "fresh", "local");
        assertThat(registry.get("docs").getUrl()).isEqualTo("https://docs.example.com/v2/mcp");
        assertThat(registry.find("local")).isEmpty();
        assertThat(events).contains(new ProviderChangedEvent("local", ProviderChangedEvent.Change.REMOVED));
    }

    @Test
    void reload_unchangedFile_reportsNothing() {
        ProviderRegistry registry = registry(false);
        registry.add(docs());

        assertThat(registry.reload()).isEmpty();
    }
}
