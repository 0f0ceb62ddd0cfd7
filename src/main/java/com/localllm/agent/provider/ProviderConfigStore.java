package com.localllm.agent.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.localllm.agent.config.AgentProperties;
import com.localllm.agent.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON file persistence for provider configs.
 *
 * File layout: {@code {"mcpServers": {"<id>": {...}}}}. Other top-level
 * keys ($schema, _documentation, ...) are preserved on save.
 *
 * Writes go to a sibling temp file, are forced to disk, then atomically
 * renamed over the original, so a crash mid-write leaves either the old
 * or the new file, never a truncated one.
 */
@Component
@Slf4j
public class ProviderConfigStore {

    static final String SERVERS_KEY = "mcpServers";

    private final Path path;
    private final ObjectMapper objectMapper;

    public ProviderConfigStore(AgentProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getProviders().getConfigPath()), objectMapper);
    }

    public ProviderConfigStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads all entries in file order. Missing file means no user entries.
     * A corrupt file is an error: silently treating it as empty would make
     * the next save wipe the user's providers.
     */
    public Map<String, ProviderConfigEntry> load() {
        Map<String, ProviderConfigEntry> entries = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            log.info("Provider config file not found at {} - starting with built-ins only", path);
            return entries;
        }
        JsonNode root = readRoot();
        JsonNode servers = root.path(SERVERS_KEY);
        if (!servers.isObject()) {
            return entries;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = servers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                entries.put(field.getKey(), objectMapper.treeToValue(field.getValue(), ProviderConfigEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable provider entry [{}]: {}", field.getKey(), e.getOriginalMessage());
            }
        }
        log.debug("Loaded {} provider entries from {}", entries.size(), path);
        return entries;
    }

    public void save(Collection<ProviderConfig> providers) {
        ObjectNode root = Files.exists(path) ? readRoot() : objectMapper.createObjectNode();
        ObjectNode servers = objectMapper.createObjectNode();
        for (ProviderConfig provider : providers) {
            servers.set(provider.getId(), objectMapper.valueToTree(ProviderConfigEntry.from(provider)));
        }
        root.set(SERVERS_KEY, servers);

        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
                try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new AgentException("Failed to persist provider config to " + path, e);
        }
        log.debug("Saved {} providers to {}", providers.size(), path);
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to plain replace", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private ObjectNode readRoot() {
        try {
            JsonNode node = objectMapper.readTree(path.toFile());
            if (node == null || node.isMissingNode() || node.isNull()) {
                return objectMapper.createObjectNode();
            }
            if (!node.isObject()) {
                throw new AgentException("Provider config " + path + " must contain a JSON object");
            }
            return (ObjectNode) node;
        } catch (IOException e) {
            throw new AgentException("Failed to read provider config " + path, e);
        }
    }
}
