package com.localllm.agent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of one capability advertised by a provider.
 * Decouples the LLM serialization format from the MCP wire format.
 */
@Value
@Builder(toBuilder = true)
public class ToolDefinition {

    String name;

    @Builder.Default
    String description = "";

    @Builder.Default
    Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());

    /**
     * Converts to the OpenAI tool format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description != null ? description : "");
        function.put("parameters", inputSchema != null ? inputSchema : Map.of("type", "object"));
        return Map.of("type", "function", "function", function);
    }
}
