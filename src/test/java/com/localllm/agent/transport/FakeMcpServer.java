package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Scripted MCP server for transport tests. HTTP tests call {@link #handle}
 * in-process; the stdio test launches {@link #main} as a child JVM.
 */
public final class FakeMcpServer {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final String SECOND_PAGE = "page-2";

    private FakeMcpServer() {
    }

    public static void main(String[] args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.err.println("fake mcp server starting");
        out.println("fake mcp server banner");

        String line;
        while ((line = in.readLine()) != null) {
            JsonNode request = MAPPER.readTree(line);
            if ("exit".equals(request.path("params").path("name").asText())) {
                System.exit(3);
            }
            ObjectNode response = handle(request);
            if (response != null) {
                out.println(MAPPER.writeValueAsString(response));
            }
        }
    }

    /** Returns null for notifications. */
    static ObjectNode handle(JsonNode request) {
        if (!request.has("id")) {
            return null;
        }
        ObjectNode response = MAPPER.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", request.get("id"));
        JsonNode params = request.path("params");

        switch (request.path("method").asText()) {
            case "initialize" -> {
                ObjectNode result = response.putObject("result");
                result.put("protocolVersion", params.path("protocolVersion").asText());
                result.putObject("capabilities").putObject("tools");
                result.putObject("serverInfo").put("name", "fake").put("version", "1.0");
            }
            case "tools/list" -> listTools(params, response.putObject("result"));
            case "tools/call" -> callTool(params, response);
            default -> response.putObject("error")
                    .put("code", -32601)
                    .put("message", "Method not found: " + request.path("method").asText());
        }
        return response;
    }

    private static void listTools(JsonNode params, ObjectNode result) {
        ArrayNode tools = result.putArray("tools");
        if (SECOND_PAGE.equals(params.path("cursor").asText(null))) {
            tool(tools, "broken", "Always answers with a protocol error");
            tool(tools, "env", "Reads an environment variable of the server process");
            tool(tools, "slow", "Sleeps before answering");
            tool(tools, "exit", "Terminates the server");
        } else {
            tool(tools, "echo", "Echoes its text argument");
            tool(tools, "fail", "Reports a tool-level error");
            result.put("nextCursor", SECOND_PAGE);
        }
    }

    private static void tool(ArrayNode tools, String name, String description) {
        ObjectNode tool = tools.addObject();
        tool.put("name", name);
        tool.put("description", description);
        ObjectNode schema = tool.putObject("inputSchema");
        schema.put("type", "object");
        schema.putObject("properties").putObject("text").put("type", "string");
    }

    private static void callTool(JsonNode params, ObjectNode response) {
        JsonNode arguments = params.path("arguments");
        switch (params.path("name").asText()) {
            case "echo" -> text(response, arguments.path("text").asText(), false);
            case "fail" -> text(response, "boom", true);
            case "env" -> {
                String value = System.getenv(arguments.path("name").asText());
                text(response, value != null ? value : "<unset>", false);
            }
            case "slow" -> {
                try {
                    Thread.sleep(arguments.path("ms").asLong(3000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                text(response, "done", false);
            }
            case "broken" -> response.putObject("error").put("code", -32602).put("message", "Invalid params");
            default -> response.putObject("error").put("code", -32601).put("message", "Unknown tool");
        }
    }

    private static void text(ObjectNode response, String text, boolean isError) {
        ObjectNode result = response.putObject("result");
        result.putArray("content").addObject().put("type", "text").put("text", text);
        result.put("isError", isError);
    }
}
