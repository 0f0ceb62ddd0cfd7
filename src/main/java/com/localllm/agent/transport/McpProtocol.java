package com.localllm.agent.transport;

/** MCP method names and handshake constants. */
final class McpProtocol {

    static final String JSONRPC_VERSION = "2.0";
    static final String PROTOCOL_VERSION = "2025-03-26";
    static final String CLIENT_NAME = "research-agent";
    static final String CLIENT_VERSION = "0.1.0";

    static final String INITIALIZE = "initialize";
    static final String INITIALIZED = "notifications/initialized";
    static final String TOOLS_LIST = "tools/list";
    static final String TOOLS_CALL = "tools/call";

    static final String SESSION_HEADER = "Mcp-Session-Id";

    private McpProtocol() {
    }
}
