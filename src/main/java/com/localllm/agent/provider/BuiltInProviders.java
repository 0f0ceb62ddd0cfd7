package com.localllm.agent.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Providers that ship with the agent. They can be disabled or reconfigured
 * through the config file or the admin API, never removed.
 */
public final class BuiltInProviders {

    private static final Map<String, ProviderConfig> DEFAULTS = new LinkedHashMap<>();

    static {
        register(ProviderConfig.builder()
                .id("mssql")
                .name("MSSQL Server")
                .description("SQL Server database access")
                .transport(TransportKind.STDIO)
                .command("node")
                .args(List.of("${MCP_MSSQL_PATH}"))
                .env(Map.of(
                        "SERVER_NAME", "${SQL_SERVER_HOST}",
                        "DATABASE_NAME", "${SQL_DATABASE_NAME}",
                        "TRUST_SERVER_CERTIFICATE", "${SQL_TRUST_SERVER_CERTIFICATE:-true}",
                        "READONLY", "${MCP_MSSQL_READONLY:-false}"))
                .build());

        register(ProviderConfig.builder()
                .id("analytics-management")
                .name("Analytics Management")
                .description("Dashboard, widget, and saved query management")
                .transport(TransportKind.STDIO)
                .command("uv")
                .args(List.of("run", "python", "-m", "src.mcp.analytics_mcp_server"))
                .env(Map.of(
                        "BACKEND_DB_HOST", "${BACKEND_DB_HOST:-localhost}",
                        "BACKEND_DB_PORT", "${BACKEND_DB_PORT:-1434}",
                        "BACKEND_DB_NAME", "${BACKEND_DB_NAME:-LLM_BackEnd}"))
                .timeoutSeconds(60)
                .build());

        register(ProviderConfig.builder()
                .id("data-analytics")
                .name("Data Analytics")
                .description("Statistical analysis, aggregations, time series, anomaly detection")
                .transport(TransportKind.STDIO)
                .command("uv")
                .args(List.of("run", "python", "-m", "src.mcp.data_analytics_mcp_server"))
                .env(Map.of(
                        "SQL_SERVER_HOST", "${SQL_SERVER_HOST:-localhost}",
                        "SQL_SERVER_PORT", "${SQL_SERVER_PORT:-1433}",
                        "SQL_DATABASE_NAME", "${SQL_DATABASE_NAME:-ResearchAnalytics}"))
                .timeoutSeconds(60)
                .build());
    }

    private BuiltInProviders() {
    }

    private static void register(ProviderConfig config) {
        DEFAULTS.put(config.getId(), config.toBuilder().builtIn(true).build());
    }

    public static Map<String, ProviderConfig> defaults() {
        return Map.copyOf(DEFAULTS);
    }

    public static List<ProviderConfig> list() {
        return List.copyOf(DEFAULTS.values());
    }

    public static boolean isBuiltIn(String providerId) {
        return DEFAULTS.containsKey(providerId);
    }
}
