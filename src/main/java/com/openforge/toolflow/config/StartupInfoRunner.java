package com.openforge.toolflow.config;

import com.openforge.toolflow.agent.OrchestrationProperties;
import com.openforge.toolflow.llm.LlmProperties;
import com.openforge.toolflow.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Shared DataSource: opens a real JDBC connection and reads the server version
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Tool kinds: api timeout, function sandbox limits, database row cap
 *   - Orchestration defaults
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final ObjectProvider<DataSource> dataSource;
    private final LlmProperties              llmProperties;
    private final ToolProperties             toolProperties;
    private final OrchestrationProperties    orchestrationProperties;
    private final Environment                env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary    = llmProperties.primary();
        LlmProperties.ProviderConfig fallback   = llmProperties.fallback();
        LlmProperties.Resilience     resilience = llmProperties.resilience() != null
                ? llmProperties.resilience()
                : LlmProperties.Resilience.defaults();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Toolflow  -  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Shared database (database-kind tools)                   ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}
                ║    Fallback       : {}
                ║    Resilience     : attempts={}  circuit open wait={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    API timeout    : {} s
                ║    Function       : timeout={} ms  statements={}
                ║    Database       : max rows={}
                ║    Max tool calls : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),

                describe(primary),
                describe(fallback),
                resilience.maxAttempts(), resilience.openStateWait(),

                toolProperties.api().timeoutSeconds(),
                toolProperties.function().timeoutMs(),
                toolProperties.function().statementLimit(),
                toolProperties.database().maxRows(),
                orchestrationProperties.defaultMaxToolCalls()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describe(LlmProperties.ProviderConfig provider) {
        if (provider == null || !provider.isConfigured()) {
            return "(not configured)";
        }
        return "%s  [%s]  %s  key=%s".formatted(provider.name(), provider.model(), provider.baseUrl(),
                maskKey(provider.apiKey()));
    }

    private String probeDatabase() {
        DataSource shared = dataSource.getIfAvailable();
        if (shared == null) {
            return "✘ No shared DataSource: database tools need an explicit url";
        }
        try (Connection conn = shared.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key is empty.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
