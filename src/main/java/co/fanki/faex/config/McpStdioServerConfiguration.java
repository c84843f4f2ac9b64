package co.fanki.faex.config;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.analysis.application.EndpointAnalysisService;
import co.fanki.faex.analysis.application.report.DeclarationSuggester;
import co.fanki.faex.analysis.application.report.DeclarationSuggester.Suggestion;
import co.fanki.faex.analysis.application.report.JsonReportFormatter;
import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.shared.Preconditions;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Exposes the exception check as MCP tools over stdin/stdout.
 *
 * <p>Active when the {@code mcp.server.stdio} property is {@code true}.
 * Run it with {@code spring.main.web-application-type=none} so that no
 * web server is started; stdout carries JSON-RPC only, logs go to
 * stderr.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String CHECK_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "path": {
                  "type": "string",
                  "description": "Python file or directory to analyze"
                },
                "maxDepth": {
                  "type": "integer",
                  "description": "Call levels to follow (defaults to 3)"
                },
                "ignore": {
                  "type": "array",
                  "items": { "type": "string" },
                  "description": "Exception class names to leave out"
                },
                "verbose": {
                  "type": "boolean",
                  "description": "List endpoints without issues too"
                }
              },
              "required": ["path"]
            }
            """;

    private static final String SUGGEST_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "path": {
                  "type": "string",
                  "description": "Python file or directory to analyze"
                },
                "maxDepth": {
                  "type": "integer",
                  "description": "Call levels to follow (defaults to 3)"
                }
              },
              "required": ["path"]
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param analysisService the service behind both tools
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final EndpointAnalysisService analysisService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("faex", "0.1.0")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(checkTool(analysisService, objectMapper));
        server.addTool(suggestTool(analysisService, objectMapper));

        LOG.info("MCP stdio server initialized with 2 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification checkTool(
            final EndpointAnalysisService analysisService,
            final ObjectMapper objectMapper) {

        final JsonReportFormatter report =
                new JsonReportFormatter(objectMapper);

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("check_endpoint_exceptions",
                        "Check that every FastAPI endpoint under a path"
                                + " declares, in exceptions=[...], each"
                                + " exception it can raise directly or"
                                + " through the functions it calls."
                                + " Returns a JSON report with the"
                                + " undeclared exceptions per endpoint.",
                        CHECK_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final AnalysisResult result = analyze(
                                analysisService, arguments);
                        final boolean verbose = Boolean.TRUE.equals(
                                arguments.get("verbose"));
                        return textResult(report.format(result, verbose));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification suggestTool(
            final EndpointAnalysisService analysisService,
            final ObjectMapper objectMapper) {

        final DeclarationSuggester suggester = new DeclarationSuggester();

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("suggest_exception_declarations",
                        "Suggest the complete exceptions=[...] list for"
                                + " every FastAPI endpoint under a path"
                                + " that raises undeclared exceptions.",
                        SUGGEST_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final AnalysisResult result = analyze(
                                analysisService, arguments);
                        final List<Map<String, Object>> suggestions =
                                suggester.suggest(result).stream()
                                        .map(Suggestion::toMap)
                                        .toList();
                        return textResult(objectMapper.writeValueAsString(
                                suggestions));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    @SuppressWarnings("unchecked")
    private AnalysisResult analyze(
            final EndpointAnalysisService analysisService,
            final Map<String, Object> arguments) {
        final Path path = Preconditions.requirePath(
                (String) arguments.get("path"));
        final Integer maxDepth = arguments.get("maxDepth") instanceof Number n
                ? n.intValue() : null;
        final List<String> ignore = arguments.get("ignore") instanceof List<?>
                ? (List<String>) arguments.get("ignore") : null;

        final AnalysisOptions options = analysisService.defaultOptions()
                .override(maxDepth, ignore);
        return analysisService.analyze(path, options);
    }

    private CallToolResult textResult(final String text) {
        return new CallToolResult(
                List.of(new McpSchema.TextContent(text)), false);
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
