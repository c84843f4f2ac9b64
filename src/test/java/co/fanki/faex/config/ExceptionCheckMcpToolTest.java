package co.fanki.faex.config;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.analysis.application.EndpointAnalysisService;
import co.fanki.faex.analysis.domain.SourceFileScanner;
import co.fanki.faex.analysis.domain.python.PythonSourceReader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * Integration tests for the exception check MCP tools.
 *
 * <p>Simulates an MCP client talking to the server over the stdio
 * transport through in-process pipes: initialize handshake, tool listing
 * and tool invocation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExceptionCheckMcpToolTest {

    @TempDir
    Path root;

    private McpSyncServer server;
    private EndpointAnalysisService analysisService;
    private PrintWriter clientWriter;
    private BufferedReader clientReader;
    private PipedOutputStream clientToServer;

    @BeforeEach
    void setUp() throws Exception {
        final ObjectMapper objectMapper = new ObjectMapper();

        Files.writeString(root.resolve("routes.py"), """
                def charge(order):
                    raise PaymentDeclined()

                @router.post("/orders", exceptions=[])
                async def create_order(order):
                    charge(order)
                """);

        clientToServer = new PipedOutputStream();
        final PipedInputStream serverIn =
                new PipedInputStream(clientToServer);
        final PipedOutputStream serverOut = new PipedOutputStream();
        final PipedInputStream serverToClient =
                new PipedInputStream(serverOut);

        analysisService = spy(new EndpointAnalysisService(
                new PythonSourceReader(), new SourceFileScanner(),
                AnalysisOptions.defaults()));

        final StdioServerTransportProvider transport =
                new StdioServerTransportProvider(
                        objectMapper, serverIn, serverOut);

        server = new McpStdioServerConfiguration()
                .mcpSyncServer(transport, analysisService, objectMapper);

        clientWriter = new PrintWriter(
                new OutputStreamWriter(clientToServer));
        clientReader = new BufferedReader(
                new InputStreamReader(serverToClient));

        performHandshake();
    }

    @AfterEach
    void tearDown() {
        try {
            clientToServer.close();
        } catch (final Exception ignored) {}
        if (server != null) {
            server.close();
        }
    }

    @Test
    void whenListingTools_shouldIncludeCheckAndSuggestTools()
            throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"tools/list\","
                + "\"params\":{}}");

        final JsonNode tools = readJson().path("result").path("tools");
        assertTrue(tools.isArray());

        boolean check = false;
        boolean suggest = false;
        for (final JsonNode tool : tools) {
            final String name = tool.path("name").asText();
            if ("check_endpoint_exceptions".equals(name)) {
                check = true;
                assertEquals("string", tool.path("inputSchema")
                        .path("properties").path("path").path("type")
                        .asText());
            }
            if ("suggest_exception_declarations".equals(name)) {
                suggest = true;
            }
        }
        assertTrue(check, "check_endpoint_exceptions must be registered");
        assertTrue(suggest, "suggest_exception_declarations must be"
                + " registered");
    }

    @Test
    void whenCallingCheck_givenRouterWithIssues_shouldReturnJsonReport()
            throws Exception {
        callTool(20, "check_endpoint_exceptions",
                "{\"path\":\"" + root + "\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());

        final JsonNode report = new ObjectMapper().readTree(
                result.path("content").get(0).path("text").asText());
        assertEquals(1, report.path("summary").path("total_undeclared")
                .asInt());
        assertEquals("PaymentDeclined", report.path("endpoints").get(0)
                .path("undeclared_exceptions").get(0).path("class")
                .asText());
    }

    @Test
    void whenCallingCheck_givenDepthAndIgnore_shouldPassThemToTheService()
            throws Exception {
        callTool(21, "check_endpoint_exceptions",
                "{\"path\":\"" + root + "\",\"maxDepth\":1,"
                        + "\"ignore\":[\"PaymentDeclined\"]}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        verify(analysisService).analyze(root,
                new AnalysisOptions(1, Set.of("PaymentDeclined")));
    }

    @Test
    void whenCallingSuggest_givenRouterWithIssues_shouldReturnDeclarations()
            throws Exception {
        callTool(22, "suggest_exception_declarations",
                "{\"path\":\"" + root + "\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());

        final JsonNode suggestions = new ObjectMapper().readTree(
                result.path("content").get(0).path("text").asText());
        assertEquals("create_order", suggestions.get(0).path("function")
                .asText());
        assertEquals("PaymentDeclined", suggestions.get(0)
                .path("suggested_exceptions").get(0).asText());
    }

    @Test
    void whenCallingCheck_givenMissingPath_shouldReturnError()
            throws Exception {
        callTool(30, "check_endpoint_exceptions",
                "{\"path\":\"" + root.resolve("missing") + "\"}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean(),
                "Missing path should return isError=true");
        assertTrue(result.path("content").get(0).path("text").asText()
                .startsWith("Error: Path does not exist"));
    }

    @Test
    void whenCallingSuggest_givenPathWithNulCharacter_shouldReturnError()
            throws Exception {
        callTool(31, "suggest_exception_declarations",
                "{\"path\":\"routes\\u0000.py\"}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean());
        assertTrue(result.path("content").get(0).path("text").asText()
                .startsWith("Error: Invalid path"));
    }

    // --- private helpers ---

    private void callTool(final int id, final String tool,
            final String arguments) {
        send("{\"jsonrpc\":\"2.0\",\"id\":" + id
                + ",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"" + tool + "\","
                + "\"arguments\":" + arguments + "}}");
    }

    private void performHandshake() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                + "\"params\":{\"protocolVersion\":\"2024-11-05\","
                + "\"capabilities\":{},"
                + "\"clientInfo\":{\"name\":\"test-client\","
                + "\"version\":\"1.0\"}}}");

        readJson();

        send("{\"jsonrpc\":\"2.0\","
                + "\"method\":\"notifications/initialized\","
                + "\"params\":{}}");

        Thread.sleep(50);
    }

    private void send(final String json) {
        clientWriter.println(json);
        clientWriter.flush();
    }

    private JsonNode readJson() throws Exception {
        final ObjectMapper objectMapper = new ObjectMapper();
        final CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return clientReader.readLine();
                    } catch (final Exception e) {
                        throw new RuntimeException(e);
                    }
                });
        final String line = future.get(5, TimeUnit.SECONDS);
        assertNotNull(line, "Server did not respond within 5 seconds");
        return objectMapper.readTree(line);
    }

}
