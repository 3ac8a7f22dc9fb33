package no.cantara.registry.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.registry.Catalog;
import no.cantara.registry.LoadResult;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for RegistryServer: invoke buildTools() handlers directly,
 * without a real MCP transport.
 */
class RegistryServerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private RegistryServer.ToolSet tools;

    private static Path fixturePackages() {
        URL url = RegistryServerTest.class.getClassLoader().getResource("fixtures/packages");
        assertNotNull(url, "fixture tree not found");
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @BeforeEach void setUp() {
        Catalog catalog = Catalog.fromDirectory(fixturePackages());
        catalog.reload();
        tools = RegistryServer.buildTools(catalog);
    }

    private McpSchema.CallToolResult call(String tool, Map<String, Object> args) {
        return tools.handlers().get(tool).handle(args);
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    private static JsonNode json(McpSchema.CallToolResult result) throws Exception {
        assertFalse(result.isError(), () -> text(result));
        return JSON.readTree(text(result));
    }

    // ── tool list ─────────────────────────────────────────────────────────────────

    @Test void registersFourTools() {
        List<String> names = tools.tools().stream().map(McpSchema.Tool::name).toList();
        assertEquals(List.of("search", "categories", "package", "file"), names);
        assertEquals(tools.handlers().keySet(), Set.copyOf(names));
    }

    // ── search ────────────────────────────────────────────────────────────────────

    @Test void searchReturnsNewestVisibleVersions() throws Exception {
        JsonNode result = json(call("search", Map.of()));
        assertEquals(2, result.size());
        assertEquals("mysql", result.get(0).get("name").asText());
        assertEquals("1.2.0", result.get(0).get("version").asText());
        assertEquals("/package/mysql-1.2.0.tar.gz", result.get(0).get("download").asText());
        assertEquals("nginx", result.get(1).get("name").asText());
    }

    @Test void searchWithNullArgumentsUsesDefaults() throws Exception {
        assertEquals(2, json(call("search", null)).size());
    }

    @Test void searchHonoursKibanaVersion() throws Exception {
        JsonNode result = json(call("search", Map.of("kibana", "7.5.0")));
        assertEquals("1.0.0", result.get(0).get("version").asText());
    }

    @Test void searchAllAndInternal() throws Exception {
        JsonNode result = json(call("search", Map.of("all", "true", "internal", "true")));
        assertEquals(4, result.size());
        assertEquals("internal_tool", result.get(0).get("name").asText());
        assertTrue(result.get(0).get("internal").asBoolean());
    }

    @Test void searchWithoutMatchesIsEmptyArray() {
        McpSchema.CallToolResult result = call("search", Map.of("package", "apache"));
        assertFalse(result.isError());
        assertEquals("[]", text(result));
    }

    @Test void invalidKibanaVersionIsAnErrorResult() {
        McpSchema.CallToolResult result = call("search", Map.of("kibana", "not-a-version"));
        assertTrue(result.isError());
        assertTrue(text(result).startsWith("Error: invalid Kibana version"));
    }

    // ── categories ────────────────────────────────────────────────────────────────

    @Test void categoriesCountNewestVersions() throws Exception {
        JsonNode result = json(call("categories", Map.of()));
        assertEquals(3, result.size());
        assertEquals("datastore", result.get(0).get("id").asText());
        assertEquals(1, result.get(0).get("count").asInt());
    }

    @Test void categoriesIncludeInternalOnRequest() throws Exception {
        JsonNode result = json(call("categories", Map.of("internal", true)));
        assertEquals(4, result.size());
    }

    // ── package ───────────────────────────────────────────────────────────────────

    @Test void packageReturnsDetail() throws Exception {
        JsonNode result = json(call("package", Map.of("name", "nginx", "version", "2.0.0")));
        assertEquals("Nginx", result.get("title").asText());
        JsonNode access = result.get("datasets").get(0);
        assertEquals("nginx.access", access.get("id").asText());
        assertEquals("access", access.get("ingest_pipeline").asText());
        assertEquals(100, access.get("streams").get(0).get("vars").get(1).get("default").asInt());
    }

    @Test void packageShowsImplicitDefaultPipeline() throws Exception {
        JsonNode result = json(call("package", Map.of("name", "mysql", "version", "1.2.0")));
        assertEquals(">=7.6.0 <8.0.0", result.get("requirement").get("kibana").get("versions").asText());
        assertEquals("default", result.get("datasets").get(0).get("ingest_pipeline").asText());
    }

    @Test void packageRequiresVersion() {
        McpSchema.CallToolResult result = call("package", Map.of("name", "nginx"));
        assertTrue(result.isError());
        assertEquals("Error: 'version' is required", text(result));
    }

    @Test void unknownPackageIsAnErrorResult() {
        McpSchema.CallToolResult result = call("package", Map.of("name", "nginx", "version", "9.9.9"));
        assertTrue(result.isError());
        assertEquals("Error: package not found: nginx-9.9.9", text(result));
    }

    @Test void invalidPackageVersionIsAnErrorResult() {
        McpSchema.CallToolResult result = call("package", Map.of("name", "nginx", "version", "latest"));
        assertTrue(result.isError());
        assertTrue(text(result).startsWith("Error: invalid version 'latest'"));
    }

    // ── file ──────────────────────────────────────────────────────────────────────

    private static McpSchema.ResourceContents resource(McpSchema.CallToolResult result) {
        assertFalse(result.isError());
        return ((McpSchema.EmbeddedResource) result.content().get(0)).resource();
    }

    @Test void fileReturnsDocumentWithMime() {
        McpSchema.ResourceContents contents = resource(call("file",
            Map.of("name", "nginx", "version", "2.0.0", "path", "docs/README.md")));
        McpSchema.TextResourceContents text = assertInstanceOf(McpSchema.TextResourceContents.class, contents);
        assertEquals("text/markdown", text.mimeType());
        assertEquals("/package/nginx-2.0.0/docs/README.md", text.uri());
        assertTrue(text.text().contains("# Nginx Integration"));
    }

    @Test void fileReturnsBinaryAsBlob() {
        McpSchema.ResourceContents contents = resource(call("file",
            Map.of("name", "nginx", "version", "2.0.0", "path", "img/screenshot.png")));
        McpSchema.BlobResourceContents blob = assertInstanceOf(McpSchema.BlobResourceContents.class, contents);
        assertEquals("image/png", blob.mimeType());
        byte[] bytes = Base64.getDecoder().decode(blob.blob());
        assertEquals((byte) 0x89, bytes[0]);
        assertEquals((byte) 'P', bytes[1]);
    }

    @Test void fileRejectsTraversal() {
        McpSchema.CallToolResult result = call("file",
            Map.of("name", "nginx", "version", "2.0.0", "path", "../../mysql/1.0.0/manifest.yml"));
        assertTrue(result.isError());
        assertTrue(text(result).contains("escapes package directory"));
    }

    @Test void fileRequiresPath() {
        Map<String, Object> args = new HashMap<>(Map.of("name", "nginx", "version", "2.0.0"));
        McpSchema.CallToolResult result = call("file", args);
        assertTrue(result.isError());
        assertEquals("Error: 'path' is required", text(result));
    }

    @Test void missingFileIsAnErrorResult() {
        McpSchema.CallToolResult result = call("file",
            Map.of("name", "nginx", "version", "2.0.0", "path", "docs/CHANGELOG.md"));
        assertTrue(result.isError());
    }

    // ── reload ────────────────────────────────────────────────────────────────────

    @Test void handlersReadTheCurrentSnapshot() throws Exception {
        Deque<LoadResult> loads = new ArrayDeque<>(List.of(
            new LoadResult(List.of(pkg("1.0.0")), List.of()),
            new LoadResult(List.of(pkg("1.0.0"), pkg("1.1.0")), List.of())));
        Catalog catalog = new Catalog(loads::removeFirst);
        catalog.reload();
        RegistryServer.ToolSet ts = RegistryServer.buildTools(catalog);

        JsonNode before = JSON.readTree(text(ts.handlers().get("search").handle(Map.of())));
        assertEquals("1.0.0", before.get(0).get("version").asText());

        catalog.reload();
        JsonNode after = JSON.readTree(text(ts.handlers().get("search").handle(Map.of())));
        assertEquals("1.1.0", after.get(0).get("version").asText());
    }

    private static Package pkg(String version) {
        return new Package("apache", Version.parse(version), null, "Apache", "integration",
            List.of("web"), null, false, null, "beta", List.of(), null);
    }
}
