package no.cantara.registry.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.registry.Catalog;
import no.cantara.registry.MalformedVersionException;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.Query;
import no.cantara.registry.model.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and returns a configured MCP server exposing a {@link Catalog} as tools.
 */
public final class RegistryServer {

    private static final Logger log = LoggerFactory.getLogger(RegistryServer.class);

    static final String SERVER_NAME    = "package-registry";
    static final String SERVER_VERSION = "0.1.0";

    private RegistryServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the tool list and per-name call handlers.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ToolSet(
        List<McpSchema.Tool> tools,
        Map<String, ToolHandler> handlers
    ) {}

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(Map<String, Object> arguments);
    }

    /**
     * Builds all tools and their handlers over {@code catalog}. Handlers read the
     * catalog's current snapshot on every call.
     */
    static ToolSet buildTools(Catalog catalog) {
        List<McpSchema.Tool>     tools    = new ArrayList<>();
        Map<String, ToolHandler> handlers = new LinkedHashMap<>();

        // ── search ────────────────────────────────────────────────────────────────
        tools.add(RegistryMapper.searchTool());
        handlers.put(RegistryMapper.SEARCH_TOOL, guarded(RegistryMapper.SEARCH_TOOL, args -> {
            Query query = QueryDecoder.decode(args);
            return text(CatalogJson.writeResultSet(catalog.search(query)));
        }));

        // ── categories ────────────────────────────────────────────────────────────
        tools.add(RegistryMapper.categoriesTool());
        handlers.put(RegistryMapper.CATEGORIES_TOOL, guarded(RegistryMapper.CATEGORIES_TOOL, args -> {
            Query query = QueryDecoder.decode(args);
            return text(CatalogJson.write(RegistryMapper.categoriesPayload(catalog.categories(query))));
        }));

        // ── package ───────────────────────────────────────────────────────────────
        tools.add(RegistryMapper.packageTool());
        handlers.put(RegistryMapper.PACKAGE_TOOL, guarded(RegistryMapper.PACKAGE_TOOL, args -> {
            Package p = requirePackage(catalog, args);
            return text(CatalogJson.write(RegistryMapper.packageDetail(p)));
        }));

        // ── file ──────────────────────────────────────────────────────────────────
        tools.add(RegistryMapper.fileTool());
        handlers.put(RegistryMapper.FILE_TOOL, guarded(RegistryMapper.FILE_TOOL, args -> {
            Package p = requirePackage(catalog, args);
            String path = requireArgument(args, "path");
            if (p.basePath() == null) {
                throw new PackageContent.ResourceNotFoundException("package has no files: " + p.key());
            }
            PackageContent.ContentResult content;
            try {
                content = PackageContent.read(p.basePath(), path);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return resource(p.catalogPath() + "/" + path, content);
        }));

        return new ToolSet(tools, handlers);
    }

    static Package requirePackage(Catalog catalog, Map<String, Object> args) {
        String name = requireArgument(args, "name");
        String versionText = requireArgument(args, "version");
        Version version;
        try {
            version = Version.parse(versionText);
        } catch (MalformedVersionException e) {
            throw new BadRequestException("invalid version '" + versionText + "'", e);
        }
        return catalog.find(name, version)
            .orElseThrow(() -> new PackageContent.ResourceNotFoundException(
                "package not found: " + name + "-" + versionText));
    }

    private static String requireArgument(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new BadRequestException("'" + key + "' is required");
        }
        return value.toString();
    }

    /** Request problems become error results; the server keeps running. */
    private static ToolHandler guarded(String toolName, ToolHandler handler) {
        return arguments -> {
            Map<String, Object> args = arguments != null ? arguments : Map.of();
            try {
                return handler.handle(args);
            } catch (IllegalArgumentException | UncheckedIOException e) {
                log.debug("Tool '{}' rejected {}: {}", toolName, args, e.getMessage());
                return error(e.getMessage());
            }
        };
    }

    private static McpSchema.CallToolResult text(String content) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(content)), false);
    }

    /** Binary files travel as base64 blobs; either way the MIME type goes along. */
    private static McpSchema.CallToolResult resource(String uri, PackageContent.ContentResult content) {
        McpSchema.ResourceContents contents = content.binary()
            ? new McpSchema.BlobResourceContents(uri, content.mime(), content.text(), null)
            : new McpSchema.TextResourceContents(uri, content.mime(), content.text(), null);
        return new McpSchema.CallToolResult(List.of(new McpSchema.EmbeddedResource(null, contents)), false);
    }

        private static McpSchema.CallToolResult error(String message) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent("Error: " + message)), true);
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Returns a configured MCP sync server answering from {@code catalog}.
     * The catalog should already be loaded.
     *
     * @param catalog   catalog whose current snapshot answers each call
     * @param transport MCP transport provider (e.g. StdioServerTransportProvider)
     */
    public static McpSyncServer createServer(Catalog catalog, McpServerTransportProvider transport) {
        ToolSet ts = buildTools(catalog);

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .capabilities(McpSchema.ServerCapabilities.builder()
                .tools(false)
                .build())
            .build();

        for (McpSchema.Tool tool : ts.tools()) {
            ToolHandler handler = ts.handlers().get(tool.name());
            server.addTool(McpServerFeatures.SyncToolSpecification.builder()
                .tool(tool)
                .callHandler((exchange, request) -> handler.handle(request.arguments()))
                .build());
        }

        log.info("Serving {} package(s) with tools {}", catalog.index().size(), ts.handlers().keySet());
        return server;
    }
}
