package no.cantara.registry.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.registry.model.CategoryCount;
import no.cantara.registry.model.Dataset;
import no.cantara.registry.model.Icon;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.PackageSummary;
import no.cantara.registry.model.ResultSet;
import no.cantara.registry.model.Stream;
import no.cantara.registry.model.VariableDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pure mapping functions: catalog model → JSON-ready maps and MCP schema types.
 * No I/O.
 */
public final class RegistryMapper {

    private RegistryMapper() {}

    // ── MIME tables ───────────────────────────────────────────────────────────────

    private static final Map<String, String> EXT_MIME = Map.ofEntries(
        Map.entry(".md",   "text/markdown"),
        Map.entry(".yaml", "application/yaml"),
        Map.entry(".yml",  "application/yaml"),
        Map.entry(".json", "application/json"),
        Map.entry(".txt",  "text/plain"),
        Map.entry(".png",  "image/png"),
        Map.entry(".jpg",  "image/jpeg"),
        Map.entry(".jpeg", "image/jpeg"),
        Map.entry(".svg",  "image/svg+xml")
    );

    private static final Set<String> BINARY_PREFIXES = Set.of("image/", "audio/", "video/");
    private static final Set<String> TEXT_IMAGES     = Set.of("image/svg+xml");

    // ── Tool names ────────────────────────────────────────────────────────────────

    public static final String SEARCH_TOOL     = "search";
    public static final String CATEGORIES_TOOL = "categories";
    public static final String PACKAGE_TOOL    = "package";
    public static final String FILE_TOOL       = "file";

    // ── MIME ──────────────────────────────────────────────────────────────────────

    public static String resolveMime(String path) {
        int dot = path.lastIndexOf('.');
        if (dot >= 0) {
            String mime = EXT_MIME.get(path.substring(dot).toLowerCase());
            if (mime != null) return mime;
        }
        return "text/plain";
    }

    public static boolean isBinaryMime(String mime) {
        if (mime == null || TEXT_IMAGES.contains(mime)) return false;
        return BINARY_PREFIXES.stream().anyMatch(mime::startsWith);
    }

    // ── Search results ────────────────────────────────────────────────────────────

    /** Keys are sorted so the rendered JSON does not depend on insertion order. */
    public static Map<String, Object> summaryMap(PackageSummary s) {
        Map<String, Object> m = new TreeMap<>();
        m.put("name",        s.name());
        m.put("description", Objects.requireNonNullElse(s.description(), ""));
        m.put("version",     s.version());
        m.put("type",        s.type());
        m.put("download",    s.download());
        m.put("path",        s.path());
        if (s.title() != null) {
            m.put("title", s.title());
        }
        if (s.icons() != null) {
            m.put("icons", s.icons().stream().map(RegistryMapper::iconMap).toList());
        }
        if (s.internal()) {
            m.put("internal", true);
        }
        return m;
    }

    public static List<Map<String, Object>> searchPayload(ResultSet resultSet) {
        return resultSet.entries().stream().map(RegistryMapper::summaryMap).toList();
    }

    public static List<Map<String, Object>> categoriesPayload(List<CategoryCount> categories) {
        List<Map<String, Object>> out = new ArrayList<>(categories.size());
        for (CategoryCount c : categories) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",    c.id());
            m.put("title", c.title());
            m.put("count", c.count());
            out.add(m);
        }
        return out;
    }

    // ── Package detail ────────────────────────────────────────────────────────────

    public static Map<String, Object> packageDetail(Package p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", p.name());
        putIfPresent(m, "title", p.title());
        m.put("version",     p.version().toString());
        m.put("release",     p.release());
        m.put("description", p.description());
        m.put("type",        p.type());
        m.put("categories",  p.categories());
        if (p.kibanaConstraint() != null) {
            m.put("requirement", Map.of("kibana", Map.of("versions", p.kibanaConstraint().expression())));
        }
        if (p.icons() != null) {
            m.put("icons", p.icons().stream().map(RegistryMapper::iconMap).toList());
        }
        if (p.internal()) {
            m.put("internal", true);
        }
        m.put("download", p.downloadPath());
        m.put("path",     p.catalogPath());
        if (!p.datasets().isEmpty()) {
            m.put("datasets", p.datasets().stream().map(RegistryMapper::datasetMap).toList());
        }
        return m;
    }

    static Map<String, Object> datasetMap(Dataset d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",      d.id());
        m.put("title",   d.title());
        m.put("release", d.release());
        m.put("type",    d.type());
        putIfPresent(m, "ingest_pipeline", d.ingestPipeline());
        if (!d.streams().isEmpty()) {
            m.put("streams", d.streams().stream().map(RegistryMapper::streamMap).toList());
        }
        m.put("package", d.packageName());
        m.put("path",    d.path());
        return m;
    }

    static Map<String, Object> streamMap(Stream s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("input", s.input());
        if (!s.vars().isEmpty()) {
            m.put("vars", s.vars().stream().map(RegistryMapper::varMap).toList());
        }
        putIfPresent(m, "dataset",     s.dataset());
        putIfPresent(m, "title",       s.title());
        putIfPresent(m, "description", s.description());
        return m;
    }

    static Map<String, Object> varMap(VariableDefinition v) {
        Map<String, Object> m = new LinkedHashMap<>();
        v.fields().forEach((k, value) -> m.put(k, value.toPlain()));
        return m;
    }

    static Map<String, Object> iconMap(Icon icon) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("src", icon.src());
        putIfPresent(m, "title", icon.title());
        putIfPresent(m, "size",  icon.size());
        putIfPresent(m, "type",  icon.type());
        return m;
    }

    // ── Tool definitions ──────────────────────────────────────────────────────────

    public static McpSchema.Tool searchTool() {
        Map<String, Object> properties = new LinkedHashMap<>(queryProperties());
        properties.put("package", stringProperty("Exact package name"));
        properties.put("all",     booleanProperty("Return every matching version instead of the newest per package"));
        return tool(SEARCH_TOOL,
            "Search the package catalog. Returns one entry per package, the newest matching version, "
                + "sorted by name and version.",
            properties, List.of());
    }

    public static McpSchema.Tool categoriesTool() {
        return tool(CATEGORIES_TOOL,
            "List categories with the number of packages carrying each, counting the newest version only.",
            queryProperties(), List.of());
    }

    public static McpSchema.Tool packageTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("name",    stringProperty("Package name"));
        properties.put("version", stringProperty("Package version"));
        return tool(PACKAGE_TOOL,
            "Full descriptor of one package version, including its datasets and streams.",
            properties, List.of("name", "version"));
    }

    public static McpSchema.Tool fileTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("name",    stringProperty("Package name"));
        properties.put("version", stringProperty("Package version"));
        properties.put("path",    stringProperty("File path relative to the package root, e.g. docs/README.md"));
        return tool(FILE_TOOL,
            "Contents of one file inside a package as an embedded resource carrying its MIME type. "
                + "Binary files are returned as base64 blobs.",
            properties, List.of("name", "version", "path"));
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static McpSchema.Tool tool(String name, String description,
                                       Map<String, Object> properties, List<String> required) {
        McpSchema.JsonSchema schema = new McpSchema.JsonSchema(
            "object",
            properties,
            required,
            false,  // additionalProperties
            null,   // defs
            null    // definitions
        );
        return McpSchema.Tool.builder()
            .name(name)
            .description(description)
            .inputSchema(schema)
            .build();
    }

    private static Map<String, Object> queryProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("kibana",   stringProperty("Kibana version packages must be compatible with, e.g. 7.6.0"));
        properties.put("category", stringProperty("Only packages carrying this category"));
        properties.put("internal", booleanProperty("Include internal packages"));
        return properties;
    }

    private static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    private static Map<String, Object> booleanProperty(String description) {
        return Map.of("type", "boolean", "description", description);
    }

    private static void putIfPresent(Map<String, Object> m, String key, String value) {
        if (value != null && !value.isBlank()) {
            m.put(key, value);
        }
    }
}
