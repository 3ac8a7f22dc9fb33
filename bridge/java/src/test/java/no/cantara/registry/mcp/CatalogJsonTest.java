package no.cantara.registry.mcp;

import no.cantara.registry.ResultFormatter;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.ResultSet;
import no.cantara.registry.model.Version;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Unit tests for CatalogJson: stable rendering of responses. */
class CatalogJsonTest {

    private static Package apache(String version) {
        return new Package("apache", Version.parse(version), null, "Apache", "integration",
            List.of("web"), null, false, null, "beta", List.of(), null);
    }

    @Test void emptyResultIsEmptyArray() {
        assertEquals("[]", CatalogJson.writeResultSet(ResultSet.empty()));
    }

    @Test void rendersSearchResultWithSortedKeys() {
        String json = CatalogJson.writeResultSet(ResultFormatter.format(List.of(apache("1.0.0"))));
        String expected = String.join("\n",
            "[",
            "  {",
            "    \"description\": \"Apache\",",
            "    \"download\": \"/package/apache-1.0.0.tar.gz\",",
            "    \"name\": \"apache\",",
            "    \"path\": \"/package/apache-1.0.0\",",
            "    \"type\": \"integration\",",
            "    \"version\": \"1.0.0\"",
            "  }",
            "]");
        assertEquals(expected, json);
    }

    @Test void missingDescriptionRendersAsEmptyString() {
        Package bare = new Package("apache", Version.parse("1.0.0"), null, null, "integration",
            List.of(), null, false, null, "beta", List.of(), null);
        String json = CatalogJson.writeResultSet(ResultFormatter.format(List.of(bare)));
        assertTrue(json.contains("\"description\": \"\","), json);
        assertFalse(json.contains("null"), json);
    }

    @Test void equalResultsRenderIdentically() {
        ResultSet a = ResultFormatter.format(List.of(apache("1.0.0"), apache("2.0.0")));
        ResultSet b = ResultFormatter.format(List.of(apache("2.0.0"), apache("1.0.0")));
        assertEquals(CatalogJson.writeResultSet(a), CatalogJson.writeResultSet(b));
    }

    @Test void nestedEmptyContainersStayCompact() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("list", List.of());
        m.put("map", Map.of());
        assertEquals("{\n  \"list\": [],\n  \"map\": {}\n}", CatalogJson.write(m));
    }

    @Test void arraysAreOneValuePerLine() {
        assertEquals("{\n  \"categories\": [\n    \"web\",\n    \"security\"\n  ]\n}",
            CatalogJson.write(Map.of("categories", List.of("web", "security"))));
    }
}
