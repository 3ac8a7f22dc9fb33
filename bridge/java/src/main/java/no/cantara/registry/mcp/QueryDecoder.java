package no.cantara.registry.mcp;

import no.cantara.registry.MalformedVersionException;
import no.cantara.registry.model.Query;

import java.util.Map;
import java.util.Set;

/**
 * Turns request parameters into a {@link Query}.
 *
 * <pre>
 * kibana    Kibana version the packages must be compatible with
 * category  category filter
 * package   exact package name
 * all       return all versions instead of only the newest
 * internal  include internal packages
 * </pre>
 */
public final class QueryDecoder {

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "TRUE", "true", "True");

    private QueryDecoder() {}

    /**
     * @throws BadRequestException if {@code kibana} is not a valid version
     */
    public static Query decode(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return Query.defaults();
        }
        Query.Builder query = Query.builder();

        String kibana = text(params.get("kibana"));
        if (kibana != null) {
            try {
                query.platformVersion(kibana);
            } catch (MalformedVersionException e) {
                throw new BadRequestException("invalid Kibana version '" + kibana + "': " + e.getMessage(), e);
            }
        }

        return query
                .category(text(params.get("category")))
                .packageName(text(params.get("package")))
                .all(flag(params.get("all")))
                .internal(flag(params.get("internal")))
                .build();
    }

    /** Unparsable flags count as {@code false}. */
    static boolean flag(Object value) {
        if (value instanceof Boolean b) return b;
        String s = text(value);
        return s != null && TRUE_VALUES.contains(s);
    }

    private static String text(Object value) {
        if (value == null) return null;
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
