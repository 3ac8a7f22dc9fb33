package no.cantara.registry.model;

import java.util.List;

/**
 * The ordered outcome of a catalog search. Never null; possibly empty.
 */
public record ResultSet(List<PackageSummary> entries) {

    public ResultSet {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static ResultSet empty() {
        return new ResultSet(List.of());
    }

    public int size() { return entries.size(); }
    public boolean isEmpty() { return entries.isEmpty(); }
}
