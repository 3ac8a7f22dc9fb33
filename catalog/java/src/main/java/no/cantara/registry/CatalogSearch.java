package no.cantara.registry;

import no.cantara.registry.model.CategoryCount;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.Query;
import no.cantara.registry.model.ResultSet;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs queries against one {@link PackageIndex} snapshot.
 */
public final class CatalogSearch {

    private CatalogSearch() {}

    /**
     * Filters, resolves and formats. A package-name filter does not disable resolution:
     * without {@code all} only the newest matching version of that package is returned.
     */
    public static ResultSet search(PackageIndex index, Query query) {
        List<Package> filtered = PackageFilter.filter(index, query);
        List<Package> selected = ResolutionSelector.select(filtered, query.all());
        return ResultFormatter.format(selected);
    }

    /**
     * Counts the newest visible version of each package per category. Only the visibility
     * and platform parts of {@code query} apply.
     */
    public static List<CategoryCount> categories(PackageIndex index, Query query) {
        Query visible = Query.builder()
                .platformVersion(query.platformVersion())
                .internal(query.internal())
                .build();
        List<Package> newest = ResolutionSelector.select(PackageFilter.filter(index, visible), false);

        Map<String, Long> counts = new TreeMap<>();
        for (Package p : newest) {
            for (String category : p.categories()) {
                counts.merge(category, 1L, Long::sum);
            }
        }
        return counts.entrySet().stream()
                .map(e -> new CategoryCount(e.getKey(), e.getKey(), e.getValue()))
                .toList();
    }
}
