package no.cantara.registry;

import no.cantara.registry.model.Package;
import no.cantara.registry.model.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Applies the active predicates of a {@link Query} to a {@link PackageIndex}.
 *
 * <p>Predicates run in a fixed order, cheapest and most restrictive first: visibility,
 * category, platform compatibility, name. Filtering happens before version resolution,
 * so an older version that matches survives even when the newest one does not.
 */
public final class PackageFilter {

    private PackageFilter() {}

    /**
     * @return every package passing all active predicates, in index order
     */
    public static List<Package> filter(PackageIndex index, Query query) {
        List<Predicate<Package>> predicates = predicates(query);
        List<Package> result = new ArrayList<>();
        for (Package p : index.packages()) {
            if (matchesAll(predicates, p)) {
                result.add(p);
            }
        }
        return result;
    }

    static List<Predicate<Package>> predicates(Query query) {
        List<Predicate<Package>> predicates = new ArrayList<>(4);
        if (!query.internal()) {
            predicates.add(p -> !p.internal());
        }
        if (query.category() != null) {
            String category = query.category();
            predicates.add(p -> p.hasCategory(category));
        }
        if (query.platformVersion() != null) {
            var platformVersion = query.platformVersion();
            predicates.add(p -> p.isCompatibleWith(platformVersion));
        }
        if (query.packageName() != null) {
            String name = query.packageName();
            predicates.add(p -> p.name().equals(name));
        }
        return predicates;
    }

    private static boolean matchesAll(List<Predicate<Package>> predicates, Package p) {
        for (Predicate<Package> predicate : predicates) {
            if (!predicate.test(p)) {
                return false;
            }
        }
        return true;
    }
}
