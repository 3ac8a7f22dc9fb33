package no.cantara.registry;

import no.cantara.registry.model.Package;
import no.cantara.registry.model.Version;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which versions of each package are exposed.
 */
public final class ResolutionSelector {

    private ResolutionSelector() {}

    /**
     * @param filtered packages that passed the filter pipeline
     * @param all      keep every version instead of the newest per name
     * @return when {@code all}, the input without name+version duplicates; otherwise the
     *         newest version per name, the first one encountered winning a tie
     */
    public static List<Package> select(List<Package> filtered, boolean all) {
        if (all) {
            return distinct(filtered);
        }
        Map<String, Package> newest = new LinkedHashMap<>();
        for (Package p : filtered) {
            newest.merge(p.name(), p, (current, candidate) -> candidate.isNewerThan(current) ? candidate : current);
        }
        return new ArrayList<>(newest.values());
    }

    private static List<Package> distinct(List<Package> packages) {
        Set<Release> seen = new HashSet<>();
        List<Package> result = new ArrayList<>(packages.size());
        for (Package p : packages) {
            if (seen.add(new Release(p.name(), p.version()))) {
                result.add(p);
            }
        }
        return result;
    }

    private record Release(String name, Version version) {}
}
