package no.cantara.registry;

import no.cantara.registry.model.Package;
import no.cantara.registry.model.Version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of every known package, keyed by name and then by version.
 *
 * <p>Rebuilt wholesale on each catalog load; there is no update API.
 */
public final class PackageIndex {

    private static final PackageIndex EMPTY = new PackageIndex(new TreeMap<>(), List.of());

    private final NavigableMap<String, NavigableMap<Version, Package>> byName;
    private final List<Package> packages;

    private PackageIndex(NavigableMap<String, NavigableMap<Version, Package>> byName, List<Package> packages) {
        this.byName = byName;
        this.packages = packages;
    }

    public static PackageIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index over {@code packages}.
     *
     * @throws DuplicateVersionException if two packages share name and version
     */
    public static PackageIndex build(Collection<Package> packages) {
        TreeMap<String, NavigableMap<Version, Package>> byName = new TreeMap<>();
        for (Package p : packages) {
            NavigableMap<Version, Package> versions = byName.computeIfAbsent(p.name(), n -> new TreeMap<>());
            Package existing = versions.putIfAbsent(p.version(), p);
            if (existing != null) {
                throw new DuplicateVersionException(p.name(), p.version().toString(),
                        String.valueOf(existing.basePath()), String.valueOf(p.basePath()));
            }
        }

        List<Package> ordered = new ArrayList<>(packages.size());
        byName.replaceAll((name, versions) -> {
            ordered.addAll(versions.values());
            return Collections.unmodifiableNavigableMap(versions);
        });
        return new PackageIndex(Collections.unmodifiableNavigableMap(byName), List.copyOf(ordered));
    }

    /** All packages, ordered by name and then by ascending version. */
    public List<Package> packages() {
        return packages;
    }

    public Set<String> names() {
        return byName.keySet();
    }

    /** Versions of one package, ascending; empty if the name is unknown. */
    public NavigableMap<Version, Package> versions(String name) {
        NavigableMap<Version, Package> versions = byName.get(name);
        return versions != null ? versions : Collections.emptyNavigableMap();
    }

    public Optional<Package> find(String name, Version version) {
        return Optional.ofNullable(versions(name).get(version));
    }

    public Optional<Package> latest(String name) {
        Map.Entry<Version, Package> last = versions(name).lastEntry();
        return last != null ? Optional.of(last.getValue()) : Optional.empty();
    }

    public int size() {
        return packages.size();
    }

    public boolean isEmpty() {
        return packages.isEmpty();
    }
}
