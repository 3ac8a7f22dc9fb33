package no.cantara.registry;

import no.cantara.registry.model.Package;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of reading a package tree: the packages that loaded and one failure per
 * package that did not.
 */
public record LoadResult(List<Package> packages, List<Failure> failures) {

    public LoadResult {
        packages = List.copyOf(packages);
        failures = List.copyOf(failures);
    }

    /**
     * @param path    directory of the package that failed to load
     * @param message reason, suitable for display
     */
    public record Failure(Path path, String message) {
        @Override
        public String toString() {
            return path + ": " + message;
        }
    }

    public boolean hasFailures() { return !failures.isEmpty(); }
}
