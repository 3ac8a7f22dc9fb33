package no.cantara.registry;

import no.cantara.registry.model.CategoryCount;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.Query;
import no.cantara.registry.model.ResultSet;
import no.cantara.registry.model.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the current {@link PackageIndex} snapshot and answers queries against it.
 *
 * <p>{@link #reload()} builds a complete new index before publishing it, so a query
 * running concurrently sees either the old or the new snapshot, never a mix.
 */
public final class Catalog {

    private static final Logger log = LoggerFactory.getLogger(Catalog.class);

    private final Supplier<LoadResult> loader;
    private final AtomicReference<PackageIndex> snapshot = new AtomicReference<>(PackageIndex.empty());

    public Catalog(Supplier<LoadResult> loader) {
        this.loader = loader;
    }

    public static Catalog fromDirectory(Path packagesDir) {
        return new Catalog(() -> {
            try {
                return PackageLoader.loadAll(packagesDir);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Loads all packages and replaces the snapshot.
     *
     * @return the load result, including per-package failures
     * @throws DuplicateVersionException if two packages share name and version; the previous
     *                                   snapshot stays in place
     * @throws UncheckedIOException      if the package tree cannot be read
     */
    public LoadResult reload() {
        LoadResult result = loader.get();
        PackageIndex index;
        try {
            index = PackageIndex.build(result.packages());
        } catch (DuplicateVersionException e) {
            log.error("Catalog rebuild rejected, keeping {} package(s): {}", snapshot.get().size(), e.getMessage());
            throw e;
        }
        snapshot.set(index);
        log.info("Catalog snapshot replaced: {} package(s), {} name(s), {} load failure(s)",
                index.size(), index.names().size(), result.failures().size());
        return result;
    }

    public PackageIndex index() {
        return snapshot.get();
    }

    public ResultSet search(Query query) {
        return CatalogSearch.search(snapshot.get(), query);
    }

    public List<CategoryCount> categories(Query query) {
        return CatalogSearch.categories(snapshot.get(), query);
    }

    public Optional<Package> find(String name, Version version) {
        return snapshot.get().find(name, version);
    }
}
