package no.cantara.registry;

import no.cantara.registry.model.Dataset;
import no.cantara.registry.model.Icon;
import no.cantara.registry.model.Package;
import no.cantara.registry.model.Stream;
import no.cantara.registry.model.VariableDefinition;
import no.cantara.registry.model.Version;
import no.cantara.registry.model.VersionConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a package tree laid out as {@code {root}/{name}/{version}/manifest.yml}, with
 * datasets under {@code {package}/dataset/{dataset}/manifest.yml}.
 */
public final class PackageLoader {

    private static final Logger log = LoggerFactory.getLogger(PackageLoader.class);

    public static final String MANIFEST = "manifest.yml";
    public static final String DATASET_DIR = "dataset";

    private PackageLoader() {}

    /**
     * Loads every package below {@code root}. A package that fails to parse or validate is
     * reported in {@link LoadResult#failures()} and does not stop the others.
     *
     * @throws IOException if {@code root} itself cannot be listed
     */
    public static LoadResult loadAll(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Package directory not found: " + root);
        }
        List<Package> packages = new ArrayList<>();
        List<LoadResult.Failure> failures = new ArrayList<>();

        for (Path nameDir : sortedSubdirectories(root)) {
            for (Path versionDir : sortedSubdirectories(nameDir)) {
                try {
                    Package p = load(versionDir);
                    checkLayout(p, nameDir, versionDir);
                    packages.add(p);
                } catch (IOException | UncheckedIOException | YAMLException | IllegalArgumentException
                         | ClassCastException e) {
                    log.warn("Skipping package {}: {}", versionDir, e.getMessage());
                    failures.add(new LoadResult.Failure(versionDir, e.getMessage()));
                }
            }
        }
        log.debug("Loaded {} package(s) from {}, {} failure(s)", packages.size(), root, failures.size());
        return new LoadResult(packages, failures);
    }

    /**
     * Loads and validates one package directory.
     *
     * @throws DatasetValidationException  if a dataset breaks a structural rule
     * @throws MalformedVersionException   if the version or Kibana constraint is invalid
     */
    public static Package load(Path packageDir) throws IOException {
        Map<String, Object> data = parse(packageDir.resolve(MANIFEST));
        return fromMap(data, packageDir);
    }

    public static Map<String, Object> parse(Path manifest) throws IOException {
        if (!Files.isRegularFile(manifest)) {
            throw new IOException("manifest does not exist: " + manifest);
        }
        try (InputStream is = Files.newInputStream(manifest)) {
            Map<String, Object> data = yaml().load(is);
            if (data == null) {
                throw new IOException("manifest is empty: " + manifest);
            }
            return data;
        }
    }

    /**
     * Builds a package from parsed manifest data. When {@code basePath} is given, the
     * datasets below it are loaded and validated as well.
     */
    public static Package fromMap(Map<String, Object> data, Path basePath) throws IOException {
        String name = string(data, "name");
        String versionText = string(data, "version");
        if (versionText == null) {
            throw new IllegalArgumentException("package '" + name + "': 'version' is required");
        }
        Version version = Version.parse(versionText);

        String constraint = kibanaConstraint(data);
        List<?> iconItems = (List<?>) data.get("icons");

        List<Dataset> datasets = basePath != null ? loadDatasets(name, basePath) : List.of();

        return new Package(
                name,
                version,
                string(data, "title"),
                stringOrDefault(data, "description", ""),
                string(data, "type"),
                strings(data.get("categories")),
                constraint != null ? VersionConstraint.parse(constraint) : null,
                Boolean.TRUE.equals(data.get("internal")),
                iconItems != null
                        ? iconItems.stream().map(i -> parseIcon(mapping(i, "package '" + name + "': icon"))).toList()
                        : null,
                stringOrDefault(data, "release", Dataset.DEFAULT_RELEASE),
                datasets,
                basePath
        );
    }

    /**
     * Builds a dataset from parsed manifest data and applies the defaults for
     * {@code id} and {@code release}. No validation happens here.
     */
    public static Dataset datasetFromMap(Map<String, Object> data, String packageName, Path datasetDir) {
        String path = datasetDir.getFileName().toString();
        String id = string(data, "id");
        if (id == null || id.isBlank()) {
            id = packageName + "." + path;
        }
        List<?> streamItems = (List<?>) data.getOrDefault("streams", List.of());
        return new Dataset(
                id,
                string(data, "title"),
                string(data, "type"),
                stringOrDefault(data, "release", Dataset.DEFAULT_RELEASE),
                string(data, "ingest_pipeline"),
                streamItems != null
                        ? streamItems.stream().map(s -> parseStream(mapping(s, "dataset '" + path + "': stream"))).toList()
                        : List.of(),
                packageName,
                path,
                datasetDir
        );
    }

    private static List<Dataset> loadDatasets(String packageName, Path packageDir) throws IOException {
        Path datasetRoot = packageDir.resolve(DATASET_DIR);
        if (!Files.isDirectory(datasetRoot)) {
            return List.of();
        }
        List<Dataset> datasets = new ArrayList<>();
        for (Path datasetDir : sortedSubdirectories(datasetRoot)) {
            Path manifest = datasetDir.resolve(MANIFEST);
            if (!Files.isRegularFile(manifest)) {
                throw new IOException("manifest does not exist for dataset " + datasetDir.getFileName()
                        + " in package " + packageName);
            }
            Dataset dataset = datasetFromMap(parse(manifest), packageName, datasetDir);
            datasets.add(DatasetValidator.validate(dataset));
        }
        return datasets;
    }

    private static Stream parseStream(Map<String, Object> s) {
        List<?> vars = (List<?>) s.getOrDefault("vars", List.of());
        return new Stream(
                string(s, "input"),
                vars != null ? vars.stream().map(v -> VariableDefinition.fromMap(mapping(v, "stream variable"))).toList() : List.of(),
                string(s, "dataset"),
                string(s, "title"),
                string(s, "description")
        );
    }

    /** List items of streams, vars and icons must be YAML mappings. */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapping(Object item, String what) {
        if (!(item instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(what + " must be a mapping, got " + (item == null ? "null" : item));
        }
        return (Map<String, Object>) item;
    }

    private static Icon parseIcon(Map<String, Object> i) {
        return new Icon(string(i, "src"), string(i, "title"), string(i, "size"), string(i, "type"));
    }

    @SuppressWarnings("unchecked")
    private static String kibanaConstraint(Map<String, Object> data) {
        if (data.get("requirement") instanceof Map<?, ?> requirement
                && requirement.get("kibana") instanceof Map<?, ?> kibana) {
            return string((Map<String, Object>) kibana, "versions");
        }
        if (data.get("conditions") instanceof Map<?, ?> conditions) {
            if (conditions.get("kibana") instanceof Map<?, ?> kibana) {
                return string((Map<String, Object>) kibana, "version");
            }
            return string((Map<String, Object>) conditions, "kibana.version");
        }
        return null;
    }

    private static void checkLayout(Package p, Path nameDir, Path versionDir) {
        String dirName = nameDir.getFileName().toString();
        String dirVersion = versionDir.getFileName().toString();
        if (!p.name().equals(dirName)) {
            throw new IllegalArgumentException("package '" + p.name() + "' is stored under directory '" + dirName + "'");
        }
        if (!p.version().equals(Version.parse(dirVersion))) {
            throw new IllegalArgumentException("package '" + p.name() + "' version " + p.version()
                    + " is stored under directory '" + dirVersion + "'");
        }
    }

    private static List<Path> sortedSubdirectories(Path dir) throws IOException {
        try (var entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        }
    }

    private static String string(Map<String, Object> m, String key) {
        Object value = m.get(key);
        return value != null ? value.toString() : null;
    }

    private static String stringOrDefault(Map<String, Object> m, String key, String defaultValue) {
        String value = string(m, key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private static List<String> strings(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return value != null ? List.of(value.toString()) : List.of();
    }

    // Yaml instances are not thread-safe; SafeConstructor keeps YAML tags from instantiating Java types.
    private static Yaml yaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }
}
