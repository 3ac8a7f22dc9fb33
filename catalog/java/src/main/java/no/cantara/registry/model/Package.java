package no.cantara.registry.model;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One published integration package at one specific version.
 *
 * <p>Instances are immutable and built once per catalog load.
 */
public record Package(
        String name,
        Version version,
        String title,
        String description,
        String type,
        List<String> categories,
        VersionConstraint kibanaConstraint,
        boolean internal,
        List<Icon> icons,
        String release,
        List<Dataset> datasets,
        Path basePath
) {
    /** Joins name and version in composite keys; never allowed in a package name. */
    public static final char KEY_SEPARATOR = '@';

    public Package {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("package: 'name' is required");
        }
        if (name.indexOf(KEY_SEPARATOR) >= 0) {
            throw new IllegalArgumentException("package '" + name + "': name must not contain '" + KEY_SEPARATOR + "'");
        }
        if (version == null) {
            throw new IllegalArgumentException("package '" + name + "': 'version' is required");
        }
        categories = categories != null ? List.copyOf(new LinkedHashSet<>(categories)) : List.of();
        icons = icons != null ? List.copyOf(icons) : null;
        datasets = datasets != null ? List.copyOf(datasets) : List.of();
    }

    public String downloadPath() {
        return "/package/" + name + "-" + version + ".tar.gz";
    }

    public String catalogPath() {
        return "/package/" + name + "-" + version;
    }

    /** Composite key {@code name@version}, as used for deterministic ordering. */
    public String key() {
        return name + KEY_SEPARATOR + version;
    }

    public boolean hasCategory(String category) {
        return categories.contains(category);
    }

    /** Packages without a Kibana constraint are compatible with every version. */
    public boolean isCompatibleWith(Version kibanaVersion) {
        return kibanaConstraint == null || kibanaConstraint.isSatisfiedBy(kibanaVersion);
    }

    public boolean isNewerThan(Package other) {
        return version.isNewerThan(other.version);
    }
}
