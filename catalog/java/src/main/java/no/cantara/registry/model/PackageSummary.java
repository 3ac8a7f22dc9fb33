package no.cantara.registry.model;

import java.util.List;

/**
 * The projection of a package returned by catalog searches.
 *
 * @param title    {@code null} when the package declares none
 * @param icons    {@code null} when the package declares none
 * @param internal {@code true} only for internal packages
 */
public record PackageSummary(
        String name,
        String description,
        String version,
        String type,
        String download,
        String path,
        String title,
        List<Icon> icons,
        boolean internal
) {
    public PackageSummary {
        icons = icons != null ? List.copyOf(icons) : null;
    }

    public static PackageSummary of(Package p) {
        return new PackageSummary(
                p.name(),
                p.description(),
                p.version().toString(),
                p.type(),
                p.downloadPath(),
                p.catalogPath(),
                p.title(),
                p.icons(),
                p.internal()
        );
    }
}
