package no.cantara.registry.model;

/**
 * An icon shipped with a package. Only {@code src} is required.
 */
public record Icon(
        String src,
        String title,
        String size,
        String type
) {}
