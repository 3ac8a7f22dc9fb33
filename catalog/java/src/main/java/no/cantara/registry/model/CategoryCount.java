package no.cantara.registry.model;

/**
 * Number of packages carrying one category.
 */
public record CategoryCount(
        String id,
        String title,
        long count
) {}
