package no.cantara.registry.model;

import java.util.List;

/**
 * One input configuration of a dataset.
 */
public record Stream(
        String input,
        List<VariableDefinition> vars,
        String dataset,
        String title,
        String description
) {
    public Stream {
        vars = vars != null ? List.copyOf(vars) : List.of();
    }
}
