package no.cantara.registry.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A data-collection unit owned by exactly one package.
 *
 * @param id             dataset identifier, {@code {package}.{path}} unless declared
 * @param release        release stage, {@code beta} unless declared
 * @param ingestPipeline name of the ingest pipeline, or {@code null}
 * @param packageName    name of the owning package
 * @param path           name of the dataset directory inside the package
 * @param basePath       directory backing this dataset; never serialized
 */
public record Dataset(
        String id,
        String title,
        String type,
        String release,
        String ingestPipeline,
        List<Stream> streams,
        String packageName,
        String path,
        Path basePath
) {
    public static final String DEFAULT_RELEASE = "beta";

    public Dataset {
        streams = streams != null ? List.copyOf(streams) : List.of();
    }

    public Dataset withIngestPipeline(String pipeline) {
        return new Dataset(id, title, type, release, pipeline, streams, packageName, path, basePath);
    }

    public boolean hasIngestPipeline() {
        return ingestPipeline != null && !ingestPipeline.isBlank();
    }
}
