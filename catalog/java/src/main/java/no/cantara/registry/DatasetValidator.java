package no.cantara.registry;

import no.cantara.registry.model.Dataset;
import no.cantara.registry.model.Stream;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks a dataset against its naming and ingest-pipeline rules.
 *
 * <p>Pipeline files live in {@code {dataset}/elasticsearch/ingest-pipeline}. A dataset that
 * declares no pipeline may ship none, or a {@code default.json}/{@code default.yml} which it
 * then implicitly references. A declared pipeline must have a matching json or yml file.
 */
public final class DatasetValidator {

    public static final String DEFAULT_PIPELINE = "default";
    private static final List<String> PIPELINE_EXTENSIONS = List.of(".json", ".yml");

    private DatasetValidator() {}

    public static Path pipelineDir(Path datasetBasePath) {
        return datasetBasePath.resolve("elasticsearch").resolve("ingest-pipeline");
    }

    /**
     * Validates a dataset against the pipeline files in its backing directory.
     *
     * @throws UncheckedIOException if the pipeline directory exists but cannot be listed
     */
    public static Dataset validate(Dataset dataset) {
        return validate(dataset, listPipelineFiles(dataset.basePath()));
    }

    /**
     * Validates a dataset against the given pipeline file names.
     *
     * @param pipelineFileNames file names (not paths) present in the pipeline directory
     * @return the dataset, with {@code ingestPipeline} set to {@code default} when implied
     * @throws DatasetValidationException on the first violated rule
     */
    public static Dataset validate(Dataset dataset, Collection<String> pipelineFileNames) {
        String id = dataset.id();
        if (id == null || id.isBlank()) {
            throw missing(String.valueOf(id), "id");
        }
        if (id.contains("-")) {
            throw new DatasetValidationException(DatasetValidationException.Kind.INVALID_IDENTIFIER, id,
                    "dataset '" + id + "': name is not allowed to contain '-'");
        }
        requireFields(dataset);

        Set<String> files = new TreeSet<>(pipelineFileNames);
        Dataset result = dataset;

        if (!result.hasIngestPipeline() && hasPipelineFile(files, DEFAULT_PIPELINE)) {
            result = result.withIngestPipeline(DEFAULT_PIPELINE);
        }

        if (!result.hasIngestPipeline() && !files.isEmpty()) {
            throw new DatasetValidationException(DatasetValidationException.Kind.UNUSED_PIPELINES, id,
                    "dataset '" + id + "': contains pipelines which are not used: " + files);
        }

        if (result.hasIngestPipeline() && !hasPipelineFile(files, result.ingestPipeline())) {
            throw new DatasetValidationException(DatasetValidationException.Kind.MISSING_PIPELINE, id,
                    "dataset '" + id + "': defined ingest_pipeline '" + result.ingestPipeline() + "' does not exist");
        }
        return result;
    }

    static Set<String> listPipelineFiles(Path datasetBasePath) {
        if (datasetBasePath == null) {
            return Set.of();
        }
        Path dir = pipelineDir(datasetBasePath);
        if (!Files.isDirectory(dir)) {
            return Set.of();
        }
        try (var entries = Files.list(dir)) {
            return entries.map(p -> p.getFileName().toString()).collect(Collectors.toCollection(TreeSet::new));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list pipelines in " + dir, e);
        }
    }

    private static boolean hasPipelineFile(Set<String> files, String pipeline) {
        return PIPELINE_EXTENSIONS.stream().anyMatch(ext -> files.contains(pipeline + ext));
    }

    private static void requireFields(Dataset dataset) {
        String id = dataset.id();
        if (dataset.title() == null || dataset.title().isBlank()) {
            throw missing(id, "title");
        }
        if (dataset.type() == null || dataset.type().isBlank()) {
            throw missing(id, "type");
        }
        if (dataset.streams().isEmpty()) {
            throw missing(id, "streams");
        }
        for (Stream stream : dataset.streams()) {
            if (stream.input() == null || stream.input().isBlank()) {
                throw missing(id, "streams.input");
            }
        }
    }

    private static DatasetValidationException missing(String id, String field) {
        return new DatasetValidationException(DatasetValidationException.Kind.MISSING_FIELD, id,
                "dataset '" + id + "': '" + field + "' is required");
    }
}
