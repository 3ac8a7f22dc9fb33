package no.cantara.registry.mcp;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Reads files inside a package directory with path-traversal protection.
 */
public final class PackageContent {

    private PackageContent() {}

    /** Thrown when the resolved path escapes the package directory. */
    public static class PathTraversalException extends IllegalArgumentException {
        public PathTraversalException(String msg) { super(msg); }
    }

    /** Thrown when the file does not exist. */
    public static class ResourceNotFoundException extends IllegalArgumentException {
        public ResourceNotFoundException(String msg) { super(msg); }
    }

    /**
     * Result from reading a package file.
     *
     * @param text   UTF-8 text content (binary=false), or base64 string (binary=true)
     * @param mime   MIME type derived from the file extension
     * @param binary true if the file was read as binary
     */
    public record ContentResult(String text, String mime, boolean binary) {}

    /**
     * @param packageDir   root directory of the package version
     * @param relativePath path of the file, relative to {@code packageDir}
     * @throws PathTraversalException    if relativePath escapes packageDir
     * @throws ResourceNotFoundException if the file does not exist
     * @throws IOException               on I/O error
     */
    public static ContentResult read(Path packageDir, String relativePath) throws IOException {
        Path root     = packageDir.toRealPath();
        Path resolved = root.resolve(relativePath).normalize();

        if (!resolved.startsWith(root)) {
            throw new PathTraversalException(
                "Path traversal attempt: '" + relativePath + "' escapes package directory");
        }

        if (!Files.isRegularFile(resolved)) {
            throw new ResourceNotFoundException("File not found: " + relativePath);
        }

        String mime = RegistryMapper.resolveMime(relativePath);
        if (RegistryMapper.isBinaryMime(mime)) {
            byte[] bytes = Files.readAllBytes(resolved);
            return new ContentResult(Base64.getEncoder().encodeToString(bytes), mime, true);
        }
        return new ContentResult(Files.readString(resolved), mime, false);
    }
}
