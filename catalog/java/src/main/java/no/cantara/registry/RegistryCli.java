package no.cantara.registry;

import java.nio.file.Path;

/**
 * Command-line check of a package tree.
 * Usage: java -jar package-registry.jar &lt;packages-dir&gt;
 */
public class RegistryCli {

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar package-registry.jar <packages-dir>");
            System.exit(1);
        }

        Path root = Path.of(args[0]);
        if (!root.toFile().isDirectory()) {
            System.err.println("Error: directory not found: " + root);
            System.exit(1);
        }

        LoadResult result;
        PackageIndex index;
        try {
            result = PackageLoader.loadAll(root);
            index = PackageIndex.build(result.packages());
        } catch (Exception e) {
            System.err.println("Load error: " + e.getMessage());
            System.exit(1);
            return;
        }

        if (result.hasFailures()) {
            System.err.println("Validation failed: " + result.failures().size() + " package(s) rejected:");
            result.failures().forEach(f -> System.err.println("  • " + f));
            System.exit(1);
        }

        System.out.printf("✓ %s is valid: %d package(s), %d version(s), %d dataset(s)%n",
                root,
                index.names().size(),
                index.size(),
                index.packages().stream().mapToInt(p -> p.datasets().size()).sum());
    }
}
