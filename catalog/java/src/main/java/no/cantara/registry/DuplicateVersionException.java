package no.cantara.registry;

/**
 * Two manifests claim the same package name and version. The catalog
 * snapshot being built is rejected as a whole.
 */
public class DuplicateVersionException extends IllegalStateException {

    private final String packageName;
    private final String version;

    public DuplicateVersionException(String packageName, String version, String existingPath, String duplicatePath) {
        super("package '" + packageName + "' version " + version + " is declared twice: "
                + existingPath + " and " + duplicatePath);
        this.packageName = packageName;
        this.version = version;
    }

    public String packageName() {
        return packageName;
    }

    public String version() {
        return version;
    }
}
