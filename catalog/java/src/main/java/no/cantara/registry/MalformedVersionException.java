package no.cantara.registry;

/**
 * Thrown when a version string or version constraint cannot be parsed.
 * Callers reject the query or the package; no default is substituted.
 */
public class MalformedVersionException extends IllegalArgumentException {

    private final String input;

    public MalformedVersionException(String input, Throwable cause) {
        super("Invalid version '" + input + "': " + (cause != null ? cause.getMessage() : "unparsable"), cause);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
