package no.cantara.registry.mcp;

/** Thrown when request parameters cannot be turned into a query. */
public class BadRequestException extends IllegalArgumentException {
    public BadRequestException(String msg) { super(msg); }
    public BadRequestException(String msg, Throwable cause) { super(msg, cause); }
}
