package net.neurod3.exception;

import java.util.Objects;

/**
 * Thrown when the dataset catalog cannot be read: neither the unified view nor the
 * base table exists, or the database call itself failed.
 *
 * <p>Controllers translate this into {@code 503 Service Unavailable}.</p>
 */
public class CatalogUnavailableException extends RuntimeException {

    /**
     * Why the catalog could not be served.
     */
    public enum Reason {
        CATALOG_MISSING,
        DATABASE_ERROR
    }

    private final Reason reason;

    public CatalogUnavailableException(Reason reason, String message) {
        this(reason, message, null);
    }

    public CatalogUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }
}
