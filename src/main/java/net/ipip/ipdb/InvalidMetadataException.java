package net.ipip.ipdb;

/**
 * Signals that the metadata header of the database is malformed or
 * inconsistent.
 */
public class InvalidMetadataException extends InvalidDatabaseException {

    private static final long serialVersionUID = 2817265386203715931L;

    InvalidMetadataException(String message) {
        super(message);
    }

    InvalidMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
