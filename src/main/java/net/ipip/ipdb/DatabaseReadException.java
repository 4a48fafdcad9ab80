package net.ipip.ipdb;

import java.io.IOException;

/**
 * Signals that the database source could not be read in full.
 */
public class DatabaseReadException extends IOException {

    private static final long serialVersionUID = 4420133251806498570L;

    DatabaseReadException(String message) {
        super(message);
    }

    DatabaseReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
