package net.ipip.ipdb;

/**
 * Signals that the size of the database does not match the sizes declared in
 * its header.
 */
public class InvalidFileSizeException extends InvalidDatabaseException {

    private static final long serialVersionUID = -3520938641172946125L;

    InvalidFileSizeException(String message) {
        super(message);
    }
}
