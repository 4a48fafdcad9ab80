package net.ipip.ipdb;

/**
 * The base class of the errors a single lookup can report. Lookup errors
 * never affect the state of the reader.
 */
public class LookupException extends Exception {

    private static final long serialVersionUID = -1923104535309628719L;

    /**
     * @param message A message describing the reason why the exception was thrown.
     */
    public LookupException(String message) {
        super(message);
    }

    /**
     * @param message A message describing the reason why the exception was thrown.
     * @param cause   The cause of the exception.
     */
    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
