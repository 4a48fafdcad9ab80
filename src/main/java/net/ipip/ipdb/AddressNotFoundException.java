package net.ipip.ipdb;

/**
 * Signals that the database holds no record for the queried address.
 */
public class AddressNotFoundException extends LookupException {

    private static final long serialVersionUID = 1L;

    AddressNotFoundException(String message) {
        super(message);
    }
}
