package net.ipip.ipdb;

/**
 * Signals that the queried address is not a valid IPv4 or IPv6 literal.
 */
public class InvalidAddressException extends LookupException {

    private static final long serialVersionUID = 1L;

    InvalidAddressException(String address, Throwable cause) {
        super("Invalid IP address: " + address, cause);
    }
}
