package net.ipip.ipdb;

/**
 * Signals that the database does not contain data for the IP version of the
 * queried address.
 */
public abstract class UnsupportedIpVersionException extends LookupException {

    private static final long serialVersionUID = 1L;

    UnsupportedIpVersionException(String message) {
        super(message);
    }

    /**
     * @return the IP version that is not supported, 4 or 6
     */
    public abstract int getIpVersion();
}
