package net.ipip.ipdb;

/**
 * Signals an IPv4 lookup in a database without IPv4 data.
 */
public class IPv4NotSupportedException extends UnsupportedIpVersionException {

    private static final long serialVersionUID = 1L;

    IPv4NotSupportedException() {
        super("The database does not support IPv4 lookups");
    }

    @Override
    public int getIpVersion() {
        return 4;
    }
}
