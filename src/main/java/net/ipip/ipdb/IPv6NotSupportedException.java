package net.ipip.ipdb;

/**
 * Signals an IPv6 lookup in a database without IPv6 data.
 */
public class IPv6NotSupportedException extends UnsupportedIpVersionException {

    private static final long serialVersionUID = 1L;

    IPv6NotSupportedException() {
        super("The database does not support IPv6 lookups");
    }

    @Override
    public int getIpVersion() {
        return 6;
    }
}
