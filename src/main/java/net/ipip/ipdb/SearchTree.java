package net.ipip.ipdb;

import java.net.InetAddress;

/**
 * The binary search tree of a database. Node {@code i} occupies
 * {@link #NODE_BYTE_SIZE} bytes at {@code i * 8}: the 32-bit record followed
 * for a 0 bit, then the one followed for a 1 bit. A record below the node
 * count is another node; any other value points out of the tree.
 *
 * <p>Every address is walked as a 128-bit one. IPv4 addresses live below the
 * IPv4-mapped prefix {@code ::ffff:0:0/96}, so their walk starts at the node
 * found at the end of that prefix.
 */
final class SearchTree {
    static final int NODE_BYTE_SIZE = 8;

    private static final int RECORD_BYTE_SIZE = 4;
    private static final int IPV4_PREFIX_BITS = 96;
    // the ::ffff:0:0/96 prefix is 80 zero bits followed by 16 one bits
    private static final int IPV4_PREFIX_ZERO_BITS = 80;

    private final Buffer buffer;
    private final long nodeCount;
    private final long ipV4Start;

    /**
     * @param buffer    the search tree and data section. Its capacity must be
     *                  at least {@code nodeCount * 8}.
     * @param nodeCount the number of nodes in the tree
     */
    SearchTree(Buffer buffer, long nodeCount) {
        this.buffer = buffer;
        this.nodeCount = nodeCount;
        this.ipV4Start = this.findIpV4StartNode();
    }

    long nodeCount() {
        return nodeCount;
    }

    long ipV4Start() {
        return ipV4Start;
    }

    private long findIpV4StartNode() {
        long node = 0;
        for (int i = 0; i < IPV4_PREFIX_BITS && node < nodeCount; i++) {
            node = this.readNode(node, i >= IPV4_PREFIX_ZERO_BITS ? 1 : 0);
        }
        return node;
    }

    /**
     * Walks the tree for {@code address}.
     *
     * @param address the address, 4 or 16 bytes long
     * @return the record the walk ended on, always greater than the node count
     * @throws AddressNotFoundException if the walk did not end on a data record
     */
    long search(InetAddress address) throws AddressNotFoundException {
        byte[] ip = address.getAddress();
        int bitCount = ip.length * 8;
        long node = bitCount == 32 ? this.ipV4Start : 0;

        for (int i = 0; i < bitCount && node < nodeCount; i++) {
            int b = 0xFF & ip[i / 8];
            int bit = 1 & (b >> 7 - (i % 8));

            // bit:0 -> left record.
            // bit:1 -> right record.
            node = this.readNode(node, bit);
        }

        // a record equal to the node count marks an empty branch
        if (node > nodeCount) {
            return node;
        }
        throw new AddressNotFoundException(
            "The address " + address.getHostAddress() + " is not in the database");
    }

    /*
     * Callers must ensure node < nodeCount. Together with the size check done
     * when loading the metadata, this keeps every read inside the tree.
     */
    long readNode(long node, int index) {
        return buffer.getUnsignedInt(node * NODE_BYTE_SIZE + (long) index * RECORD_BYTE_SIZE);
    }
}
