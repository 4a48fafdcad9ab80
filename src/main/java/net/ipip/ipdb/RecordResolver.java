package net.ipip.ipdb;

/**
 * Turns a record pointer found in the search tree into the bytes of the
 * record it points to. Records are stored as a 16-bit length followed by that
 * many bytes.
 */
final class RecordResolver {
    private static final int LENGTH_BYTE_SIZE = 2;

    private final Buffer buffer;
    private final long nodeCount;
    private final long searchTreeSize;

    RecordResolver(Buffer buffer, long nodeCount) {
        this.buffer = buffer;
        this.nodeCount = nodeCount;
        this.searchTreeSize = nodeCount * SearchTree.NODE_BYTE_SIZE;
    }

    Buffer resolve(long pointer) throws InvalidDatabaseException {
        long resolved = (pointer - this.nodeCount) + this.searchTreeSize;
        long capacity = buffer.capacity();

        if (resolved + LENGTH_BYTE_SIZE > capacity) {
            throw new InvalidDatabaseException(
                "The IPDB file's search tree is corrupt: "
                    + "contains pointer larger than the database.");
        }

        int size = buffer.getUnsignedShort(resolved);
        if (resolved + LENGTH_BYTE_SIZE + size > capacity) {
            throw new InvalidDatabaseException(
                "The IPDB file's data section is corrupt: record of " + size
                    + " bytes at offset " + resolved + " extends past the end of the database.");
        }
        return buffer.slice(resolved + LENGTH_BYTE_SIZE, size);
    }
}
