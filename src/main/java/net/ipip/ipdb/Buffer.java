package net.ipip.ipdb;

import java.nio.charset.Charset;

/**
 * A read-only view over binary database content.
 *
 * <p>All reads are absolute, so a single instance can be shared by any number
 * of threads. Multi-byte integers are big-endian.
 */
interface Buffer {
    /**
     * Returns the total capacity of this buffer in bytes.
     *
     * @return the capacity
     */
    long capacity();

    /**
     * Reads a byte at the given absolute index.
     *
     * @param index the index to read from
     * @return the byte value
     */
    byte get(long index);

    /**
     * Reads two bytes at the given index as an unsigned 16-bit integer.
     *
     * @param index the index to read from
     * @return the value, between 0 and 65535
     */
    int getUnsignedShort(long index);

    /**
     * Reads four bytes at the given index as an unsigned 32-bit integer.
     *
     * @param index the index to read from
     * @return the value, between 0 and 2^32 - 1
     */
    long getUnsignedInt(long index);

    /**
     * Creates a view of a region of this buffer. The content is shared, not
     * copied.
     *
     * @param index  the start of the region
     * @param length the length of the region
     * @return the view
     */
    Buffer slice(long index, long length);

    /**
     * Decodes the whole buffer into a string. Malformed input is replaced
     * rather than reported.
     *
     * @param charset the charset to decode with
     * @return the decoded string
     */
    String decode(Charset charset);
}
