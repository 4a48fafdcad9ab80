package net.ipip.ipdb;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileChannel.MapMode;
import java.nio.charset.Charset;

/**
 * A {@link Buffer} implementation backed by a single {@link ByteBuffer}.
 *
 * <p>This implementation is limited to capacities up to
 * {@link Integer#MAX_VALUE}, as {@link ByteBuffer} cannot exceed that size.
 */
final class SingleBuffer implements Buffer {

    private final ByteBuffer buffer;

    private SingleBuffer(ByteBuffer buffer) {
        this.buffer = buffer;
    }

    /** {@inheritDoc} */
    @Override
    public long capacity() {
        return buffer.capacity();
    }

    /** {@inheritDoc} */
    @Override
    public byte get(long index) {
        return buffer.get((int) index);
    }

    /** {@inheritDoc} */
    @Override
    public int getUnsignedShort(long index) {
        return buffer.getShort((int) index) & 0xFFFF;
    }

    /** {@inheritDoc} */
    @Override
    public long getUnsignedInt(long index) {
        return buffer.getInt((int) index) & 0xFFFFFFFFL;
    }

    /** {@inheritDoc} */
    @Override
    public SingleBuffer slice(long index, long length) {
        if (index < 0 || length < 0 || index + length > capacity()) {
            throw new IndexOutOfBoundsException(
                "Slice [" + index + ", " + (index + length) + ") is outside of a buffer of "
                    + capacity() + " bytes");
        }
        return new SingleBuffer(buffer.slice((int) index, (int) length));
    }

    /** {@inheritDoc} */
    @Override
    public String decode(Charset charset) {
        // Charset.decode replaces malformed input and works on a duplicate
        return charset.decode(buffer.duplicate()).toString();
    }

    /**
     * Wraps the given byte array in a new read-only {@code SingleBuffer}.
     *
     * @param array the byte array to wrap
     * @return a new {@code SingleBuffer} backed by the array
     */
    static SingleBuffer wrap(byte[] array) {
        return new SingleBuffer(ByteBuffer.wrap(array).asReadOnlyBuffer());
    }

    /**
     * Creates a read-only {@code SingleBuffer} by memory-mapping the given
     * {@link FileChannel}.
     *
     * @param channel the file channel to map
     * @return a new read-only {@code SingleBuffer}
     * @throws IOException if an I/O error occurs
     */
    static SingleBuffer mapFromChannel(FileChannel channel) throws IOException {
        ByteBuffer buffer = channel.map(MapMode.READ_ONLY, 0, channel.size());
        return new SingleBuffer(buffer.asReadOnlyBuffer());
    }
}
