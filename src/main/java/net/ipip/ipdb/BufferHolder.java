package net.ipip.ipdb;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import net.ipip.ipdb.Reader.FileMode;

/**
 * Loads the full content of a database into a read-only {@link Buffer}.
 */
final class BufferHolder {
    private final Buffer buffer;

    // Reasonable I/O buffer size for reading from InputStream.
    private static final int IO_BUFFER_SIZE = 16 * 1024;

    BufferHolder(File database, FileMode mode) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(database, "r");
             FileChannel channel = file.getChannel()) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new InvalidFileSizeException("The database " + database.getName()
                    + " is " + size + " bytes, which exceeds the supported maximum of "
                    + Integer.MAX_VALUE + " bytes.");
            }
            if (mode == FileMode.MEMORY_MAPPED) {
                this.buffer = SingleBuffer.mapFromChannel(channel);
                return;
            }
            ByteBuffer buffer = ByteBuffer.allocate((int) size);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) == -1) {
                    throw new DatabaseReadException("Unable to read "
                        + database.getName()
                        + " into memory. Unexpected end of stream.");
                }
            }
            this.buffer = SingleBuffer.wrap(buffer.array());
        }
    }

    BufferHolder(InputStream stream) throws IOException {
        if (null == stream) {
            throw new NullPointerException("Unable to use a NULL InputStream");
        }
        var output = new ByteArrayOutputStream();
        var tmp = new byte[IO_BUFFER_SIZE];
        int read;
        try {
            while (-1 != (read = stream.read(tmp))) {
                output.write(tmp, 0, read);
            }
        } catch (IOException e) {
            throw new DatabaseReadException("Unable to read the database stream into memory.", e);
        }
        this.buffer = SingleBuffer.wrap(output.toByteArray());
    }

    BufferHolder(byte[] database) {
        if (null == database) {
            throw new NullPointerException("Unable to use a NULL byte array");
        }
        this.buffer = SingleBuffer.wrap(database);
    }

    /*
     * The returned Buffer only supports absolute reads and may be shared
     * between threads.
     */
    Buffer get() {
        return this.buffer;
    }
}
