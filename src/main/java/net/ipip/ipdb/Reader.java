package net.ipip.ipdb;

import com.google.common.net.InetAddresses;
import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instances of this class provide a reader for the IPDB format. IP addresses
 * can be looked up using the <code>find</code> methods.
 *
 * <p>The whole database is held in memory; lookups do no I/O. A reader is safe
 * for use by any number of threads, including while it is being reloaded:
 * each lookup runs against the database that was current when it started.
 *
 * @param <T> the type of record produced by {@link #findInfo}
 */
public final class Reader<T> implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Reader.class);

    private final Schema<T> schema;
    private final FileMode fileMode;
    private final Supplier<LookupCache> cacheSupplier;
    private final AtomicReference<Snapshot<T>> snapshotReference;
    // serializes reload, clearCache and close
    private final ReentrantLock writeLock = new ReentrantLock();
    // the metadata of the last database, set once the reader is closed
    private volatile Metadata closedMetadata;

    /**
     * The file mode to use when opening an IPDB file.
     */
    public enum FileMode {
        /**
         * The default file mode. Loads the database into memory when the
         * reader is constructed.
         */
        MEMORY,
        /**
         * Maps the database to virtual memory. This often provides similar
         * performance to loading the database into real memory without the
         * overhead.
         */
        MEMORY_MAPPED
    }

    /**
     * Constructs a Reader for the IPDB format, with the default cache. The file
     * passed to it must be a valid IPDB file.
     *
     * @param database the IPDB file to use.
     * @param schema   the schema used to decode records.
     * @throws IOException if there is an error opening or reading from the file.
     */
    public Reader(File database, Schema<T> schema) throws IOException {
        this(database, schema, FileMode.MEMORY);
    }

    /**
     * Constructs a Reader for the IPDB format, with the specified backing
     * cache. A new cache is taken from {@code cacheSupplier} each time the
     * database is loaded.
     *
     * @param database      the IPDB file to use.
     * @param schema        the schema used to decode records.
     * @param cacheSupplier supplier of backing cache instances
     * @throws IOException if there is an error opening or reading from the file.
     */
    public Reader(File database, Schema<T> schema, Supplier<LookupCache> cacheSupplier)
        throws IOException {
        this(database, schema, FileMode.MEMORY, cacheSupplier);
    }

    /**
     * Constructs a Reader for the IPDB format, with the default cache.
     *
     * @param database the IPDB file to use.
     * @param schema   the schema used to decode records.
     * @param fileMode the mode to open the file with.
     * @throws IOException if there is an error opening or reading from the file.
     */
    public Reader(File database, Schema<T> schema, FileMode fileMode) throws IOException {
        this(database, schema, fileMode, LRUCache::new);
    }

    /**
     * Constructs a Reader for the IPDB format, with the specified backing
     * cache.
     *
     * @param database      the IPDB file to use.
     * @param schema        the schema used to decode records.
     * @param fileMode      the mode to open the file with.
     * @param cacheSupplier supplier of backing cache instances
     * @throws IOException if there is an error opening or reading from the file.
     */
    public Reader(File database, Schema<T> schema, FileMode fileMode,
                  Supplier<LookupCache> cacheSupplier) throws IOException {
        this(new BufferHolder(database, fileMode), database.getName(), schema, fileMode,
            cacheSupplier);
    }

    /**
     * Constructs a Reader with the default cache, as if in mode
     * {@link FileMode#MEMORY}, without using a <code>File</code> instance.
     *
     * @param source the InputStream that contains the IPDB file.
     * @param schema the schema used to decode records.
     * @throws IOException if there is an error reading from the Stream.
     */
    public Reader(InputStream source, Schema<T> schema) throws IOException {
        this(source, schema, LRUCache::new);
    }

    /**
     * Constructs a Reader with the specified backing cache, as if in mode
     * {@link FileMode#MEMORY}, without using a <code>File</code> instance.
     *
     * @param source        the InputStream that contains the IPDB file.
     * @param schema        the schema used to decode records.
     * @param cacheSupplier supplier of backing cache instances
     * @throws IOException if there is an error reading from the Stream.
     */
    public Reader(InputStream source, Schema<T> schema, Supplier<LookupCache> cacheSupplier)
        throws IOException {
        this(new BufferHolder(source), "<InputStream>", schema, FileMode.MEMORY, cacheSupplier);
    }

    /**
     * Constructs a Reader with the default cache over the content of an IPDB
     * file. The array is used as is, not copied, and must not be modified.
     *
     * @param database the content of an IPDB file.
     * @param schema   the schema used to decode records.
     * @throws IOException if the content is not a valid IPDB database.
     */
    public Reader(byte[] database, Schema<T> schema) throws IOException {
        this(database, schema, LRUCache::new);
    }

    /**
     * Constructs a Reader with the specified backing cache over the content of
     * an IPDB file. The array is used as is, not copied, and must not be
     * modified.
     *
     * @param database      the content of an IPDB file.
     * @param schema        the schema used to decode records.
     * @param cacheSupplier supplier of backing cache instances
     * @throws IOException if the content is not a valid IPDB database.
     */
    public Reader(byte[] database, Schema<T> schema, Supplier<LookupCache> cacheSupplier)
        throws IOException {
        this(new BufferHolder(database), "<byte[]>", schema, FileMode.MEMORY, cacheSupplier);
    }

    private Reader(BufferHolder bufferHolder, String name, Schema<T> schema, FileMode fileMode,
                   Supplier<LookupCache> cacheSupplier) throws IOException {
        if (schema == null) {
            throw new NullPointerException("Schema cannot be null");
        }
        if (cacheSupplier == null) {
            throw new NullPointerException("Cache supplier cannot be null");
        }
        this.schema = schema;
        this.fileMode = fileMode;
        this.cacheSupplier = cacheSupplier;

        Snapshot<T> snapshot = Snapshot.load(bufferHolder, name, schema, cacheSupplier.get());
        this.snapshotReference = new AtomicReference<>(snapshot);
    }

    /**
     * Looks up <code>address</code> in the IPDB database.
     *
     * @param address  the IPv4 or IPv6 address to look up.
     * @param language the language of the returned values.
     * @return the values of the language's fields, in {@link #fields()} order.
     * @throws IOException     if the database is closed or corrupt.
     * @throws LookupException if the address is invalid or not in the database,
     *                         or the database does not support the language or
     *                         the IP version of the address.
     */
    public List<String> find(String address, String language)
        throws IOException, LookupException {
        InetAddress ip = parseAddress(address);
        return this.getSnapshot().find(ip, address, language);
    }

    /**
     * Looks up <code>address</code> in the IPDB database.
     *
     * @param address  the IPv4 or IPv6 address to look up.
     * @param language the language of the returned values.
     * @return the values of the language's fields keyed by field name, in
     *         {@link #fields()} order.
     * @throws IOException     if the database is closed or corrupt.
     * @throws LookupException if the address is invalid or not in the database,
     *                         or the database does not support the language or
     *                         the IP version of the address.
     */
    public Map<String, String> findMap(String address, String language)
        throws IOException, LookupException {
        InetAddress ip = parseAddress(address);
        return this.getSnapshot().findMap(ip, address, language);
    }

    /**
     * Looks up <code>address</code> in the IPDB database and decodes the
     * values with the reader's schema.
     *
     * @param address  the IPv4 or IPv6 address to look up.
     * @param language the language of the returned values.
     * @return the record.
     * @throws IOException     if the database is closed or corrupt.
     * @throws LookupException if the address is invalid or not in the database,
     *                         or the database does not support the language or
     *                         the IP version of the address.
     */
    public T findInfo(String address, String language) throws IOException, LookupException {
        InetAddress ip = parseAddress(address);
        return this.getSnapshot().findInfo(ip, address, language);
    }

    private static InetAddress parseAddress(String address) throws InvalidAddressException {
        if (address == null) {
            throw new InvalidAddressException(null, null);
        }
        // zone indexes would be resolved against the local network interfaces
        if (address.indexOf('%') >= 0) {
            throw new InvalidAddressException(address, null);
        }
        try {
            // literal only, never resolves host names
            return InetAddresses.forString(address);
        } catch (IllegalArgumentException e) {
            throw new InvalidAddressException(address, e);
        }
    }

    Snapshot<T> getSnapshot() throws ClosedDatabaseException {
        Snapshot<T> snapshot = this.snapshotReference.get();
        if (snapshot == null) {
            throw new ClosedDatabaseException();
        }
        return snapshot;
    }

    /**
     * Replaces the database with the content of <code>database</code>. The
     * new file is opened with the reader's file mode and gets a new cache.
     * If loading fails, the current database stays in use.
     *
     * @param database the IPDB file to use.
     * @throws FileNotFoundException   if the file does not exist.
     * @throws ClosedDatabaseException if the reader has been closed.
     * @throws IOException             if there is an error opening or reading
     *                                 from the file.
     */
    public void reload(File database) throws IOException {
        this.getSnapshot();
        if (!database.isFile()) {
            throw new FileNotFoundException("The database " + database + " does not exist");
        }

        Snapshot<T> fresh = Snapshot.load(new BufferHolder(database, fileMode),
            database.getName(), schema, cacheSupplier.get());

        writeLock.lock();
        try {
            this.getSnapshot();
            this.snapshotReference.set(fresh);
        } finally {
            writeLock.unlock();
        }
        logger.info("Reloaded the {} database from {}, built at {}",
            schema.name(), database, fresh.metadata().buildTime());
    }

    /**
     * Discards every cached lookup result.
     *
     * @throws ClosedDatabaseException if the reader has been closed.
     */
    public void clearCache() throws ClosedDatabaseException {
        writeLock.lock();
        try {
            Snapshot<T> current = this.getSnapshot();
            this.snapshotReference.set(current.withCache(cacheSupplier.get()));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return whether the database contains IPv4 data.
     */
    public boolean isIPv4Supported() {
        return this.getMetadata().isIPv4Supported();
    }

    /**
     * @return whether the database contains IPv6 data.
     */
    public boolean isIPv6Supported() {
        return this.getMetadata().isIPv6Supported();
    }

    /**
     * @return the languages the database supports.
     */
    public Set<String> languages() {
        return this.getMetadata().languages().keySet();
    }

    /**
     * @return the names of the fields of each language, in record order.
     */
    public List<String> fields() {
        return this.getMetadata().fields();
    }

    /**
     * @return the build time of the database.
     */
    public Instant buildTime() {
        return this.getMetadata().buildTime();
    }

    /**
     * @return the metadata of the database lookups currently run against, or
     *         of the last database once the reader is closed.
     */
    public Metadata getMetadata() {
        Snapshot<T> snapshot = this.snapshotReference.get();
        return snapshot != null ? snapshot.metadata() : this.closedMetadata;
    }

    /**
     * @return the schema used to decode records.
     */
    public Schema<T> getSchema() {
        return this.schema;
    }

    /**
     * <p>
     * Closes the database.
     * </p>
     * <p>
     * If you are using <code>FileMode.MEMORY_MAPPED</code>, this will
     * <em>not</em> unmap the underlying file due to a limitation in Java's
     * <code>MappedByteBuffer</code>. It will however set the reference to
     * the buffer to <code>null</code>, allowing the garbage collector to
     * collect it. The metadata stays available.
     * </p>
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            Snapshot<T> current = this.snapshotReference.get();
            if (current != null) {
                this.closedMetadata = current.metadata();
                this.snapshotReference.set(null);
            }
        } finally {
            writeLock.unlock();
        }
    }
}
