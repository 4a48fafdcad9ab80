package net.ipip.ipdb;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * One loaded database: the buffer, the structures derived from its metadata
 * and the cache of lookups made against it. A snapshot is never modified
 * after construction, so lookups holding one are unaffected by reloads.
 */
final class Snapshot<T> {
    private static final Logger logger = LoggerFactory.getLogger(Snapshot.class);

    @SuppressWarnings("rawtypes")
    private static final Class<List> LIST_TYPE = List.class;
    @SuppressWarnings("rawtypes")
    private static final Class<Map> MAP_TYPE = Map.class;

    private final String name;
    private final Metadata metadata;
    private final SearchTree tree;
    private final RecordResolver resolver;
    private final FieldDecoder decoder;
    private final Schema<T> schema;
    private final Map<String, Integer> slots;
    private final LookupCache cache;

    private Snapshot(String name, Metadata metadata, SearchTree tree, RecordResolver resolver,
                     FieldDecoder decoder, Schema<T> schema, Map<String, Integer> slots,
                     LookupCache cache) {
        this.name = name;
        this.metadata = metadata;
        this.tree = tree;
        this.resolver = resolver;
        this.decoder = decoder;
        this.schema = schema;
        this.slots = slots;
        this.cache = cache;
    }

    static <T> Snapshot<T> load(BufferHolder holder, String name, Schema<T> schema,
                                LookupCache cache) throws InvalidDatabaseException {
        if (cache == null) {
            throw new NullPointerException("Cache cannot be null");
        }
        MetadataParser.Result parsed = MetadataParser.parse(holder.get(), name);
        Metadata metadata = parsed.metadata();
        Buffer data = parsed.data();

        SearchTree tree = new SearchTree(data, metadata.nodeCount());
        Snapshot<T> snapshot = new Snapshot<>(
            name,
            metadata,
            tree,
            new RecordResolver(data, metadata.nodeCount()),
            new FieldDecoder(metadata),
            schema,
            schema.bind(metadata.fields()),
            cache);

        logger.debug("Loaded {}: build time {}, {} nodes, IPv4 start node {}, languages {}",
            name, metadata.buildTime(), metadata.nodeCount(), tree.ipV4Start(),
            metadata.languages().keySet());
        return snapshot;
    }

    /*
     * The same database with a different cache.
     */
    Snapshot<T> withCache(LookupCache newCache) {
        if (newCache == null) {
            throw new NullPointerException("Cache cannot be null");
        }
        return new Snapshot<>(name, metadata, tree, resolver, decoder, schema, slots, newCache);
    }

    Metadata metadata() {
        return metadata;
    }

    String name() {
        return name;
    }

    @SuppressWarnings("unchecked")
    List<String> find(InetAddress address, String text, String language)
        throws IOException, LookupException {
        int offset = this.prepare(address, language);
        return (List<String>) cache.get(new CacheKey(text, language, LIST_TYPE),
            key -> this.lookup(address, offset));
    }

    @SuppressWarnings("unchecked")
    Map<String, String> findMap(InetAddress address, String text, String language)
        throws IOException, LookupException {
        int offset = this.prepare(address, language);
        return (Map<String, String>) cache.get(new CacheKey(text, language, MAP_TYPE),
            key -> this.fields(this.lookup(address, offset)).asMap());
    }

    T findInfo(InetAddress address, String text, String language)
        throws IOException, LookupException {
        int offset = this.prepare(address, language);
        Object value = cache.get(new CacheKey(text, language, schema.type()),
            key -> schema.create(this.fields(this.lookup(address, offset))));
        return schema.type().cast(value);
    }

    private int prepare(InetAddress address, String language) throws LookupException {
        int offset = decoder.languageOffset(language);
        if (address instanceof Inet4Address) {
            if (!metadata.isIPv4Supported()) {
                throw new IPv4NotSupportedException();
            }
        } else if (!metadata.isIPv6Supported()) {
            throw new IPv6NotSupportedException();
        }
        return offset;
    }

    private List<String> lookup(InetAddress address, int offset)
        throws IOException, LookupException {
        long pointer = tree.search(address);
        return decoder.decode(resolver.resolve(pointer), offset);
    }

    private RecordFields fields(List<String> values) {
        return new RecordFields(metadata.fields(), values, slots);
    }
}
