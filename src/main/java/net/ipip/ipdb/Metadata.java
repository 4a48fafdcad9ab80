package net.ipip.ipdb;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code Metadata} holds data associated with the database itself.
 *
 * @param build      The build time of the database, in seconds since the
 *                   epoch.
 * @param ipVersion  A bitmask of the supported IP versions. Bit 0 is set when
 *                   the database contains IPv4 data, bit 1 when it contains
 *                   IPv6 data.
 * @param languages  Map from language code to the index of the first field of
 *                   that language within each record.
 * @param nodeCount  The number of nodes in the search tree.
 * @param totalSize  The number of bytes following the metadata, i.e. the
 *                   search tree and the data section.
 * @param fields     The names of the fields every record carries for each
 *                   language, in record order.
 */
public record Metadata(
        long build,
        int ipVersion,
        Map<String, Integer> languages,
        long nodeCount,
        long totalSize,
        List<String> fields
) {
    static final int IPV4 = 0x01;
    static final int IPV6 = 0x02;

    /**
     * Canonical constructor, used to decode the JSON header. Missing
     * collections are read as empty ones.
     */
    @JsonCreator
    public Metadata(
            @JsonProperty("build") long build,
            @JsonProperty("ip_version") int ipVersion,
            @JsonProperty("languages") Map<String, Integer> languages,
            @JsonProperty("node_count") long nodeCount,
            @JsonProperty("total_size") long totalSize,
            @JsonProperty("fields") List<String> fields
    ) {
        this.build = build;
        this.ipVersion = ipVersion;
        this.languages = languages == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(languages));
        this.nodeCount = nodeCount;
        this.totalSize = totalSize;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * @return the build time of the database.
     */
    public Instant buildTime() {
        return Instant.ofEpochSecond(build);
    }

    /**
     * @return whether the database contains IPv4 data.
     */
    public boolean isIPv4Supported() {
        return (ipVersion & IPV4) == IPV4;
    }

    /**
     * @return whether the database contains IPv6 data.
     */
    public boolean isIPv6Supported() {
        return (ipVersion & IPV6) == IPV6;
    }

    /**
     * @return the size of the search tree in bytes.
     */
    long searchTreeSize() {
        return nodeCount * SearchTree.NODE_BYTE_SIZE;
    }
}
