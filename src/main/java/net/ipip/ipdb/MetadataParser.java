package net.ipip.ipdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * Decodes the header of a database:
 *
 *   [0:4]   uint32 metadata length L
 *   [4:4+L] JSON metadata
 *   [4+L:]  search tree followed by the data section, total_size bytes
 */
final class MetadataParser {
    private static final Logger logger = LoggerFactory.getLogger(MetadataParser.class);

    private static final int LENGTH_PREFIX_SIZE = 4;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * The decoded metadata and the bytes that follow it.
     *
     * @param metadata the metadata
     * @param data     a view of the search tree and data section
     */
    record Result(Metadata metadata, Buffer data) {}

    private MetadataParser() {
    }

    static Result parse(Buffer buffer, String name) throws InvalidDatabaseException {
        long fileSize = buffer.capacity();
        if (fileSize < LENGTH_PREFIX_SIZE) {
            throw new InvalidFileSizeException("The database " + name + " is only "
                + fileSize + " bytes long, too short to contain a metadata length.");
        }

        long metadataLength = buffer.getUnsignedInt(0);
        if (fileSize < LENGTH_PREFIX_SIZE + metadataLength) {
            throw new InvalidFileSizeException("The database " + name + " declares "
                + metadataLength + " bytes of metadata but is only " + fileSize + " bytes long.");
        }

        String json = buffer.slice(LENGTH_PREFIX_SIZE, metadataLength)
            .decode(StandardCharsets.UTF_8);
        Metadata metadata;
        try {
            metadata = MAPPER.readValue(json, Metadata.class);
        } catch (JsonProcessingException e) {
            throw new InvalidMetadataException(
                "The metadata of " + name + " could not be decoded: " + e.getOriginalMessage(), e);
        }
        if (metadata == null) {
            throw new InvalidMetadataException("The metadata of " + name + " is empty.");
        }

        if (metadata.languages().isEmpty() || metadata.fields().isEmpty()) {
            throw new InvalidMetadataException("The metadata of " + name
                + " must declare at least one language and one field.");
        }
        if (metadata.nodeCount() < 0 || metadata.totalSize() < 0) {
            throw new InvalidMetadataException("The metadata of " + name
                + " contains a negative node count or total size.");
        }

        long expectedSize = LENGTH_PREFIX_SIZE + metadataLength + metadata.totalSize();
        if (fileSize != expectedSize) {
            throw new InvalidFileSizeException("The database " + name + " is " + fileSize
                + " bytes long, but its metadata describes " + expectedSize + " bytes.");
        }

        if (metadata.nodeCount() > metadata.totalSize() / SearchTree.NODE_BYTE_SIZE) {
            throw new InvalidMetadataException("The search tree of " + name + " ("
                + metadata.nodeCount() + " nodes) does not fit in " + metadata.totalSize()
                + " bytes.");
        }

        int fieldCount = metadata.fields().size();
        for (Map.Entry<String, Integer> language : metadata.languages().entrySet()) {
            Integer offset = language.getValue();
            if (offset == null || offset < 0) {
                throw new InvalidMetadataException("The metadata of " + name
                    + " contains an invalid offset for the language " + language.getKey());
            }
            if (offset % fieldCount != 0) {
                logger.warn("The offset {} of language {} in {} is not a multiple of the "
                    + "{} declared fields", offset, language.getKey(), name, fieldCount);
            }
        }

        long dataStart = LENGTH_PREFIX_SIZE + metadataLength;
        return new Result(metadata, buffer.slice(dataStart, fileSize - dataStart));
    }
}
