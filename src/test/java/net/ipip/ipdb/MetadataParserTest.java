package net.ipip.ipdb;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class MetadataParserTest {

    private static MetadataParser.Result parse(byte[] database) throws InvalidDatabaseException {
        return MetadataParser.parse(SingleBuffer.wrap(database), "test.ipdb");
    }

    private static Map<String, Object> metadata(long nodeCount, long totalSize) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("build", 1_600_000_000L);
        metadata.put("ip_version", 1);
        metadata.put("languages", Map.of("CN", 0));
        metadata.put("node_count", nodeCount);
        metadata.put("total_size", totalSize);
        metadata.put("fields", List.of("country_name"));
        return metadata;
    }

    @Test
    public void testParse() throws InvalidDatabaseException {
        byte[] database = ReaderTest.cityDatabase();
        MetadataParser.Result result = parse(database);
        Metadata metadata = result.metadata();

        assertEquals(Instant.ofEpochSecond(ReaderTest.BUILD), metadata.buildTime());
        assertTrue(metadata.isIPv4Supported());
        assertEquals(ReaderTest.FIELDS, metadata.fields());
        assertEquals(Map.of("CN", 0, "EN", 3), metadata.languages());
        assertEquals(metadata.totalSize(), result.data().capacity());
        assertTrue(metadata.searchTreeSize() <= metadata.totalSize());
    }

    @Test
    public void testUnknownPropertiesAreIgnored() throws InvalidDatabaseException {
        Map<String, Object> metadata = metadata(1, 8);
        metadata.put("database_type", "city");
        MetadataParser.Result result = parse(IpdbWriter.assemble(metadata, new byte[8]));

        assertEquals(1, result.metadata().nodeCount());
    }

    @Test
    public void testTooShort() {
        var exception = assertThrows(InvalidFileSizeException.class,
            () -> parse(new byte[] {0, 0, 1}));
        assertThat(exception.getMessage(), containsString("test.ipdb"));
    }

    @Test
    public void testMetadataLongerThanFile() {
        assertThrows(InvalidFileSizeException.class,
            () -> parse(new byte[] {0, 0, 0, 100, '{', '}'}));
        assertThrows(InvalidFileSizeException.class,
            () -> parse(new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF}));
    }

    @Test
    public void testMalformedMetadata() {
        var exception = assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble("{\"build\": ", new byte[0])));
        assertThat(exception.getMessage(), containsString("could not be decoded"));

        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble("", new byte[0])));
        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble("null", new byte[0])));
        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble("{\"node_count\": \"many\"}", new byte[0])));
    }

    @Test
    public void testMissingLanguagesOrFields() {
        Map<String, Object> noLanguages = metadata(0, 0);
        noLanguages.put("languages", Map.of());
        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble(noLanguages, new byte[0])));

        Map<String, Object> noFields = metadata(0, 0);
        noFields.remove("fields");
        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble(noFields, new byte[0])));
    }

    @Test
    public void testFileSizeMismatch() {
        byte[] database = ReaderTest.cityDatabase();

        assertThrows(InvalidFileSizeException.class,
            () -> parse(Arrays.copyOf(database, database.length - 1)));
        assertThrows(InvalidFileSizeException.class,
            () -> parse(Arrays.copyOf(database, database.length + 1)));
        assertThrows(InvalidFileSizeException.class,
            () -> parse(IpdbWriter.assemble(metadata(1, 16), new byte[8])));
    }

    @Test
    public void testSearchTreeLargerThanData() {
        var exception = assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble(metadata(2, 8), new byte[8])));
        assertThat(exception.getMessage(), containsString("does not fit"));
    }

    @Test
    public void testNegativeSizes() {
        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble(metadata(-1, 0), new byte[0])));
    }

    @Test
    public void testNegativeLanguageOffset() {
        Map<String, Object> metadata = metadata(1, 8);
        metadata.put("languages", Map.of("CN", -1));
        assertThrows(InvalidMetadataException.class,
            () -> parse(IpdbWriter.assemble(metadata, new byte[8])));
    }
}
