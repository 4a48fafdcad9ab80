package net.ipip.ipdb;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/*
 * Splits a record into its tab separated values and selects the block of
 * fields of one language. Language blocks follow each other within a record;
 * the metadata gives the index of the first field of each block.
 */
final class FieldDecoder {
    private static final Pattern SEPARATOR = Pattern.compile("\t");

    private final Metadata metadata;
    private final int fieldCount;

    FieldDecoder(Metadata metadata) {
        this.metadata = metadata;
        this.fieldCount = metadata.fields().size();
    }

    int languageOffset(String language) throws UnsupportedLanguageException {
        Integer offset = language == null ? null : metadata.languages().get(language);
        if (offset == null) {
            throw new UnsupportedLanguageException(language);
        }
        return offset;
    }

    List<String> decode(Buffer record, int offset) throws InvalidDatabaseException {
        // -1 keeps trailing empty values
        String[] tokens = SEPARATOR.split(record.decode(StandardCharsets.UTF_8), -1);
        if ((long) offset + fieldCount > tokens.length) {
            throw new InvalidDatabaseException("The IPDB file's data section is corrupt: "
                + "a record has " + tokens.length + " values, expected at least "
                + ((long) offset + fieldCount));
        }
        return List.of(Arrays.copyOfRange(tokens, offset, offset + fieldCount));
    }
}
