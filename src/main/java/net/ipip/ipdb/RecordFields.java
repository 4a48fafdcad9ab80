package net.ipip.ipdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The values of one language of one record, as handed to a {@link Schema}'s
 * creator. Values are read by field key; only the keys the schema declares
 * can be read.
 */
public final class RecordFields {
    private static final Logger logger = LoggerFactory.getLogger(RecordFields.class);

    static final int ABSENT = -1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<String> names;
    private final List<String> values;
    private final Map<String, Integer> slots;

    RecordFields(List<String> names, List<String> values, Map<String, Integer> slots) {
        this.names = names;
        this.values = values;
        this.slots = slots;
    }

    /**
     * @param key a declared field key
     * @return the value of the field, or the empty string if the database does
     *         not carry it
     * @throws IllegalArgumentException if the schema does not declare the key
     */
    public String string(String key) {
        Integer slot = slots.get(key);
        if (slot == null) {
            throw new IllegalArgumentException("The field " + key + " is not declared by the schema");
        }
        return slot == ABSENT ? "" : values.get(slot);
    }

    /**
     * @param key a declared field key
     * @return the value of the field as a decimal integer, or 0 if it is absent
     *         or not a number. Surrounding whitespace makes it not a number.
     * @throws IllegalArgumentException if the schema does not declare the key
     */
    public int integer(String key) {
        String value = string(key);
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric value {} of field {}", value, key);
            return 0;
        }
    }

    /**
     * Decodes a field holding embedded JSON.
     *
     * @param <V>      the decoded type
     * @param key      a declared field key
     * @param type     the decoded type
     * @param fallback the value to return when the field is absent, empty or
     *                 not valid JSON for {@code type}
     * @return the decoded value
     * @throws IllegalArgumentException if the schema does not declare the key
     */
    public <V> V json(String key, Class<V> type, V fallback) {
        return json(key, MAPPER.readerFor(type), fallback);
    }

    /**
     * Decodes a field holding embedded JSON into a generic type.
     *
     * @param <V>      the decoded type
     * @param key      a declared field key
     * @param type     the decoded type
     * @param fallback the value to return when the field is absent, empty or
     *                 not valid JSON for {@code type}
     * @return the decoded value
     * @throws IllegalArgumentException if the schema does not declare the key
     */
    public <V> V json(String key, TypeReference<V> type, V fallback) {
        return json(key, MAPPER.readerFor(type), fallback);
    }

    private <V> V json(String key, ObjectReader reader, V fallback) {
        String value = string(key);
        if (value.isBlank()) {
            return fallback;
        }
        try {
            V decoded = reader.readValue(value);
            return decoded == null ? fallback : decoded;
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring invalid JSON in field {}: {}", key, e.getOriginalMessage());
            return fallback;
        }
    }

    /**
     * @return all values of the record, keyed by field name in database field
     *         order
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values.get(i));
        }
        return Collections.unmodifiableMap(map);
    }
}
