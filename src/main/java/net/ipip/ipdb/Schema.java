package net.ipip.ipdb;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes how the fields of a database are decoded into a typed record.
 *
 * <p>A schema declares the field keys it reads and a creator that builds the
 * record from a {@link RecordFields}. When a database is loaded, the declared
 * keys are bound to their positions in the database's field list once; the
 * creator then only reads keys through that table.
 *
 * <pre>{@code
 * Schema<RiskInfo> schema = Schema.of("risk", RiskInfo.class,
 *     List.of("score", "behavior", "country_code"),
 *     fields -> new RiskInfo(
 *         fields.integer("score"),
 *         fields.string("behavior"),
 *         fields.string("country_code")));
 * }</pre>
 *
 * @param <T> the type of record the schema creates
 */
public final class Schema<T> {
    private static final Logger logger = LoggerFactory.getLogger(Schema.class);

    @SuppressWarnings("unchecked")
    private static final Schema<Map<String, String>> MAP = new Schema<>(
        "map",
        (Class<Map<String, String>>) (Class<?>) Map.class,
        List.of(),
        RecordFields::asMap);

    private final String name;
    private final Class<T> type;
    private final List<String> keys;
    private final Function<RecordFields, T> creator;

    private Schema(String name, Class<T> type, List<String> keys,
                   Function<RecordFields, T> creator) {
        if (name == null || type == null || keys == null || creator == null) {
            throw new NullPointerException("Schema name, type, keys and creator are required");
        }
        this.name = name;
        this.type = type;
        this.keys = List.copyOf(keys);
        this.creator = creator;
    }

    /**
     * Creates a schema.
     *
     * @param <T>     the type of record the schema creates
     * @param name    a name for the schema, used in log messages
     * @param type    the class of the created records
     * @param keys    the field keys the creator reads
     * @param creator builds a record from the fields of one language
     * @return the schema
     */
    public static <T> Schema<T> of(String name, Class<T> type, List<String> keys,
                                   Function<RecordFields, T> creator) {
        return new Schema<>(name, type, keys, creator);
    }

    /**
     * @return a schema that decodes a record into a map from field name to
     *         value, in database field order.
     */
    public static Schema<Map<String, String>> map() {
        return MAP;
    }

    /**
     * @return the name of the schema
     */
    public String name() {
        return name;
    }

    /**
     * @return the class of the created records
     */
    public Class<T> type() {
        return type;
    }

    /**
     * @return the declared field keys
     */
    public List<String> keys() {
        return keys;
    }

    /*
     * Maps each declared key to its index in the database's field list. Keys
     * the database does not carry are left out and read back as zero values.
     */
    Map<String, Integer> bind(List<String> fields) {
        Map<String, Integer> positions = new HashMap<>(fields.size() * 2);
        for (int i = 0; i < fields.size(); i++) {
            positions.putIfAbsent(fields.get(i), i);
        }

        Map<String, Integer> slots = new HashMap<>(keys.size() * 2);
        for (String key : keys) {
            Integer position = positions.get(key);
            if (position == null) {
                logger.debug("The {} schema field {} is not present in the database", name, key);
                slots.put(key, RecordFields.ABSENT);
            } else {
                slots.put(key, position);
            }
        }
        return Collections.unmodifiableMap(slots);
    }

    T create(RecordFields fields) {
        T record = creator.apply(fields);
        if (record == null) {
            throw new IllegalStateException("The " + name + " schema created a null record");
        }
        return record;
    }

    @Override
    public String toString() {
        return "Schema{" + name + ", keys=" + keys + "}";
    }
}
