package net.ipip.ipdb.model;

import java.util.List;
import net.ipip.ipdb.Schema;

/**
 * A record of a risk database. Risk databases carry a single language,
 * usually {@code CN}.
 *
 * @param score       the risk score, 0 when unknown
 * @param behavior    the observed behavior
 * @param countryCode the ISO 3166 country code
 */
public record RiskInfo(int score, String behavior, String countryCode) {
    /**
     * The schema of risk databases.
     */
    public static final Schema<RiskInfo> SCHEMA = Schema.of(
        "risk",
        RiskInfo.class,
        List.of("score", "behavior", "country_code"),
        fields -> new RiskInfo(
            fields.integer("score"),
            fields.string("behavior"),
            fields.string("country_code")));
}
