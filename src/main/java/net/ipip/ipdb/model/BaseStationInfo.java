package net.ipip.ipdb.model;

import java.util.List;
import net.ipip.ipdb.Schema;

/**
 * A record of a base station database.
 *
 * @param countryName the country name
 * @param regionName  the region or province name
 * @param cityName    the city name
 * @param ownerDomain the domain of the owner of the address range
 * @param ispDomain   the domain of the ISP
 * @param baseStation the base station flag, e.g. {@code WIFI} or {@code BS}
 */
public record BaseStationInfo(
        String countryName,
        String regionName,
        String cityName,
        String ownerDomain,
        String ispDomain,
        String baseStation
) {
    /**
     * The schema of base station databases.
     */
    public static final Schema<BaseStationInfo> SCHEMA = Schema.of(
        "base station",
        BaseStationInfo.class,
        List.of("country_name", "region_name", "city_name", "owner_domain", "isp_domain",
            "base_station"),
        fields -> new BaseStationInfo(
            fields.string("country_name"),
            fields.string("region_name"),
            fields.string("city_name"),
            fields.string("owner_domain"),
            fields.string("isp_domain"),
            fields.string("base_station")));
}
