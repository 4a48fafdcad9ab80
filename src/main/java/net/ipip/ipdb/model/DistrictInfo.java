package net.ipip.ipdb.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import net.ipip.ipdb.Schema;

/**
 * A record of a district database. The same structure is embedded as JSON in
 * the {@code district_info} field of city databases.
 *
 * @param countryName    the country name
 * @param regionName     the region or province name
 * @param cityName       the city name
 * @param districtName   the district name
 * @param chinaAdminCode the Chinese administrative division code
 * @param coveringRadius the radius covered by the location, in kilometers
 * @param latitude       the latitude of the district
 * @param longitude      the longitude of the district
 */
public record DistrictInfo(
        @JsonProperty("country_name") String countryName,
        @JsonProperty("region_name") String regionName,
        @JsonProperty("city_name") String cityName,
        @JsonProperty("district_name") String districtName,
        @JsonProperty("china_admin_code") String chinaAdminCode,
        @JsonProperty("covering_radius") String coveringRadius,
        @JsonProperty("latitude") String latitude,
        @JsonProperty("longitude") String longitude
) {
    /**
     * The schema of district databases.
     */
    public static final Schema<DistrictInfo> SCHEMA = Schema.of(
        "district",
        DistrictInfo.class,
        List.of("country_name", "region_name", "city_name", "district_name",
            "china_admin_code", "covering_radius", "latitude", "longitude"),
        fields -> new DistrictInfo(
            fields.string("country_name"),
            fields.string("region_name"),
            fields.string("city_name"),
            fields.string("district_name"),
            fields.string("china_admin_code"),
            fields.string("covering_radius"),
            fields.string("latitude"),
            fields.string("longitude")));
}
