package net.ipip.ipdb.model;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.List;
import java.util.Objects;
import net.ipip.ipdb.Schema;

/**
 * A record of a city database.
 *
 * <p>{@code districtInfo} and {@code asnInfo} are decoded from JSON embedded
 * in their fields. When that JSON is missing or invalid they are
 * {@code null} and an empty list respectively; the rest of the record is
 * unaffected.
 */
public record CityInfo(
        String countryName,
        String regionName,
        String cityName,
        String districtName,
        String ownerDomain,
        String ispDomain,
        String latitude,
        String longitude,
        String timezone,
        String utcOffset,
        String chinaRegionCode,
        String chinaCityCode,
        String chinaDistrictCode,
        String chinaAdminCode,
        String iddCode,
        String countryCode,
        String continentCode,
        String idc,
        String baseStation,
        String countryCode3,
        String europeanUnion,
        String currencyCode,
        String currencyName,
        String anycast,
        String line,
        DistrictInfo districtInfo,
        String route,
        String asn,
        List<ASNInfo> asnInfo,
        String areaCode,
        String usageType
) {
    private static final TypeReference<List<ASNInfo>> ASN_LIST = new TypeReference<>() {};

    /**
     * The schema of city databases.
     */
    public static final Schema<CityInfo> SCHEMA = Schema.of(
        "city",
        CityInfo.class,
        List.of("country_name", "region_name", "city_name", "district_name", "owner_domain",
            "isp_domain", "latitude", "longitude", "timezone", "utc_offset",
            "china_region_code", "china_city_code", "china_district_code", "china_admin_code",
            "idd_code", "country_code", "continent_code", "idc", "base_station",
            "country_code3", "european_union", "currency_code", "currency_name", "anycast",
            "line", "district_info", "route", "asn", "asn_info", "area_code", "usage_type"),
        fields -> new CityInfo(
            fields.string("country_name"),
            fields.string("region_name"),
            fields.string("city_name"),
            fields.string("district_name"),
            fields.string("owner_domain"),
            fields.string("isp_domain"),
            fields.string("latitude"),
            fields.string("longitude"),
            fields.string("timezone"),
            fields.string("utc_offset"),
            fields.string("china_region_code"),
            fields.string("china_city_code"),
            fields.string("china_district_code"),
            fields.string("china_admin_code"),
            fields.string("idd_code"),
            fields.string("country_code"),
            fields.string("continent_code"),
            fields.string("idc"),
            fields.string("base_station"),
            fields.string("country_code3"),
            fields.string("european_union"),
            fields.string("currency_code"),
            fields.string("currency_name"),
            fields.string("anycast"),
            fields.string("line"),
            fields.json("district_info", DistrictInfo.class, null),
            fields.string("route"),
            fields.string("asn"),
            fields.json("asn_info", ASN_LIST, List.of()),
            fields.string("area_code"),
            fields.string("usage_type")));

    public CityInfo {
        asnInfo = asnInfo == null
            ? List.of()
            : asnInfo.stream().filter(Objects::nonNull).toList();
    }
}
