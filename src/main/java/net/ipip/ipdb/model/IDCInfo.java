package net.ipip.ipdb.model;

import java.util.List;
import net.ipip.ipdb.Schema;

/**
 * A record of an IDC (data center) database.
 *
 * @param countryName the country name
 * @param regionName  the region or province name
 * @param cityName    the city name
 * @param ownerDomain the domain of the owner of the address range
 * @param ispDomain   the domain of the ISP
 * @param idc         the data center flag, e.g. {@code IDC}
 */
public record IDCInfo(
        String countryName,
        String regionName,
        String cityName,
        String ownerDomain,
        String ispDomain,
        String idc
) {
    /**
     * The schema of IDC databases.
     */
    public static final Schema<IDCInfo> SCHEMA = Schema.of(
        "idc",
        IDCInfo.class,
        List.of("country_name", "region_name", "city_name", "owner_domain", "isp_domain", "idc"),
        fields -> new IDCInfo(
            fields.string("country_name"),
            fields.string("region_name"),
            fields.string("city_name"),
            fields.string("owner_domain"),
            fields.string("isp_domain"),
            fields.string("idc")));
}
