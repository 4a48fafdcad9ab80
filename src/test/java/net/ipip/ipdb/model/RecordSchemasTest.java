package net.ipip.ipdb.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import net.ipip.ipdb.IpdbWriter;
import net.ipip.ipdb.Reader;
import org.junit.jupiter.api.Test;

public class RecordSchemasTest {
    private static final List<String> FIELDS = List.of("country_name", "region_name",
        "city_name", "owner_domain", "isp_domain", "idc", "base_station");

    private static byte[] database() {
        return new IpdbWriter(FIELDS, "CN", "EN")
            .insert("36.110.0.0/16",
                "中国", "北京", "北京", "", "chinatelecom.com.cn", "", "WIFI",
                "China", "Beijing", "Beijing", "", "chinatelecom.com.cn", "", "WIFI")
            .insert("103.235.46.0/24",
                "中国", "香港", "", "baidu.com", "", "IDC", "",
                "China", "Hong Kong", "", "baidu.com", "", "IDC", "")
            .write();
    }

    @Test
    public void testIDCInfo() throws Exception {
        try (var reader = new Reader<>(database(), IDCInfo.SCHEMA)) {
            assertEquals(new IDCInfo("China", "Hong Kong", "", "baidu.com", "", "IDC"),
                reader.findInfo("103.235.46.39", "EN"));
            assertEquals("", reader.findInfo("36.110.1.1", "CN").idc());
        }
    }

    @Test
    public void testBaseStationInfo() throws Exception {
        try (var reader = new Reader<>(database(), BaseStationInfo.SCHEMA)) {
            assertEquals(new BaseStationInfo("中国", "北京", "北京", "", "chinatelecom.com.cn",
                "WIFI"), reader.findInfo("36.110.1.1", "CN"));
        }
    }

    @Test
    public void testDistrictInfo() throws Exception {
        byte[] database = new IpdbWriter(List.of("country_name", "region_name", "city_name",
            "district_name", "china_admin_code", "covering_radius", "latitude", "longitude"), "CN")
            .insert("123.123.0.0/16", "中国", "北京", "北京", "朝阳区", "110105", "5", "39.92",
                "116.44")
            .write();

        try (var reader = new Reader<>(database, DistrictInfo.SCHEMA)) {
            assertEquals(new DistrictInfo("中国", "北京", "北京", "朝阳区", "110105", "5", "39.92",
                "116.44"), reader.findInfo("123.123.1.1", "CN"));
        }
    }
}
