package net.ipip.ipdb.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import net.ipip.ipdb.IpdbWriter;
import net.ipip.ipdb.Reader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CityInfoTest {
    private static final List<String> FIELDS = List.of("country_name", "region_name",
        "city_name", "country_code", "district_info", "asn", "asn_info", "usage_type");

    private static final String DISTRICT = "{\"country_name\":\"中国\",\"region_name\":\"北京\","
        + "\"city_name\":\"北京\",\"district_name\":\"朝阳区\",\"china_admin_code\":\"110105\","
        + "\"covering_radius\":\"5\",\"latitude\":\"39.92\",\"longitude\":\"116.44\","
        + "\"source\":\"survey\"}";
    private static final String ASN = "[{\"asn\":4134,\"reg\":\"apnic\",\"cc\":\"CN\","
        + "\"net\":\"CHINANET\",\"org\":\"China Telecom\",\"type\":\"isp\","
        + "\"domain\":\"chinatelecom.com.cn\"},null]";

    private Reader<CityInfo> reader;

    @BeforeEach
    public void setupReader() throws Exception {
        byte[] database = new IpdbWriter(FIELDS, "CN")
            .insert("123.123.0.0/16", "中国", "北京", "北京", "CN", DISTRICT, "4134", ASN, "")
            .insert("1.1.1.0/24", "澳大利亚", "", "", "AU", "{\"country_name\":", "13335",
                "not json", "")
            .insert("8.8.8.0/24", "美国", "", "", "US", "", "", "", "dc")
            .write();
        this.reader = new Reader<>(database, CityInfo.SCHEMA);
    }

    @AfterEach
    public void teardownReader() {
        this.reader.close();
    }

    @Test
    public void testDecode() throws Exception {
        CityInfo info = this.reader.findInfo("123.123.45.6", "CN");

        assertEquals("中国", info.countryName());
        assertEquals("北京", info.regionName());
        assertEquals("北京", info.cityName());
        assertEquals("CN", info.countryCode());
        assertEquals("4134", info.asn());
        assertEquals("", info.usageType());
    }

    @Test
    public void testFieldsNotInTheDatabaseAreEmpty() throws Exception {
        CityInfo info = this.reader.findInfo("123.123.45.6", "CN");

        assertEquals("", info.districtName());
        assertEquals("", info.timezone());
        assertEquals("", info.idc());
        assertEquals("", info.line());
    }

    @Test
    public void testEmbeddedJson() throws Exception {
        CityInfo info = this.reader.findInfo("123.123.45.6", "CN");

        assertEquals(new DistrictInfo("中国", "北京", "北京", "朝阳区", "110105", "5", "39.92",
            "116.44"), info.districtInfo());
        assertEquals(List.of(new ASNInfo(4134, "apnic", "CN", "CHINANET", "China Telecom", "isp",
            "chinatelecom.com.cn")), info.asnInfo());
    }

    @Test
    public void testInvalidEmbeddedJson() throws Exception {
        CityInfo info = this.reader.findInfo("1.1.1.1", "CN");

        assertNull(info.districtInfo());
        assertTrue(info.asnInfo().isEmpty());
        assertEquals("澳大利亚", info.countryName());
        assertEquals("13335", info.asn());
    }

    @Test
    public void testEmptyEmbeddedJson() throws Exception {
        CityInfo info = this.reader.findInfo("8.8.8.8", "CN");

        assertNull(info.districtInfo());
        assertEquals(List.of(), info.asnInfo());
        assertEquals("dc", info.usageType());
    }
}
