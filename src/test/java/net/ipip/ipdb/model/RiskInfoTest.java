package net.ipip.ipdb.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import net.ipip.ipdb.IpdbWriter;
import net.ipip.ipdb.Reader;
import org.junit.jupiter.api.Test;

public class RiskInfoTest {

    @Test
    public void testDecode() throws Exception {
        byte[] database = new IpdbWriter(List.of("score", "behavior", "country_code"), "CN")
            .insert("45.0.0.0/8", "87", "SCAN", "US")
            .insert("46.0.0.0/8", "", "", "RU")
            .insert("47.0.0.0/8", "high", "PROXY", "CN")
            .insert("48.0.0.0/8", " 5", "SCAN", "DE")
            .write();

        try (var reader = new Reader<>(database, RiskInfo.SCHEMA)) {
            assertEquals(new RiskInfo(87, "SCAN", "US"), reader.findInfo("45.1.2.3", "CN"));
            assertEquals(new RiskInfo(0, "", "RU"), reader.findInfo("46.1.2.3", "CN"));
            assertEquals(new RiskInfo(0, "PROXY", "CN"), reader.findInfo("47.1.2.3", "CN"));
            assertEquals(new RiskInfo(0, "SCAN", "DE"), reader.findInfo("48.1.2.3", "CN"));
        }
    }

    @Test
    public void testFieldOrderFollowsTheDatabase() throws Exception {
        byte[] database = new IpdbWriter(List.of("country_code", "score"), "CN")
            .insert("45.0.0.0/8", "US", "12")
            .write();

        try (var reader = new Reader<>(database, RiskInfo.SCHEMA)) {
            assertEquals(new RiskInfo(12, "", "US"), reader.findInfo("45.1.2.3", "CN"));
        }
    }
}
