package com.chicu.aiforecast.source.weather;

import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.source.RawRecord;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeatherConnectorTest {

    @Test
    void parse_shouldMapForecastListToRecords() {
        WeatherConnector connector = new WeatherConnector(new OkHttpClient(), new SourceProperties());
        String body = """
                {"cod": "200", "list": [
                  {"dt": 1710072000, "main": {"temp": 7.5, "humidity": 81, "pressure": 1012},
                   "wind": {"speed": 4.1}, "weather": [{"description": "light rain"}]},
                  {"dt": 1710082800, "main": {"temp": 9.0, "pressure": 1011}, "weather": []}
                ]}
                """;

        List<RawRecord> recs = connector.parse(body, Instant.parse("2024-03-10T12:00:00Z"));

        assertEquals(2, recs.size());
        assertEquals(Instant.ofEpochSecond(1710072000), recs.get(0).timestamp());
        assertEquals(7.5, ((Number) recs.get(0).field("temperature")).doubleValue(), 1e-9);
        assertEquals("light rain", recs.get(0).field("description"));
        assertNull(recs.get(1).field("humidity"));
        assertNull(recs.get(1).field("wind_speed"));
        assertNull(recs.get(1).field("description"));
    }
}
