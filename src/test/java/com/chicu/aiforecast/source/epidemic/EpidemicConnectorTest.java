package com.chicu.aiforecast.source.epidemic;

import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.source.RawRecord;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EpidemicConnectorTest {

    private final EpidemicConnector connector = new EpidemicConnector(new OkHttpClient(), new SourceProperties());

    @Test
    void parse_shouldOrderDaysChronologically_acrossYearBoundary() {
        String body = """
                {"cases": {"1/2/20": 200, "12/31/19": 100, "1/1/20": 150},
                 "deaths": {"1/2/20": 2, "12/31/19": 1, "1/1/20": 1},
                 "recovered": {"1/2/20": 20, "12/31/19": 10}}
                """;

        List<RawRecord> recs = connector.parse(body, Instant.parse("2020-01-03T00:00:00Z"));

        assertEquals(3, recs.size());
        assertEquals(Instant.parse("2019-12-31T00:00:00Z"), recs.get(0).timestamp());
        assertEquals(Instant.parse("2020-01-02T00:00:00Z"), recs.get(2).timestamp());
        assertEquals(200, ((Number) recs.get(2).field("cases")).intValue());
        assertNull(recs.get(1).field("recovered"), "нет значения → null, заполнит нормализатор");
    }

    @Test
    void buildUrl_shouldUseLookbackDays() {
        HttpUrl url = connector.buildUrl(HttpUrl.get("https://disease.sh"));

        assertEquals("/v3/covid-19/historical/all", url.encodedPath());
        assertEquals("30", url.queryParameter("lastdays"));
    }
}
