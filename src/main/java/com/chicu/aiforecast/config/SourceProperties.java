package com.chicu.aiforecast.config;

import com.chicu.aiforecast.common.enums.SourceKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "sources")
public class SourceProperties {

    private Settings epidemic = Settings.withBaseUrl("https://disease.sh");
    private Settings weather = Settings.withBaseUrl("https://api.openweathermap.org");
    private Settings market = Settings.withBaseUrl("https://www.alphavantage.co");

    public Settings forSource(SourceKind kind) {
        return switch (kind) {
            case EPIDEMIC -> epidemic;
            case WEATHER -> weather;
            case MARKET -> market;
        };
    }

    @Data
    public static class Settings {

        private boolean enabled = true;

        private String baseUrl;

        /**
         * Пустой ключ у key-gated источника → синтетический fallback (degraded).
         */
        private String apiKey = "";

        private int timeoutMs = HttpClientConfig.DEFAULT_SOURCE_TIMEOUT_MS;

        private int maxAttempts = 3;

        /**
         * Первая пауза между попытками, дальше удваивается.
         */
        private long backoffMs = 500L;

        private int lookbackDays = 30;

        private String city = "New York";

        private String symbol = "AAPL";

        private long syntheticSeed = 42L;

        private int syntheticRecords = 60;

        /**
         * Дефолты колонок для forward-fill, перекрывают встроенные дефолты схемы.
         */
        private Map<String, Double> defaults = new LinkedHashMap<>();

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        static Settings withBaseUrl(String url) {
            Settings s = new Settings();
            s.setBaseUrl(url);
            return s;
        }
    }
}
