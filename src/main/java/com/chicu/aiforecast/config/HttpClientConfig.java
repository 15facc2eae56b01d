package com.chicu.aiforecast.config;

import com.chicu.aiforecast.common.enums.SourceKind;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * HTTP-клиенты источников: общий пул соединений + таймаут на источник.
 */
@Configuration
public class HttpClientConfig {

    /** Таймаут вызова источника, если sources.&lt;id&gt;.timeout-ms не задан. */
    public static final int DEFAULT_SOURCE_TIMEOUT_MS = 10_000;

    /** Нижняя граница: меньшие значения из конфига поднимаются до неё. */
    public static final int MIN_SOURCE_TIMEOUT_MS = 500;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * 🌐 Базовый клиент. read/write = самый длинный таймаут среди источников,
     * чтобы call-таймаут источника срабатывал раньше сокетного.
     */
    @Bean
    public OkHttpClient okHttpClient(SourceProperties sources) {
        Duration io = Duration.ofMillis(longestSourceTimeoutMs(sources));
        return new OkHttpClient.Builder()
                .connectTimeout(CONNECT_TIMEOUT.compareTo(io) < 0 ? CONNECT_TIMEOUT : io)
                .readTimeout(io)
                .writeTimeout(io)
                .retryOnConnectionFailure(true)
                .build();
    }

    /**
     * Клиент конкретного источника: тот же пул, свой callTimeout.
     */
    public static OkHttpClient forSource(OkHttpClient base, SourceProperties.Settings settings) {
        return base.newBuilder()
                .callTimeout(Duration.ofMillis(sourceTimeoutMs(settings)))
                .build();
    }

    public static int sourceTimeoutMs(SourceProperties.Settings settings) {
        int configured = settings.getTimeoutMs() > 0 ? settings.getTimeoutMs() : DEFAULT_SOURCE_TIMEOUT_MS;
        return Math.max(MIN_SOURCE_TIMEOUT_MS, configured);
    }

    static int longestSourceTimeoutMs(SourceProperties sources) {
        int max = MIN_SOURCE_TIMEOUT_MS;
        for (SourceKind kind : SourceKind.values()) {
            max = Math.max(max, sourceTimeoutMs(sources.forSource(kind)));
        }
        return max;
    }
}
