package com.govsense.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "govsense")
@Data
public class GovSenseProperties {

    private Refresh refresh = new Refresh();
    private Ingestion ingestion = new Ingestion();
    private Map<String, DatasetOverride> datasets = new LinkedHashMap<>();
    private Cache cache = new Cache();

    @Data
    public static class Refresh {
        /** Null disables periodic refreshes; manual triggers still work */
        private Duration interval;
        private Duration initialDelay = Duration.ofMinutes(1);
        private boolean runOnStartup = false;
        private int historySize = 10;
    }

    @Data
    public static class Ingestion {
        private String baseUrl = "https://www.data.gouv.fr/api/1";
        /** Per attempt, independent of the retry policy */
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Duration readTimeout = Duration.ofSeconds(120);
        private int fetchThreads = 3;
    }

    @Data
    public static class DatasetOverride {
        private String source;
    }

    @Data
    public static class Cache {
        private Duration defaultTtl = Duration.ofMinutes(5);

        /** Query type (e.g. region-stats) to ttl */
        private Map<String, Duration> ttl = new LinkedHashMap<>();

        public Duration ttlFor(String queryType) {
            return ttl.getOrDefault(queryType, defaultTtl);
        }
    }
}
