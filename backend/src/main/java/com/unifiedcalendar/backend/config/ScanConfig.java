package com.unifiedcalendar.backend.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scan")
@Data
public class ScanConfig {

    // Retry policy for acquiring raw candidates from a scraper or feed
    private int maxAttempts = 3;
    private Duration retryDelay = Duration.ofSeconds(2);

    // Wait after driving the "next period" navigation before scraping again
    private Duration navigationSettle = Duration.ofSeconds(3);

    private int defaultLookbackDays = 14;
    private int maxEmailsPerAccount = 50;

    // Feed events that ended more than this many days ago are not surfaced
    private int staleFeedDays = 7;

    private Duration feedTimeout = Duration.ofSeconds(30);
    private String feedUserAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    // Number of scan log rows kept after each scan
    private int logRetention = 500;

    // Empty means the JVM default zone
    private String zone = "";

    private Schedule schedule = new Schedule();

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private Duration interval = Duration.ofHours(4);
    }
}
