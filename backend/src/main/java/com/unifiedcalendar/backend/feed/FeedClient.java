package com.unifiedcalendar.backend.feed;

import com.unifiedcalendar.backend.config.ScanConfig;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Downloads private calendar feeds. One attempt per call; retries belong to the scan.
 */
@Component
@Slf4j
public class FeedClient {

    private final ScanConfig scanConfig;

    public FeedClient(ScanConfig scanConfig) {
        this.scanConfig = scanConfig;
    }

    public String fetch(String feedUrl) {
        if (feedUrl == null || feedUrl.isBlank()) {
            throw new FeedException("Account has no feed URL");
        }
        try {
            Connection.Response response = Jsoup.connect(feedUrl)
                    .userAgent(scanConfig.getFeedUserAgent())
                    .timeout((int) scanConfig.getFeedTimeout().toMillis())
                    .ignoreContentType(true)
                    .maxBodySize(0)
                    .execute();
            String body = response.body();
            log.debug("Fetched {} chars from feed (HTTP {})", body.length(), response.statusCode());
            return body;
        } catch (IOException e) {
            throw new FeedException("Failed to fetch feed: " + e.getMessage(), e);
        }
    }
}
