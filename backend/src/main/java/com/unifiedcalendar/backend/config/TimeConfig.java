package com.unifiedcalendar.backend.config;

import java.time.Clock;
import java.time.ZoneId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class TimeConfig {

    /**
     * Clock used for stale-feed cutoffs, email timestamp parsing and year roll-over.
     * Local (zone-less) feed timestamps are read in this clock's zone.
     */
    @Bean
    public Clock scanClock(ScanConfig scanConfig) {
        String zone = scanConfig.getZone();
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        log.info("Scan clock uses zone {}", zoneId);
        return Clock.system(zoneId);
    }
}
