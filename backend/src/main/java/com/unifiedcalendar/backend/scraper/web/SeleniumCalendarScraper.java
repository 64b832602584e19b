package com.unifiedcalendar.backend.scraper.web;

import com.unifiedcalendar.backend.account.Account;
import com.unifiedcalendar.backend.account.AccountPlatform;
import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.scan.RetryPolicy;
import com.unifiedcalendar.backend.scraper.CalendarScraper;
import com.unifiedcalendar.backend.scraper.CalendarView;
import com.unifiedcalendar.backend.scraper.RawCalendarEvent;
import com.unifiedcalendar.backend.scraper.ScraperException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Calendar week views read through a Selenium-driven browser.
 */
@Component
@Slf4j
public class SeleniumCalendarScraper implements CalendarScraper {

    private static final int PAGE_WAIT_SECONDS = 15;

    private static final String GOOGLE_CHIP_SELECTOR = "[data-eventchip]";
    private static final String OUTLOOK_EVENT_SELECTOR = "button[aria-label*='to'], div[aria-label*='to']";
    private static final List<String> NEXT_BUTTON_SELECTORS = List.of(
            "[data-value='next']",
            "button[aria-label*='Next']",
            "button[aria-label*='Forward']",
            "button[title*='Next']");

    private final ObjectProvider<WebDriver> driverProvider;
    private final ScanConfig scanConfig;
    private final Clock clock;
    private final GoogleCalendarLabelParser googleParser = new GoogleCalendarLabelParser();
    private final OutlookCalendarLabelParser outlookParser = new OutlookCalendarLabelParser();

    @Value("${scraper.enabled:false}")
    private boolean enabled;

    public SeleniumCalendarScraper(ObjectProvider<WebDriver> driverProvider, ScanConfig scanConfig, Clock clock) {
        this.driverProvider = driverProvider;
        this.scanConfig = scanConfig;
        this.clock = clock;
    }

    @Override
    public CalendarView open(Account account) {
        if (!enabled) {
            throw new ScraperException("Browser scraping is disabled (scraper.enabled=false)");
        }
        AccountPlatform platform = account.getPlatform() != null ? account.getPlatform() : AccountPlatform.GOOGLE;

        WebDriver driver;
        try {
            driver = driverProvider.getObject();
        } catch (BeansException e) {
            throw new ScraperException("Could not start browser: " + e.getMessage(), e);
        }

        try {
            String url = platform.calendarUrl(account.getAccountIndex() == null ? 0 : account.getAccountIndex());
            log.info("📅 Opening calendar for {}: {}", account.getName(), url);
            driver.get(url);
            new WebDriverWait(driver, Duration.ofSeconds(PAGE_WAIT_SECONDS))
                    .until(ExpectedConditions.presenceOfElementLocated(By.tagName("body")));
            RetryPolicy.sleep(scanConfig.getNavigationSettle());
            return new WebCalendarView(driver, account, platform);
        } catch (WebDriverException e) {
            quitQuietly(driver);
            throw new ScraperException("Could not open calendar for " + account.getName() + ": " + e.getMessage(), e);
        }
    }

    private static void quitQuietly(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("WebDriver quit failed: {}", e.getMessage());
        }
    }

    private class WebCalendarView implements CalendarView {

        private final WebDriver driver;
        private final Account account;
        private final AccountPlatform platform;

        WebCalendarView(WebDriver driver, Account account, AccountPlatform platform) {
            this.driver = driver;
            this.account = account;
            this.platform = platform;
        }

        @Override
        public List<RawCalendarEvent> scrapeVisibleEvents() {
            try {
                return platform == AccountPlatform.OUTLOOK ? scrapeOutlook() : scrapeGoogle();
            } catch (WebDriverException e) {
                throw new ScraperException("Calendar scrape failed: " + e.getMessage(), e);
            }
        }

        private List<RawCalendarEvent> scrapeGoogle() {
            List<RawCalendarEvent> events = new ArrayList<>();
            Set<String> seenLabels = new HashSet<>();
            for (WebElement chip : driver.findElements(By.cssSelector(GOOGLE_CHIP_SELECTOR))) {
                String text = chip.getText();
                if (text == null || text.isBlank() || text.trim().equals("Add location")) {
                    continue;
                }
                String label = googleParser.labelPortion(text);
                if (!seenLabels.add(label)) {
                    continue;
                }
                RawCalendarEvent event = googleParser.parse(label, account.getName());
                if (event != null) {
                    events.add(event);
                } else {
                    log.debug("Unreadable event chip: {}", label);
                }
            }
            log.debug("Google calendar view for {} yielded {} events", account.getName(), events.size());
            return events;
        }

        private List<RawCalendarEvent> scrapeOutlook() {
            List<RawCalendarEvent> events = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            LocalDate today = LocalDate.now(clock);
            for (WebElement element : driver.findElements(By.cssSelector(OUTLOOK_EVENT_SELECTOR))) {
                String description = element.getDomAttribute("aria-label");
                if (description == null || description.length() < 20 || !description.contains(",")) {
                    continue;
                }
                RawCalendarEvent event = outlookParser.parse(description, today);
                if (event != null && seen.add(event.dedupeKey())) {
                    events.add(event);
                }
            }
            log.debug("Outlook calendar view for {} yielded {} events", account.getName(), events.size());
            return events;
        }

        @Override
        public void navigateNextPeriod() {
            for (String selector : NEXT_BUTTON_SELECTORS) {
                List<WebElement> buttons = driver.findElements(By.cssSelector(selector));
                if (!buttons.isEmpty()) {
                    try {
                        buttons.get(0).click();
                        return;
                    } catch (WebDriverException e) {
                        throw new ScraperException("Next period click failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new ScraperException("Next period button not found");
        }

        @Override
        public void close() {
            quitQuietly(driver);
        }
    }
}
