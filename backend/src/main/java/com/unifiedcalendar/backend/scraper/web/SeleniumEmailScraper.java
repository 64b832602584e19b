package com.unifiedcalendar.backend.scraper.web;

import com.unifiedcalendar.backend.account.Account;
import com.unifiedcalendar.backend.account.AccountPlatform;
import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.scan.RetryPolicy;
import com.unifiedcalendar.backend.scraper.EmailScraper;
import com.unifiedcalendar.backend.scraper.RawEmail;
import com.unifiedcalendar.backend.scraper.ScraperException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Gmail "All Mail" list rows read through a Selenium-driven browser.
 */
@Component
@Slf4j
public class SeleniumEmailScraper implements EmailScraper {

    // Gmail changes its markup; the first selector with rows wins
    private static final List<String> ROW_SELECTORS = List.of("tr.zA", "div[role='row']", ".aDP.bq");
    private static final Pattern MESSAGE_ID = Pattern.compile("#[^/]+/([^/?]+)");

    private final ObjectProvider<WebDriver> driverProvider;
    private final ScanConfig scanConfig;

    @Value("${scraper.enabled:false}")
    private boolean enabled;

    public SeleniumEmailScraper(ObjectProvider<WebDriver> driverProvider, ScanConfig scanConfig) {
        this.driverProvider = driverProvider;
        this.scanConfig = scanConfig;
    }

    @Override
    public List<RawEmail> scanVisibleEmails(Account account, int lookbackDays) {
        if (!enabled) {
            throw new ScraperException("Browser scraping is disabled (scraper.enabled=false)");
        }
        AccountPlatform platform = account.getPlatform() != null ? account.getPlatform() : AccountPlatform.GOOGLE;
        if (!platform.isSupportsEmailScan()) {
            throw new ScraperException("No mail scraper for " + platform);
        }

        WebDriver driver;
        try {
            driver = driverProvider.getObject();
        } catch (BeansException e) {
            throw new ScraperException("Could not start browser: " + e.getMessage(), e);
        }

        try {
            String url = platform.mailUrl(account.getAccountIndex() == null ? 0 : account.getAccountIndex());
            log.info("📬 Opening mail for {} (lookback {} days)", account.getName(), lookbackDays);
            driver.get(url);
            RetryPolicy.sleep(scanConfig.getNavigationSettle());

            List<RawEmail> emails = new ArrayList<>();
            for (WebElement row : findRows(driver)) {
                RawEmail email = extractRow(row);
                if (email != null) {
                    emails.add(email);
                }
            }
            log.debug("Mail list for {} yielded {} rows", account.getName(), emails.size());
            return emails;
        } catch (WebDriverException e) {
            throw new ScraperException("Mail scrape failed for " + account.getName() + ": " + e.getMessage(), e);
        } finally {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.debug("WebDriver quit failed: {}", e.getMessage());
            }
        }
    }

    private static List<WebElement> findRows(WebDriver driver) {
        for (String selector : ROW_SELECTORS) {
            List<WebElement> rows = driver.findElements(By.cssSelector(selector));
            if (!rows.isEmpty()) {
                return rows;
            }
        }
        return List.of();
    }

    private static RawEmail extractRow(WebElement row) {
        String id = null;
        WebElement link = first(row, "a[href*='#']");
        if (link != null) {
            Matcher m = MESSAGE_ID.matcher(String.valueOf(link.getDomAttribute("href")));
            if (m.find()) {
                id = m.group(1);
            }
        }
        WebElement subjectEl = first(row, ".y6 span, .bog, [data-thread-id]");
        String threadId = subjectEl != null ? subjectEl.getDomAttribute("data-legacy-thread-id") : null;
        if (id == null) {
            id = threadId;
        }

        String subject = text(subjectEl);
        if (id == null && subject.isEmpty()) {
            return null;
        }

        WebElement senderEl = first(row, ".yW span[email], .yP, .zF");
        String from = senderEl == null ? "" : senderEl.getDomAttribute("email");
        if (from == null || from.isBlank()) {
            from = text(senderEl);
        }

        WebElement dateEl = first(row, ".xW span, .bq3");
        String timestampText = text(dateEl);
        if (timestampText.isEmpty() && dateEl != null) {
            timestampText = String.valueOf(dateEl.getDomAttribute("title"));
        }

        return RawEmail.builder()
                .id(id)
                .threadId(threadId)
                .subject(subject.isEmpty() ? "No Subject" : subject)
                .from(from)
                .timestampText(timestampText)
                .snippet(text(first(row, ".y2, .Zs")))
                .build();
    }

    private static WebElement first(SearchContext context, String selector) {
        List<WebElement> found = context.findElements(By.cssSelector(selector));
        return found.isEmpty() ? null : found.get(0);
    }

    private static String text(WebElement element) {
        if (element == null || element.getText() == null) {
            return "";
        }
        return element.getText().trim();
    }
}
