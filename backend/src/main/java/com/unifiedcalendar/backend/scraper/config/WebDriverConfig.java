package com.unifiedcalendar.backend.scraper.config;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.openqa.selenium.firefox.FirefoxProfile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

/**
 * Browser for the calendar and mail scrapers. Account sessions come from the
 * configured browser profile, so the profile must already be signed in.
 */
@Configuration
@Slf4j
public class WebDriverConfig {

    @Value("${scraper.webdriver.type:chrome}")
    private String webDriverType;

    @Value("${scraper.webdriver.headless:true}")
    private boolean headless;

    @Value("${scraper.webdriver.timeout:30}")
    private int timeoutSeconds;

    @Value("${scraper.webdriver.window.width:1920}")
    private int windowWidth;

    @Value("${scraper.webdriver.window.height:1080}")
    private int windowHeight;

    // Signed-in browser profile; empty means a fresh profile
    @Value("${scraper.webdriver.profile-dir:}")
    private String profileDir;

    @Bean
    @Scope("prototype")
    public WebDriver webDriver() {
        log.info("Creating WebDriver instance: type={}, headless={}, profile={}",
                webDriverType, headless, profileDir.isBlank() ? "<none>" : profileDir);

        WebDriver driver = switch (webDriverType.toLowerCase()) {
            case "firefox" -> createFirefoxDriver();
            default -> createChromeDriver();
        };

        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(timeoutSeconds));
        // Scrapers use findElements for optional parts, so keep implicit waits short
        driver.manage().timeouts().implicitlyWait(Duration.ofSeconds(2));
        driver.manage().window().setSize(new Dimension(windowWidth, windowHeight));
        return driver;
    }

    private WebDriver createChromeDriver() {
        ChromeOptions options = new ChromeOptions();

        if (headless) {
            options.addArguments("--headless=new");
        }
        if (!profileDir.isBlank()) {
            options.addArguments("--user-data-dir=" + profileDir);
        }

        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-extensions");
        options.addArguments("--lang=en-US");

        return new ChromeDriver(options);
    }

    private WebDriver createFirefoxDriver() {
        FirefoxOptions options = new FirefoxOptions();

        if (headless) {
            options.addArguments("--headless");
        }
        if (!profileDir.isBlank()) {
            options.setProfile(new FirefoxProfile(new java.io.File(profileDir)));
        }
        options.addPreference("intl.accept_languages", "en-US");

        return new FirefoxDriver(options);
    }
}
