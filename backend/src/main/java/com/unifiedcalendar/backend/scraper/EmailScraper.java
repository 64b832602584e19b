package com.unifiedcalendar.backend.scraper;

import com.unifiedcalendar.backend.account.Account;
import java.util.List;

public interface EmailScraper {

    /**
     * Reads the rows of the account's mail list view. Filtering by
     * {@code lookbackDays} is best effort here; the scan filters again.
     *
     * @throws ScraperException if the mail page cannot be opened
     */
    List<RawEmail> scanVisibleEmails(Account account, int lookbackDays);
}
