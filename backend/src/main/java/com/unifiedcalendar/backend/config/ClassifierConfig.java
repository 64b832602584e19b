package com.unifiedcalendar.backend.config;

import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for the email meeting classifier. The lists are a starting
 * configuration and are expected to be adjusted per deployment.
 */
@ConfigurationProperties(prefix = "classifier")
@Data
public class ClassifierConfig {

    private int meetingThreshold = 3;
    private int highConfidenceThreshold = 5;

    private boolean oracleEnabled = true;

    private int defaultDurationMinutes = 60;

    // Explicit scheduling vocabulary
    private List<String> schedulingKeywords = Arrays.asList(
            "meeting", "meet", "appointment", "interview", "schedule", "scheduled",
            "reschedule", "invite", "invitation", "call", "calendar", "sync", "catch up",
            "booking", "reservation", "available"
    );

    // Video-call platform names
    private List<String> platformKeywords = Arrays.asList(
            "zoom", "teams", "google meet", "meet.google", "webex", "skype", "whereby", "hangouts"
    );

    // Sender address fragments that mark automated mail
    private List<String> automatedSenderPatterns = Arrays.asList(
            "no-reply", "noreply", "do-not-reply", "donotreply", "digest", "newsletter",
            "notification", "notifications", "mailer-daemon", "updates@", "news@"
    );

    private int schedulingWeight = 2;
    private int platformWeight = 2;
    private int subjectTimeWeight = 2;
    private int subjectDateWeight = 2;
    private int withPersonWeight = 1;
    private int automatedSenderPenalty = 3;
}
