package com.unifiedcalendar.backend.scan;

import lombok.Value;

/**
 * What one running scan hands to each of its phases.
 */
@Value
public class ScanContext {
    ScanState state;
    CancellationToken token;
    ScanOptions options;

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
