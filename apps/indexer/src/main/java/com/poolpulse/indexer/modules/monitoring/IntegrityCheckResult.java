package com.poolpulse.indexer.modules.monitoring;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one integrity check. A check passes when it found no issue.
 */
@Value
public class IntegrityCheckResult {
    String checkType;
    Instant timestamp;
    boolean passed;
    List<IntegrityIssue> issues;
    Map<String, Object> details;

    public static IntegrityCheckResult of(String checkType, Instant timestamp,
                                          List<IntegrityIssue> issues, Map<String, Object> details) {
        return new IntegrityCheckResult(checkType, timestamp, issues.isEmpty(), List.copyOf(issues), details);
    }

    public static IntegrityCheckResult failed(String checkType, Instant timestamp, Exception cause) {
        return new IntegrityCheckResult(checkType, timestamp, false,
                List.of(new IntegrityIssue(Severity.ERROR, "check failed: " + cause.getMessage(), 0)),
                Map.of());
    }
}
