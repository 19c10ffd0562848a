package com.poolpulse.indexer.modules.monitoring;

import lombok.Value;

@Value
public class IntegrityIssue {
    Severity severity;
    String message;
    long affectedCount;
}
