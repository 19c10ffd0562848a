package com.poolpulse.indexer.modules.monitoring;

public enum Severity {
    WARNING,
    ERROR
}
