package com.poolpulse.indexer.entity;

/**
 * Account classification. BOT and MEV are reserved for offline analysis.
 */
public enum UserType {
    RETAIL,
    WHALE,
    BOT,
    LP,
    MEV
}
