package com.poolpulse.indexer.modules.chains.model;

import lombok.Value;

import java.util.List;

/**
 * Subscription state reported to status queries.
 */
@Value
public class ListenerStatus {
    boolean listening;
    List<String> pools;
    int count;
}
