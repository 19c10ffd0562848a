package com.poolpulse.indexer.modules.chains.model;

import lombok.Value;

/**
 * ERC-20 metadata of one pool token.
 */
@Value
public class TokenInfo {

    String address;
    int decimals;
    String symbol;

    public TokenInfo(String address, int decimals, String symbol) {
        this.address = address != null ? address.toLowerCase() : null;
        this.decimals = decimals;
        this.symbol = symbol != null ? symbol : "";
    }
}
