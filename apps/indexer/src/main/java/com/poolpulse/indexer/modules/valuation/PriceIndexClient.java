package com.poolpulse.indexer.modules.valuation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.util.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * USD prices from a CoinGecko-compatible HTTP price index.
 * Lookups return null when the index has no price or every attempt failed.
 */
@Slf4j
@Component
public class PriceIndexClient {

    private static final Map<String, String> SYMBOL_IDS = Map.of(
            "WETH", "weth",
            "ETH", "ethereum",
            "USDC", "usd-coin",
            "USDT", "tether",
            "DAI", "dai",
            "WBTC", "wrapped-bitcoin",
            "ARB", "arbitrum",
            "UNI", "uniswap",
            "LINK", "chainlink",
            "AAVE", "aave");

    private static final Map<Long, String> PLATFORMS = Map.of(
            1L, "ethereum",
            42161L, "arbitrum-one",
            137L, "polygon-pos",
            56L, "binance-smart-chain");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final RetryPolicy retryPolicy;

    @Autowired
    public PriceIndexClient(@Qualifier("priceIndexRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            PoolPulseProperties properties) {
        this(restTemplate, objectMapper, properties.getValuation().getPriceIndex().getBaseUrl(),
                new RetryPolicy(
                        properties.getValuation().getPriceIndex().getAttempts(),
                        Duration.ofMillis(properties.getValuation().getPriceIndex().getDelayMs()),
                        Duration.ofMillis(properties.getValuation().getPriceIndex().getTimeoutMs())));
    }

    public PriceIndexClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, RetryPolicy retryPolicy) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Price index id for a token symbol. Unknown symbols map to their lowercase form.
     */
    public static String symbolId(String symbol) {
        return SYMBOL_IDS.getOrDefault(symbol.toUpperCase(Locale.ROOT), symbol.toLowerCase(Locale.ROOT));
    }

    public static String platform(long chainId) {
        return PLATFORMS.get(chainId);
    }

    public Double priceBySymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        String id = symbolId(symbol);
        return retryPolicy.executeOrNull("price index lookup " + id, () -> {
            String body = restTemplate.getForObject(
                    baseUrl + "/simple/price?ids={id}&vs_currencies=usd", String.class, id);
            return usdField(body, id);
        });
    }

    public Double priceByAddress(long chainId, String tokenAddress) {
        String platform = platform(chainId);
        if (platform == null || tokenAddress == null) {
            log.debug("No price index platform for chain {}", chainId);
            return null;
        }
        String address = tokenAddress.toLowerCase(Locale.ROOT);
        return retryPolicy.executeOrNull("price index lookup " + platform + ":" + address, () -> {
            String body = restTemplate.getForObject(
                    baseUrl + "/simple/token_price/{platform}?contract_addresses={address}&vs_currencies=usd",
                    String.class, platform, address);
            return usdField(body, address);
        });
    }

    private Double usdField(String body, String key) throws Exception {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode usd = objectMapper.readTree(body).path(key).path("usd");
        if (!usd.isNumber() || usd.asDouble() <= 0) {
            return null;
        }
        return usd.asDouble();
    }
}
