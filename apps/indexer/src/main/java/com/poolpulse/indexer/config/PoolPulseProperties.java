package com.poolpulse.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Indexer configuration bound from {@code poolpulse.*} in application.yaml.
 */
@Component
@ConfigurationProperties(prefix = "poolpulse")
public class PoolPulseProperties {

    private Rpc rpc = new Rpc();
    private Pool pool = new Pool();
    private Valuation valuation = new Valuation();
    private Processing processing = new Processing();
    private Aggregation aggregation = new Aggregation();
    private UserStats userStats = new UserStats();
    private Metrics metrics = new Metrics();
    private Integrity integrity = new Integrity();
    private Bootstrap bootstrap = new Bootstrap();

    public Rpc getRpc() {
        return rpc;
    }

    public void setRpc(Rpc rpc) {
        this.rpc = rpc;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Valuation getValuation() {
        return valuation;
    }

    public void setValuation(Valuation valuation) {
        this.valuation = valuation;
    }

    public Processing getProcessing() {
        return processing;
    }

    public void setProcessing(Processing processing) {
        this.processing = processing;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public UserStats getUserStats() {
        return userStats;
    }

    public void setUserStats(UserStats userStats) {
        this.userStats = userStats;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Integrity getIntegrity() {
        return integrity;
    }

    public void setIntegrity(Integrity integrity) {
        this.integrity = integrity;
    }

    public Bootstrap getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(Bootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    /**
     * Chain RPC endpoint and its retry budget.
     */
    public static class Rpc {

        /**
         * HTTP or WebSocket endpoint. ws:// and wss:// use a WebSocket transport.
         */
        private String url;

        private int attempts = 3;

        private long delayMs = 2_000;

        /**
         * Per-attempt timeout.
         */
        private long timeoutMs = 30_000;

        /**
         * Log filter polling interval for HTTP transports.
         */
        private long pollingIntervalMs = 2_000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getPollingIntervalMs() {
            return pollingIntervalMs;
        }

        public void setPollingIntervalMs(long pollingIntervalMs) {
            this.pollingIntervalMs = pollingIntervalMs;
        }
    }

    public static class Pool {

        /**
         * Monitored pool contract address.
         */
        private String address;

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }
    }

    public static class Valuation {

        /**
         * On-chain quoter used for unit prices.
         */
        private String quoterAddress = "0xb27308f9F90D607463bb33eA1BeBb41C27CE5AB6";

        /**
         * Fee tiers tried in ascending order.
         */
        private List<Integer> feeTiers = new ArrayList<>(List.of(100, 500, 3000, 10000));

        private long cacheTtlMinutes = 10;

        private long cacheMaxSize = 1_000;

        /**
         * USD quote token per chain id. Chains without an entry use {@link #defaultUsdToken}.
         */
        private Map<Long, String> usdTokens = new HashMap<>(Map.of(
                42161L, "0xaf88d065e77c8cc2239327c5edb3a432268e5831"));

        private String defaultUsdToken = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

        /**
         * Addresses valued at face value, without a price lookup.
         */
        private List<String> stablecoins = new ArrayList<>(List.of(
                "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48",
                "0xdac17f958d2ee523a2206206994597c13d831ec7",
                "0xaf88d065e77c8cc2239327c5edb3a432268e5831",
                "0xfd086bc7cd5c481dcc9c85ebe478a1c0b69fcbb9",
                "0xda10009cbd5d07dd0cecc66161fc93d7c9000da1"));

        private PriceIndex priceIndex = new PriceIndex();

        public String getQuoterAddress() {
            return quoterAddress;
        }

        public void setQuoterAddress(String quoterAddress) {
            this.quoterAddress = quoterAddress;
        }

        public List<Integer> getFeeTiers() {
            return feeTiers;
        }

        public void setFeeTiers(List<Integer> feeTiers) {
            this.feeTiers = feeTiers;
        }

        public long getCacheTtlMinutes() {
            return cacheTtlMinutes;
        }

        public void setCacheTtlMinutes(long cacheTtlMinutes) {
            this.cacheTtlMinutes = cacheTtlMinutes;
        }

        public long getCacheMaxSize() {
            return cacheMaxSize;
        }

        public void setCacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
        }

        public Map<Long, String> getUsdTokens() {
            return usdTokens;
        }

        public void setUsdTokens(Map<Long, String> usdTokens) {
            this.usdTokens = usdTokens;
        }

        public String getDefaultUsdToken() {
            return defaultUsdToken;
        }

        public void setDefaultUsdToken(String defaultUsdToken) {
            this.defaultUsdToken = defaultUsdToken;
        }

        public List<String> getStablecoins() {
            return stablecoins;
        }

        public void setStablecoins(List<String> stablecoins) {
            this.stablecoins = stablecoins;
        }

        public PriceIndex getPriceIndex() {
            return priceIndex;
        }

        public void setPriceIndex(PriceIndex priceIndex) {
            this.priceIndex = priceIndex;
        }
    }

    /**
     * External USD price index (CoinGecko compatible).
     */
    public static class PriceIndex {

        private String baseUrl = "https://api.coingecko.com/api/v3";

        private int attempts = 3;

        private long delayMs = 2_000;

        private long timeoutMs = 15_000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Processing {

        /**
         * Workers consuming decoded pool events.
         */
        private int workerThreads = 4;

        /**
         * Pending events held before the subscription thread runs them itself.
         */
        private int queueCapacity = 1_000;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Aggregation {

        /**
         * Pool fee rate used for fee estimates.
         */
        private BigDecimal feeRate = new BigDecimal("0.0005");

        /**
         * USD value above which a swap counts as a whale transaction.
         */
        private BigDecimal whaleTransactionUsd = new BigDecimal("10000");

        /**
         * Zone used to align hourly and daily buckets.
         */
        private String zone = "UTC";

        public BigDecimal getFeeRate() {
            return feeRate;
        }

        public void setFeeRate(BigDecimal feeRate) {
            this.feeRate = feeRate;
        }

        public BigDecimal getWhaleTransactionUsd() {
            return whaleTransactionUsd;
        }

        public void setWhaleTransactionUsd(BigDecimal whaleTransactionUsd) {
            this.whaleTransactionUsd = whaleTransactionUsd;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class UserStats {

        private BigDecimal whaleUsd = new BigDecimal("100000");

        private BigDecimal retailUsd = new BigDecimal("100");

        public BigDecimal getWhaleUsd() {
            return whaleUsd;
        }

        public void setWhaleUsd(BigDecimal whaleUsd) {
            this.whaleUsd = whaleUsd;
        }

        public BigDecimal getRetailUsd() {
            return retailUsd;
        }

        public void setRetailUsd(BigDecimal retailUsd) {
            this.retailUsd = retailUsd;
        }
    }

    public static class Metrics {

        private long flushIntervalMs = 30_000;

        /**
         * Buffer size that triggers an immediate flush.
         */
        private int flushThreshold = 1_000;

        /**
         * Number of recent metrics kept in memory for real-time statistics.
         */
        private int recentWindow = 1_000;

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public int getFlushThreshold() {
            return flushThreshold;
        }

        public void setFlushThreshold(int flushThreshold) {
            this.flushThreshold = flushThreshold;
        }

        public int getRecentWindow() {
            return recentWindow;
        }

        public void setRecentWindow(int recentWindow) {
            this.recentWindow = recentWindow;
        }
    }

    public static class Integrity {

        /**
         * Block distance between adjacent swaps that counts as a gap.
         */
        private long gapThreshold = 10;

        private int mismatchSampleLimit = 10;

        public long getGapThreshold() {
            return gapThreshold;
        }

        public void setGapThreshold(long gapThreshold) {
            this.gapThreshold = gapThreshold;
        }

        public int getMismatchSampleLimit() {
            return mismatchSampleLimit;
        }

        public void setMismatchSampleLimit(int mismatchSampleLimit) {
            this.mismatchSampleLimit = mismatchSampleLimit;
        }
    }

    public static class Bootstrap {

        /**
         * Load token info, start the scheduler and attach the pool once the application is ready.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
