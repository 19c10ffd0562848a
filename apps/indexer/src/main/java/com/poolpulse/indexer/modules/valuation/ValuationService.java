package com.poolpulse.indexer.modules.valuation;

import com.github.benmanes.caffeine.cache.Cache;
import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * USD valuation of pool events.
 *
 * <p>Resolution order: stablecoin face value, then the on-chain quoter, then the external
 * price index by symbol and by contract address. Resolved unit prices are cached per
 * (token pair, quote side). A null result means no source could price the event.
 */
@Slf4j
@Service
public class ValuationService {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final StablecoinRegistry stablecoinRegistry;
    private final QuoterClient quoterClient;
    private final PriceIndexClient priceIndexClient;
    private final ChainRpcClient rpcClient;
    private final Cache<String, Double> priceCache;

    public ValuationService(StablecoinRegistry stablecoinRegistry,
                            QuoterClient quoterClient,
                            PriceIndexClient priceIndexClient,
                            ChainRpcClient rpcClient,
                            @Qualifier("usdPriceCache") Cache<String, Double> priceCache) {
        this.stablecoinRegistry = stablecoinRegistry;
        this.quoterClient = quoterClient;
        this.priceIndexClient = priceIndexClient;
        this.rpcClient = rpcClient;
        this.priceCache = priceCache;
    }

    /**
     * USD value of an event given both readable token amounts.
     *
     * @param amount0     readable token0 amount, sign ignored
     * @param amount1     readable token1 amount, sign ignored
     * @param token0      pool token0
     * @param token1      pool token1
     * @param aggregation how two resolved sides combine
     * @return USD value, or null if neither side could be priced
     */
    public BigDecimal usdValue(BigDecimal amount0, BigDecimal amount1,
                               TokenInfo token0, TokenInfo token1, UsdAggregation aggregation) {
        if (stablecoinRegistry.isStablecoin(token0.getAddress())) {
            return amount0.abs();
        }
        if (stablecoinRegistry.isStablecoin(token1.getAddress())) {
            return amount1.abs();
        }

        Double price0 = tokenUsdPrice(token0, token1, 0);
        Double price1 = tokenUsdPrice(token1, token0, 1);

        BigDecimal value0 = price0 != null ? amount0.abs().multiply(BigDecimal.valueOf(price0)) : null;
        BigDecimal value1 = price1 != null ? amount1.abs().multiply(BigDecimal.valueOf(price1)) : null;

        if (value0 != null && value1 != null) {
            BigDecimal total = value0.add(value1);
            return aggregation == UsdAggregation.SUM ? total : total.divide(TWO, MathContext.DECIMAL64);
        }
        if (value0 != null) {
            return value0;
        }
        if (value1 != null) {
            return value1;
        }
        log.warn("No USD price source for {}/{}", token0.getSymbol(), token1.getSymbol());
        return null;
    }

    /**
     * USD price of one whole token, with the same resolution order and cache as {@link #usdValue}.
     *
     * @param token       token to price
     * @param counterpart the other token of the pool
     * @param side        0 when {@code token} is token0, 1 when it is token1
     */
    public Double tokenUsdPrice(TokenInfo token, TokenInfo counterpart, int side) {
        if (stablecoinRegistry.isStablecoin(token.getAddress())) {
            return 1.0;
        }
        String key = cacheKey(token, counterpart, side);
        return priceCache.get(key, k -> resolve(token));
    }

    private Double resolve(TokenInfo token) {
        Double price = quoterClient.quoteUsdPrice(token);
        if (isPriced(price)) {
            return price;
        }

        price = priceIndexClient.priceBySymbol(token.getSymbol());
        if (isPriced(price)) {
            log.info("Priced {} from price index by symbol: {}", token.getSymbol(), price);
            return price;
        }

        try {
            price = priceIndexClient.priceByAddress(rpcClient.getChainId(), token.getAddress());
        } catch (RuntimeException e) {
            log.warn("Chain id unavailable for address lookup of {}: {}", token.getAddress(), e.getMessage());
            return null;
        }
        if (!isPriced(price)) {
            return null;
        }
        log.info("Priced {} from price index by address: {}", token.getAddress(), price);
        return price;
    }

    // A zero or negative quote counts as unpriced.
    private static boolean isPriced(Double price) {
        return price != null && price > 0;
    }

    private static String cacheKey(TokenInfo token, TokenInfo counterpart, int side) {
        String pair = side == 0
                ? token.getAddress() + "/" + counterpart.getAddress()
                : counterpart.getAddress() + "/" + token.getAddress();
        return pair + "#" + side;
    }
}
