package com.poolpulse.indexer.modules.snapshot;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.PoolSnapshot;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.valuation.PriceMath;
import com.poolpulse.indexer.modules.valuation.ValuationService;
import com.poolpulse.indexer.repository.SwapEventRepository;
import com.poolpulse.indexer.service.EventStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Hourly pool snapshot: on-chain state, TVL and trailing 24h activity.
 */
@Slf4j
@Service
public class PoolSnapshotService {

    private final PoolStateReader stateReader;
    private final ValuationService valuationService;
    private final SwapEventRepository swapRepository;
    private final EventStorageService storageService;
    private final PoolPulseProperties properties;

    private volatile PoolTokens tokens;

    public PoolSnapshotService(PoolStateReader stateReader,
                               ValuationService valuationService,
                               SwapEventRepository swapRepository,
                               EventStorageService storageService,
                               PoolPulseProperties properties) {
        this.stateReader = stateReader;
        this.valuationService = valuationService;
        this.swapRepository = swapRepository;
        this.storageService = storageService;
        this.properties = properties;
    }

    public void setTokenInfo(PoolTokens tokens) {
        this.tokens = tokens;
    }

    /**
     * Read the pool, build the snapshot for {@code snapshotTime} and upsert it.
     *
     * @throws IllegalStateException if the pool address or token info is missing
     */
    public PoolSnapshot createSnapshot(Instant snapshotTime) {
        String pool = properties.getPool().getAddress();
        if (pool == null || pool.isBlank()) {
            throw new IllegalStateException("poolpulse.pool.address is not configured");
        }
        PoolTokens current = tokens;
        if (current == null) {
            throw new IllegalStateException("Token info not set; call setTokenInfo() before taking snapshots");
        }

        PoolState state = stateReader.readState(pool);
        double price = PriceMath.priceFromSqrtPrice(state.getSqrtPriceX96());

        PoolSnapshot snapshot = new PoolSnapshot();
        snapshot.setSnapshotTime(snapshotTime);
        snapshot.setBlockNumber(state.getBlockNumber());
        snapshot.setSqrtPriceX96(state.getSqrtPriceX96());
        snapshot.setTick(state.getTick());
        snapshot.setLiquidity(state.getLiquidity());
        snapshot.setPriceToken0(PriceMath.toDecimal(price));
        snapshot.setPriceToken1(PriceMath.toDecimal(PriceMath.inversePrice(price)));

        BigDecimal balance0 = stateReader.readBalance(current.getToken0(), pool);
        BigDecimal balance1 = stateReader.readBalance(current.getToken1(), pool);
        snapshot.setToken0Balance(balance0);
        snapshot.setToken1Balance(balance1);
        if (balance0 != null && balance1 != null) {
            snapshot.setTvlUsd(tvl(current, balance0, balance1));
        }

        SwapEventRepository.TrailingVolume trailing =
                swapRepository.summarizeValuedBetween(snapshotTime.minus(Duration.ofHours(24)), snapshotTime);
        BigDecimal volume = trailing != null && trailing.getVolumeUsd() != null
                ? trailing.getVolumeUsd() : BigDecimal.ZERO;
        snapshot.setVolume24hUsd(volume);
        snapshot.setFees24hUsd(volume.multiply(properties.getAggregation().getFeeRate()));
        snapshot.setTransactions24h(trailing != null && trailing.getTransactions() != null
                ? trailing.getTransactions().intValue() : 0);

        storageService.saveSnapshot(snapshot);
        log.info("Pool snapshot at {}: block={}, tick={}, tvlUsd={}, volume24hUsd={}",
                snapshotTime, snapshot.getBlockNumber(), snapshot.getTick(), snapshot.getTvlUsd(), volume);
        return snapshot;
    }

    private BigDecimal tvl(PoolTokens current, BigDecimal balance0, BigDecimal balance1) {
        Double price0 = valuationService.tokenUsdPrice(current.getToken0(), current.getToken1(), 0);
        Double price1 = valuationService.tokenUsdPrice(current.getToken1(), current.getToken0(), 1);
        BigDecimal tvl = null;
        if (price0 != null) {
            tvl = balance0.multiply(BigDecimal.valueOf(price0));
        }
        if (price1 != null) {
            BigDecimal side1 = balance1.multiply(BigDecimal.valueOf(price1));
            tvl = tvl != null ? tvl.add(side1) : side1;
        }
        return tvl;
    }
}
