package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.PoolSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Repository
public interface PoolSnapshotRepository extends JpaRepository<PoolSnapshot, UUID> {

    @Modifying
    @Query(value = """
            INSERT INTO pool_snapshots (snapshot_time, block_number, sqrt_price_x96, tick, liquidity,
                                        price_token0, price_token1, tvl_usd, token0_balance, token1_balance,
                                        volume_24h_usd, fees_24h_usd, transactions_24h, created_at)
            VALUES (:#{#p.snapshotTime}, :#{#p.blockNumber}, :#{#p.sqrtPriceX96}, :#{#p.tick}, :#{#p.liquidity},
                    CAST(:#{#p.priceToken0} AS numeric), CAST(:#{#p.priceToken1} AS numeric),
                    CAST(:#{#p.tvlUsd} AS numeric),
                    CAST(:#{#p.token0Balance} AS numeric), CAST(:#{#p.token1Balance} AS numeric),
                    CAST(:#{#p.volume24hUsd} AS numeric), CAST(:#{#p.fees24hUsd} AS numeric),
                    CAST(:#{#p.transactions24h} AS integer), NOW())
            ON CONFLICT (snapshot_time) DO UPDATE SET
                block_number = EXCLUDED.block_number,
                sqrt_price_x96 = EXCLUDED.sqrt_price_x96,
                tick = EXCLUDED.tick,
                liquidity = EXCLUDED.liquidity,
                price_token0 = EXCLUDED.price_token0,
                price_token1 = EXCLUDED.price_token1,
                tvl_usd = EXCLUDED.tvl_usd,
                token0_balance = EXCLUDED.token0_balance,
                token1_balance = EXCLUDED.token1_balance,
                volume_24h_usd = EXCLUDED.volume_24h_usd,
                fees_24h_usd = EXCLUDED.fees_24h_usd,
                transactions_24h = EXCLUDED.transactions_24h
            """, nativeQuery = true)
    int upsert(@Param("p") PoolSnapshot snapshot);

    /**
     * Average TVL over [start, end) and the TVL of the last snapshot in that window.
     */
    @Query(value = """
            SELECT AVG(tvl_usd) AS "avgTvlUsd",
                   (SELECT latest.tvl_usd FROM pool_snapshots latest
                    WHERE latest.snapshot_time >= :start AND latest.snapshot_time < :end
                      AND latest.tvl_usd IS NOT NULL
                    ORDER BY latest.snapshot_time DESC
                    LIMIT 1) AS "endTvlUsd"
            FROM pool_snapshots
            WHERE snapshot_time >= :start AND snapshot_time < :end
            """, nativeQuery = true)
    TvlSummary summarizeTvl(@Param("start") Instant start, @Param("end") Instant end);

    interface TvlSummary {
        BigDecimal getAvgTvlUsd();

        BigDecimal getEndTvlUsd();
    }
}
