package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.HourlyStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HourlyStatsRepository extends JpaRepository<HourlyStats, UUID> {

    Optional<HourlyStats> findByHourStart(Instant hourStart);

    /**
     * Insert the bucket or overwrite every non-key field of an existing one.
     */
    @Modifying
    @Query(value = """
            INSERT INTO hourly_stats (hour_start, hour_end, open_price, high_price, low_price, close_price,
                                      total_transactions, buy_transactions, sell_transactions,
                                      volume_token0, volume_token1, volume_usd, fees_token0, fees_token1, fees_usd,
                                      unique_addresses, unique_senders, avg_liquidity, min_liquidity, max_liquidity,
                                      created_at, updated_at)
            VALUES (:#{#h.hourStart}, :#{#h.hourEnd}, :#{#h.openPrice}, :#{#h.highPrice}, :#{#h.lowPrice},
                    :#{#h.closePrice}, :#{#h.totalTransactions}, :#{#h.buyTransactions}, :#{#h.sellTransactions},
                    :#{#h.volumeToken0}, :#{#h.volumeToken1}, :#{#h.volumeUsd},
                    :#{#h.feesToken0}, :#{#h.feesToken1}, :#{#h.feesUsd},
                    :#{#h.uniqueAddresses}, :#{#h.uniqueSenders},
                    CAST(:#{#h.avgLiquidity} AS numeric), CAST(:#{#h.minLiquidity} AS numeric),
                    CAST(:#{#h.maxLiquidity} AS numeric), NOW(), NOW())
            ON CONFLICT (hour_start) DO UPDATE SET
                hour_end = EXCLUDED.hour_end,
                open_price = EXCLUDED.open_price,
                high_price = EXCLUDED.high_price,
                low_price = EXCLUDED.low_price,
                close_price = EXCLUDED.close_price,
                total_transactions = EXCLUDED.total_transactions,
                buy_transactions = EXCLUDED.buy_transactions,
                sell_transactions = EXCLUDED.sell_transactions,
                volume_token0 = EXCLUDED.volume_token0,
                volume_token1 = EXCLUDED.volume_token1,
                volume_usd = EXCLUDED.volume_usd,
                fees_token0 = EXCLUDED.fees_token0,
                fees_token1 = EXCLUDED.fees_token1,
                fees_usd = EXCLUDED.fees_usd,
                unique_addresses = EXCLUDED.unique_addresses,
                unique_senders = EXCLUDED.unique_senders,
                avg_liquidity = EXCLUDED.avg_liquidity,
                min_liquidity = EXCLUDED.min_liquidity,
                max_liquidity = EXCLUDED.max_liquidity,
                updated_at = NOW()
            """, nativeQuery = true)
    int upsert(@Param("h") HourlyStats stats);
}
