package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.DailyStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DailyStatsRepository extends JpaRepository<DailyStats, UUID> {

    Optional<DailyStats> findByDate(LocalDate date);

    @Modifying
    @Query(value = """
            INSERT INTO daily_stats (date, open_price, high_price, low_price, close_price,
                                     total_transactions, buy_transactions, sell_transactions,
                                     volume_token0, volume_token1, volume_usd, fees_token0, fees_token1, fees_usd,
                                     unique_addresses, new_addresses, avg_tvl_usd, end_tvl_usd,
                                     whale_transactions, largest_transaction_usd, created_at, updated_at)
            VALUES (:#{#d.date}, :#{#d.openPrice}, :#{#d.highPrice}, :#{#d.lowPrice}, :#{#d.closePrice},
                    :#{#d.totalTransactions}, :#{#d.buyTransactions}, :#{#d.sellTransactions},
                    :#{#d.volumeToken0}, :#{#d.volumeToken1}, :#{#d.volumeUsd},
                    :#{#d.feesToken0}, :#{#d.feesToken1}, :#{#d.feesUsd},
                    :#{#d.uniqueAddresses}, :#{#d.newAddresses},
                    CAST(:#{#d.avgTvlUsd} AS numeric), CAST(:#{#d.endTvlUsd} AS numeric),
                    :#{#d.whaleTransactions}, CAST(:#{#d.largestTransactionUsd} AS numeric), NOW(), NOW())
            ON CONFLICT (date) DO UPDATE SET
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
                new_addresses = EXCLUDED.new_addresses,
                avg_tvl_usd = EXCLUDED.avg_tvl_usd,
                end_tvl_usd = EXCLUDED.end_tvl_usd,
                whale_transactions = EXCLUDED.whale_transactions,
                largest_transaction_usd = EXCLUDED.largest_transaction_usd,
                updated_at = NOW()
            """, nativeQuery = true)
    int upsert(@Param("d") DailyStats stats);
}
