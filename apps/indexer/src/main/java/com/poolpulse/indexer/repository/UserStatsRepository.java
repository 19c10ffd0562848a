package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.UserStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserStatsRepository extends JpaRepository<UserStats, UUID> {

    Optional<UserStats> findByAddress(String address);

    /**
     * Atomically merge one activity into an account row.
     *
     * <p>The VALUES row is the activity applied to an empty account. On conflict counts and
     * volumes add, extrema and the LP flag fold, and user_type is re-derived from the stored
     * row plus the incoming USD value: LP is sticky, a value above the whale threshold gives
     * WHALE, an existing type is kept, an unclassified account below the retail threshold
     * becomes RETAIL.
     */
    @Modifying
    @Query(value = """
            INSERT INTO user_stats (address, total_transactions, buy_transactions, sell_transactions,
                                    total_volume_usd, largest_transaction_usd, first_transaction_at, last_transaction_at,
                                    is_liquidity_provider, total_liquidity_provided_usd, user_type, created_at, updated_at)
            VALUES (:#{#u.address}, :#{#u.totalTransactions}, :#{#u.buyTransactions}, :#{#u.sellTransactions},
                    :#{#u.totalVolumeUsd}, CAST(:#{#u.largestTransactionUsd} AS numeric),
                    :#{#u.firstTransactionAt}, :#{#u.lastTransactionAt},
                    :#{#u.liquidityProvider}, :#{#u.totalLiquidityProvidedUsd},
                    CAST(:#{#u.userType == null ? null : #u.userType.name()} AS varchar), NOW(), NOW())
            ON CONFLICT (address) DO UPDATE SET
                total_transactions = user_stats.total_transactions + EXCLUDED.total_transactions,
                buy_transactions = user_stats.buy_transactions + EXCLUDED.buy_transactions,
                sell_transactions = user_stats.sell_transactions + EXCLUDED.sell_transactions,
                total_volume_usd = user_stats.total_volume_usd + EXCLUDED.total_volume_usd,
                largest_transaction_usd = GREATEST(user_stats.largest_transaction_usd, EXCLUDED.largest_transaction_usd),
                first_transaction_at = LEAST(user_stats.first_transaction_at, EXCLUDED.first_transaction_at),
                last_transaction_at = GREATEST(user_stats.last_transaction_at, EXCLUDED.last_transaction_at),
                is_liquidity_provider = COALESCE(user_stats.is_liquidity_provider, FALSE) OR EXCLUDED.is_liquidity_provider,
                total_liquidity_provided_usd = COALESCE(user_stats.total_liquidity_provided_usd, 0)
                                               + EXCLUDED.total_liquidity_provided_usd,
                user_type = CASE
                    WHEN user_stats.user_type = 'LP'
                         OR COALESCE(user_stats.is_liquidity_provider, FALSE)
                         OR EXCLUDED.is_liquidity_provider THEN 'LP'
                    WHEN COALESCE(CAST(:usdValue AS numeric), 0) > :whaleUsd THEN 'WHALE'
                    WHEN user_stats.user_type IS NOT NULL THEN user_stats.user_type
                    WHEN COALESCE(CAST(:usdValue AS numeric), 0) < :retailUsd THEN 'RETAIL'
                    ELSE NULL
                END,
                updated_at = NOW()
            """, nativeQuery = true)
    int mergeActivity(@Param("u") UserStats activityRow,
                      @Param("usdValue") BigDecimal usdValue,
                      @Param("whaleUsd") BigDecimal whaleUsd,
                      @Param("retailUsd") BigDecimal retailUsd);

    /**
     * Insert or overwrite a rebuilt account row.
     */
    @Modifying
    @Query(value = """
            INSERT INTO user_stats (address, total_transactions, buy_transactions, sell_transactions,
                                    total_volume_usd, largest_transaction_usd, first_transaction_at, last_transaction_at,
                                    is_liquidity_provider, total_liquidity_provided_usd, user_type, created_at, updated_at)
            VALUES (:#{#u.address}, :#{#u.totalTransactions}, :#{#u.buyTransactions}, :#{#u.sellTransactions},
                    :#{#u.totalVolumeUsd}, CAST(:#{#u.largestTransactionUsd} AS numeric),
                    CAST(:#{#u.firstTransactionAt} AS timestamptz), CAST(:#{#u.lastTransactionAt} AS timestamptz),
                    :#{#u.liquidityProvider}, :#{#u.totalLiquidityProvidedUsd},
                    CAST(:#{#u.userType == null ? null : #u.userType.name()} AS varchar), NOW(), NOW())
            ON CONFLICT (address) DO UPDATE SET
                total_transactions = EXCLUDED.total_transactions,
                buy_transactions = EXCLUDED.buy_transactions,
                sell_transactions = EXCLUDED.sell_transactions,
                total_volume_usd = EXCLUDED.total_volume_usd,
                largest_transaction_usd = EXCLUDED.largest_transaction_usd,
                first_transaction_at = EXCLUDED.first_transaction_at,
                last_transaction_at = EXCLUDED.last_transaction_at,
                is_liquidity_provider = EXCLUDED.is_liquidity_provider,
                total_liquidity_provided_usd = EXCLUDED.total_liquidity_provided_usd,
                user_type = EXCLUDED.user_type,
                updated_at = NOW()
            """, nativeQuery = true)
    int replace(@Param("u") UserStats stats);

    /**
     * Accounts whose stored transaction count differs from the number of swaps they sent.
     */
    @Query(value = """
            SELECT u.address AS "address",
                   u.total_transactions AS "recordedTransactions",
                   COALESCE(c.swap_count, 0) AS "actualTransactions"
            FROM user_stats u
            LEFT JOIN (SELECT sender, COUNT(*) AS swap_count FROM swaps GROUP BY sender) c ON c.sender = u.address
            WHERE u.total_transactions <> COALESCE(c.swap_count, 0)
            LIMIT :limit
            """, nativeQuery = true)
    List<TransactionCountMismatch> findTransactionCountMismatches(@Param("limit") int limit);

    interface TransactionCountMismatch {
        String getAddress();

        Integer getRecordedTransactions();

        Long getActualTransactions();
    }
}
