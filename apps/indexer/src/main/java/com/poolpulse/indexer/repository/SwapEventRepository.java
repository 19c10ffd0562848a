package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.SwapEvent;
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

/**
 * Repository for valued Swap events
 */
@Repository
public interface SwapEventRepository extends JpaRepository<SwapEvent, UUID> {

    /**
     * Insert, ignoring a row whose (transaction_hash, log_index) already exists.
     *
     * @return 1 when inserted, 0 for a duplicate
     */
    @Modifying
    @Query(value = """
            INSERT INTO swaps (transaction_hash, block_number, block_timestamp, log_index, sender, recipient,
                               amount0, amount1, sqrt_price_x96, liquidity, tick,
                               amount0_readable, amount1_readable, price_token0, price_token1, swap_type, usd_value,
                               gas_used, gas_price, transaction_fee, created_at)
            VALUES (:#{#s.transactionHash}, :#{#s.blockNumber}, :#{#s.blockTimestamp}, :#{#s.logIndex},
                    :#{#s.sender}, :#{#s.recipient},
                    :#{#s.amount0}, :#{#s.amount1}, :#{#s.sqrtPriceX96}, :#{#s.liquidity}, :#{#s.tick},
                    CAST(:#{#s.amount0Readable} AS numeric), CAST(:#{#s.amount1Readable} AS numeric),
                    CAST(:#{#s.priceToken0} AS numeric), CAST(:#{#s.priceToken1} AS numeric),
                    :#{#s.swapType.name()}, CAST(:#{#s.usdValue} AS numeric),
                    CAST(:#{#s.gasUsed} AS bigint), CAST(:#{#s.gasPrice} AS numeric),
                    CAST(:#{#s.transactionFee} AS numeric), NOW())
            ON CONFLICT (transaction_hash, log_index) DO NOTHING
            """, nativeQuery = true)
    int insertIgnoringDuplicate(@Param("s") SwapEvent swap);

    /**
     * Priced swaps in [start, end) in chain order.
     */
    @Query("""
            SELECT s FROM SwapEvent s
            WHERE s.blockTimestamp >= :start AND s.blockTimestamp < :end AND s.priceToken0 IS NOT NULL
            ORDER BY s.blockTimestamp ASC, s.blockNumber ASC, s.logIndex ASC
            """)
    List<SwapEvent> findPricedBetween(@Param("start") Instant start, @Param("end") Instant end);

    @Query("SELECT s FROM SwapEvent s WHERE s.blockTimestamp >= :start AND s.blockTimestamp < :end")
    List<SwapEvent> findBetween(@Param("start") Instant start, @Param("end") Instant end);

    List<SwapEvent> findAllByOrderByBlockTimestampAscBlockNumberAscLogIndexAsc();

    /**
     * Most recent pool price strictly before the given time.
     */
    @Query(value = """
            SELECT price_token0 FROM swaps
            WHERE block_timestamp < :before AND price_token0 IS NOT NULL
            ORDER BY block_timestamp DESC, block_number DESC, log_index DESC
            LIMIT 1
            """, nativeQuery = true)
    Optional<BigDecimal> findLatestPriceBefore(@Param("before") Instant before);

    @Query(value = """
            SELECT COALESCE(SUM(usd_value), 0) AS "volumeUsd", COUNT(*) AS "transactions"
            FROM swaps
            WHERE block_timestamp >= :since AND block_timestamp < :until AND usd_value IS NOT NULL
            """, nativeQuery = true)
    TrailingVolume summarizeValuedBetween(@Param("since") Instant since, @Param("until") Instant until);

    @Query(value = "SELECT DISTINCT block_number FROM swaps ORDER BY block_number", nativeQuery = true)
    List<Long> findDistinctBlockNumbers();

    @Query(value = """
            SELECT COUNT(*) FROM (
                SELECT transaction_hash, log_index FROM swaps
                GROUP BY transaction_hash, log_index
                HAVING COUNT(*) > 1
            ) duplicates
            """, nativeQuery = true)
    long countDuplicateKeys();

    /**
     * Swaps whose timestamp is earlier than the swap before them in block order.
     */
    @Query(value = """
            SELECT COUNT(*) FROM (
                SELECT block_timestamp,
                       LAG(block_timestamp) OVER (ORDER BY block_number, log_index) AS previous_timestamp
                FROM swaps
            ) ordered
            WHERE previous_timestamp IS NOT NULL AND block_timestamp < previous_timestamp
            """, nativeQuery = true)
    long countTimestampRegressions();

    @Query(value = """
            SELECT COUNT(*) FROM swaps s
            WHERE s.price_token0 IS NOT NULL
              AND NOT EXISTS (SELECT 1 FROM price_history p WHERE p.timestamp = s.block_timestamp)
            """, nativeQuery = true)
    long countPricedWithoutHistory();

    interface TrailingVolume {
        BigDecimal getVolumeUsd();

        Long getTransactions();
    }
}
