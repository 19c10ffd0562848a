package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.LiquidityEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for Mint, Burn and Collect events
 */
@Repository
public interface LiquidityEventRepository extends JpaRepository<LiquidityEvent, UUID> {

    /**
     * @return 1 when inserted, 0 for a duplicate (transaction_hash, log_index)
     */
    @Modifying
    @Query(value = """
            INSERT INTO liquidity_events (transaction_hash, block_number, block_timestamp, log_index, event_type,
                                          owner, sender, liquidity_delta, tick_lower, tick_upper,
                                          amount0, amount1, amount0_readable, amount1_readable, usd_value, created_at)
            VALUES (:#{#e.transactionHash}, :#{#e.blockNumber}, :#{#e.blockTimestamp}, :#{#e.logIndex},
                    :#{#e.eventType.name()}, :#{#e.owner}, CAST(:#{#e.sender} AS varchar),
                    :#{#e.liquidityDelta}, :#{#e.tickLower}, :#{#e.tickUpper},
                    :#{#e.amount0}, :#{#e.amount1},
                    CAST(:#{#e.amount0Readable} AS numeric), CAST(:#{#e.amount1Readable} AS numeric),
                    CAST(:#{#e.usdValue} AS numeric), NOW())
            ON CONFLICT (transaction_hash, log_index) DO NOTHING
            """, nativeQuery = true)
    int insertIgnoringDuplicate(@Param("e") LiquidityEvent event);

    List<LiquidityEvent> findAllByOrderByBlockTimestampAscBlockNumberAscLogIndexAsc();
}
