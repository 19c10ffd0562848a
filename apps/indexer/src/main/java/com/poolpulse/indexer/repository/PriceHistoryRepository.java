package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.PriceHistoryPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Repository
public interface PriceHistoryRepository extends JpaRepository<PriceHistoryPoint, UUID> {

    @Modifying
    @Query(value = """
            INSERT INTO price_history (timestamp, block_number, price, created_at)
            VALUES (:timestamp, :blockNumber, :price, NOW())
            ON CONFLICT (timestamp) DO UPDATE SET
                block_number = EXCLUDED.block_number,
                price = EXCLUDED.price
            """, nativeQuery = true)
    int upsert(@Param("timestamp") Instant timestamp,
               @Param("blockNumber") long blockNumber,
               @Param("price") BigDecimal price);

    /**
     * Points whose timestamp matches no swap.
     */
    @Query(value = """
            SELECT COUNT(*) FROM price_history p
            WHERE NOT EXISTS (SELECT 1 FROM swaps s WHERE s.block_timestamp = p.timestamp)
            """, nativeQuery = true)
    long countOrphans();

    @Query(value = "SELECT COUNT(*) FROM price_history WHERE price IS NULL OR price <= 0", nativeQuery = true)
    long countInvalidPrices();
}
