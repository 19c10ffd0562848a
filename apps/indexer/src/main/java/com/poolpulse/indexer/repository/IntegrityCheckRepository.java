package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.IntegrityCheck;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface IntegrityCheckRepository extends JpaRepository<IntegrityCheck, UUID> {
}
