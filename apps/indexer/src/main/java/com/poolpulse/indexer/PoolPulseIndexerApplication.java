package com.poolpulse.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PoolPulse Indexer Application
 * Pool event ingestion, valuation and time-bucketed aggregation
 */
@SpringBootApplication
@EnableScheduling
public class PoolPulseIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(PoolPulseIndexerApplication.class);

    public static void main(String[] args) {
        logger.info("Starting PoolPulse Indexer...");
        SpringApplication.run(PoolPulseIndexerApplication.class, args);
        logger.info("PoolPulse Indexer started successfully!");
    }
}
