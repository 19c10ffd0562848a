package com.poolpulse.indexer.modules.monitoring;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.IntegrityCheck;
import com.poolpulse.indexer.repository.PriceHistoryRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import com.poolpulse.indexer.repository.UserStatsRepository;
import com.poolpulse.indexer.service.EventStorageService;
import com.poolpulse.indexer.util.JsonUtils;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Consistency checks over the stored pool data. Each check runs on its own: a failing query
 * turns that check into a failed result without stopping the others.
 */
@Slf4j
@Service
public class IntegrityService {

    static final String MISSING_TRANSACTIONS = "missing_transactions";
    static final String DUPLICATE_TRANSACTIONS = "duplicate_transactions";
    static final String PRICE_HISTORY_INTEGRITY = "price_history_integrity";
    static final String BLOCK_NUMBER_CONTINUITY = "block_number_continuity";
    static final String SWAP_PRICE_CONSISTENCY = "swap_price_consistency";
    static final String USER_STATS_INTEGRITY = "user_stats_integrity";

    private final SwapEventRepository swapRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final UserStatsRepository userStatsRepository;
    private final EventStorageService storageService;
    private final PoolPulseProperties properties;
    private final Clock clock;
    private final Tracer tracer;

    public IntegrityService(SwapEventRepository swapRepository,
                            PriceHistoryRepository priceHistoryRepository,
                            UserStatsRepository userStatsRepository,
                            EventStorageService storageService,
                            PoolPulseProperties properties,
                            Clock clock,
                            Tracer tracer) {
        this.swapRepository = swapRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.userStatsRepository = userStatsRepository;
        this.storageService = storageService;
        this.properties = properties;
        this.clock = clock;
        this.tracer = tracer;
    }

    /**
     * Run every check and persist each result.
     */
    public List<IntegrityCheckResult> checkDataIntegrity() {
        List<IntegrityCheckResult> results = List.of(
                run(MISSING_TRANSACTIONS, this::checkMissingTransactions),
                run(DUPLICATE_TRANSACTIONS, this::checkDuplicateTransactions),
                run(PRICE_HISTORY_INTEGRITY, this::checkPriceHistory),
                run(BLOCK_NUMBER_CONTINUITY, this::checkBlockOrdering),
                run(SWAP_PRICE_CONSISTENCY, this::checkSwapPriceConsistency),
                run(USER_STATS_INTEGRITY, this::checkUserStats));

        long failed = results.stream().filter(r -> !r.isPassed()).count();
        if (failed > 0) {
            log.warn("Integrity checks finished: {} of {} failed", failed, results.size());
        } else {
            log.info("Integrity checks finished: all {} passed", results.size());
        }
        results.forEach(this::save);
        return results;
    }

    IntegrityCheckResult checkMissingTransactions() {
        long threshold = properties.getIntegrity().getGapThreshold();
        BlockGapDetector.GapReport report =
                BlockGapDetector.detect(swapRepository.findDistinctBlockNumbers(), threshold);

        List<IntegrityIssue> issues = new ArrayList<>();
        if (report.getGapCount() > 0) {
            issues.add(new IntegrityIssue(Severity.WARNING,
                    String.format("Found %d block gap(s) larger than %d blocks (max gap: %d blocks)",
                            report.getGapCount(), threshold, report.getMaxGap()),
                    report.getGapCount()));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gap_count", report.getGapCount());
        details.put("max_gap", report.getMaxGap());
        details.put("min_block", report.getMinBlock());
        details.put("max_block", report.getMaxBlock());
        details.put("total_swaps", swapRepository.count());
        return IntegrityCheckResult.of(MISSING_TRANSACTIONS, clock.instant(), issues, details);
    }

    IntegrityCheckResult checkDuplicateTransactions() {
        long duplicates = swapRepository.countDuplicateKeys();
        List<IntegrityIssue> issues = new ArrayList<>();
        if (duplicates > 0) {
            issues.add(new IntegrityIssue(Severity.ERROR,
                    "Found " + duplicates + " duplicated (transaction_hash, log_index) key(s)", duplicates));
        }
        return IntegrityCheckResult.of(DUPLICATE_TRANSACTIONS, clock.instant(), issues,
                Map.of("duplicate_keys", duplicates));
    }

    IntegrityCheckResult checkPriceHistory() {
        long orphans = priceHistoryRepository.countOrphans();
        long invalid = priceHistoryRepository.countInvalidPrices();

        List<IntegrityIssue> issues = new ArrayList<>();
        if (orphans > 0) {
            issues.add(new IntegrityIssue(Severity.WARNING,
                    "Found " + orphans + " price point(s) without a matching swap", orphans));
        }
        if (invalid > 0) {
            issues.add(new IntegrityIssue(Severity.ERROR,
                    "Found " + invalid + " price point(s) with a null or non-positive price", invalid));
        }
        return IntegrityCheckResult.of(PRICE_HISTORY_INTEGRITY, clock.instant(), issues,
                Map.of("orphaned_points", orphans, "invalid_prices", invalid));
    }

    IntegrityCheckResult checkBlockOrdering() {
        long regressions = swapRepository.countTimestampRegressions();
        List<IntegrityIssue> issues = new ArrayList<>();
        if (regressions > 0) {
            issues.add(new IntegrityIssue(Severity.WARNING,
                    "Found " + regressions + " swap(s) timestamped before a lower-block predecessor", regressions));
        }
        return IntegrityCheckResult.of(BLOCK_NUMBER_CONTINUITY, clock.instant(), issues,
                Map.of("out_of_order", regressions));
    }

    IntegrityCheckResult checkSwapPriceConsistency() {
        long missing = swapRepository.countPricedWithoutHistory();
        List<IntegrityIssue> issues = new ArrayList<>();
        if (missing > 0) {
            issues.add(new IntegrityIssue(Severity.WARNING,
                    "Found " + missing + " priced swap(s) without a price history point", missing));
        }
        return IntegrityCheckResult.of(SWAP_PRICE_CONSISTENCY, clock.instant(), issues,
                Map.of("missing_price_points", missing));
    }

    IntegrityCheckResult checkUserStats() {
        List<UserStatsRepository.TransactionCountMismatch> mismatches =
                userStatsRepository.findTransactionCountMismatches(properties.getIntegrity().getMismatchSampleLimit());

        List<IntegrityIssue> issues = new ArrayList<>();
        if (!mismatches.isEmpty()) {
            issues.add(new IntegrityIssue(Severity.WARNING,
                    "Found " + mismatches.size() + " account(s) whose transaction count differs from their swaps",
                    mismatches.size()));
        }

        List<Map<String, Object>> sample = new ArrayList<>();
        for (UserStatsRepository.TransactionCountMismatch mismatch : mismatches) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("address", mismatch.getAddress());
            row.put("recorded", mismatch.getRecordedTransactions());
            row.put("actual", mismatch.getActualTransactions());
            sample.add(row);
        }
        return IntegrityCheckResult.of(USER_STATS_INTEGRITY, clock.instant(), issues, Map.of("mismatches", sample));
    }

    private IntegrityCheckResult run(String checkType, Supplier<IntegrityCheckResult> check) {
        Span span = tracer.spanBuilder("IntegrityService." + checkType).startSpan();
        try {
            IntegrityCheckResult result = check.get();
            span.setAttribute("passed", result.isPassed());
            return result;
        } catch (Exception e) {
            log.error("Integrity check {} failed: {}", checkType, e.getMessage(), e);
            span.recordException(e);
            return IntegrityCheckResult.failed(checkType, clock.instant(), e);
        } finally {
            span.end();
        }
    }

    private void save(IntegrityCheckResult result) {
        IntegrityCheck row = new IntegrityCheck();
        row.setCheckType(result.getCheckType());
        row.setTimestamp(result.getTimestamp());
        row.setPassed(result.isPassed());
        row.setIssuesCount(result.getIssues().size());
        row.setDetails(JsonUtils.toJsonOrEmpty(result));
        try {
            storageService.saveIntegrityCheck(row);
        } catch (RuntimeException e) {
            log.error("Failed to store {} result: {}", result.getCheckType(), e.getMessage());
        }
    }
}
