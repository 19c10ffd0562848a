package com.poolpulse.indexer.modules.monitoring;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.IntegrityCheck;
import com.poolpulse.indexer.repository.PriceHistoryRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import com.poolpulse.indexer.repository.UserStatsRepository;
import com.poolpulse.indexer.service.EventStorageService;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntegrityServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-02T00:05:00Z");

    private SwapEventRepository swapRepository;
    private PriceHistoryRepository priceHistoryRepository;
    private UserStatsRepository userStatsRepository;
    private EventStorageService storageService;
    private IntegrityService service;

    @BeforeEach
    void setUp() {
        swapRepository = mock(SwapEventRepository.class);
        priceHistoryRepository = mock(PriceHistoryRepository.class);
        userStatsRepository = mock(UserStatsRepository.class);
        storageService = mock(EventStorageService.class);
        service = new IntegrityService(swapRepository, priceHistoryRepository, userStatsRepository,
                storageService, new PoolPulseProperties(), Clock.fixed(NOW, ZoneOffset.UTC),
                OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    void blockGapIsReportedAsWarning() {
        when(swapRepository.findDistinctBlockNumbers()).thenReturn(List.of(100L, 101L, 102L, 120L));
        when(swapRepository.count()).thenReturn(4L);

        IntegrityCheckResult result = service.checkMissingTransactions();

        assertFalse(result.isPassed());
        assertEquals(1, result.getIssues().size());
        IntegrityIssue issue = result.getIssues().get(0);
        assertEquals(Severity.WARNING, issue.getSeverity());
        assertEquals(1, issue.getAffectedCount());
        assertEquals("Found 1 block gap(s) larger than 10 blocks (max gap: 18 blocks)", issue.getMessage());
        assertEquals(18L, result.getDetails().get("max_gap"));
        assertEquals(4L, result.getDetails().get("total_swaps"));
    }

    @Test
    void contiguousBlocksPass() {
        when(swapRepository.findDistinctBlockNumbers()).thenReturn(List.of(100L, 105L, 115L));

        assertTrue(service.checkMissingTransactions().isPassed());
    }

    @Test
    void duplicatesAndInvalidPricesAreErrors() {
        when(swapRepository.countDuplicateKeys()).thenReturn(2L);
        when(priceHistoryRepository.countOrphans()).thenReturn(3L);
        when(priceHistoryRepository.countInvalidPrices()).thenReturn(1L);

        IntegrityCheckResult duplicates = service.checkDuplicateTransactions();
        IntegrityCheckResult prices = service.checkPriceHistory();

        assertEquals(Severity.ERROR, duplicates.getIssues().get(0).getSeverity());
        assertEquals(2, prices.getIssues().size());
        assertEquals(Severity.WARNING, prices.getIssues().get(0).getSeverity());
        assertEquals(Severity.ERROR, prices.getIssues().get(1).getSeverity());
    }

    @Test
    void transactionCountMismatchesAreSampled() {
        UserStatsRepository.TransactionCountMismatch mismatch = mock(UserStatsRepository.TransactionCountMismatch.class);
        when(mismatch.getAddress()).thenReturn("0xabc");
        when(mismatch.getRecordedTransactions()).thenReturn(3);
        when(mismatch.getActualTransactions()).thenReturn(5L);
        when(userStatsRepository.findTransactionCountMismatches(10)).thenReturn(List.of(mismatch));

        IntegrityCheckResult result = service.checkUserStats();

        assertFalse(result.isPassed());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> sample = (List<Map<String, Object>>) result.getDetails().get("mismatches");
        assertEquals("0xabc", sample.get(0).get("address"));
        assertEquals(5L, sample.get(0).get("actual"));
    }

    @Test
    void failingQueryOnlyFailsItsOwnCheck() {
        when(swapRepository.findDistinctBlockNumbers()).thenThrow(new DataAccessResourceFailureException("timeout"));
        when(userStatsRepository.findTransactionCountMismatches(anyInt())).thenReturn(List.of());

        List<IntegrityCheckResult> results = service.checkDataIntegrity();

        assertEquals(6, results.size());
        IntegrityCheckResult gaps = results.get(0);
        assertEquals(IntegrityService.MISSING_TRANSACTIONS, gaps.getCheckType());
        assertFalse(gaps.isPassed());
        assertEquals(Severity.ERROR, gaps.getIssues().get(0).getSeverity());
        assertEquals("check failed: timeout", gaps.getIssues().get(0).getMessage());
        assertTrue(results.subList(1, 6).stream().allMatch(IntegrityCheckResult::isPassed));

        ArgumentCaptor<IntegrityCheck> saved = ArgumentCaptor.forClass(IntegrityCheck.class);
        verify(storageService, times(6)).saveIntegrityCheck(saved.capture());
        IntegrityCheck row = saved.getAllValues().get(0);
        assertEquals(IntegrityService.MISSING_TRANSACTIONS, row.getCheckType());
        assertEquals(NOW, row.getTimestamp());
        assertEquals(1, row.getIssuesCount());
        assertTrue(row.getDetails().contains("check failed: timeout"));
    }

    @Test
    void storeFailureDoesNotLoseOtherResults() {
        doThrow(new DataAccessResourceFailureException("down")).when(storageService).saveIntegrityCheck(any());

        assertEquals(6, service.checkDataIntegrity().size());
    }
}
