package com.poolpulse.indexer.modules.snapshot;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.PoolSnapshot;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import com.poolpulse.indexer.modules.valuation.ValuationService;
import com.poolpulse.indexer.repository.SwapEventRepository;
import com.poolpulse.indexer.service.EventStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PoolSnapshotServiceTest {

    private static final String POOL = "0x88e6a0c2ddd26feeb64f039a2c41296fcb3f5640";
    private static final Instant SNAPSHOT_TIME = Instant.parse("2024-03-01T11:00:00Z");
    private static final TokenInfo TOKEN0 = new TokenInfo("0x00000000000000000000000000000000000000a0", 18, "WETH");
    private static final TokenInfo TOKEN1 = new TokenInfo("0x00000000000000000000000000000000000000b1", 6, "USDC");

    private PoolStateReader stateReader;
    private ValuationService valuationService;
    private SwapEventRepository swapRepository;
    private EventStorageService storageService;
    private PoolPulseProperties properties;
    private PoolSnapshotService service;

    @BeforeEach
    void setUp() {
        stateReader = mock(PoolStateReader.class);
        valuationService = mock(ValuationService.class);
        swapRepository = mock(SwapEventRepository.class);
        storageService = mock(EventStorageService.class);
        properties = new PoolPulseProperties();
        properties.getPool().setAddress(POOL);
        service = new PoolSnapshotService(stateReader, valuationService, swapRepository, storageService,
                properties);
    }

    @Test
    void snapshotCombinesStateBalancesAndTrailingVolume() {
        service.setTokenInfo(new PoolTokens(TOKEN0, TOKEN1));
        when(stateReader.readState(POOL)).thenReturn(
                new PoolState(BigInteger.TWO.pow(96), 0, BigInteger.valueOf(5_000_000), 19_000_123L));
        when(stateReader.readBalance(TOKEN0, POOL)).thenReturn(new BigDecimal("10"));
        when(stateReader.readBalance(TOKEN1, POOL)).thenReturn(new BigDecimal("30000"));
        when(valuationService.tokenUsdPrice(TOKEN0, TOKEN1, 0)).thenReturn(3000.0);
        when(valuationService.tokenUsdPrice(TOKEN1, TOKEN0, 1)).thenReturn(1.0);
        SwapEventRepository.TrailingVolume trailing = mock(SwapEventRepository.TrailingVolume.class);
        when(trailing.getVolumeUsd()).thenReturn(new BigDecimal("200000"));
        when(trailing.getTransactions()).thenReturn(42L);
        when(swapRepository.summarizeValuedBetween(SNAPSHOT_TIME.minusSeconds(86_400), SNAPSHOT_TIME)).thenReturn(trailing);

        PoolSnapshot snapshot = service.createSnapshot(SNAPSHOT_TIME);

        assertEquals(SNAPSHOT_TIME, snapshot.getSnapshotTime());
        assertEquals(19_000_123L, snapshot.getBlockNumber());
        assertEquals(0, BigDecimal.ONE.compareTo(snapshot.getPriceToken0()));
        assertEquals(0, new BigDecimal("60000").compareTo(snapshot.getTvlUsd()));
        assertEquals(0, new BigDecimal("100").compareTo(snapshot.getFees24hUsd()));
        assertEquals(42, snapshot.getTransactions24h());
        verify(storageService).saveSnapshot(snapshot);
    }

    @Test
    void missingBalanceLeavesTvlEmpty() {
        service.setTokenInfo(new PoolTokens(TOKEN0, TOKEN1));
        when(stateReader.readState(POOL)).thenReturn(
                new PoolState(BigInteger.TWO.pow(96), 0, BigInteger.ONE, 1L));
        when(stateReader.readBalance(TOKEN0, POOL)).thenReturn(null);
        when(stateReader.readBalance(TOKEN1, POOL)).thenReturn(BigDecimal.ONE);

        PoolSnapshot snapshot = service.createSnapshot(SNAPSHOT_TIME);

        assertNull(snapshot.getTvlUsd());
        assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.getVolume24hUsd()));
        assertEquals(0, snapshot.getTransactions24h());
    }

    @Test
    void backfilledSnapshotUsesTheDayBeforeItsOwnTime() {
        Instant lastWeek = Instant.parse("2024-02-23T08:00:00Z");
        service.setTokenInfo(new PoolTokens(TOKEN0, TOKEN1));
        when(stateReader.readState(POOL)).thenReturn(
                new PoolState(BigInteger.TWO.pow(96), 0, BigInteger.ONE, 1L));
        SwapEventRepository.TrailingVolume trailing = mock(SwapEventRepository.TrailingVolume.class);
        when(trailing.getVolumeUsd()).thenReturn(new BigDecimal("1500"));
        when(trailing.getTransactions()).thenReturn(3L);
        when(swapRepository.summarizeValuedBetween(Instant.parse("2024-02-22T08:00:00Z"), lastWeek)).thenReturn(trailing);

        PoolSnapshot snapshot = service.createSnapshot(lastWeek);

        assertEquals(0, new BigDecimal("1500").compareTo(snapshot.getVolume24hUsd()));
        assertEquals(3, snapshot.getTransactions24h());
    }

    @Test
    void refusesWithoutTokenInfo() {
        assertThrows(IllegalStateException.class, () -> service.createSnapshot(SNAPSHOT_TIME));
        verify(storageService, never()).saveSnapshot(any());
    }
}
