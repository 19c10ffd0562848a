package com.poolpulse.indexer.modules.processor;

import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.modules.chains.model.LogMetadata;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.model.RawSwapEvent;
import com.poolpulse.indexer.modules.chains.model.SwapType;
import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import com.poolpulse.indexer.modules.valuation.UsdAggregation;
import com.poolpulse.indexer.modules.valuation.ValuationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SwapProcessorTest {

    private static final TokenInfo TOKEN0 = new TokenInfo("0x00000000000000000000000000000000000000a0", 18, "WETH");
    private static final TokenInfo TOKEN1 = new TokenInfo("0x00000000000000000000000000000000000000b1", 6, "USDC");
    private static final Instant BLOCK_TIME = Instant.parse("2024-03-01T10:15:00Z");
    private static final LogMetadata METADATA = new LogMetadata("0xfeed", 19_000_000L, 3);

    private ChainRpcClient rpcClient;
    private ValuationService valuationService;
    private SwapProcessor processor;

    @BeforeEach
    void setUp() {
        rpcClient = mock(ChainRpcClient.class);
        valuationService = mock(ValuationService.class);
        processor = new SwapProcessor(rpcClient, valuationService);
        processor.setTokenInfo(new PoolTokens(TOKEN0, TOKEN1));
        when(rpcClient.getBlockTimestamp(19_000_000L)).thenReturn(BLOCK_TIME);
    }

    @Test
    void buildsValuedSwapFromRawLog() {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setFrom("0xABCDEF0000000000000000000000000000000001");
        receipt.setGasUsed("0x249f0");
        receipt.setEffectiveGasPrice("0x4a817c800");
        when(rpcClient.getTransactionReceipt("0xfeed")).thenReturn(Optional.of(receipt));
        when(valuationService.usdValue(any(), any(), eq(TOKEN0), eq(TOKEN1), eq(UsdAggregation.AVERAGE)))
                .thenReturn(new BigDecimal("2.0"));

        SwapEvent swap = processor.process(raw());

        assertEquals("0xfeed", swap.getTransactionHash());
        assertEquals(3, swap.getLogIndex());
        assertEquals(BLOCK_TIME, swap.getBlockTimestamp());
        assertEquals("0xabcdef0000000000000000000000000000000001", swap.getSender());
        assertEquals("0x2222222222222222222222222222222222222222", swap.getRecipient());
        assertEquals(0, BigDecimal.ONE.compareTo(swap.getAmount0Readable()));
        assertEquals(0, new BigDecimal("2").compareTo(swap.getAmount1Readable()));
        assertEquals(0, BigDecimal.ONE.compareTo(swap.getPriceToken0()));
        assertEquals(0, BigDecimal.ONE.compareTo(swap.getPriceToken1()));
        assertEquals(SwapType.BUY, swap.getSwapType());
        assertEquals(0, new BigDecimal("2.0").compareTo(swap.getUsdValue()));

        assertEquals(150_000L, swap.getGasUsed());
        assertEquals(BigInteger.valueOf(20_000_000_000L), swap.getGasPrice());
        assertEquals(0, new BigDecimal("0.003").compareTo(swap.getTransactionFee()));
    }

    @Test
    void missingReceiptFallsBackToLogSender() {
        when(rpcClient.getTransactionReceipt("0xfeed")).thenReturn(Optional.empty());

        SwapEvent swap = processor.process(raw());

        assertEquals("0x1111111111111111111111111111111111111111", swap.getSender());
        assertNull(swap.getGasUsed());
        assertNull(swap.getTransactionFee());
        assertNull(swap.getUsdValue());
    }

    @Test
    void refusesToProcessWithoutTokenInfo() {
        SwapProcessor unconfigured = new SwapProcessor(rpcClient, valuationService);

        assertThrows(IllegalStateException.class, () -> unconfigured.process(raw()));
    }

    private static RawSwapEvent raw() {
        return RawSwapEvent.builder()
                .metadata(METADATA)
                .sender("0x1111111111111111111111111111111111111111")
                .recipient("0x2222222222222222222222222222222222222222")
                .amount0(new BigInteger("-1000000000000000000"))
                .amount1(BigInteger.valueOf(2_000_000))
                .sqrtPriceX96(BigInteger.TWO.pow(96))
                .liquidity(BigInteger.valueOf(1_000_000))
                .tick(0)
                .build();
    }
}
