package com.poolpulse.indexer.modules.valuation;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValuationServiceTest {

    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final TokenInfo WETH = new TokenInfo("0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", 18, "WETH");
    private static final TokenInfo WBTC = new TokenInfo("0x2260fac5e5542a773aa44fbcfedf7c193bc2c599", 8, "WBTC");
    private static final TokenInfo STABLE = new TokenInfo(USDC, 6, "USDC");

    private QuoterClient quoterClient;
    private PriceIndexClient priceIndexClient;
    private ChainRpcClient rpcClient;
    private ValuationService service;

    @BeforeEach
    void setUp() {
        quoterClient = mock(QuoterClient.class);
        priceIndexClient = mock(PriceIndexClient.class);
        rpcClient = mock(ChainRpcClient.class);
        service = new ValuationService(new StablecoinRegistry(List.of(USDC.toUpperCase())),
                quoterClient, priceIndexClient, rpcClient, Caffeine.newBuilder().<String, Double>build());
    }

    @Test
    void stablecoinSideIsFaceValueWithoutAnyLookup() {
        BigDecimal usd = service.usdValue(new BigDecimal("1.5"), new BigDecimal("-3000.25"),
                WETH, STABLE, UsdAggregation.AVERAGE);

        assertEquals(0, new BigDecimal("3000.25").compareTo(usd));
        verify(quoterClient, never()).quoteUsdPrice(any());
        verify(priceIndexClient, never()).priceBySymbol(anyString());
    }

    @Test
    void averageHalvesBothPricedSides() {
        when(quoterClient.quoteUsdPrice(WETH)).thenReturn(2000.0);
        when(quoterClient.quoteUsdPrice(WBTC)).thenReturn(40000.0);

        BigDecimal usd = service.usdValue(new BigDecimal("1"), new BigDecimal("0.05"),
                WETH, WBTC, UsdAggregation.AVERAGE);

        assertEquals(0, new BigDecimal("2000").compareTo(usd));
    }

    @Test
    void sumAddsBothPricedSides() {
        when(quoterClient.quoteUsdPrice(WETH)).thenReturn(2000.0);
        when(quoterClient.quoteUsdPrice(WBTC)).thenReturn(40000.0);

        BigDecimal usd = service.usdValue(new BigDecimal("1"), new BigDecimal("0.05"),
                WETH, WBTC, UsdAggregation.SUM);

        assertEquals(0, new BigDecimal("4000").compareTo(usd));
    }

    @Test
    void singlePricedSideIsUsedAlone() {
        when(quoterClient.quoteUsdPrice(WETH)).thenReturn(2000.0);
        when(quoterClient.quoteUsdPrice(WBTC)).thenReturn(null);
        when(priceIndexClient.priceBySymbol("WBTC")).thenReturn(null);
        when(rpcClient.getChainId()).thenReturn(1L);
        when(priceIndexClient.priceByAddress(1L, WBTC.getAddress())).thenReturn(null);

        BigDecimal usd = service.usdValue(new BigDecimal("2"), new BigDecimal("0.1"),
                WETH, WBTC, UsdAggregation.AVERAGE);

        assertEquals(0, new BigDecimal("4000").compareTo(usd));
    }

    @Test
    void fallsBackToPriceIndexBySymbolThenAddress() {
        when(quoterClient.quoteUsdPrice(WBTC)).thenReturn(null);
        when(priceIndexClient.priceBySymbol("WBTC")).thenReturn(null);
        when(rpcClient.getChainId()).thenReturn(1L);
        when(priceIndexClient.priceByAddress(1L, WBTC.getAddress())).thenReturn(40000.0);

        Double wbtc = service.tokenUsdPrice(WBTC, WETH, 0);

        assertEquals(40000.0, wbtc);
        InOrder order = inOrder(quoterClient, priceIndexClient);
        order.verify(quoterClient).quoteUsdPrice(WBTC);
        order.verify(priceIndexClient).priceBySymbol("WBTC");
        order.verify(priceIndexClient).priceByAddress(1L, WBTC.getAddress());
    }

    @Test
    void symbolHitSkipsAddressLookup() {
        when(quoterClient.quoteUsdPrice(WETH)).thenReturn(null);
        when(priceIndexClient.priceBySymbol("WETH")).thenReturn(2100.0);

        assertEquals(2100.0, service.tokenUsdPrice(WETH, WBTC, 0));
        verify(priceIndexClient, never()).priceByAddress(anyLong(), anyString());
    }

    @Test
    void unpricedEventIsNull() {
        when(quoterClient.quoteUsdPrice(any())).thenReturn(null);
        when(priceIndexClient.priceBySymbol(anyString())).thenReturn(null);
        when(rpcClient.getChainId()).thenReturn(1L);
        when(priceIndexClient.priceByAddress(anyLong(), anyString())).thenReturn(null);

        assertNull(service.usdValue(BigDecimal.ONE, BigDecimal.ONE, WETH, WBTC, UsdAggregation.SUM));
    }

    @Test
    void zeroQuoteFallsThroughAndDoesNotDiluteAverage() {
        when(quoterClient.quoteUsdPrice(WETH)).thenReturn(2000.0);
        when(quoterClient.quoteUsdPrice(WBTC)).thenReturn(0.0);
        when(priceIndexClient.priceBySymbol("WBTC")).thenReturn(0.0);
        when(rpcClient.getChainId()).thenReturn(1L);
        when(priceIndexClient.priceByAddress(1L, WBTC.getAddress())).thenReturn(-1.0);

        BigDecimal usd = service.usdValue(new BigDecimal("2"), new BigDecimal("0.1"),
                WETH, WBTC, UsdAggregation.AVERAGE);

        assertEquals(0, new BigDecimal("4000").compareTo(usd));
        verify(priceIndexClient).priceByAddress(1L, WBTC.getAddress());
    }

    @Test
    void zeroQuoteFromQuoterUsesPriceIndex() {
        when(quoterClient.quoteUsdPrice(WBTC)).thenReturn(0.0);
        when(priceIndexClient.priceBySymbol("WBTC")).thenReturn(39000.0);

        assertEquals(39000.0, service.tokenUsdPrice(WBTC, WETH, 0));
    }

    @Test
    void resolvedPricesAreCachedPerPairAndSide() {
        when(quoterClient.quoteUsdPrice(WETH)).thenReturn(2000.0);

        service.tokenUsdPrice(WETH, WBTC, 0);
        service.tokenUsdPrice(WETH, WBTC, 0);
        service.tokenUsdPrice(WETH, WBTC, 1);

        verify(quoterClient, times(2)).quoteUsdPrice(WETH);
        verify(priceIndexClient, never()).priceByAddress(anyLong(), anyString());
    }
}
