package com.poolpulse.indexer.modules.processor;

import com.poolpulse.indexer.entity.LiquidityEvent;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.model.RawLiquidityEvent;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import com.poolpulse.indexer.modules.valuation.PriceMath;
import com.poolpulse.indexer.modules.valuation.UsdAggregation;
import com.poolpulse.indexer.modules.valuation.ValuationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Turns decoded Mint, Burn and Collect logs into valued liquidity rows.
 * Both sides are summed in USD since the event moves capital on both tokens.
 */
@Slf4j
@Component
public class LiquidityProcessor extends PoolEventProcessor {

    public LiquidityProcessor(ChainRpcClient rpcClient, ValuationService valuationService) {
        super(rpcClient, valuationService);
    }

    public LiquidityEvent process(RawLiquidityEvent raw) {
        PoolTokens tokens = requireTokens();

        String origin = originOf(receipt(raw.getMetadata()), raw.getSender());

        LiquidityEvent event = new LiquidityEvent();
        event.setTransactionHash(raw.getMetadata().getTransactionHash());
        event.setBlockNumber(raw.getMetadata().getBlockNumber());
        event.setLogIndex(raw.getMetadata().getLogIndex());
        event.setBlockTimestamp(blockTimestamp(raw.getMetadata()));
        event.setEventType(raw.getType());
        event.setOwner(lower(raw.getOwner()));
        event.setSender(lower(origin));
        event.setLiquidityDelta(raw.getLiquidityDelta());
        event.setTickLower(raw.getTickLower());
        event.setTickUpper(raw.getTickUpper());
        event.setAmount0(raw.getAmount0());
        event.setAmount1(raw.getAmount1());

        BigDecimal amount0 = PriceMath.readableAmount(raw.getAmount0(), tokens.getToken0().getDecimals());
        BigDecimal amount1 = PriceMath.readableAmount(raw.getAmount1(), tokens.getToken1().getDecimals());
        event.setAmount0Readable(amount0);
        event.setAmount1Readable(amount1);
        event.setUsdValue(valuationService.usdValue(amount0, amount1,
                tokens.getToken0(), tokens.getToken1(), UsdAggregation.SUM));

        log.debug("Processed {} tx={} logIndex={} usd={}",
                event.getEventType(), event.getTransactionHash(), event.getLogIndex(), event.getUsdValue());
        return event;
    }
}
