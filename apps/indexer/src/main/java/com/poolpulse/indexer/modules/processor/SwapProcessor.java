package com.poolpulse.indexer.modules.processor;

import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.model.RawSwapEvent;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import com.poolpulse.indexer.modules.valuation.PriceMath;
import com.poolpulse.indexer.modules.valuation.UsdAggregation;
import com.poolpulse.indexer.modules.valuation.ValuationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Turns a decoded Swap log into a valued swap row.
 */
@Slf4j
@Component
public class SwapProcessor extends PoolEventProcessor {

    private static final int NATIVE_DECIMALS = 18;

    public SwapProcessor(ChainRpcClient rpcClient, ValuationService valuationService) {
        super(rpcClient, valuationService);
    }

    /**
     * @throws IllegalStateException if token info is not set
     * @throws RuntimeException      if the block or receipt lookup fails
     */
    public SwapEvent process(RawSwapEvent raw) {
        PoolTokens tokens = requireTokens();

        Optional<TransactionReceipt> receipt = receipt(raw.getMetadata());

        SwapEvent swap = new SwapEvent();
        swap.setTransactionHash(raw.getMetadata().getTransactionHash());
        swap.setBlockNumber(raw.getMetadata().getBlockNumber());
        swap.setLogIndex(raw.getMetadata().getLogIndex());
        swap.setBlockTimestamp(blockTimestamp(raw.getMetadata()));
        swap.setSender(lower(originOf(receipt, raw.getSender())));
        swap.setRecipient(lower(raw.getRecipient()));
        swap.setAmount0(raw.getAmount0());
        swap.setAmount1(raw.getAmount1());
        swap.setSqrtPriceX96(raw.getSqrtPriceX96());
        swap.setLiquidity(raw.getLiquidity());
        swap.setTick(raw.getTick());

        BigDecimal amount0 = PriceMath.readableAmount(raw.getAmount0(), tokens.getToken0().getDecimals());
        BigDecimal amount1 = PriceMath.readableAmount(raw.getAmount1(), tokens.getToken1().getDecimals());
        swap.setAmount0Readable(amount0);
        swap.setAmount1Readable(amount1);

        double price = PriceMath.priceFromSqrtPrice(raw.getSqrtPriceX96());
        swap.setPriceToken0(PriceMath.toDecimal(price));
        swap.setPriceToken1(PriceMath.toDecimal(PriceMath.inversePrice(price)));
        swap.setSwapType(PriceMath.classifySwapDirection(raw.getAmount0()));

        swap.setUsdValue(valuationService.usdValue(amount0, amount1,
                tokens.getToken0(), tokens.getToken1(), UsdAggregation.AVERAGE));

        receipt.ifPresent(r -> applyGas(swap, r));

        log.debug("Processed swap tx={} logIndex={} type={} usd={}",
                swap.getTransactionHash(), swap.getLogIndex(), swap.getSwapType(), swap.getUsdValue());
        return swap;
    }

    private static void applyGas(SwapEvent swap, TransactionReceipt receipt) {
        if (receipt.getGasUsedRaw() == null) {
            return;
        }
        BigInteger gasUsed = receipt.getGasUsed();
        BigInteger gasPrice = receipt.getEffectiveGasPrice() != null
                ? Numeric.decodeQuantity(receipt.getEffectiveGasPrice())
                : BigInteger.ZERO;

        swap.setGasUsed(gasUsed.longValue());
        swap.setGasPrice(gasPrice);
        if (gasPrice.signum() > 0) {
            swap.setTransactionFee(new BigDecimal(gasUsed.multiply(gasPrice)).movePointLeft(NATIVE_DECIMALS));
        }
    }
}
