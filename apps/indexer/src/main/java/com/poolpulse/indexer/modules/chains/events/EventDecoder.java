package com.poolpulse.indexer.modules.chains.events;

import com.poolpulse.indexer.modules.chains.model.LiquidityEventType;
import com.poolpulse.indexer.modules.chains.model.LogMetadata;
import com.poolpulse.indexer.modules.chains.model.RawLiquidityEvent;
import com.poolpulse.indexer.modules.chains.model.RawSwapEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventValues;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.tx.Contract;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Decodes Web3j Log events into typed pool events.
 */
@Component
public class EventDecoder {

    private static final Logger logger = LoggerFactory.getLogger(EventDecoder.class);

    /**
     * Extract (txHash, blockNumber, logIndex). Empty when any of them is missing.
     *
     * @param logEvent Web3j Log object
     * @return metadata, or empty for malformed or truncated logs
     */
    public Optional<LogMetadata> readMetadata(Log logEvent) {
        if (logEvent == null
                || isBlank(logEvent.getTransactionHash())
                || isBlank(logEvent.getBlockNumberRaw())
                || isBlank(logEvent.getLogIndexRaw())) {
            return Optional.empty();
        }
        return Optional.of(new LogMetadata(
                logEvent.getTransactionHash().toLowerCase(),
                logEvent.getBlockNumber().longValue(),
                logEvent.getLogIndex().intValue()));
    }

    /**
     * Extract event signature from topics.
     */
    public String extractEventSignature(List<String> topics) {
        if (topics != null && !topics.isEmpty()) {
            return topics.get(0);
        }
        return null;
    }

    public boolean isSwap(Log logEvent) {
        return PoolEventAbi.SWAP_TOPIC.equalsIgnoreCase(extractEventSignature(logEvent.getTopics()));
    }

    public Optional<LiquidityEventType> liquidityEventType(Log logEvent) {
        String signature = extractEventSignature(logEvent.getTopics());
        if (PoolEventAbi.MINT_TOPIC.equalsIgnoreCase(signature)) {
            return Optional.of(LiquidityEventType.MINT);
        }
        if (PoolEventAbi.BURN_TOPIC.equalsIgnoreCase(signature)) {
            return Optional.of(LiquidityEventType.BURN);
        }
        if (PoolEventAbi.COLLECT_TOPIC.equalsIgnoreCase(signature)) {
            return Optional.of(LiquidityEventType.COLLECT);
        }
        return Optional.empty();
    }

    public RawSwapEvent decodeSwap(Log logEvent, LogMetadata metadata) {
        EventValues values = extract(PoolEventAbi.SWAP, logEvent);
        List<Type> indexed = values.getIndexedValues();
        List<Type> data = values.getNonIndexedValues();

        RawSwapEvent event = RawSwapEvent.builder()
                .metadata(metadata)
                .sender(address(indexed.get(0)))
                .recipient(address(indexed.get(1)))
                .amount0(integer(data.get(0)))
                .amount1(integer(data.get(1)))
                .sqrtPriceX96(integer(data.get(2)))
                .liquidity(integer(data.get(3)))
                .tick(integer(data.get(4)).intValue())
                .build();

        logger.debug("Decoded Swap: tx={}, logIndex={}, amount0={}, amount1={}",
                metadata.getTransactionHash(), metadata.getLogIndex(), event.getAmount0(), event.getAmount1());
        return event;
    }

    public RawLiquidityEvent decodeLiquidity(Log logEvent, LogMetadata metadata, LiquidityEventType type) {
        RawLiquidityEvent.RawLiquidityEventBuilder builder = RawLiquidityEvent.builder()
                .metadata(metadata)
                .type(type);

        EventValues values;
        switch (type) {
            case MINT -> {
                values = extract(PoolEventAbi.MINT, logEvent);
                List<Type> data = values.getNonIndexedValues();
                builder.sender(address(data.get(0)))
                        .liquidityDelta(integer(data.get(1)))
                        .amount0(integer(data.get(2)))
                        .amount1(integer(data.get(3)));
            }
            case BURN -> {
                values = extract(PoolEventAbi.BURN, logEvent);
                List<Type> data = values.getNonIndexedValues();
                builder.sender(null)
                        .liquidityDelta(integer(data.get(0)))
                        .amount0(integer(data.get(1)))
                        .amount1(integer(data.get(2)));
            }
            case COLLECT -> {
                values = extract(PoolEventAbi.COLLECT, logEvent);
                List<Type> data = values.getNonIndexedValues();
                builder.sender(address(data.get(0)))
                        .liquidityDelta(BigInteger.ZERO)
                        .amount0(integer(data.get(1)))
                        .amount1(integer(data.get(2)));
            }
            default -> throw new IllegalArgumentException("Unsupported liquidity event: " + type);
        }

        // owner, tickLower, tickUpper are indexed on all three events
        List<Type> indexed = values.getIndexedValues();
        RawLiquidityEvent event = builder
                .owner(address(indexed.get(0)))
                .tickLower(integer(indexed.get(1)).intValue())
                .tickUpper(integer(indexed.get(2)).intValue())
                .build();

        logger.debug("Decoded {}: tx={}, logIndex={}, owner={}",
                type, metadata.getTransactionHash(), metadata.getLogIndex(), event.getOwner());
        return event;
    }

    private EventValues extract(Event event, Log logEvent) {
        EventValues values = Contract.staticExtractEventParameters(event, logEvent);
        if (values == null) {
            throw new IllegalArgumentException("Log " + logEvent.getTransactionHash()
                    + " does not match event " + event.getName());
        }
        return values;
    }

    private static String address(Type value) {
        return value.toString().toLowerCase();
    }

    private static BigInteger integer(Type value) {
        return (BigInteger) value.getValue();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
