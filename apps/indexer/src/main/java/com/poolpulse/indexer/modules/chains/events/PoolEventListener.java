package com.poolpulse.indexer.modules.chains.events;

import com.poolpulse.indexer.modules.chains.model.LiquidityEventType;
import com.poolpulse.indexer.modules.chains.model.ListenerStatus;
import com.poolpulse.indexer.modules.chains.model.LogMetadata;
import com.poolpulse.indexer.modules.chains.model.RawLiquidityEvent;
import com.poolpulse.indexer.modules.chains.model.RawSwapEvent;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.reactivex.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.web3j.crypto.WalletUtils;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Subscribes to Swap/Mint/Burn/Collect logs of monitored pools.
 * Keeps one live subscription per pool; decoded events are handed to a bounded worker pool.
 */
@Component
public class PoolEventListener {

    private static final Logger logger = LoggerFactory.getLogger(PoolEventListener.class);
    private static final long RESUBSCRIBE_DELAY_MS = 5_000;

    private final Web3j web3j;
    private final ChainRpcClient rpcClient;
    private final EventDecoder eventDecoder;
    private final PoolEventHandler eventHandler;
    private final Executor eventExecutor;
    private final Tracer tracer;
    private final Map<String, Disposable> subscriptions = new ConcurrentHashMap<>();

    public PoolEventListener(Web3j web3j,
                             ChainRpcClient rpcClient,
                             EventDecoder eventDecoder,
                             PoolEventHandler eventHandler,
                             @Qualifier("eventExecutor") Executor eventExecutor,
                             Tracer tracer) {
        this.web3j = web3j;
        this.rpcClient = rpcClient;
        this.eventDecoder = eventDecoder;
        this.eventHandler = eventHandler;
        this.eventExecutor = eventExecutor;
        this.tracer = tracer;
    }

    /**
     * Start listening to a pool. A prior subscription for the same pool is disposed first.
     *
     * @param poolAddress Pool contract address
     * @throws IllegalArgumentException If the address is malformed or has no contract code
     */
    public void attach(String poolAddress) {
        Span span = tracer.spanBuilder("PoolEventListener.attach")
                .setAttribute("pool.address", String.valueOf(poolAddress))
                .startSpan();
        try {
            if (poolAddress == null || !WalletUtils.isValidAddress(poolAddress)) {
                throw new IllegalArgumentException("Invalid pool address: " + poolAddress);
            }
            String pool = poolAddress.toLowerCase();

            String code = rpcClient.getCode(pool);
            if (code == null || code.isEmpty() || "0x".equals(code)) {
                throw new IllegalArgumentException("No contract deployed at " + pool);
            }

            Disposable previous = subscriptions.remove(pool);
            if (previous != null) {
                previous.dispose();
                logger.info("Replaced existing subscription for pool {}", pool);
            }

            subscriptions.put(pool, subscribe(pool));
            logger.info("Listening to pool {} (Swap, Mint, Burn, Collect)", pool);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Stop listening to one pool, or to every pool when the address is null. Idempotent.
     */
    public void detach(String poolAddress) {
        if (poolAddress == null) {
            subscriptions.forEach((pool, subscription) -> subscription.dispose());
            int count = subscriptions.size();
            subscriptions.clear();
            logger.info("Stopped listening to {} pool(s)", count);
            return;
        }

        Disposable subscription = subscriptions.remove(poolAddress.toLowerCase());
        if (subscription != null) {
            subscription.dispose();
            logger.info("Stopped listening to pool {}", poolAddress.toLowerCase());
        }
    }

    public ListenerStatus getStatus() {
        List<String> pools = new ArrayList<>(subscriptions.keySet());
        return new ListenerStatus(!pools.isEmpty(), pools, pools.size());
    }

    private Disposable subscribe(String pool) {
        EthFilter filter = new EthFilter(DefaultBlockParameterName.LATEST, DefaultBlockParameterName.LATEST, pool);
        filter.addOptionalTopics(
                PoolEventAbi.SWAP_TOPIC,
                PoolEventAbi.MINT_TOPIC,
                PoolEventAbi.BURN_TOPIC,
                PoolEventAbi.COLLECT_TOPIC);

        return web3j.ethLogFlowable(filter)
                .subscribe(
                        logEvent -> handleLog(pool, logEvent),
                        error -> handleError(pool, error),
                        () -> logger.info("Event stream completed for pool: {}", pool));
    }

    /**
     * Handle incoming log event.
     */
    void handleLog(String pool, Log logEvent) {
        Span span = tracer.spanBuilder("PoolEventListener.handleLog")
                .setAttribute("pool.address", pool)
                .setAttribute("tx.hash", logEvent != null ? String.valueOf(logEvent.getTransactionHash()) : "null")
                .startSpan();
        try {
            Optional<LogMetadata> metadata = eventDecoder.readMetadata(logEvent);
            if (metadata.isEmpty()) {
                logger.warn("Dropping log without tx hash, block number or log index: pool={}, tx={}",
                        pool, logEvent != null ? logEvent.getTransactionHash() : null);
                return;
            }

            if (eventDecoder.isSwap(logEvent)) {
                RawSwapEvent swap = eventDecoder.decodeSwap(logEvent, metadata.get());
                eventExecutor.execute(() -> eventHandler.onSwap(swap));
                return;
            }

            Optional<LiquidityEventType> type = eventDecoder.liquidityEventType(logEvent);
            if (type.isPresent()) {
                RawLiquidityEvent event = eventDecoder.decodeLiquidity(logEvent, metadata.get(), type.get());
                eventExecutor.execute(() -> eventHandler.onLiquidityEvent(event));
            } else {
                logger.debug("Ignoring unknown event signature {} from pool {}",
                        eventDecoder.extractEventSignature(logEvent.getTopics()), pool);
            }
        } catch (Exception e) {
            logger.error("Error handling log event from pool {}: {}", pool, e.getMessage(), e);
            span.recordException(e);
        } finally {
            span.end();
        }
    }

    /**
     * Handle subscription error. The pool is resubscribed unless it was detached meanwhile.
     */
    private void handleError(String pool, Throwable error) {
        logger.error("Error in event stream for pool {}: {}", pool, error.getMessage(), error);
        Disposable failed = subscriptions.get(pool);
        if (failed == null) {
            return;
        }

        CompletableFuture.delayedExecutor(RESUBSCRIBE_DELAY_MS, TimeUnit.MILLISECONDS).execute(() -> {
            if (subscriptions.get(pool) != failed) {
                return;
            }
            try {
                Disposable replacement = subscribe(pool);
                if (!subscriptions.replace(pool, failed, replacement)) {
                    replacement.dispose();
                    return;
                }
                logger.info("Resubscribed to pool {}", pool);
            } catch (Exception e) {
                logger.error("Failed to resubscribe to pool {}: {}", pool, e.getMessage(), e);
            }
        });
    }
}
