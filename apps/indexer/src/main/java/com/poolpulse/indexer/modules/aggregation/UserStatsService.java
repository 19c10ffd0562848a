package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.LiquidityEvent;
import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.entity.UserStats;
import com.poolpulse.indexer.modules.chains.model.LiquidityEventType;
import com.poolpulse.indexer.repository.LiquidityEventRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import com.poolpulse.indexer.service.EventStorageService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-account activity rollup. Each event is merged atomically in the datastore; the resync
 * rebuilds every row from the stored raw events.
 */
@Slf4j
@Service
public class UserStatsService {

    private final EventStorageService storageService;
    private final SwapEventRepository swapRepository;
    private final LiquidityEventRepository liquidityRepository;
    private final UserStatsMerger merger;
    private final Tracer tracer;

    public UserStatsService(EventStorageService storageService,
                            SwapEventRepository swapRepository,
                            LiquidityEventRepository liquidityRepository,
                            PoolPulseProperties properties,
                            Tracer tracer) {
        this.storageService = storageService;
        this.swapRepository = swapRepository;
        this.liquidityRepository = liquidityRepository;
        this.merger = new UserStatsMerger(
                properties.getUserStats().getWhaleUsd(),
                properties.getUserStats().getRetailUsd());
        this.tracer = tracer;
    }

    /**
     * Credit the sender, and the recipient when it is a different account.
     */
    public void updateFromSwap(SwapEvent swap) {
        for (AccountActivity activity : activitiesOf(swap)) {
            apply(activity);
        }
    }

    /**
     * Credit the owner, and the sender when present and different.
     */
    public void updateFromLiquidityEvent(LiquidityEvent event) {
        for (AccountActivity activity : activitiesOf(event)) {
            apply(activity);
        }
    }

    /**
     * Rebuild every account row by replaying all stored events in chain order.
     *
     * @return number of accounts written
     */
    public int syncAllUserStats() {
        Span span = tracer.spanBuilder("UserStatsService.syncAllUserStats").startSpan();
        try {
            List<SwapEvent> swaps = swapRepository.findAllByOrderByBlockTimestampAscBlockNumberAscLogIndexAsc();
            List<LiquidityEvent> liquidityEvents =
                    liquidityRepository.findAllByOrderByBlockTimestampAscBlockNumberAscLogIndexAsc();
            log.info("Resyncing account stats from {} swaps and {} liquidity events",
                    swaps.size(), liquidityEvents.size());

            List<ReplayedEvent> replay = new ArrayList<>(swaps.size() + liquidityEvents.size());
            swaps.forEach(s -> replay.add(new ReplayedEvent(
                    s.getBlockTimestamp(), s.getBlockNumber(), s.getLogIndex(), activitiesOf(s))));
            liquidityEvents.forEach(e -> replay.add(new ReplayedEvent(
                    e.getBlockTimestamp(), e.getBlockNumber(), e.getLogIndex(), activitiesOf(e))));
            replay.sort(Comparator.comparing(ReplayedEvent::timestamp)
                    .thenComparingLong(ReplayedEvent::blockNumber)
                    .thenComparingInt(ReplayedEvent::logIndex));

            Map<String, UserStats> rows = new LinkedHashMap<>();
            for (ReplayedEvent event : replay) {
                for (AccountActivity activity : event.activities()) {
                    UserStats current = rows.getOrDefault(activity.getAddress(),
                            UserStats.empty(activity.getAddress()));
                    rows.put(activity.getAddress(), merger.merge(current, activity));
                }
            }

            storageService.replaceUserStats(new ArrayList<>(rows.values()));
            span.setAttribute("accounts", rows.size());
            log.info("Account stats resync complete: {} accounts", rows.size());
            return rows.size();
        } catch (RuntimeException e) {
            log.error("Account stats resync failed: {}", e.getMessage(), e);
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void apply(AccountActivity activity) {
        storageService.mergeUserActivity(merger.contribution(activity), activity.getUsdValue(),
                merger.getWhaleUsd(), merger.getRetailUsd());
    }

    static List<AccountActivity> activitiesOf(SwapEvent swap) {
        List<AccountActivity> activities = new ArrayList<>(2);
        activities.add(swapActivity(swap, swap.getSender()));
        if (swap.getRecipient() != null && !swap.getRecipient().equalsIgnoreCase(swap.getSender())) {
            activities.add(swapActivity(swap, swap.getRecipient()));
        }
        return activities;
    }

    static List<AccountActivity> activitiesOf(LiquidityEvent event) {
        boolean provider = event.getEventType() == LiquidityEventType.MINT
                || event.getEventType() == LiquidityEventType.BURN;
        List<AccountActivity> activities = new ArrayList<>(2);
        activities.add(liquidityActivity(event, event.getOwner(), provider));
        if (event.getSender() != null && !event.getSender().equalsIgnoreCase(event.getOwner())) {
            activities.add(liquidityActivity(event, event.getSender(), provider));
        }
        return activities;
    }

    private static AccountActivity swapActivity(SwapEvent swap, String address) {
        return AccountActivity.builder()
                .address(address.toLowerCase())
                .timestamp(swap.getBlockTimestamp())
                .swapType(swap.getSwapType())
                .usdValue(swap.getUsdValue())
                .build();
    }

    private static AccountActivity liquidityActivity(LiquidityEvent event, String address, boolean provider) {
        return AccountActivity.builder()
                .address(address.toLowerCase())
                .timestamp(event.getBlockTimestamp())
                .usdValue(event.getUsdValue())
                .liquidityProvider(provider)
                .build();
    }

    private record ReplayedEvent(Instant timestamp, long blockNumber, int logIndex,
                                 List<AccountActivity> activities) {
    }
}
