package com.poolpulse.indexer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.protocol.websocket.WebSocketService;
import org.web3j.utils.Async;

import java.net.ConnectException;

/**
 * Web3j client for the configured RPC endpoint, over WebSocket for ws(s):// URLs and HTTP otherwise.
 * Log subscriptions poll an eth_newFilter on either transport at the configured polling interval.
 */
@Slf4j
@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(PoolPulseProperties properties) throws ConnectException {
        String url = properties.getRpc().getUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("poolpulse.rpc.url is not configured");
        }

        if (url.startsWith("ws://") || url.startsWith("wss://")) {
            WebSocketService wsService = new WebSocketService(url, true);
            wsService.connect();
            log.info("Connected to RPC via WebSocket: {}", url);
            return Web3j.build(wsService, properties.getRpc().getPollingIntervalMs(), Async.defaultExecutorService());
        }

        log.info("Connected to RPC via HTTP: {}", url);
        return Web3j.build(new HttpService(url), properties.getRpc().getPollingIntervalMs(), Async.defaultExecutorService());
    }
}
