package com.poolpulse.indexer.modules.chains.rpc;

import com.poolpulse.indexer.util.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetCode;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChainRpcClientTest {

    private static final String POOL = "0x88e6a0c2ddd26feeb64f039a2c41296fcb3f5640";

    private Web3j web3j;
    private ChainRpcClient client;

    @BeforeEach
    void setUp() {
        web3j = mock(Web3j.class);
        client = new ChainRpcClient(web3j, new RetryPolicy(3, Duration.ofMillis(1), Duration.ofSeconds(5))
                .retryingOn(e -> !(e instanceof RpcException)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void transportFailureIsRetried() throws Exception {
        EthGetCode code = new EthGetCode();
        code.setResult("0x6080");
        Request<?, EthGetCode> request = mock(Request.class);
        when(request.send()).thenThrow(new IOException("connection reset")).thenReturn(code);
        doReturn(request).when(web3j).ethGetCode(anyString(), any());

        assertEquals("0x6080", client.getCode(POOL));
        verify(request, times(2)).send();
    }

    @Test
    @SuppressWarnings("unchecked")
    void rpcErrorIsNotRetried() throws Exception {
        EthGetCode failed = new EthGetCode();
        failed.setError(new Response.Error(-32000, "header not found"));
        Request<?, EthGetCode> request = mock(Request.class);
        when(request.send()).thenReturn(failed);
        doReturn(request).when(web3j).ethGetCode(anyString(), any());

        RpcException e = assertThrows(RpcException.class, () -> client.getCode(POOL));

        assertEquals("RPC error -32000: header not found", e.getMessage());
        verify(request, times(1)).send();
    }

    @Test
    @SuppressWarnings("unchecked")
    void chainIdIsReadOnce() throws Exception {
        EthChainId chainId = new EthChainId();
        chainId.setResult("0xa4b1");
        Request<?, EthChainId> request = mock(Request.class);
        when(request.send()).thenReturn(chainId);
        doReturn(request).when(web3j).ethChainId();

        assertEquals(42161L, client.getChainId());
        assertEquals(42161L, client.getChainId());
        verify(request, times(1)).send();
    }
}
