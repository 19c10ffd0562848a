package com.poolpulse.indexer.modules.chains.rpc;

/**
 * Chain node returned an error or an unusable response.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
