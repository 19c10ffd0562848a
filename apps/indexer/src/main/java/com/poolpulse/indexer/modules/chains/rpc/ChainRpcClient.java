package com.poolpulse.indexer.modules.chains.rpc;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Request/response RPC calls against the chain node.
 * Every call runs under the shared RPC retry policy; exhaustion surfaces as an exception.
 * JSON-RPC error responses are deterministic and are not retried.
 */
@Component
public class ChainRpcClient {

    private static final Logger logger = LoggerFactory.getLogger(ChainRpcClient.class);

    private final Web3j web3j;
    private final RetryPolicy retryPolicy;
    private volatile Long chainId;

    @Autowired
    public ChainRpcClient(Web3j web3j, PoolPulseProperties properties) {
        this(web3j, new RetryPolicy(
                properties.getRpc().getAttempts(),
                Duration.ofMillis(properties.getRpc().getDelayMs()),
                Duration.ofMillis(properties.getRpc().getTimeoutMs()))
                .retryingOn(e -> !(e instanceof RpcException)));
    }

    public ChainRpcClient(Web3j web3j, RetryPolicy retryPolicy) {
        this.web3j = web3j;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Deployed bytecode at the address, "0x" when none.
     */
    public String getCode(String address) {
        return retryPolicy.execute("eth_getCode " + address, () ->
                checked(web3j.ethGetCode(address, DefaultBlockParameterName.LATEST).send()).getCode());
    }

    public Instant getBlockTimestamp(long blockNumber) {
        EthBlock.Block block = retryPolicy.execute("eth_getBlockByNumber " + blockNumber, () ->
                checked(web3j.ethGetBlockByNumber(
                        DefaultBlockParameter.valueOf(BigInteger.valueOf(blockNumber)), false).send()).getBlock());
        if (block == null) {
            throw new RpcException("Block not found: " + blockNumber);
        }
        return Instant.ofEpochSecond(block.getTimestamp().longValue());
    }

    /**
     * Receipt of a mined transaction, empty when the node does not know it.
     */
    public Optional<TransactionReceipt> getTransactionReceipt(String txHash) {
        EthGetTransactionReceipt response = retryPolicy.execute("eth_getTransactionReceipt " + txHash, () ->
                checked(web3j.ethGetTransactionReceipt(txHash).send()));
        return response.getTransactionReceipt();
    }

    public long getBlockNumber() {
        return retryPolicy.execute("eth_blockNumber", () ->
                checked(web3j.ethBlockNumber().send()).getBlockNumber().longValue());
    }

    /**
     * Chain id of the connected node, read once.
     */
    public long getChainId() {
        Long cached = chainId;
        if (cached == null) {
            cached = retryPolicy.execute("eth_chainId", () ->
                    checked(web3j.ethChainId().send()).getChainId().longValue());
            chainId = cached;
            logger.info("Detected chain id {}", cached);
        }
        return cached;
    }

    /**
     * Read-only contract call at the latest block.
     *
     * @param contractAddress Target contract
     * @param function        ABI function with its output parameters
     * @return Decoded return values
     */
    public List<Type> call(String contractAddress, Function function) {
        String data = FunctionEncoder.encode(function);
        EthCall response = retryPolicy.execute("eth_call " + function.getName() + "@" + contractAddress, () ->
                checked(web3j.ethCall(
                        Transaction.createEthCallTransaction(null, contractAddress, data),
                        DefaultBlockParameterName.LATEST).send()));
        if (response.isReverted()) {
            throw new RpcException(function.getName() + " reverted: " + response.getRevertReason());
        }
        List<Type> values = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (values.isEmpty() && !function.getOutputParameters().isEmpty()) {
            throw new RpcException(function.getName() + " returned no data from " + contractAddress);
        }
        return values;
    }

    private static <R extends Response<?>> R checked(R response) {
        if (response.hasError()) {
            throw new RpcException("RPC error " + response.getError().getCode() + ": " + response.getError().getMessage());
        }
        return response;
    }
}
