package com.poolpulse.indexer.modules.snapshot;

import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import com.poolpulse.indexer.modules.chains.rpc.ContractFunctions;
import com.poolpulse.indexer.modules.valuation.PriceMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class PoolStateReader {

    private final ChainRpcClient rpcClient;

    public PoolState readState(String poolAddress) {
        List<Type> slot0 = rpcClient.call(poolAddress, ContractFunctions.slot0());
        List<Type> liquidity = rpcClient.call(poolAddress, ContractFunctions.liquidity());
        long blockNumber = rpcClient.getBlockNumber();

        return new PoolState(
                (BigInteger) slot0.get(0).getValue(),
                ((BigInteger) slot0.get(1).getValue()).intValue(),
                (BigInteger) liquidity.get(0).getValue(),
                blockNumber);
    }

    /**
     * Readable balance of {@code token} held by the pool, null when the lookup fails.
     */
    public BigDecimal readBalance(TokenInfo token, String poolAddress) {
        try {
            List<Type> result = rpcClient.call(token.getAddress(), ContractFunctions.balanceOf(poolAddress));
            return PriceMath.readableAmount((BigInteger) result.get(0).getValue(), token.getDecimals());
        } catch (RuntimeException e) {
            log.warn("balanceOf({}) failed on {}: {}", poolAddress, token.getAddress(), e.getMessage());
            return null;
        }
    }
}
