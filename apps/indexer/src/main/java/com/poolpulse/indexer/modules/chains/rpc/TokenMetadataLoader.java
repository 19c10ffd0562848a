package com.poolpulse.indexer.modules.chains.rpc;

import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.util.List;

/**
 * Reads token addresses of a pool and the ERC-20 metadata of each token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenMetadataLoader {

    private final ChainRpcClient rpcClient;

    public PoolTokens loadPoolTokens(String poolAddress) {
        String token0 = readAddress(poolAddress, ContractFunctions.token0());
        String token1 = readAddress(poolAddress, ContractFunctions.token1());
        PoolTokens tokens = new PoolTokens(loadToken(token0), loadToken(token1));
        log.info("Loaded pool tokens: token0={} ({}, {} decimals), token1={} ({}, {} decimals)",
                tokens.getToken0().getAddress(), tokens.getToken0().getSymbol(), tokens.getToken0().getDecimals(),
                tokens.getToken1().getAddress(), tokens.getToken1().getSymbol(), tokens.getToken1().getDecimals());
        return tokens;
    }

    public TokenInfo loadToken(String tokenAddress) {
        List<Type> decimals = rpcClient.call(tokenAddress, ContractFunctions.decimals());
        int tokenDecimals = ((BigInteger) decimals.get(0).getValue()).intValue();

        String symbol = "";
        try {
            List<Type> result = rpcClient.call(tokenAddress, ContractFunctions.symbol());
            symbol = (String) result.get(0).getValue();
        } catch (RuntimeException e) {
            log.warn("symbol() unavailable for {}: {}", tokenAddress, e.getMessage());
        }
        return new TokenInfo(tokenAddress, tokenDecimals, symbol);
    }

    private String readAddress(String poolAddress, Function function) {
        List<Type> result = rpcClient.call(poolAddress, function);
        return result.get(0).getValue().toString();
    }
}
