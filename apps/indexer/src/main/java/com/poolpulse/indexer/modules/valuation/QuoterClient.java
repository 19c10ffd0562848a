package com.poolpulse.indexer.modules.valuation;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.modules.chains.model.TokenInfo;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import com.poolpulse.indexer.modules.chains.rpc.ContractFunctions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unit USD prices from the on-chain quoter, trying fee tiers in ascending order.
 */
@Slf4j
@Component
public class QuoterClient {

    private final ChainRpcClient rpcClient;
    private final PoolPulseProperties.Valuation settings;
    private final Map<String, Integer> quoteTokenDecimals = new ConcurrentHashMap<>();

    public QuoterClient(ChainRpcClient rpcClient, PoolPulseProperties properties) {
        this.rpcClient = rpcClient;
        this.settings = properties.getValuation();
    }

    /**
     * USD quote token on the connected chain.
     */
    public String usdTokenAddress() {
        long chainId = rpcClient.getChainId();
        return settings.getUsdTokens().getOrDefault(chainId, settings.getDefaultUsdToken()).toLowerCase(Locale.ROOT);
    }

    /**
     * Price of one whole token in USD, or null when no fee tier quotes it.
     */
    public Double quoteUsdPrice(TokenInfo token) {
        String usdToken;
        int usdDecimals;
        try {
            usdToken = usdTokenAddress();
            if (usdToken.equals(token.getAddress())) {
                return 1.0;
            }
            usdDecimals = quoteTokenDecimals(usdToken);
        } catch (RuntimeException e) {
            log.warn("Quoter unavailable for {}: {}", token.getAddress(), e.getMessage());
            return null;
        }
        BigInteger oneToken = BigInteger.TEN.pow(token.getDecimals());

        for (Integer fee : settings.getFeeTiers().stream().sorted().toList()) {
            try {
                List<Type> result = rpcClient.call(settings.getQuoterAddress(),
                        ContractFunctions.quoteExactInputSingle(token.getAddress(), usdToken, fee, oneToken));
                BigInteger amountOut = (BigInteger) result.get(0).getValue();
                if (amountOut.signum() > 0) {
                    double price = new BigDecimal(amountOut).movePointLeft(usdDecimals)
                            .round(MathContext.DECIMAL64).doubleValue();
                    log.debug("Quoted {} at {} USD (fee tier {})", token.getSymbol(), price, fee);
                    return price;
                }
            } catch (RuntimeException e) {
                log.debug("Quote failed for {} at fee tier {}: {}", token.getAddress(), fee, e.getMessage());
            }
        }
        log.warn("No fee tier quoted {} ({})", token.getSymbol(), token.getAddress());
        return null;
    }

    private int quoteTokenDecimals(String usdToken) {
        return quoteTokenDecimals.computeIfAbsent(usdToken, address -> {
            List<Type> result = rpcClient.call(address, ContractFunctions.decimals());
            return ((BigInteger) result.get(0).getValue()).intValue();
        });
    }
}
