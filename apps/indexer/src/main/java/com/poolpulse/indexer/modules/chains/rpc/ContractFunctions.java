package com.poolpulse.indexer.modules.chains.rpc;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Int24;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint16;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.Bool;

import java.math.BigInteger;
import java.util.List;

/**
 * ABI definitions of the read-only pool, ERC-20 and quoter calls.
 */
public final class ContractFunctions {

    private ContractFunctions() {
    }

    public static Function token0() {
        return new Function("token0", List.of(), List.of(new TypeReference<Address>() {}));
    }

    public static Function token1() {
        return new Function("token1", List.of(), List.of(new TypeReference<Address>() {}));
    }

    public static Function decimals() {
        return new Function("decimals", List.of(), List.of(new TypeReference<Uint8>() {}));
    }

    public static Function symbol() {
        return new Function("symbol", List.of(), List.of(new TypeReference<Utf8String>() {}));
    }

    public static Function balanceOf(String owner) {
        return new Function("balanceOf", List.of(new Address(owner)), List.of(new TypeReference<Uint256>() {}));
    }

    /**
     * slot0(): sqrtPriceX96, tick, observationIndex, observationCardinality,
     * observationCardinalityNext, feeProtocol, unlocked.
     */
    public static Function slot0() {
        return new Function("slot0", List.of(), List.of(
                new TypeReference<Uint160>() {},
                new TypeReference<Int24>() {},
                new TypeReference<Uint16>() {},
                new TypeReference<Uint16>() {},
                new TypeReference<Uint16>() {},
                new TypeReference<Uint8>() {},
                new TypeReference<Bool>() {}));
    }

    public static Function liquidity() {
        return new Function("liquidity", List.of(), List.of(new TypeReference<Uint128>() {}));
    }

    /**
     * Quoter V1 quoteExactInputSingle with no price limit.
     */
    public static Function quoteExactInputSingle(String tokenIn, String tokenOut, int fee, BigInteger amountIn) {
        return new Function("quoteExactInputSingle",
                List.of(new Address(tokenIn), new Address(tokenOut), new Uint24(fee),
                        new Uint256(amountIn), new Uint160(BigInteger.ZERO)),
                List.of(new TypeReference<Uint256>() {}));
    }
}
