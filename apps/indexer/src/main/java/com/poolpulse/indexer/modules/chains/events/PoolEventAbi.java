package com.poolpulse.indexer.modules.chains.events;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Int24;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;

/**
 * Concentrated-liquidity pool events consumed by the indexer.
 */
public final class PoolEventAbi {

    public static final Event SWAP = new Event("Swap", Arrays.asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Int256>() {},
            new TypeReference<Int256>() {},
            new TypeReference<Uint160>() {},
            new TypeReference<Uint128>() {},
            new TypeReference<Int24>() {}));

    public static final Event MINT = new Event("Mint", Arrays.asList(
            new TypeReference<Address>() {},
            new TypeReference<Address>(true) {},
            new TypeReference<Int24>(true) {},
            new TypeReference<Int24>(true) {},
            new TypeReference<Uint128>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}));

    public static final Event BURN = new Event("Burn", Arrays.asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Int24>(true) {},
            new TypeReference<Int24>(true) {},
            new TypeReference<Uint128>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}));

    public static final Event COLLECT = new Event("Collect", Arrays.asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>() {},
            new TypeReference<Int24>(true) {},
            new TypeReference<Int24>(true) {},
            new TypeReference<Uint128>() {},
            new TypeReference<Uint128>() {}));

    public static final String SWAP_TOPIC = EventEncoder.encode(SWAP);
    public static final String MINT_TOPIC = EventEncoder.encode(MINT);
    public static final String BURN_TOPIC = EventEncoder.encode(BURN);
    public static final String COLLECT_TOPIC = EventEncoder.encode(COLLECT);

    private PoolEventAbi() {
    }
}
