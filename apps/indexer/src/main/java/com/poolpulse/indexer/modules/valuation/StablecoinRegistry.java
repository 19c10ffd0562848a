package com.poolpulse.indexer.modules.valuation;

import com.poolpulse.indexer.config.PoolPulseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tokens valued at one USD per unit.
 */
@Component
public class StablecoinRegistry {

    private final Set<String> addresses;

    @Autowired
    public StablecoinRegistry(PoolPulseProperties properties) {
        this(properties.getValuation().getStablecoins());
    }

    public StablecoinRegistry(Collection<String> addresses) {
        this.addresses = addresses.stream()
                .map(a -> a.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isStablecoin(String address) {
        return address != null && addresses.contains(address.toLowerCase(Locale.ROOT));
    }
}
