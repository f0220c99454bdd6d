package com.stockalert.monitor.domain.quote;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class QuoteProviderRegistry {

    private final Map<ProviderTier, QuoteProvider> providers = new EnumMap<>(ProviderTier.class);

    public QuoteProviderRegistry(List<QuoteProvider> providers) {
        for (var provider : providers) {
            var previous = this.providers.put(provider.tier(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two quote providers registered for tier " + provider.tier());
            }
        }
    }

    public Optional<QuoteProvider> find(ProviderTier tier) {
        return Optional.ofNullable(providers.get(tier));
    }

    public QuoteProvider get(ProviderTier tier) {
        return find(tier).orElseThrow(() -> new IllegalStateException("No quote provider for tier " + tier));
    }
}
