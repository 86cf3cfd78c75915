/**
 * Health indicator for poster providers
 *
 * @author William Callahan
 *
 * Reports UP while at least one provider is available, with each provider's circuit state
 */

package com.williamcallahan.poster_resolution_engine.config;

import com.williamcallahan.poster_resolution_engine.service.ResolutionManager;
import com.williamcallahan.poster_resolution_engine.types.ProviderStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component("posterProvidersHealthIndicator")
public class PosterProvidersHealthIndicator implements HealthIndicator {

    private final ResolutionManager resolutionManager;

    public PosterProvidersHealthIndicator(ResolutionManager resolutionManager) {
        this.resolutionManager = resolutionManager;
    }

    @Override
    public Health health() {
        Map<String, ProviderStatus> providers = resolutionManager.getStats().providers();
        if (providers.isEmpty()) {
            return Health.unknown().withDetail("reason", "no poster providers registered").build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        long available = 0;
        for (ProviderStatus status : providers.values()) {
            if (status.available()) {
                available++;
            }
            Map<String, Object> providerDetails = new LinkedHashMap<>();
            providerDetails.put("enabled", status.enabled());
            providerDetails.put("available", status.available());
            providerDetails.put("circuit", status.circuitState());
            providerDetails.put("consecutiveFailures", status.metrics().consecutiveFailures());
            details.put(status.name(), providerDetails);
        }

        Health.Builder builder = available > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("availableProviders", available)
                .withDetail("providers", details)
                .build();
    }
}
