package com.auraide.sandbox;

import com.auraide.sandbox.model.ProviderHealth;
import com.auraide.sandbox.model.ProviderInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds exactly one provider instance per {@link ProviderType} and tracks which
 * of them initialized successfully. Iteration follows {@link ProviderType} declaration order.
 */
@Service
public class SandboxProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(SandboxProviderRegistry.class);

    private final Map<ProviderType, SandboxProvider> providers = new EnumMap<>(ProviderType.class);
    private final Set<ProviderType> initialized = Collections.synchronizedSet(EnumSet.noneOf(ProviderType.class));
    private final Map<ProviderType, String> initializationErrors = Collections.synchronizedMap(new EnumMap<>(ProviderType.class));

    public SandboxProviderRegistry(List<SandboxProvider> providers) {
        for (SandboxProvider provider : providers) {
            SandboxProvider previous = this.providers.putIfAbsent(provider.type(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider registered for type " + provider.type());
            }
        }
        log.info("Registered sandbox providers: {}", this.providers.keySet());
    }

    /**
     * Initializes every registered provider that is not already initialized.
     * A failure marks only that provider unavailable.
     *
     * @return initialization outcome per provider
     */
    public Map<ProviderType, Boolean> initializeAll() {
        Map<ProviderType, Boolean> outcome = new LinkedHashMap<>();
        for (var entry : providers.entrySet()) {
            ProviderType type = entry.getKey();
            if (initialized.contains(type)) {
                outcome.put(type, true);
                continue;
            }
            try {
                entry.getValue().initialize();
                initialized.add(type);
                initializationErrors.remove(type);
                outcome.put(type, true);
                log.info("Provider '{}' initialized", type);
            } catch (RuntimeException e) {
                initializationErrors.put(type, e.getMessage());
                outcome.put(type, false);
                log.warn("Provider '{}' failed to initialize: {}", type, e.getMessage());
            }
        }
        return outcome;
    }

    /**
     * @throws ProviderUnavailableException if the type is not registered or not initialized
     */
    public SandboxProvider getProvider(ProviderType type) {
        SandboxProvider provider = providers.get(type);
        if (provider == null) {
            throw new ProviderUnavailableException(type, "Provider '" + type.wireName() + "' is not registered");
        }
        if (!initialized.contains(type)) {
            throw new ProviderUnavailableException(type);
        }
        return provider;
    }

    public Optional<SandboxProvider> findProvider(ProviderType type) {
        return isAvailable(type) ? Optional.of(providers.get(type)) : Optional.empty();
    }

    public boolean isAvailable(ProviderType type) {
        return providers.containsKey(type) && initialized.contains(type);
    }

    public List<ProviderType> getRegisteredProviders() {
        return List.copyOf(providers.keySet());
    }

    /**
     * @return initialized providers in registry order
     */
    public List<ProviderType> getAvailableProviders() {
        List<ProviderType> available = new ArrayList<>();
        for (ProviderType type : providers.keySet()) {
            if (initialized.contains(type)) {
                available.add(type);
            }
        }
        return available;
    }

    public Optional<String> getInitializationError(ProviderType type) {
        return Optional.ofNullable(initializationErrors.get(type));
    }

    public ProviderCapabilities getCapabilities(ProviderType type) {
        SandboxProvider provider = providers.get(type);
        if (provider == null) {
            throw new ProviderUnavailableException(type, "Provider '" + type.wireName() + "' is not registered");
        }
        return provider.capabilities();
    }

    public Map<ProviderType, ProviderCapabilities> getAllCapabilities() {
        Map<ProviderType, ProviderCapabilities> result = new LinkedHashMap<>();
        providers.forEach((type, provider) -> result.put(type, provider.capabilities()));
        return result;
    }

    /**
     * Never throws: an unavailable provider or a failing check is reported unhealthy.
     */
    public ProviderHealth healthCheck(ProviderType type) {
        if (!isAvailable(type)) {
            return ProviderHealth.unhealthy(0, getInitializationError(type)
                    .map(err -> "Provider not initialized: " + err)
                    .orElse("Provider not available"));
        }
        long start = System.nanoTime();
        try {
            return providers.get(type).healthCheck();
        } catch (RuntimeException e) {
            log.warn("Health check for provider '{}' failed: {}", type, e.getMessage());
            return ProviderHealth.unhealthy((System.nanoTime() - start) / 1_000_000, e.getMessage());
        }
    }

    public Map<ProviderType, ProviderHealth> healthCheckAll() {
        Map<ProviderType, ProviderHealth> result = new LinkedHashMap<>();
        for (ProviderType type : providers.keySet()) {
            result.put(type, healthCheck(type));
        }
        return result;
    }

    /**
     * @throws ProviderUnavailableException if the provider is unavailable
     */
    public ProviderInfo getProviderInfo(ProviderType type) {
        return getProvider(type).getProviderInfo();
    }

    /**
     * Calls {@link SandboxProvider#cleanup()} on every initialized provider, logging failures.
     */
    public void cleanupAll() {
        for (ProviderType type : getAvailableProviders()) {
            try {
                providers.get(type).cleanup();
                log.info("Provider '{}' cleaned up", type);
            } catch (RuntimeException e) {
                log.warn("Cleanup of provider '{}' failed: {}", type, e.getMessage(), e);
            }
            initialized.remove(type);
        }
    }
}
