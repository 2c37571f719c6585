package com.auraide.sandbox;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Picks a provider for a new sandbox among the candidates.
 * Not thread-safe; {@link SandboxManager} calls it under its lock.
 */
class LoadBalancer {

    private final LoadBalancingStrategy strategy;
    private final Random random;
    private long roundRobinIndex;

    LoadBalancer(LoadBalancingStrategy strategy) {
        this(strategy, new Random());
    }

    LoadBalancer(LoadBalancingStrategy strategy, Random random) {
        this.strategy = strategy;
        this.random = random;
    }

    /**
     * @param candidates available providers in registry order, non-empty
     * @param loads      live session count per provider; absent means zero
     */
    ProviderType select(List<ProviderType> candidates, Map<ProviderType, Integer> loads) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidate providers");
        }
        return switch (strategy) {
            case ROUND_ROBIN -> nextRoundRobin(candidates);
            case LEAST_LOADED -> leastLoaded(candidates, loads);
            case RANDOM -> candidates.get(random.nextInt(candidates.size()));
        };
    }

    LoadBalancingStrategy strategy() {
        return strategy;
    }

    private ProviderType nextRoundRobin(List<ProviderType> candidates) {
        ProviderType selected = candidates.get((int) Math.floorMod(roundRobinIndex, (long) candidates.size()));
        roundRobinIndex = roundRobinIndex == Long.MAX_VALUE ? 0 : roundRobinIndex + 1;
        return selected;
    }

    // Ties go to the earliest candidate.
    private static ProviderType leastLoaded(List<ProviderType> candidates, Map<ProviderType, Integer> loads) {
        ProviderType best = candidates.get(0);
        int bestLoad = loads.getOrDefault(best, 0);
        for (ProviderType candidate : candidates) {
            int load = loads.getOrDefault(candidate, 0);
            if (load < bestLoad) {
                best = candidate;
                bestLoad = load;
            }
        }
        return best;
    }
}
