package com.auraide.sandbox;

public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    LEAST_LOADED,
    RANDOM
}
