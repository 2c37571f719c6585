package com.auraide.sandbox;

/**
 * Outcome of an operation that depends on an optional provider capability.
 * An unsupported outcome is a normal value, never an exception.
 *
 * @param supported  false when the provider lacks the capability
 * @param value      operation result when supported (may itself be null)
 * @param capability the capability that was missing, when unsupported
 * @param reason     human-readable explanation when unsupported
 */
public record CapabilityResult<T>(
    boolean supported,
    T value,
    Capability capability,
    String reason
) {
    public static <T> CapabilityResult<T> of(T value) {
        return new CapabilityResult<>(true, value, null, null);
    }

    public static <T> CapabilityResult<T> unsupported(ProviderType provider, Capability capability) {
        return new CapabilityResult<>(false, null, capability,
                "Provider '" + provider.wireName() + "' does not support " + capability.wireName());
    }

    public boolean isUnsupported() {
        return !supported;
    }
}
