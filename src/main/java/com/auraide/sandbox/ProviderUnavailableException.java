package com.auraide.sandbox;

/**
 * Thrown when a provider is not registered or failed to initialize.
 */
public class ProviderUnavailableException extends SandboxException {

    private final ProviderType provider;

    public ProviderUnavailableException(ProviderType provider) {
        super("Provider '" + provider.wireName() + "' is not available");
        this.provider = provider;
    }

    public ProviderUnavailableException(ProviderType provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderType getProvider() {
        return provider;
    }
}
