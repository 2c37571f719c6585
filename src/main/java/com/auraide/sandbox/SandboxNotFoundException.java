package com.auraide.sandbox;

public class SandboxNotFoundException extends SandboxException {

    private final String sandboxId;

    public SandboxNotFoundException(String sandboxId) {
        super("Sandbox " + sandboxId + " not found in any provider");
        this.sandboxId = sandboxId;
    }

    public SandboxNotFoundException(String sandboxId, ProviderType provider) {
        super("Sandbox " + sandboxId + " not found in provider '" + provider.wireName() + "'");
        this.sandboxId = sandboxId;
    }

    public String getSandboxId() {
        return sandboxId;
    }
}
