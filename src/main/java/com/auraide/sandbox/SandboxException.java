package com.auraide.sandbox;

/**
 * Base type for sandbox infrastructure failures: a provider could not carry
 * out an operation for reasons other than a command's own exit status.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
