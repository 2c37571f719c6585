package com.auraide.sandbox.workspace;

import com.auraide.sandbox.SandboxException;

/**
 * Non-2xx answer from the workspace service.
 */
public class WorkspaceApiException extends SandboxException {

    private final int statusCode;

    public WorkspaceApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
