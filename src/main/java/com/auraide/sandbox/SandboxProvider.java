package com.auraide.sandbox;

import com.auraide.core.events.EventBus;
import com.auraide.core.events.SandboxEvent;
import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Uniform contract over a family of sandbox backends.
 * Implementations: {@code LocalSandboxProvider} (reference), {@code DockerSandboxProvider},
 * {@code WorkspaceSandboxProvider}.
 *
 * <p>All calls block the calling thread. Paths are relative to the sandbox root.
 * Operations backed by an optional {@link Capability} return a {@link CapabilityResult};
 * the defaults here report them as unsupported.
 */
public interface SandboxProvider {

    ProviderType type();

    ProviderCapabilities capabilities();

    /**
     * Prepares the provider for use. A provider whose initialization throws is
     * reported unavailable by the registry.
     */
    void initialize();

    /**
     * Releases timers, connections and executors. Sandboxes themselves are left in place.
     */
    void cleanup();

    // -- Lifecycle -----------------------------------------------------------

    SandboxEnvironment createSandbox(SandboxCreateOptions options);

    /**
     * @return the sandbox, or null when this provider does not know the id
     */
    SandboxEnvironment getSandbox(String sandboxId);

    List<SandboxEnvironment> listSandboxes(SandboxFilters filters);

    SandboxEnvironment updateSandbox(String sandboxId, SandboxUpdateOptions options);

    SandboxEnvironment startSandbox(String sandboxId);

    SandboxEnvironment stopSandbox(String sandboxId);

    /**
     * Stops, waits a settle delay, then starts the sandbox.
     */
    SandboxEnvironment restartSandbox(String sandboxId);

    /**
     * @return false when the sandbox did not exist
     */
    boolean deleteSandbox(String sandboxId);

    /**
     * @return current usage, or null when the provider cannot measure it
     */
    SandboxMetrics getMetrics(String sandboxId);

    // -- Execution -----------------------------------------------------------

    /**
     * Runs a shell command. A non-zero exit status or a timeout is a normal result;
     * only an unknown or unreachable sandbox throws.
     */
    ExecutionResult executeCommand(String sandboxId, String command, ExecOptions options);

    // -- Files ---------------------------------------------------------------

    List<FileSystemEntry> listFiles(String sandboxId, String path, ListFilesOptions options);

    /**
     * @return the file, or null when it does not exist
     */
    SandboxFile readFile(String sandboxId, String path, ReadFileOptions options);

    void writeFile(String sandboxId, String path, String content, WriteFileOptions options);

    /**
     * @return true if something was deleted, or if the path was missing and {@code force} was set
     */
    boolean deleteFile(String sandboxId, String path, DeleteFileOptions options);

    void createDirectory(String sandboxId, String path, CreateDirectoryOptions options);

    /**
     * Writes each file independently; a failure on one file does not stop the rest.
     */
    default UploadResult uploadFiles(String sandboxId, List<UploadFile> files, UploadOptions options) {
        List<String> uploaded = new ArrayList<>();
        List<UploadResult.Failure> failed = new ArrayList<>();
        for (UploadFile file : files) {
            String target = options.resolve(file.path());
            try {
                if (!options.overwrite()
                        && readFile(sandboxId, target, new ReadFileOptions(FileEncoding.BINARY, null)) != null) {
                    failed.add(new UploadResult.Failure(target, "File already exists"));
                    continue;
                }
                writeFile(sandboxId, target, file.content(),
                        new WriteFileOptions(file.encoding(), options.createDirs(), false));
                uploaded.add(target);
            } catch (RuntimeException e) {
                failed.add(new UploadResult.Failure(target, e.getMessage()));
            }
        }
        return new UploadResult(uploaded, failed);
    }

    /**
     * @return content keyed by requested path; missing files are left out
     */
    default Map<String, byte[]> downloadFiles(String sandboxId, List<String> paths, String baseDir) {
        var resolver = new UploadOptions(baseDir, true, false);
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (String path : paths) {
            SandboxFile file = readFile(sandboxId, resolver.resolve(path), new ReadFileOptions(FileEncoding.BINARY, null));
            if (file != null) {
                result.put(path, file.content());
            }
        }
        return result;
    }

    // -- Optional capabilities -------------------------------------------------

    default CapabilityResult<SnapshotInfo> createSnapshot(String sandboxId, String name, SnapshotOptions options) {
        return CapabilityResult.unsupported(type(), Capability.SNAPSHOTS);
    }

    default CapabilityResult<Boolean> restoreSnapshot(String sandboxId, String snapshotId, RestoreOptions options) {
        return CapabilityResult.unsupported(type(), Capability.SNAPSHOTS);
    }

    default CapabilityResult<TerminalSession> connectTerminal(String sandboxId, TerminalOptions options) {
        return CapabilityResult.unsupported(type(), Capability.TERMINAL);
    }

    default CapabilityResult<Boolean> disconnectTerminal(String sandboxId, String terminalSessionId) {
        return CapabilityResult.unsupported(type(), Capability.TERMINAL);
    }

    default CapabilityResult<PortForward> forwardPort(String sandboxId, int port, PortForwardOptions options) {
        return CapabilityResult.unsupported(type(), Capability.PORT_FORWARDING);
    }

    default CapabilityResult<Boolean> removePortForward(String sandboxId, int externalPort) {
        return CapabilityResult.unsupported(type(), Capability.PORT_FORWARDING);
    }

    // -- Observability -------------------------------------------------------

    List<String> getLogs(String sandboxId, LogOptions options);

    ProviderInfo getProviderInfo();

    ProviderHealth healthCheck();

    // -- Events --------------------------------------------------------------

    EventBus.Subscription on(SandboxEventType type, Consumer<SandboxEvent> listener);

    EventBus.Subscription onAny(Consumer<SandboxEvent> listener);

    void off(SandboxEventType type, Consumer<SandboxEvent> listener);
}
