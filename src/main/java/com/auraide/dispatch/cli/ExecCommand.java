package com.auraide.dispatch.cli;

import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.ExecOptions;
import com.auraide.sandbox.model.ExecutionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: aura exec &lt;sandbox-id&gt; &lt;command...&gt;
 * <p>
 * Runs a shell command in an existing sandbox and exits with the command's exit code.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Run a command in a sandbox")
@Component
public class ExecCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Parameters(index = "1..*", arity = "1..*", description = "Command to run")
    private List<String> command;

    @Option(names = {"--workdir", "-w"}, description = "Working directory relative to the sandbox root")
    private String workingDir;

    @Option(names = {"--timeout", "-t"}, description = "Timeout in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "30")
    private long timeoutSeconds;

    @Option(names = {"--provider"}, description = "Provider that owns the sandbox")
    private String provider;

    private final SandboxManager sandboxManager;

    public ExecCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public Integer call() {
        var options = new ExecOptions(workingDir, Duration.ofSeconds(timeoutSeconds), Map.of());
        try {
            ProviderType target = provider != null ? ProviderType.fromWire(provider) : null;
            ExecutionResult result = sandboxManager.executeCommand(sandboxId, String.join(" ", command),
                    options, target);
            ConsoleOutput.execution(result);
            return result.exitCode();
        } catch (SandboxException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
