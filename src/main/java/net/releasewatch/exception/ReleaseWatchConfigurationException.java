package net.releasewatch.exception;

import java.util.List;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Startup configuration is unusable; the run must abort before any external call.
 *
 * <p>Also thrown while beans are built. Spring Boot then takes the process exit code from
 * {@link #getExitCode()}.</p>
 */
public class ReleaseWatchConfigurationException extends IllegalStateException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    private final List<String> problems;

    public ReleaseWatchConfigurationException(List<String> problems) {
        super("Invalid release-watch configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
