package net.releasewatch.runner;

import net.releasewatch.exception.ReleaseWatchConfigurationException;
import net.releasewatch.service.CollectionRunReport;
import net.releasewatch.service.ReleaseCollectionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Runs exactly one collection cycle at startup and turns its outcome into the process exit code:
 * 0 on success, 1 when a source failed or the run was cancelled, 2 on configuration or storage
 * failures.
 */
@Component
@ConditionalOnProperty(prefix = "release-watch.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CollectionCycleRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String DRY_RUN_OPTION = "dry-run";
    static final int EXIT_FATAL = ReleaseWatchConfigurationException.EXIT_CODE;

    private static final Logger log = LoggerFactory.getLogger(CollectionCycleRunner.class);

    private final ApplicationArguments arguments;
    private final ReleaseCollectionOrchestrator orchestrator;
    private volatile int exitCode = 0;

    public CollectionCycleRunner(ApplicationArguments arguments, ReleaseCollectionOrchestrator orchestrator) {
        this.arguments = arguments;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) {
        boolean dryRun = arguments.containsOption(DRY_RUN_OPTION);
        try {
            CollectionRunReport report = orchestrator.runOnce(dryRun);
            exitCode = report.exitCode();
            if (!report.sourceFailures().isEmpty()) {
                log.warn("Run finished with failed sources: {}", report.sourceFailures());
            }
            if (report.cancelled()) {
                log.warn("Run was cancelled before completion");
            }
        } catch (ReleaseWatchConfigurationException e) {
            exitCode = EXIT_FATAL;
            log.error("Invalid configuration, nothing was fetched:");
            e.getProblems().forEach(problem -> log.error("  - {}", problem));
        } catch (DataAccessException e) {
            exitCode = EXIT_FATAL;
            log.error("Storage unavailable; run aborted: {}", e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
