package net.releasewatch.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import net.releasewatch.exception.ReleaseWatchConfigurationException;
import net.releasewatch.service.CollectionRunReport;
import net.releasewatch.service.ReleaseCollectionOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class CollectionCycleRunnerTest {

    @Mock
    private ReleaseCollectionOrchestrator orchestrator;

    @Test
    void should_ExitZero_When_RunSucceeds() {
        when(orchestrator.runOnce(false)).thenReturn(report(Map.of(), false));
        CollectionCycleRunner runner = runner();

        runner.run();

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void should_ExitOne_When_SourceFailedOrCancelled() {
        when(orchestrator.runOnce(false)).thenReturn(report(Map.of("anilist", "TIMEOUT"), false));
        CollectionCycleRunner failedSource = runner();
        failedSource.run();

        when(orchestrator.runOnce(false)).thenReturn(report(Map.of(), true));
        CollectionCycleRunner cancelled = runner();
        cancelled.run();

        assertThat(failedSource.getExitCode()).isEqualTo(1);
        assertThat(cancelled.getExitCode()).isEqualTo(1);
    }

    @Test
    void should_ExitTwo_When_ConfigurationInvalid() {
        when(orchestrator.runOnce(false))
            .thenThrow(new ReleaseWatchConfigurationException(List.of("notification.recipient is required")));
        CollectionCycleRunner runner = runner();

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(CollectionCycleRunner.EXIT_FATAL);
    }

    @Test
    void should_ExitTwo_When_StorageUnavailable() {
        when(orchestrator.runOnce(false)).thenThrow(new DataAccessResourceFailureException("connection refused"));
        CollectionCycleRunner runner = runner();

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(CollectionCycleRunner.EXIT_FATAL);
    }

    @Test
    void should_RequestDryRun_When_OptionGiven() {
        when(orchestrator.runOnce(true)).thenReturn(report(Map.of(), false));
        CollectionCycleRunner runner = runner("--dry-run");

        runner.run("--dry-run");

        verify(orchestrator).runOnce(true);
        assertThat(runner.getExitCode()).isZero();
    }

    private CollectionCycleRunner runner(String... args) {
        return new CollectionCycleRunner(new DefaultApplicationArguments(args), orchestrator);
    }

    private static CollectionRunReport report(Map<String, String> failures, boolean cancelled) {
        return new CollectionRunReport(3, 0, 0, 1, 2, 1, 0, failures, cancelled, false);
    }
}
