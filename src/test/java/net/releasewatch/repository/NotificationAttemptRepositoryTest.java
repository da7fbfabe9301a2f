package net.releasewatch.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import net.releasewatch.model.NotificationAttempt;
import net.releasewatch.model.NotificationChannel;
import net.releasewatch.repository.NotificationAttemptRepository.ChannelStatistics;
import net.releasewatch.testutil.MutableClock;
import net.releasewatch.testutil.ReleaseFixtures;
import net.releasewatch.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationAttemptRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-01-10T00:00:00Z");

    private TestDatabase database;
    private NotificationAttemptRepository repository;
    private long releaseId;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        repository = new NotificationAttemptRepository(database.jdbcTemplate());
        ReleaseStore store = new ReleaseStore(database.jdbcTemplate(), database.transactionManager(), new MutableClock(T0));
        releaseId = store.persist(ReleaseFixtures.anime("Sample Title", "12", LocalDate.of(2025, 1, 10)).build())
            .releaseId();
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void should_AssignIdAndTruncateDetail_When_Appending() {
        NotificationAttempt stored = repository.append(
            NotificationAttempt.failed(T0, NotificationChannel.EMAIL, releaseId, 3, "x".repeat(2500)));

        assertThat(stored.id()).isNotNull();
        assertThat(stored.errorDetail()).hasSize(2000);
        assertThat(repository.findByRelease(releaseId)).singleElement().satisfies(row -> {
            assertThat(row.success()).isFalse();
            assertThat(row.attempts()).isEqualTo(3);
            assertThat(row.itemCount()).isEqualTo(1);
            assertThat(row.attemptedAt()).isEqualTo(T0);
        });
    }

    @Test
    void should_ReturnNewestFirst_When_ReadingHistory() {
        repository.append(NotificationAttempt.succeeded(T0, NotificationChannel.EMAIL, releaseId, 1));
        repository.append(NotificationAttempt.failed(T0.plusSeconds(60), NotificationChannel.CALENDAR, releaseId, 3, "503"));
        repository.append(NotificationAttempt.succeeded(T0.plusSeconds(120), NotificationChannel.CALENDAR, releaseId, 1));

        assertThat(repository.findLastAttempt()).get()
            .satisfies(last -> assertThat(last.attemptedAt()).isEqualTo(T0.plusSeconds(120)));
        assertThat(repository.recent(2)).extracting(NotificationAttempt::attemptedAt)
            .containsExactly(T0.plusSeconds(120), T0.plusSeconds(60));
        assertThat(repository.recentFailures(10)).extracting(NotificationAttempt::errorDetail).containsExactly("503");
        assertThat(repository.countSuccessful(releaseId, NotificationChannel.CALENDAR)).isEqualTo(1);
        assertThat(repository.countSuccessful(releaseId + 1, NotificationChannel.EMAIL)).isZero();
    }

    @Test
    void should_AggregatePerChannel_When_ComputingStatistics() {
        repository.append(NotificationAttempt.succeeded(T0.minusSeconds(7200), NotificationChannel.EMAIL, releaseId, 1));
        repository.append(NotificationAttempt.succeeded(T0, NotificationChannel.EMAIL, releaseId, 1));
        repository.append(NotificationAttempt.failed(T0, NotificationChannel.EMAIL, releaseId, 3, "timeout"));

        Map<NotificationChannel, ChannelStatistics> statistics = repository.statistics(T0.minusSeconds(3600));

        assertThat(statistics.get(NotificationChannel.EMAIL).attempts()).isEqualTo(2);
        assertThat(statistics.get(NotificationChannel.EMAIL).errorRate()).isEqualTo(0.5);
        assertThat(statistics.get(NotificationChannel.CALENDAR).attempts()).isZero();
        assertThat(statistics.get(NotificationChannel.CALENDAR).errorRate()).isZero();
    }

    @Test
    void should_ReturnEmpty_When_NoHistory() {
        assertThat(repository.findLastAttempt()).isEmpty();
        assertThat(repository.recentFailures(5)).isEmpty();
    }
}
