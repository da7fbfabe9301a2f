package net.releasewatch.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import net.releasewatch.model.NotificationChannel;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for collection runs, registered under {@code release_watch.*}.
 */
@Component
public class CollectionMetrics {

    private final MeterRegistry meterRegistry;

    public CollectionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordFetched(String sourceId, int count) {
        counter("release_watch.records.fetched", "source", sourceId).increment(count);
    }

    public void recordSourceFailure(String sourceId, String reason) {
        Counter.builder("release_watch.source.failures")
            .tag("source", sourceId)
            .tag("reason", reason)
            .register(meterRegistry)
            .increment();
    }

    public void recordFiltered(String sourceId) {
        counter("release_watch.records.filtered", "source", sourceId).increment();
    }

    public void recordSkipped(String sourceId) {
        counter("release_watch.records.skipped", "source", sourceId).increment();
    }

    public void recordPersisted(boolean created) {
        counter("release_watch.releases.persisted", "created", String.valueOf(created)).increment();
    }

    public void recordDelivery(NotificationChannel channel, boolean success) {
        Counter.builder("release_watch.notifications")
            .tag("channel", channel.name().toLowerCase(Locale.ROOT))
            .tag("outcome", success ? "success" : "failure")
            .register(meterRegistry)
            .increment();
    }

    public void recordRun(boolean succeeded) {
        counter("release_watch.runs", "outcome", succeeded ? "success" : "failure").increment();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return Counter.builder(name).tag(tagKey, tagValue).register(meterRegistry);
    }
}
