/**
 * Configuration for upstream source guards
 * - One guard (rate limiter + circuit breaker + retry) per source id
 * - Feed guards are built per feed by FeedCollector, one attempt per HTTP try
 */
package net.releasewatch.config;

import java.time.Clock;
import net.releasewatch.support.guard.SourceCallGuard;
import net.releasewatch.support.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SourceClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(SourceClientConfig.class);

    /**
     * Guard for the AniList GraphQL API
     * - Budget from {@code release-watch.source-budgets.anilist}
     * - Retries transient failures up to {@code source-retry.max-attempts}
     *
     * @return Configured guard instance
     */
    @Bean
    @Qualifier("aniListCallGuard")
    public SourceCallGuard aniListCallGuard(ReleaseWatchProperties properties, Clock clock, Sleeper sleeper) {
        SourceCallGuard guard = SourceCallGuard.create(
            ReleaseWatchProperties.ANILIST_SOURCE_ID,
            properties,
            properties.getSourceRetry().getMaxAttempts(),
            clock,
            sleeper);
        logger.info("AniList call guard initialized with {} requests/minute, breaker threshold {}, cooldown {}",
            properties.budgetFor(ReleaseWatchProperties.ANILIST_SOURCE_ID),
            properties.getCircuitBreaker().getFailureThreshold(),
            properties.getCircuitBreaker().getCooldown());
        return guard;
    }
}
