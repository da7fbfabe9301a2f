package net.releasewatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.AniListAiringRecord;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.exception.SourceFetchException.Reason;
import net.releasewatch.model.CircuitState;
import net.releasewatch.support.guard.SourceCallGuard;
import net.releasewatch.testutil.MutableClock;
import net.releasewatch.testutil.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class AniListSourceClientTest {

    private static final String FRIEREN_PAGE = """
        {"data":{"Page":{"pageInfo":{"hasNextPage":%s},"airingSchedules":[
          {"episode":12,"airingAt":1736523000,"media":{
            "id":154587,"siteUrl":"https://anilist.co/anime/154587","isAdult":false,
            "genres":["Adventure","Fantasy"],"description":"An elf mage looks back.",
            "title":{"romaji":"Sousou no Frieren","english":"Frieren: Beyond Journey's End","native":"葬送のフリーレン"},
            "tags":[{"name":"Magic"},{"name":""}],
            "externalLinks":[{"site":"Official Site","type":"INFO"},{"site":"Crunchyroll","type":"STREAMING"}]}},
          {"episode":null,"airingAt":1736600000,"media":null}
        ]}}}
        """;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private ReleaseWatchProperties properties;
    private final AtomicInteger requests = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-10T00:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        properties = new ReleaseWatchProperties();
    }

    @Test
    void should_ParseAiringSchedules_When_SinglePageReturned() {
        AniListSourceClient client = client(page -> json(HttpStatus.OK, FRIEREN_PAGE.formatted("false")));

        List<AniListAiringRecord> records = client.fetchAiringSchedule();

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.sourceId()).isEqualTo("anilist");
            assertThat(record.mediaId()).isEqualTo(154587L);
            assertThat(record.titleRomaji()).isEqualTo("Sousou no Frieren");
            assertThat(record.titleNative()).isEqualTo("葬送のフリーレン");
            assertThat(record.episode()).isEqualTo(12);
            assertThat(record.airingAt()).isEqualTo(Instant.ofEpochSecond(1736523000L));
            assertThat(record.genres()).containsExactly("Adventure", "Fantasy");
            assertThat(record.tags()).containsExactly("Magic");
            assertThat(record.streamingSites()).containsExactly("Crunchyroll");
            assertThat(record.adult()).isFalse();
        });
        assertThat(requests).hasValue(1);
    }

    @Test
    void should_FollowPagination_When_MorePagesReported() {
        AniListSourceClient client = client(page ->
            json(HttpStatus.OK, FRIEREN_PAGE.formatted(page < 3 ? "true" : "false")));

        List<AniListAiringRecord> records = client.fetchAiringSchedule();

        assertThat(records).hasSize(3);
        assertThat(requests).hasValue(3);
    }

    @Test
    void should_StopAtPageLimit_When_UpstreamAlwaysHasMore() {
        properties.getAnilist().setMaxPages(2);
        AniListSourceClient client = client(page -> json(HttpStatus.OK, FRIEREN_PAGE.formatted("true")));

        assertThat(client.fetchAiringSchedule()).hasSize(2);
        assertThat(requests).hasValue(2);
    }

    @Test
    void should_RetryThenFailRateLimited_When_UpstreamKeepsAnswering429() {
        AniListSourceClient client = client(page -> json(HttpStatus.TOO_MANY_REQUESTS, "{}"));

        assertThatThrownBy(client::fetchAiringSchedule)
            .isInstanceOfSatisfying(SourceFetchException.class,
                failure -> assertThat(failure.getReason()).isEqualTo(Reason.RATE_LIMITED));

        assertThat(requests).hasValue(3);
        assertThat(sleeper.sleeps()).hasSize(2);
        assertThat(client.state().allowedRatePerMinute()).isLessThan(90.0);
    }

    @Test
    void should_FailWithoutRetry_When_GraphQlReturnsErrors() {
        AniListSourceClient client = client(page ->
            json(HttpStatus.OK, "{\"errors\":[{\"message\":\"Invalid query\"}],\"data\":null}"));

        assertThatThrownBy(client::fetchAiringSchedule)
            .isInstanceOfSatisfying(SourceFetchException.class, failure -> {
                assertThat(failure.getReason()).isEqualTo(Reason.NON_RETRYABLE);
                assertThat(failure.getMessage()).contains("Invalid query");
            });
        assertThat(requests).hasValue(1);
        assertThat(client.state().consecutiveFailures()).isZero();
    }

    @Test
    void should_OpenCircuitAndSkipUpstream_When_ServerErrorsPersist() {
        properties.getCircuitBreaker().setFailureThreshold(2);
        AniListSourceClient client = client(page -> json(HttpStatus.INTERNAL_SERVER_ERROR, "{}"));

        assertThatThrownBy(client::fetchAiringSchedule).isInstanceOf(SourceFetchException.class);
        int requestsWhenOpened = requests.get();
        assertThatThrownBy(client::fetchAiringSchedule)
            .isInstanceOfSatisfying(SourceFetchException.class,
                failure -> assertThat(failure.getReason()).isEqualTo(Reason.CIRCUIT_OPEN));

        assertThat(requestsWhenOpened).isEqualTo(2);
        assertThat(requests).hasValue(requestsWhenOpened);
        assertThat(client.state().circuitState()).isEqualTo(CircuitState.OPEN);
    }

    private AniListSourceClient client(IntFunction<ClientResponse> responder) {
        WebClient.Builder builder = WebClient.builder()
            .exchangeFunction(request -> Mono.fromSupplier(() -> responder.apply(requests.incrementAndGet())));
        SourceCallGuard guard = SourceCallGuard.create("anilist", properties,
            properties.getSourceRetry().getMaxAttempts(), clock, sleeper);
        return new AniListSourceClient(builder, properties, guard, clock);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
