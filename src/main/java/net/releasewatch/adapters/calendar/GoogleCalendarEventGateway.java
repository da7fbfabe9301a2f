/**
 * Calendar channel backed by the Google Calendar v3 REST API.
 * Events are tagged with a private extended property so a retried creation finds the earlier one.
 */
package net.releasewatch.adapters.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.ChannelDeliveryException;
import net.releasewatch.model.NotificationChannel;
import net.releasewatch.service.CalendarEventGateway;
import net.releasewatch.support.guard.UpstreamFailureClassifier;
import net.releasewatch.util.ExternalApiLogger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Slf4j
@Component
public class GoogleCalendarEventGateway implements CalendarEventGateway {

    static final String DEDUP_PROPERTY = "releaseKey";
    private static final String API_NAME = "GoogleCalendar";

    private final WebClient webClient;
    private final ReleaseWatchProperties.Notification.Calendar settings;

    public GoogleCalendarEventGateway(WebClient.Builder webClientBuilder, ReleaseWatchProperties properties) {
        this.settings = properties.getNotification().getCalendar();
        this.webClient = webClientBuilder.clone().baseUrl(settings.getBaseUrl()).build();
    }

    @Override
    public Optional<String> findEventByKey(String calendarId, String dedupKey) {
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "events.list", dedupKey);
        JsonNode response = execute("events.list", () -> webClient.get()
            .uri(uri -> uri.path("/calendars/{calendarId}/events")
                .queryParam("privateExtendedProperty", DEDUP_PROPERTY + "=" + dedupKey)
                .queryParam("maxResults", 1)
                .queryParam("showDeleted", false)
                .build(calendarId))
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getAccessToken())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(settings.getTimeout())
            .block());
        JsonNode items = response != null ? response.path("items") : null;
        if (items != null && items.isArray() && !items.isEmpty() && items.get(0).hasNonNull("id")) {
            String eventId = items.get(0).get("id").asText();
            log.debug("Calendar event {} already exists for key {}", eventId, dedupKey);
            return Optional.of(eventId);
        }
        return Optional.empty();
    }

    @Override
    public String createEvent(CalendarEventRequest request) {
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "events.insert", request.title());
        Map<String, Object> body = eventBody(request);
        JsonNode response = execute("events.insert", () -> webClient.post()
            .uri("/calendars/{calendarId}/events", request.calendarId())
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getAccessToken())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(settings.getTimeout())
            .block());
        if (response == null || !response.hasNonNull("id")) {
            throw new ChannelDeliveryException(NotificationChannel.CALENDAR, "Calendar API returned no event id", false);
        }
        String eventId = response.get("id").asText();
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "events.insert", request.title(), 1);
        return eventId;
    }

    static Map<String, Object> eventBody(CalendarEventRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", request.title());
        body.put("description", request.description());
        if (request.location() != null && !request.location().isBlank()) {
            body.put("location", request.location());
        }
        body.put("start", Map.of(
            "dateTime", request.start().toOffsetDateTime().toString(),
            "timeZone", request.start().getZone().getId()));
        body.put("end", Map.of(
            "dateTime", request.end().toOffsetDateTime().toString(),
            "timeZone", request.end().getZone().getId()));
        List<Map<String, Object>> overrides = new ArrayList<>();
        for (Integer minutes : request.reminderMinutes()) {
            overrides.add(Map.of("method", "popup", "minutes", minutes));
        }
        body.put("reminders", Map.of("useDefault", false, "overrides", overrides));
        body.put("extendedProperties", Map.of("private", Map.of(DEDUP_PROPERTY, request.dedupKey())));
        return body;
    }

    private JsonNode execute(String operation, Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (RuntimeException failure) {
            boolean retryable = UpstreamFailureClassifier.isTransient(failure);
            String detail = failure instanceof WebClientResponseException response
                ? "HTTP " + response.getStatusCode().value()
                : failure.getMessage();
            ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, "", detail);
            throw new ChannelDeliveryException(NotificationChannel.CALENDAR,
                "Calendar " + operation + " failed: " + detail, retryable, failure);
        }
    }
}
