package net.releasewatch.service;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import net.releasewatch.exception.ChannelDeliveryException;

/**
 * Secondary notification channel. Events carry a dedup key so a retried creation can find the
 * event an earlier attempt already made.
 */
public interface CalendarEventGateway {

    /**
     * Calendar entry to create.
     */
    record CalendarEventRequest(
        String calendarId,
        String title,
        String description,
        String location,
        ZonedDateTime start,
        ZonedDateTime end,
        List<Integer> reminderMinutes,
        String dedupKey
    ) {
    }

    /**
     * @return the id of an existing event carrying this key
     * @throws ChannelDeliveryException when the lookup fails
     */
    Optional<String> findEventByKey(String calendarId, String dedupKey);

    /**
     * @return the id of the created event
     * @throws ChannelDeliveryException when creation fails
     */
    String createEvent(CalendarEventRequest request);
}
