package net.releasewatch.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class DateParsingUtilsTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @Test
    void should_ParseRfc1123_When_RssPubDateGiven() {
        assertThat(DateParsingUtils.parseFeedTimestamp("Tue, 07 Jan 2025 10:00:00 +0900", TOKYO))
            .isEqualTo(Instant.parse("2025-01-07T01:00:00Z"));
        assertThat(DateParsingUtils.parseFeedTimestamp("Tue, 07 Jan 2025 10:00:00 GMT", TOKYO))
            .isEqualTo(Instant.parse("2025-01-07T10:00:00Z"));
    }

    @Test
    void should_ParseIsoOffset_When_AtomTimestampGiven() {
        assertThat(DateParsingUtils.parseFeedTimestamp("2025-01-07T10:00:00+09:00", TOKYO))
            .isEqualTo(Instant.parse("2025-01-07T01:00:00Z"));
    }

    @Test
    void should_UseStartOfDayInZone_When_OnlyDateGiven() {
        assertThat(DateParsingUtils.parseFeedTimestamp("2025-01-07", TOKYO))
            .isEqualTo(Instant.parse("2025-01-06T15:00:00Z"));
    }

    @Test
    void should_ReturnNull_When_ValueUnparseable() {
        assertThat(DateParsingUtils.parseFeedTimestamp("garbage", TOKYO)).isNull();
        assertThat(DateParsingUtils.parseFeedTimestamp("  ", TOKYO)).isNull();
        assertThat(DateParsingUtils.parseIsoLocalDate("2025-13-01")).isNull();
    }

    @Test
    void should_ShiftDate_When_InstantCrossesMidnightInZone() {
        assertThat(DateParsingUtils.toLocalDate(Instant.parse("2025-01-06T16:00:00Z"), TOKYO))
            .isEqualTo(LocalDate.of(2025, 1, 7));
        assertThat(DateParsingUtils.toLocalDate(null, TOKYO)).isNull();
    }
}
