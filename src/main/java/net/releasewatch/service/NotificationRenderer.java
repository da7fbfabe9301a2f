package net.releasewatch.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.StringJoiner;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.model.ReleaseKind;
import net.releasewatch.model.StoredRelease;
import net.releasewatch.service.CalendarEventGateway.CalendarEventRequest;
import net.releasewatch.util.TextUtils;
import org.springframework.stereotype.Component;

/**
 * Renders mail subjects and bodies and calendar entries for stored releases.
 */
@Component
public class NotificationRenderer {

    static final int DEDUP_KEY_LENGTH = 32;

    private final ReleaseWatchProperties properties;

    public NotificationRenderer(ReleaseWatchProperties properties) {
        this.properties = properties;
    }

    /**
     * {@code <prefix> <title> <number label> (<platform>)}, skipping absent parts.
     */
    public String subject(StoredRelease release) {
        StringJoiner subject = new StringJoiner(" ");
        addIfText(subject, properties.getNotification().getSubjectPrefix());
        subject.add(release.workTitle());
        addIfText(subject, numberLabel(release));
        if (release.hasPlatform()) {
            subject.add("(" + release.platform() + ")");
        }
        return subject.toString();
    }

    public String body(StoredRelease release) {
        List<String> lines = new ArrayList<>();
        lines.add("Title: " + release.workTitle());
        lines.add("Kind: " + release.workKind() + " / " + release.releaseKind());
        if (release.hasNumber()) {
            lines.add("Number: " + release.number());
        }
        if (release.hasPlatform()) {
            lines.add("Platform: " + release.platform());
        }
        lines.add("Release date: " + release.releaseDate());
        if (TextUtils.hasText(release.sourceUrl())) {
            lines.add("Details: " + release.sourceUrl());
        }
        lines.add("");
        lines.add("Source: " + release.source());
        return String.join("\n", lines);
    }

    /**
     * Calendar title: episodes read "第N話配信", volumes "第N巻発売", followed by the platform.
     */
    public String calendarTitle(StoredRelease release) {
        StringBuilder title = new StringBuilder(release.workTitle());
        if (release.hasNumber()) {
            switch (release.releaseKind()) {
                case EPISODE -> title.append(" 第").append(release.number()).append("話配信");
                case VOLUME -> title.append(" 第").append(release.number()).append("巻発売");
                case SPECIAL -> title.append(" 特別編 ").append(release.number());
                default -> { }
            }
        } else if (release.releaseKind() == ReleaseKind.SPECIAL) {
            title.append(" 特別編");
        }
        if (release.hasPlatform()) {
            title.append(" (").append(release.platform()).append(")");
        }
        return title.toString();
    }

    public String calendarDescription(StoredRelease release) {
        List<String> lines = new ArrayList<>();
        lines.add("タイトル: " + release.workTitle());
        if (release.hasNumber()) {
            if (release.releaseKind() == ReleaseKind.EPISODE) {
                lines.add("エピソード: 第" + release.number() + "話");
            } else if (release.releaseKind() == ReleaseKind.VOLUME) {
                lines.add("巻数: 第" + release.number() + "巻");
            } else {
                lines.add("特別編: " + release.number());
            }
        }
        if (release.hasPlatform()) {
            lines.add("プラットフォーム: " + release.platform());
        }
        if (TextUtils.hasText(release.sourceUrl())) {
            lines.add("詳細: " + release.sourceUrl());
        }
        return String.join("\n", lines);
    }

    public CalendarEventRequest calendarEvent(StoredRelease release) {
        ReleaseWatchProperties.Notification.Calendar calendar = properties.getNotification().getCalendar();
        ZonedDateTime start = release.releaseDate().atTime(calendar.getStartTime()).atZone(properties.getZone());
        return new CalendarEventRequest(
            calendar.getCalendarId(),
            calendarTitle(release),
            calendarDescription(release),
            release.hasPlatform() ? release.platform() : "",
            start,
            start.plus(calendar.getDuration()),
            List.copyOf(calendar.getReminderMinutes()),
            dedupKey(release));
    }

    /**
     * Hex prefix of SHA-256 over {@code sourceUrl|releaseDate|releaseId}.
     */
    public String dedupKey(StoredRelease release) {
        String material = (release.sourceUrl() != null ? release.sourceUrl() : "")
            + "|" + release.releaseDate()
            + "|" + release.id();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DEDUP_KEY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String numberLabel(StoredRelease release) {
        if (!release.hasNumber()) {
            return release.releaseKind() == ReleaseKind.SPECIAL ? "特別編" : "";
        }
        return switch (release.releaseKind()) {
            case EPISODE -> "第" + release.number() + "話";
            case VOLUME -> "第" + release.number() + "巻";
            case SPECIAL -> "特別編 " + release.number();
        };
    }

    private static void addIfText(StringJoiner joiner, String value) {
        if (TextUtils.hasText(value)) {
            joiner.add(value.strip());
        }
    }
}
