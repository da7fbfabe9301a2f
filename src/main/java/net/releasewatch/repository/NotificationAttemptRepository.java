package net.releasewatch.repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.releasewatch.model.NotificationAttempt;
import net.releasewatch.model.NotificationChannel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * Append-only history of notification attempt sequences. Rows are never updated.
 */
@Repository
public class NotificationAttemptRepository {

    private static final String SELECT = """
        SELECT id, attempted_at, channel, success, error_detail, item_count, release_id, attempts
        FROM notification_attempts
        """;

    private static final int MAX_ERROR_DETAIL_LENGTH = 2000;

    private static final RowMapper<NotificationAttempt> ROW_MAPPER = NotificationAttemptRepository::mapAttempt;

    /**
     * Attempt counts of one channel since a given instant.
     */
    public record ChannelStatistics(NotificationChannel channel, long attempts, long failures) {

        public double errorRate() {
            return attempts == 0 ? 0.0d : (double) failures / attempts;
        }
    }

    private final JdbcTemplate jdbcTemplate;

    public NotificationAttemptRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return the attempt with its generated id
     */
    public NotificationAttempt append(NotificationAttempt attempt) {
        String errorDetail = attempt.errorDetail();
        if (errorDetail != null && errorDetail.length() > MAX_ERROR_DETAIL_LENGTH) {
            errorDetail = errorDetail.substring(0, MAX_ERROR_DETAIL_LENGTH);
        }
        String storedDetail = errorDetail;
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO notification_attempts (attempted_at, channel, success, error_detail, item_count,"
                    + " release_id, attempts) VALUES (?, ?, ?, ?, ?, ?, ?)",
                new String[] {"id"});
            ps.setTimestamp(1, Timestamp.from(attempt.attemptedAt()));
            ps.setString(2, attempt.channel().name());
            ps.setBoolean(3, attempt.success());
            ps.setString(4, storedDetail);
            ps.setInt(5, attempt.itemCount());
            if (attempt.releaseId() != null) {
                ps.setLong(6, attempt.releaseId());
            } else {
                ps.setNull(6, Types.BIGINT);
            }
            ps.setInt(7, attempt.attempts());
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return new NotificationAttempt(
            key != null ? key.longValue() : null,
            attempt.attemptedAt(),
            attempt.channel(),
            attempt.success(),
            storedDetail,
            attempt.itemCount(),
            attempt.releaseId(),
            attempt.attempts());
    }

    public Optional<NotificationAttempt> findLastAttempt() {
        return jdbcTemplate.query(SELECT + " ORDER BY attempted_at DESC, id DESC LIMIT 1", ROW_MAPPER)
            .stream()
            .findFirst();
    }

    public List<NotificationAttempt> recent(int limit) {
        return jdbcTemplate.query(SELECT + " ORDER BY attempted_at DESC, id DESC LIMIT ?", ROW_MAPPER, Math.max(0, limit));
    }

    public List<NotificationAttempt> recentFailures(int limit) {
        return jdbcTemplate.query(
            SELECT + " WHERE success = FALSE ORDER BY attempted_at DESC, id DESC LIMIT ?",
            ROW_MAPPER,
            Math.max(0, limit));
    }

    public List<NotificationAttempt> findByRelease(long releaseId) {
        return jdbcTemplate.query(SELECT + " WHERE release_id = ? ORDER BY id ASC", ROW_MAPPER, releaseId);
    }

    public long countSuccessful(long releaseId, NotificationChannel channel) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM notification_attempts WHERE release_id = ? AND channel = ? AND success = TRUE",
            Long.class,
            releaseId,
            channel.name());
        return count != null ? count : 0L;
    }

    /**
     * Per-channel attempt and failure counts since {@code since}. Channels without attempts are
     * reported with zero counts.
     */
    public Map<NotificationChannel, ChannelStatistics> statistics(Instant since) {
        Map<NotificationChannel, ChannelStatistics> statistics = new EnumMap<>(NotificationChannel.class);
        for (NotificationChannel channel : NotificationChannel.values()) {
            statistics.put(channel, new ChannelStatistics(channel, 0L, 0L));
        }
        jdbcTemplate.query(
            "SELECT channel, COUNT(*) AS total, SUM(CASE WHEN success THEN 0 ELSE 1 END) AS failures"
                + " FROM notification_attempts WHERE attempted_at >= ? GROUP BY channel",
            rs -> {
                NotificationChannel channel = NotificationChannel.valueOf(rs.getString("channel"));
                statistics.put(channel, new ChannelStatistics(channel, rs.getLong("total"), rs.getLong("failures")));
            },
            Timestamp.from(since));
        return statistics;
    }

    private static NotificationAttempt mapAttempt(ResultSet rs, int rowNum) throws SQLException {
        long releaseId = rs.getLong("release_id");
        Long nullableReleaseId = rs.wasNull() ? null : releaseId;
        return new NotificationAttempt(
            rs.getLong("id"),
            rs.getTimestamp("attempted_at").toInstant(),
            NotificationChannel.valueOf(rs.getString("channel")),
            rs.getBoolean("success"),
            rs.getString("error_detail"),
            rs.getInt("item_count"),
            nullableReleaseId,
            rs.getInt("attempts"));
    }
}
