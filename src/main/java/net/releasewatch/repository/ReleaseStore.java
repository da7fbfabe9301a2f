package net.releasewatch.repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.dto.NormalizedRelease;
import net.releasewatch.dto.PersistOutcome;
import net.releasewatch.dto.ReleaseUpsertResult;
import net.releasewatch.model.ReleaseKind;
import net.releasewatch.model.StoredRelease;
import net.releasewatch.model.WorkKind;
import net.releasewatch.util.TextUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable home of works and releases, and the single authority on release identity.
 *
 * <p>The unique key {@code (work_id, release_kind, number, platform, release_date)} is the dedup
 * key. Inserts run inside a savepoint so a unique violation raised by a concurrent writer rolls
 * back only the insert, after which the existing row is returned with {@code created=false}.
 * Writes are serialized through one lock; reads are not.</p>
 */
@Slf4j
@Repository
public class ReleaseStore {

    private static final String RELEASE_SELECT = """
        SELECT r.id, r.work_id, w.title AS work_title, w.kind AS work_kind, r.release_kind, r.number,
               r.platform, r.release_date, r.source, r.source_url, r.notified, r.event_ref, r.created_at
        FROM releases r
        JOIN works w ON w.id = r.work_id
        """;

    private static final RowMapper<StoredRelease> RELEASE_ROW_MAPPER = ReleaseStore::mapRelease;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate savepointTemplate;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public ReleaseStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.savepointTemplate = new TransactionTemplate(transactionManager);
        this.savepointTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.clock = clock;
    }

    /**
     * Persists the work and the release of a normalized record in one transaction.
     */
    public PersistOutcome persist(NormalizedRelease release) {
        return withWriteLock(() -> transactionTemplate.execute(status -> {
            long workId = upsertWork(release.title(), release.workKind(), release.titleEn(),
                release.titleAlt(), release.officialUrl());
            ReleaseUpsertResult result = upsertRelease(workId, release.releaseKind(), release.number(),
                release.platform(), release.releaseDate(), release.sourceId(), release.sourceUrl());
            return new PersistOutcome(workId, result.releaseId(), result.created());
        }));
    }

    /**
     * Returns the id of the work with this title and kind, creating it on first sighting. Empty
     * optional fields of an existing work are filled in; populated ones are never overwritten.
     */
    public long upsertWork(String title, WorkKind kind, String titleEn, String titleAlt, String officialUrl) {
        if (!TextUtils.hasText(title)) {
            throw new IllegalArgumentException("Work title must not be blank");
        }
        Objects.requireNonNull(kind, "kind");
        Long workId = withWriteLock(() -> transactionTemplate.execute(status -> {
            Optional<ExistingWork> existing = findWork(title, kind);
            if (existing.isPresent()) {
                fillMissingWorkFields(existing.get(), titleEn, titleAlt, officialUrl);
                return existing.get().id();
            }
            try {
                Long id = savepointTemplate.execute(nested -> insertWork(title, kind, titleEn, titleAlt, officialUrl));
                log.debug("Created work {} '{}' ({})", id, title, kind);
                return id;
            } catch (DuplicateKeyException duplicate) {
                log.debug("Work '{}' ({}) inserted concurrently; reusing existing row", title, kind);
                return findWork(title, kind)
                    .map(ExistingWork::id)
                    .orElseThrow(() -> new IllegalStateException(
                        "Work '" + title + "' violated uniqueness but could not be read back", duplicate));
            }
        }));
        return Objects.requireNonNull(workId, "workId");
    }

    /**
     * Returns the existing release for the dedup key, or inserts it.
     */
    public ReleaseUpsertResult upsertRelease(long workId,
                                             ReleaseKind releaseKind,
                                             String number,
                                             String platform,
                                             LocalDate releaseDate,
                                             String source,
                                             String sourceUrl) {
        String safeNumber = number == null ? "" : number;
        String safePlatform = platform == null ? "" : platform;
        return withWriteLock(() -> transactionTemplate.execute(status -> {
            Optional<Long> existing = findReleaseId(workId, releaseKind, safeNumber, safePlatform, releaseDate);
            if (existing.isPresent()) {
                return new ReleaseUpsertResult(existing.get(), false);
            }
            return insertReleaseOrFindExisting(workId, releaseKind, safeNumber, safePlatform, releaseDate, source, sourceUrl);
        }));
    }

    /**
     * Insert path of {@link #upsertRelease}. A unique violation rolls back to the savepoint and
     * resolves to the row that won.
     */
    ReleaseUpsertResult insertReleaseOrFindExisting(long workId,
                                                    ReleaseKind releaseKind,
                                                    String number,
                                                    String platform,
                                                    LocalDate releaseDate,
                                                    String source,
                                                    String sourceUrl) {
        try {
            Long id = savepointTemplate.execute(nested ->
                insertRelease(workId, releaseKind, number, platform, releaseDate, source, sourceUrl));
            return new ReleaseUpsertResult(id, true);
        } catch (DuplicateKeyException duplicate) {
            log.debug("Release work={} {} '{}' '{}' {} already present; treating as existing",
                workId, releaseKind, number, platform, releaseDate);
            return findReleaseId(workId, releaseKind, number, platform, releaseDate)
                .map(id -> new ReleaseUpsertResult(id, false))
                .orElseThrow(() -> new IllegalStateException(
                    "Release for work " + workId + " violated uniqueness but could not be read back", duplicate));
        }
    }

    /**
     * Unnotified releases, oldest release date first.
     */
    public List<StoredRelease> listUnnotified(int limit) {
        return jdbcTemplate.query(
            RELEASE_SELECT + " WHERE r.notified = FALSE ORDER BY r.release_date ASC, r.id ASC LIMIT ?",
            RELEASE_ROW_MAPPER,
            Math.max(0, limit));
    }

    /**
     * Notified releases still missing a calendar event, dated on or after {@code since}.
     */
    public List<StoredRelease> listAwaitingCalendarEvent(LocalDate since, int limit) {
        return jdbcTemplate.query(
            RELEASE_SELECT + " WHERE r.notified = TRUE AND r.event_ref IS NULL AND r.release_date >= ?"
                + " ORDER BY r.release_date ASC, r.id ASC LIMIT ?",
            RELEASE_ROW_MAPPER,
            java.sql.Date.valueOf(since),
            Math.max(0, limit));
    }

    public Optional<StoredRelease> findRelease(long releaseId) {
        List<StoredRelease> rows = jdbcTemplate.query(RELEASE_SELECT + " WHERE r.id = ?", RELEASE_ROW_MAPPER, releaseId);
        return rows.stream().findFirst();
    }

    /**
     * Flips {@code notified} to true. Only a still-unnotified row is changed, so the flag never
     * goes back and a second call returns {@code false}.
     *
     * @param eventRef calendar event id to attach, may be {@code null}
     * @return whether this call performed the transition
     */
    public boolean markNotified(long releaseId, String eventRef) {
        return withWriteLock(() -> jdbcTemplate.update(
            "UPDATE releases SET notified = TRUE, event_ref = COALESCE(?, event_ref), updated_at = ?"
                + " WHERE id = ? AND notified = FALSE",
            eventRef,
            now(),
            releaseId) == 1);
    }

    /**
     * Attaches a calendar event id to a release that has none yet.
     */
    public boolean attachEventRef(long releaseId, String eventRef) {
        if (!TextUtils.hasText(eventRef)) {
            return false;
        }
        return withWriteLock(() -> jdbcTemplate.update(
            "UPDATE releases SET event_ref = ?, updated_at = ? WHERE id = ? AND event_ref IS NULL",
            eventRef,
            now(),
            releaseId) == 1);
    }

    public long countReleases() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM releases", Long.class);
        return count != null ? count : 0L;
    }

    public long countWorks() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM works", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Cheap round trip used before a run to fail fast when storage is unreachable.
     */
    public void probe() {
        jdbcTemplate.queryForObject("SELECT COUNT(*) FROM releases WHERE 1 = 0", Long.class);
    }

    private Optional<ExistingWork> findWork(String title, WorkKind kind) {
        List<ExistingWork> rows = jdbcTemplate.query(
            "SELECT id, title_en, title_alt, official_url FROM works WHERE title = ? AND kind = ?",
            (rs, rowNum) -> new ExistingWork(
                rs.getLong("id"), rs.getString("title_en"), rs.getString("title_alt"), rs.getString("official_url")),
            title,
            kind.name());
        return rows.stream().findFirst();
    }

    private void fillMissingWorkFields(ExistingWork work, String titleEn, String titleAlt, String officialUrl) {
        String newTitleEn = fill(work.titleEn(), titleEn);
        String newTitleAlt = fill(work.titleAlt(), titleAlt);
        String newOfficialUrl = fill(work.officialUrl(), officialUrl);
        if (Objects.equals(newTitleEn, work.titleEn())
            && Objects.equals(newTitleAlt, work.titleAlt())
            && Objects.equals(newOfficialUrl, work.officialUrl())) {
            return;
        }
        jdbcTemplate.update(
            "UPDATE works SET title_en = ?, title_alt = ?, official_url = ?, updated_at = ? WHERE id = ?",
            newTitleEn, newTitleAlt, newOfficialUrl, now(), work.id());
        log.debug("Filled missing fields for work {}", work.id());
    }

    private Long insertWork(String title, WorkKind kind, String titleEn, String titleAlt, String officialUrl) {
        Timestamp now = now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO works (title, kind, title_en, title_alt, official_url, created_at, updated_at)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?)",
                new String[] {"id"});
            ps.setString(1, title);
            ps.setString(2, kind.name());
            ps.setString(3, blankToNull(titleEn));
            ps.setString(4, blankToNull(titleAlt));
            ps.setString(5, blankToNull(officialUrl));
            ps.setTimestamp(6, now);
            ps.setTimestamp(7, now);
            return ps;
        }, keyHolder);
        return generatedId(keyHolder);
    }

    private Long insertRelease(long workId,
                               ReleaseKind releaseKind,
                               String number,
                               String platform,
                               LocalDate releaseDate,
                               String source,
                               String sourceUrl) {
        Timestamp now = now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO releases (work_id, release_kind, number, platform, release_date, source, source_url,"
                    + " notified, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?)",
                new String[] {"id"});
            ps.setLong(1, workId);
            ps.setString(2, releaseKind.name());
            ps.setString(3, number);
            ps.setString(4, platform);
            ps.setDate(5, java.sql.Date.valueOf(releaseDate));
            ps.setString(6, source);
            ps.setString(7, sourceUrl);
            ps.setTimestamp(8, now);
            ps.setTimestamp(9, now);
            return ps;
        }, keyHolder);
        return generatedId(keyHolder);
    }

    private Optional<Long> findReleaseId(long workId,
                                         ReleaseKind releaseKind,
                                         String number,
                                         String platform,
                                         LocalDate releaseDate) {
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT id FROM releases WHERE work_id = ? AND release_kind = ? AND number = ? AND platform = ?"
                + " AND release_date = ?",
            Long.class,
            workId,
            releaseKind.name(),
            number,
            platform,
            java.sql.Date.valueOf(releaseDate));
        return ids.stream().findFirst();
    }

    private <T> T withWriteLock(Supplier<T> write) {
        writeLock.lock();
        try {
            return write.get();
        } finally {
            writeLock.unlock();
        }
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static Long generatedId(KeyHolder keyHolder) {
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Insert returned no generated id");
        }
        return key.longValue();
    }

    private static String fill(String current, String candidate) {
        return TextUtils.hasText(current) ? current : blankToNull(candidate);
    }

    private static String blankToNull(String value) {
        return TextUtils.hasText(value) ? value.strip() : null;
    }

    private static StoredRelease mapRelease(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new StoredRelease(
            rs.getLong("id"),
            rs.getLong("work_id"),
            rs.getString("work_title"),
            WorkKind.valueOf(rs.getString("work_kind")),
            ReleaseKind.valueOf(rs.getString("release_kind")),
            rs.getString("number"),
            rs.getString("platform"),
            rs.getDate("release_date").toLocalDate(),
            rs.getString("source"),
            rs.getString("source_url"),
            rs.getBoolean("notified"),
            rs.getString("event_ref"),
            createdAt != null ? createdAt.toInstant() : null);
    }

    private record ExistingWork(Long id, String titleEn, String titleAlt, String officialUrl) {
    }
}
