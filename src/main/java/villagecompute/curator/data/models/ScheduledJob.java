package villagecompute.curator.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import villagecompute.curator.jobs.JobSchedule;
import villagecompute.curator.jobs.JobType;

/**
 * Panache entity for a recurring or one-time scheduled job.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (TEXT, PK) - {@code recap-<feedId>} for config-synced jobs, UUID string otherwise</li>
 * <li>{@code job_type} (TEXT) - JobType enum value</li>
 * <li>{@code feed_id} (TEXT) - Feed the job belongs to, if any</li>
 * <li>{@code schedule} (TEXT) - Five-field cron expression or ISO-8601 timestamp</li>
 * <li>{@code is_one_time} (BOOLEAN) - Disabled automatically after its single run</li>
 * <li>{@code next_run_at} (TIMESTAMPTZ) - Null only when disabled or the schedule is unparseable</li>
 * <li>{@code config} (JSON) - Handler-specific settings (transform, batchTransform, distribute, date range)</li>
 * <li>{@code version} (BIGINT) - Optimistic lock counter</li>
 * </ul>
 *
 * @see JobExecution for the per-run history
 */
@Entity
@Table(
        name = "scheduled_jobs",
        indexes = {@Index(
                name = "idx_scheduled_jobs_due",
                columnList = "enabled, next_run_at"),
                @Index(
                        name = "idx_scheduled_jobs_feed",
                        columnList = "feed_id")})
@NamedQuery(
        name = ScheduledJob.QUERY_FIND_DUE,
        query = ScheduledJob.JPQL_FIND_DUE)
public class ScheduledJob extends PanacheEntityBase {

    public static final String QUERY_FIND_DUE = "ScheduledJob.findDue";

    static final String JPQL_FIND_DUE = "FROM ScheduledJob WHERE enabled = true AND nextRunAt IS NOT NULL "
            + "AND nextRunAt <= :now ORDER BY nextRunAt";

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            nullable = false)
    public String name;

    @Column(
            length = 1000)
    public String description;

    @Column(
            name = "job_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobType jobType;

    @Column(
            name = "feed_id")
    public String feedId;

    @Column(
            nullable = false)
    public String schedule;

    @Column(
            name = "is_one_time",
            nullable = false)
    public boolean isOneTime;

    @Column(
            nullable = false)
    public boolean enabled;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "config")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> config;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Version
    @Column(
            nullable = false)
    public long version;

    /**
     * Applies the bookkeeping of a finished run to this row. One-time jobs are disabled; a job disabled meanwhile stays
     * disabled, and the next run is computed from the schedule as it is now, not as it was when the run started.
     *
     * @param startedAt
     *            start time of the run, stored as {@code lastRunAt}
     * @param now
     *            reference time for the next occurrence
     */
    public void applyRun(Instant startedAt, Instant now) {
        lastRunAt = startedAt;
        enabled = enabled && !isOneTime;
        nextRunAt = enabled ? JobSchedule.nextRunAtOrNull(schedule, now) : null;
        updatedAt = now;
    }

    /**
     * Finds enabled jobs whose next run time has elapsed, oldest first.
     *
     * @param now
     *            reference time
     * @return due jobs ordered by next_run_at ascending
     */
    public static List<ScheduledJob> findDue(Instant now) {
        return find("#" + QUERY_FIND_DUE, Parameters.with("now", now)).list();
    }

    /**
     * Lists jobs matching the optional filter fields, ordered by creation time. Null fields are ignored.
     */
    public static List<ScheduledJob> findFiltered(Boolean enabled, JobType jobType, String feedId) {
        StringBuilder query = new StringBuilder();
        Parameters params = new Parameters();
        if (enabled != null) {
            query.append("enabled = :enabled");
            params.and("enabled", enabled);
        }
        if (jobType != null) {
            query.append(query.isEmpty() ? "" : " AND ").append("jobType = :jobType");
            params.and("jobType", jobType);
        }
        if (feedId != null) {
            query.append(query.isEmpty() ? "" : " AND ").append("feedId = :feedId");
            params.and("feedId", feedId);
        }
        if (query.isEmpty()) {
            return findAll(Sort.by("createdAt")).list();
        }
        return find(query.toString(), Sort.by("createdAt"), params).list();
    }
}
