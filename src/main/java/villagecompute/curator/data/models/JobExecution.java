package villagecompute.curator.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * One attempt at running a {@link ScheduledJob}. Rows are inserted as RUNNING before the handler is invoked and
 * updated exactly once on completion.
 */
@Entity
@Table(
        name = "job_executions",
        indexes = @Index(
                name = "idx_job_executions_job",
                columnList = "job_id, started_at"))
public class JobExecution extends PanacheEntityBase {

    /** Upper bound for stored error messages. */
    public static final int MAX_ERROR_LENGTH = 4000;

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "job_id",
            nullable = false)
    public String jobId;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            length = MAX_ERROR_LENGTH)
    public String error;

    @Column(
            name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> result;

    @Column(
            name = "duration_ms")
    public Long durationMs;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Execution lifecycle statuses. SUCCESS and FAILED are terminal.
     */
    public enum JobStatus {
        PENDING, RUNNING, SUCCESS, FAILED
    }

    /**
     * Lists executions for a job, newest first.
     *
     * @param jobId
     *            owning job id
     * @param limit
     *            max rows to return
     */
    public static List<JobExecution> findByJob(String jobId, int limit) {
        return find("jobId", Sort.descending("startedAt"), jobId).page(0, limit).list();
    }

    public static long deleteByJob(String jobId) {
        return delete("jobId", jobId);
    }
}
