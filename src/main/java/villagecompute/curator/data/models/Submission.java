package villagecompute.curator.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Moderated social-media submission. Rows are written by the ingestion and moderation services; this application only
 * reads approved rows when building recaps.
 */
@Entity
@Table(
        name = "feed_submissions",
        indexes = @Index(
                name = "idx_feed_submissions_approved",
                columnList = "feed_id, status, approved_at"))
public class Submission extends PanacheEntityBase {

    @Id
    public UUID id;

    @Column(
            name = "feed_id",
            nullable = false)
    public String feedId;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public SubmissionStatus status;

    @Column(
            name = "content",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> content;

    @Column(
            name = "submitted_at",
            nullable = false)
    public Instant submittedAt;

    @Column(
            name = "approved_at")
    public Instant approvedAt;

    public enum SubmissionStatus {
        PENDING, APPROVED, REJECTED
    }

    /**
     * Approved submissions for a feed whose approval time falls in {@code [from, to)}, oldest first.
     */
    public static List<Submission> findApproved(String feedId, Instant from, Instant to) {
        return find("feedId = ?1 AND status = ?2 AND approvedAt >= ?3 AND approvedAt < ?4 ORDER BY approvedAt", feedId,
                SubmissionStatus.APPROVED, from, to).list();
    }
}
