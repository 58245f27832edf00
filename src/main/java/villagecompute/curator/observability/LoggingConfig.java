package villagecompute.curator.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching log lines with scheduler context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code node_id} - Process identifier used for leader election</li>
 * <li>{@code job_id} - Scheduled job primary key (job execution only)</li>
 * <li>{@code feed_id} - Feed the running job belongs to</li>
 * <li>{@code request_origin} - HTTP request path or job type identifier</li>
 * </ul>
 *
 * <p>
 * <b>Usage in job execution:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(job.id);
 * LoggingConfig.setRequestOrigin("JobType." + job.jobType.name());
 * </pre>
 *
 * <p>
 * MDC is thread-local. Every job run clears it when done so pooled worker threads do not leak context into the next
 * run.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Leader election node identifier ({@code node-xxxxxxxx}). Lets operators tell which instance ran a job.
     */
    public static final String MDC_NODE_ID = "node_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_FEED_ID = "feed_id";

    /**
     * HTTP request path (e.g. "/api/jobs") or job type identifier (e.g. "JobType.RECAP").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no span is
     * active so the field set stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setNodeId(String nodeId) {
        if (nodeId != null) {
            MDC.put(MDC_NODE_ID, nodeId);
        }
    }

    public static void setJobId(String jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
    }

    public static void setFeedId(String feedId) {
        if (feedId != null) {
            MDC.put(MDC_FEED_ID, feedId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all fields set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_NODE_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_FEED_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
