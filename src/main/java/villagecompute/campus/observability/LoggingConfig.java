package villagecompute.campus.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Central configuration and utilities for structured logging with observability context.
 *
 * <p>
 * Defines the MDC field names used by the scheduler, the job handlers and the REST layer. The console log format in
 * {@code application.yaml} prints {@code job_id} and {@code trace_id} so that every line written during a dispatch can
 * be correlated with its JobLog row and its trace.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - ScheduledJob primary key (only during dispatch)</li>
 * <li>{@code job_class} - Stored job class name, e.g. {@code VoucherAutoBlockJob}</li>
 * <li>{@code request_origin} - HTTP request path or handler identifier</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(context.jobId());
 * LoggingConfig.setRequestOrigin("VoucherAutoBlockJobHandler");
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each request or job run
 * must clear MDC in a {@code finally} block.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * ScheduledJob primary key (Long as String). Only present while a job is being dispatched.
     */
    public static final String MDC_JOB_ID = "job_id";

    /**
     * Stored job class name of the job being dispatched.
     */
    public static final String MDC_JOB_CLASS = "job_class";

    /**
     * HTTP request path (e.g., "/api/scheduled-jobs/execute") or handler identifier.
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. If no valid span is active (tracing
     * disabled, or called outside a span) both fields are set to empty strings.
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

    /**
     * Sets the scheduled job ID for dispatch logs.
     *
     * @param jobId
     *            scheduled job primary key
     */
    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    /**
     * Sets the job class being dispatched.
     *
     * @param jobClass
     *            stored job class name
     */
    public static void setJobClass(String jobClass) {
        if (jobClass != null) {
            MDC.put(MDC_JOB_CLASS, jobClass);
        }
    }

    /**
     * Sets the request origin (HTTP path or handler identifier).
     *
     * @param requestOrigin
     *            path like "/api/scheduled-jobs/execute" or a handler class name
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_CLASS);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
