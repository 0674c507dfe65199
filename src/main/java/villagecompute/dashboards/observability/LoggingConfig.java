package villagecompute.dashboards.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.dashboards.widgets.DashboardKind;
import villagecompute.dashboards.widgets.OwnerContext;

/**
 * Standard MDC fields for structured logging and helpers to populate them.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code owner_id} - namespace owner (customer id, admin id or {@code system})</li>
 * <li>{@code owner_scope} - {@code system}, {@code admin} or {@code customer}</li>
 * <li>{@code dashboard_kind} - dashboard variant being read or mutated</li>
 * <li>{@code widget_id} - widget being calculated or stored</li>
 * <li>{@code request_origin} - service method or HTTP path</li>
 * </ul>
 *
 * <p>
 * <b>Usage in services:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setOwner(owner);
 * LoggingConfig.setRequestOrigin("CustomWidgetService.save");
 * ...
 * LoggingConfig.clearMDC();
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> all methods operate on {@link MDC}, which is thread-local. Every traced operation clears the
 * MDC in its {@code finally} block.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_OWNER_ID = "owner_id";

    public static final String MDC_OWNER_SCOPE = "owner_scope";

    public static final String MDC_DASHBOARD_KIND = "dashboard_kind";

    public static final String MDC_WIDGET_ID = "widget_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings are used when no span is active
     * so the JSON log schema stays stable.
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

    public static void setOwner(OwnerContext owner) {
        if (owner != null) {
            MDC.put(MDC_OWNER_ID, owner.ownerId());
            MDC.put(MDC_OWNER_SCOPE, owner.scope().code());
        }
    }

    public static void setLayoutOwner(DashboardKind kind, String ownerId) {
        if (kind != null) {
            MDC.put(MDC_DASHBOARD_KIND, kind.code());
        }
        if (ownerId != null) {
            MDC.put(MDC_OWNER_ID, ownerId);
        }
    }

    public static void setWidgetId(String widgetId) {
        if (widgetId != null) {
            MDC.put(MDC_WIDGET_ID, widgetId);
        }
    }

    /**
     * @param requestOrigin
     *            path like "/api/widgets/catalog" or "CustomWidgetService.save"
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Removes every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_OWNER_ID);
        MDC.remove(MDC_OWNER_SCOPE);
        MDC.remove(MDC_DASHBOARD_KIND);
        MDC.remove(MDC_WIDGET_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
