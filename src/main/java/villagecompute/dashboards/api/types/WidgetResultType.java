package villagecompute.dashboards.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of calculating one widget. A failed widget yields an {@link Status#ERROR} result instead of failing the
 * dashboard.
 *
 * @param widgetId
 *            calculated widget
 * @param status
 *            outcome
 * @param data
 *            rendered data; empty shape for {@code empty}, {@code null} for {@code error} and {@code stale}
 * @param error
 *            error message for {@code error}
 * @param frozen
 *            whether the data came from a static snapshot
 * @param calculatedAt
 *            ISO-8601 instant of calculation (or of the snapshot)
 */
public record WidgetResultType(@JsonProperty("widget_id") String widgetId, Status status, WidgetDataType data,
        String error, boolean frozen, @JsonProperty("calculated_at") String calculatedAt) {

    public enum Status {
        READY("ready"), EMPTY("empty"), ERROR("error"), STALE("stale");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    public static WidgetResultType ready(String widgetId, WidgetDataType data) {
        return new WidgetResultType(widgetId, Status.READY, data, null, false, Instant.now().toString());
    }

    public static WidgetResultType empty(String widgetId, WidgetDataType data) {
        return new WidgetResultType(widgetId, Status.EMPTY, data, null, false, Instant.now().toString());
    }

    public static WidgetResultType frozen(String widgetId, WidgetDataType snapshot, String snapshotTimestamp) {
        return new WidgetResultType(widgetId, Status.READY, snapshot, null, true, snapshotTimestamp);
    }

    public static WidgetResultType error(String widgetId, String message) {
        return new WidgetResultType(widgetId, Status.ERROR, null, message, false, Instant.now().toString());
    }

    /**
     * Result of a fetch that was superseded by a newer request for the same widget slot.
     */
    public static WidgetResultType stale(String widgetId) {
        return new WidgetResultType(widgetId, Status.STALE, null, null, false, Instant.now().toString());
    }
}
