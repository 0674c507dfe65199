package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Selection change while editing; a {@code null} id clears the selection.
 *
 * @param widgetId
 *            widget to select, or {@code null}
 */
public record SelectWidgetRequestType(@JsonProperty("widget_id") String widgetId) {
}
