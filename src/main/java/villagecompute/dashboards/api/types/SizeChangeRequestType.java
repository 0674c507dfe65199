package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to resize a widget. Out-of-range sizes are clamped to the widget's constraints, not rejected.
 *
 * @param widgetId
 *            widget in the layout
 * @param size
 *            requested size level
 */
public record SizeChangeRequestType(@JsonProperty("widget_id") @NotBlank String widgetId, int size) {
}
