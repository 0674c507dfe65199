package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to add a widget to a dashboard.
 *
 * @param widgetId
 *            built-in or custom widget id
 */
public record AddWidgetRequestType(@JsonProperty("widget_id") @NotBlank String widgetId) {
}
