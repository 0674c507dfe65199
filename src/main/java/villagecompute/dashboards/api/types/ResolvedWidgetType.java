package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.dashboards.widgets.WidgetDefinition;

/**
 * A layout slot with its definition and effective size.
 *
 * @param widgetId
 *            widget id in the layout
 * @param definition
 *            built-in or custom definition
 * @param size
 *            effective size level after clamping
 * @param constraints
 *            size constraints of the widget
 * @param interactive
 *            whether the widget handles pointer gestures itself (excluded from hover reorder)
 * @param custom
 *            whether the definition is a custom widget
 */
public record ResolvedWidgetType(@JsonProperty("widget_id") String widgetId, WidgetDefinition definition, int size,
        SizeConstraintType constraints, boolean interactive, boolean custom) {
}
