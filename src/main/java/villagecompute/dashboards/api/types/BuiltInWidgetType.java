package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.WidgetDefinition;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Immutable, deploy-time widget definition from the built-in catalog.
 *
 * @param id
 *            stable unique id
 * @param name
 *            display name
 * @param description
 *            short description
 * @param type
 *            widget type
 * @param category
 *            catalog category ({@code volume}, {@code financial}, ...)
 * @param accessScope
 *            audience of the widget
 * @param defaultSize
 *            preferred size level, or {@code null}
 * @param querySpec
 *            data query
 * @param visualizationHint
 *            presentation hint
 */
public record BuiltInWidgetType(String id, String name, String description, WidgetType type, String category,
        @JsonProperty("access_scope") AccessScope accessScope, @JsonProperty("default_size") Integer defaultSize,
        @JsonProperty("query_spec") QuerySpecType querySpec,
        @JsonProperty("visualization_hint") VisualizationHintType visualizationHint) implements WidgetDefinition {
}
