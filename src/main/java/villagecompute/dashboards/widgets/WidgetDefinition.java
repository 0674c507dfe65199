package villagecompute.dashboards.widgets;

import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.VisualizationHintType;
import villagecompute.dashboards.api.types.WidgetDataType;

/**
 * Common view of built-in and custom widget definitions.
 *
 * <p>
 * A definition carries data only. Calculation goes through
 * {@link villagecompute.dashboards.services.WidgetDataService#calculate} for every widget, whatever its origin.
 */
public interface WidgetDefinition {

    String id();

    String name();

    String description();

    WidgetType type();

    String category();

    AccessScope accessScope();

    /**
     * Preferred size level, or {@code null} to use the type's optimal size.
     */
    Integer defaultSize();

    QuerySpecType querySpec();

    VisualizationHintType visualizationHint();

    /**
     * Frozen result served instead of querying, or {@code null} for live widgets.
     */
    default WidgetDataType staticSnapshot() {
        return null;
    }

    default String snapshotTimestamp() {
        return null;
    }
}
