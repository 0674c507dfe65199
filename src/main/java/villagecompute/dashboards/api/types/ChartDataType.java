package villagecompute.dashboards.api.types;

import java.util.List;

/**
 * Chart series result, already ordered for display.
 *
 * @param series
 *            named points
 */
public record ChartDataType(List<ChartPointType> series) implements WidgetDataType {

    public ChartDataType {
        series = series == null ? List.of() : List.copyOf(series);
    }
}
