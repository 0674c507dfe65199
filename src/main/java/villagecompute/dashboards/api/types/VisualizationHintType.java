package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Presentation hint stored alongside a query spec.
 *
 * @param xAxis
 *            category field used when the query has no group-by
 * @param yAxis
 *            value field label for charts
 * @param valueField
 *            field shown by KPI tiles
 * @param label
 *            display label for KPI values
 * @param format
 *            {@code number}, {@code currency} or {@code percent}
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record VisualizationHintType(@JsonProperty("x_axis") String xAxis, @JsonProperty("y_axis") String yAxis,
        @JsonProperty("value_field") String valueField, String label, String format) {

    public static final String FORMAT_NUMBER = "number";
    public static final String FORMAT_CURRENCY = "currency";
    public static final String FORMAT_PERCENT = "percent";

    public static VisualizationHintType kpi(String label, String format) {
        return new VisualizationHintType(null, null, null, label, format);
    }

    public static VisualizationHintType chart(String xAxis, String yAxis) {
        return new VisualizationHintType(xAxis, yAxis, null, null, FORMAT_NUMBER);
    }
}
