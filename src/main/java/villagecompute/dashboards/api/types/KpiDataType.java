package villagecompute.dashboards.api.types;

/**
 * Scalar KPI result.
 *
 * @param value
 *            aggregated value, never NaN or infinite
 * @param label
 *            display label
 * @param format
 *            display format ({@code number}, {@code currency}, {@code percent})
 */
public record KpiDataType(double value, String label, String format) implements WidgetDataType {
}
