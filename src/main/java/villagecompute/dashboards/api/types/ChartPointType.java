package villagecompute.dashboards.api.types;

/**
 * One point of a chart series.
 *
 * @param name
 *            category or time bucket
 * @param value
 *            aggregated value
 */
public record ChartPointType(String name, double value) {
}
