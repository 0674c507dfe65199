package villagecompute.dashboards.widgets;

/**
 * Result shapes produced by the aggregation pipeline.
 */
public enum AggregationShape {
    /** Single value (KPI tiles). */
    SCALAR,
    /** Series sorted by value, descending, truncated to the top entries. */
    CATEGORICAL,
    /** Series sorted ascending by group key. */
    CHRONOLOGICAL,
    /** Projected rows. */
    TABULAR
}
