package villagecompute.dashboards.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.dashboards.api.types.ChartDataType;
import villagecompute.dashboards.api.types.ChartPointType;
import villagecompute.dashboards.api.types.KpiDataType;
import villagecompute.dashboards.api.types.QueryColumnType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.TableDataType;
import villagecompute.dashboards.api.types.VisualizationHintType;
import villagecompute.dashboards.api.types.WidgetDataType;
import villagecompute.dashboards.widgets.AggregateFunction;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Turns a query spec and the rows it fetched into a renderable {@link WidgetDataType}.
 *
 * <p>
 * <b>Shapes:</b>
 * <ul>
 * <li>KPI ({@code kpi}, {@code featured_kpi}): the first aggregate column reduced over all rows; no aggregate column
 * means row count</li>
 * <li>Categorical ({@code bar_chart}, {@code pie_chart}, {@code map}): rows grouped by category, sorted by value
 * descending, top {@value #MAX_SERIES} kept</li>
 * <li>Chronological ({@code line_chart}): rows grouped by time bucket, sorted ascending by bucket key</li>
 * <li>Tabular ({@code table}, {@code ai_report}): declared columns projected in order, truncated to the limit</li>
 * </ul>
 *
 * <p>
 * <b>Numeric coercion:</b> numbers are used as-is, strings are parsed, everything else (including NaN, infinities and
 * unparseable text) counts as 0. Aggregation never throws on malformed data and an empty row set produces zero or
 * empty results.
 */
@ApplicationScoped
public class WidgetAggregationService {

    private static final Logger LOG = Logger.getLogger(WidgetAggregationService.class);

    public static final String UNKNOWN_CATEGORY = "Unknown";
    public static final int MAX_SERIES = 10;
    public static final int DEFAULT_TABLE_LIMIT = 100;
    public static final int MAX_TABLE_LIMIT = 1000;

    public WidgetDataType aggregate(QuerySpecType spec, WidgetType widgetType, List<Map<String, Object>> rows) {
        return aggregate(spec, widgetType, rows, null);
    }

    /**
     * Aggregates rows into the shape required by the widget type.
     *
     * @param spec
     *            query spec that produced the rows
     * @param widgetType
     *            widget type; {@code null} is treated as KPI
     * @param rows
     *            fetched rows, may be {@code null} or empty
     * @param hint
     *            optional presentation hint (labels, format, fallback category field)
     * @return exactly one data variant
     */
    public WidgetDataType aggregate(QuerySpecType spec, WidgetType widgetType, List<Map<String, Object>> rows,
            VisualizationHintType hint) {
        List<Map<String, Object>> safeRows = rows == null ? List.of() : rows;
        WidgetType type = widgetType == null ? WidgetType.KPI : widgetType;

        return switch (type.shape()) {
            case SCALAR -> aggregateKpi(spec, safeRows, hint);
            case CATEGORICAL -> aggregateSeries(spec, safeRows, hint, false);
            case CHRONOLOGICAL -> aggregateSeries(spec, safeRows, hint, true);
            case TABULAR -> aggregateTable(spec, safeRows);
        };
    }

    private KpiDataType aggregateKpi(QuerySpecType spec, List<Map<String, Object>> rows, VisualizationHintType hint) {
        QueryColumnType valueColumn = spec == null ? null : spec.primaryAggregate().orElse(null);
        AggregateFunction function = valueColumn == null ? AggregateFunction.COUNT : valueColumn.aggregate();

        Accumulator accumulator = new Accumulator();
        for (Map<String, Object> row : rows) {
            accumulator.add(valueColumn == null ? 0 : toNumber(valueOf(row, valueColumn)));
        }

        String label = hint != null && hint.label() != null ? hint.label()
                : valueColumn != null ? valueColumn.key() : "count";
        String format = hint != null && hint.format() != null ? hint.format() : VisualizationHintType.FORMAT_NUMBER;
        return new KpiDataType(accumulator.value(function), label, format);
    }

    private ChartDataType aggregateSeries(QuerySpecType spec, List<Map<String, Object>> rows,
            VisualizationHintType hint, boolean chronological) {
        String categoryField = categoryField(spec, hint);
        QueryColumnType valueColumn = spec == null ? null : spec.primaryAggregate().orElse(null);
        AggregateFunction function = valueColumn == null ? AggregateFunction.COUNT : valueColumn.aggregate();

        if (categoryField == null) {
            LOG.debugf("No category field for %s; all rows fall into '%s'",
                    spec == null ? "<no spec>" : spec.baseEntity(), UNKNOWN_CATEGORY);
        }

        Map<String, Accumulator> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String category = categoryOf(categoryField == null ? null : lookup(row, categoryField));
            double value = valueColumn == null ? 0 : toNumber(valueOf(row, valueColumn));
            groups.computeIfAbsent(category, key -> new Accumulator()).add(value);
        }

        List<ChartPointType> series = new ArrayList<>(groups.size());
        groups.forEach((name, accumulator) -> series.add(new ChartPointType(name, accumulator.value(function))));

        if (chronological) {
            series.sort((left, right) -> compareKeys(left.name(), right.name()));
            return new ChartDataType(series);
        }

        // List.sort is stable, so equal values keep first-seen order
        series.sort(Comparator.comparingDouble(ChartPointType::value).reversed());
        int maxSeries = MAX_SERIES;
        if (spec != null && spec.limit() != null && spec.limit() > 0) {
            maxSeries = Math.min(spec.limit(), MAX_SERIES);
        }
        return new ChartDataType(series.size() > maxSeries ? series.subList(0, maxSeries) : series);
    }

    private TableDataType aggregateTable(QuerySpecType spec, List<Map<String, Object>> rows) {
        List<QueryColumnType> columns = spec == null ? List.of() : spec.columns();
        int limit = DEFAULT_TABLE_LIMIT;
        if (spec != null && spec.limit() != null && spec.limit() > 0) {
            limit = Math.min(spec.limit(), MAX_TABLE_LIMIT);
        }

        List<String> columnKeys = new ArrayList<>(columns.size());
        for (QueryColumnType column : columns) {
            columnKeys.add(column.key());
        }

        List<Map<String, Object>> projected = new ArrayList<>(Math.min(rows.size(), limit));
        for (Map<String, Object> row : rows) {
            if (projected.size() >= limit) {
                break;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (QueryColumnType column : columns) {
                out.put(column.key(), valueOf(row, column));
            }
            projected.add(out);
        }
        return new TableDataType(projected, columnKeys);
    }

    /**
     * Category field: first group-by entry, else the hint's x axis, else the first non-aggregated column.
     */
    private String categoryField(QuerySpecType spec, VisualizationHintType hint) {
        if (spec != null && !spec.groupBy().isEmpty()) {
            return spec.groupBy().get(0);
        }
        if (hint != null && hint.xAxis() != null && !hint.xAxis().isBlank()) {
            return hint.xAxis();
        }
        if (spec != null) {
            for (QueryColumnType column : spec.columns()) {
                if (column.aggregate() == null) {
                    return column.field();
                }
            }
        }
        return null;
    }

    private static String categoryOf(Object raw) {
        if (raw == null) {
            return UNKNOWN_CATEGORY;
        }
        String text = String.valueOf(raw).trim();
        return text.isEmpty() ? UNKNOWN_CATEGORY : text;
    }

    /**
     * Ascending key order: numeric keys first in numeric order, then the remaining keys in lexical order.
     */
    static int compareKeys(String left, String right) {
        Double leftNumber = parseDouble(left);
        Double rightNumber = parseDouble(right);
        if (leftNumber != null && rightNumber != null) {
            int byValue = Double.compare(leftNumber, rightNumber);
            return byValue != 0 ? byValue : left.compareTo(right);
        }
        if (leftNumber != null) {
            return -1;
        }
        if (rightNumber != null) {
            return 1;
        }
        return left.compareTo(right);
    }

    private static Object valueOf(Map<String, Object> row, QueryColumnType column) {
        Object value = lookup(row, column.field());
        if (value == null && column.alias() != null) {
            value = row.get(column.alias());
        }
        return value;
    }

    /**
     * Looks a field up by its exact name, then by its unqualified name.
     */
    private static Object lookup(Map<String, Object> row, String field) {
        if (row == null || field == null) {
            return null;
        }
        Object value = row.get(field);
        if (value == null) {
            int dot = field.lastIndexOf('.');
            if (dot >= 0) {
                value = row.get(field.substring(dot + 1));
            }
        }
        return value;
    }

    /**
     * Numeric coercion used for every aggregate. Never throws.
     */
    public static double toNumber(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : 0;
        }
        if (raw instanceof String text) {
            Double parsed = parseDouble(text);
            return parsed == null ? 0 : parsed;
        }
        return 0;
    }

    private static Double parseDouble(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static final class Accumulator {
        private long count;
        private double sum;

        void add(double value) {
            count++;
            sum += value;
        }

        double value(AggregateFunction function) {
            double result = switch (function) {
                case COUNT -> count;
                case SUM -> sum;
                case AVG -> count == 0 ? 0 : sum / count;
            };
            return Double.isFinite(result) ? result : 0;
        }
    }
}
