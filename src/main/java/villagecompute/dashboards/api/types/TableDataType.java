package villagecompute.dashboards.api.types;

import java.util.List;
import java.util.Map;

/**
 * Tabular result.
 *
 * @param rows
 *            projected rows keyed by column name
 * @param columns
 *            column names in display order
 */
public record TableDataType(List<Map<String, Object>> rows, List<String> columns) implements WidgetDataType {

    public TableDataType {
        rows = rows == null ? List.of() : List.copyOf(rows);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
