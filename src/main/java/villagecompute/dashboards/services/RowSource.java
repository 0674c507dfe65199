package villagecompute.dashboards.services;

import java.util.List;
import java.util.Map;

import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.QuerySpecType;

/**
 * Executes a resolved query spec against the backing data store and returns raw rows.
 *
 * <p>
 * Callers hand in a spec whose dynamic filters are already bound; implementations must not consult the stored spec
 * for tenant or date values. Aggregation happens afterwards in {@link WidgetAggregationService}, so rows are keyed by
 * the selected field names.
 */
public interface RowSource {

    List<Map<String, Object>> fetchRows(QuerySpecType spec, ExecutionContextType context);
}
