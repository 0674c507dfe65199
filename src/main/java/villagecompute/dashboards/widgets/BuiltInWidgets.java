package villagecompute.dashboards.widgets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import villagecompute.dashboards.api.types.BuiltInWidgetType;
import villagecompute.dashboards.api.types.OrderByType;
import villagecompute.dashboards.api.types.QueryColumnType;
import villagecompute.dashboards.api.types.QueryFilterType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.VisualizationHintType;

/**
 * Deploy-time catalog of built-in widgets.
 *
 * <p>
 * Every built-in query reads the {@value #SHIPMENTS} relation and is scoped by the dynamic tenant filter and the
 * dynamic pickup date range, so the same definitions serve every customer. Admin widgets read restricted fields
 * ({@code cost}, {@code margin}) and are only calculated in privileged contexts.
 */
public final class BuiltInWidgets {

    public static final String SHIPMENTS = "shipments";

    static final String TENANT_FIELD = "customer_id";
    static final String DATE_FIELD = "pickup_date";

    private BuiltInWidgets() {
    }

    public static List<BuiltInWidgetType> all() {
        List<BuiltInWidgetType> widgets = new ArrayList<>();

        // Volume
        widgets.add(widget("total_shipments", "Total Shipments", "Count of shipments picked up in the date range",
                WidgetType.KPI, "volume", AccessScope.ALL,
                spec(List.of(QueryColumnType.aggregate("load_id", AggregateFunction.COUNT)), List.of(), List.of(),
                        null),
                VisualizationHintType.kpi("Shipments", VisualizationHintType.FORMAT_NUMBER)));

        // Financial
        widgets.add(widget("total_spend", "Total Spend", "Sum of billed amounts in the date range",
                WidgetType.FEATURED_KPI, "financial", AccessScope.ALL,
                spec(List.of(QueryColumnType.aggregate("retail", AggregateFunction.SUM)), List.of(), List.of(), null),
                VisualizationHintType.kpi("Total Spend", VisualizationHintType.FORMAT_CURRENCY)));
        widgets.add(widget("avg_cost_shipment", "Avg Cost Per Shipment", "Average billed amount per shipment",
                WidgetType.FEATURED_KPI, "financial", AccessScope.ALL,
                spec(List.of(QueryColumnType.aggregate("retail", AggregateFunction.AVG)), List.of(), List.of(), null),
                VisualizationHintType.kpi("Avg Cost", VisualizationHintType.FORMAT_CURRENCY)));
        widgets.add(widget("monthly_spend", "Monthly Spend Trend", "Billed amount per pickup month",
                WidgetType.LINE_CHART, "financial", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("pickup_month"),
                        QueryColumnType.aggregate("retail", AggregateFunction.SUM)), List.of("pickup_month"),
                        List.of(), null),
                new VisualizationHintType("pickup_month", "retail", null, "Spend",
                        VisualizationHintType.FORMAT_CURRENCY)));

        // Breakdown
        widgets.add(widget("mode_breakdown", "Shipments by Mode", "Distribution of shipments by mode",
                WidgetType.PIE_CHART, "breakdown", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("mode_name"),
                        QueryColumnType.aggregate("load_id", AggregateFunction.COUNT)), List.of("mode_name"),
                        List.of(), null),
                VisualizationHintType.chart("mode_name", "load_id")));
        widgets.add(widget("carrier_mix", "Carrier Mix", "Share of shipments per carrier", WidgetType.PIE_CHART,
                "breakdown", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("carrier_name"),
                        QueryColumnType.aggregate("load_id", AggregateFunction.COUNT)), List.of("carrier_name"),
                        List.of(), null),
                VisualizationHintType.chart("carrier_name", "load_id")));
        widgets.add(widget("carrier_spend", "Spend by Carrier", "Billed amount per carrier", WidgetType.BAR_CHART,
                "breakdown", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("carrier_name"),
                        QueryColumnType.aggregate("retail", AggregateFunction.SUM)), List.of("carrier_name"),
                        List.of(), 10),
                new VisualizationHintType("carrier_name", "retail", null, "Spend",
                        VisualizationHintType.FORMAT_CURRENCY)));
        widgets.add(widget("top_lanes", "Top Lanes", "Most recent shipments with their lane and billed amount",
                WidgetType.TABLE, "breakdown", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("lane"), QueryColumnType.of("carrier_name"),
                        new QueryColumnType("retail", "spend", null), QueryColumnType.of(DATE_FIELD)), List.of(),
                        List.of(new OrderByType(DATE_FIELD, "desc")), 25),
                null));

        // Geographic
        widgets.add(widget("cost_by_state", "Cost by State", "Billed amount per destination state", WidgetType.MAP,
                "geographic", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("destination_state"),
                        QueryColumnType.aggregate("retail", AggregateFunction.SUM)), List.of("destination_state"),
                        List.of(), null),
                new VisualizationHintType("destination_state", "retail", null, "Spend",
                        VisualizationHintType.FORMAT_CURRENCY)));
        widgets.add(widget("flow_map", "Shipment Flow Map", "Shipment counts per origin to destination lane",
                WidgetType.MAP, "geographic", AccessScope.ALL,
                spec(List.of(QueryColumnType.of("lane"), QueryColumnType.aggregate("load_id", AggregateFunction.COUNT)),
                        List.of("lane"), List.of(), null),
                VisualizationHintType.chart("lane", "load_id")));

        // Admin only
        widgets.add(widget("total_revenue_admin", "Total Revenue", "Billed amount across all customers",
                WidgetType.FEATURED_KPI, "financial", AccessScope.ADMIN,
                spec(List.of(QueryColumnType.aggregate("retail", AggregateFunction.SUM)), List.of(), List.of(), null),
                VisualizationHintType.kpi("Revenue", VisualizationHintType.FORMAT_CURRENCY)));
        widgets.add(widget("avg_margin_admin", "Average Margin", "Average margin percent per shipment",
                WidgetType.KPI, "financial", AccessScope.ADMIN,
                spec(List.of(QueryColumnType.aggregate("margin_percent", AggregateFunction.AVG)), List.of(),
                        List.of(), null),
                VisualizationHintType.kpi("Avg Margin", VisualizationHintType.FORMAT_PERCENT)));
        widgets.add(widget("top_customers_revenue", "Top Customers by Revenue", "Customers ranked by billed amount",
                WidgetType.BAR_CHART, "customers", AccessScope.ADMIN,
                spec(List.of(QueryColumnType.of("customer_name"),
                        QueryColumnType.aggregate("retail", AggregateFunction.SUM)), List.of("customer_name"),
                        List.of(), 10),
                new VisualizationHintType("customer_name", "retail", null, "Revenue",
                        VisualizationHintType.FORMAT_CURRENCY)));

        return Collections.unmodifiableList(widgets);
    }

    private static BuiltInWidgetType widget(String id, String name, String description, WidgetType type,
            String category, AccessScope accessScope, QuerySpecType querySpec, VisualizationHintType hint) {
        return new BuiltInWidgetType(id, name, description, type, category, accessScope, null, querySpec, hint);
    }

    /**
     * Shipments query with the standard tenant and pickup date range filters appended.
     */
    private static QuerySpecType spec(List<QueryColumnType> columns, List<String> groupBy, List<OrderByType> orderBy,
            Integer limit) {
        List<QueryFilterType> filters = List.of(QueryFilterType.dynamic(TENANT_FIELD, "eq"),
                QueryFilterType.dynamic(DATE_FIELD, "gte"), QueryFilterType.dynamic(DATE_FIELD, "lte"));
        return new QuerySpecType(SHIPMENTS, columns, filters, groupBy, orderBy, limit);
    }
}
