package villagecompute.dashboards.widgets;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Dashboard variants. Each kind keeps its own layout per owner and has a default widget list used on reset.
 */
public enum DashboardKind {

    CUSTOMER_DASHBOARD("customer_dashboard", List.of("total_shipments", "total_spend", "avg_cost_shipment",
            "monthly_spend", "mode_breakdown", "carrier_mix", "top_lanes")),

    PULSE("pulse", List.of("total_shipments", "total_spend", "monthly_spend", "carrier_spend")),

    ANALYTICS_HUB("analytics_hub", List.of("monthly_spend", "cost_by_state", "flow_map", "top_lanes")),

    ADMIN_DASHBOARD("admin_dashboard", List.of("total_shipments", "total_revenue_admin", "avg_margin_admin",
            "top_customers_revenue"));

    private final String code;
    private final List<String> defaultWidgetIds;

    DashboardKind(String code, List<String> defaultWidgetIds) {
        this.code = code;
        this.defaultWidgetIds = defaultWidgetIds;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public List<String> defaultWidgetIds() {
        return defaultWidgetIds;
    }

    /**
     * Whether the kind is reserved for privileged owners.
     */
    public boolean adminOnly() {
        return this == ADMIN_DASHBOARD;
    }

    @JsonCreator
    public static DashboardKind fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase().replace('-', '_');
        for (DashboardKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
