package villagecompute.dashboards.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.dashboards.api.types.OrderByType;
import villagecompute.dashboards.api.types.QueryColumnType;
import villagecompute.dashboards.api.types.QueryFilterType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.VisualizationHintType;

/**
 * Static deny-list of internal cost and margin fields that restricted (customer) scopes must never see.
 *
 * <p>
 * Matching is case-insensitive and ignores a table qualifier, so {@code Shipments.CARRIER_PAY} is as restricted as
 * {@code carrier_pay}. Redaction removes every column, filter, group-by and order-by entry referencing a denied field,
 * and blanks hint fields that point at one. It is applied when a restricted owner saves a widget and again when a
 * restricted context executes one.
 */
@ApplicationScoped
public class FieldAccessPolicy {

    static final Set<String> RESTRICTED_FIELDS = Set.of("cost", "cost_amount", "cost_per_mile", "cost_without_tax",
            "margin", "margin_percent", "profit", "markup", "carrier_cost", "carrier_pay", "carrier_rate",
            "carrier_total", "linehaul", "target_rate", "buy_rate", "net_revenue", "commission");

    /**
     * Redacted spec plus the number of references removed.
     */
    public record Redaction(QuerySpecType spec, VisualizationHintType hint, int removed) {
    }

    public boolean isRestricted(String field) {
        if (field == null) {
            return false;
        }
        String normalized = field.trim().toLowerCase(Locale.ROOT);
        int dot = normalized.lastIndexOf('.');
        if (dot >= 0) {
            normalized = normalized.substring(dot + 1);
        }
        return RESTRICTED_FIELDS.contains(normalized);
    }

    public Set<String> restrictedFields() {
        return RESTRICTED_FIELDS;
    }

    /**
     * Removes every restricted reference from a spec and its hint.
     *
     * @param spec
     *            query spec, may be {@code null}
     * @param hint
     *            visualization hint, may be {@code null}
     * @return redacted copies and the count of removed references
     */
    public Redaction redact(QuerySpecType spec, VisualizationHintType hint) {
        int removed = 0;
        QuerySpecType redactedSpec = spec;

        if (spec != null) {
            List<QueryColumnType> columns = new ArrayList<>();
            for (QueryColumnType column : spec.columns()) {
                if (isRestricted(column.field()) || isRestricted(column.alias())) {
                    removed++;
                } else {
                    columns.add(column);
                }
            }
            List<QueryFilterType> filters = new ArrayList<>();
            for (QueryFilterType filter : spec.filters()) {
                if (isRestricted(filter.field())) {
                    removed++;
                } else {
                    filters.add(filter);
                }
            }
            List<String> groupBy = new ArrayList<>();
            for (String field : spec.groupBy()) {
                if (isRestricted(field)) {
                    removed++;
                } else {
                    groupBy.add(field);
                }
            }
            List<OrderByType> orderBy = new ArrayList<>();
            for (OrderByType order : spec.orderBy()) {
                if (isRestricted(order.field())) {
                    removed++;
                } else {
                    orderBy.add(order);
                }
            }
            redactedSpec = new QuerySpecType(spec.baseEntity(), columns, filters, groupBy, orderBy, spec.limit());
        }

        VisualizationHintType redactedHint = hint;
        if (hint != null) {
            String xAxis = hint.xAxis();
            String yAxis = hint.yAxis();
            String valueField = hint.valueField();
            if (isRestricted(xAxis)) {
                xAxis = null;
                removed++;
            }
            if (isRestricted(yAxis)) {
                yAxis = null;
                removed++;
            }
            if (isRestricted(valueField)) {
                valueField = null;
                removed++;
            }
            redactedHint = new VisualizationHintType(xAxis, yAxis, valueField, hint.label(), hint.format());
        }

        return new Redaction(redactedSpec, redactedHint, removed);
    }

    /**
     * Counts restricted references without changing anything.
     */
    public int countRestrictedReferences(QuerySpecType spec) {
        return redact(spec, null).removed();
    }
}
