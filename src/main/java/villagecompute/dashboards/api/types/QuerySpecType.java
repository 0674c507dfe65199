package villagecompute.dashboards.api.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * Declarative description of the data a widget needs and how to aggregate it.
 *
 * <p>
 * Specs are pure data: the same spec drives built-in and custom widgets through one aggregation pipeline. At most one
 * aggregate column (the first) drives KPI widgets.
 *
 * @param baseEntity
 *            relation the rows come from
 * @param columns
 *            selected columns, in output order
 * @param filters
 *            filter predicates; dynamic ones are bound at execution time
 * @param groupBy
 *            grouping fields; the first one is the category for charts
 * @param orderBy
 *            ordering clauses handed to the row source
 * @param limit
 *            optional row or series limit
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record QuerySpecType(@JsonProperty("base_entity") @NotBlank String baseEntity,
        @Valid List<QueryColumnType> columns, @Valid List<QueryFilterType> filters,
        @JsonProperty("group_by") List<String> groupBy, @JsonProperty("order_by") @Valid List<OrderByType> orderBy,
        Integer limit) {

    public QuerySpecType {
        columns = copyOf(columns);
        filters = copyOf(filters);
        groupBy = copyOf(groupBy);
        orderBy = copyOf(orderBy);
    }

    /**
     * First aggregate column, which drives KPI values and chart series.
     */
    @JsonIgnore
    public Optional<QueryColumnType> primaryAggregate() {
        return columns.stream().filter(column -> column.aggregate() != null).findFirst();
    }

    public QuerySpecType withFilters(List<QueryFilterType> newFilters) {
        return new QuerySpecType(baseEntity, columns, newFilters, groupBy, orderBy, limit);
    }

    private static <T> List<T> copyOf(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableList(copy);
    }
}
