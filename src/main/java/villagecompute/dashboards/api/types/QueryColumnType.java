package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotBlank;
import villagecompute.dashboards.widgets.AggregateFunction;

/**
 * A selected column of a widget query.
 *
 * @param field
 *            source field, optionally table-qualified ({@code shipments.retail})
 * @param alias
 *            output name; defaults to {@code field}
 * @param aggregate
 *            optional aggregate applied to the field
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record QueryColumnType(@NotBlank String field, String alias, AggregateFunction aggregate) {

    public static QueryColumnType of(String field) {
        return new QueryColumnType(field, null, null);
    }

    public static QueryColumnType aggregate(String field, AggregateFunction aggregate) {
        return new QueryColumnType(field, null, aggregate);
    }

    /**
     * Output key for this column: the alias when present, otherwise the field.
     */
    @JsonIgnore
    public String key() {
        return alias != null && !alias.isBlank() ? alias : field;
    }
}
