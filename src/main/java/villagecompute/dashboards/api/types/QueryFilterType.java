package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * A filter predicate of a widget query.
 *
 * <p>
 * Operators: {@code eq, neq, gt, gte, lt, lte, like, in, between}. For dynamic filters the stored {@code value} is
 * never used; the value comes from the execution context when the widget is calculated.
 *
 * @param field
 *            filtered field
 * @param operator
 *            comparison operator
 * @param value
 *            static comparison value (collection for {@code in}, two-element list for {@code between})
 * @param dynamic
 *            whether the value is bound from the execution context
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record QueryFilterType(@NotBlank String field, @NotBlank String operator, Object value,
        @JsonProperty("is_dynamic") boolean dynamic) {

    public static QueryFilterType fixed(String field, String operator, Object value) {
        return new QueryFilterType(field, operator, value, false);
    }

    public static QueryFilterType dynamic(String field, String operator) {
        return new QueryFilterType(field, operator, null, true);
    }

    public QueryFilterType withValue(Object resolvedValue) {
        return new QueryFilterType(field, operator, resolvedValue, false);
    }
}
