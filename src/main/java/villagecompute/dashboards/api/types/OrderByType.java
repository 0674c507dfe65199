package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotBlank;

/**
 * Ordering clause of a widget query.
 *
 * @param field
 *            ordered field
 * @param direction
 *            {@code asc} or {@code desc}; anything else is treated as {@code asc}
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record OrderByType(@NotBlank String field, String direction) {

    @JsonIgnore
    public boolean descending() {
        return "desc".equalsIgnoreCase(direction);
    }
}
