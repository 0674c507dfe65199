package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Layout constraints of a widget. Sizes are levels on the 1..3 scale (small, medium, large).
 *
 * @param minSize
 *            smallest allowed size level
 * @param maxSize
 *            largest allowed size level
 * @param optimalSize
 *            size used when the layout has no override
 * @param minHeight
 *            minimum rendered height in pixels
 */
public record SizeConstraintType(@JsonProperty("min_size") int minSize, @JsonProperty("max_size") int maxSize,
        @JsonProperty("optimal_size") int optimalSize, @JsonProperty("min_height") int minHeight) {
}
