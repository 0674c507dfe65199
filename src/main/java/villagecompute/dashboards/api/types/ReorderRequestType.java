package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;

/**
 * Move of one widget from {@code oldIndex} to {@code newIndex}, as produced by a drag gesture.
 *
 * @param oldIndex
 *            current position of the moved widget
 * @param newIndex
 *            target position
 */
public record ReorderRequestType(@JsonProperty("old_index") @Min(0) int oldIndex,
        @JsonProperty("new_index") @Min(0) int newIndex) {
}
