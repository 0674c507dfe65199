package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.dashboards.widgets.OwnerScope;

/**
 * Request to copy a custom widget into another namespace.
 *
 * @param sourceScope
 *            namespace scope holding the original; the caller's own scope when {@code null}
 * @param sourceOwnerId
 *            namespace owner holding the original; the caller's own namespace when {@code null}
 * @param deleteOriginal
 *            remove the original after copying instead of marking it promoted
 */
public record PromoteWidgetRequestType(@JsonProperty("source_scope") OwnerScope sourceScope,
        @JsonProperty("source_owner_id") String sourceOwnerId,
        @JsonProperty("delete_original") boolean deleteOriginal) {
}
