package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.dashboards.widgets.OwnerScope;

/**
 * Audit trail kept on a widget that was copied from another namespace.
 *
 * @param originalId
 *            id of the source widget
 * @param originalScope
 *            namespace scope of the source
 * @param originalOwnerId
 *            namespace owner of the source
 * @param originalVersion
 *            version of the source at copy time
 * @param copiedAt
 *            ISO-8601 copy instant
 * @param copiedBy
 *            user who performed the copy
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record PromotedFromType(@JsonProperty("original_id") String originalId,
        @JsonProperty("original_scope") OwnerScope originalScope,
        @JsonProperty("original_owner_id") String originalOwnerId,
        @JsonProperty("original_version") int originalVersion, @JsonProperty("copied_at") String copiedAt,
        @JsonProperty("copied_by") String copiedBy) {
}
