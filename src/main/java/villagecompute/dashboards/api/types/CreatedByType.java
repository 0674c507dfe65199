package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.dashboards.widgets.OwnerScope;

/**
 * Creation audit record of a custom widget.
 *
 * @param ownerId
 *            acting user at creation time
 * @param ownerScope
 *            scope the widget was created in
 * @param timestamp
 *            ISO-8601 creation instant
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record CreatedByType(@JsonProperty("owner_id") String ownerId,
        @JsonProperty("owner_scope") OwnerScope ownerScope, String timestamp) {
}
