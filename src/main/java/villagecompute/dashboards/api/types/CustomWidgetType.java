package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.WidgetDefinition;
import villagecompute.dashboards.widgets.WidgetType;
import villagecompute.dashboards.widgets.WidgetVisibility;

/**
 * User or admin authored widget definition, stored as one JSON document in its owner's namespace.
 *
 * <p>
 * Audit fields ({@code created_by}, {@code version}, {@code created_at}, {@code updated_at}) are maintained by
 * {@link villagecompute.dashboards.services.CustomWidgetService}; values supplied by clients are ignored on save.
 *
 * @param id
 *            widget id; generated on first save when blank
 * @param name
 *            display name
 * @param description
 *            optional description
 * @param type
 *            widget type
 * @param category
 *            catalog category, {@code custom} by default
 * @param accessScope
 *            audience of the widget
 * @param defaultSize
 *            preferred size level, or {@code null}
 * @param querySpec
 *            data query
 * @param visualizationHint
 *            presentation hint
 * @param createdBy
 *            creation audit record
 * @param visibility
 *            private, promoted or system
 * @param version
 *            starts at 1 and increases by one per update
 * @param createdAt
 *            ISO-8601 creation instant
 * @param updatedAt
 *            ISO-8601 instant of the last update
 * @param staticSnapshot
 *            frozen data served without querying, or {@code null}
 * @param snapshotTimestamp
 *            ISO-8601 instant the snapshot was taken
 * @param promotedFrom
 *            source of a copied widget, or {@code null}
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record CustomWidgetType(String id, @NotBlank String name, String description, @NotNull WidgetType type,
        String category, @JsonProperty("access_scope") AccessScope accessScope,
        @JsonProperty("default_size") Integer defaultSize,
        @JsonProperty("query_spec") @NotNull @Valid QuerySpecType querySpec,
        @JsonProperty("visualization_hint") VisualizationHintType visualizationHint,
        @JsonProperty("created_by") CreatedByType createdBy, WidgetVisibility visibility, int version,
        @JsonProperty("created_at") String createdAt, @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("static_snapshot") WidgetDataType staticSnapshot,
        @JsonProperty("snapshot_timestamp") String snapshotTimestamp,
        @JsonProperty("promoted_from") PromotedFromType promotedFrom) implements WidgetDefinition {

    /**
     * Draft with only the authored fields set, as a client would submit it.
     */
    public static CustomWidgetType draft(String id, String name, WidgetType type, QuerySpecType querySpec,
            VisualizationHintType visualizationHint) {
        return new CustomWidgetType(id, name, null, type, null, null, null, querySpec, visualizationHint, null, null,
                0, null, null, null, null, null);
    }

    public CustomWidgetType withId(String newId) {
        return new CustomWidgetType(newId, name, description, type, category, accessScope, defaultSize, querySpec,
                visualizationHint, createdBy, visibility, version, createdAt, updatedAt, staticSnapshot,
                snapshotTimestamp, promotedFrom);
    }

    public CustomWidgetType withName(String newName) {
        return new CustomWidgetType(id, newName, description, type, category, accessScope, defaultSize, querySpec,
                visualizationHint, createdBy, visibility, version, createdAt, updatedAt, staticSnapshot,
                snapshotTimestamp, promotedFrom);
    }

    public CustomWidgetType withQuery(QuerySpecType newQuerySpec, VisualizationHintType newHint) {
        return new CustomWidgetType(id, name, description, type, category, accessScope, defaultSize, newQuerySpec,
                newHint, createdBy, visibility, version, createdAt, updatedAt, staticSnapshot, snapshotTimestamp,
                promotedFrom);
    }

    public CustomWidgetType withVisibility(WidgetVisibility newVisibility) {
        return new CustomWidgetType(id, name, description, type, category, accessScope, defaultSize, querySpec,
                visualizationHint, createdBy, newVisibility, version, createdAt, updatedAt, staticSnapshot,
                snapshotTimestamp, promotedFrom);
    }

    public CustomWidgetType withSnapshot(WidgetDataType snapshot, String timestamp) {
        return new CustomWidgetType(id, name, description, type, category, accessScope, defaultSize, querySpec,
                visualizationHint, createdBy, visibility, version, createdAt, updatedAt, snapshot, timestamp,
                promotedFrom);
    }

    /**
     * Copy carrying fresh audit fields, used when the widget is (re)persisted.
     */
    public CustomWidgetType withAudit(String newCategory, AccessScope newAccessScope, CreatedByType newCreatedBy,
            WidgetVisibility newVisibility, int newVersion, String newCreatedAt, String newUpdatedAt,
            PromotedFromType newPromotedFrom) {
        return new CustomWidgetType(id, name, description, type, newCategory, newAccessScope, defaultSize, querySpec,
                visualizationHint, newCreatedBy, newVisibility, newVersion, newCreatedAt, newUpdatedAt, staticSnapshot,
                snapshotTimestamp, newPromotedFrom);
    }
}
