package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.dashboards.widgets.GridMode;

/**
 * Snapshot of a grid session: mode, selection and the last persisted layout.
 *
 * @param dashboardKind
 *            dashboard variant code
 * @param ownerId
 *            layout owner
 * @param mode
 *            viewing or editing
 * @param selectedWidgetId
 *            selected widget while editing, or {@code null}
 * @param layout
 *            last persisted layout
 * @param pendingSave
 *            whether a debounced hover reorder is waiting to be saved
 */
public record GridStateType(@JsonProperty("dashboard_kind") String dashboardKind,
        @JsonProperty("owner_id") String ownerId, GridMode mode,
        @JsonProperty("selected_widget_id") String selectedWidgetId, LayoutDocumentType layout,
        @JsonProperty("pending_save") boolean pendingSave) {
}
