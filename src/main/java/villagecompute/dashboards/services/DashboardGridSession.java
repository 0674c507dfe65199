package villagecompute.dashboards.services;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import villagecompute.dashboards.api.types.GridStateType;
import villagecompute.dashboards.api.types.LayoutDocumentType;
import villagecompute.dashboards.widgets.GridMode;
import villagecompute.dashboards.widgets.LayoutOwnerKey;
import villagecompute.dashboards.widgets.OwnerContext;

/**
 * Mutable grid state for one (dashboard kind, owner). Guarded by its own monitor; callers synchronize on the session.
 *
 * <p>
 * The layout and any pending hover save belong to the owner and are shared by everyone editing that owner's
 * dashboard. Mode and selection belong to the acting user: one user entering edit mode does not put another user of
 * the same customer into edit mode.
 *
 * <p>
 * {@code layout} only ever holds what the layout store accepted. A hover reorder waiting for its debounced save lives in
 * {@code pendingOrder} until it is written.
 */
final class DashboardGridSession {

    /**
     * Per-user view state.
     */
    static final class Editor {
        GridMode mode = GridMode.VIEWING;
        String selectedWidgetId;

        boolean editing() {
            return mode == GridMode.EDITING;
        }
    }

    final LayoutOwnerKey key;

    LayoutDocumentType layout;

    List<String> pendingOrder;
    ScheduledFuture<?> pendingSave;

    private final Map<String, Editor> editors = new HashMap<>();

    DashboardGridSession(LayoutOwnerKey key, LayoutDocumentType layout) {
        this.key = key;
        this.layout = layout;
    }

    /**
     * Editor state of the acting user, created in viewing mode on first use.
     */
    Editor editor(OwnerContext actor) {
        return editors.computeIfAbsent(userKey(actor), user -> new Editor());
    }

    /**
     * Drops {@code widgetId} from every user's selection.
     */
    void clearSelection(String widgetId) {
        for (Editor editor : editors.values()) {
            if (widgetId == null || widgetId.equals(editor.selectedWidgetId)) {
                editor.selectedWidgetId = null;
            }
        }
    }

    /**
     * Order the next hover reorder applies to: the pending hover order, else the persisted one.
     */
    List<String> workingOrder() {
        return pendingOrder != null ? pendingOrder : layout.widgetIds();
    }

    GridStateType snapshot(OwnerContext actor) {
        Editor editor = editor(actor);
        return new GridStateType(key.kind().code(), key.ownerId(), editor.mode, editor.selectedWidgetId, layout,
                pendingOrder != null);
    }

    private static String userKey(OwnerContext actor) {
        return actor.userId() != null ? actor.userId() : actor.ownerId();
    }
}
