package villagecompute.dashboards.services;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.dashboards.api.types.BuiltInWidgetType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.GridActionResultType;
import villagecompute.dashboards.api.types.GridActionResultType.Failure;
import villagecompute.dashboards.api.types.GridStateType;
import villagecompute.dashboards.api.types.ReorderRequestType;
import villagecompute.dashboards.api.types.ResolvedWidgetType;
import villagecompute.dashboards.api.types.SizeConstraintType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ResourceNotFoundException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.observability.DashboardMetrics;
import villagecompute.dashboards.observability.LoggingConfig;
import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.DashboardKind;
import villagecompute.dashboards.widgets.GridMode;
import villagecompute.dashboards.widgets.LayoutOwnerKey;
import villagecompute.dashboards.widgets.OwnerContext;
import villagecompute.dashboards.widgets.WidgetDefinition;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Dashboard grid controller: viewing/editing mode, selection, and every layout mutation a user can make.
 *
 * <p>
 * <b>Modes:</b>
 * <ul>
 * <li>{@code viewing}: add widgets, hover reorder (debounced; pointer-interactive widgets such as maps are
 * refused)</li>
 * <li>{@code editing}: select, remove, resize (clamped), reorder by index; each persisted immediately</li>
 * </ul>
 *
 * <p>
 * A mutation reaches the in-memory view only after the layout store accepted it; a store failure returns
 * {@link Failure#STORE_FAILURE} and the view keeps the last persisted layout. Edit-mode mutations flush a pending hover
 * save first, so saves for one owner never overlap.
 *
 * <p>
 * Sessions are cached per {@link LayoutOwnerKey} and expire after {@code dashboards.grid.session-idle-minutes} without
 * access. The layout is shared by every user of an owner; mode and selection are tracked per acting user.
 */
@ApplicationScoped
public class DashboardGridService {

    private static final Logger LOG = Logger.getLogger(DashboardGridService.class);

    @Inject
    DashboardLayoutService layoutService;

    @Inject
    WidgetRegistryService registryService;

    @Inject
    CustomWidgetService customWidgetService;

    @Inject
    WidgetSizeConstraintResolver sizeResolver;

    @Inject
    WidgetDataService widgetDataService;

    @Inject
    DashboardMetrics metrics;

    @ConfigProperty(
            name = "dashboards.layout.save-debounce-ms",
            defaultValue = "750")
    long saveDebounceMs;

    @ConfigProperty(
            name = "dashboards.grid.session-idle-minutes",
            defaultValue = "30")
    long sessionIdleMinutes;

    private Cache<LayoutOwnerKey, DashboardGridSession> sessions;
    private ScheduledExecutorService debounceExecutor;

    @PostConstruct
    void init() {
        sessions = Caffeine.newBuilder().expireAfterAccess(Duration.ofMinutes(sessionIdleMinutes))
                .maximumSize(10_000).build();
        debounceExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "dashboard-layout-debounce");
            thread.setDaemon(true);
            return thread;
        });
        metrics.registerActiveSessionGauge(() -> sessions.estimatedSize());
        LOG.infof("Dashboard grid ready (save debounce %dms, session idle %d min)", saveDebounceMs,
                sessionIdleMinutes);
    }

    @PreDestroy
    void shutdown() {
        for (DashboardGridSession session : sessions.asMap().values()) {
            synchronized (session) {
                try {
                    flushPending(session);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Failed to flush pending layout save for %s on shutdown", session.key);
                }
            }
        }
        debounceExecutor.shutdownNow();
    }

    /**
     * Current grid state, loading the layout on first access.
     */
    public GridStateType state(DashboardKind kind, OwnerContext owner) {
        DashboardGridSession session = session(kind, owner);
        synchronized (session) {
            return session.snapshot(owner);
        }
    }

    public GridActionResultType enterEdit(DashboardKind kind, OwnerContext owner) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "enter_edit", () -> {
            flushPending(session);
            session.editor(owner).mode = GridMode.EDITING;
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Leaves edit mode. Only the selection is cleared; the layout was persisted as it changed.
     */
    public GridActionResultType exitEdit(DashboardKind kind, OwnerContext owner) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "exit_edit", () -> {
            DashboardGridSession.Editor editor = session.editor(owner);
            editor.mode = GridMode.VIEWING;
            editor.selectedWidgetId = null;
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Selects a widget while editing; {@code null} clears the selection.
     */
    public GridActionResultType selectWidget(DashboardKind kind, OwnerContext owner, String widgetId) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "select_widget", () -> {
            requireEditing(session, owner, "select_widget");
            if (widgetId != null && !session.layout.contains(widgetId)) {
                throw new ResourceNotFoundException("Widget " + widgetId + " is not on this dashboard");
            }
            session.editor(owner).selectedWidgetId = widgetId;
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Adds a widget in either mode. The id must resolve to a built-in or custom definition visible to the owner.
     */
    public GridActionResultType addWidget(DashboardKind kind, OwnerContext owner, String widgetId) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "add_widget", () -> {
            if (widgetId == null || widgetId.isBlank()) {
                throw new ValidationException("Widget id is required");
            }
            if (resolveDefinition(widgetId, owner).isEmpty()) {
                throw new ResourceNotFoundException("Widget not found: " + widgetId);
            }
            flushPending(session);
            session.layout = layoutService.addWidget(session.key, widgetId);
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    public GridActionResultType removeWidget(DashboardKind kind, OwnerContext owner, String widgetId) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "remove_widget", () -> {
            requireEditing(session, owner, "remove_widget");
            if (!session.layout.contains(widgetId)) {
                throw new ResourceNotFoundException("Widget " + widgetId + " is not on this dashboard");
            }
            flushPending(session);
            session.layout = layoutService.removeWidget(session.key, widgetId);
            session.clearSelection(widgetId);
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Resizes a widget while editing. The requested size is clamped to the widget's constraints before it is stored.
     */
    public GridActionResultType changeSize(DashboardKind kind, OwnerContext owner, String widgetId, int size) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "change_size", () -> {
            requireEditing(session, owner, "change_size");
            if (widgetId == null || !session.layout.contains(widgetId)) {
                throw new ResourceNotFoundException("Widget " + widgetId + " is not on this dashboard");
            }
            WidgetType type = resolveDefinition(widgetId, owner).map(WidgetDefinition::type).orElse(null);
            int clamped = sizeResolver.clamp(size, widgetId, type);
            if (clamped != size) {
                LOG.debugf("Clamped size of %s from %d to %d", widgetId, size, clamped);
            }
            flushPending(session);
            session.layout = layoutService.setSize(session.key, widgetId, clamped);
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Moves the widget at {@code oldIndex} to {@code newIndex} while editing.
     */
    public GridActionResultType reorder(DashboardKind kind, OwnerContext owner, ReorderRequestType request) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "reorder", () -> {
            requireEditing(session, owner, "reorder");
            flushPending(session);
            List<String> newOrder = move(session.layout.widgetIds(), request);
            session.layout = layoutService.reorder(session.key, newOrder);
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Reorders by hovering while viewing. The save is debounced: hover reorders within the window coalesce into one
     * write. Pointer-interactive widgets cannot be moved this way.
     *
     * @return {@link GridActionResultType.Outcome#SCHEDULED} when accepted
     */
    public GridActionResultType hoverReorder(DashboardKind kind, OwnerContext owner, ReorderRequestType request) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "hover_reorder", () -> {
            if (session.editor(owner).editing()) {
                throw new WrongModeException("Hover reorder is only available while viewing");
            }
            List<String> current = session.workingOrder();
            requireIndexes(current, request);
            String moving = current.get(request.oldIndex());
            Optional<WidgetDefinition> definition = resolveDefinition(moving, owner);
            if (definition.isPresent() && definition.get().type() != null
                    && definition.get().type().isPointerInteractive()) {
                throw new ValidationException(
                        "Widget " + moving + " handles pointer gestures itself and cannot be hover-reordered");
            }

            session.pendingOrder = move(current, request);
            if (session.pendingSave != null) {
                session.pendingSave.cancel(false);
            }
            session.pendingSave = debounceExecutor.schedule(() -> flushScheduled(session), saveDebounceMs,
                    TimeUnit.MILLISECONDS);
            return GridActionResultType.scheduled(session.snapshot(owner));
        });
    }

    /**
     * Replaces the layout with the dashboard kind's defaults and clears the selection.
     */
    public GridActionResultType resetToDefault(DashboardKind kind, OwnerContext owner) {
        DashboardGridSession session = session(kind, owner);
        return apply(session, owner, "reset", () -> {
            if (session.pendingSave != null) {
                session.pendingSave.cancel(false);
                session.pendingSave = null;
            }
            session.pendingOrder = null;
            session.layout = layoutService.resetToDefault(session.key);
            session.clearSelection(null);
            return GridActionResultType.applied(session.snapshot(owner));
        });
    }

    /**
     * Writes any pending hover reorder for the key now.
     */
    public GridStateType flushPendingSaves(DashboardKind kind, OwnerContext owner) {
        DashboardGridSession session = session(kind, owner);
        synchronized (session) {
            flushPending(session);
            return session.snapshot(owner);
        }
    }

    /**
     * Persisted layout widgets with their definitions and clamped sizes. Ids without a definition are skipped.
     */
    public List<ResolvedWidgetType> resolveWidgets(DashboardKind kind, OwnerContext owner) {
        DashboardGridSession session = session(kind, owner);
        List<String> order;
        synchronized (session) {
            order = List.copyOf(session.layout.widgetIds());
        }

        List<ResolvedWidgetType> resolved = new ArrayList<>(order.size());
        for (String widgetId : order) {
            Optional<WidgetDefinition> definition = resolveDefinition(widgetId, owner);
            if (definition.isEmpty()) {
                LOG.warnf("Skipping unresolvable widget %s on %s", widgetId, session.key);
                continue;
            }
            WidgetDefinition widget = definition.get();
            WidgetType type = widget.type() == null ? WidgetType.KPI : widget.type();
            SizeConstraintType constraints = sizeResolver.getConstraints(widgetId, type);
            int size;
            synchronized (session) {
                size = session.layout.sizes().containsKey(widgetId)
                        ? layoutService.resolveSize(session.layout, widgetId, type)
                        : widget.defaultSize() != null ? sizeResolver.clamp(widget.defaultSize(), widgetId, type)
                                : constraints.optimalSize();
            }
            resolved.add(new ResolvedWidgetType(widgetId, widget, size, constraints, type.isPointerInteractive(),
                    !(widget instanceof BuiltInWidgetType)));
        }
        return resolved;
    }

    /**
     * Calculates every resolvable widget of the dashboard concurrently. Each slot keeps only its latest request; a
     * failing widget yields an error result.
     */
    public List<WidgetResultType> loadWidgetData(DashboardKind kind, OwnerContext owner, ExecutionContextType context) {
        List<ResolvedWidgetType> widgets = resolveWidgets(kind, owner);
        LayoutOwnerKey key = LayoutOwnerKey.of(kind, owner);

        List<CompletableFuture<WidgetResultType>> futures = new ArrayList<>(widgets.size());
        for (ResolvedWidgetType widget : widgets) {
            futures.add(widgetDataService.calculateForSlot(key + ":" + widget.widgetId(), widget.definition(),
                    context));
        }

        List<WidgetResultType> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            String widgetId = widgets.get(i).widgetId();
            try {
                results.add(futures.get(i).join());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Widget %s failed on %s", widgetId, key);
                results.add(WidgetResultType.error(widgetId, "Widget data is unavailable"));
            }
        }
        return results;
    }

    /**
     * Built-in catalog first, then the owner's custom widgets. Admin-scoped widgets resolve only for privileged owners.
     */
    Optional<WidgetDefinition> resolveDefinition(String widgetId, OwnerContext owner) {
        Optional<WidgetDefinition> builtIn = registryService.get(widgetId)
                .filter(widget -> owner.privileged() || widget.accessScope() != AccessScope.ADMIN)
                .map(WidgetDefinition.class::cast);
        if (builtIn.isPresent()) {
            return builtIn;
        }
        try {
            return customWidgetService.find(widgetId, owner).map(WidgetDefinition.class::cast);
        } catch (DocumentStoreException e) {
            LOG.warnf("Could not look up custom widget %s: %s", widgetId, e.getMessage());
            return Optional.empty();
        }
    }

    private DashboardGridSession session(DashboardKind kind, OwnerContext owner) {
        if (kind == null) {
            throw new ValidationException("Dashboard kind is required");
        }
        if (kind.adminOnly() && !owner.privileged()) {
            throw new ValidationException("Dashboard " + kind.code() + " requires admin access");
        }
        LayoutOwnerKey key = LayoutOwnerKey.of(kind, owner);
        return sessions.get(key, k -> new DashboardGridSession(k, layoutService.load(k)));
    }

    private GridActionResultType apply(DashboardGridSession session, OwnerContext owner, String operation,
            Supplier<GridActionResultType> action) {
        synchronized (session) {
            try {
                LoggingConfig.setLayoutOwner(session.key.kind(), session.key.ownerId());
                LoggingConfig.setRequestOrigin("DashboardGridService." + operation);
                return action.get();
            } catch (WrongModeException e) {
                return reject(session, owner, operation, Failure.WRONG_MODE, e);
            } catch (ValidationException e) {
                return reject(session, owner, operation, Failure.INVALID_REQUEST, e);
            } catch (ResourceNotFoundException e) {
                return reject(session, owner, operation, Failure.NOT_FOUND, e);
            } catch (DocumentStoreException e) {
                LOG.errorf(e, "Layout store failed during %s on %s", operation, session.key);
                return reject(session, owner, operation, Failure.STORE_FAILURE, e);
            } finally {
                LoggingConfig.clearMDC();
            }
        }
    }

    private GridActionResultType reject(DashboardGridSession session, OwnerContext owner, String operation,
            Failure failure, RuntimeException e) {
        LOG.debugf("Rejected %s on %s: %s", operation, session.key, e.getMessage());
        metrics.incrementGridRejection(operation, failure.code());
        return GridActionResultType.failed(failure, e.getMessage(), session.snapshot(owner));
    }

    /**
     * Saves a pending hover order now. Caller holds the session monitor. On failure the pending order is dropped and
     * the view falls back to the persisted layout.
     */
    private void flushPending(DashboardGridSession session) {
        if (session.pendingOrder == null) {
            return;
        }
        if (session.pendingSave != null) {
            session.pendingSave.cancel(false);
            session.pendingSave = null;
        }
        List<String> order = session.pendingOrder;
        session.pendingOrder = null;
        session.layout = layoutService.reorder(session.key, order);
    }

    private void flushScheduled(DashboardGridSession session) {
        synchronized (session) {
            try {
                flushPending(session);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Debounced layout save failed for %s", session.key);
                metrics.incrementGridRejection("hover_reorder", Failure.STORE_FAILURE.code());
            }
        }
    }

    private static void requireEditing(DashboardGridSession session, OwnerContext owner, String operation) {
        if (!session.editor(owner).editing()) {
            throw new WrongModeException("Operation " + operation + " requires edit mode");
        }
    }

    private static void requireIndexes(List<String> order, ReorderRequestType request) {
        if (request == null) {
            throw new ValidationException("Reorder request is required");
        }
        int size = order.size();
        if (request.oldIndex() < 0 || request.oldIndex() >= size || request.newIndex() < 0
                || request.newIndex() >= size) {
            throw new ValidationException("Reorder indexes " + request.oldIndex() + " -> " + request.newIndex()
                    + " are outside the layout of " + size + " widgets");
        }
    }

    static List<String> move(List<String> order, ReorderRequestType request) {
        requireIndexes(order, request);
        List<String> moved = new ArrayList<>(order);
        String widgetId = moved.remove(request.oldIndex());
        moved.add(request.newIndex(), widgetId);
        return moved;
    }

    /**
     * Operation not allowed in the current grid mode.
     */
    static final class WrongModeException extends RuntimeException {
        WrongModeException(String message) {
            super(message);
        }
    }
}
