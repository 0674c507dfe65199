package villagecompute.dashboards.services;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.dashboards.api.types.LayoutDocumentType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ResourceNotFoundException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.observability.DashboardMetrics;
import villagecompute.dashboards.observability.LoggingConfig;
import villagecompute.dashboards.services.DocumentStore.BucketType;
import villagecompute.dashboards.widgets.LayoutOwnerKey;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Persistence for dashboard layouts, one document per (dashboard kind, owner).
 *
 * <p>
 * Documents are replaced wholesale on every save. Writes for the same {@link LayoutOwnerKey} are serialized with a
 * per-key lock, so each read-modify-write sees the previous write; different owners never contend.
 *
 * <p>
 * A missing document loads as an empty layout. An unreadable one is logged and also treated as empty, so a corrupted
 * layout never blocks a dashboard from rendering.
 */
@ApplicationScoped
public class DashboardLayoutService {

    private static final Logger LOG = Logger.getLogger(DashboardLayoutService.class);

    @Inject
    DocumentStore documentStore;

    @Inject
    WidgetSizeConstraintResolver sizeResolver;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Tracer tracer;

    @Inject
    DashboardMetrics metrics;

    // Weak values: a key's lock is only reclaimed once no thread holds or waits on it
    private final Cache<LayoutOwnerKey, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

    /**
     * Loads a layout, normalized (no repeated ids, no sizes for absent widgets).
     *
     * @return the stored layout, or an empty layout when none exists yet
     * @throws DocumentStoreException
     *             if the store cannot be read
     */
    public LayoutDocumentType load(LayoutOwnerKey key) {
        Optional<byte[]> bytes = documentStore.get(BucketType.DASHBOARD_LAYOUTS, key.path());
        if (bytes.isEmpty()) {
            LOG.debugf("No layout stored for %s, using empty layout", key);
            return LayoutDocumentType.empty();
        }
        try {
            LayoutDocumentType document = objectMapper.readValue(bytes.get(), LayoutDocumentType.class);
            if (document == null) {
                return LayoutDocumentType.empty();
            }
            if (document.schemaVersion() > LayoutDocumentType.CURRENT_SCHEMA_VERSION) {
                LOG.warnf("Layout %s has newer schema v%d than supported v%d", key, document.schemaVersion(),
                        LayoutDocumentType.CURRENT_SCHEMA_VERSION);
            }
            return document.normalized();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to parse layout %s, treating it as empty", key);
            metrics.incrementDocumentSkipped("dashboard_layouts", "unparseable");
            return LayoutDocumentType.empty();
        }
    }

    /**
     * Replaces the stored layout.
     *
     * @throws ValidationException
     *             if ids repeat or are blank, or a size refers to a widget not in the layout
     * @throws DocumentStoreException
     *             if the write fails
     */
    public LayoutDocumentType save(LayoutOwnerKey key, LayoutDocumentType document) {
        validate(document);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            write(key, document);
            return document;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a widget unless it is already present.
     */
    public LayoutDocumentType addWidget(LayoutOwnerKey key, String widgetId) {
        requireId(widgetId);
        return mutate(key, "add_widget", current -> {
            if (current.contains(widgetId)) {
                return current;
            }
            List<String> ids = new ArrayList<>(current.widgetIds());
            ids.add(widgetId);
            return current.withWidgetIds(ids);
        });
    }

    /**
     * Removes a widget and its size override. Removing an absent widget is a no-op.
     */
    public LayoutDocumentType removeWidget(LayoutOwnerKey key, String widgetId) {
        requireId(widgetId);
        return mutate(key, "remove_widget", current -> {
            if (!current.contains(widgetId) && !current.sizes().containsKey(widgetId)) {
                return current;
            }
            return current.without(widgetId);
        });
    }

    /**
     * Replaces the widget order.
     *
     * @param newOrder
     *            must contain exactly the stored ids, each once
     * @throws ValidationException
     *             if {@code newOrder} is not a permutation of the stored ids; nothing is written
     */
    public LayoutDocumentType reorder(LayoutOwnerKey key, List<String> newOrder) {
        if (newOrder == null) {
            throw new ValidationException("New widget order is required");
        }
        return mutate(key, "reorder", current -> {
            requirePermutation(current.widgetIds(), newOrder);
            if (current.widgetIds().equals(newOrder)) {
                return current;
            }
            return current.withWidgetIds(newOrder);
        });
    }

    /**
     * Stores a size override as requested. Callers clamp first; {@link #resolveSize} clamps again before use.
     *
     * @throws ResourceNotFoundException
     *             if the widget is not in the layout
     */
    public LayoutDocumentType setSize(LayoutOwnerKey key, String widgetId, int size) {
        requireId(widgetId);
        return mutate(key, "set_size", current -> {
            if (!current.contains(widgetId)) {
                throw new ResourceNotFoundException("Widget " + widgetId + " is not on dashboard " + key);
            }
            Integer existing = current.sizes().get(widgetId);
            if (existing != null && existing == size) {
                return current;
            }
            return current.withSize(widgetId, size);
        });
    }

    /**
     * Writes the dashboard kind's default widget list, dropping all size overrides.
     */
    public LayoutDocumentType resetToDefault(LayoutOwnerKey key) {
        LayoutDocumentType defaults = LayoutDocumentType.of(key.kind().defaultWidgetIds());
        LOG.infof("Resetting layout %s to %d default widgets", key, defaults.widgetIds().size());
        return save(key, defaults);
    }

    /**
     * Effective size of a widget: the stored override clamped to its constraints, or the optimal size.
     */
    public int resolveSize(LayoutDocumentType document, String widgetId, WidgetType widgetType) {
        Integer stored = document.sizes().get(widgetId);
        if (stored == null) {
            return sizeResolver.getDefaultSize(widgetId, widgetType);
        }
        return sizeResolver.clamp(stored, widgetId, widgetType);
    }

    /**
     * Read-modify-write under the key's lock. When {@code change} returns the same instance nothing is written.
     */
    LayoutDocumentType mutate(LayoutOwnerKey key, String operation, UnaryOperator<LayoutDocumentType> change) {
        Span span = tracer.spanBuilder("layout." + operation).setAttribute("dashboard_kind", key.kind().code())
                .setAttribute("owner_id", key.ownerId()).startSpan();

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setLayoutOwner(key.kind(), key.ownerId());
            LoggingConfig.setRequestOrigin("DashboardLayoutService." + operation);

            LayoutDocumentType current = load(key);
            LayoutDocumentType next = change.apply(current);
            if (next == current) {
                span.setAttribute("changed", false);
                return current;
            }
            write(key, next);
            span.setAttribute("changed", true);
            span.setAttribute("widget_count", next.widgetIds().size());
            return next;

        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            lock.unlock();
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private void write(LayoutOwnerKey key, LayoutDocumentType document) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize layout %s", key);
            throw new DocumentStoreException("Failed to serialize layout " + key, e);
        }
        try {
            documentStore.put(BucketType.DASHBOARD_LAYOUTS, key.path(), json);
            metrics.incrementLayoutSave(key.kind().code(), true);
            LOG.debugf("Saved layout %s (%d widgets)", key, document.widgetIds().size());
        } catch (DocumentStoreException e) {
            metrics.incrementLayoutSave(key.kind().code(), false);
            throw e;
        }
    }

    ReentrantLock lockFor(LayoutOwnerKey key) {
        return locks.get(key, k -> new ReentrantLock());
    }

    private static void validate(LayoutDocumentType document) {
        if (document == null) {
            throw new ValidationException("Layout document is required");
        }
        Set<String> seen = new HashSet<>();
        for (String widgetId : document.widgetIds()) {
            requireId(widgetId);
            if (!seen.add(widgetId)) {
                throw new ValidationException("Widget " + widgetId + " appears more than once in the layout");
            }
        }
        for (String widgetId : document.sizes().keySet()) {
            if (!seen.contains(widgetId)) {
                throw new ValidationException("Size given for widget " + widgetId + " which is not in the layout");
            }
        }
    }

    private static void requirePermutation(List<String> current, List<String> newOrder) {
        Set<String> proposed = new HashSet<>(newOrder);
        if (proposed.size() != newOrder.size()) {
            throw new ValidationException("New widget order contains repeated ids");
        }
        if (newOrder.size() != current.size() || !proposed.equals(new HashSet<>(current))) {
            Set<String> missing = new HashSet<>(current);
            missing.removeAll(proposed);
            Set<String> extra = new HashSet<>(proposed);
            extra.removeAll(current);
            throw new ValidationException(
                    "New widget order must be a permutation of the current widgets (missing " + missing + ", unexpected "
                            + extra + ")");
        }
    }

    private static void requireId(String widgetId) {
        if (widgetId == null || widgetId.isBlank()) {
            throw new ValidationException("Widget id is required");
        }
    }
}
