package villagecompute.dashboards.services;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.dashboards.api.types.CreatedByType;
import villagecompute.dashboards.api.types.CustomWidgetType;
import villagecompute.dashboards.api.types.PromotedFromType;
import villagecompute.dashboards.api.types.WidgetDataType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ResourceNotFoundException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.observability.DashboardMetrics;
import villagecompute.dashboards.observability.LoggingConfig;
import villagecompute.dashboards.services.DocumentStore.BucketType;
import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.OwnerContext;
import villagecompute.dashboards.widgets.OwnerScope;
import villagecompute.dashboards.widgets.WidgetVisibility;

/**
 * Persistence for user and admin authored widget definitions.
 *
 * <p>
 * <b>Namespaces</b> (one JSON document per widget, {@code {namespace}{id}.json}):
 * <ul>
 * <li>{@code system/} - widgets visible to every scope</li>
 * <li>{@code admin/{adminId}/} - an administrator's private widgets</li>
 * <li>{@code customer/{customerId}/} - a customer's widgets</li>
 * </ul>
 * A definition lives in exactly one namespace. Promotion and duplication copy into the target namespace and keep a
 * {@code promoted_from} audit record; they never move a document.
 *
 * <p>
 * <b>Versioning:</b> the first save writes version 1; each later save of the same id increments the version,
 * refreshes {@code updated_at} and preserves {@code created_at} / {@code created_by}.
 *
 * <p>
 * <b>Restricted owners:</b> customer saves are silently narrowed by {@link FieldAccessPolicy}; the save succeeds with
 * every restricted column, filter, group-by and order-by entry removed.
 *
 * <p>
 * <b>Listings</b> skip malformed documents (unparseable JSON, or missing id, name, type or query) with a warning and a
 * metric; one bad document never aborts the listing.
 */
@ApplicationScoped
public class CustomWidgetService {

    private static final Logger LOG = Logger.getLogger(CustomWidgetService.class);

    private static final Pattern WIDGET_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final String DOCUMENT_SUFFIX = ".json";
    private static final String DEFAULT_CATEGORY = "custom";
    private static final String COPY_SUFFIX = " (Copy)";

    @Inject
    DocumentStore documentStore;

    @Inject
    FieldAccessPolicy fieldAccessPolicy;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Tracer tracer;

    @Inject
    DashboardMetrics metrics;

    /**
     * Creates or updates a custom widget in the owner's namespace.
     *
     * @param definition
     *            authored definition; a blank id creates a new widget
     * @param owner
     *            owning namespace and acting user
     * @return the persisted definition, carrying its id and version
     * @throws ValidationException
     *             if name, type or query is missing, or the id is malformed
     * @throws DocumentStoreException
     *             if the document cannot be written
     */
    public CustomWidgetType save(CustomWidgetType definition, OwnerContext owner) {
        Span span = tracer.spanBuilder("custom_widget.save").setAttribute("owner_scope", owner.scope().code())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setOwner(owner);
            LoggingConfig.setRequestOrigin("CustomWidgetService.save");

            validateDraft(definition);

            String widgetId = definition.id() == null || definition.id().isBlank() ? generateId() : definition.id();
            requireValidId(widgetId);
            LoggingConfig.setWidgetId(widgetId);
            span.setAttribute("widget_id", widgetId);

            String path = owner.namespace() + widgetId + DOCUMENT_SUFFIX;
            Optional<CustomWidgetType> existing = readTolerant(path);

            CustomWidgetType candidate = definition.withId(widgetId);
            if (owner.scope().isRestricted()) {
                FieldAccessPolicy.Redaction redaction = fieldAccessPolicy.redact(candidate.querySpec(),
                        candidate.visualizationHint());
                if (redaction.removed() > 0) {
                    LOG.infof("Stripped %d restricted field reference(s) from widget %s saved by %s/%s",
                            redaction.removed(), widgetId, owner.scope().code(), owner.ownerId());
                    metrics.incrementRestrictedFieldsStripped("save", redaction.removed());
                }
                candidate = candidate.withQuery(redaction.spec(), redaction.hint());
            }

            String now = Instant.now().toString();
            AccessScope accessScope = owner.scope().isRestricted() || definition.accessScope() == null
                    ? AccessScope.ALL
                    : definition.accessScope();
            String category = definition.category() == null || definition.category().isBlank() ? DEFAULT_CATEGORY
                    : definition.category();

            CustomWidgetType toPersist;
            if (existing.isPresent()) {
                CustomWidgetType previous = existing.get();
                toPersist = candidate.withAudit(category, accessScope, previous.createdBy(), previous.visibility(),
                        previous.version() + 1, previous.createdAt(), now, previous.promotedFrom())
                        .withSnapshot(previous.staticSnapshot(), previous.snapshotTimestamp());
            } else {
                WidgetVisibility visibility = owner.scope() == OwnerScope.SYSTEM ? WidgetVisibility.SYSTEM
                        : WidgetVisibility.PRIVATE;
                toPersist = candidate.withAudit(category, accessScope,
                        new CreatedByType(owner.userId(), owner.scope(), now), visibility, 1, now, now, null)
                        .withSnapshot(null, null);
            }

            write(path, toPersist);
            span.setAttribute("version", toPersist.version());
            LOG.infof("Saved custom widget %s v%d in %s", widgetId, toPersist.version(), owner.namespace());
            return toPersist;

        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Looks a widget up in the owner's namespace, then in the system namespace.
     */
    public Optional<CustomWidgetType> find(String widgetId, OwnerContext owner) {
        if (widgetId == null || !WIDGET_ID.matcher(widgetId).matches()) {
            return Optional.empty();
        }
        Optional<CustomWidgetType> own = readTolerant(owner.namespace() + widgetId + DOCUMENT_SUFFIX);
        if (own.isPresent() || owner.scope() == OwnerScope.SYSTEM) {
            return own;
        }
        return readTolerant(OwnerContext.system(owner.userId()).namespace() + widgetId + DOCUMENT_SUFFIX)
                .filter(widget -> isVisibleTo(widget, owner));
    }

    /**
     * @throws ResourceNotFoundException
     *             if neither the owner's nor the system namespace holds the widget
     */
    public CustomWidgetType get(String widgetId, OwnerContext owner) {
        return find(widgetId, owner)
                .orElseThrow(() -> new ResourceNotFoundException("Custom widget not found: " + widgetId));
    }

    /**
     * Lists every valid widget of one namespace.
     *
     * @param scope
     *            namespace scope
     * @param ownerId
     *            admin or customer id; ignored for {@link OwnerScope#SYSTEM}
     * @return valid definitions, malformed documents skipped
     */
    public List<CustomWidgetType> listForScope(OwnerScope scope, String ownerId) {
        OwnerContext namespaceOwner = new OwnerContext(ownerId, scope, ownerId);
        String prefix = namespaceOwner.namespace();

        Span span = tracer.spanBuilder("custom_widget.list").setAttribute("prefix", prefix).startSpan();

        try (Scope spanScope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setOwner(namespaceOwner);
            LoggingConfig.setRequestOrigin("CustomWidgetService.listForScope");

            List<CustomWidgetType> widgets = new ArrayList<>();
            int skipped = 0;
            for (String path : documentStore.list(BucketType.CUSTOM_WIDGETS, prefix)) {
                if (!path.endsWith(DOCUMENT_SUFFIX)) {
                    continue;
                }
                try {
                    Optional<CustomWidgetType> widget = read(path);
                    if (widget.isPresent()) {
                        widgets.add(widget.get());
                    }
                } catch (MalformedDocumentException e) {
                    skipped++;
                    LOG.warnf("Skipping malformed custom widget document %s: %s", path, e.getMessage());
                    metrics.incrementDocumentSkipped("custom_widgets", e.reason);
                } catch (DocumentStoreException e) {
                    skipped++;
                    LOG.warnf(e, "Skipping unreadable custom widget document %s", path);
                    metrics.incrementDocumentSkipped("custom_widgets", "unreadable");
                }
            }

            span.setAttribute("widget_count", widgets.size());
            span.setAttribute("skipped_count", skipped);
            LOG.debugf("Listed custom widgets under %s: %d kept, %d skipped", prefix, widgets.size(), skipped);
            return widgets;

        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Widgets the owner can place on a dashboard: its own namespace plus visible system widgets. An own widget
     * shadows a system widget with the same id.
     */
    public List<CustomWidgetType> listVisible(OwnerContext owner) {
        Map<String, CustomWidgetType> byId = new LinkedHashMap<>();
        if (owner.scope() != OwnerScope.SYSTEM) {
            for (CustomWidgetType widget : listForScope(owner.scope(), owner.scopeId())) {
                byId.put(widget.id(), widget);
            }
        }
        for (CustomWidgetType widget : listForScope(OwnerScope.SYSTEM, null)) {
            if (isVisibleTo(widget, owner)) {
                byId.putIfAbsent(widget.id(), widget);
            }
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * Deletes a widget from the owner's namespace. Deleting a missing widget succeeds.
     */
    public void delete(String widgetId, OwnerContext owner) {
        requireValidId(widgetId);
        Span span = tracer.spanBuilder("custom_widget.delete").setAttribute("widget_id", widgetId).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setOwner(owner);
            LoggingConfig.setWidgetId(widgetId);

            documentStore.delete(BucketType.CUSTOM_WIDGETS, owner.namespace() + widgetId + DOCUMENT_SUFFIX);
            LOG.infof("Deleted custom widget %s from %s", widgetId, owner.namespace());

        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Copies a widget into the system namespace.
     *
     * <p>
     * The copy gets a new id, version 1, {@code system} visibility and a {@code promoted_from} record. The original is
     * then deleted, or re-saved with {@code promoted} visibility.
     *
     * @param widgetId
     *            widget to promote
     * @param source
     *            namespace holding the original
     * @param actor
     *            privileged user performing the promotion
     * @param deleteOriginal
     *            whether to remove the original afterwards
     * @return the new system widget
     * @throws ValidationException
     *             if the actor is not privileged
     * @throws ResourceNotFoundException
     *             if the original does not exist in {@code source}
     */
    public CustomWidgetType promoteToSystem(String widgetId, OwnerContext source, OwnerContext actor,
            boolean deleteOriginal) {
        if (!actor.privileged()) {
            throw new ValidationException("Only administrators may promote widgets to system");
        }
        if (source.scope() == OwnerScope.SYSTEM) {
            throw new ValidationException("Widget " + widgetId + " is already a system widget");
        }
        requireValidId(widgetId);

        Span span = tracer.spanBuilder("custom_widget.promote").setAttribute("widget_id", widgetId)
                .setAttribute("delete_original", deleteOriginal).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setOwner(actor);
            LoggingConfig.setWidgetId(widgetId);

            String originalPath = source.namespace() + widgetId + DOCUMENT_SUFFIX;
            CustomWidgetType original = readTolerant(originalPath).orElseThrow(
                    () -> new ResourceNotFoundException("Custom widget not found: " + source.namespace() + widgetId));

            String now = Instant.now().toString();
            OwnerContext system = OwnerContext.system(actor.userId());
            CustomWidgetType copy = original.withId(generateId()).withAudit(original.category(),
                    original.accessScope(), new CreatedByType(actor.userId(), OwnerScope.SYSTEM, now),
                    WidgetVisibility.SYSTEM, 1, now, now, auditOf(original, source, actor, now));
            write(system.namespace() + copy.id() + DOCUMENT_SUFFIX, copy);

            if (deleteOriginal) {
                documentStore.delete(BucketType.CUSTOM_WIDGETS, originalPath);
            } else {
                CustomWidgetType marked = original.withAudit(original.category(), original.accessScope(),
                        original.createdBy(), WidgetVisibility.PROMOTED, original.version() + 1, original.createdAt(),
                        now, original.promotedFrom());
                write(originalPath, marked);
            }

            LOG.infof("Promoted custom widget %s from %s to system widget %s", widgetId, source.namespace(),
                    copy.id());
            return copy;

        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Copies a widget (typically a customer's) into an administrator's private namespace under a new id.
     */
    public CustomWidgetType duplicateToAdmin(String widgetId, OwnerContext source, OwnerContext admin) {
        if (admin.scope() != OwnerScope.ADMIN) {
            throw new ValidationException("Widgets can only be duplicated into an admin namespace");
        }
        requireValidId(widgetId);

        CustomWidgetType original = readTolerant(source.namespace() + widgetId + DOCUMENT_SUFFIX).orElseThrow(
                () -> new ResourceNotFoundException("Custom widget not found: " + source.namespace() + widgetId));

        String now = Instant.now().toString();
        CustomWidgetType copy = original.withId(generateId()).withName(original.name() + COPY_SUFFIX).withAudit(
                original.category(), original.accessScope(), new CreatedByType(admin.userId(), OwnerScope.ADMIN, now),
                WidgetVisibility.PRIVATE, 1, now, now, auditOf(original, source, admin, now));
        write(admin.namespace() + copy.id() + DOCUMENT_SUFFIX, copy);

        LOG.infof("Duplicated custom widget %s from %s to %s as %s", widgetId, source.namespace(), admin.namespace(),
                copy.id());
        return copy;
    }

    /**
     * Stores a static snapshot so the widget is served without querying. A {@code null} snapshot unfreezes it.
     * Freezing counts as an update and bumps the version.
     */
    public CustomWidgetType freeze(String widgetId, OwnerContext owner, WidgetDataType snapshot) {
        requireValidId(widgetId);
        String path = owner.namespace() + widgetId + DOCUMENT_SUFFIX;
        CustomWidgetType existing = readTolerant(path)
                .orElseThrow(() -> new ResourceNotFoundException("Custom widget not found: " + widgetId));

        String now = Instant.now().toString();
        CustomWidgetType updated = existing.withSnapshot(snapshot, snapshot == null ? null : now).withAudit(
                existing.category(), existing.accessScope(), existing.createdBy(), existing.visibility(),
                existing.version() + 1, existing.createdAt(), now, existing.promotedFrom());
        write(path, updated);

        LOG.infof("%s custom widget %s (v%d)", snapshot == null ? "Unfroze" : "Froze", widgetId, updated.version());
        return updated;
    }

    private boolean isVisibleTo(CustomWidgetType widget, OwnerContext owner) {
        return owner.privileged() || widget.accessScope() != AccessScope.ADMIN;
    }

    private PromotedFromType auditOf(CustomWidgetType original, OwnerContext source, OwnerContext actor,
            String now) {
        return new PromotedFromType(original.id(), source.scope(), source.ownerId(), original.version(), now,
                actor.userId());
    }

    /**
     * Reads a single document, treating a malformed one as absent.
     */
    private Optional<CustomWidgetType> readTolerant(String path) {
        try {
            return read(path);
        } catch (MalformedDocumentException e) {
            LOG.warnf("Ignoring malformed custom widget document %s: %s", path, e.getMessage());
            metrics.incrementDocumentSkipped("custom_widgets", e.reason);
            return Optional.empty();
        }
    }

    private Optional<CustomWidgetType> read(String path) {
        Optional<byte[]> bytes = documentStore.get(BucketType.CUSTOM_WIDGETS, path);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        CustomWidgetType widget;
        try {
            widget = objectMapper.readValue(bytes.get(), CustomWidgetType.class);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("unparseable", "Invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new MalformedDocumentException("unparseable", "Unreadable document: " + e.getMessage());
        }
        if (widget == null || widget.id() == null || widget.id().isBlank() || widget.name() == null
                || widget.name().isBlank() || widget.type() == null || widget.querySpec() == null) {
            throw new MalformedDocumentException("missing_fields", "Missing id, name, type or query_spec");
        }
        return Optional.of(widget);
    }

    private void write(String path, CustomWidgetType widget) {
        try {
            documentStore.put(BucketType.CUSTOM_WIDGETS, path, objectMapper.writeValueAsBytes(widget));
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize custom widget %s", widget.id());
            throw new DocumentStoreException("Failed to serialize custom widget " + widget.id(), e);
        }
    }

    private void validateDraft(CustomWidgetType definition) {
        if (definition == null) {
            throw new ValidationException("Widget definition is required");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ValidationException("Widget name is required");
        }
        if (definition.type() == null) {
            throw new ValidationException("Widget type is required");
        }
        if (definition.querySpec() == null) {
            throw new ValidationException("Widget query_spec is required");
        }
    }

    private static void requireValidId(String widgetId) {
        if (widgetId == null || !WIDGET_ID.matcher(widgetId).matches()) {
            throw new ValidationException("Invalid widget id: " + widgetId);
        }
    }

    static String generateId() {
        return "widget_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Raised internally when a stored document cannot be turned into a valid definition.
     */
    static final class MalformedDocumentException extends RuntimeException {

        final String reason;

        MalformedDocumentException(String reason, String message) {
            super(message);
            this.reason = reason;
        }
    }
}
