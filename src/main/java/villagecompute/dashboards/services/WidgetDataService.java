package villagecompute.dashboards.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.dashboards.api.types.DateRangeType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.QueryFilterType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.VisualizationHintType;
import villagecompute.dashboards.api.types.WidgetDataType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.observability.DashboardMetrics;
import villagecompute.dashboards.observability.LoggingConfig;
import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.WidgetDefinition;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * The one place a widget definition turns into data, for built-in and custom widgets alike.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Frozen widgets return their static snapshot without querying.</li>
 * <li>Admin-scoped widgets fail in a non-privileged context.</li>
 * <li>Restricted contexts get the query redacted again, whatever was stored.</li>
 * <li>Dynamic filters are bound from the {@link ExecutionContextType}: the tenant column takes the tenant id,
 * {@code gt/gte} take the range start, {@code lt/lte} the range end, {@code between} both. A dynamic filter with no
 * context value is dropped. The tenant filter is always added from the context and never taken from the stored
 * spec in a restricted context.</li>
 * <li>Rows are fetched from the {@link RowSource} and aggregated for the widget type.</li>
 * </ol>
 *
 * <p>
 * Failures become {@link WidgetResultType.Status#ERROR} results so one widget never takes down a dashboard.
 */
@ApplicationScoped
public class WidgetDataService {

    private static final Logger LOG = Logger.getLogger(WidgetDataService.class);

    static final String LEGACY_TENANT_FIELD = "tenant_id";

    @Inject
    RowSource rowSource;

    @Inject
    WidgetAggregationService aggregationService;

    @Inject
    FieldAccessPolicy fieldAccessPolicy;

    @Inject
    Tracer tracer;

    @Inject
    DashboardMetrics metrics;

    @ConfigProperty(
            name = "dashboards.row-source.tenant-column",
            defaultValue = "customer_id")
    String tenantColumn;

    // Weak values: a slot's counter lives as long as a request for it is in flight
    private final Cache<String, AtomicLong> slotGenerations = Caffeine.newBuilder().weakValues().build();

    /**
     * Calculates one widget.
     *
     * @param definition
     *            built-in or custom definition
     * @param context
     *            tenant, date range and privilege of the caller
     * @return a result; never throws for data or query problems
     */
    public WidgetResultType calculate(WidgetDefinition definition, ExecutionContextType context) {
        WidgetType type = definition.type() == null ? WidgetType.KPI : definition.type();

        if (definition.staticSnapshot() != null) {
            LOG.debugf("Serving frozen snapshot for widget %s", definition.id());
            metrics.recordWidgetCalculation(type.code(), "frozen", 0);
            return WidgetResultType.frozen(definition.id(), definition.staticSnapshot(),
                    definition.snapshotTimestamp());
        }

        Span span = tracer.spanBuilder("widget.calculate").setAttribute("widget_id", definition.id())
                .setAttribute("widget_type", type.code()).setAttribute("privileged", context.privileged())
                .startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setWidgetId(definition.id());
            LoggingConfig.setRequestOrigin("WidgetDataService.calculate");

            if (definition.accessScope() == AccessScope.ADMIN && !context.privileged()) {
                LOG.warnf("Refusing admin widget %s in a restricted context", definition.id());
                metrics.recordWidgetCalculation(type.code(), WidgetResultType.Status.ERROR.code(),
                        System.currentTimeMillis() - startTime);
                return WidgetResultType.error(definition.id(), "Widget is not available");
            }
            if (definition.querySpec() == null) {
                metrics.recordWidgetCalculation(type.code(), WidgetResultType.Status.ERROR.code(),
                        System.currentTimeMillis() - startTime);
                return WidgetResultType.error(definition.id(), "Widget has no query");
            }

            QuerySpecType spec = definition.querySpec();
            VisualizationHintType hint = definition.visualizationHint();
            if (!context.privileged()) {
                FieldAccessPolicy.Redaction redaction = fieldAccessPolicy.redact(spec, hint);
                if (redaction.removed() > 0) {
                    LOG.warnf("Stripped %d restricted field references from widget %s at execution",
                            redaction.removed(), definition.id());
                    metrics.incrementRestrictedFieldsStripped("execution", redaction.removed());
                }
                spec = redaction.spec();
                hint = redaction.hint();
            }

            QuerySpecType resolved = bindContext(spec, context);
            List<Map<String, Object>> rows = rowSource.fetchRows(resolved, context);
            WidgetDataType data = aggregationService.aggregate(resolved, type, rows, hint);

            WidgetResultType result = rows == null || rows.isEmpty() ? WidgetResultType.empty(definition.id(), data)
                    : WidgetResultType.ready(definition.id(), data);

            long latencyMs = System.currentTimeMillis() - startTime;
            metrics.recordWidgetCalculation(type.code(), result.status().code(), latencyMs);
            span.setAttribute("row_count", rows == null ? 0 : rows.size());
            span.setAttribute("status", result.status().code());
            LOG.debugf("Calculated widget %s from %d rows (%dms)", definition.id(), rows == null ? 0 : rows.size(),
                    latencyMs);
            return result;

        } catch (RuntimeException e) {
            span.recordException(e);
            metrics.recordWidgetCalculation(type.code(), WidgetResultType.Status.ERROR.code(),
                    System.currentTimeMillis() - startTime);
            LOG.errorf(e, "Failed to calculate widget %s: %s", definition.id(), e.getMessage());
            return WidgetResultType.error(definition.id(), "Widget data is unavailable");

        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Calculates a widget asynchronously for a display slot. Only the latest request for a slot delivers data; a result
     * that completes after a newer request for the same slot comes back {@link WidgetResultType.Status#STALE}.
     *
     * @param slotKey
     *            identifies the display slot, e.g. {@code pulse:cust-42:monthly_spend}
     */
    public CompletableFuture<WidgetResultType> calculateForSlot(String slotKey, WidgetDefinition definition,
            ExecutionContextType context) {
        AtomicLong generation = slotGenerations.get(slotKey, key -> new AtomicLong());
        long requested = generation.incrementAndGet();

        return CompletableFuture.supplyAsync(() -> calculate(definition, context)).handle((result, error) -> {
            if (generation.get() != requested) {
                LOG.debugf("Discarding superseded result for slot %s", slotKey);
                return WidgetResultType.stale(definition.id());
            }
            if (error != null) {
                LOG.errorf(error, "Widget %s failed in slot %s", definition.id(), slotKey);
                return WidgetResultType.error(definition.id(), "Widget data is unavailable");
            }
            return result;
        });
    }

    /**
     * Replaces stored filters with the ones this context allows.
     */
    QuerySpecType bindContext(QuerySpecType spec, ExecutionContextType context) {
        DateRangeType range = context.dateRange();
        List<QueryFilterType> filters = new ArrayList<>();

        for (QueryFilterType filter : spec.filters()) {
            if (isTenantField(filter.field())) {
                if (!filter.dynamic() && context.privileged()) {
                    filters.add(filter);
                }
                continue;
            }
            if (!filter.dynamic()) {
                filters.add(filter);
                continue;
            }

            String operator = filter.operator() == null ? "" : filter.operator().toLowerCase(Locale.ROOT);
            Object value = switch (operator) {
                case "gt", "gte" -> range.start();
                case "lt", "lte" -> range.end();
                case "between" -> range.start() != null && range.end() != null ? List.of(range.start(), range.end())
                        : null;
                default -> null;
            };
            if (value == null) {
                LOG.debugf("Dropping dynamic filter %s %s with no context value", filter.field(), operator);
                continue;
            }
            filters.add(filter.withValue(value));
        }

        if (context.tenantId() != null && !context.tenantId().isBlank()) {
            filters.add(QueryFilterType.fixed(tenantColumn, "eq", context.tenantId()));
        }
        return spec.withFilters(filters);
    }

    private boolean isTenantField(String field) {
        if (field == null) {
            return false;
        }
        String normalized = field.trim().toLowerCase(Locale.ROOT);
        int dot = normalized.lastIndexOf('.');
        if (dot >= 0) {
            normalized = normalized.substring(dot + 1);
        }
        return normalized.equals(tenantColumn.toLowerCase(Locale.ROOT)) || normalized.equals(LEGACY_TENANT_FIELD);
    }
}
