package villagecompute.dashboards.observability;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Custom dashboard metrics, exported in Prometheus format at {@code /q/metrics}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code dashboards_documents_skipped_total{store,reason}} - malformed documents skipped while
 * listing or loading</li>
 * <li><b>Counters:</b> {@code dashboards_restricted_fields_stripped_total{stage}} - restricted field references removed
 * at save or execution time</li>
 * <li><b>Counters:</b> {@code dashboards_widget_calculations_total{type,status}} - widget calculation outcomes</li>
 * <li><b>Timers:</b> {@code dashboards_widget_calculation_duration{type}} - widget calculation latency</li>
 * <li><b>Counters:</b> {@code dashboards_layout_saves_total{kind,result}} - layout document writes</li>
 * <li><b>Counters:</b> {@code dashboards_grid_rejections_total{operation,failure}} - rejected grid operations</li>
 * <li><b>Gauges:</b> {@code dashboards_grid_sessions_active} - cached grid sessions</li>
 * </ul>
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class DashboardMetrics {

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> calculationCounters = new ConcurrentHashMap<>();

    public void incrementDocumentSkipped(String store, String reason) {
        Counter.builder("dashboards_documents_skipped_total").description("Malformed documents skipped")
                .tags(List.of(Tag.of("store", store), Tag.of("reason", reason))).register(registry).increment();
    }

    public void incrementRestrictedFieldsStripped(String stage, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("dashboards_restricted_fields_stripped_total")
                .description("Restricted field references removed from widget queries").tag("stage", stage)
                .register(registry).increment(count);
    }

    public void recordWidgetCalculation(String widgetType, String status, long latencyMs) {
        String key = widgetType + ":" + status;
        Counter counter = calculationCounters.computeIfAbsent(key,
                k -> Counter.builder("dashboards_widget_calculations_total")
                        .description("Widget calculations by outcome")
                        .tags(List.of(Tag.of("type", widgetType), Tag.of("status", status))).register(registry));
        counter.increment();

        Timer.builder("dashboards_widget_calculation_duration").tag("type", widgetType).register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void incrementLayoutSave(String dashboardKind, boolean success) {
        Counter.builder("dashboards_layout_saves_total").description("Layout document writes")
                .tags(List.of(Tag.of("kind", dashboardKind), Tag.of("result", success ? "success" : "failure")))
                .register(registry).increment();
    }

    public void incrementGridRejection(String operation, String failure) {
        Counter.builder("dashboards_grid_rejections_total").description("Rejected grid operations")
                .tags(List.of(Tag.of("operation", operation), Tag.of("failure", failure))).register(registry)
                .increment();
    }

    public void registerActiveSessionGauge(Supplier<Number> activeSessions) {
        Gauge.builder("dashboards_grid_sessions_active", activeSessions).description("Cached dashboard grid sessions")
                .register(registry);
    }
}
