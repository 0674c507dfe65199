package villagecompute.dashboards.services;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.dashboards.api.types.SizeConstraintType;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Resolves layout size constraints for a widget from its type and id.
 *
 * <p>
 * <b>Resolution order:</b>
 * <ol>
 * <li>Per-type default table. Every {@link WidgetType} has an entry; a {@code null} type resolves to the KPI
 * default.</li>
 * <li>Per-id override table. Overrides are partial and may narrow or widen any field.</li>
 * <li>Normalization to the 1..3 scale with {@code min <= optimal <= max}.</li>
 * </ol>
 *
 * <p>
 * All methods are pure and total. Out-of-range sizes are clamped, never rejected.
 *
 * <p>
 * <b>Size levels:</b> 1 = small (one column), 2 = medium, 3 = large (full row).
 */
@ApplicationScoped
public class WidgetSizeConstraintResolver {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 3;

    private static final Map<WidgetType, SizeConstraintType> TYPE_DEFAULTS = buildTypeDefaults();

    // Geo widgets need width to stay legible; breakdown pies stay compact.
    private static final Map<String, SizeOverride> ID_OVERRIDES = Map.of("flow_map", new SizeOverride(3, 3, 3, 500),
            "cost_by_state", new SizeOverride(2, 3, 3, 400), "carrier_mix", new SizeOverride(1, 2, 1, 200),
            "top_lanes", new SizeOverride(2, 3, 2, 320), "monthly_spend", new SizeOverride(2, 3, 2, 280));

    /**
     * Partial override; {@code null} fields keep the type default.
     */
    record SizeOverride(Integer minSize, Integer maxSize, Integer optimalSize, Integer minHeight) {
    }

    private static Map<WidgetType, SizeConstraintType> buildTypeDefaults() {
        Map<WidgetType, SizeConstraintType> defaults = new EnumMap<>(WidgetType.class);
        for (WidgetType type : WidgetType.values()) {
            defaults.put(type, typeDefault(type));
        }
        return defaults;
    }

    // Exhaustive switch: adding a WidgetType without a default fails compilation.
    private static SizeConstraintType typeDefault(WidgetType type) {
        return switch (type) {
            case KPI -> new SizeConstraintType(1, 3, 1, 120);
            case FEATURED_KPI -> new SizeConstraintType(1, 3, 1, 140);
            case PIE_CHART -> new SizeConstraintType(1, 2, 1, 200);
            case BAR_CHART, LINE_CHART -> new SizeConstraintType(2, 3, 2, 280);
            case TABLE -> new SizeConstraintType(2, 3, 2, 300);
            case MAP -> new SizeConstraintType(2, 3, 3, 400);
            case AI_REPORT -> new SizeConstraintType(2, 3, 2, 320);
        };
    }

    /**
     * Returns the constraints for a widget.
     *
     * @param widgetId
     *            widget id, may be {@code null}
     * @param widgetType
     *            widget type, may be {@code null}
     * @return constraints satisfying {@code 1 <= min <= optimal <= max <= 3}
     */
    public SizeConstraintType getConstraints(String widgetId, WidgetType widgetType) {
        SizeConstraintType base = TYPE_DEFAULTS.get(widgetType == null ? WidgetType.KPI : widgetType);
        SizeOverride override = widgetId == null ? null : ID_OVERRIDES.get(widgetId);
        if (override == null) {
            return base;
        }
        int minSize = override.minSize() != null ? override.minSize() : base.minSize();
        int maxSize = override.maxSize() != null ? override.maxSize() : base.maxSize();
        int optimalSize = override.optimalSize() != null ? override.optimalSize() : base.optimalSize();
        int minHeight = override.minHeight() != null ? override.minHeight() : base.minHeight();
        return normalize(minSize, maxSize, optimalSize, minHeight);
    }

    /**
     * Clamps a requested size into the widget's allowed range.
     */
    public int clamp(int requestedSize, String widgetId, WidgetType widgetType) {
        SizeConstraintType constraints = getConstraints(widgetId, widgetType);
        return Math.max(Math.min(requestedSize, constraints.maxSize()), constraints.minSize());
    }

    public boolean isValid(int size, String widgetId, WidgetType widgetType) {
        SizeConstraintType constraints = getConstraints(widgetId, widgetType);
        return size >= constraints.minSize() && size <= constraints.maxSize();
    }

    /**
     * Size used when a layout carries no override for the widget.
     */
    public int getDefaultSize(String widgetId, WidgetType widgetType) {
        return getConstraints(widgetId, widgetType).optimalSize();
    }

    /**
     * Ids with a dedicated override entry.
     */
    public Set<String> overriddenWidgetIds() {
        return ID_OVERRIDES.keySet();
    }

    private static SizeConstraintType normalize(int minSize, int maxSize, int optimalSize, int minHeight) {
        int min = bound(minSize);
        int max = Math.max(bound(maxSize), min);
        int optimal = Math.max(Math.min(bound(optimalSize), max), min);
        return new SizeConstraintType(min, max, optimal, Math.max(minHeight, 0));
    }

    private static int bound(int level) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }
}
