package villagecompute.dashboards.widgets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Renderable widget types.
 *
 * <p>
 * The type decides two things: the default size constraints (see
 * {@link villagecompute.dashboards.services.WidgetSizeConstraintResolver}) and the aggregation shape produced by
 * {@link villagecompute.dashboards.services.WidgetAggregationService}.
 *
 * <p>
 * Wire codes are the lowercase snake_case names ({@code kpi}, {@code featured_kpi}, ...). An unknown code decodes to
 * {@code null} so callers can decide between rejecting the document and falling back to {@link #KPI}.
 */
public enum WidgetType {

    KPI("kpi"),
    FEATURED_KPI("featured_kpi"),
    LINE_CHART("line_chart"),
    BAR_CHART("bar_chart"),
    PIE_CHART("pie_chart"),
    TABLE("table"),
    MAP("map"),
    AI_REPORT("ai_report");

    private final String code;

    WidgetType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Decodes a wire code.
     *
     * @param code
     *            code such as {@code bar_chart}; case-insensitive
     * @return the matching type, or {@code null} when the code is blank or unknown
     */
    @JsonCreator
    public static WidgetType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (WidgetType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Aggregation shape used when rendering this type.
     */
    public AggregationShape shape() {
        return switch (this) {
            case KPI, FEATURED_KPI -> AggregationShape.SCALAR;
            case BAR_CHART, PIE_CHART, MAP -> AggregationShape.CATEGORICAL;
            case LINE_CHART -> AggregationShape.CHRONOLOGICAL;
            case TABLE, AI_REPORT -> AggregationShape.TABULAR;
        };
    }

    /**
     * Whether the widget handles its own pointer gestures (pan/zoom). Such widgets never take part in hover reorder.
     */
    public boolean isPointerInteractive() {
        return this == MAP;
    }
}
