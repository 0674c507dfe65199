package villagecompute.dashboards.widgets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregates a query column may request.
 */
public enum AggregateFunction {

    COUNT("count"), SUM("sum"), AVG("avg");

    private final String code;

    AggregateFunction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static AggregateFunction fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (AggregateFunction function : values()) {
            if (function.code.equals(normalized)) {
                return function;
            }
        }
        return null;
    }
}
