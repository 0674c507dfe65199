package villagecompute.dashboards.widgets;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Interaction mode of a dashboard grid session.
 */
public enum GridMode {

    VIEWING("viewing"), EDITING("editing");

    private final String code;

    GridMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
