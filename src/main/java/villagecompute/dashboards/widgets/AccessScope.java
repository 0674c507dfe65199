package villagecompute.dashboards.widgets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who may see a widget definition. {@link #ADMIN} widgets are hidden from callers without admin capability.
 */
public enum AccessScope {

    ALL("all"), ADMIN("admin");

    private final String code;

    AccessScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static AccessScope fromCode(String code) {
        if (code != null && ADMIN.code.equalsIgnoreCase(code.trim())) {
            return ADMIN;
        }
        return ALL;
    }
}
