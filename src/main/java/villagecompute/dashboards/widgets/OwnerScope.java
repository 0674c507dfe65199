package villagecompute.dashboards.widgets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ownership tier of a custom widget or dashboard layout.
 */
public enum OwnerScope {

    SYSTEM("system"), ADMIN("admin"), CUSTOMER("customer");

    private final String code;

    OwnerScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static OwnerScope fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (OwnerScope scope : values()) {
            if (scope.code.equals(normalized)) {
                return scope;
            }
        }
        return null;
    }

    /**
     * Customer scopes never see restricted fields.
     */
    public boolean isRestricted() {
        return this == CUSTOMER;
    }
}
