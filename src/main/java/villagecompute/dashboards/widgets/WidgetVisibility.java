package villagecompute.dashboards.widgets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Visibility of a custom widget.
 *
 * <ul>
 * <li>{@code private} - visible to its owning namespace only</li>
 * <li>{@code promoted} - original that has been copied into the system namespace</li>
 * <li>{@code system} - lives in the system namespace and is visible to every scope</li>
 * </ul>
 */
public enum WidgetVisibility {

    PRIVATE("private"), PROMOTED("promoted"), SYSTEM("system");

    private final String code;

    WidgetVisibility(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static WidgetVisibility fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (WidgetVisibility visibility : values()) {
            if (visibility.code.equals(normalized)) {
                return visibility;
            }
        }
        // legacy documents used admin_only for private admin widgets
        return PRIVATE;
    }
}
