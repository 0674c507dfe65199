package villagecompute.dashboards.widgets;

import java.util.regex.Pattern;

/**
 * Identity of the caller that owns custom widgets and layouts.
 *
 * <p>
 * {@code scopeId} names the namespace inside the scope: the admin's id for {@link OwnerScope#ADMIN}, the customer id
 * for {@link OwnerScope#CUSTOMER}, and is ignored for {@link OwnerScope#SYSTEM}. {@code userId} is the acting user and
 * only ends up in audit fields.
 *
 * @param userId
 *            acting user identifier
 * @param scope
 *            ownership tier
 * @param scopeId
 *            namespace identifier within the tier
 */
public record OwnerContext(String userId, OwnerScope scope, String scopeId) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_.@-]{1,128}");

    public OwnerContext {
        if (scope == null) {
            throw new IllegalArgumentException("Owner scope is required");
        }
        if (scope != OwnerScope.SYSTEM && !isSafeSegment(scopeId)) {
            throw new IllegalArgumentException("Invalid " + scope.code() + " id: " + scopeId);
        }
        if (scope == OwnerScope.SYSTEM) {
            scopeId = null;
        }
    }

    public static OwnerContext system(String userId) {
        return new OwnerContext(userId, OwnerScope.SYSTEM, null);
    }

    public static OwnerContext admin(String adminId) {
        return new OwnerContext(adminId, OwnerScope.ADMIN, adminId);
    }

    public static OwnerContext customer(String customerId, String userId) {
        return new OwnerContext(userId, OwnerScope.CUSTOMER, customerId);
    }

    /**
     * Admins and system operators may see every field and promote widgets.
     */
    public boolean privileged() {
        return !scope.isRestricted();
    }

    /**
     * Document namespace prefix, always ending in {@code /}.
     */
    public String namespace() {
        return switch (scope) {
            case SYSTEM -> "system/";
            case ADMIN -> "admin/" + scopeId + "/";
            case CUSTOMER -> "customer/" + scopeId + "/";
        };
    }

    /**
     * Stable owner identifier used for layout keys and audit fields.
     */
    public String ownerId() {
        return scope == OwnerScope.SYSTEM ? "system" : scopeId;
    }

    static boolean isSafeSegment(String value) {
        return value != null && SEGMENT.matcher(value).matches() && !value.contains("..");
    }
}
