package villagecompute.dashboards.api.rest;

import java.security.Principal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import jakarta.ws.rs.core.SecurityContext;
import villagecompute.dashboards.api.types.DateRangeType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.widgets.OwnerContext;

/**
 * Derives owner and execution contexts for REST calls.
 *
 * <p>
 * Role mapping: {@value #ROLE_SYSTEM_ADMIN} acts on the system namespace, {@value #ROLE_ADMIN} on the admin's own
 * namespace, everyone else is a customer user whose customer id arrives in the {@value #CUSTOMER_HEADER} header.
 */
final class CallerContexts {

    static final String ROLE_SYSTEM_ADMIN = "system_admin";
    static final String ROLE_ADMIN = "admin";
    static final String CUSTOMER_HEADER = "X-Customer-Id";

    private CallerContexts() {
    }

    /**
     * @return the caller's owner context, or {@code null} when unauthenticated
     * @throws ValidationException
     *             if a customer user has no valid customer id
     */
    static OwnerContext owner(SecurityContext securityContext, String customerId) {
        if (securityContext == null) {
            return null;
        }
        Principal principal = securityContext.getUserPrincipal();
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return null;
        }

        String userId = principal.getName();
        try {
            if (securityContext.isUserInRole(ROLE_SYSTEM_ADMIN)) {
                return OwnerContext.system(userId);
            }
            if (securityContext.isUserInRole(ROLE_ADMIN)) {
                return OwnerContext.admin(userId);
            }
            // TODO: Take the customer id from a JWT claim once tokens carry it
            if (customerId == null || customerId.isBlank()) {
                throw new ValidationException(CUSTOMER_HEADER + " header is required for customer users");
            }
            return OwnerContext.customer(customerId.trim(), userId);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    /**
     * Execution context for widget calculations. Customers are always pinned to their own tenant; privileged callers
     * may narrow to one customer with {@code customerFilter}.
     */
    static ExecutionContextType execution(OwnerContext owner, String from, String to, String customerFilter) {
        DateRangeType range;
        try {
            range = new DateRangeType(parseDate(from), parseDate(to));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Dates must be ISO-8601 (yyyy-MM-dd)", e);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        if (owner.privileged()) {
            String tenant = customerFilter == null || customerFilter.isBlank() ? null : customerFilter.trim();
            return ExecutionContextType.privileged(tenant, range);
        }
        return ExecutionContextType.forTenant(owner.scopeId(), range);
    }

    private static LocalDate parseDate(String value) {
        return value == null || value.isBlank() ? null : LocalDate.parse(value.trim());
    }
}
