package villagecompute.dashboards.api.types;

/**
 * Immutable context handed to every widget calculation. Dynamic filters are bound from here and nowhere else.
 *
 * @param tenantId
 *            tenant (customer) the rows are scoped to; required unless {@code privileged}
 * @param dateRange
 *            active date range, never {@code null}
 * @param privileged
 *            whether restricted fields and admin-scoped widgets are allowed
 */
public record ExecutionContextType(String tenantId, DateRangeType dateRange, boolean privileged) {

    public ExecutionContextType {
        if (dateRange == null) {
            dateRange = DateRangeType.unbounded();
        }
        if (!privileged && (tenantId == null || tenantId.isBlank())) {
            throw new IllegalArgumentException("A tenant id is required for a restricted execution context");
        }
    }

    public static ExecutionContextType forTenant(String tenantId, DateRangeType dateRange) {
        return new ExecutionContextType(tenantId, dateRange, false);
    }

    /**
     * Privileged context, optionally narrowed to a single tenant.
     */
    public static ExecutionContextType privileged(String tenantId, DateRangeType dateRange) {
        return new ExecutionContextType(tenantId, dateRange, true);
    }
}
