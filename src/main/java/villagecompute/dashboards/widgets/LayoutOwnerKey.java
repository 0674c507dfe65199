package villagecompute.dashboards.widgets;

/**
 * Identifies one layout document: a dashboard kind plus the owner that customizes it.
 *
 * @param kind
 *            dashboard variant
 * @param ownerId
 *            owner identifier (customer id, admin id or {@code system})
 */
public record LayoutOwnerKey(DashboardKind kind, String ownerId) {

    public LayoutOwnerKey {
        if (kind == null) {
            throw new IllegalArgumentException("Dashboard kind is required");
        }
        if (!OwnerContext.isSafeSegment(ownerId)) {
            throw new IllegalArgumentException("Invalid layout owner id: " + ownerId);
        }
    }

    public static LayoutOwnerKey of(DashboardKind kind, OwnerContext owner) {
        return new LayoutOwnerKey(kind, owner.ownerId());
    }

    /**
     * Document path inside the layout bucket.
     */
    public String path() {
        return kind.code() + "/" + ownerId + ".json";
    }

    @Override
    public String toString() {
        return kind.code() + ":" + ownerId;
    }
}
