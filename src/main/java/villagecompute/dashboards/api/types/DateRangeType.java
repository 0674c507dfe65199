package villagecompute.dashboards.api.types;

import java.time.LocalDate;

/**
 * Inclusive date range applied to dynamic date filters. Either bound may be open.
 *
 * @param start
 *            first day, or {@code null}
 * @param end
 *            last day, or {@code null}
 */
public record DateRangeType(LocalDate start, LocalDate end) {

    public DateRangeType {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " is before start " + start);
        }
    }

    public static DateRangeType unbounded() {
        return new DateRangeType(null, null);
    }
}
