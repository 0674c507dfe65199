package villagecompute.dashboards.data.models;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.hibernate.annotations.Immutable;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Read-only mapping of the {@code shipments} relation that built-in widgets query.
 *
 * <p>
 * Widget queries run as native SQL through {@link villagecompute.dashboards.services.NativeQueryRowSource}; this
 * mapping documents the columns the built-in catalog relies on. The application never writes shipments.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code load_id} (TEXT, PK) - Shipment identifier</li>
 * <li>{@code customer_id} (TEXT) - Owning customer; the tenant column of every widget query</li>
 * <li>{@code customer_name} (TEXT) - Customer display name (admin widgets)</li>
 * <li>{@code pickup_date} (DATE) - Date range column</li>
 * <li>{@code pickup_month} (TEXT) - {@code yyyy-MM} bucket of the pickup date</li>
 * <li>{@code mode_name}, {@code carrier_name} (TEXT) - Breakdown categories</li>
 * <li>{@code lane}, {@code destination_state} (TEXT) - Geographic categories</li>
 * <li>{@code retail} (NUMERIC) - Amount billed to the customer</li>
 * <li>{@code cost}, {@code margin_percent} (NUMERIC) - Restricted; never shown to customer users</li>
 * </ul>
 */
@Entity
@Immutable
@Table(
        name = "shipments")
public class Shipment extends PanacheEntityBase {

    @Id
    @Column(
            name = "load_id",
            nullable = false)
    public String loadId;

    @Column(
            name = "customer_id",
            nullable = false)
    public String customerId;

    @Column(
            name = "customer_name")
    public String customerName;

    @Column(
            name = "pickup_date")
    public LocalDate pickupDate;

    @Column(
            name = "pickup_month")
    public String pickupMonth;

    @Column(
            name = "mode_name")
    public String modeName;

    @Column(
            name = "carrier_name")
    public String carrierName;

    @Column(
            name = "lane")
    public String lane;

    @Column(
            name = "destination_state")
    public String destinationState;

    @Column(
            name = "retail",
            precision = 12,
            scale = 2)
    public BigDecimal retail;

    @Column(
            name = "cost",
            precision = 12,
            scale = 2)
    public BigDecimal cost;

    @Column(
            name = "margin_percent",
            precision = 7,
            scale = 4)
    public BigDecimal marginPercent;
}
