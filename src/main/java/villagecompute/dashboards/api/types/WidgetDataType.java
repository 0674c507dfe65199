package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Renderable output of the aggregation pipeline. Serialized with a {@code kind} discriminator; exactly one variant is
 * present per result.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "kind")
@JsonSubTypes({@JsonSubTypes.Type(
        value = KpiDataType.class,
        name = "kpi"),
        @JsonSubTypes.Type(
                value = ChartDataType.class,
                name = "chart"),
        @JsonSubTypes.Type(
                value = TableDataType.class,
                name = "table")})
public interface WidgetDataType {
}
