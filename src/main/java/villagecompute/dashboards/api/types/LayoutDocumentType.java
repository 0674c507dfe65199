package villagecompute.dashboards.api.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted layout of one dashboard: ordered widget ids plus per-widget size overrides.
 *
 * <p>
 * The document is replaced wholesale on every save. Older documents stored the order under {@code layout} and the
 * sizes under {@code widgetSizes}; both names are still accepted on read.
 *
 * @param widgetIds
 *            ordered widget ids, each at most once
 * @param sizes
 *            size level overrides keyed by widget id
 * @param schemaVersion
 *            document schema version
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record LayoutDocumentType(@JsonProperty("widget_ids") @JsonAlias({"layout", "widgetIds"}) List<String> widgetIds,
        @JsonAlias("widgetSizes") Map<String, Integer> sizes, @JsonProperty("schema_version") Integer schemaVersion) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public LayoutDocumentType {
        widgetIds = widgetIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(widgetIds));
        sizes = sizes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sizes));
        if (schemaVersion == null) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
    }

    public static LayoutDocumentType empty() {
        return new LayoutDocumentType(List.of(), Map.of(), CURRENT_SCHEMA_VERSION);
    }

    public static LayoutDocumentType of(List<String> widgetIds) {
        return new LayoutDocumentType(widgetIds, Map.of(), CURRENT_SCHEMA_VERSION);
    }

    public boolean contains(String widgetId) {
        return widgetIds.contains(widgetId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return widgetIds.isEmpty();
    }

    /**
     * Repairs documents written by older clients: blank and repeated ids are dropped (first occurrence wins) and sizes
     * of widgets not in the sequence are discarded.
     */
    public LayoutDocumentType normalized() {
        Set<String> unique = new LinkedHashSet<>();
        for (String widgetId : widgetIds) {
            if (widgetId != null && !widgetId.isBlank()) {
                unique.add(widgetId);
            }
        }
        Map<String, Integer> keptSizes = new LinkedHashMap<>();
        sizes.forEach((widgetId, size) -> {
            if (size != null && unique.contains(widgetId)) {
                keptSizes.put(widgetId, size);
            }
        });
        return new LayoutDocumentType(new ArrayList<>(unique), keptSizes, CURRENT_SCHEMA_VERSION);
    }

    public LayoutDocumentType withWidgetIds(List<String> newWidgetIds) {
        return new LayoutDocumentType(newWidgetIds, sizes, schemaVersion);
    }

    public LayoutDocumentType withSize(String widgetId, int size) {
        Map<String, Integer> newSizes = new LinkedHashMap<>(sizes);
        newSizes.put(widgetId, size);
        return new LayoutDocumentType(widgetIds, newSizes, schemaVersion);
    }

    public LayoutDocumentType without(String widgetId) {
        List<String> newIds = new ArrayList<>(widgetIds);
        newIds.remove(widgetId);
        Map<String, Integer> newSizes = new LinkedHashMap<>(sizes);
        newSizes.remove(widgetId);
        return new LayoutDocumentType(newIds, newSizes, schemaVersion);
    }
}
