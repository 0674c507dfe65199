package villagecompute.dashboards.api.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.dashboards.testing.TestFixtures;

class LayoutDocumentTypeTest {

    private final ObjectMapper objectMapper = TestFixtures.objectMapper();

    @Test
    void testNormalized_dropsBlankRepeatedAndOrphans() {
        LayoutDocumentType document = new LayoutDocumentType(Arrays.asList("a", null, "b", "a", " "),
                Map.of("a", 2, "orphan", 1), 1);

        LayoutDocumentType normalized = document.normalized();

        assertEquals(List.of("a", "b"), normalized.widgetIds());
        assertEquals(Map.of("a", 2), normalized.sizes());
    }

    @Test
    void testWithoutRemovesSize() {
        LayoutDocumentType document = new LayoutDocumentType(List.of("a", "b"), Map.of("a", 2), null);

        LayoutDocumentType removed = document.without("a");

        assertEquals(List.of("b"), removed.widgetIds());
        assertTrue(removed.sizes().isEmpty());
        assertEquals(LayoutDocumentType.CURRENT_SCHEMA_VERSION, removed.schemaVersion());
    }

    /**
     * Test: The stored form uses snake_case keys and reads back equal.
     */
    @Test
    void testJsonShape() throws Exception {
        LayoutDocumentType document = new LayoutDocumentType(List.of("total_spend", "top_lanes"),
                Map.of("top_lanes", 3), null);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsBytes(document));

        assertEquals("total_spend", json.get("widget_ids").get(0).asText());
        assertEquals(3, json.get("sizes").get("top_lanes").asInt());
        assertEquals(1, json.get("schema_version").asInt());
        assertEquals(3, json.size());
        assertEquals(document, objectMapper.treeToValue(json, LayoutDocumentType.class));
    }

    @Test
    void testDateRangeOrder() {
        assertThrows(IllegalArgumentException.class,
                () -> new DateRangeType(java.time.LocalDate.of(2024, 2, 1), java.time.LocalDate.of(2024, 1, 1)));
        assertThrows(IllegalArgumentException.class, () -> ExecutionContextType.forTenant(" ", null));
    }
}
