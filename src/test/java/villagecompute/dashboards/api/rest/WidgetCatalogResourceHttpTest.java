package villagecompute.dashboards.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import villagecompute.dashboards.services.DocumentStore;
import villagecompute.dashboards.services.RowSource;
import villagecompute.dashboards.testing.TestFixtures;

/**
 * HTTP tests for {@link WidgetCatalogResource}.
 */
@QuarkusTest
class WidgetCatalogResourceHttpTest {

    @InjectMock
    DocumentStore documentStore;

    @InjectMock
    RowSource rowSource;

    private String customerId;

    @BeforeEach
    void setUp() {
        TestFixtures.backWithMemory(documentStore);
        customerId = "cust-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Test: Customers see no admin-only built-in widgets.
     */
    @Test
    @TestSecurity(
            user = "user-1")
    void testCatalog_customerScope() {
        given().header(CallerContexts.CUSTOMER_HEADER, customerId).when().get("/api/widgets/catalog").then()
                .statusCode(200).body("built_in.id", hasItem("total_spend"))
                .body("built_in.id", not(hasItem("total_revenue_admin"))).body("custom", empty());
    }

    @Test
    @TestSecurity(
            user = "admin-1",
            roles = {"admin"})
    void testCatalog_adminSeesAdminWidgets() {
        given().when().get("/api/widgets/catalog").then().statusCode(200)
                .body("built_in.id", hasItem("total_revenue_admin"));
    }

    @Test
    @TestSecurity(
            user = "user-1")
    void testCatalog_missingCustomerHeader() {
        given().when().get("/api/widgets/catalog").then().statusCode(400).body("error",
                equalTo("X-Customer-Id header is required for customer users"));
    }

    @Test
    void testCatalog_unauthenticated() {
        given().header(CallerContexts.CUSTOMER_HEADER, customerId).when().get("/api/widgets/catalog").then()
                .statusCode(401);
    }

    @Test
    @TestSecurity(
            user = "user-1")
    void testGetData_builtInKpi() {
        when(rowSource.fetchRows(any(), any())).thenReturn(List.of(Map.of("retail", 12.5)));

        given().header(CallerContexts.CUSTOMER_HEADER, customerId).when().get("/api/widgets/total_spend/data")
                .then().statusCode(200).body("widget_id", equalTo("total_spend")).body("status", equalTo("ready"))
                .body("data.kind", equalTo("kpi")).body("data.value", equalTo(12.5f));
    }

    @Test
    @TestSecurity(
            user = "user-1")
    void testGetData_adminWidgetForbiddenForCustomer() {
        given().header(CallerContexts.CUSTOMER_HEADER, customerId).when()
                .get("/api/widgets/total_revenue_admin/data").then().statusCode(403);

        verify(rowSource, never()).fetchRows(any(), any());
    }

    @Test
    @TestSecurity(
            user = "user-1")
    void testGetData_unknownWidget() {
        given().header(CallerContexts.CUSTOMER_HEADER, customerId).when().get("/api/widgets/nope/data").then()
                .statusCode(404);
    }

    @Test
    @TestSecurity(
            user = "user-1")
    void testGetConstraints_idOverride() {
        given().when().get("/api/widgets/flow_map/constraints").then().statusCode(200)
                .body("min_size", equalTo(3)).body("max_size", equalTo(3)).body("optimal_size", equalTo(3))
                .body("min_height", equalTo(500));
    }

    @Test
    @TestSecurity(
            user = "user-1")
    void testGetConstraints_explicitType() {
        given().queryParam("type", "table").when().get("/api/widgets/my_table/constraints").then().statusCode(200)
                .body("min_size", equalTo(2)).body("min_height", equalTo(300));
    }
}
