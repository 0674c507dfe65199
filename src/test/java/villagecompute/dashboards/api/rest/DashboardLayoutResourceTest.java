package villagecompute.dashboards.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.Principal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import villagecompute.dashboards.api.types.AddWidgetRequestType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.GridActionResultType;
import villagecompute.dashboards.api.types.GridActionResultType.Failure;
import villagecompute.dashboards.api.types.GridStateType;
import villagecompute.dashboards.api.types.LayoutDocumentType;
import villagecompute.dashboards.api.types.ReorderRequestType;
import villagecompute.dashboards.api.types.SizeChangeRequestType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.services.DashboardGridService;
import villagecompute.dashboards.widgets.DashboardKind;
import villagecompute.dashboards.widgets.GridMode;
import villagecompute.dashboards.widgets.OwnerContext;

/**
 * Unit tests for {@link DashboardLayoutResource}.
 */
class DashboardLayoutResourceTest {

    @Mock
    DashboardGridService gridService;

    @Mock
    SecurityContext securityContext;

    @Mock
    Principal principal;

    @InjectMocks
    DashboardLayoutResource resource;

    private GridStateType state;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        when(securityContext.getUserPrincipal()).thenReturn(principal);
        when(principal.getName()).thenReturn("user-1");

        state = new GridStateType("pulse", "cust-42", GridMode.VIEWING, null,
                LayoutDocumentType.of(List.of("total_spend")), false);
    }

    @Test
    void testGetState_success() {
        when(gridService.state(DashboardKind.PULSE, OwnerContext.customer("cust-42", "user-1"))).thenReturn(state);

        Response response = resource.getState("pulse", securityContext, "cust-42");

        assertEquals(200, response.getStatus());
        assertSame(state, response.getEntity());
    }

    @Test
    void testGetState_unauthenticated() {
        when(securityContext.getUserPrincipal()).thenReturn(null);

        Response response = resource.getState("pulse", securityContext, "cust-42");

        assertEquals(401, response.getStatus());
    }

    @Test
    void testGetState_customerWithoutHeader() {
        Response response = resource.getState("pulse", securityContext, null);

        assertEquals(400, response.getStatus());
        assertInstanceOf(DashboardLayoutResource.ErrorResponse.class, response.getEntity());
    }

    @Test
    void testGetState_unknownKind() {
        Response response = resource.getState("reports", securityContext, "cust-42");

        assertEquals(404, response.getStatus());
    }

    /**
     * Test: Customers cannot open the admin dashboard; admins can.
     */
    @Test
    void testAdminDashboard_access() {
        Response forbidden = resource.getState("admin_dashboard", securityContext, "cust-42");

        when(securityContext.isUserInRole(CallerContexts.ROLE_ADMIN)).thenReturn(true);
        when(gridService.state(DashboardKind.ADMIN_DASHBOARD, OwnerContext.admin("user-1"))).thenReturn(state);
        Response allowed = resource.getState("admin_dashboard", securityContext, null);

        assertEquals(403, forbidden.getStatus());
        assertEquals(200, allowed.getStatus());
    }

    @Test
    void testAddWidget_applied() {
        when(gridService.addWidget(any(), any(), eq("total_spend"))).thenReturn(GridActionResultType.applied(state));

        Response response = resource.addWidget("pulse", new AddWidgetRequestType("total_spend"), securityContext,
                "cust-42");

        assertEquals(200, response.getStatus());
    }

    @Test
    void testAddWidget_missingBody() {
        Response response = resource.addWidget("pulse", null, securityContext, "cust-42");

        assertEquals(400, response.getStatus());
        verify(gridService, never()).addWidget(any(), any(), any());
    }

    @Test
    void testHoverReorder_scheduled() {
        when(gridService.hoverReorder(any(), any(), any())).thenReturn(GridActionResultType.scheduled(state));

        Response response = resource.hoverReorder("pulse", new ReorderRequestType(0, 1), securityContext, "cust-42");

        assertEquals(202, response.getStatus());
    }

    /**
     * Test: Failure kinds map to 400, 409, 404 and 503.
     */
    @Test
    void testToResponse_failures() {
        assertEquals(400, DashboardLayoutResource
                .toResponse(GridActionResultType.failed(Failure.INVALID_REQUEST, "bad", state)).getStatus());
        assertEquals(409, DashboardLayoutResource
                .toResponse(GridActionResultType.failed(Failure.WRONG_MODE, "mode", state)).getStatus());
        assertEquals(404, DashboardLayoutResource
                .toResponse(GridActionResultType.failed(Failure.NOT_FOUND, "gone", state)).getStatus());
        assertEquals(503, DashboardLayoutResource
                .toResponse(GridActionResultType.failed(Failure.STORE_FAILURE, "down", state)).getStatus());
    }

    @Test
    void testChangeSize_wrongMode() {
        when(gridService.changeSize(any(), any(), eq("total_spend"), eq(2)))
                .thenReturn(GridActionResultType.failed(Failure.WRONG_MODE, "requires edit mode", state));

        Response response = resource.changeSize("pulse", new SizeChangeRequestType("total_spend", 2),
                securityContext, "cust-42");

        assertEquals(409, response.getStatus());
    }

    @Test
    void testGetWidgets_storeUnavailable() {
        when(gridService.resolveWidgets(any(), any())).thenThrow(new DocumentStoreException("down"));

        Response response = resource.getWidgets("pulse", securityContext, "cust-42");

        assertEquals(503, response.getStatus());
    }

    /**
     * Test: Customers are pinned to their own tenant even when asking for another customer's data.
     */
    @Test
    void testGetData_customerTenantPinned() {
        when(gridService.loadWidgetData(any(), any(), any())).thenReturn(List.of());

        Response response = resource.getData("pulse", "2024-01-01", "2024-03-31", "cust-99", securityContext,
                "cust-42");

        assertEquals(200, response.getStatus());
        ArgumentCaptor<ExecutionContextType> captor = ArgumentCaptor.forClass(ExecutionContextType.class);
        verify(gridService).loadWidgetData(eq(DashboardKind.PULSE), any(), captor.capture());
        assertEquals("cust-42", captor.getValue().tenantId());
        assertEquals(LocalDate.of(2024, 1, 1), captor.getValue().dateRange().start());
    }

    @Test
    void testGetData_invalidDates() {
        assertEquals(400,
                resource.getData("pulse", "01/02/2024", null, null, securityContext, "cust-42").getStatus());
        assertEquals(400,
                resource.getData("pulse", "2024-03-01", "2024-01-01", null, securityContext, "cust-42").getStatus());
    }
}
