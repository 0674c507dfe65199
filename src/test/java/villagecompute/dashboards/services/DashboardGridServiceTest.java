package villagecompute.dashboards.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.dashboards.api.types.CustomWidgetType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.GridActionResultType;
import villagecompute.dashboards.api.types.GridActionResultType.Failure;
import villagecompute.dashboards.api.types.GridActionResultType.Outcome;
import villagecompute.dashboards.api.types.GridStateType;
import villagecompute.dashboards.api.types.QueryColumnType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.ReorderRequestType;
import villagecompute.dashboards.api.types.ResolvedWidgetType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.services.DocumentStore.BucketType;
import villagecompute.dashboards.testing.InMemoryDocumentStore;
import villagecompute.dashboards.testing.TestFixtures;
import villagecompute.dashboards.widgets.AggregateFunction;
import villagecompute.dashboards.widgets.DashboardKind;
import villagecompute.dashboards.widgets.GridMode;
import villagecompute.dashboards.widgets.LayoutOwnerKey;
import villagecompute.dashboards.widgets.OwnerContext;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Unit tests for {@link DashboardGridService}.
 *
 * <p>
 * Test coverage:
 * <ul>
 * <li>Viewing/editing mode rules and selection</li>
 * <li>Add, remove, resize and reorder persisted before the view changes</li>
 * <li>Store failures leaving the view unchanged</li>
 * <li>Hover reorder: map exclusion, debounce coalescing and flushing</li>
 * <li>Widget resolution and concurrent data loading</li>
 * </ul>
 */
class DashboardGridServiceTest {

    private static final DashboardKind KIND = DashboardKind.PULSE;
    private static final OwnerContext OWNER = OwnerContext.customer("cust-42", "user-1");
    private static final String LAYOUT_PATH = "pulse/cust-42.json";

    private DashboardGridService service;
    private InMemoryDocumentStore store;
    private DashboardLayoutService layoutService;
    private CustomWidgetService customWidgetService;
    private WidgetDataService widgetDataService;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryDocumentStore();
        WidgetSizeConstraintResolver sizeResolver = new WidgetSizeConstraintResolver();

        layoutService = new DashboardLayoutService();
        TestFixtures.setField(layoutService, "documentStore", store);
        TestFixtures.setField(layoutService, "sizeResolver", sizeResolver);
        TestFixtures.setField(layoutService, "objectMapper", TestFixtures.objectMapper());
        TestFixtures.setField(layoutService, "tracer", TestFixtures.tracer());
        TestFixtures.setField(layoutService, "metrics", TestFixtures.metrics());

        customWidgetService = mock(CustomWidgetService.class);
        when(customWidgetService.find(anyString(), any())).thenReturn(Optional.empty());
        widgetDataService = mock(WidgetDataService.class);

        service = new DashboardGridService();
        TestFixtures.setField(service, "layoutService", layoutService);
        TestFixtures.setField(service, "registryService", new WidgetRegistryService());
        TestFixtures.setField(service, "customWidgetService", customWidgetService);
        TestFixtures.setField(service, "sizeResolver", sizeResolver);
        TestFixtures.setField(service, "widgetDataService", widgetDataService);
        TestFixtures.setField(service, "metrics", TestFixtures.metrics());
        TestFixtures.setField(service, "saveDebounceMs", 60_000L);
        TestFixtures.setField(service, "sessionIdleMinutes", 30L);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void testState_initiallyViewingEmptyLayout() {
        GridStateType state = service.state(KIND, OWNER);

        assertEquals(GridMode.VIEWING, state.mode());
        assertEquals("pulse", state.dashboardKind());
        assertEquals("cust-42", state.ownerId());
        assertTrue(state.layout().isEmpty());
        assertFalse(state.pendingSave());
    }

    /**
     * Test: Remove, resize, reorder and select are refused while viewing.
     */
    @Test
    void testEditOperations_requireEditMode() {
        service.addWidget(KIND, OWNER, "total_spend");

        assertFailure(Failure.WRONG_MODE, service.removeWidget(KIND, OWNER, "total_spend"));
        assertFailure(Failure.WRONG_MODE, service.changeSize(KIND, OWNER, "total_spend", 2));
        assertFailure(Failure.WRONG_MODE, service.reorder(KIND, OWNER, new ReorderRequestType(0, 0)));
        assertFailure(Failure.WRONG_MODE, service.selectWidget(KIND, OWNER, "total_spend"));
        assertEquals(List.of("total_spend"), service.state(KIND, OWNER).layout().widgetIds());
    }

    @Test
    void testEditMode_selectionLifecycle() {
        service.addWidget(KIND, OWNER, "total_spend");

        assertEquals(GridMode.EDITING, service.enterEdit(KIND, OWNER).state().mode());
        GridActionResultType selected = service.selectWidget(KIND, OWNER, "total_spend");
        assertEquals(Outcome.APPLIED, selected.outcome());
        assertEquals("total_spend", selected.state().selectedWidgetId());
        assertFailure(Failure.NOT_FOUND, service.selectWidget(KIND, OWNER, "monthly_spend"));

        GridActionResultType exited = service.exitEdit(KIND, OWNER);
        assertEquals(GridMode.VIEWING, exited.state().mode());
        assertNull(exited.state().selectedWidgetId());
        assertEquals(List.of("total_spend"), exited.state().layout().widgetIds());
    }

    /**
     * Test: Edit mode belongs to the user who entered it, not to every user of the same customer.
     */
    @Test
    void testEditMode_isPerUser() {
        OwnerContext colleague = OwnerContext.customer("cust-42", "user-2");
        service.addWidget(KIND, OWNER, "total_shipments");
        service.enterEdit(KIND, OWNER);

        GridActionResultType refused = service.removeWidget(KIND, colleague, "total_shipments");

        assertFailure(Failure.WRONG_MODE, refused);
        assertEquals(GridMode.VIEWING, refused.state().mode());
        assertEquals(List.of("total_shipments"), service.state(KIND, OWNER).layout().widgetIds());

        service.enterEdit(KIND, colleague);
        service.exitEdit(KIND, colleague);
        assertEquals(GridMode.EDITING, service.state(KIND, OWNER).mode());
        assertEquals(GridMode.VIEWING, service.state(KIND, colleague).mode());
    }

    /**
     * Test: Users of one customer share the layout, and removing a widget clears it from every user's selection.
     */
    @Test
    void testLayout_sharedAcrossUsersOfOwner() {
        OwnerContext colleague = OwnerContext.customer("cust-42", "user-2");
        service.addWidget(KIND, OWNER, "total_spend");
        service.addWidget(KIND, colleague, "monthly_spend");
        service.enterEdit(KIND, OWNER);
        service.selectWidget(KIND, OWNER, "monthly_spend");
        service.enterEdit(KIND, colleague);

        service.removeWidget(KIND, colleague, "monthly_spend");

        GridStateType state = service.state(KIND, OWNER);
        assertEquals(List.of("total_spend"), state.layout().widgetIds());
        assertNull(state.selectedWidgetId());
    }

    /**
     * Test: Adding persists first; unknown widgets and admin widgets for customers are not found.
     */
    @Test
    void testAddWidget() {
        GridActionResultType added = service.addWidget(KIND, OWNER, "monthly_spend");

        assertEquals(Outcome.APPLIED, added.outcome());
        assertEquals(List.of("monthly_spend"), added.state().layout().widgetIds());
        assertEquals(List.of("monthly_spend"), layoutService.load(LayoutOwnerKey.of(KIND, OWNER)).widgetIds());

        assertFailure(Failure.NOT_FOUND, service.addWidget(KIND, OWNER, "no_such_widget"));
        assertFailure(Failure.NOT_FOUND, service.addWidget(KIND, OWNER, "total_revenue_admin"));
        assertFailure(Failure.INVALID_REQUEST, service.addWidget(KIND, OWNER, " "));
    }

    @Test
    void testAddWidget_customWidget() {
        CustomWidgetType custom = CustomWidgetType.draft("widget_1", "Mine", WidgetType.KPI,
                new QuerySpecType("shipments", List.of(QueryColumnType.aggregate("retail", AggregateFunction.SUM)),
                        List.of(), List.of(), List.of(), null),
                null);
        when(customWidgetService.find("widget_1", OWNER)).thenReturn(Optional.of(custom));

        assertEquals(Outcome.APPLIED, service.addWidget(KIND, OWNER, "widget_1").outcome());

        List<ResolvedWidgetType> resolved = service.resolveWidgets(KIND, OWNER);
        assertEquals(1, resolved.size());
        assertTrue(resolved.get(0).custom());
        assertEquals(custom, resolved.get(0).definition());
    }

    @Test
    void testRemoveWidget_clearsSelection() {
        service.addWidget(KIND, OWNER, "total_spend");
        service.addWidget(KIND, OWNER, "monthly_spend");
        service.enterEdit(KIND, OWNER);
        service.selectWidget(KIND, OWNER, "total_spend");

        GridActionResultType removed = service.removeWidget(KIND, OWNER, "total_spend");

        assertEquals(List.of("monthly_spend"), removed.state().layout().widgetIds());
        assertNull(removed.state().selectedWidgetId());
        assertFailure(Failure.NOT_FOUND, service.removeWidget(KIND, OWNER, "total_spend"));
    }

    /**
     * Test: Requested sizes are clamped to the widget's constraints before being stored.
     */
    @Test
    void testChangeSize_clamped() {
        service.addWidget(KIND, OWNER, "carrier_mix");
        service.enterEdit(KIND, OWNER);

        GridActionResultType resized = service.changeSize(KIND, OWNER, "carrier_mix", 3);

        assertEquals(Integer.valueOf(2), resized.state().layout().sizes().get("carrier_mix"));
        assertFailure(Failure.NOT_FOUND, service.changeSize(KIND, OWNER, "monthly_spend", 2));
    }

    @Test
    void testReorder() {
        addAll("total_shipments", "total_spend", "monthly_spend");
        service.enterEdit(KIND, OWNER);

        GridActionResultType reordered = service.reorder(KIND, OWNER, new ReorderRequestType(2, 0));

        assertEquals(List.of("monthly_spend", "total_shipments", "total_spend"),
                reordered.state().layout().widgetIds());
        assertFailure(Failure.INVALID_REQUEST, service.reorder(KIND, OWNER, new ReorderRequestType(0, 3)));
        assertFailure(Failure.INVALID_REQUEST, service.reorder(KIND, OWNER, null));
    }

    /**
     * Test: When the store rejects a write, the view keeps showing the last persisted layout.
     */
    @Test
    void testStoreFailure_viewUnchanged() {
        addAll("total_shipments", "total_spend");
        service.enterEdit(KIND, OWNER);
        store.setFailWrites(true);

        GridActionResultType failedAdd = service.addWidget(KIND, OWNER, "monthly_spend");
        GridActionResultType failedReorder = service.reorder(KIND, OWNER, new ReorderRequestType(1, 0));

        assertFailure(Failure.STORE_FAILURE, failedAdd);
        assertFailure(Failure.STORE_FAILURE, failedReorder);
        assertEquals(List.of("total_shipments", "total_spend"), service.state(KIND, OWNER).layout().widgetIds());
    }

    @Test
    void testHoverReorder_refusedWhileEditing() {
        addAll("total_shipments", "total_spend");
        service.enterEdit(KIND, OWNER);

        assertFailure(Failure.WRONG_MODE, service.hoverReorder(KIND, OWNER, new ReorderRequestType(0, 1)));
    }

    /**
     * Test: Pointer-interactive (map) widgets cannot be moved by hovering.
     */
    @Test
    void testHoverReorder_mapWidgetRejected() {
        addAll("total_shipments", "cost_by_state");

        assertFailure(Failure.INVALID_REQUEST, service.hoverReorder(KIND, OWNER, new ReorderRequestType(1, 0)));
        assertFailure(Failure.INVALID_REQUEST, service.hoverReorder(KIND, OWNER, new ReorderRequestType(0, 5)));
        assertFalse(service.state(KIND, OWNER).pendingSave());
    }

    /**
     * Test: Successive hover reorders coalesce into one save, and nothing is shown before it is written.
     */
    @Test
    void testHoverReorder_debouncedIntoSingleSave() {
        addAll("total_shipments", "total_spend", "monthly_spend");
        int writesBefore = store.writeCount();

        GridActionResultType first = service.hoverReorder(KIND, OWNER, new ReorderRequestType(0, 2));
        GridActionResultType second = service.hoverReorder(KIND, OWNER, new ReorderRequestType(0, 1));

        assertEquals(Outcome.SCHEDULED, first.outcome());
        assertEquals(Outcome.SCHEDULED, second.outcome());
        assertTrue(second.state().pendingSave());
        assertEquals(List.of("total_shipments", "total_spend", "monthly_spend"),
                second.state().layout().widgetIds());
        assertEquals(writesBefore, store.writeCount());

        GridStateType flushed = service.flushPendingSaves(KIND, OWNER);

        assertEquals(writesBefore + 1, store.writeCount());
        assertFalse(flushed.pendingSave());
        assertEquals(List.of("monthly_spend", "total_spend", "total_shipments"), flushed.layout().widgetIds());
        assertTrue(store.getRaw(BucketType.DASHBOARD_LAYOUTS, LAYOUT_PATH).orElseThrow()
                .contains("[\"monthly_spend\",\"total_spend\",\"total_shipments\"]"));
    }

    @Test
    void testHoverReorder_savedAfterDebounceWindow() throws Exception {
        TestFixtures.setField(service, "saveDebounceMs", 50L);
        addAll("total_shipments", "total_spend");

        service.hoverReorder(KIND, OWNER, new ReorderRequestType(1, 0));

        long deadline = System.currentTimeMillis() + 5_000;
        while (service.state(KIND, OWNER).pendingSave() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(List.of("total_spend", "total_shipments"), service.state(KIND, OWNER).layout().widgetIds());
    }

    /**
     * Test: Entering edit mode writes a pending hover order first so saves never overlap.
     */
    @Test
    void testEnterEdit_flushesPendingHover() {
        addAll("total_shipments", "total_spend");
        service.hoverReorder(KIND, OWNER, new ReorderRequestType(1, 0));

        GridActionResultType editing = service.enterEdit(KIND, OWNER);

        assertFalse(editing.state().pendingSave());
        assertEquals(List.of("total_spend", "total_shipments"), editing.state().layout().widgetIds());
    }

    @Test
    void testResetToDefault_dropsPendingHover() {
        addAll("total_shipments", "total_spend");
        service.hoverReorder(KIND, OWNER, new ReorderRequestType(1, 0));

        GridActionResultType reset = service.resetToDefault(KIND, OWNER);

        assertEquals(KIND.defaultWidgetIds(), reset.state().layout().widgetIds());
        assertFalse(reset.state().pendingSave());
        assertEquals(KIND.defaultWidgetIds(), service.flushPendingSaves(KIND, OWNER).layout().widgetIds());
    }

    /**
     * Test: Unknown ids in a stored layout are skipped; sizes fall back to the optimal size or a clamped override.
     */
    @Test
    void testResolveWidgets() {
        store.putRaw(BucketType.DASHBOARD_LAYOUTS, LAYOUT_PATH,
                "{\"widget_ids\":[\"total_spend\",\"retired_widget\",\"carrier_mix\",\"flow_map\"],"
                        + "\"sizes\":{\"carrier_mix\":3}}");

        List<ResolvedWidgetType> resolved = service.resolveWidgets(KIND, OWNER);

        assertEquals(List.of("total_spend", "carrier_mix", "flow_map"),
                resolved.stream().map(ResolvedWidgetType::widgetId).toList());
        assertEquals(1, resolved.get(0).size());
        assertEquals(2, resolved.get(1).size());
        assertEquals(3, resolved.get(2).size());
        assertTrue(resolved.get(2).interactive());
        assertFalse(resolved.get(0).custom());
    }

    @Test
    void testResolveDefinition_customStoreDown() {
        when(customWidgetService.find(anyString(), any())).thenThrow(new DocumentStoreException("down"));

        assertTrue(service.resolveDefinition("widget_1", OWNER).isEmpty());
        assertTrue(service.resolveDefinition("total_spend", OWNER).isPresent());
    }

    @Test
    void testAdminDashboard_requiresPrivilege() {
        assertThrows(ValidationException.class, () -> service.state(DashboardKind.ADMIN_DASHBOARD, OWNER));
        assertEquals(GridMode.VIEWING,
                service.state(DashboardKind.ADMIN_DASHBOARD, OwnerContext.admin("admin-7")).mode());
    }

    /**
     * Test: Each widget is calculated in its own slot and a failing slot becomes an error result.
     */
    @Test
    void testLoadWidgetData() {
        addAll("total_shipments", "total_spend");
        ExecutionContextType context = ExecutionContextType.forTenant("cust-42", null);
        when(widgetDataService.calculateForSlot(eq("pulse:cust-42:total_shipments"), any(), eq(context)))
                .thenReturn(CompletableFuture.completedFuture(WidgetResultType.empty("total_shipments", null)));
        when(widgetDataService.calculateForSlot(eq("pulse:cust-42:total_spend"), any(), eq(context)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        List<WidgetResultType> results = service.loadWidgetData(KIND, OWNER, context);

        assertEquals(2, results.size());
        assertEquals(WidgetResultType.Status.EMPTY, results.get(0).status());
        assertEquals(WidgetResultType.Status.ERROR, results.get(1).status());
        assertEquals("total_spend", results.get(1).widgetId());
        verify(widgetDataService).calculateForSlot(eq("pulse:cust-42:total_spend"), any(), eq(context));
    }

    @Test
    void testMove() {
        assertEquals(List.of("b", "c", "a"), DashboardGridService.move(List.of("a", "b", "c"),
                new ReorderRequestType(0, 2)));
        assertEquals(List.of("a", "b", "c"), DashboardGridService.move(List.of("a", "b", "c"),
                new ReorderRequestType(1, 1)));
    }

    private void addAll(String... widgetIds) {
        for (String widgetId : widgetIds) {
            assertEquals(Outcome.APPLIED, service.addWidget(KIND, OWNER, widgetId).outcome());
        }
    }

    private static void assertFailure(Failure expected, GridActionResultType result) {
        assertEquals(Outcome.FAILED, result.outcome());
        assertEquals(expected, result.failure());
    }
}
