package villagecompute.dashboards.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import villagecompute.dashboards.api.types.BuiltInWidgetType;
import villagecompute.dashboards.api.types.ChartDataType;
import villagecompute.dashboards.api.types.ChartPointType;
import villagecompute.dashboards.api.types.CustomWidgetType;
import villagecompute.dashboards.api.types.DateRangeType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.KpiDataType;
import villagecompute.dashboards.api.types.QueryColumnType;
import villagecompute.dashboards.api.types.QueryFilterType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.api.types.VisualizationHintType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.testing.TestFixtures;
import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.AggregateFunction;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * Unit tests for {@link WidgetDataService}.
 *
 * <p>
 * Test coverage:
 * <ul>
 * <li>Binding dynamic filters from the execution context</li>
 * <li>Tenant isolation for restricted contexts</li>
 * <li>Admin widget refusal and restricted field stripping at execution</li>
 * <li>Frozen snapshots, empty results and failures</li>
 * <li>Superseded slot requests</li>
 * </ul>
 */
class WidgetDataServiceTest {

    private static final DateRangeType Q1 = new DateRangeType(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31));
    private static final ExecutionContextType CUSTOMER = ExecutionContextType.forTenant("cust-42", Q1);

    private WidgetDataService service;
    private RowSource rowSource;

    @BeforeEach
    void setUp() throws Exception {
        rowSource = mock(RowSource.class);
        service = new WidgetDataService();
        TestFixtures.setField(service, "rowSource", rowSource);
        TestFixtures.setField(service, "aggregationService", new WidgetAggregationService());
        TestFixtures.setField(service, "fieldAccessPolicy", new FieldAccessPolicy());
        TestFixtures.setField(service, "tracer", TestFixtures.tracer());
        TestFixtures.setField(service, "metrics", TestFixtures.metrics());
        TestFixtures.setField(service, "tenantColumn", "customer_id");
    }

    /**
     * Test: Dynamic filters take the context's range; stored tenant filters are replaced by the context tenant.
     */
    @Test
    void testBindContext_restrictedContext() {
        QuerySpecType spec = specWithFilters(List.of(QueryFilterType.dynamic("customer_id", "eq"),
                QueryFilterType.fixed("tenant_id", "eq", "cust-99"), QueryFilterType.fixed("customer_id", "eq", "cust-99"),
                QueryFilterType.dynamic("pickup_date", "gte"), QueryFilterType.dynamic("pickup_date", "lte"),
                QueryFilterType.dynamic("pickup_date", "between"), QueryFilterType.fixed("mode_name", "eq", "TL")));

        List<QueryFilterType> bound = service.bindContext(spec, CUSTOMER).filters();

        assertEquals(List.of(QueryFilterType.fixed("pickup_date", "gte", Q1.start()),
                QueryFilterType.fixed("pickup_date", "lte", Q1.end()),
                QueryFilterType.fixed("pickup_date", "between", List.of(Q1.start(), Q1.end())),
                QueryFilterType.fixed("mode_name", "eq", "TL"), QueryFilterType.fixed("customer_id", "eq", "cust-42")),
                bound);
    }

    /**
     * Test: A privileged context without tenant or range keeps static tenant filters and drops unbound dynamic ones.
     */
    @Test
    void testBindContext_privilegedWithoutTenant() {
        QuerySpecType spec = specWithFilters(List.of(QueryFilterType.dynamic("customer_id", "eq"),
                QueryFilterType.fixed("customer_id", "eq", "cust-7"), QueryFilterType.dynamic("pickup_date", "gte"),
                QueryFilterType.dynamic("pickup_date", "between")));

        List<QueryFilterType> bound = service.bindContext(spec, ExecutionContextType.privileged(null, null))
                .filters();

        assertEquals(List.of(QueryFilterType.fixed("customer_id", "eq", "cust-7")), bound);
    }

    @Test
    void testBindContext_privilegedNarrowedToTenant() {
        QuerySpecType spec = specWithFilters(List.of(QueryFilterType.dynamic("customer_id", "eq")));

        List<QueryFilterType> bound = service
                .bindContext(spec, ExecutionContextType.privileged("cust-9", DateRangeType.unbounded())).filters();

        assertEquals(List.of(QueryFilterType.fixed("customer_id", "eq", "cust-9")), bound);
    }

    /**
     * Test: A calculation fetches rows with the tenant bound and aggregates them.
     */
    @Test
    void testCalculate_ready() {
        when(rowSource.fetchRows(any(), any())).thenReturn(
                List.of(Map.of("carrier_name", "A", "retail", 10), Map.of("carrier_name", "B", "retail", 5)));

        WidgetResultType result = service.calculate(barWidget(AccessScope.ALL), CUSTOMER);

        assertEquals(WidgetResultType.Status.READY, result.status());
        assertEquals("carrier_spend", result.widgetId());
        assertFalse(result.frozen());
        assertEquals(List.of(new ChartPointType("A", 10.0), new ChartPointType("B", 5.0)),
                ((ChartDataType) result.data()).series());

        ArgumentCaptor<QuerySpecType> captor = ArgumentCaptor.forClass(QuerySpecType.class);
        verify(rowSource).fetchRows(captor.capture(), any());
        assertTrue(captor.getValue().filters().contains(QueryFilterType.fixed("customer_id", "eq", "cust-42")));
    }

    @Test
    void testCalculate_emptyRows() {
        when(rowSource.fetchRows(any(), any())).thenReturn(List.of());

        WidgetResultType result = service.calculate(barWidget(AccessScope.ALL), CUSTOMER);

        assertEquals(WidgetResultType.Status.EMPTY, result.status());
        assertTrue(((ChartDataType) result.data()).series().isEmpty());
    }

    /**
     * Test: Admin-scoped widgets never run in a restricted context.
     */
    @Test
    void testCalculate_adminWidgetRefusedForCustomer() {
        WidgetResultType result = service.calculate(barWidget(AccessScope.ADMIN), CUSTOMER);

        assertEquals(WidgetResultType.Status.ERROR, result.status());
        assertNull(result.data());
        verify(rowSource, never()).fetchRows(any(), any());
    }

    @Test
    void testCalculate_adminWidgetForPrivileged() {
        when(rowSource.fetchRows(any(), any())).thenReturn(List.of(Map.of("carrier_name", "A", "retail", 1)));

        WidgetResultType result = service.calculate(barWidget(AccessScope.ADMIN),
                ExecutionContextType.privileged(null, Q1));

        assertEquals(WidgetResultType.Status.READY, result.status());
    }

    /**
     * Test: Restricted fields stored in a definition are stripped again before the query runs.
     */
    @Test
    void testCalculate_stripsRestrictedFieldsAtExecution() {
        when(rowSource.fetchRows(any(), any())).thenReturn(List.of(Map.of("retail", 3)));
        QuerySpecType spec = new QuerySpecType("shipments",
                List.of(QueryColumnType.aggregate("cost", AggregateFunction.SUM),
                        QueryColumnType.aggregate("retail", AggregateFunction.SUM)),
                List.of(), List.of(), List.of(), null);
        CustomWidgetType widget = CustomWidgetType.draft("w1", "Leaky", WidgetType.KPI, spec, null);

        WidgetResultType result = service.calculate(widget, CUSTOMER);

        ArgumentCaptor<QuerySpecType> captor = ArgumentCaptor.forClass(QuerySpecType.class);
        verify(rowSource).fetchRows(captor.capture(), any());
        assertEquals(List.of("retail"), captor.getValue().columns().stream().map(QueryColumnType::field).toList());
        assertEquals(3.0, ((KpiDataType) result.data()).value());
    }

    /**
     * Test: A frozen widget serves its snapshot without querying.
     */
    @Test
    void testCalculate_frozenSnapshot() {
        KpiDataType snapshot = new KpiDataType(42.0, "Loads", "number");
        CustomWidgetType widget = CustomWidgetType.draft("w1", "Loads", WidgetType.KPI, specWithFilters(List.of()), null)
                .withSnapshot(snapshot, "2024-04-01T00:00:00Z");

        WidgetResultType result = service.calculate(widget, CUSTOMER);

        assertTrue(result.frozen());
        assertEquals(WidgetResultType.Status.READY, result.status());
        assertEquals(snapshot, result.data());
        assertEquals("2024-04-01T00:00:00Z", result.calculatedAt());
        verify(rowSource, never()).fetchRows(any(), any());
    }

    @Test
    void testCalculate_failureBecomesErrorResult() {
        when(rowSource.fetchRows(any(), any())).thenThrow(new IllegalStateException("connection refused"));

        WidgetResultType result = service.calculate(barWidget(AccessScope.ALL), CUSTOMER);

        assertEquals(WidgetResultType.Status.ERROR, result.status());
        assertEquals("Widget data is unavailable", result.error());
    }

    @Test
    void testCalculate_missingQuery() {
        CustomWidgetType widget = CustomWidgetType.draft("w1", "Empty", WidgetType.KPI, null, null);

        assertEquals(WidgetResultType.Status.ERROR, service.calculate(widget, CUSTOMER).status());
    }

    /**
     * Test: When a newer request for the same slot completes first, the older one comes back stale.
     */
    @Test
    void testCalculateForSlot_supersededRequestIsStale() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ExecutionContextType slow = ExecutionContextType.forTenant("slow", Q1);
        ExecutionContextType fast = ExecutionContextType.forTenant("fast", Q1);
        when(rowSource.fetchRows(any(), any())).thenAnswer(invocation -> {
            ExecutionContextType context = invocation.getArgument(1);
            if ("slow".equals(context.tenantId())) {
                release.await(5, TimeUnit.SECONDS);
            }
            return List.of(Map.of("carrier_name", context.tenantId(), "retail", 1));
        });

        CompletableFuture<WidgetResultType> first = service.calculateForSlot("pulse:cust-42:carrier_spend",
                barWidget(AccessScope.ALL), slow);
        CompletableFuture<WidgetResultType> second = service.calculateForSlot("pulse:cust-42:carrier_spend",
                barWidget(AccessScope.ALL), fast);

        WidgetResultType latest = second.get(5, TimeUnit.SECONDS);
        release.countDown();
        WidgetResultType superseded = first.get(5, TimeUnit.SECONDS);

        assertEquals(WidgetResultType.Status.READY, latest.status());
        assertEquals("fast", ((ChartDataType) latest.data()).series().get(0).name());
        assertEquals(WidgetResultType.Status.STALE, superseded.status());
        assertNull(superseded.data());
    }

    @Test
    void testCalculateForSlot_independentSlots() throws Exception {
        when(rowSource.fetchRows(any(), any())).thenReturn(List.of(Map.of("carrier_name", "A", "retail", 1)));

        CompletableFuture<WidgetResultType> a = service.calculateForSlot("slot-a", barWidget(AccessScope.ALL),
                CUSTOMER);
        CompletableFuture<WidgetResultType> b = service.calculateForSlot("slot-b", barWidget(AccessScope.ALL),
                CUSTOMER);

        assertEquals(WidgetResultType.Status.READY, a.get(5, TimeUnit.SECONDS).status());
        assertEquals(WidgetResultType.Status.READY, b.get(5, TimeUnit.SECONDS).status());
    }

    private static BuiltInWidgetType barWidget(AccessScope accessScope) {
        QuerySpecType spec = new QuerySpecType("shipments",
                List.of(QueryColumnType.of("carrier_name"), QueryColumnType.aggregate("retail", AggregateFunction.SUM)),
                List.of(QueryFilterType.dynamic("customer_id", "eq"), QueryFilterType.dynamic("pickup_date", "gte"),
                        QueryFilterType.dynamic("pickup_date", "lte")),
                List.of("carrier_name"), List.of(), 10);
        return new BuiltInWidgetType("carrier_spend", "Carrier Spend", null, WidgetType.BAR_CHART, "spend",
                accessScope, null, spec, VisualizationHintType.chart("carrier_name", "retail"));
    }

    private static QuerySpecType specWithFilters(List<QueryFilterType> filters) {
        return new QuerySpecType("shipments", List.of(QueryColumnType.aggregate("load_id", AggregateFunction.COUNT)),
                filters, List.of(), List.of(), null);
    }
}
