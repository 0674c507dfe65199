package villagecompute.dashboards.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.security.Principal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import jakarta.ws.rs.core.SecurityContext;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.widgets.OwnerContext;
import villagecompute.dashboards.widgets.OwnerScope;

/**
 * Unit tests for {@link CallerContexts}.
 */
class CallerContextsTest {

    private SecurityContext securityContext;
    private Principal principal;

    @BeforeEach
    void setUp() {
        securityContext = mock(SecurityContext.class);
        principal = mock(Principal.class);
        when(securityContext.getUserPrincipal()).thenReturn(principal);
        when(principal.getName()).thenReturn("user-1");
    }

    @Test
    void testOwner_unauthenticated() {
        assertNull(CallerContexts.owner(null, "cust-42"));

        when(securityContext.getUserPrincipal()).thenReturn(null);
        assertNull(CallerContexts.owner(securityContext, "cust-42"));
    }

    @Test
    void testOwner_blankPrincipalName() {
        when(principal.getName()).thenReturn("  ");

        assertNull(CallerContexts.owner(securityContext, "cust-42"));
    }

    @Test
    void testOwner_systemAdminWinsOverAdmin() {
        when(securityContext.isUserInRole(CallerContexts.ROLE_SYSTEM_ADMIN)).thenReturn(true);
        when(securityContext.isUserInRole(CallerContexts.ROLE_ADMIN)).thenReturn(true);

        OwnerContext owner = CallerContexts.owner(securityContext, "cust-42");

        assertEquals(OwnerScope.SYSTEM, owner.scope());
        assertEquals("user-1", owner.userId());
    }

    @Test
    void testOwner_adminIgnoresCustomerHeader() {
        when(securityContext.isUserInRole(CallerContexts.ROLE_ADMIN)).thenReturn(true);

        OwnerContext owner = CallerContexts.owner(securityContext, "cust-42");

        assertEquals(OwnerContext.admin("user-1"), owner);
    }

    @Test
    void testOwner_customerHeaderTrimmed() {
        OwnerContext owner = CallerContexts.owner(securityContext, " cust-42 ");

        assertEquals(OwnerContext.customer("cust-42", "user-1"), owner);
    }

    @Test
    void testOwner_customerWithoutHeader() {
        assertThrows(ValidationException.class, () -> CallerContexts.owner(securityContext, null));
        assertThrows(ValidationException.class, () -> CallerContexts.owner(securityContext, ""));
    }

    @Test
    void testOwner_unsafeCustomerId() {
        assertThrows(ValidationException.class, () -> CallerContexts.owner(securityContext, "cust/42"));
    }

    @Test
    void testExecution_customerPinnedToOwnTenant() {
        OwnerContext owner = OwnerContext.customer("cust-42", "user-1");

        ExecutionContextType context = CallerContexts.execution(owner, "2024-01-01", "2024-01-31", "cust-99");

        assertEquals("cust-42", context.tenantId());
        assertFalse(context.privileged());
        assertEquals(LocalDate.of(2024, 1, 1), context.dateRange().start());
        assertEquals(LocalDate.of(2024, 1, 31), context.dateRange().end());
    }

    /**
     * Test: Privileged callers see every tenant unless they narrow to one.
     */
    @Test
    void testExecution_privileged() {
        OwnerContext admin = OwnerContext.admin("user-1");

        ExecutionContextType all = CallerContexts.execution(admin, null, null, " ");
        ExecutionContextType narrowed = CallerContexts.execution(admin, null, null, " cust-99 ");

        assertTrue(all.privileged());
        assertNull(all.tenantId());
        assertNull(all.dateRange().start());
        assertEquals("cust-99", narrowed.tenantId());
    }

    @Test
    void testExecution_invalidDates() {
        OwnerContext owner = OwnerContext.customer("cust-42", "user-1");

        assertThrows(ValidationException.class, () -> CallerContexts.execution(owner, "01/02/2024", null, null));
        assertThrows(ValidationException.class,
                () -> CallerContexts.execution(owner, "2024-02-01", "2024-01-01", null));
    }
}
