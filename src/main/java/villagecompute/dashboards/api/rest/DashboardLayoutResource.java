package villagecompute.dashboards.api.rest;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import villagecompute.dashboards.api.types.AddWidgetRequestType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.GridActionResultType;
import villagecompute.dashboards.api.types.GridStateType;
import villagecompute.dashboards.api.types.ReorderRequestType;
import villagecompute.dashboards.api.types.ResolvedWidgetType;
import villagecompute.dashboards.api.types.SelectWidgetRequestType;
import villagecompute.dashboards.api.types.SizeChangeRequestType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.services.DashboardGridService;
import villagecompute.dashboards.widgets.DashboardKind;
import villagecompute.dashboards.widgets.OwnerContext;

/**
 * REST endpoints for a dashboard grid: layout state, edit mode, and layout mutations.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/dashboards/{kind}} – grid state with the persisted layout</li>
 * <li>{@code GET /api/dashboards/{kind}/widgets} – resolved widgets with effective sizes</li>
 * <li>{@code GET /api/dashboards/{kind}/data} – data for every widget</li>
 * <li>{@code POST|DELETE /api/dashboards/{kind}/edit} – enter or leave edit mode</li>
 * <li>{@code PUT /api/dashboards/{kind}/selection} – select a widget while editing</li>
 * <li>{@code POST /api/dashboards/{kind}/widgets}, {@code DELETE .../widgets/{widgetId}} – add or remove a
 * widget</li>
 * <li>{@code PUT /api/dashboards/{kind}/sizes} – resize a widget</li>
 * <li>{@code POST /api/dashboards/{kind}/reorder}, {@code POST .../hover-reorder} – reorder widgets</li>
 * <li>{@code POST /api/dashboards/{kind}/flush}, {@code POST .../reset} – flush a pending save, reset to
 * defaults</li>
 * </ul>
 *
 * <p>
 * Grid operations answer with a {@link GridActionResultType}: 200 when applied, 202 when a debounced save was
 * scheduled, and 400/404/409/503 for invalid requests, unknown widgets, wrong mode and store failures.
 */
@Path("/api/dashboards/{kind}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Dashboards",
        description = "Dashboard layout and grid operations")
public class DashboardLayoutResource {

    private static final Logger LOG = Logger.getLogger(DashboardLayoutResource.class);

    @Inject
    DashboardGridService gridService;

    @GET
    @Operation(
            summary = "Get dashboard state",
            description = "Grid mode, selection and the persisted layout for the caller")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "State returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = GridStateType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Dashboard requires admin access"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown dashboard kind"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Layout store unavailable")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response getState(@PathParam("kind") String kindCode, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> Response.ok(gridService.state(kind, owner)).build());
    }

    @GET
    @Path("/widgets")
    @Operation(
            summary = "List dashboard widgets",
            description = "Widgets in layout order with definitions, effective sizes and constraints")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widgets returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ResolvedWidgetType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response getWidgets(@PathParam("kind") String kindCode, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId, (kind, owner) -> {
            List<ResolvedWidgetType> widgets = gridService.resolveWidgets(kind, owner);
            return Response.ok(widgets).build();
        });
    }

    @GET
    @Path("/data")
    @Operation(
            summary = "Load dashboard data",
            description = "Calculates every widget of the dashboard; failing widgets come back with status error")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widget results returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = WidgetResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid date range"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response getData(@PathParam("kind") String kindCode, @QueryParam("from") String from,
            @QueryParam("to") String to, @QueryParam("customer_id") String customerFilter,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId, (kind, owner) -> {
            ExecutionContextType context = CallerContexts.execution(owner, from, to, customerFilter);
            List<WidgetResultType> results = gridService.loadWidgetData(kind, owner, context);
            return Response.ok(results).build();
        });
    }

    @POST
    @Path("/edit")
    @Operation(
            summary = "Enter edit mode")
    @APIResponse(
            responseCode = "200",
            description = "Edit mode entered",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = GridActionResultType.class)))
    @SecurityRequirement(
            name = "bearerAuth")
    public Response enterEdit(@PathParam("kind") String kindCode, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.enterEdit(kind, owner)));
    }

    @DELETE
    @Path("/edit")
    @Operation(
            summary = "Leave edit mode",
            description = "Clears the selection; the layout was saved as it changed")
    @APIResponse(
            responseCode = "200",
            description = "Edit mode left",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = GridActionResultType.class)))
    @SecurityRequirement(
            name = "bearerAuth")
    public Response exitEdit(@PathParam("kind") String kindCode, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.exitEdit(kind, owner)));
    }

    @PUT
    @Path("/selection")
    @Operation(
            summary = "Select a widget",
            description = "Only while editing; a null widget_id clears the selection")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Selection changed"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Widget is not on the dashboard"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Not in edit mode")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response selectWidget(@PathParam("kind") String kindCode, SelectWidgetRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        String widgetId = request == null ? null : request.widgetId();
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.selectWidget(kind, owner, widgetId)));
    }

    @POST
    @Path("/widgets")
    @Operation(
            summary = "Add a widget",
            description = "Appends a built-in or custom widget; adding a present widget changes nothing")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widget added",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = GridActionResultType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown widget"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Layout could not be saved")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response addWidget(@PathParam("kind") String kindCode, @Valid AddWidgetRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.addWidget(kind, owner, request.widgetId())));
    }

    @DELETE
    @Path("/widgets/{widgetId}")
    @Operation(
            summary = "Remove a widget",
            description = "Only while editing; also drops the widget's size override")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widget removed"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Widget is not on the dashboard"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Not in edit mode")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response removeWidget(@PathParam("kind") String kindCode, @PathParam("widgetId") String widgetId,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.removeWidget(kind, owner, widgetId)));
    }

    @PUT
    @Path("/sizes")
    @Operation(
            summary = "Resize a widget",
            description = "Only while editing; the size is clamped to the widget's constraints")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Size stored"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Widget is not on the dashboard"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Not in edit mode")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response changeSize(@PathParam("kind") String kindCode, @Valid SizeChangeRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return withDashboard(kindCode, securityContext, customerId, (kind, owner) -> toResponse(
                gridService.changeSize(kind, owner, request.widgetId(), request.size())));
    }

    @POST
    @Path("/reorder")
    @Operation(
            summary = "Reorder widgets",
            description = "Only while editing; moves the widget at old_index to new_index and saves immediately")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Order saved"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Index out of range"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Not in edit mode")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response reorder(@PathParam("kind") String kindCode, @Valid ReorderRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.reorder(kind, owner, request)));
    }

    @POST
    @Path("/hover-reorder")
    @Operation(
            summary = "Hover reorder",
            description = "Only while viewing; the save is debounced and map widgets cannot be moved this way")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Reorder accepted, save scheduled"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Index out of range or widget is pointer-interactive"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Not in viewing mode")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response hoverReorder(@PathParam("kind") String kindCode, @Valid ReorderRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.hoverReorder(kind, owner, request)));
    }

    @POST
    @Path("/flush")
    @Operation(
            summary = "Save pending hover reorder now")
    @APIResponse(
            responseCode = "200",
            description = "Pending save written",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = GridStateType.class)))
    @SecurityRequirement(
            name = "bearerAuth")
    public Response flush(@PathParam("kind") String kindCode, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> Response.ok(gridService.flushPendingSaves(kind, owner)).build());
    }

    @POST
    @Path("/reset")
    @Operation(
            summary = "Reset to default layout",
            description = "Replaces the layout with the dashboard's default widgets and drops size overrides")
    @APIResponse(
            responseCode = "200",
            description = "Layout reset",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = GridActionResultType.class)))
    @SecurityRequirement(
            name = "bearerAuth")
    public Response reset(@PathParam("kind") String kindCode, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return withDashboard(kindCode, securityContext, customerId,
                (kind, owner) -> toResponse(gridService.resetToDefault(kind, owner)));
    }

    /**
     * Resolves kind and caller, checks dashboard access, and maps service exceptions to HTTP statuses.
     */
    private Response withDashboard(String kindCode, SecurityContext securityContext, String customerId,
            DashboardCall call) {
        DashboardKind kind = DashboardKind.fromCode(kindCode);
        if (kind == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("Unknown dashboard: " + kindCode)).build();
        }

        OwnerContext owner;
        try {
            owner = CallerContexts.owner(securityContext, customerId);
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
        if (owner == null) {
            return Response.status(Response.Status.UNAUTHORIZED).entity(new ErrorResponse("Authentication required"))
                    .build();
        }
        if (kind.adminOnly() && !owner.privileged()) {
            LOG.warnf("Customer %s attempted to open %s", owner.ownerId(), kind.code());
            return Response.status(Response.Status.FORBIDDEN)
                    .entity(new ErrorResponse("Dashboard requires admin access")).build();
        }

        try {
            return call.handle(kind, owner);

        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (DocumentStoreException e) {
            LOG.errorf(e, "Layout store unavailable for %s/%s", kind.code(), owner.ownerId());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Dashboard storage is unavailable")).build();
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error on dashboard %s for %s", kind.code(), owner.ownerId());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Dashboard operation failed")).build();
        }
    }

    static Response toResponse(GridActionResultType result) {
        Response.Status status = switch (result.outcome()) {
            case APPLIED -> Response.Status.OK;
            case SCHEDULED -> Response.Status.ACCEPTED;
            case FAILED -> switch (result.failure()) {
                case INVALID_REQUEST -> Response.Status.BAD_REQUEST;
                case WRONG_MODE -> Response.Status.CONFLICT;
                case NOT_FOUND -> Response.Status.NOT_FOUND;
                case STORE_FAILURE -> Response.Status.SERVICE_UNAVAILABLE;
            };
        };
        return Response.status(status).entity(result).build();
    }

    @FunctionalInterface
    private interface DashboardCall {
        Response handle(DashboardKind kind, OwnerContext owner);
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
