package villagecompute.dashboards.api.rest;

import java.util.List;
import java.util.function.Function;

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
import villagecompute.dashboards.api.types.CustomWidgetType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.PromoteWidgetRequestType;
import villagecompute.dashboards.api.types.WidgetDataType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ResourceNotFoundException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.services.CustomWidgetService;
import villagecompute.dashboards.services.WidgetDataService;
import villagecompute.dashboards.widgets.OwnerContext;
import villagecompute.dashboards.widgets.OwnerScope;

/**
 * REST endpoints for custom widget definitions in the caller's namespace.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/widgets/custom} – own widgets plus visible system widgets</li>
 * <li>{@code POST /api/widgets/custom}, {@code PUT /api/widgets/custom/{id}} – create or update</li>
 * <li>{@code GET|DELETE /api/widgets/custom/{id}} – read or delete</li>
 * <li>{@code GET /api/widgets/custom/{id}/data} – calculate the widget</li>
 * <li>{@code POST /api/widgets/custom/{id}/promote} – copy into the system namespace (admins)</li>
 * <li>{@code POST /api/widgets/custom/{id}/duplicate} – copy into the caller's admin namespace</li>
 * <li>{@code PUT|DELETE /api/widgets/custom/{id}/freeze} – store or drop a static snapshot</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> customer users only ever write their own customer namespace, and restricted fields are stripped
 * from their queries on save.
 */
@Path("/api/widgets/custom")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Custom Widgets",
        description = "User and admin authored widget definitions")
public class CustomWidgetResource {

    private static final Logger LOG = Logger.getLogger(CustomWidgetResource.class);

    @Inject
    CustomWidgetService customWidgetService;

    @Inject
    WidgetDataService widgetDataService;

    @GET
    @Operation(
            summary = "List custom widgets",
            description = "Widgets of the caller's namespace followed by visible system widgets")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widgets returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CustomWidgetType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Widget store unavailable")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response list(@Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId, owner -> {
            List<CustomWidgetType> widgets = customWidgetService.listVisible(owner);
            return Response.ok(widgets).build();
        });
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get a custom widget")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widget returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CustomWidgetType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Widget not found")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response get(@PathParam("id") String id, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId, owner -> Response.ok(customWidgetService.get(id, owner)).build());
    }

    @POST
    @Operation(
            summary = "Create a custom widget",
            description = "Stores a new widget with a generated id at version 1")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Widget created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CustomWidgetType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid definition")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response create(@Valid CustomWidgetType definition, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        if (definition == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return asCaller(securityContext, customerId, owner -> {
            CustomWidgetType saved = customWidgetService.save(definition.withId(null), owner);
            return Response.status(Response.Status.CREATED).entity(saved).build();
        });
    }

    @PUT
    @Path("/{id}")
    @Operation(
            summary = "Save a custom widget",
            description = "Creates the widget under the given id or updates it, incrementing the version")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widget saved",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CustomWidgetType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid definition")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response update(@PathParam("id") String id, @Valid CustomWidgetType definition,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        if (definition == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return asCaller(securityContext, customerId,
                owner -> Response.ok(customWidgetService.save(definition.withId(id), owner)).build());
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete a custom widget",
            description = "Deleting a missing widget succeeds")
    @APIResponse(
            responseCode = "204",
            description = "Widget deleted")
    @SecurityRequirement(
            name = "bearerAuth")
    public Response delete(@PathParam("id") String id, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId, owner -> {
            customWidgetService.delete(id, owner);
            return Response.noContent().build();
        });
    }

    @GET
    @Path("/{id}/data")
    @Operation(
            summary = "Calculate a custom widget",
            description = "Frozen widgets return their snapshot; others are queried for the caller's tenant")
    @APIResponse(
            responseCode = "200",
            description = "Widget result",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = WidgetResultType.class)))
    @SecurityRequirement(
            name = "bearerAuth")
    public Response data(@PathParam("id") String id, @QueryParam("from") String from, @QueryParam("to") String to,
            @QueryParam("customer_id") String customerFilter, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId, owner -> {
            CustomWidgetType widget = customWidgetService.get(id, owner);
            ExecutionContextType context = CallerContexts.execution(owner, from, to, customerFilter);
            return Response.ok(widgetDataService.calculate(widget, context)).build();
        });
    }

    @POST
    @Path("/{id}/promote")
    @Operation(
            summary = "Promote to system widget",
            description = "Copies a widget into the system namespace; the original is deleted or marked promoted")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "System widget created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CustomWidgetType.class))),
                    @APIResponse(
                            responseCode = "403",
                            description = "Admin access required"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Widget not found")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response promote(@PathParam("id") String id, PromoteWidgetRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId, owner -> {
            if (!owner.privileged()) {
                return forbidden();
            }
            OwnerContext source = sourceOwner(request, owner);
            boolean deleteOriginal = request != null && request.deleteOriginal();
            CustomWidgetType promoted = customWidgetService.promoteToSystem(id, source, owner, deleteOriginal);
            return Response.status(Response.Status.CREATED).entity(promoted).build();
        });
    }

    @POST
    @Path("/{id}/duplicate")
    @Operation(
            summary = "Duplicate into admin namespace",
            description = "Copies a widget, usually a customer's, into the calling admin's private namespace")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Copy created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CustomWidgetType.class))),
                    @APIResponse(
                            responseCode = "403",
                            description = "Admin access required")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response duplicate(@PathParam("id") String id, PromoteWidgetRequestType request,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId, owner -> {
            if (owner.scope() != OwnerScope.ADMIN) {
                return forbidden();
            }
            CustomWidgetType copy = customWidgetService.duplicateToAdmin(id, sourceOwner(request, owner), owner);
            return Response.status(Response.Status.CREATED).entity(copy).build();
        });
    }

    @PUT
    @Path("/{id}/freeze")
    @Operation(
            summary = "Freeze a custom widget",
            description = "Stores the given data as a static snapshot served instead of querying")
    @APIResponse(
            responseCode = "200",
            description = "Widget frozen",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = CustomWidgetType.class)))
    @SecurityRequirement(
            name = "bearerAuth")
    public Response freeze(@PathParam("id") String id, WidgetDataType snapshot,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        if (snapshot == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Snapshot data required"))
                    .build();
        }
        return asCaller(securityContext, customerId,
                owner -> Response.ok(customWidgetService.freeze(id, owner, snapshot)).build());
    }

    @DELETE
    @Path("/{id}/freeze")
    @Operation(
            summary = "Unfreeze a custom widget")
    @APIResponse(
            responseCode = "200",
            description = "Widget is live again")
    @SecurityRequirement(
            name = "bearerAuth")
    public Response unfreeze(@PathParam("id") String id, @Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        return asCaller(securityContext, customerId,
                owner -> Response.ok(customWidgetService.freeze(id, owner, null)).build());
    }

    private Response asCaller(SecurityContext securityContext, String customerId,
            Function<OwnerContext, Response> call) {
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

        try {
            return call.apply(owner);

        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (DocumentStoreException e) {
            LOG.errorf(e, "Widget store unavailable for %s", owner.namespace());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Widget storage is unavailable")).build();
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error handling custom widgets for %s", owner.namespace());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Custom widget operation failed")).build();
        }
    }

    /**
     * Namespace named by the request, defaulting to the caller's own.
     */
    private static OwnerContext sourceOwner(PromoteWidgetRequestType request, OwnerContext caller) {
        if (request == null || request.sourceScope() == null) {
            return caller;
        }
        try {
            return switch (request.sourceScope()) {
                case SYSTEM -> OwnerContext.system(caller.userId());
                case ADMIN -> OwnerContext.admin(request.sourceOwnerId());
                case CUSTOMER -> OwnerContext.customer(request.sourceOwnerId(), caller.userId());
            };
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid source namespace: " + e.getMessage(), e);
        }
    }

    private static Response forbidden() {
        return Response.status(Response.Status.FORBIDDEN).entity(new ErrorResponse("Admin access required")).build();
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
