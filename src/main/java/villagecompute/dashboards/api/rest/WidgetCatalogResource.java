package villagecompute.dashboards.api.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import villagecompute.dashboards.api.types.BuiltInWidgetType;
import villagecompute.dashboards.api.types.CustomWidgetType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.SizeConstraintType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.exceptions.DocumentStoreException;
import villagecompute.dashboards.exceptions.ResourceNotFoundException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.services.CustomWidgetService;
import villagecompute.dashboards.services.WidgetDataService;
import villagecompute.dashboards.services.WidgetRegistryService;
import villagecompute.dashboards.services.WidgetSizeConstraintResolver;
import villagecompute.dashboards.widgets.OwnerContext;
import villagecompute.dashboards.widgets.WidgetType;

/**
 * REST endpoints for the widget catalog, widget data and size constraints.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/widgets/catalog} – built-in widgets for the caller's role plus visible custom widgets</li>
 * <li>{@code GET /api/widgets/{id}/data} – calculate a built-in (or visible custom) widget</li>
 * <li>{@code GET /api/widgets/{id}/constraints} – size constraints for a widget id and type</li>
 * </ul>
 */
@Path("/api/widgets")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Widgets",
        description = "Widget catalog and data operations")
public class WidgetCatalogResource {

    private static final Logger LOG = Logger.getLogger(WidgetCatalogResource.class);

    @Inject
    WidgetRegistryService registryService;

    @Inject
    CustomWidgetService customWidgetService;

    @Inject
    WidgetDataService widgetDataService;

    @Inject
    WidgetSizeConstraintResolver sizeResolver;

    @GET
    @Path("/catalog")
    @Operation(
            summary = "Get widget catalog",
            description = "Built-in widgets (admin widgets only for admins) and the caller's visible custom widgets")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Catalog returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response getCatalog(@Context SecurityContext securityContext,
            @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
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

        List<BuiltInWidgetType> builtIn = registryService.listForScope(owner.privileged());
        List<CustomWidgetType> custom;
        try {
            custom = customWidgetService.listVisible(owner);
        } catch (DocumentStoreException e) {
            // Built-in widgets stay usable while the custom widget store is down
            LOG.warnf("Custom widgets unavailable for catalog of %s: %s", owner.namespace(), e.getMessage());
            custom = List.of();
        }

        Map<String, Object> catalog = new LinkedHashMap<>();
        catalog.put("built_in", builtIn);
        catalog.put("custom", custom);
        return Response.ok(catalog).build();
    }

    @GET
    @Path("/{id}/data")
    @Operation(
            summary = "Calculate a widget",
            description = "Runs the widget's query for the caller's tenant and date range")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Widget result",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = WidgetResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid date range"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Widget requires admin access"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Widget not found")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response getData(@PathParam("id") String id, @QueryParam("from") String from,
            @QueryParam("to") String to, @QueryParam("customer_id") String customerFilter,
            @Context SecurityContext securityContext, @HeaderParam(CallerContexts.CUSTOMER_HEADER) String customerId) {
        OwnerContext owner;
        ExecutionContextType context;
        try {
            owner = CallerContexts.owner(securityContext, customerId);
            if (owner == null) {
                return Response.status(Response.Status.UNAUTHORIZED)
                        .entity(new ErrorResponse("Authentication required")).build();
            }
            context = CallerContexts.execution(owner, from, to, customerFilter);
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }

        try {
            Optional<BuiltInWidgetType> builtIn = registryService.get(id);
            if (builtIn.isPresent()) {
                return Response.ok(registryService.calculate(id, context)).build();
            }
            CustomWidgetType custom = customWidgetService.get(id, owner);
            return Response.ok(widgetDataService.calculate(custom, context)).build();

        } catch (ValidationException e) {
            LOG.warnf("Refused widget %s for %s: %s", id, owner.namespace(), e.getMessage());
            return Response.status(Response.Status.FORBIDDEN).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (DocumentStoreException e) {
            LOG.errorf(e, "Widget store unavailable while loading %s", id);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Widget storage is unavailable")).build();
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error calculating widget %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to calculate widget")).build();
        }
    }

    @GET
    @Path("/{id}/constraints")
    @Operation(
            summary = "Get size constraints",
            description = "Min, max and optimal size level and minimum height; the type defaults to the catalog entry's")
    @APIResponse(
            responseCode = "200",
            description = "Constraints returned",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = SizeConstraintType.class)))
    public Response getConstraints(@PathParam("id") String id, @QueryParam("type") String typeCode) {
        WidgetType type = WidgetType.fromCode(typeCode);
        if (type == null) {
            type = registryService.get(id).map(BuiltInWidgetType::type).orElse(null);
        }
        return Response.ok(sizeResolver.getConstraints(id, type)).build();
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
