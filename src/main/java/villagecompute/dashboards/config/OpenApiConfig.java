package villagecompute.dashboards.config;

import org.eclipse.microprofile.openapi.annotations.Components;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the Widget Dashboards API.
 *
 * <p>
 * Defines API metadata, the bearer security scheme, and endpoint groupings via tags.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Widget Dashboards API",
                version = "1.0.0",
                description = """
                        Customizable analytics dashboards built from declarative widgets.

                        ## Features
                        - **Dashboards**: per-owner layouts with edit mode, resize, reorder and reset
                        - **Widget Catalog**: built-in KPI, chart, table and map widgets
                        - **Custom Widgets**: user and admin authored widgets with promotion and snapshots

                        ## Authentication
                        Endpoints require a JWT bearer token. Customer users pass their customer id in the
                        `X-Customer-Id` header; cost and margin fields are never returned to them.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Dashboards",
                description = "Dashboard layout and grid operations"),
                @Tag(
                        name = "Widgets",
                        description = "Widget catalog, widget data and size constraints"),
                @Tag(
                        name = "Custom Widgets",
                        description = "User and admin authored widget definitions")},
        components = @Components(
                securitySchemes = {@SecurityScheme(
                        securitySchemeName = "bearerAuth",
                        type = SecuritySchemeType.HTTP,
                        scheme = "bearer",
                        bearerFormat = "JWT",
                        description = "JWT bearer token. Required for all dashboard and widget endpoints.")}))
public class OpenApiConfig extends Application {
    // Configuration via annotations only - no programmatic setup needed
}
