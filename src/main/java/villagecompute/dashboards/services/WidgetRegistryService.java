package villagecompute.dashboards.services;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.dashboards.api.types.BuiltInWidgetType;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.WidgetResultType;
import villagecompute.dashboards.exceptions.ResourceNotFoundException;
import villagecompute.dashboards.exceptions.ValidationException;
import villagecompute.dashboards.widgets.AccessScope;
import villagecompute.dashboards.widgets.BuiltInWidgets;

/**
 * Immutable catalog of built-in widget definitions, keyed by id in catalog order.
 *
 * <p>
 * The catalog is fixed at startup; a repeated id fails construction.
 */
@ApplicationScoped
public class WidgetRegistryService {

    private static final Logger LOG = Logger.getLogger(WidgetRegistryService.class);

    @Inject
    WidgetDataService widgetDataService;

    private final Map<String, BuiltInWidgetType> widgets;

    public WidgetRegistryService() {
        this(BuiltInWidgets.all());
    }

    WidgetRegistryService(Collection<BuiltInWidgetType> definitions) {
        Map<String, BuiltInWidgetType> byId = new LinkedHashMap<>();
        for (BuiltInWidgetType definition : definitions) {
            if (byId.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate built-in widget id: " + definition.id());
            }
        }
        this.widgets = Collections.unmodifiableMap(byId);
        LOG.debugf("Registered %d built-in widgets", widgets.size());
    }

    /**
     * Widgets the caller may add; admin-scoped widgets are hidden from non-admins.
     */
    public List<BuiltInWidgetType> listForScope(boolean admin) {
        return widgets.values().stream().filter(widget -> admin || widget.accessScope() != AccessScope.ADMIN)
                .toList();
    }

    public Optional<BuiltInWidgetType> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(widgets.get(id));
    }

    public BuiltInWidgetType require(String id) {
        return get(id).orElseThrow(() -> new ResourceNotFoundException("Widget not found: " + id));
    }

    /**
     * Calculates a built-in widget for the given context.
     *
     * @throws ResourceNotFoundException
     *             if the id is not in the catalog
     * @throws ValidationException
     *             if an admin-scoped widget is requested in a restricted context
     */
    public WidgetResultType calculate(String id, ExecutionContextType context) {
        BuiltInWidgetType definition = require(id);
        if (definition.accessScope() == AccessScope.ADMIN && !context.privileged()) {
            throw new ValidationException("Widget " + id + " requires admin access");
        }
        return widgetDataService.calculate(definition, context);
    }
}
