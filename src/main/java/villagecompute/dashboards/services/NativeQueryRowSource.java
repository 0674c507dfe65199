package villagecompute.dashboards.services;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;
import villagecompute.dashboards.api.types.ExecutionContextType;
import villagecompute.dashboards.api.types.OrderByType;
import villagecompute.dashboards.api.types.QueryColumnType;
import villagecompute.dashboards.api.types.QueryFilterType;
import villagecompute.dashboards.api.types.QuerySpecType;
import villagecompute.dashboards.exceptions.ValidationException;

/**
 * {@link RowSource} that runs a parameterized native SQL {@code SELECT} through the JPA {@link EntityManager}.
 *
 * <p>
 * Only identifiers are interpolated into the SQL text, and only after they match a plain (optionally table-qualified)
 * identifier pattern; the base entity must also be on the configured allow-list. Every filter value is bound as a named
 * parameter. Values compared against the configured date column are bound as {@link LocalDate}.
 *
 * <p>
 * Rows come back raw (no SQL aggregation) keyed by the selected field names; grouping and aggregation stay in
 * {@link WidgetAggregationService}.
 */
@ApplicationScoped
public class NativeQueryRowSource implements RowSource {

    private static final Logger LOG = Logger.getLogger(NativeQueryRowSource.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    @Inject
    EntityManager entityManager;

    @ConfigProperty(
            name = "dashboards.row-source.allowed-entities",
            defaultValue = "shipments")
    List<String> allowedEntities;

    @ConfigProperty(
            name = "dashboards.row-source.date-column",
            defaultValue = "pickup_date")
    String dateColumn;

    @ConfigProperty(
            name = "dashboards.row-source.max-rows",
            defaultValue = "50000")
    int maxRows;

    @Override
    @Transactional
    public List<Map<String, Object>> fetchRows(QuerySpecType spec, ExecutionContextType context) {
        if (spec == null) {
            throw new ValidationException("Query spec is required");
        }
        String entity = requireIdentifier(spec.baseEntity());
        if (allowedEntities.stream().noneMatch(allowed -> allowed.equalsIgnoreCase(entity))) {
            throw new ValidationException("Entity " + entity + " is not available for widget queries");
        }

        List<String> fields = selectedFields(spec);
        if (fields.isEmpty()) {
            throw new ValidationException("Query for " + entity + " selects no columns");
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        String sql = buildSql(spec, entity, fields, parameters);

        Query query = entityManager.createNativeQuery(sql);
        parameters.forEach(query::setParameter);
        query.setMaxResults(rowLimit(spec));

        LOG.debugf("Fetching rows from %s: %s", entity, sql);

        @SuppressWarnings("unchecked")
        List<Object> results = query.getResultList();

        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        for (Object result : results) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (result instanceof Object[] values) {
                for (int i = 0; i < fields.size() && i < values.length; i++) {
                    row.put(fields.get(i), values[i]);
                }
            } else {
                row.put(fields.get(0), result);
            }
            rows.add(row);
        }
        return rows;
    }

    String buildSql(QuerySpecType spec, String entity, List<String> fields, Map<String, Object> parameters) {
        StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", fields)).append(" FROM ")
                .append(entity);

        List<String> predicates = new ArrayList<>();
        for (QueryFilterType filter : spec.filters()) {
            String predicate = predicate(filter, parameters);
            if (predicate != null) {
                predicates.add(predicate);
            }
        }
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }

        List<String> orderings = new ArrayList<>();
        for (OrderByType order : spec.orderBy()) {
            orderings.add(requireIdentifier(order.field()) + (order.descending() ? " DESC" : " ASC"));
        }
        if (!orderings.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderings));
        }
        return sql.toString();
    }

    private String predicate(QueryFilterType filter, Map<String, Object> parameters) {
        if (filter.dynamic()) {
            // Unbound dynamic filters never reach SQL; their value must come from the execution context
            LOG.warnf("Skipping unbound dynamic filter on %s", filter.field());
            return null;
        }
        String field = requireIdentifier(filter.field());
        String operator = filter.operator() == null ? "" : filter.operator().trim().toLowerCase(Locale.ROOT);
        Object value = filter.value();

        return switch (operator) {
            case "eq" -> value == null ? field + " IS NULL" : field + " = " + bind(field, value, parameters);
            case "neq" -> value == null ? field + " IS NOT NULL" : field + " <> " + bind(field, value, parameters);
            case "gt" -> field + " > " + bind(field, value, parameters);
            case "gte" -> field + " >= " + bind(field, value, parameters);
            case "lt" -> field + " < " + bind(field, value, parameters);
            case "lte" -> field + " <= " + bind(field, value, parameters);
            case "like" -> field + " LIKE " + bind(field, value, parameters);
            case "in" -> inPredicate(field, value, parameters);
            case "between" -> betweenPredicate(field, value, parameters);
            default -> {
                LOG.warnf("Skipping filter on %s with unknown operator '%s'", field, filter.operator());
                yield null;
            }
        };
    }

    private String inPredicate(String field, Object value, Map<String, Object> parameters) {
        if (!(value instanceof Collection<?> values) || values.isEmpty()) {
            throw new ValidationException("Filter 'in' on " + field + " needs a non-empty list of values");
        }
        List<Object> bound = new ArrayList<>(values.size());
        for (Object element : values) {
            bound.add(coerce(field, element));
        }
        String name = "p" + parameters.size();
        parameters.put(name, bound);
        return field + " IN (:" + name + ")";
    }

    private String betweenPredicate(String field, Object value, Map<String, Object> parameters) {
        if (!(value instanceof List<?> bounds) || bounds.size() != 2) {
            throw new ValidationException("Filter 'between' on " + field + " needs exactly two values");
        }
        return field + " BETWEEN " + bind(field, bounds.get(0), parameters) + " AND "
                + bind(field, bounds.get(1), parameters);
    }

    private String bind(String field, Object value, Map<String, Object> parameters) {
        if (value == null) {
            throw new ValidationException("Filter on " + field + " has no value");
        }
        String name = "p" + parameters.size();
        parameters.put(name, coerce(field, value));
        return ":" + name;
    }

    private Object coerce(String field, Object value) {
        if (value instanceof String text && isDateColumn(field)) {
            try {
                return LocalDate.parse(text.trim());
            } catch (DateTimeParseException e) {
                throw new ValidationException("Invalid date '" + text + "' for " + field, e);
            }
        }
        return value;
    }

    private boolean isDateColumn(String field) {
        int dot = field.lastIndexOf('.');
        String unqualified = dot >= 0 ? field.substring(dot + 1) : field;
        return unqualified.equalsIgnoreCase(dateColumn);
    }

    private static List<String> selectedFields(QuerySpecType spec) {
        Set<String> fields = new LinkedHashSet<>();
        for (QueryColumnType column : spec.columns()) {
            fields.add(requireIdentifier(column.field()));
        }
        for (String field : spec.groupBy()) {
            fields.add(requireIdentifier(field));
        }
        return new ArrayList<>(fields);
    }

    /**
     * Plain column lists are truncated in SQL; anything aggregated needs every row.
     */
    private int rowLimit(QuerySpecType spec) {
        boolean aggregated = spec.primaryAggregate().isPresent() || !spec.groupBy().isEmpty();
        if (!aggregated && spec.limit() != null && spec.limit() > 0) {
            return Math.min(spec.limit(), maxRows);
        }
        return maxRows;
    }

    private static String requireIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new ValidationException("Invalid identifier in widget query: " + identifier);
        }
        return identifier;
    }
}
