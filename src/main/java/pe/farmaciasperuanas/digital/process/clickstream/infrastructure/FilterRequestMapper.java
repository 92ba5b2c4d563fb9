package pe.farmaciasperuanas.digital.process.clickstream.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.DTO.ConversionQueryRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.DTO.FilterRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.InvalidFilterException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterClause;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.GroupKey;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.PageType;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.SortSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Convierte y valida los filtros recibidos por HTTP. Reúne todas las violaciones antes de
 * rechazar la solicitud con {@link InvalidFilterException}; el motor nunca recibe filtros inválidos.
 */
@Component
public class FilterRequestMapper {

    private static final String METRIC_TOTAL_SESSIONS = "total_sessions";
    private static final String METRIC_CONVERSIONS = "conversions";
    private static final String METRIC_CONVERSION_RATE = "conversion_rate";

    private final Set<String> allowedMonths;
    private final Set<String> allowedVisitorTypes;

    /**
     * Listas vacías desactivan la validación de valores para ese campo.
     */
    public FilterRequestMapper(
            @Value("${clickstream.filters.months:}") String[] allowedMonths,
            @Value("${clickstream.filters.visitor-types:}") String[] allowedVisitorTypes) {
        this.allowedMonths = new LinkedHashSet<>(Arrays.asList(allowedMonths));
        this.allowedVisitorTypes = new LinkedHashSet<>(Arrays.asList(allowedVisitorTypes));
    }

    public FilterConfiguration toConfiguration(FilterRequest request) {
        List<String> violations = new ArrayList<>();
        FilterConfiguration configuration = toConfiguration(request, violations);
        if (!violations.isEmpty()) {
            throw new InvalidFilterException(violations);
        }
        return configuration;
    }

    public MetricRequest toConversionRequest(ConversionQueryRequest request) {
        ConversionQueryRequest query = request != null ? request : new ConversionQueryRequest();
        List<String> violations = new ArrayList<>();

        unknownFields(query.getUnknownFields(), violations);
        List<GroupKey> groupKeys = groupKeys(query.getGroupBy(), violations);
        List<SortSpec> ordering = ordering(query.getOrderBy(), groupKeys, violations);
        FilterConfiguration filter = toConfiguration(query.getFilters(), violations);

        if (!violations.isEmpty()) {
            throw new InvalidFilterException(violations);
        }
        return MetricRequest.conversion(groupKeys, ordering, filter);
    }

    private FilterConfiguration toConfiguration(FilterRequest request, List<String> violations) {
        if (request == null) {
            return FilterConfiguration.none();
        }
        unknownFields(request.getUnknownFields(), violations);
        return FilterConfiguration.builder()
                .months(textClause("months", request.getMonths(), allowedMonths, violations))
                .visitorTypes(textClause("visitor_types", request.getVisitorTypes(), allowedVisitorTypes, violations))
                .weekend(weekendClause(request.getWeekend()))
                .browsers(codeClause("browsers", request.getBrowsers(), violations))
                .operatingSystems(codeClause("operating_systems", request.getOperatingSystems(), violations))
                .regions(codeClause("regions", request.getRegions(), violations))
                .trafficTypes(codeClause("traffic_types", request.getTrafficTypes(), violations))
                .pageTypes(pageTypeClause(request.getPageTypes(), violations))
                .build();
    }

    private static void unknownFields(Map<String, Object> fields, List<String> violations) {
        if (fields == null) {
            return;
        }
        for (String name : fields.keySet()) {
            violations.add("campo desconocido '" + name + "'");
        }
    }

    private static FilterClause<String> textClause(String field, List<String> values, Set<String> allowed,
                                                   List<String> violations) {
        if (values == null) {
            return FilterClause.unset();
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                violations.add(field + ": contiene un valor vacío");
            } else if (!allowed.isEmpty() && !allowed.contains(value)) {
                violations.add(field + ": valor no permitido '" + value + "', permitidos: " + allowed);
            }
        }
        return FilterClause.of(values);
    }

    private static FilterClause<Boolean> weekendClause(Boolean weekend) {
        if (weekend == null) {
            return FilterClause.unset();
        }
        return FilterClause.of(List.of(weekend));
    }

    private static FilterClause<Integer> codeClause(String field, List<Integer> codes, List<String> violations) {
        if (codes == null) {
            return FilterClause.unset();
        }
        for (Integer code : codes) {
            if (code == null) {
                violations.add(field + ": contiene un código nulo");
            } else if (code <= 0) {
                violations.add(field + ": código inválido " + code + ", debe ser mayor que 0");
            }
        }
        return FilterClause.of(codes);
    }

    private static FilterClause<PageType> pageTypeClause(List<String> labels, List<String> violations) {
        if (labels == null) {
            return FilterClause.unset();
        }
        List<PageType> pageTypes = new ArrayList<>();
        for (String label : labels) {
            Optional<PageType> pageType = PageType.fromLabel(label);
            if (pageType.isPresent()) {
                pageTypes.add(pageType.get());
            } else {
                violations.add("page_types: tipo de página desconocido '" + label + "'");
            }
        }
        return FilterClause.of(pageTypes);
    }

    private static List<GroupKey> groupKeys(List<String> columns, List<String> violations) {
        List<GroupKey> groupKeys = new ArrayList<>();
        if (columns == null) {
            return groupKeys;
        }
        for (String column : columns) {
            Optional<GroupKey> groupKey = GroupKey.fromColumn(column);
            if (!groupKey.isPresent()) {
                violations.add("group_by: columna desconocida '" + column + "'");
            } else if (groupKeys.contains(groupKey.get())) {
                violations.add("group_by: columna repetida '" + column + "'");
            } else {
                groupKeys.add(groupKey.get());
            }
        }
        return groupKeys;
    }

    /**
     * Cada criterio es "columna" o "columna:asc|desc". Sin dirección, las métricas se ordenan
     * de forma descendente y las claves de forma ascendente.
     */
    private static List<SortSpec> ordering(List<String> criteria, List<GroupKey> groupKeys, List<String> violations) {
        List<SortSpec> ordering = new ArrayList<>();
        if (criteria == null) {
            return ordering;
        }
        for (String criterion : criteria) {
            if (criterion == null || criterion.isBlank()) {
                violations.add("order_by: criterio vacío");
                continue;
            }
            String[] parts = criterion.trim().split(":", -1);
            String column = parts[0].trim();
            Boolean descending = null;
            if (parts.length > 2) {
                violations.add("order_by: criterio mal formado '" + criterion + "'");
                continue;
            }
            if (parts.length == 2) {
                String direction = parts[1].trim().toLowerCase();
                if ("asc".equals(direction)) {
                    descending = false;
                } else if ("desc".equals(direction)) {
                    descending = true;
                } else {
                    violations.add("order_by: dirección inválida '" + parts[1] + "' en '" + criterion + "'");
                    continue;
                }
            }

            SortSpec.Field metric = metricField(column);
            if (metric != null) {
                ordering.add(SortSpec.metric(metric, descending == null || descending));
                continue;
            }
            Optional<GroupKey> groupKey = GroupKey.fromColumn(column);
            if (groupKey.isPresent() && groupKeys.contains(groupKey.get())) {
                ordering.add(SortSpec.key(groupKey.get(), descending != null && descending));
            } else {
                violations.add("order_by: la columna '" + column + "' no es métrica ni clave de agrupación");
            }
        }
        return ordering;
    }

    private static SortSpec.Field metricField(String column) {
        switch (column.toLowerCase()) {
            case METRIC_TOTAL_SESSIONS:
                return SortSpec.Field.TOTAL_SESSIONS;
            case METRIC_CONVERSIONS:
                return SortSpec.Field.CONVERSIONS;
            case METRIC_CONVERSION_RATE:
                return SortSpec.Field.CONVERSION_RATE;
            default:
                return null;
        }
    }
}
