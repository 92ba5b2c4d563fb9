package pe.farmaciasperuanas.digital.process.clickstream.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.ClickstreamSnapshot;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.DimensionRegistry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.EnrichedRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterOptions;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRow;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.PageType;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Punto de entrada del motor: filtra el snapshot, lo desnormaliza y delega la agregación
 * según el tipo de métrica. No guarda estado; el mismo snapshot y la misma solicitud
 * producen siempre las mismas filas.
 */
@Component
@RequiredArgsConstructor
public class MetricsEngine {

    private final DenormalizationView denormalizationView;
    private final FilterPredicateEngine filterPredicateEngine;
    private final AggregationEngine aggregationEngine;

    public List<? extends MetricRow> evaluate(ClickstreamSnapshot snapshot, MetricRequest request) {
        FilterConfiguration filter = request.getFilter();

        switch (request.getKind()) {
            case CONVERSION_BY_KEY:
                return aggregationEngine.aggregate(
                        enrich(snapshot, filter), request.getGroupKeys(), request.getOrdering());
            case EXECUTIVE_SUMMARY:
                return List.of(aggregationEngine.summarize(enrich(snapshot, filter)));
            case ENGAGEMENT_IMPACT:
                return aggregationEngine.engagement(filter(snapshot, filter));
            case PAGE_TYPE_PERFORMANCE:
                return aggregationEngine.pageTypePerformance(filter(snapshot, filter));
            case PAGE_TYPE_PERFORMANCE_TIDY:
                return aggregationEngine.pageTypePerformanceTidy(filter(snapshot, filter));
            case PAGE_TYPE_BREAKDOWN: {
                // La cláusula de tipos de página vacía ramas, no filtra sesiones
                List<SessionRecord> sessions = snapshot.getSessions().stream()
                        .filter(session -> filterPredicateEngine.matchesAttributes(session, filter))
                        .collect(Collectors.toList());
                return aggregationEngine.pageTypeBreakdown(sessions, filter.getPageTypes());
            }
            default:
                throw new IllegalArgumentException("Tipo de métrica no soportado: " + request.getKind());
        }
    }

    public FilterOptions filterOptions(ClickstreamSnapshot snapshot) {
        List<SessionRecord> sessions = snapshot.getSessions();
        DimensionRegistry registry = snapshot.getRegistry();

        return FilterOptions.builder()
                .months(distinct(sessions, SessionRecord::getMonth))
                .visitorTypes(distinct(sessions, SessionRecord::getVisitorType))
                .weekend(distinct(sessions, SessionRecord::isWeekend))
                .browsers(dimensionOptions(sessions, registry, Dimension.BROWSER))
                .operatingSystems(dimensionOptions(sessions, registry, Dimension.OPERATING_SYSTEM))
                .regions(dimensionOptions(sessions, registry, Dimension.REGION))
                .trafficTypes(dimensionOptions(sessions, registry, Dimension.TRAFFIC))
                .pageTypes(List.of(PageType.values()))
                .build();
    }

    private List<SessionRecord> filter(ClickstreamSnapshot snapshot, FilterConfiguration filter) {
        if (filter.isUnrestricted()) {
            return snapshot.getSessions();
        }
        return snapshot.getSessions().stream()
                .filter(filterPredicateEngine.predicate(filter))
                .collect(Collectors.toList());
    }

    private List<EnrichedRecord> enrich(ClickstreamSnapshot snapshot, FilterConfiguration filter) {
        return denormalizationView.enrich(filter(snapshot, filter), snapshot.getRegistry());
    }

    private static <T extends Comparable<T>> List<T> distinct(List<SessionRecord> sessions,
                                                              Function<SessionRecord, T> attribute) {
        return sessions.stream()
                .map(attribute)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private static List<FilterOptions.DimensionOption> dimensionOptions(List<SessionRecord> sessions,
                                                                        DimensionRegistry registry,
                                                                        Dimension dimension) {
        return distinct(sessions, dimension::codeOf).stream()
                .map(code -> new FilterOptions.DimensionOption(code, registry.resolve(dimension, code)))
                .collect(Collectors.toList());
    }
}
