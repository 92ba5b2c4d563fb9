package pe.farmaciasperuanas.digital.process.clickstream.domain.service;

import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.EngagementResult;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.EnrichedRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterClause;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.GroupKey;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricResult;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.PageType;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.PageTypeEngagementResult;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.PageTypePerformanceResult;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.SortSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Agregaciones sobre sesiones ya filtradas.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * <ul>
 * <li>Conversión por clave: sesiones, conversiones y tasa por grupo.</li>
 * <li>Engagement: promedios de rebote, salida y valor de página según conversión.</li>
 * <li>Tipo de página: promedios por categoría (ancho y largo) y desglose por vistas de página.</li>
 * </ul>
 *
 * Ningún cálculo falla por casos numéricos: un denominador cero produce una tasa indefinida.
 */
@Component
public class AggregationEngine {

    public static final String PAGE_TYPE_COLUMN = "page_type";

    /**
     * Agrupa por las claves indicadas y ordena según los criterios. Sin claves, devuelve
     * una única fila resumen (también con entrada vacía).
     */
    public List<MetricResult> aggregate(List<EnrichedRecord> records, List<GroupKey> groupKeys,
                                        List<SortSpec> ordering) {
        if (groupKeys.isEmpty()) {
            return List.of(summarize(records));
        }

        // [total, conversiones] por tupla de claves, en orden de aparición
        Map<List<Object>, long[]> counters = new LinkedHashMap<>();
        for (EnrichedRecord record : records) {
            List<Object> key = new ArrayList<>(groupKeys.size());
            for (GroupKey groupKey : groupKeys) {
                key.add(groupKey.valueOf(record));
            }
            long[] counter = counters.computeIfAbsent(key, k -> new long[2]);
            counter[0]++;
            if (record.getSession().isRevenue()) {
                counter[1]++;
            }
        }

        List<MetricResult> rows = new ArrayList<>(counters.size());
        counters.forEach((key, counter) -> rows.add(MetricResult.of(groupKeys, key, counter[0], counter[1])));
        rows.sort(comparator(groupKeys, ordering));
        return rows;
    }

    public MetricResult summarize(List<EnrichedRecord> records) {
        long conversions = records.stream().filter(r -> r.getSession().isRevenue()).count();
        return MetricResult.of(Map.of(), records.size(), conversions);
    }

    public List<EngagementResult> engagement(List<SessionRecord> sessions) {
        List<EngagementResult> rows = new ArrayList<>();
        groupByRevenue(sessions).forEach((revenue, group) -> rows.add(EngagementResult.builder()
                .revenue(revenue)
                .sessions(group.size())
                .avgBounceRate(average(group, SessionRecord::getBounceRates))
                .avgExitRate(average(group, SessionRecord::getExitRates))
                .avgPageValue(average(group, SessionRecord::getPageValues))
                .build()));
        return rows;
    }

    public List<PageTypePerformanceResult> pageTypePerformance(List<SessionRecord> sessions) {
        List<PageTypePerformanceResult> rows = new ArrayList<>();
        groupByRevenue(sessions).forEach((revenue, group) -> rows.add(PageTypePerformanceResult.builder()
                .revenue(revenue)
                .avgAdminPages(average(group, SessionRecord::getAdministrative))
                .avgAdminDuration(average(group, SessionRecord::getAdministrativeDuration))
                .avgInfoPages(average(group, SessionRecord::getInformational))
                .avgInfoDuration(average(group, SessionRecord::getInformationalDuration))
                .avgProductPages(average(group, SessionRecord::getProductRelated))
                .avgProductDuration(average(group, SessionRecord::getProductRelatedDuration))
                .build()));
        return rows;
    }

    /**
     * Una fila por (conversión, categoría), conversión descendente y luego categoría.
     */
    public List<PageTypeEngagementResult> pageTypePerformanceTidy(List<SessionRecord> sessions) {
        List<PageTypeEngagementResult> rows = new ArrayList<>();
        groupByRevenue(sessions).forEach((revenue, group) -> {
            for (PageType pageType : PageType.values()) {
                rows.add(PageTypeEngagementResult.builder()
                        .revenue(revenue)
                        .pageType(pageType)
                        .avgPages(average(group, pageType::pageViews))
                        .avgSeconds(average(group, pageType::duration))
                        .build());
            }
        });
        return rows;
    }

    /**
     * Desglose por categoría de página. Suma vistas de página, no sesiones: una sesión con
     * tres vistas de producto aporta 3 al total de Product Related. Una categoría excluida
     * por la cláusula queda en cero con tasa indefinida.
     */
    public List<MetricResult> pageTypeBreakdown(List<SessionRecord> sessions, FilterClause<PageType> pageTypes) {
        List<MetricResult> rows = new ArrayList<>(PageType.values().length);
        for (PageType pageType : PageType.values()) {
            long views = 0;
            long convertedViews = 0;
            if (pageTypes.includes(pageType)) {
                for (SessionRecord session : sessions) {
                    int sessionViews = pageType.pageViews(session);
                    views += sessionViews;
                    if (session.isRevenue()) {
                        convertedViews += sessionViews;
                    }
                }
            }
            rows.add(MetricResult.of(Map.of(PAGE_TYPE_COLUMN, pageType.getLabel()), views, convertedViews));
        }
        return rows;
    }

    Comparator<MetricResult> comparator(List<GroupKey> groupKeys, List<SortSpec> ordering) {
        Comparator<MetricResult> comparator = (a, b) -> 0;
        for (SortSpec spec : ordering) {
            comparator = comparator.thenComparing(criterion(spec, groupKeys));
        }
        // Desempate: tupla de claves ascendente, nulos al final
        for (GroupKey groupKey : groupKeys) {
            comparator = comparator.thenComparing(
                    (a, b) -> compareNullsLast(a.keyValue(groupKey), b.keyValue(groupKey), false));
        }
        return comparator;
    }

    private Comparator<MetricResult> criterion(SortSpec spec, List<GroupKey> groupKeys) {
        boolean descending = spec.isDescending();
        switch (spec.getField()) {
            case KEY: {
                String column = spec.getColumn();
                if (groupKeys.stream().noneMatch(key -> key.getColumn().equals(column))) {
                    throw new IllegalArgumentException("La columna de orden no es clave de agrupación: " + column);
                }
                return (a, b) -> compareNullsLast(a.keyValue(column), b.keyValue(column), descending);
            }
            case TOTAL_SESSIONS:
                return (a, b) -> compareNullsLast(a.getTotalSessions(), b.getTotalSessions(), descending);
            case CONVERSIONS:
                return (a, b) -> compareNullsLast(a.getConversions(), b.getConversions(), descending);
            case CONVERSION_RATE:
                // Tasa indefinida al final en ambos sentidos
                return (a, b) -> compareNullsLast(
                        a.getConversionRate().orNull(), b.getConversionRate().orNull(), descending);
            default:
                throw new IllegalArgumentException("Criterio de orden no soportado: " + spec.getField());
        }
    }

    @SuppressWarnings("unchecked")
    static int compareNullsLast(Object a, Object b, boolean descending) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        int result = ((Comparable<Object>) a).compareTo(b);
        return descending ? -result : result;
    }

    private static Map<Boolean, List<SessionRecord>> groupByRevenue(List<SessionRecord> sessions) {
        return sessions.stream().collect(Collectors.groupingBy(
                SessionRecord::isRevenue,
                () -> new TreeMap<Boolean, List<SessionRecord>>(Comparator.reverseOrder()),
                Collectors.toList()));
    }

    private static double average(List<SessionRecord> group, ToDoubleFunction<SessionRecord> field) {
        return group.stream().mapToDouble(field).average().orElse(0.0);
    }
}
