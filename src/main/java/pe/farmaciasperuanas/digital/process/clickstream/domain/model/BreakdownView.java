package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Desgloses de conversión predefinidos que, a diferencia de {@link CohortView}, aceptan filtros.
 * Corresponden a los paneles filtrables del dashboard.
 */
public enum BreakdownView {
    WEEKDAY_VS_WEEKEND(
            List.of(GroupKey.WEEKEND),
            List.of()),
    MONTHWISE_REVENUE(
            List.of(GroupKey.MONTH),
            List.of()),
    BROWSER_PERFORMANCE(
            List.of(GroupKey.BROWSER_NAME),
            List.of(SortSpec.sessionsDescending())),
    OS_PERFORMANCE(
            List.of(GroupKey.OS_NAME),
            List.of(SortSpec.sessionsDescending())),
    REGION_PERFORMANCE(
            List.of(GroupKey.REGION_NAME),
            List.of(SortSpec.conversionsDescending())),
    TRAFFIC_TYPE_PERFORMANCE(
            List.of(GroupKey.TRAFFIC_NAME),
            List.of(SortSpec.rateDescending(), SortSpec.sessionsDescending())),
    SPECIAL_DAY_EFFECT(
            List.of(GroupKey.SPECIAL_DAY),
            List.of()),
    VISITOR_TYPE_CONVERSION(
            List.of(GroupKey.VISITOR_TYPE, GroupKey.WEEKEND),
            List.of(SortSpec.rateDescending()));

    private final List<GroupKey> groupKeys;
    private final List<SortSpec> ordering;

    BreakdownView(List<GroupKey> groupKeys, List<SortSpec> ordering) {
        this.groupKeys = groupKeys;
        this.ordering = ordering;
    }

    public List<GroupKey> getGroupKeys() {
        return groupKeys;
    }

    public String getPath() {
        return ViewNames.toPath(this);
    }

    public MetricRequest toRequest(FilterConfiguration filter) {
        return MetricRequest.builder()
                .view(getPath())
                .kind(MetricKind.CONVERSION_BY_KEY)
                .groupKeys(groupKeys)
                .ordering(ordering)
                .filter(filter)
                .build();
    }

    public static Optional<BreakdownView> fromPath(String path) {
        return ViewNames.fromPath(BreakdownView.class, path);
    }
}
