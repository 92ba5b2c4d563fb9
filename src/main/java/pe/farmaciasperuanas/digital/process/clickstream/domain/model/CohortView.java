package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Vistas fijas del dashboard. No reciben filtros en tiempo de consulta y siempre operan
 * sobre el conjunto completo de sesiones enriquecidas (salvo la restricción propia de la vista).
 */
public enum CohortView {
    WEEKDAY_VS_WEEKEND(
            List.of(GroupKey.WEEKEND),
            List.of()),
    BROWSER_USAGE(
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
            List.of(SortSpec.conversionsDescending())),
    SPECIAL_DAY_EFFECT(
            List.of(GroupKey.SPECIAL_DAY),
            List.of()),
    MONTHLY_REVENUE(
            List.of(GroupKey.MONTH),
            List.of()),
    MONTHLY_NEW_VS_RETURNING(
            List.of(GroupKey.MONTH, GroupKey.VISITOR_TYPE),
            List.of(),
            FilterConfiguration.builder()
                    .visitorTypes(FilterClause.of("New_Visitor", "Returning_Visitor"))
                    .build()),
    WEEKDAY_CONVERSION_BY_TRAFFIC(
            List.of(GroupKey.WEEKEND_LABEL, GroupKey.TRAFFIC_NAME),
            List.of(SortSpec.keyAscending(GroupKey.WEEKEND_LABEL), SortSpec.rateDescending())),
    BROWSER_OS_CONVERSION_MATRIX(
            List.of(GroupKey.BROWSER_NAME, GroupKey.OS_NAME),
            List.of(SortSpec.sessionsDescending())),
    VISITOR_TYPE_BY_WEEKEND(
            List.of(GroupKey.VISITOR_TYPE, GroupKey.WEEKEND),
            List.of(SortSpec.rateDescending())),
    EXECUTIVE_SUMMARY(
            List.of(),
            List.of());

    private final List<GroupKey> groupKeys;
    private final List<SortSpec> ordering;
    private final FilterConfiguration restriction;

    CohortView(List<GroupKey> groupKeys, List<SortSpec> ordering) {
        this(groupKeys, ordering, FilterConfiguration.none());
    }

    CohortView(List<GroupKey> groupKeys, List<SortSpec> ordering, FilterConfiguration restriction) {
        this.groupKeys = groupKeys;
        this.ordering = ordering;
        this.restriction = restriction;
    }

    public List<GroupKey> getGroupKeys() {
        return groupKeys;
    }

    public String getPath() {
        return ViewNames.toPath(this);
    }

    public MetricRequest toRequest() {
        return MetricRequest.builder()
                .view(getPath())
                .kind(this == EXECUTIVE_SUMMARY ? MetricKind.EXECUTIVE_SUMMARY : MetricKind.CONVERSION_BY_KEY)
                .groupKeys(groupKeys)
                .ordering(ordering)
                .filter(restriction)
                .build();
    }

    public static Optional<CohortView> fromPath(String path) {
        return ViewNames.fromPath(CohortView.class, path);
    }
}
