package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CohortViewTest {

    @Test
    void resolvesPathsAndConstantNames() {
        assertThat(CohortView.fromPath("weekday-vs-weekend")).contains(CohortView.WEEKDAY_VS_WEEKEND);
        assertThat(CohortView.fromPath("BROWSER_USAGE")).contains(CohortView.BROWSER_USAGE);
        assertThat(CohortView.fromPath("unknown")).isEmpty();
        assertThat(CohortView.fromPath(null)).isEmpty();
        assertThat(BreakdownView.fromPath("traffic-type-performance")).contains(BreakdownView.TRAFFIC_TYPE_PERFORMANCE);
    }

    @Test
    void executiveSummaryHasNoGrouping() {
        MetricRequest request = CohortView.EXECUTIVE_SUMMARY.toRequest();

        assertThat(request.getKind()).isEqualTo(MetricKind.EXECUTIVE_SUMMARY);
        assertThat(request.getGroupKeys()).isEmpty();
        assertThat(request.getFilter().isUnrestricted()).isTrue();
    }

    @Test
    void monthlyNewVsReturningRestrictsVisitorTypes() {
        MetricRequest request = CohortView.MONTHLY_NEW_VS_RETURNING.toRequest();

        assertThat(request.getGroupKeys()).containsExactly(GroupKey.MONTH, GroupKey.VISITOR_TYPE);
        assertThat(request.getFilter().getVisitorTypes().values())
                .containsExactlyInAnyOrder("New_Visitor", "Returning_Visitor");
    }

    @Test
    void weekdayByTrafficOrdersByLabelThenRate() {
        MetricRequest request = CohortView.WEEKDAY_CONVERSION_BY_TRAFFIC.toRequest();

        assertThat(request.getOrdering()).containsExactly(
                SortSpec.keyAscending(GroupKey.WEEKEND_LABEL), SortSpec.rateDescending());
    }

    @Test
    void breakdownCarriesTheGivenFilter() {
        FilterConfiguration filter = FilterConfiguration.builder().browsers(FilterClause.of(1)).build();

        MetricRequest request = BreakdownView.BROWSER_PERFORMANCE.toRequest(filter);

        assertThat(request.getFilter()).isEqualTo(filter);
        assertThat(request.getView()).isEqualTo("browser-performance");
        assertThat(request.getOrdering()).isEqualTo(List.of(SortSpec.sessionsDescending()));
    }
}
