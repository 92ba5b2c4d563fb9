package pe.farmaciasperuanas.digital.process.clickstream.infrastructure;

import org.junit.jupiter.api.Test;
import pe.farmaciasperuanas.digital.process.clickstream.domain.DTO.ConversionQueryRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.DTO.FilterRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.InvalidFilterException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.GroupKey;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricKind;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.PageType;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.SortSpec;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterRequestMapperTest {

    private final FilterRequestMapper mapper = new FilterRequestMapper(
            new String[]{"Feb", "Mar", "May", "Nov"},
            new String[]{"Returning_Visitor", "New_Visitor", "Other"});

    @Test
    void nullRequestIsUnrestricted() {
        assertThat(mapper.toConfiguration(null)).isEqualTo(FilterConfiguration.none());
        assertThat(mapper.toConfiguration(new FilterRequest()).isUnrestricted()).isTrue();
    }

    @Test
    void mapsEveryClauseAndKeepsEmptySets() {
        FilterRequest request = FilterRequest.builder()
                .months(List.of("Feb"))
                .visitorTypes(List.of("New_Visitor"))
                .weekend(true)
                .browsers(List.of())
                .regions(List.of(1, 3))
                .pageTypes(List.of("Product Related", "administrative"))
                .build();

        FilterConfiguration filter = mapper.toConfiguration(request);

        assertThat(filter.getMonths().values()).containsExactly("Feb");
        assertThat(filter.getWeekend().values()).containsExactly(true);
        assertThat(filter.getBrowsers().isSet()).isTrue();
        assertThat(filter.getBrowsers().values()).isEmpty();
        assertThat(filter.getOperatingSystems().isSet()).isFalse();
        assertThat(filter.getRegions().values()).containsExactly(1, 3);
        assertThat(filter.getPageTypes().values())
                .containsExactlyInAnyOrder(PageType.PRODUCT_RELATED, PageType.ADMINISTRATIVE);
    }

    @Test
    void collectsEveryViolation() {
        FilterRequest request = FilterRequest.builder()
                .months(List.of("Jan"))
                .browsers(Arrays.asList(1, null, -2))
                .pageTypes(List.of("Checkout"))
                .build();

        assertThatThrownBy(() -> mapper.toConfiguration(request))
                .isInstanceOfSatisfying(InvalidFilterException.class, e ->
                        assertThat(e.getViolations()).hasSize(4)
                                .anyMatch(v -> v.startsWith("months"))
                                .anyMatch(v -> v.startsWith("page_types")));
    }

    @Test
    void rejectsMisspelledFieldsInsteadOfIgnoringThem() {
        FilterRequest filters = new FilterRequest();
        filters.addUnknownField("browser", List.of());
        ConversionQueryRequest query = ConversionQueryRequest.builder()
                .groupBy(List.of("weekend"))
                .filters(filters)
                .build();
        query.addUnknownField("groupby", List.of("month"));

        assertThatThrownBy(() -> mapper.toConfiguration(filters))
                .isInstanceOfSatisfying(InvalidFilterException.class, e ->
                        assertThat(e.getViolations()).containsExactly("campo desconocido 'browser'"));
        assertThatThrownBy(() -> mapper.toConversionRequest(query))
                .isInstanceOfSatisfying(InvalidFilterException.class, e ->
                        assertThat(e.getViolations()).containsExactlyInAnyOrder(
                                "campo desconocido 'groupby'", "campo desconocido 'browser'"));
    }

    @Test
    void emptyAllowedListsSkipValueValidation() {
        FilterRequestMapper permissive = new FilterRequestMapper(new String[0], new String[0]);

        FilterConfiguration filter = permissive.toConfiguration(FilterRequest.builder()
                .months(List.of("Jan"))
                .build());

        assertThat(filter.getMonths().values()).containsExactly("Jan");
    }

    @Test
    void buildsConversionRequest() {
        ConversionQueryRequest query = ConversionQueryRequest.builder()
                .groupBy(List.of("browser_name", "WEEKEND"))
                .orderBy(List.of("conversion_rate", "browser_name:desc", "total_sessions:asc"))
                .filters(FilterRequest.builder().weekend(false).build())
                .build();

        MetricRequest request = mapper.toConversionRequest(query);

        assertThat(request.getKind()).isEqualTo(MetricKind.CONVERSION_BY_KEY);
        assertThat(request.getGroupKeys()).containsExactly(GroupKey.BROWSER_NAME, GroupKey.WEEKEND);
        assertThat(request.getOrdering()).containsExactly(
                SortSpec.rateDescending(),
                SortSpec.key(GroupKey.BROWSER_NAME, true),
                SortSpec.metric(SortSpec.Field.TOTAL_SESSIONS, false));
        assertThat(request.getFilter().getWeekend().values()).containsExactly(false);
    }

    @Test
    void rejectsUnknownDuplicateAndUngroupedColumns() {
        ConversionQueryRequest query = ConversionQueryRequest.builder()
                .groupBy(List.of("browser_name", "browser_name", "colour"))
                .orderBy(List.of("region_name", "conversions:sideways"))
                .build();

        assertThatThrownBy(() -> mapper.toConversionRequest(query))
                .isInstanceOfSatisfying(InvalidFilterException.class, e ->
                        assertThat(e.getViolations()).hasSize(4));
    }

    @Test
    void emptyQueryIsSummaryOfConversion() {
        MetricRequest request = mapper.toConversionRequest(null);

        assertThat(request.getGroupKeys()).isEmpty();
        assertThat(request.getOrdering()).isEmpty();
        assertThat(request.getFilter().isUnrestricted()).isTrue();
    }
}
