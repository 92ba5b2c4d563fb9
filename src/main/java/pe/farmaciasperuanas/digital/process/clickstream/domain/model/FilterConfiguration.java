package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.stream.Stream;

/**
 * Configuración de filtros de una consulta: ocho cláusulas independientes combinadas con AND.
 * Ninguna cláusula es nula; la ausencia de filtro se expresa con {@link FilterClause#unset()}.
 */
@Value
@Builder(toBuilder = true)
public class FilterConfiguration {

    private static final FilterConfiguration NONE = FilterConfiguration.builder().build();

    @Builder.Default
    FilterClause<String> months = FilterClause.unset();
    @Builder.Default
    FilterClause<String> visitorTypes = FilterClause.unset();
    @Builder.Default
    FilterClause<Boolean> weekend = FilterClause.unset();
    @Builder.Default
    FilterClause<Integer> browsers = FilterClause.unset();
    @Builder.Default
    FilterClause<Integer> operatingSystems = FilterClause.unset();
    @Builder.Default
    FilterClause<Integer> regions = FilterClause.unset();
    @Builder.Default
    FilterClause<Integer> trafficTypes = FilterClause.unset();
    @Builder.Default
    FilterClause<PageType> pageTypes = FilterClause.unset();

    public static FilterConfiguration none() {
        return NONE;
    }

    public boolean isUnrestricted() {
        return Stream.of(months, visitorTypes, weekend, browsers, operatingSystems, regions, trafficTypes, pageTypes)
                .noneMatch(FilterClause::isSet);
    }
}
