package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Valores disponibles para cada filtro del dashboard, calculados sobre el snapshot vigente.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FilterOptions {
    List<String> months;
    List<String> visitorTypes;
    List<Boolean> weekend;
    List<DimensionOption> browsers;
    List<DimensionOption> operatingSystems;
    List<DimensionOption> regions;
    List<DimensionOption> trafficTypes;
    List<PageType> pageTypes;

    @Value
    public static class DimensionOption {
        Integer code;
        String name;
    }
}
