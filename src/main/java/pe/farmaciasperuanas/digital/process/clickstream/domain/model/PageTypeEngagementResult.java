package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Formato largo del rendimiento por tipo de página: una fila por (conversión, categoría).
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PageTypeEngagementResult implements MetricRow {
    boolean revenue;
    PageType pageType;
    double avgPages;
    double avgSeconds;
}
