package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Formato ancho: páginas y duración promedio por categoría, agrupado por conversión.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PageTypePerformanceResult implements MetricRow {
    boolean revenue;
    double avgAdminPages;
    double avgAdminDuration;
    double avgInfoPages;
    double avgInfoDuration;
    double avgProductPages;
    double avgProductDuration;
}
