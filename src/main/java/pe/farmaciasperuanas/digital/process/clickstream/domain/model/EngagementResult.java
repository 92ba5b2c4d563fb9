package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Promedios de rebote, salida y valor de página por resultado de conversión.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EngagementResult implements MetricRow {
    boolean revenue;
    long sessions;
    double avgBounceRate;
    double avgExitRate;
    double avgPageValue;
}
