package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.Builder;
import lombok.Value;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;

/**
 * Sesión desnormalizada: códigos originales más nombres resueltos y etiqueta de fin de semana.
 */
@Value
@Builder
public class EnrichedRecord {
    SessionRecord session;
    String browserName;
    String operatingSystemName;
    String regionName;
    String trafficName;
    String weekendLabel;

    public String nameOf(Dimension dimension) {
        switch (dimension) {
            case BROWSER:
                return browserName;
            case OPERATING_SYSTEM:
                return operatingSystemName;
            case REGION:
                return regionName;
            case TRAFFIC:
                return trafficName;
            default:
                throw new IllegalArgumentException("Dimensión no soportada: " + dimension);
        }
    }
}
