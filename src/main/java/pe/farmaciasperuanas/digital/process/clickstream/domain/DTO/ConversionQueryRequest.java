package pe.farmaciasperuanas.digital.process.clickstream.domain.DTO;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consulta libre de conversión.
 * <ul>
 * <li>group_by: columnas de agrupación, p.ej. ["browser_name", "weekend"].</li>
 * <li>order_by: criterios "columna[:asc|:desc]"; columnas de métrica: total_sessions,
 * conversions, conversion_rate.</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversionQueryRequest {
    private List<String> groupBy;
    private List<String> orderBy;
    private FilterRequest filters;

    /** Claves del JSON que no corresponden a ningún campo; se rechazan al validar. */
    @JsonIgnore
    private Map<String, Object> unknownFields;

    @JsonAnySetter
    public void addUnknownField(String name, Object value) {
        if (unknownFields == null) {
            unknownFields = new LinkedHashMap<>();
        }
        unknownFields.put(name, value);
    }
}
