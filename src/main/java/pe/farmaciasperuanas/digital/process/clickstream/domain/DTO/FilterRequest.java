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
 * Filtros tal como llegan por HTTP. Un campo ausente o {@code null} significa "sin filtro";
 * una lista vacía es un filtro que no acepta ninguna sesión.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FilterRequest {
    private List<String> months;
    private List<String> visitorTypes;
    private Boolean weekend;
    private List<Integer> browsers;
    private List<Integer> operatingSystems;
    private List<Integer> regions;
    private List<Integer> trafficTypes;
    private List<String> pageTypes;

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
