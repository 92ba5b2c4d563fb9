package pe.farmaciasperuanas.digital.process.clickstream.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.annotation.Id;

/**
 * Entrada de una tabla de dimensión (dim_browser, dim_os, dim_region, dim_traffic).
 * La colección concreta se elige al consultar, ver {@code Dimension#getCollection()}.
 */
@Value
@Builder
@AllArgsConstructor
public class DimensionEntry {
    @Id
    Integer code;
    String name;
}
