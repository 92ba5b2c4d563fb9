package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Solicitud al motor: tipo de métrica, claves de agrupación, orden y filtros.
 * Es inmutable y sirve como parte de la llave de caché de resultados.
 */
@Value
@Builder(toBuilder = true)
public class MetricRequest {
    String view;
    MetricKind kind;
    @Builder.Default
    List<GroupKey> groupKeys = List.of();
    @Builder.Default
    List<SortSpec> ordering = List.of();
    @Builder.Default
    FilterConfiguration filter = FilterConfiguration.none();

    public static MetricRequest conversion(List<GroupKey> groupKeys, List<SortSpec> ordering,
                                           FilterConfiguration filter) {
        return MetricRequest.builder()
                .view("conversion")
                .kind(MetricKind.CONVERSION_BY_KEY)
                .groupKeys(List.copyOf(groupKeys))
                .ordering(List.copyOf(ordering))
                .filter(filter)
                .build();
    }

    public static MetricRequest of(MetricKind kind, FilterConfiguration filter) {
        return MetricRequest.builder()
                .view(kind.name().toLowerCase())
                .kind(kind)
                .filter(filter)
                .build();
    }
}
