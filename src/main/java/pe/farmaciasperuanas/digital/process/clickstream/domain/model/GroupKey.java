package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.Getter;

import java.util.Optional;
import java.util.function.Function;

/**
 * Atributos por los que se puede agrupar un conjunto de sesiones enriquecidas.
 * La columna es el nombre con el que la clave aparece en cada fila de resultado.
 */
@Getter
public enum GroupKey {
    MONTH("month", r -> r.getSession().getMonth()),
    VISITOR_TYPE("visitortype", r -> r.getSession().getVisitorType()),
    WEEKEND("weekend", r -> r.getSession().isWeekend()),
    WEEKEND_LABEL("weekend_label", EnrichedRecord::getWeekendLabel),
    REVENUE("revenue", r -> r.getSession().isRevenue()),
    SPECIAL_DAY("specialday", r -> r.getSession().getSpecialDay()),
    BROWSER("browser", r -> r.getSession().getBrowser()),
    BROWSER_NAME("browser_name", EnrichedRecord::getBrowserName),
    OPERATING_SYSTEM("operatingsystems", r -> r.getSession().getOperatingSystem()),
    OS_NAME("os_name", EnrichedRecord::getOperatingSystemName),
    REGION("region", r -> r.getSession().getRegion()),
    REGION_NAME("region_name", EnrichedRecord::getRegionName),
    TRAFFIC_TYPE("traffictype", r -> r.getSession().getTrafficType()),
    TRAFFIC_NAME("traffic_name", EnrichedRecord::getTrafficName);

    private final String column;
    private final Function<EnrichedRecord, Comparable<?>> extractor;

    GroupKey(String column, Function<EnrichedRecord, Comparable<?>> extractor) {
        this.column = column;
        this.extractor = extractor;
    }

    public Comparable<?> valueOf(EnrichedRecord record) {
        return extractor.apply(record);
    }

    /**
     * Acepta el nombre de columna (browser_name) o el nombre de la constante (BROWSER_NAME).
     */
    public static Optional<GroupKey> fromColumn(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (GroupKey key : values()) {
            if (key.column.equalsIgnoreCase(name) || key.name().equalsIgnoreCase(name)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
