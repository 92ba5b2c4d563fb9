package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.Getter;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;

import java.util.Objects;
import java.util.function.Function;

/**
 * Dimensiones categóricas de una sesión que se resuelven contra una tabla de nombres.
 */
@Getter
public enum Dimension {
    BROWSER("Browser", "dim_browser", "browser", SessionRecord::getBrowser),
    OPERATING_SYSTEM("OS", "dim_os", "operatingsystems", SessionRecord::getOperatingSystem),
    REGION("Region", "dim_region", "region", SessionRecord::getRegion),
    TRAFFIC("Traffic", "dim_traffic", "traffictype", SessionRecord::getTrafficType);

    private final String label;
    private final String collection;
    private final String sessionField;
    private final Function<SessionRecord, Integer> codeExtractor;

    Dimension(String label, String collection, String sessionField,
              Function<SessionRecord, Integer> codeExtractor) {
        this.label = label;
        this.collection = collection;
        this.sessionField = sessionField;
        this.codeExtractor = codeExtractor;
    }

    public Integer codeOf(SessionRecord record) {
        return codeExtractor.apply(record);
    }

    /**
     * Etiqueta sintética para un código sin entrada en la tabla de dimensión.
     * Un código nulo produce solo el prefijo seguido de un espacio.
     */
    public String fallbackLabel(Integer code) {
        return label + " " + Objects.toString(code, "");
    }
}
