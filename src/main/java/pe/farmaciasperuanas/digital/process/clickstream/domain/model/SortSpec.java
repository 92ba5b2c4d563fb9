package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Criterio de orden de las filas de un resultado de conversión.
 * Cuando los criterios empatan, el motor desempata por la tupla de claves en orden ascendente.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SortSpec {

    public enum Field {
        KEY,
        TOTAL_SESSIONS,
        CONVERSIONS,
        CONVERSION_RATE
    }

    Field field;
    String column;      // Solo para KEY
    boolean descending;

    public static SortSpec key(GroupKey key, boolean descending) {
        return key(key.getColumn(), descending);
    }

    public static SortSpec key(String column, boolean descending) {
        return new SortSpec(Field.KEY, column, descending);
    }

    public static SortSpec keyAscending(GroupKey key) {
        return key(key, false);
    }

    public static SortSpec sessionsDescending() {
        return new SortSpec(Field.TOTAL_SESSIONS, null, true);
    }

    public static SortSpec conversionsDescending() {
        return new SortSpec(Field.CONVERSIONS, null, true);
    }

    public static SortSpec rateDescending() {
        return new SortSpec(Field.CONVERSION_RATE, null, true);
    }

    public static SortSpec metric(Field field, boolean descending) {
        if (field == Field.KEY) {
            throw new IllegalArgumentException("Un orden por clave requiere la columna");
        }
        return new SortSpec(field, null, descending);
    }
}
