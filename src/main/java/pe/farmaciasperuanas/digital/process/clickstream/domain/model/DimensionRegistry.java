package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.DimensionEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registro inmutable de nombres por código para las cuatro dimensiones.
 * Se construye una vez por snapshot y solo se lee desde el motor.
 */
public final class DimensionRegistry {

    private static final DimensionRegistry EMPTY = builder().build();

    private final Map<Dimension, Map<Integer, String>> names;

    private DimensionRegistry(Map<Dimension, Map<Integer, String>> names) {
        this.names = names;
    }

    public static DimensionRegistry empty() {
        return EMPTY;
    }

    public static DimensionRegistry of(Map<Dimension, ? extends Collection<DimensionEntry>> entries) {
        Builder builder = builder();
        entries.forEach((dimension, list) -> list.forEach(entry -> builder.entry(dimension, entry)));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> lookup(Dimension dimension, Integer code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(names.get(dimension).get(code));
    }

    /**
     * Nombre de la dimensión o la etiqueta de respaldo cuando el código no existe.
     */
    public String resolve(Dimension dimension, Integer code) {
        return lookup(dimension, code).orElseGet(() -> dimension.fallbackLabel(code));
    }

    public Map<Integer, String> entries(Dimension dimension) {
        return names.get(dimension);
    }

    public static final class Builder {
        private final Map<Dimension, Map<Integer, String>> names = new EnumMap<>(Dimension.class);

        private Builder() {
            for (Dimension dimension : Dimension.values()) {
                names.put(dimension, new TreeMap<>());
            }
        }

        /**
         * Registra un nombre. Se conserva la primera entrada de un código repetido y
         * se ignoran nombres nulos, que se resuelven luego con la etiqueta de respaldo.
         */
        public Builder put(Dimension dimension, Integer code, String name) {
            if (code != null && name != null) {
                names.get(dimension).putIfAbsent(code, name);
            }
            return this;
        }

        public Builder entry(Dimension dimension, DimensionEntry entry) {
            return put(dimension, entry.getCode(), entry.getName());
        }

        public DimensionRegistry build() {
            Map<Dimension, Map<Integer, String>> copy = new EnumMap<>(Dimension.class);
            names.forEach((dimension, map) ->
                    copy.put(dimension, Collections.unmodifiableMap(new TreeMap<>(map))));
            return new DimensionRegistry(Collections.unmodifiableMap(copy));
        }
    }
}
