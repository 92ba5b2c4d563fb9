package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import java.util.Optional;

/**
 * Conversión entre constantes de vistas y su forma en URL (WEEKDAY_VS_WEEKEND &lt;-&gt; weekday-vs-weekend).
 */
final class ViewNames {

    private ViewNames() {
    }

    static String toPath(Enum<?> view) {
        return view.name().toLowerCase().replace('_', '-');
    }

    static <E extends Enum<E>> Optional<E> fromPath(Class<E> type, String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String normalized = path.trim().replace('-', '_');
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(normalized)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
