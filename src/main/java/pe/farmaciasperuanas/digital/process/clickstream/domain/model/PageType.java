package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;

import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Categorías de página registradas por sesión (conteo de vistas y duración).
 */
public enum PageType {
    ADMINISTRATIVE("Administrative", SessionRecord::getAdministrative,
            SessionRecord::getAdministrativeDuration),
    INFORMATIONAL("Informational", SessionRecord::getInformational,
            SessionRecord::getInformationalDuration),
    PRODUCT_RELATED("Product Related", SessionRecord::getProductRelated,
            SessionRecord::getProductRelatedDuration);

    private final String label;
    private final ToIntFunction<SessionRecord> pageViews;
    private final ToDoubleFunction<SessionRecord> duration;

    PageType(String label, ToIntFunction<SessionRecord> pageViews, ToDoubleFunction<SessionRecord> duration) {
        this.label = label;
        this.pageViews = pageViews;
        this.duration = duration;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int pageViews(SessionRecord record) {
        return pageViews.applyAsInt(record);
    }

    public double duration(SessionRecord record) {
        return duration.applyAsDouble(record);
    }

    public static Optional<PageType> fromLabel(String label) {
        for (PageType pageType : values()) {
            if (pageType.label.equalsIgnoreCase(label) || pageType.name().equalsIgnoreCase(label)) {
                return Optional.of(pageType);
            }
        }
        return Optional.empty();
    }
}
