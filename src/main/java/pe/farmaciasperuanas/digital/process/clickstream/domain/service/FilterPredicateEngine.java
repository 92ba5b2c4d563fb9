package pe.farmaciasperuanas.digital.process.clickstream.domain.service;

import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;

import java.util.function.Predicate;

/**
 * Evalúa una {@link FilterConfiguration} sobre una sesión. Las cláusulas se combinan con AND;
 * la de tipos de página es la única disyunción interna.
 */
@Component
public class FilterPredicateEngine {

    public boolean matches(SessionRecord record, FilterConfiguration filter) {
        return matchesAttributes(record, filter) && matchesPageTypes(record, filter);
    }

    /**
     * Todas las cláusulas menos la de tipos de página.
     */
    public boolean matchesAttributes(SessionRecord record, FilterConfiguration filter) {
        return filter.getMonths().test(record.getMonth())
                && filter.getVisitorTypes().test(record.getVisitorType())
                && filter.getWeekend().test(record.isWeekend())
                && filter.getBrowsers().test(record.getBrowser())
                && filter.getOperatingSystems().test(record.getOperatingSystem())
                && filter.getRegions().test(record.getRegion())
                && filter.getTrafficTypes().test(record.getTrafficType());
    }

    /**
     * Verdadero si alguna de las categorías pedidas tiene al menos una vista en la sesión.
     */
    public boolean matchesPageTypes(SessionRecord record, FilterConfiguration filter) {
        return filter.getPageTypes().anyMatch(pageType -> pageType.pageViews(record) > 0);
    }

    public Predicate<SessionRecord> predicate(FilterConfiguration filter) {
        return record -> matches(record, filter);
    }
}
