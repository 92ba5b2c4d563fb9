package pe.farmaciasperuanas.digital.process.clickstream.domain.service;

import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.ClickstreamSnapshot;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.DimensionRegistry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.EnrichedRecord;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Vista desnormalizada de las sesiones: cada sesión con los nombres de sus cuatro dimensiones
 * y la etiqueta de fin de semana.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * Equivale a un LEFT JOIN: ninguna sesión se descarta y un código sin entrada
 * en la tabla de dimensión se muestra como "&lt;Dimensión&gt; &lt;código&gt;".
 */
@Component
public class DenormalizationView {

    public static final String WEEKEND_LABEL = "Weekend";
    public static final String WEEKDAY_LABEL = "Weekday";

    public Stream<EnrichedRecord> stream(ClickstreamSnapshot snapshot) {
        DimensionRegistry registry = snapshot.getRegistry();
        return snapshot.getSessions().stream().map(session -> enrich(session, registry));
    }

    public List<EnrichedRecord> enrich(ClickstreamSnapshot snapshot) {
        return stream(snapshot).collect(Collectors.toList());
    }

    public List<EnrichedRecord> enrich(List<SessionRecord> sessions, DimensionRegistry registry) {
        return sessions.stream()
                .map(session -> enrich(session, registry))
                .collect(Collectors.toList());
    }

    public EnrichedRecord enrich(SessionRecord session, DimensionRegistry registry) {
        return EnrichedRecord.builder()
                .session(session)
                .browserName(registry.resolve(Dimension.BROWSER, session.getBrowser()))
                .operatingSystemName(registry.resolve(Dimension.OPERATING_SYSTEM, session.getOperatingSystem()))
                .regionName(registry.resolve(Dimension.REGION, session.getRegion()))
                .trafficName(registry.resolve(Dimension.TRAFFIC, session.getTrafficType()))
                .weekendLabel(session.isWeekend() ? WEEKEND_LABEL : WEEKDAY_LABEL)
                .build();
    }
}
