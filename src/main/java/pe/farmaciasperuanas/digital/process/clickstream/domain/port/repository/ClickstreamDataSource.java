package pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository;

import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.DimensionEntry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import reactor.core.publisher.Flux;

/**
 * Acceso de solo lectura a la colección de sesiones y a las cuatro tablas de dimensión.
 */
public interface ClickstreamDataSource {

    Flux<SessionRecord> findAllSessions();

    Flux<DimensionEntry> findDimensionEntries(Dimension dimension);
}
