package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.outbound.adapter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.DimensionEntry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository.ClickstreamDataSource;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository.SessionRecordRepository;
import reactor.core.publisher.Flux;

/**
 * Lectura de sesiones (shopper_data) y de las tablas de dimensión (dim_browser, dim_os,
 * dim_region, dim_traffic) en MongoDB.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class MongoClickstreamDataSource implements ClickstreamDataSource {

    private final SessionRecordRepository sessionRecordRepository;
    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Flux<SessionRecord> findAllSessions() {
        return sessionRecordRepository.findAll()
                .doOnSubscribe(s -> log.debug("Leyendo sesiones de shopper_data"))
                .doOnError(e -> log.error("Error leyendo sesiones: {}", e.getMessage()));
    }

    @Override
    public Flux<DimensionEntry> findDimensionEntries(Dimension dimension) {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, "_id"));
        return reactiveMongoTemplate.find(query, DimensionEntry.class, dimension.getCollection())
                .doOnError(e -> log.error("Error leyendo dimensión {} ({}): {}",
                        dimension, dimension.getCollection(), e.getMessage()));
    }
}
