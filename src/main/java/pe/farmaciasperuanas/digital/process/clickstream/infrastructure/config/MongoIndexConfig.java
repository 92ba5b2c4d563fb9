package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Crea al arrancar los índices de la colección de sesiones sobre los campos filtrables.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoIndexConfig {

    static final String SESSIONS_COLLECTION = "shopper_data";

    private final ReactiveMongoTemplate mongoTemplate;

    /**
     * Nombre del índice y sus campos en orden, todos ascendentes.
     */
    static Map<String, List<String>> sessionIndexes() {
        Map<String, List<String>> indexes = new LinkedHashMap<>();
        indexes.put("session_month_visitor_idx", List.of("month", "visitortype"));
        indexes.put("session_weekend_idx", List.of("weekend"));
        indexes.put("session_browser_idx", List.of("browser"));
        indexes.put("session_os_idx", List.of("operatingsystems"));
        indexes.put("session_region_idx", List.of("region"));
        indexes.put("session_traffic_idx", List.of("traffictype"));
        indexes.put("session_revenue_idx", List.of("revenue"));
        return indexes;
    }

    @PostConstruct
    public void createIndexes() {
        log.info("Iniciando creación de índices para la colección {}", SESSIONS_COLLECTION);

        createCollectionIndexes(SESSIONS_COLLECTION, sessionIndexes())
                .subscribe(
                        created -> log.info("Índices creados: {} en colección {}", created, SESSIONS_COLLECTION),
                        error -> log.error("Error creando índices en {}: {}", SESSIONS_COLLECTION, error.getMessage())
                );
    }

    Mono<Long> createCollectionIndexes(String collectionName, Map<String, List<String>> indexes) {
        return mongoTemplate.indexOps(collectionName).getIndexInfo()
                .map(IndexInfo::getName)
                .collect(Collectors.toSet())
                .flatMapMany(existing -> missing(indexes, existing))
                .concatMap(entry -> {
                    Index index = new Index().named(entry.getKey()).background();
                    entry.getValue().forEach(field -> index.on(field, Sort.Direction.ASC));
                    return mongoTemplate.indexOps(collectionName).ensureIndex(index);
                })
                .count();
    }

    private static Flux<Map.Entry<String, List<String>>> missing(Map<String, List<String>> indexes,
                                                                  Set<String> existing) {
        return Flux.fromIterable(indexes.entrySet())
                .filter(entry -> !existing.contains(entry.getKey()));
    }
}
