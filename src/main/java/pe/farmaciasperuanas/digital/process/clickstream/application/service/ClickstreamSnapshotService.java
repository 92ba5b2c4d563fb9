package pe.farmaciasperuanas.digital.process.clickstream.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.DataSourceUnavailableException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.ClickstreamSnapshot;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.DimensionRegistry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository.ClickstreamDataSource;
import pe.farmaciasperuanas.digital.process.clickstream.infrastructure.RetryHandler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mantiene el snapshot vigente de sesiones y dimensiones.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * El snapshot se carga en la primera suscripción y se reutiliza durante el TTL configurado.
 * Un error de carga no se guarda en caché: la siguiente consulta vuelve a intentar.
 */
@Service
@Slf4j
public class ClickstreamSnapshotService {

    private final ClickstreamDataSource dataSource;
    private final Duration ttl;
    private final int maxRetries;
    private final long initialBackoffMs;

    private final AtomicReference<Mono<ClickstreamSnapshot>> current = new AtomicReference<>();

    public ClickstreamSnapshotService(
            ClickstreamDataSource dataSource,
            @Value("${clickstream.snapshot.ttl-seconds:300}") long ttlSeconds,
            @Value("${clickstream.retry.max-attempts:3}") int maxRetries,
            @Value("${clickstream.retry.initial-backoff-ms:1000}") long initialBackoffMs) {
        this.dataSource = dataSource;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.maxRetries = maxRetries;
        this.initialBackoffMs = initialBackoffMs;
        this.current.set(cachedLoad());
    }

    public Mono<ClickstreamSnapshot> current() {
        return current.get();
    }

    /**
     * Reemplaza el snapshot en caché por una carga nueva y la devuelve.
     */
    public Mono<ClickstreamSnapshot> refresh() {
        Mono<ClickstreamSnapshot> reloaded = cachedLoad();
        current.set(reloaded);
        log.info("Snapshot de clickstream invalidado, se recargará en la siguiente suscripción");
        return reloaded;
    }

    private Mono<ClickstreamSnapshot> cachedLoad() {
        return load().cache(snapshot -> ttl, error -> Duration.ZERO, () -> Duration.ZERO);
    }

    Mono<ClickstreamSnapshot> load() {
        Mono<List<SessionRecord>> sessions = RetryHandler.withRetry(
                () -> dataSource.findAllSessions().collectList(),
                "ClickstreamDataSource.findAllSessions",
                maxRetries,
                initialBackoffMs);
        Mono<DimensionRegistry> registry = RetryHandler.withRetry(
                this::loadRegistry,
                "ClickstreamDataSource.findDimensionEntries",
                maxRetries,
                initialBackoffMs);

        return Mono.zip(sessions, registry)
                .map(loaded -> ClickstreamSnapshot.of(loaded.getT1(), loaded.getT2()))
                .doOnNext(snapshot -> log.info("Snapshot {} cargado con {} sesiones",
                        snapshot.getId(), snapshot.size()))
                .onErrorMap(error -> !(error instanceof DataSourceUnavailableException),
                        error -> new DataSourceUnavailableException(
                                "Fuente de datos de clickstream no disponible: " + error.getMessage(), error));
    }

    private Mono<DimensionRegistry> loadRegistry() {
        return Flux.fromArray(Dimension.values())
                .concatMap(dimension -> dataSource.findDimensionEntries(dimension)
                        .map(entry -> Tuples.of(dimension, entry)))
                .reduceWith(DimensionRegistry::builder,
                        (builder, loaded) -> builder.entry(loaded.getT1(), loaded.getT2()))
                .map(DimensionRegistry.Builder::build);
    }
}
