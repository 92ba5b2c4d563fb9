package pe.farmaciasperuanas.digital.process.clickstream.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.ClickstreamSnapshot;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricReport;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Caché de resultados para un único snapshot. Un resultado de un snapshot más reciente
 * descarta las entradas anteriores; uno de un snapshot más antiguo se ignora.
 */
@Component
@Slf4j
public class MetricResultCache {

    private final int maxEntries;
    private final Map<MetricRequest, MetricReport> entries = new HashMap<>();
    private String snapshotId;
    private Instant snapshotLoadedAt = Instant.MIN;

    public MetricResultCache(@Value("${clickstream.cache.max-entries:500}") int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public synchronized Optional<MetricReport> get(ClickstreamSnapshot snapshot, MetricRequest request) {
        if (!snapshot.getId().equals(snapshotId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(request));
    }

    public synchronized void put(ClickstreamSnapshot snapshot, MetricRequest request, MetricReport report) {
        if (snapshot.getLoadedAt().isBefore(snapshotLoadedAt)) {
            log.debug("Resultado del snapshot {} descartado, la caché ya sigue uno más reciente", snapshot.getId());
            return;
        }
        if (!snapshot.getId().equals(snapshotId)) {
            if (!entries.isEmpty()) {
                log.debug("Nuevo snapshot {}, descartando {} resultados en caché", snapshot.getId(), entries.size());
            }
            entries.clear();
            snapshotId = snapshot.getId();
            snapshotLoadedAt = snapshot.getLoadedAt();
        }
        if (entries.size() >= maxEntries) {
            log.debug("Caché de resultados llena ({} entradas), se vacía", entries.size());
            entries.clear();
        }
        entries.put(request, report);
    }

    /**
     * Vacía la caché. Los resultados de snapshots cargados antes de este momento ya no se aceptan.
     */
    public synchronized void invalidate() {
        entries.clear();
        snapshotId = null;
        snapshotLoadedAt = Instant.now();
    }

    public synchronized int size() {
        return entries.size();
    }
}
