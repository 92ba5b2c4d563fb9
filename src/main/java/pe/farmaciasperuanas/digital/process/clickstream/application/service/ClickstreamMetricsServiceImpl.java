package pe.farmaciasperuanas.digital.process.clickstream.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.BreakdownView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.ClickstreamSnapshot;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.CohortView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterOptions;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricReport;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRow;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.service.ClickstreamMetricsService;
import pe.farmaciasperuanas.digital.process.clickstream.domain.service.MetricsEngine;
import pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config.MetricExecutionLogger;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Implementación del servicio de métricas.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * Obtiene el snapshot vigente, consulta la caché y, si no hay resultado, ejecuta el motor
 * fuera del hilo de eventos.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClickstreamMetricsServiceImpl implements ClickstreamMetricsService {

    private final ClickstreamSnapshotService snapshotService;
    private final MetricsEngine metricsEngine;
    private final MetricResultCache resultCache;
    private final MetricExecutionLogger executionLogger;

    @Override
    public Mono<MetricReport> compute(MetricRequest request) {
        return snapshotService.current()
                .flatMap(snapshot -> resultCache.get(snapshot, request)
                        .map(cached -> {
                            log.debug("Resultado en caché para vista {} (snapshot {})",
                                    request.getView(), snapshot.getId());
                            return Mono.just(cached);
                        })
                        .orElseGet(() -> evaluate(snapshot, request)));
    }

    @Override
    public Mono<MetricReport> cohort(CohortView view) {
        return compute(view.toRequest());
    }

    @Override
    public Mono<MetricReport> breakdown(BreakdownView view, FilterConfiguration filter) {
        return compute(view.toRequest(filter));
    }

    @Override
    public Mono<FilterOptions> filterOptions() {
        return snapshotService.current().map(metricsEngine::filterOptions);
    }

    @Override
    public Mono<ClickstreamSnapshot> refresh() {
        resultCache.invalidate();
        return snapshotService.refresh()
                .doOnNext(snapshot -> log.info("Snapshot recargado: {} ({} sesiones)",
                        snapshot.getId(), snapshot.size()));
    }

    private Mono<MetricReport> evaluate(ClickstreamSnapshot snapshot, MetricRequest request) {
        return Mono.fromCallable(() -> {
                    Instant startTime = executionLogger.logExecutionStart(request, snapshot.getId());
                    try {
                        List<? extends MetricRow> rows = metricsEngine.evaluate(snapshot, request);
                        executionLogger.logExecutionSuccess(request, snapshot.getId(), startTime, rows.size());
                        return MetricReport.builder()
                                .view(request.getView())
                                .kind(request.getKind())
                                .snapshotId(snapshot.getId())
                                .timestamp(LocalDateTime.now())
                                .rowCount(rows.size())
                                .rows(rows)
                                .build();
                    } catch (RuntimeException e) {
                        executionLogger.logExecutionError(request, snapshot.getId(), startTime, e);
                        throw e;
                    }
                })
                .subscribeOn(Schedulers.parallel())
                .doOnNext(report -> resultCache.put(snapshot, request, report));
    }
}
