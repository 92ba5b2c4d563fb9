package pe.farmaciasperuanas.digital.process.clickstream.domain.port.service;

import pe.farmaciasperuanas.digital.process.clickstream.domain.model.BreakdownView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.ClickstreamSnapshot;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.CohortView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterOptions;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricReport;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;
import reactor.core.publisher.Mono;

/**
 * Servicio de métricas de clickstream sobre el snapshot vigente.
 */
public interface ClickstreamMetricsService {

    Mono<MetricReport> compute(MetricRequest request);

    Mono<MetricReport> cohort(CohortView view);

    Mono<MetricReport> breakdown(BreakdownView view, FilterConfiguration filter);

    Mono<FilterOptions> filterOptions();

    /**
     * Fuerza la recarga del snapshot y descarta los resultados en caché.
     */
    Mono<ClickstreamSnapshot> refresh();
}
