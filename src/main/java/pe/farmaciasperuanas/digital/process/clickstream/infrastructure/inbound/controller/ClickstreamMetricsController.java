package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.inbound.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import pe.farmaciasperuanas.digital.process.clickstream.domain.DTO.ConversionQueryRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.DTO.FilterRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.UnknownViewException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.BreakdownView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.CohortView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterOptions;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricKind;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricReport;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.service.ClickstreamMetricsService;
import pe.farmaciasperuanas.digital.process.clickstream.infrastructure.FilterRequestMapper;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Controlador REST de métricas de clickstream.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * Los filtros se validan antes de llegar al motor; un cuerpo ausente equivale a "sin filtros".
 */
@RestController
@RequestMapping("/api/clickstream/metrics")
@Slf4j
@RequiredArgsConstructor
public class ClickstreamMetricsController {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ClickstreamMetricsService metricsService;
    private final FilterRequestMapper filterRequestMapper;

    @PostMapping("/conversion")
    public Mono<MetricReport> conversion(@RequestBody(required = false) ConversionQueryRequest request) {
        log.info("Solicitud de conversión por clave: {}", request);
        return Mono.fromCallable(() -> filterRequestMapper.toConversionRequest(request))
                .flatMap(metricsService::compute);
    }

    @PostMapping("/engagement")
    public Mono<MetricReport> engagement(@RequestBody(required = false) FilterRequest filters) {
        return filtered(MetricKind.ENGAGEMENT_IMPACT, filters);
    }

    @PostMapping("/page-types/performance")
    public Mono<MetricReport> pageTypePerformance(@RequestBody(required = false) FilterRequest filters) {
        return filtered(MetricKind.PAGE_TYPE_PERFORMANCE, filters);
    }

    @PostMapping("/page-types/performance/tidy")
    public Mono<MetricReport> pageTypePerformanceTidy(@RequestBody(required = false) FilterRequest filters) {
        return filtered(MetricKind.PAGE_TYPE_PERFORMANCE_TIDY, filters);
    }

    @PostMapping("/page-types/breakdown")
    public Mono<MetricReport> pageTypeBreakdown(@RequestBody(required = false) FilterRequest filters) {
        return filtered(MetricKind.PAGE_TYPE_BREAKDOWN, filters);
    }

    @PostMapping("/summary")
    public Mono<MetricReport> executiveSummary(@RequestBody(required = false) FilterRequest filters) {
        return filtered(MetricKind.EXECUTIVE_SUMMARY, filters);
    }

    @PostMapping("/breakdowns/{view}")
    public Mono<MetricReport> breakdown(@PathVariable String view,
                                        @RequestBody(required = false) FilterRequest filters) {
        log.info("Solicitud de desglose {}", view);
        return Mono.fromCallable(() -> BreakdownView.fromPath(view)
                        .orElseThrow(() -> new UnknownViewException(view)))
                .flatMap(breakdownView -> Mono.fromCallable(() -> filterRequestMapper.toConfiguration(filters))
                        .flatMap(filter -> metricsService.breakdown(breakdownView, filter)));
    }

    @GetMapping("/cohorts")
    public Mono<Map<String, Object>> cohorts() {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
        response.put("cohorts", Arrays.stream(CohortView.values())
                .map(CohortView::getPath)
                .collect(Collectors.toList()));
        response.put("breakdowns", Arrays.stream(BreakdownView.values())
                .map(BreakdownView::getPath)
                .collect(Collectors.toList()));
        return Mono.just(response);
    }

    @GetMapping("/cohorts/{view}")
    public Mono<MetricReport> cohort(@PathVariable String view) {
        log.info("Solicitud de cohorte {}", view);
        return Mono.fromCallable(() -> CohortView.fromPath(view)
                        .orElseThrow(() -> new UnknownViewException(view)))
                .flatMap(metricsService::cohort);
    }

    @GetMapping("/filter-options")
    public Mono<FilterOptions> filterOptions() {
        return metricsService.filterOptions();
    }

    @PostMapping("/refresh")
    public Mono<Map<String, Object>> refresh() {
        log.info("Solicitud de recarga del snapshot de clickstream");
        return metricsService.refresh()
                .map(snapshot -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("status", "success");
                    response.put("message", "Snapshot recargado correctamente");
                    response.put("snapshot_id", snapshot.getId());
                    response.put("sessions", snapshot.size());
                    response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
                    return response;
                });
    }

    private Mono<MetricReport> filtered(MetricKind kind, FilterRequest filters) {
        log.info("Solicitud de métrica {} con filtros {}", kind, filters);
        return Mono.fromCallable(() -> MetricRequest.of(kind, filterRequestMapper.toConfiguration(filters)))
                .flatMap(metricsService::compute);
    }
}
