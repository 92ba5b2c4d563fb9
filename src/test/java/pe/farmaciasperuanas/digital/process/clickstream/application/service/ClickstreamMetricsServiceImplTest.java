package pe.farmaciasperuanas.digital.process.clickstream.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import pe.farmaciasperuanas.digital.process.clickstream.ClickstreamFixtures;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.DimensionEntry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.DataSourceUnavailableException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.BreakdownView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.CohortView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterClause;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.FilterConfiguration;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.GroupKey;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricReport;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricResult;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository.ClickstreamDataSource;
import pe.farmaciasperuanas.digital.process.clickstream.domain.service.AggregationEngine;
import pe.farmaciasperuanas.digital.process.clickstream.domain.service.DenormalizationView;
import pe.farmaciasperuanas.digital.process.clickstream.domain.service.FilterPredicateEngine;
import pe.farmaciasperuanas.digital.process.clickstream.domain.service.MetricsEngine;
import pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config.MetricExecutionLogger;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ClickstreamMetricsServiceImplTest {

    @Mock
    private ClickstreamDataSource dataSource;

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private MetricsEngine metricsEngine;
    private MetricResultCache resultCache;
    private ClickstreamMetricsServiceImpl service;

    @BeforeEach
    void setUp() {
        when(dataSource.findAllSessions()).thenAnswer(i -> Flux.fromIterable(ClickstreamFixtures.sessions()));
        when(dataSource.findDimensionEntries(any())).thenReturn(Flux.empty());
        when(dataSource.findDimensionEntries(eq(Dimension.BROWSER))).thenAnswer(i -> Flux.just(
                new DimensionEntry(1, "Chrome"), new DimensionEntry(2, "Firefox")));

        metricsEngine = spy(new MetricsEngine(
                new DenormalizationView(), new FilterPredicateEngine(), new AggregationEngine()));
        resultCache = new MetricResultCache(100);
        service = newService(new ClickstreamSnapshotService(dataSource, 300, 0, 1));
    }

    private ClickstreamMetricsServiceImpl newService(ClickstreamSnapshotService snapshotService) {
        return new ClickstreamMetricsServiceImpl(snapshotService, metricsEngine, resultCache,
                new MetricExecutionLogger(mongoTemplate, false));
    }

    @Test
    void computesCohortOverLoadedSnapshot() {
        StepVerifier.create(service.cohort(CohortView.BROWSER_USAGE))
                .assertNext(report -> {
                    assertThat(report.getView()).isEqualTo("browser-usage");
                    assertThat(report.getRowCount()).isEqualTo(3);
                    assertThat(report.getRows()).extracting(r -> ((MetricResult) r).keyValue(GroupKey.BROWSER_NAME))
                            .containsExactly("Chrome", "Firefox", "Browser 99");
                })
                .verifyComplete();
    }

    @Test
    void servesRepeatedRequestsFromCache() {
        MetricReport first = service.cohort(CohortView.WEEKDAY_VS_WEEKEND).block();
        MetricReport second = service.cohort(CohortView.WEEKDAY_VS_WEEKEND).block();

        assertThat(second).isSameAs(first);
        assertThat(resultCache.size()).isEqualTo(1);
        verify(dataSource, times(1)).findAllSessions();
        verify(metricsEngine, times(1)).evaluate(any(), any());
    }

    @Test
    void breakdownAppliesFilter() {
        FilterConfiguration weekendOnly = FilterConfiguration.builder().weekend(FilterClause.of(true)).build();

        StepVerifier.create(service.breakdown(BreakdownView.REGION_PERFORMANCE, weekendOnly))
                .assertNext(report -> assertThat(report.getRows())
                        .extracting(r -> ((MetricResult) r).getTotalSessions())
                        .containsExactly(1L, 2L))
                .verifyComplete();
    }

    @Test
    void refreshReloadsSnapshotAndDropsCachedResults() {
        MetricReport before = service.cohort(CohortView.EXECUTIVE_SUMMARY).block();

        StepVerifier.create(service.refresh())
                .assertNext(snapshot -> assertThat(snapshot.getId()).isNotEqualTo(before.getSnapshotId()))
                .verifyComplete();
        MetricReport after = service.cohort(CohortView.EXECUTIVE_SUMMARY).block();

        assertThat(after.getSnapshotId()).isNotEqualTo(before.getSnapshotId());
        assertThat(after.getRows()).isEqualTo(before.getRows());
        assertThat(resultCache.size()).isEqualTo(1);
        verify(dataSource, times(2)).findAllSessions();
    }

    @Test
    void filterOptionsUseRegistryNames() {
        StepVerifier.create(service.filterOptions())
                .assertNext(options -> {
                    assertThat(options.getBrowsers()).extracting(o -> o.getName())
                            .containsExactly("Chrome", "Firefox", "Browser 99");
                    assertThat(options.getRegions()).extracting(o -> o.getName())
                            .containsExactly("Region 1", "Region 3");
                })
                .verifyComplete();
    }

    @Test
    void unavailableDataSourceSurfacesAsRetryableError() {
        when(dataSource.findAllSessions()).thenAnswer(i -> Flux.error(new IllegalStateException("sin conexión")));
        ClickstreamMetricsServiceImpl failing = newService(new ClickstreamSnapshotService(dataSource, 300, 1, 1));

        StepVerifier.create(failing.cohort(CohortView.EXECUTIVE_SUMMARY))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DataSourceUnavailableException.class)
                            .hasRootCauseInstanceOf(IllegalStateException.class);
                    assertThat(((DataSourceUnavailableException) error).isRetryable()).isTrue();
                })
                .verify();
        verify(dataSource, times(2)).findAllSessions();
    }

    @Test
    void failedLoadIsNotCached() {
        when(dataSource.findAllSessions())
                .thenAnswer(i -> Flux.error(new IllegalStateException("sin conexión")))
                .thenAnswer(i -> Flux.fromIterable(ClickstreamFixtures.sessions()));
        ClickstreamMetricsServiceImpl recovering = newService(new ClickstreamSnapshotService(dataSource, 300, 0, 1));

        StepVerifier.create(recovering.cohort(CohortView.EXECUTIVE_SUMMARY))
                .expectError(DataSourceUnavailableException.class)
                .verify();
        StepVerifier.create(recovering.cohort(CohortView.EXECUTIVE_SUMMARY))
                .assertNext(report -> assertThat(report.getRowCount()).isEqualTo(1))
                .verifyComplete();
    }
}
