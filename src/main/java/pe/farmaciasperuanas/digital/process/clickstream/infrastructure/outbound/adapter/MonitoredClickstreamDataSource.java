package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.outbound.adapter;

import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.DimensionEntry;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository.ClickstreamDataSource;
import pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config.PerformanceMonitor;
import reactor.core.publisher.Flux;

/**
 * Decorador de {@link MongoClickstreamDataSource} que mide cada lectura con {@link PerformanceMonitor}.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 */
@Repository
@Primary
public class MonitoredClickstreamDataSource implements ClickstreamDataSource {

    private final MongoClickstreamDataSource delegate;
    private final PerformanceMonitor performanceMonitor;

    public MonitoredClickstreamDataSource(MongoClickstreamDataSource delegate,
                                          PerformanceMonitor performanceMonitor) {
        this.delegate = delegate;
        this.performanceMonitor = performanceMonitor;
    }

    @Override
    public Flux<SessionRecord> findAllSessions() {
        return performanceMonitor.monitorFlux(
                "ClickstreamDataSource.findAllSessions",
                delegate::findAllSessions
        );
    }

    @Override
    public Flux<DimensionEntry> findDimensionEntries(Dimension dimension) {
        return performanceMonitor.monitorFlux(
                "ClickstreamDataSource.findDimensionEntries." + dimension.name(),
                () -> delegate.findDimensionEntries(dimension)
        );
    }
}
