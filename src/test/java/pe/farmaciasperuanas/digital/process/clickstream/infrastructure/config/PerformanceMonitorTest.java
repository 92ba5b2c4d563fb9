package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceMonitorTest {

    private final PerformanceMonitor monitor = new PerformanceMonitor();

    @Test
    void recordsOnlyWhenFluxIsSubscribed() {
        Flux<Integer> monitored = monitor.monitorFlux("lectura", () -> Flux.just(1, 2, 3));

        assertThat(monitor.getPerformanceStatistics()).containsEntry("operationCount", 0);

        StepVerifier.create(monitored).expectNext(1, 2, 3).verifyComplete();
        StepVerifier.create(monitored).expectNextCount(3).verifyComplete();

        Map<String, Object> statistics = monitor.getPerformanceStatistics();
        assertThat(statistics).containsEntry("operationCount", 1);
        assertThat(statistics).containsEntry("totalInvocations", 2);
    }

    @Test
    void countsErrors() {
        StepVerifier.create(monitor.monitorFlux("falla", () -> Flux.error(new IllegalStateException("x"))))
                .expectError(IllegalStateException.class)
                .verify();

        Object[] operations = (Object[]) monitor.getPerformanceStatistics().get("operations");
        @SuppressWarnings("unchecked")
        Map<String, Object> metrics = (Map<String, Object>) operations[0];
        assertThat(metrics).containsEntry("operation", "falla").containsEntry("errorCount", 1);
    }

    @Test
    void resetClearsStatistics() {
        assertThat(monitor.monitor("sync", () -> 42)).isEqualTo(42);

        monitor.resetStatistics();

        assertThat(monitor.getPerformanceStatistics()).containsEntry("operationCount", 0);
    }
}
