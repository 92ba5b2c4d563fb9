package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Tiempos de ejecución acumulados por operación (invocaciones, total, promedio, máximo, mínimo).
 * Para publishers reactivos se mide desde la suscripción hasta la terminación.
 */
@Component
@Slf4j
public class PerformanceMonitor {

    private static final long SLOW_THRESHOLD_MS = 1000;
    private static final long ALERT_THRESHOLD_MS = 5000;

    private final Map<String, OperationMetrics> operationMetrics = new ConcurrentHashMap<>();

    private static class OperationMetrics {
        final String operation;
        final AtomicInteger invocationCount = new AtomicInteger(0);
        final AtomicInteger errorCount = new AtomicInteger(0);
        final AtomicLong totalTimeMs = new AtomicLong(0);
        final AtomicLong maxTimeMs = new AtomicLong(0);
        final AtomicLong minTimeMs = new AtomicLong(Long.MAX_VALUE);

        OperationMetrics(String operation) {
            this.operation = operation;
        }

        void addExecution(long timeMs, boolean failed) {
            invocationCount.incrementAndGet();
            if (failed) {
                errorCount.incrementAndGet();
            }
            totalTimeMs.addAndGet(timeMs);
            maxTimeMs.accumulateAndGet(timeMs, Math::max);
            minTimeMs.accumulateAndGet(timeMs, Math::min);
        }

        double getAvgTimeMs() {
            int count = invocationCount.get();
            return count > 0 ? (double) totalTimeMs.get() / count : 0;
        }

        Map<String, Object> toMap() {
            Map<String, Object> metrics = new HashMap<>();
            metrics.put("operation", operation);
            metrics.put("invocationCount", invocationCount.get());
            metrics.put("errorCount", errorCount.get());
            metrics.put("totalTimeMs", totalTimeMs.get());
            metrics.put("avgTimeMs", getAvgTimeMs());
            metrics.put("maxTimeMs", maxTimeMs.get());
            metrics.put("minTimeMs", minTimeMs.get() == Long.MAX_VALUE ? 0 : minTimeMs.get());
            return metrics;
        }
    }

    public <T> T monitor(String operation, Supplier<T> execution) {
        StopWatch stopWatch = new StopWatch(operation);
        boolean failed = true;
        stopWatch.start();
        try {
            T result = execution.get();
            failed = false;
            return result;
        } finally {
            stopWatch.stop();
            record(operation, stopWatch.getTotalTimeMillis(), failed);
        }
    }

    public <T> Mono<T> monitorMono(String operation, Supplier<Mono<T>> execution) {
        return Mono.defer(() -> {
            StopWatch stopWatch = new StopWatch(operation);
            stopWatch.start();
            return execution.get().doFinally(signal -> {
                stopWatch.stop();
                record(operation, stopWatch.getTotalTimeMillis(), signal == SignalType.ON_ERROR);
            });
        });
    }

    public <T> Flux<T> monitorFlux(String operation, Supplier<Flux<T>> execution) {
        return Flux.defer(() -> {
            StopWatch stopWatch = new StopWatch(operation);
            stopWatch.start();
            return execution.get().doFinally(signal -> {
                stopWatch.stop();
                record(operation, stopWatch.getTotalTimeMillis(), signal == SignalType.ON_ERROR);
            });
        });
    }

    private void record(String operation, long timeMs, boolean failed) {
        operationMetrics.computeIfAbsent(operation, OperationMetrics::new).addExecution(timeMs, failed);

        if (timeMs > ALERT_THRESHOLD_MS) {
            log.warn("¡ALERTA DE RENDIMIENTO! Operación {} tardó {} ms", operation, timeMs);
        } else if (timeMs > SLOW_THRESHOLD_MS) {
            log.info("Rendimiento: operación {} tardó {} ms", operation, timeMs);
        } else if (log.isDebugEnabled()) {
            log.debug("Operación {} ejecutada en {} ms", operation, timeMs);
        }
    }

    public Map<String, Object> getPerformanceStatistics() {
        Map<String, Object> statistics = new HashMap<>();

        statistics.put("operationCount", operationMetrics.size());
        statistics.put("operations", operationMetrics.values().stream()
                .map(OperationMetrics::toMap)
                .toArray());
        statistics.put("totalInvocations", operationMetrics.values().stream()
                .mapToInt(m -> m.invocationCount.get())
                .sum());
        statistics.put("totalExecutionTimeMs", operationMetrics.values().stream()
                .mapToLong(m -> m.totalTimeMs.get())
                .sum());

        // Top 5 por tiempo promedio
        statistics.put("top5SlowestOperations", operationMetrics.values().stream()
                .filter(m -> m.invocationCount.get() > 0)
                .sorted(Comparator.comparingDouble(OperationMetrics::getAvgTimeMs).reversed())
                .limit(5)
                .map(OperationMetrics::toMap)
                .toArray());

        return statistics;
    }

    public void resetStatistics() {
        operationMetrics.clear();
        log.info("Estadísticas de rendimiento reseteadas");
    }
}
