package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.MetricRequest;

import java.time.Duration;
import java.time.Instant;

/**
 * Registra el inicio, el éxito y el fallo de cada cálculo de métricas con su duración.
 * Opcionalmente guarda cada ejecución en la colección {@value #COLLECTION}.
 */
@Component
@Slf4j
public class MetricExecutionLogger {

    static final String COLLECTION = "metric_execution_logs";

    private final ReactiveMongoTemplate mongoTemplate;
    private final boolean persist;

    public MetricExecutionLogger(ReactiveMongoTemplate mongoTemplate,
                                 @Value("${clickstream.execution-log.persist:false}") boolean persist) {
        this.mongoTemplate = mongoTemplate;
        this.persist = persist;
    }

    public Instant logExecutionStart(MetricRequest request, String snapshotId) {
        log.info("Inicio de cálculo de métrica - vista: {}, tipo: {}, snapshot: {}, filtros: {}",
                request.getView(), request.getKind(), snapshotId, request.getFilter());
        return Instant.now();
    }

    public void logExecutionSuccess(MetricRequest request, String snapshotId, Instant startTime, int rowCount) {
        long durationMs = Duration.between(startTime, Instant.now()).toMillis();

        log.info("Cálculo de métrica exitoso - vista: {}, tipo: {}, filas: {}, duración: {} ms",
                request.getView(), request.getKind(), rowCount, durationMs);

        MetricExecution execution = execution(request, snapshotId, startTime, durationMs);
        execution.setRowCount(rowCount);
        execution.setStatus("SUCCESS");
        save(execution);
    }

    public void logExecutionError(MetricRequest request, String snapshotId, Instant startTime, Throwable error) {
        long durationMs = Duration.between(startTime, Instant.now()).toMillis();

        log.error("Error en cálculo de métrica - vista: {}, tipo: {}, error: {}, duración: {} ms",
                request.getView(), request.getKind(), error.getMessage(), durationMs);

        MetricExecution execution = execution(request, snapshotId, startTime, durationMs);
        execution.setErrorMessage(error.getMessage());
        execution.setStatus("ERROR");
        save(execution);
    }

    private MetricExecution execution(MetricRequest request, String snapshotId, Instant startTime, long durationMs) {
        MetricExecution execution = new MetricExecution();
        execution.setView(request.getView());
        execution.setKind(request.getKind().name());
        execution.setSnapshotId(snapshotId);
        execution.setFilter(String.valueOf(request.getFilter()));
        execution.setStartTime(startTime);
        execution.setDurationMs(durationMs);
        return execution;
    }

    private void save(MetricExecution execution) {
        if (!persist) {
            return;
        }
        mongoTemplate.save(execution, COLLECTION)
                .subscribe(
                        saved -> log.debug("Ejecución de métrica guardada: {}", saved.getId()),
                        error -> log.error("Error al guardar ejecución de métrica: {}", error.getMessage())
                );
    }

    @Data
    static class MetricExecution {
        private String id;
        private String view;
        private String kind;
        private String snapshotId;
        private String filter;
        private Instant startTime;
        private Long durationMs;
        private Integer rowCount;
        private String status;
        private String errorMessage;
    }
}
