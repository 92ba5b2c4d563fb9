package pe.farmaciasperuanas.digital.process.clickstream.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import pe.farmaciasperuanas.digital.process.clickstream.domain.port.service.ClickstreamMetricsService;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Job programado que recarga el snapshot de clickstream.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotRefreshJob {

    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ClickstreamMetricsService metricsService;

    @Scheduled(cron = "${clickstream.snapshot.refresh-cron:0 */5 * * * ?}")
    public void refreshSnapshot() {
        LocalDateTime startTime = LocalDateTime.now();
        log.info("Iniciando recarga programada del snapshot: {}", startTime.format(DATE_TIME_FORMATTER));

        metricsService.refresh()
                .subscribe(
                        snapshot -> log.info("Recarga programada completada: {} sesiones en {} ms",
                                snapshot.size(), Duration.between(startTime, LocalDateTime.now()).toMillis()),
                        error -> log.error("Error en recarga programada del snapshot: {}", error.getMessage(), error)
                );
    }
}
