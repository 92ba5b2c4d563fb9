package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.inbound.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config.PerformanceMonitor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Estadísticas de rendimiento de las lecturas a la fuente de datos.
 */
@RestController
@RequestMapping("/api/clickstream/performance")
@Slf4j
@RequiredArgsConstructor
public class ClickstreamPerformanceController {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PerformanceMonitor performanceMonitor;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getPerformanceStatistics() {
        log.info("Solicitando estadísticas de rendimiento");

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
        response.put("statistics", performanceMonitor.getPerformanceStatistics());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> resetStatistics() {
        log.info("Reseteando estadísticas de rendimiento");
        performanceMonitor.resetStatistics();

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
        response.put("message", "Estadísticas de rendimiento reseteadas correctamente");
        return ResponseEntity.ok(response);
    }
}
