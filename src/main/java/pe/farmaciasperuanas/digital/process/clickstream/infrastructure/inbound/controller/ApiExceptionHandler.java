package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.inbound.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.DataSourceUnavailableException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.InvalidFilterException;
import pe.farmaciasperuanas.digital.process.clickstream.domain.exception.UnknownViewException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Traduce las excepciones del dominio a respuestas JSON con estado HTTP.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidFilter(InvalidFilterException e) {
        log.warn("Filtros rechazados: {}", e.getViolations());
        Map<String, Object> body = body("Filtros inválidos");
        body.put("violations", e.getViolations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedInput(ServerWebInputException e) {
        log.warn("Solicitud mal formada: {}", e.getReason());
        Map<String, Object> body = body("Solicitud mal formada");
        body.put("violations", List.of(String.valueOf(e.getReason())));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(UnknownViewException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownView(UnknownViewException e) {
        log.warn("Vista desconocida solicitada: {}", e.getView());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(e.getMessage()));
    }

    @ExceptionHandler(DataSourceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleDataSourceUnavailable(DataSourceUnavailableException e) {
        log.error("Fuente de datos no disponible: {}", e.getMessage());
        Map<String, Object> body = body("Fuente de datos no disponible, intente nuevamente");
        body.put("retryable", e.isRetryable());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static Map<String, Object> body(String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", "error");
        body.put("message", message);
        body.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
        return body;
    }
}
