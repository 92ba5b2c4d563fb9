package pe.farmaciasperuanas.digital.process.clickstream.infrastructure;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Reintentos con backoff exponencial para las lecturas de la fuente de datos.
 * Al agotarse los intentos se propaga el último error original.
 */
@Slf4j
public final class RetryHandler {

    private RetryHandler() {
    }

    /**
     * Ejecuta una operación con reintentos ante cualquier error.
     *
     * @param operation      operación diferida; se vuelve a suscribir en cada intento
     * @param operationName  nombre descriptivo para los logs
     * @param maxRetries     reintentos adicionales al primer intento (0 = sin reintentos)
     * @param initialBackoff espera inicial entre intentos, en milisegundos
     */
    public static <T> Mono<T> withRetry(
            Supplier<Mono<T>> operation,
            String operationName,
            int maxRetries,
            long initialBackoff) {
        return withRetry(operation, operationName, maxRetries, initialBackoff, error -> true);
    }

    /**
     * Igual que {@link #withRetry(Supplier, String, int, long)}, pero solo reintenta
     * los errores que cumplen {@code retryable}; el resto se propaga de inmediato.
     */
    public static <T> Mono<T> withRetry(
            Supplier<Mono<T>> operation,
            String operationName,
            int maxRetries,
            long initialBackoff,
            Predicate<? super Throwable> retryable) {

        return Mono.defer(operation)
                .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(initialBackoff))
                        .filter(retryable)
                        .doBeforeRetry(retrySignal -> log.warn("Reintento {} de {} para operación {}: {}",
                                retrySignal.totalRetries() + 1, maxRetries, operationName,
                                retrySignal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> {
                            log.error("Reintentos agotados para operación {}: {}",
                                    operationName, signal.failure().getMessage());
                            return signal.failure();
                        })
                );
    }
}
