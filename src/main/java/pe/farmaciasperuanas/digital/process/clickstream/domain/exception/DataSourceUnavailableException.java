package pe.farmaciasperuanas.digital.process.clickstream.domain.exception;

/**
 * La fuente de datos no respondió tras agotar los reintentos. El cliente puede reintentar.
 */
public class DataSourceUnavailableException extends RuntimeException {

    public DataSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return true;
    }
}
