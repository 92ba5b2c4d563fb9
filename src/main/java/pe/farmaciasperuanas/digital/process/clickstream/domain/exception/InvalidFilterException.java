package pe.farmaciasperuanas.digital.process.clickstream.domain.exception;

import java.util.List;

/**
 * Configuración de filtros o de agrupación mal formada. Lleva todas las violaciones encontradas.
 */
public class InvalidFilterException extends RuntimeException {

    private final List<String> violations;

    public InvalidFilterException(List<String> violations) {
        super("Filtros inválidos: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
