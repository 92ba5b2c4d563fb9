package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

/**
 * Fila de un reporte de métricas.
 */
public interface MetricRow {
}
