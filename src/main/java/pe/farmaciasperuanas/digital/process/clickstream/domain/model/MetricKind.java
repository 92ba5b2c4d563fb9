package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

/**
 * Tipos de métrica que sabe calcular el motor.
 */
public enum MetricKind {
    CONVERSION_BY_KEY,
    ENGAGEMENT_IMPACT,
    PAGE_TYPE_PERFORMANCE,
    PAGE_TYPE_PERFORMANCE_TIDY,
    PAGE_TYPE_BREAKDOWN,
    EXECUTIVE_SUMMARY
}
