package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fila de conversión: claves de agrupación, sesiones, conversiones y tasa.
 * Las claves se serializan como columnas de primer nivel ({"browser_name": ..., "total_sessions": ...}).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"total_sessions", "conversions", "conversion_rate"})
public class MetricResult implements MetricRow {

    @JsonIgnore
    Map<String, Object> key;
    long totalSessions;
    long conversions;
    Rate conversionRate;

    public static MetricResult of(Map<String, ?> key, long totalSessions, long conversions) {
        return new MetricResult(
                Collections.unmodifiableMap(new LinkedHashMap<>(key)),
                totalSessions,
                conversions,
                Rate.percentage(conversions, totalSessions));
    }

    public static MetricResult of(List<GroupKey> groupKeys, List<?> values, long totalSessions, long conversions) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (int i = 0; i < groupKeys.size(); i++) {
            key.put(groupKeys.get(i).getColumn(), values.get(i));
        }
        return of(key, totalSessions, conversions);
    }

    public Object keyValue(String column) {
        return key.get(column);
    }

    public Object keyValue(GroupKey groupKey) {
        return key.get(groupKey.getColumn());
    }

    @JsonIgnore
    public List<Object> getKeyValues() {
        return new ArrayList<>(key.values());
    }

    @JsonAnyGetter
    public Map<String, Object> keyColumns() {
        return key;
    }
}
