package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Vista inmutable de las sesiones y del registro de dimensiones en un instante dado.
 * Es el único acceso a datos que recibe el motor de agregación.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClickstreamSnapshot {
    String id;
    Instant loadedAt;
    List<SessionRecord> sessions;
    DimensionRegistry registry;

    public static ClickstreamSnapshot of(List<SessionRecord> sessions, DimensionRegistry registry) {
        return of(sessions, registry, Instant.now());
    }

    public static ClickstreamSnapshot of(List<SessionRecord> sessions, DimensionRegistry registry, Instant loadedAt) {
        return new ClickstreamSnapshot(
                UUID.randomUUID().toString(),
                Objects.requireNonNull(loadedAt, "loadedAt"),
                List.copyOf(sessions),
                Objects.requireNonNull(registry, "registry"));
    }

    public int size() {
        return sessions.size();
    }
}
