package pe.farmaciasperuanas.digital.process.clickstream;

import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.Dimension;
import pe.farmaciasperuanas.digital.process.clickstream.domain.model.DimensionRegistry;

import java.util.List;

/**
 * Datos de prueba compartidos: un conjunto pequeño de sesiones y un registro de dimensiones
 * al que le faltan algunos códigos a propósito (browser 99, traffic 20).
 */
public final class ClickstreamFixtures {

    private ClickstreamFixtures() {
    }

    public static SessionRecord.SessionRecordBuilder session() {
        return SessionRecord.builder()
                .month("May")
                .visitorType("Returning_Visitor")
                .operatingSystem(1)
                .browser(1)
                .region(1)
                .trafficType(1);
    }

    public static DimensionRegistry registry() {
        return DimensionRegistry.builder()
                .put(Dimension.BROWSER, 1, "Chrome")
                .put(Dimension.BROWSER, 2, "Firefox")
                .put(Dimension.OPERATING_SYSTEM, 1, "Windows")
                .put(Dimension.OPERATING_SYSTEM, 2, "macOS")
                .put(Dimension.REGION, 1, "North")
                .put(Dimension.REGION, 3, "South")
                .put(Dimension.TRAFFIC, 1, "Direct")
                .put(Dimension.TRAFFIC, 2, "Search")
                .build();
    }

    /**
     * Ocho sesiones con variedad de meses, visitantes, dimensiones y vistas de página.
     */
    public static List<SessionRecord> sessions() {
        return List.of(
                session().id("s1").month("Feb").browser(1).operatingSystem(1).region(1).trafficType(1)
                        .administrative(2).administrativeDuration(30).productRelated(5).productRelatedDuration(120)
                        .bounceRates(0.02).exitRates(0.04).pageValues(10).revenue(true).build(),
                session().id("s2").month("Feb").visitorType("New_Visitor").browser(2).operatingSystem(2)
                        .region(3).trafficType(2).informational(1).informationalDuration(15)
                        .bounceRates(0.2).exitRates(0.2).build(),
                session().id("s3").month("Mar").browser(99).operatingSystem(1).region(1).trafficType(20)
                        .weekend(true).productRelated(3).productRelatedDuration(60)
                        .bounceRates(0.0).exitRates(0.1).pageValues(20).revenue(true).build(),
                session().id("s4").month("Mar").visitorType("Other").browser(1).operatingSystem(2).region(3)
                        .trafficType(1).weekend(true).bounceRates(0.2).exitRates(0.2).build(),
                session().id("s5").month("May").browser(2).operatingSystem(1).region(1).trafficType(2)
                        .administrative(1).administrativeDuration(10).informational(2).informationalDuration(40)
                        .productRelated(10).productRelatedDuration(300).specialDay(0.4)
                        .bounceRates(0.01).exitRates(0.03).pageValues(5).build(),
                session().id("s6").month("May").visitorType("New_Visitor").browser(1).operatingSystem(1)
                        .region(1).trafficType(1).productRelated(4).productRelatedDuration(80)
                        .bounceRates(0.05).exitRates(0.06).pageValues(30).revenue(true).build(),
                session().id("s7").month("Nov").browser(2).operatingSystem(2).region(3).trafficType(2)
                        .weekend(true).administrative(3).administrativeDuration(45)
                        .bounceRates(0.1).exitRates(0.12).build(),
                session().id("s8").month("Nov").browser(1).operatingSystem(1).region(1).trafficType(1)
                        .specialDay(0.8).productRelated(1).productRelatedDuration(5)
                        .bounceRates(0.2).exitRates(0.2).build()
        );
    }
}
