package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import org.junit.jupiter.api.Test;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.DimensionEntry;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DimensionRegistryTest {

    @Test
    void resolvesKnownCodes() {
        DimensionRegistry registry = DimensionRegistry.of(Map.of(
                Dimension.BROWSER, List.of(new DimensionEntry(1, "Chrome"))));

        assertThat(registry.resolve(Dimension.BROWSER, 1)).isEqualTo("Chrome");
        assertThat(registry.lookup(Dimension.BROWSER, 1)).contains("Chrome");
    }

    @Test
    void unknownCodeFallsBackToLabelAndCode() {
        DimensionRegistry registry = DimensionRegistry.empty();

        assertThat(registry.resolve(Dimension.BROWSER, 99)).isEqualTo("Browser 99");
        assertThat(registry.resolve(Dimension.OPERATING_SYSTEM, 4)).isEqualTo("OS 4");
        assertThat(registry.resolve(Dimension.REGION, 9)).isEqualTo("Region 9");
        assertThat(registry.resolve(Dimension.TRAFFIC, 20)).isEqualTo("Traffic 20");
    }

    @Test
    void nullCodeFallsBackToBareLabel() {
        assertThat(DimensionRegistry.empty().resolve(Dimension.BROWSER, null)).isEqualTo("Browser ");
    }

    @Test
    void firstEntryWinsForDuplicateCodes() {
        DimensionRegistry registry = DimensionRegistry.builder()
                .put(Dimension.REGION, 1, "North")
                .put(Dimension.REGION, 1, "Norte")
                .build();

        assertThat(registry.resolve(Dimension.REGION, 1)).isEqualTo("North");
    }

    @Test
    void nullNameIsTreatedAsMissing() {
        DimensionRegistry registry = DimensionRegistry.builder()
                .put(Dimension.TRAFFIC, 3, null)
                .build();

        assertThat(registry.resolve(Dimension.TRAFFIC, 3)).isEqualTo("Traffic 3");
        assertThat(registry.entries(Dimension.TRAFFIC)).isEmpty();
    }
}
