package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class RateTest {

    @Test
    void zeroDenominatorIsUndefined() {
        Rate rate = Rate.percentage(0, 0);

        assertThat(rate.isDefined()).isFalse();
        assertThat(rate.orNull()).isNull();
        assertThat(rate.value()).isEmpty();
    }

    @Test
    void roundsHalfUpToTwoDecimals() {
        assertThat(Rate.percentage(1, 3).orNull()).isEqualByComparingTo("33.33");
        assertThat(Rate.percentage(2, 3).orNull()).isEqualByComparingTo("66.67");
        assertThat(Rate.percentage(1, 8).orNull()).isEqualByComparingTo("12.50");
    }

    @Test
    void keepsScaleOfTwo() {
        assertThat(Rate.percentage(1, 2).orNull()).isEqualTo(new BigDecimal("50.00"));
        assertThat(Rate.percentage(3, 3).orNull()).isEqualTo(new BigDecimal("100.00"));
    }

    @Test
    void zeroNumeratorIsDefinedZero() {
        assertThat(Rate.percentage(0, 5).isDefined()).isTrue();
        assertThat(Rate.percentage(0, 5).orNull()).isEqualByComparingTo("0");
    }
}
