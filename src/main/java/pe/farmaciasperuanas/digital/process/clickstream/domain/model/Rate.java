package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Porcentaje con dos decimales o indefinido cuando el denominador es cero.
 * Se serializa como número o como {@code null}.
 */
@EqualsAndHashCode
public final class Rate {

    private static final Rate UNDEFINED = new Rate(null);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 2;

    private final BigDecimal value;

    private Rate(BigDecimal value) {
        this.value = value;
    }

    public static Rate undefined() {
        return UNDEFINED;
    }

    /**
     * round(100 * numerator / denominator, 2) con redondeo HALF_UP; indefinido si denominator = 0.
     */
    public static Rate percentage(long numerator, long denominator) {
        if (denominator == 0) {
            return UNDEFINED;
        }
        BigDecimal result = BigDecimal.valueOf(numerator)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(denominator), SCALE, RoundingMode.HALF_UP);
        return new Rate(result);
    }

    public static Rate of(BigDecimal value) {
        return value == null ? UNDEFINED : new Rate(value.setScale(SCALE, RoundingMode.HALF_UP));
    }

    public boolean isDefined() {
        return value != null;
    }

    public Optional<BigDecimal> value() {
        return Optional.ofNullable(value);
    }

    @JsonValue
    public BigDecimal orNull() {
        return value;
    }

    @Override
    public String toString() {
        return value == null ? "undefined" : value.toPlainString();
    }
}
