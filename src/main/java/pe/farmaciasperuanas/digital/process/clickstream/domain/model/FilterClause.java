package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Cláusula de filtro opcional sobre un atributo.
 * <ul>
 * <li>Sin definir: acepta cualquier registro.</li>
 * <li>Definida: el valor del registro debe pertenecer al conjunto. Un conjunto vacío no acepta nada.</li>
 * </ul>
 *
 * @param <T> tipo del atributo filtrado
 */
@EqualsAndHashCode
public final class FilterClause<T> {

    private static final FilterClause<?> UNSET = new FilterClause<>(null);

    private final Set<T> values;

    private FilterClause(Set<T> values) {
        this.values = values;
    }

    @SuppressWarnings("unchecked")
    public static <T> FilterClause<T> unset() {
        return (FilterClause<T>) UNSET;
    }

    public static <T> FilterClause<T> of(Collection<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return new FilterClause<>(Collections.unmodifiableSet(new LinkedHashSet<>(values)));
    }

    @SafeVarargs
    public static <T> FilterClause<T> of(T... values) {
        return of(Arrays.asList(values));
    }

    /**
     * {@code null} significa "sin filtro"; cualquier colección, incluso vacía, define la cláusula.
     */
    public static <T> FilterClause<T> ofNullable(Collection<? extends T> values) {
        return values == null ? unset() : of(values);
    }

    public boolean isSet() {
        return values != null;
    }

    public Set<T> values() {
        if (values == null) {
            throw new IllegalStateException("La cláusula no está definida");
        }
        return values;
    }

    /**
     * Prueba de pertenencia. Un valor nulo en el registro nunca satisface una cláusula definida.
     */
    public boolean test(T value) {
        if (values == null) {
            return true;
        }
        return value != null && values.contains(value);
    }

    /**
     * Disyunción interna: verdadero si algún valor del conjunto cumple la condición.
     */
    public boolean anyMatch(Predicate<? super T> condition) {
        if (values == null) {
            return true;
        }
        return values.stream().anyMatch(condition);
    }

    public boolean includes(T value) {
        return values == null || values.contains(value);
    }

    @Override
    public String toString() {
        return values == null ? "unset" : values.toString();
    }
}
