package pe.farmaciasperuanas.digital.process.clickstream.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterClauseTest {

    @Test
    void unsetClauseAcceptsEverythingIncludingNull() {
        FilterClause<Integer> clause = FilterClause.unset();

        assertThat(clause.isSet()).isFalse();
        assertThat(clause.test(7)).isTrue();
        assertThat(clause.test(null)).isTrue();
        assertThat(clause.anyMatch(v -> false)).isTrue();
    }

    @Test
    void emptyClauseRejectsEverything() {
        FilterClause<Integer> clause = FilterClause.of(List.of());

        assertThat(clause.isSet()).isTrue();
        assertThat(clause.test(1)).isFalse();
        assertThat(clause.anyMatch(v -> true)).isFalse();
    }

    @Test
    void setClauseRequiresMembershipAndRejectsNull() {
        FilterClause<String> clause = FilterClause.of("Feb", "Mar");

        assertThat(clause.test("Feb")).isTrue();
        assertThat(clause.test("May")).isFalse();
        assertThat(clause.test(null)).isFalse();
    }

    @Test
    void ofNullableDistinguishesNullFromEmpty() {
        assertThat(FilterClause.<Integer>ofNullable(null).isSet()).isFalse();
        assertThat(FilterClause.<Integer>ofNullable(List.of()).isSet()).isTrue();
    }

    @Test
    void valuesOfUnsetClauseFails() {
        assertThatThrownBy(() -> FilterClause.unset().values())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void clausesWithSameValuesAreEqual() {
        assertThat(FilterClause.of(1, 2)).isEqualTo(FilterClause.of(List.of(2, 1)));
        assertThat(FilterClause.of(List.of())).isNotEqualTo(FilterClause.unset());
    }
}
