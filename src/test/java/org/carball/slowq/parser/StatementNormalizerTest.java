package org.carball.slowq.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementNormalizerTest {

    @Test
    void shouldReplaceLiteralsAndLowerCase() {
        assertThat(StatementNormalizer.normalize("SELECT * FROM Orders WHERE id = 42 AND name = 'O''Brien'"))
                .isEqualTo("select * from orders where id = ? and name = ?");
    }

    @Test
    void shouldKeepDigitsInsideIdentifiers() {
        assertThat(StatementNormalizer.normalize("SELECT col1 FROM t2 WHERE x = 3.5e-2"))
                .isEqualTo("select col1 from t2 where x = ?");
    }

    @Test
    void shouldKeepBacktickIdentifiersVerbatim() {
        assertThat(StatementNormalizer.normalize("SELECT `Id` FROM `Orders`"))
                .isEqualTo("select `Id` from `Orders`");
    }

    @Test
    void shouldDropComments() {
        assertThat(StatementNormalizer.normalize("SELECT /* hint */ id FROM t -- trailing note"))
                .isEqualTo("select id from t");
        assertThat(StatementNormalizer.normalize("SELECT id FROM t # note"))
                .isEqualTo("select id from t");
    }

    @Test
    void shouldCollapseInListsAndValueTuples() {
        assertThat(StatementNormalizer.normalize("SELECT id FROM t WHERE id IN (1, 2, 3)"))
                .isEqualTo("select id from t where id in (...)");
        assertThat(StatementNormalizer.normalize("INSERT INTO t (a, b) VALUES (1, 'x'), (2, 'y'), (3, 'z')"))
                .isEqualTo("insert into t (a, b) values (?, ?), ...");
    }

    @Test
    void shouldCollapseWhitespaceAndTrailingSemicolon() {
        assertThat(StatementNormalizer.normalize("  SELECT\n  id\tFROM   t ;"))
                .isEqualTo("select id from t");
    }

    @Test
    void shouldGiveSameDigestForDifferentLiterals() {
        // When
        String first = StatementNormalizer.digest("SELECT * FROM orders WHERE customer_id = 1");
        String second = StatementNormalizer.digest("select *  from orders where customer_id = 987");
        String other = StatementNormalizer.digest("SELECT * FROM orders WHERE status = 'x'");

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(other);
        assertThat(first).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void shouldRejectNull() {
        assertThatThrownBy(() -> StatementNormalizer.normalize(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
