package org.tabelle.table;

import org.junit.jupiter.api.Test;
import org.tabelle.eval.Environment;
import org.tabelle.support.FormulaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssignmentEnumeratorTest {

    @Test
    void rowsStartFromAllTrueAndCountDown() {
        AssignmentEnumerator enumerator = new AssignmentEnumerator(List.of("p", "q"));

        assertThat(enumerator.size()).isEqualTo(4);
        assertThat(enumerator.assignment(0)).containsExactly(true, true);
        assertThat(enumerator.assignment(1)).containsExactly(true, false);
        assertThat(enumerator.assignment(2)).containsExactly(false, true);
        assertThat(enumerator.assignment(3)).containsExactly(false, false);
    }

    @Test
    void firstVariableChangesSlowest() {
        AssignmentEnumerator enumerator = new AssignmentEnumerator(List.of("a", "b", "c"));

        assertThat(enumerator.size()).isEqualTo(8);
        assertThat(enumerator.assignment(3)).containsExactly(true, false, false);
        assertThat(enumerator.assignment(4)).containsExactly(false, true, true);

        List<Environment> environments = enumerator.environments();
        assertThat(environments).hasSize(8).doesNotHaveDuplicates();
        assertThat(environments.get(5).valueOf("a")).isFalse();
        assertThat(environments.get(5).valueOf("b")).isTrue();
        assertThat(environments.get(5).valueOf("c")).isFalse();
    }

    @Test
    void noVariablesGiveASingleEmptyRow() {
        AssignmentEnumerator enumerator = new AssignmentEnumerator(List.of());

        assertThat(enumerator.size()).isEqualTo(1);
        assertThat(enumerator.assignment(0)).isEmpty();
    }

    @Test
    void rowsOutsideTheTableAreRejected() {
        AssignmentEnumerator enumerator = new AssignmentEnumerator(List.of("p"));

        assertThatThrownBy(() -> enumerator.assignment(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> enumerator.assignment(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void largestRepresentableTableIsAccepted() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < AssignmentEnumerator.MAX_VARIABLES; i++) {
            names.add(String.join("", Collections.nCopies(i + 1, "x")));
        }

        AssignmentEnumerator enumerator = new AssignmentEnumerator(names);

        assertThat(enumerator.size()).isEqualTo(1 << 30);
        assertThat(enumerator.assignment(enumerator.size() - 1)).containsOnly(false);
    }

    @Test
    void tooManyVariablesAreRejected() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i <= AssignmentEnumerator.MAX_VARIABLES; i++) {
            names.add(String.join("", Collections.nCopies(i + 1, "x")));
        }

        assertThatThrownBy(() -> new AssignmentEnumerator(names))
                .isInstanceOf(FormulaException.class)
                .hasMessageContaining("2^31");
    }
}
