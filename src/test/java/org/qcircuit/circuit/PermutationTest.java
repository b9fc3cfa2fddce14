package org.qcircuit.circuit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PermutationTest {

    @Test
    void identityIsBijection() {
        assertThat(Permutation.identity(4).isBijectionOver(4)).isTrue();
        assertThat(Permutation.identity(4).isBijectionOver(3)).isFalse();
    }

    @Test
    void detectsCollidingImages() {
        Permutation permutation = new Permutation();
        permutation.put(0, 1);
        permutation.put(1, 1);

        assertThat(permutation.isBijectionOver(2)).isFalse();
    }

    @Test
    void unmappedQubitThrows() {
        Permutation permutation = Permutation.identity(2);
        permutation.remove(1);

        assertThat(permutation.contains(1)).isFalse();
        assertThatThrownBy(() -> permutation.get(1)).isInstanceOf(CircuitException.class);
    }
}
