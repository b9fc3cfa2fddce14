package org.qcircuit.dd;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qcircuit.test.utils.DenseMatrixPackage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RetainedEdgeTest {

    @Test
    void closeReleasesOnce() {
        DenseMatrixPackage dd = new DenseMatrixPackage();
        Edge ident = dd.makeIdent(1);

        RetainedEdge retained = RetainedEdge.retain(dd, ident);
        assertThat(dd.referencesOf(ident)).isEqualTo(1);
        retained.close();
        retained.close();

        assertThat(dd.referencesOf(ident)).isZero();
    }

    @Test
    void detachTransfersOwnership() {
        DenseMatrixPackage dd = new DenseMatrixPackage();
        Edge ident = dd.makeIdent(1);

        try (RetainedEdge retained = RetainedEdge.retain(dd, ident)) {
            assertThat(retained.detach()).isSameAs(ident);
            assertThatThrownBy(retained::detach).isInstanceOf(IllegalStateException.class);
        }

        assertThat(dd.referencesOf(ident)).isEqualTo(1);
    }
}
