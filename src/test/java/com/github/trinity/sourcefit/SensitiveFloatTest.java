package com.github.trinity.sourcefit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

class SensitiveFloatTest {

    @Test
    void accumulatesValueAndGradientTogether() {
        SensitiveFloat total = SensitiveFloat.zero(2);
        SensitiveFloat other = SensitiveFloat.zero(2);
        other.addValue(3.0);
        other.addDerivative(1, 5, 2.0);

        total.addScaled(other, -0.5);
        total.add(other);

        assertEquals(1.5, total.value(), 1e-15);
        assertEquals(1.0, total.derivative(1, 5), 1e-15);
        assertEquals(0.0, total.derivative(0, 5), 0.0);
        assertEquals(2, total.numSources());
        assertEquals(ParamLayout.SIZE, total.numParams());
    }

    @Test
    void localScalarsLandInTheirSourceSlot() {
        SensitiveFloat local = SensitiveFloat.zero();
        local.addValue(2.0);
        local.addDerivative(0, ParamLayout.scale(), 4.0);

        SensitiveFloat total = SensitiveFloat.zero(3);
        total.addToSource(local, 2, 0.5);
        assertEquals(1.0, total.value(), 1e-15);
        assertEquals(2.0, total.derivative(2, ParamLayout.scale()), 1e-15);

        // The chain-rule step leaves the value alone.
        total.addGradient(local, 0, 3.0);
        assertEquals(1.0, total.value(), 1e-15);
        assertEquals(12.0, total.derivative(0, ParamLayout.scale()), 1e-15);

        assertThrows(IllegalArgumentException.class, () -> local.addGradient(total, 0, 1.0));
    }

    @Test
    void copyIsIndependentAndClearResets() {
        SensitiveFloat sf = SensitiveFloat.zero(1);
        sf.addValue(1.0);
        sf.addDerivative(0, 0, 1.0);

        SensitiveFloat copy = sf.copy();
        sf.scale(4.0);
        assertEquals(4.0, sf.value(), 0.0);
        assertEquals(4.0, sf.gradient(0)[0], 0.0);
        assertEquals(1.0, copy.value(), 0.0);
        assertEquals(1.0, copy.derivative(0, 0), 0.0);

        sf.gradient(0)[0] = 100.0;
        assertEquals(4.0, sf.derivative(0, 0), 0.0);

        sf.clear();
        assertEquals(0.0, sf.value(), 0.0);
        assertEquals(0.0, sf.derivative(0, 0), 0.0);
    }

    @Test
    void emptyModelStillHasAShape() {
        SensitiveFloat empty = SensitiveFloat.zero(0);
        empty.addValue(-2.5);
        assertEquals(0, empty.numSources());
        assertEquals(ParamLayout.SIZE, empty.numParams());

        SensitiveFloat copy = empty.copy();
        assertEquals(ParamLayout.SIZE, copy.numParams());
        assertEquals(-2.5, copy.value(), 0.0);
        copy.add(empty);
        assertEquals(-5.0, copy.value(), 0.0);
    }

    @Test
    void mismatchedSourceCountsAreRejected() {
        SensitiveFloat one = SensitiveFloat.zero(1);
        SensitiveFloat two = SensitiveFloat.zero(2);
        assertThrows(DimensionMismatchException.class, () -> two.add(one));
    }
}
