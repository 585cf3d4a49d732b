package me.golemcore.tokens.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostTest {

    @Test
    void undefinedPlusUndefinedStaysUndefined() {
        assertFalse(Cost.undefined().plus(Cost.undefined()).isDefined());
    }

    @Test
    void undefinedPlusDefinedIsDefined() {
        assertEquals(Cost.of(1.5), Cost.undefined().plus(Cost.of(1.5)));
        assertEquals(Cost.of(1.5), Cost.of(1.5).plus(Cost.undefined()));
    }

    @Test
    void definedValuesAdd() {
        assertEquals(3.0, Cost.of(1.0).plus(Cost.of(2.0)).getValue(), 1e-12);
    }

    @Test
    void definedZeroIsNotUndefined() {
        Cost zero = Cost.of(0.0);

        assertTrue(zero.isDefined());
        assertNotEquals(Cost.undefined(), zero);
    }

    @Test
    void undefinedValueThrows() {
        Cost undefined = Cost.undefined();
        assertThrows(IllegalStateException.class, undefined::getValue);
        assertEquals(0.0, undefined.orZero());
    }

    @Test
    void comparesUndefinedAsZero() {
        assertEquals(0, Cost.undefined().compareTo(Cost.of(0.0)));
        assertTrue(Cost.of(0.5).compareTo(Cost.undefined()) > 0);
    }
}
