/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;
import org.junit.Test;

import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.NON_INTEGRAL_UNIT_POWER;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.UNIT_WITH_OFFSET;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.UNKNOWN_UNIT;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UnitTest {

    @Test
    public void test_derived_units_share_a_basis() {
        assertTrue(Units.VOLT.multiply(Units.AMPERE).isCommensurableWith(Units.WATT));
        assertTrue(Units.OHM.multiply(Units.FARAD).isCommensurableWith(Units.SECOND));
        assertTrue(Units.HERTZ.multiply(Units.SECOND).isDimensionless());
        assertFalse(Units.VOLT.isCommensurableWith(Units.AMPERE));
        assertEquals(2, Units.WATT.exponent(Unit.Dimension.METER));
        assertEquals(-3, Units.WATT.exponent(Unit.Dimension.SECOND));
    }

    @Test
    public void test_prefixed_symbols() {
        assertEquals(1e3, Units.of("kΩ").multiplier(), 0);
        assertEquals(1e3, Units.of("kohm").multiplier(), 0);
        assertEquals(1e-6, Units.of("µF").multiplier(), 0);
        assertEquals(1e-6, Units.of("uF").multiplier(), 0);
        assertTrue(Units.of("mV").isCommensurableWith(Units.VOLT));
        assertSame(Units.METER, Units.of("m"));
        assertSame(Units.KILOGRAM, Units.of("kg"));
        assertEquals(1e-3, Units.of("g").multiplier(), 0);
        assertTrue(Units.of("").isCanonical());
    }

    @Test
    public void test_unknown_symbol_throws() {
        try {
            Units.of("furlong");
            fail();
        } catch (SolverException e) {
            assertEquals(UNKNOWN_UNIT, e.errorMessage());
        }
    }

    @Test
    public void test_prefix_on_an_offset_unit_is_unknown() {
        try {
            Units.of("k°C");
            fail();
        } catch (SolverException e) {
            assertEquals(UNKNOWN_UNIT, e.errorMessage());
        }
    }

    @Test
    public void test_offset_units_do_not_multiply() {
        try {
            Units.CELSIUS.multiply(Units.METER);
            fail();
        } catch (SolverException e) {
            assertEquals(UNIT_WITH_OFFSET, e.errorMessage());
        }
    }

    @Test
    public void test_square_root_needs_even_exponents() {
        Unit area = Units.METER.power(2);
        assertTrue(area.canRaiseTo(0.5));
        assertEquals(Units.METER, area.power(0.5));
        assertFalse(Units.METER.canRaiseTo(0.5));
        try {
            Units.METER.power(0.5);
            fail();
        } catch (SolverException e) {
            assertEquals(NON_INTEGRAL_UNIT_POWER, e.errorMessage());
        }
    }

    @Test
    public void test_conversion_to_and_from_base() {
        Unit millivolt = Units.of("mV");
        assertEquals(0.25, millivolt.toBase(250), 1e-12);
        assertEquals(250, millivolt.fromBase(0.25), 1e-9);
        assertEquals(Double.POSITIVE_INFINITY, Units.CELSIUS.toBase(Double.POSITIVE_INFINITY), 0);
        assertEquals(Units.VOLT, millivolt.base());
    }

    @Test
    public void test_unit_equality_ignores_the_symbol() {
        assertEquals(Units.OHM, Units.VOLT.divide(Units.AMPERE));
        assertEquals(Units.of("kΩ"), Units.OHM.scaled(1000, "kohm"));
        assertFalse(Units.of("kΩ").equals(Units.OHM));
    }
}
