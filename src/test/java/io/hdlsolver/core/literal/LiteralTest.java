/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;
import org.junit.Test;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.INCOMMENSURABLE_UNITS;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.KIND_MISMATCH;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LiteralTest {

    @Test
    public void test_quantities_compare_in_base_units() {
        Literal.Quantity kilo = Literal.quantity(2, Units.of("kV"));
        Literal.Quantity volts = Literal.quantity(2000, Units.VOLT);
        assertEquals(kilo, volts);
        assertEquals(kilo.hashCode(), volts.hashCode());
        assertNotEquals(Literal.quantity(2000, Units.AMPERE), volts);
    }

    @Test
    public void test_canonical_form_strips_the_unit() {
        Literal.Quantity resistance = Literal.quantity(10, Units.of("kΩ"));
        Literal.Quantity canonical = resistance.canonical();
        assertTrue(canonical.isCanonical());
        assertFalse(resistance.isCanonical());
        assertEquals(Literal.quantity(10000), canonical);
        assertEquals(resistance, canonical.restore(Units.of("kΩ")));
        assertEquals(10, canonical.restore(Units.of("kΩ")).single(), 1e-9);
    }

    @Test
    public void test_offset_units_convert_through_base() {
        Literal.Quantity celsius = Literal.quantity(25, Units.CELSIUS);
        assertEquals(298.15, celsius.baseValues().single(), 1e-9);
        assertEquals(25, celsius.canonical().restore(Units.CELSIUS).single(), 1e-9);
        assertEquals(298.15, celsius.in(Units.KELVIN).single(), 1e-9);
    }

    @Test
    public void test_addition_stays_in_the_left_unit() {
        Literal.Quantity sum = Literal.quantity(1, Units.of("kV")).add(Literal.quantity(500, Units.VOLT));
        assertEquals(Units.of("kV"), sum.unit());
        assertEquals(1.5, sum.single(), 1e-12);
    }

    @Test
    public void test_addition_of_incommensurable_units_throws() {
        try {
            Literal.quantity(1, Units.VOLT).add(Literal.quantity(1, Units.AMPERE));
            fail();
        } catch (SolverException e) {
            assertEquals(INCOMMENSURABLE_UNITS, e.errorMessage());
        }
    }

    @Test
    public void test_multiplication_derives_the_unit() {
        Literal.Quantity power = Literal.quantity(2, Units.VOLT).multiply(Literal.quantity(3, Units.AMPERE));
        assertTrue(power.unit().isCommensurableWith(Units.WATT));
        assertEquals(Literal.quantity(6, Units.WATT), power);

        Literal.Quantity current = Literal.quantity(10, Units.VOLT).divide(Literal.quantity(2, Units.OHM));
        assertTrue(current.unit().isCommensurableWith(Units.AMPERE));
        assertEquals(5, current.single(), 1e-12);
    }

    @Test
    public void test_tolerance_builds_a_symmetric_range() {
        Literal.Quantity tolerance = Literal.tolerance(100, 0.1, Units.OHM);
        assertEquals(90, tolerance.min(), 1e-9);
        assertEquals(110, tolerance.max(), 1e-9);
    }

    @Test
    public void test_mixing_kinds_throws() {
        try {
            Literal.quantity(1).union(Literal.Booleans.TRUE);
            fail();
        } catch (SolverException e) {
            assertEquals(KIND_MISMATCH, e.errorMessage());
        }
        try {
            Literal.Booleans.TRUE.asQuantity();
            fail();
        } catch (SolverException e) {
            assertEquals(ILLEGAL_CAST, e.errorMessage());
        }
    }

    @Test
    public void test_booleans_behave_as_subsets_of_true_and_false() {
        assertEquals(Literal.Booleans.ANY, Literal.Booleans.TRUE.union(Literal.Booleans.FALSE));
        assertEquals(Literal.Booleans.NONE, Literal.Booleans.TRUE.intersect(Literal.Booleans.FALSE));
        assertEquals(Literal.Booleans.FALSE, Literal.Booleans.TRUE.not());
        assertEquals(Literal.Booleans.ANY, Literal.Booleans.ANY.not());
        assertEquals(Literal.Booleans.TRUE, Literal.Booleans.FALSE.or(Literal.Booleans.TRUE));
        assertEquals(Literal.Booleans.ANY, Literal.Booleans.FALSE.or(Literal.Booleans.ANY));
        assertEquals(Literal.Booleans.NONE, Literal.Booleans.NONE.or(Literal.Booleans.TRUE));
        assertTrue(Literal.Booleans.TRUE.isSubsetOf(Literal.Booleans.ANY));
        assertFalse(Literal.Booleans.ANY.isSubsetOf(Literal.Booleans.TRUE));
        assertEquals(Literal.Booleans.TRUE, Literal.Booleans.ANY.difference(Literal.Booleans.FALSE));
    }

    @Test
    public void test_enum_sets() {
        EnumType dielectric = EnumType.of("Dielectric", "C0G", "X7R", "Y5V");
        Literal.Enums stable = Literal.Enums.of(dielectric.member("C0G"), dielectric.member("X7R"));
        Literal.Enums all = Literal.Enums.all(dielectric);
        assertTrue(stable.isSubsetOf(all));
        assertEquals(Literal.Enums.of(dielectric.member("Y5V")), all.difference(stable));
        assertEquals(dielectric.member("X7R"), stable.intersect(Literal.Enums.of(dielectric.member("X7R"))).single());
        assertTrue(Literal.Enums.none(dielectric).isEmpty());
        assertEquals("{Dielectric.C0G, Dielectric.X7R}", stable.toString());
    }

    @Test
    public void test_enum_sets_of_different_types_do_not_mix() {
        EnumType a = EnumType.of("A", "X");
        EnumType b = EnumType.of("B", "X");
        try {
            Literal.Enums.all(a).union(Literal.Enums.all(b));
            fail();
        } catch (SolverException e) {
            assertEquals(KIND_MISMATCH, e.errorMessage());
        }
    }

    @Test
    public void test_repeated_members_collapse() {
        EnumType dielectric = EnumType.of("Dielectric", "C0G", "X7R");
        Literal.Enums repeated = Literal.Enums.of(dielectric.member("C0G"), dielectric.member("C0G"));
        assertEquals(Literal.Enums.of(dielectric.member("C0G")), repeated);
        assertEquals(Literal.Strings.of("x"), Literal.Strings.of("x", "x"));
    }

    @Test
    public void test_enum_set_needs_members_of_one_type() {
        try {
            Literal.Enums.of();
            fail();
        } catch (SolverException e) {
            assertEquals(ILLEGAL_ARGUMENT, e.errorMessage());
        }
        EnumType a = EnumType.of("A", "X");
        EnumType b = EnumType.of("B", "X");
        try {
            Literal.Enums.of(a.member("X"), b.member("X"));
            fail();
        } catch (SolverException e) {
            assertEquals(KIND_MISMATCH, e.errorMessage());
        }
    }

    @Test
    public void test_universal_strings() {
        Literal.Strings names = Literal.Strings.of("a", "b");
        assertTrue(names.isSubsetOf(Literal.Strings.ALL));
        assertFalse(Literal.Strings.ALL.isSubsetOf(names));
        assertEquals(names, Literal.Strings.ALL.intersect(names));
        assertEquals(Literal.Strings.ALL, names.union(Literal.Strings.ALL));
        assertEquals(Literal.Strings.of("b"), names.difference(Literal.Strings.of("a")));
        assertEquals("b", names.difference(Literal.Strings.of("a")).single());
        assertTrue(names.difference(Literal.Strings.ALL).isEmpty());
    }

    @Test
    public void test_symmetric_difference_of_quantities() {
        Literal.Quantity a = Literal.quantity(0, 4);
        Literal.Quantity b = Literal.quantity(2, 6);
        Literal.Quantity difference = a.symmetricDifference(b);
        assertEquals(Literal.quantity(NumericSet.of(Interval.of(0, 2), Interval.of(4, 6)), Units.DIMENSIONLESS), difference);
        assertTrue(a.isSupersetOf(Literal.quantity(1, 3)));
    }

    @Test
    public void test_printing() {
        assertEquals("{3}", Literal.quantity(3).toString());
        assertEquals("[1, 4] V", Literal.quantity(1, 4, Units.VOLT).toString());
        assertEquals("{true}", Literal.Booleans.TRUE.toString());
        assertEquals("{*}", Literal.Strings.ALL.toString());
    }
}
