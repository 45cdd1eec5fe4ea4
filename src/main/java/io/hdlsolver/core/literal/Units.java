/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.literal.Unit.Dimension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.UNKNOWN_UNIT;

public class Units {

    public static final Unit DIMENSIONLESS = Unit.dimensionless(1, "");
    public static final Unit PERCENT = Unit.dimensionless(0.01, "%");
    public static final Unit PPM = Unit.dimensionless(1e-6, "ppm");

    public static final Unit AMPERE = Unit.of(Dimension.AMPERE, "A");
    public static final Unit SECOND = Unit.of(Dimension.SECOND, "s");
    public static final Unit METER = Unit.of(Dimension.METER, "m");
    public static final Unit KILOGRAM = Unit.of(Dimension.KILOGRAM, "kg");
    public static final Unit KELVIN = Unit.of(Dimension.KELVIN, "K");
    public static final Unit MOLE = Unit.of(Dimension.MOLE, "mol");
    public static final Unit CANDELA = Unit.of(Dimension.CANDELA, "cd");
    public static final Unit RADIAN = Unit.of(Dimension.RADIAN, "rad");
    public static final Unit STERADIAN = Unit.of(Dimension.STERADIAN, "sr");
    public static final Unit BIT = Unit.of(Dimension.BIT, "bit");

    public static final Unit HERTZ = SECOND.power(-1).named("Hz");
    public static final Unit COULOMB = AMPERE.multiply(SECOND).named("C");
    public static final Unit WATT = KILOGRAM.multiply(METER.power(2)).multiply(SECOND.power(-3)).named("W");
    public static final Unit VOLT = WATT.divide(AMPERE).named("V");
    public static final Unit OHM = VOLT.divide(AMPERE).named("Ω");
    public static final Unit FARAD = COULOMB.divide(VOLT).named("F");
    public static final Unit HENRY = VOLT.multiply(SECOND).divide(AMPERE).named("H");
    public static final Unit DEGREE = RADIAN.scaled(Math.PI / 180, "deg");
    public static final Unit CELSIUS = KELVIN.withOffset(273.15, "°C");
    public static final Unit BYTE = BIT.scaled(8, "B");

    private static final Map<String, Unit> BY_SYMBOL;
    private static final Map<String, Double> PREFIXES;

    static {
        Map<String, Unit> units = new LinkedHashMap<>();
        for (Unit unit : new Unit[]{
                PERCENT, PPM, AMPERE, SECOND, METER, KILOGRAM, KELVIN, MOLE, CANDELA, RADIAN, STERADIAN,
                BIT, HERTZ, COULOMB, WATT, VOLT, OHM, FARAD, HENRY, DEGREE, CELSIUS, BYTE
        }) {
            units.put(unit.symbol(), unit);
        }
        units.put("", DIMENSIONLESS);
        units.put("g", KILOGRAM.scaled(1e-3, "g"));
        units.put("ohm", OHM);
        BY_SYMBOL = Collections.unmodifiableMap(units);

        Map<String, Double> prefixes = new LinkedHashMap<>();
        prefixes.put("p", 1e-12);
        prefixes.put("n", 1e-9);
        prefixes.put("u", 1e-6);
        prefixes.put("µ", 1e-6);
        prefixes.put("m", 1e-3);
        prefixes.put("k", 1e3);
        prefixes.put("M", 1e6);
        prefixes.put("G", 1e9);
        PREFIXES = Collections.unmodifiableMap(prefixes);
    }

    /**
     * Looks up a unit by symbol, accepting an SI prefix in front of any named unit, e.g. {@code kΩ}.
     * An unprefixed match wins, so {@code m} is metre rather than milli-nothing.
     */
    public static Unit of(String symbol) {
        Unit unit = BY_SYMBOL.get(symbol);
        if (unit != null) return unit;
        if (symbol.length() > 1) {
            Double factor = PREFIXES.get(symbol.substring(0, 1));
            Unit named = BY_SYMBOL.get(symbol.substring(1));
            if (factor != null && named != null && named.offset() == 0 && !named.symbol().isEmpty()) {
                return named.scaled(factor, symbol);
            }
        }
        throw SolverException.of(UNKNOWN_UNIT, symbol);
    }
}
