/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.common.parameters;

import io.hdlsolver.core.common.exception.SolverException;
import org.junit.Test;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OptionsTest {

    @Test
    public void test_defaults() {
        Options.Solve options = new Options.Solve();
        assertEquals(Options.DEFAULT_MAX_ROUNDS, options.maxRounds());
        assertFalse(options.deduplicate());
        assertFalse(options.traceGenerations());
    }

    @Test
    public void test_unset_values_fall_back_to_parent() {
        Options.Global global = new Options.Global().maxRounds(8).deduplicate(true);
        Options.Solve options = new Options.Solve().parent(global).maxRounds(3);
        assertEquals(3, options.maxRounds());
        assertTrue(options.deduplicate());
        assertFalse(options.traceGenerations());
    }

    @Test
    public void test_invalid_values_are_rejected() {
        try {
            new Options.Solve().maxRounds(0);
            fail();
        } catch (SolverException e) {
            assertEquals(ILLEGAL_ARGUMENT, e.errorMessage());
        }
        try {
            new Options.Global().parent(new Options.Solve());
            fail();
        } catch (SolverException e) {
            assertEquals(ILLEGAL_STATE, e.errorMessage());
        }
    }
}
