/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Collections.unmodifiableList;

/**
 * Collects the warnings and user errors of one solve, in the order they were raised. Contradictions
 * are reported together at the end of a solve rather than thrown one by one.
 */
public class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Warning> warnings;
    private final Set<Contradiction> contradictions;

    public Diagnostics() {
        this.warnings = new ArrayList<>();
        this.contradictions = new LinkedHashSet<>();
    }

    public void warn(Warning warning) {
        LOG.warn(warning.toString());
        warnings.add(warning);
    }

    public void contradiction(Contradiction contradiction) {
        if (contradictions.add(contradiction) && LOG.isDebugEnabled()) {
            LOG.debug("Contradiction recorded: {}", contradiction);
        }
    }

    public List<Warning> warnings() {
        return unmodifiableList(warnings);
    }

    public List<Contradiction> contradictions() {
        return unmodifiableList(new ArrayList<>(contradictions));
    }
}
