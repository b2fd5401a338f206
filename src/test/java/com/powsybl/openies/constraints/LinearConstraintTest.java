/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import com.powsybl.openies.network.Carrier;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.VariableRef;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open IES developers
 */
class LinearConstraintTest {

    private static final VariableRef X = new VariableRef(0, DispatchVariableType.GRID_IMPORT, 0);
    private static final VariableRef Y = new VariableRef(1, DispatchVariableType.GENERATION, 0);

    @Test
    void testTermMerging() {
        LinearConstraint constraint = LinearConstraint.builder("c", ConstraintKind.BUS_BALANCE, 0)
                .setCarrier(Carrier.ELECTRICITY)
                .addTerm(X, 1)
                .addTerm(Y, 2)
                .addTerm(X, 0.5)
                .equalTo(3);
        assertEquals(2, constraint.getTerms().size());
        assertEquals(new LinearTerm(X, 1.5), constraint.getTerms().get(0));
        assertEquals(ConstraintSense.EQUAL, constraint.getSense());
        assertEquals(Carrier.ELECTRICITY, constraint.getCarrier().orElseThrow());
        assertTrue(constraint.getDeviceId().isEmpty());
        assertEquals("c: 1.5*imp_0_0 + 2.0*p_1_0 = 3.0", constraint.toString());
    }

    @Test
    void testCancelledTermsAreDropped() {
        LinearConstraint constraint = LinearConstraint.builder("c", ConstraintKind.STATE_OF_CHARGE, 0)
                .addTerm(X, 1)
                .addTerm(X, -1)
                .addTerm(Y, 1)
                .lessOrEqual(1);
        assertEquals(1, constraint.getTerms().size());
        assertEquals(Y, constraint.getTerms().get(0).variable());
    }

    @Test
    void testViolation() {
        Map<VariableRef, Double> values = Map.of(X, 2.0, Y, 1.0);
        LinearConstraint le = LinearConstraint.builder("le", ConstraintKind.LINK_CAPACITY, 0).addTerm(X, 1).addTerm(Y, 1).lessOrEqual(2);
        LinearConstraint ge = LinearConstraint.builder("ge", ConstraintKind.LINK_CAPACITY, 0).addTerm(X, 1).addTerm(Y, 1).greaterOrEqual(5);
        LinearConstraint eq = LinearConstraint.builder("eq", ConstraintKind.BUS_BALANCE, 0).addTerm(X, 1).addTerm(Y, -1).equalTo(3);
        assertEquals(3, le.evalLhs(values::get), 0);
        assertEquals(1, le.getViolation(values::get), 0);
        assertEquals(2, ge.getViolation(values::get), 0);
        assertEquals(2, eq.getViolation(values::get), 0);
        assertEquals(0, LinearConstraint.builder("ok", ConstraintKind.BUS_BALANCE, 0).addTerm(X, 1).lessOrEqual(2)
                .getViolation(values::get), 0);
    }
}
