/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import com.powsybl.openies.network.IesLink;
import com.powsybl.openies.network.IesNetwork;
import com.powsybl.openies.network.LinkMode;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.VariableRef;

import java.util.Locale;

/**
 * Mode exclusivity of links which cannot run several modes in the same timestep, typically heat pumps that either
 * heat or cool. For every timestep the mode indicators sum up to at most one, and the capacity of a mode is only
 * available when its indicator is on.
 *
 * @author Open IES developers
 */
public class HeatPumpModeExclusivityConstraintGenerator implements ConstraintGenerator {

    public static final String NAME = "ModeExclusivity";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void generate(IesNetwork network, ConstraintSet constraints) {
        for (IesLink link : network.getExclusiveLinks()) {
            int num = link.getNum();
            for (int t = 0; t < network.getHorizon(); t++) {
                LinearConstraint.Builder exclusivity = LinearConstraint.builder("exclusive_" + link.getId() + "_" + t,
                                ConstraintKind.MODE_EXCLUSIVITY, t)
                        .setDeviceId(link.getId());
                for (LinkMode mode : link.getModes()) {
                    DispatchVariableType indicatorType = mode.mode().getIndicatorVariableType()
                            .orElseThrow(() -> new IllegalStateException("Mode " + mode.mode() + " of link '" + link.getId()
                                    + "' has no indicator"));
                    VariableRef indicator = new VariableRef(num, indicatorType, t);
                    exclusivity.addTerm(indicator, 1);
                    constraints.add(LinearConstraint.builder("modeCapacity_" + link.getId() + "_" + mode.mode().name().toLowerCase(Locale.ROOT) + "_" + t,
                                    ConstraintKind.MODE_CAPACITY, t)
                            .setDeviceId(link.getId())
                            .addTerm(new VariableRef(num, mode.mode().getInputVariableType(), t), link.getCapacityFactor(mode))
                            .addTerm(indicator, -link.getCapacity())
                            .lessOrEqual(0));
                }
                constraints.add(exclusivity.lessOrEqual(1));
            }
        }
    }
}
