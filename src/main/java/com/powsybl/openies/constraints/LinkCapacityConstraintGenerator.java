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
import com.powsybl.openies.opt.VariableRef;

/**
 * Capacity of a link shared by all its modes: at every timestep the capacity consumed by the modes does not exceed
 * the link capacity. Single mode links are bounded by their variable upper bound only.
 *
 * @author Open IES developers
 */
public class LinkCapacityConstraintGenerator implements ConstraintGenerator {

    public static final String NAME = "LinkCapacity";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void generate(IesNetwork network, ConstraintSet constraints) {
        for (IesLink link : network.getDevices(IesLink.class)) {
            if (link.getModes().size() < 2) {
                continue;
            }
            for (int t = 0; t < network.getHorizon(); t++) {
                LinearConstraint.Builder builder = LinearConstraint.builder("linkCapacity_" + link.getId() + "_" + t, ConstraintKind.LINK_CAPACITY, t)
                        .setDeviceId(link.getId());
                for (LinkMode mode : link.getModes()) {
                    builder.addTerm(new VariableRef(link.getNum(), mode.mode().getInputVariableType(), t), link.getCapacityFactor(mode));
                }
                constraints.add(builder.lessOrEqual(link.getCapacity()));
            }
        }
    }
}
