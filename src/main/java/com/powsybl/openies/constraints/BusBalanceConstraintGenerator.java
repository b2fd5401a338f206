/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import com.powsybl.openies.network.BalanceTerm;
import com.powsybl.openies.network.IesBus;
import com.powsybl.openies.network.IesDevice;
import com.powsybl.openies.network.IesNetwork;
import com.powsybl.openies.opt.VariableRef;

/**
 * Energy balance of every bus at every timestep: the balance terms of the attached devices sum up to the demand.
 *
 * @author Open IES developers
 */
public class BusBalanceConstraintGenerator implements ConstraintGenerator {

    public static final String NAME = "BusBalance";

    public static String getConstraintName(IesBus bus, int timestep) {
        return "balance_" + bus.getId() + "_" + timestep;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void generate(IesNetwork network, ConstraintSet constraints) {
        for (IesBus bus : network.getBuses()) {
            for (int t = 0; t < network.getHorizon(); t++) {
                LinearConstraint.Builder builder = LinearConstraint.builder(getConstraintName(bus, t), ConstraintKind.BUS_BALANCE, t)
                        .setCarrier(bus.getCarrier());
                for (IesDevice device : bus.getDevices()) {
                    for (BalanceTerm term : device.getBalanceTerms(bus.getCarrier())) {
                        builder.addTerm(new VariableRef(device.getNum(), term.type(), t), term.coefficient());
                    }
                }
                constraints.add(builder.equalTo(bus.getDemand(t)));
            }
        }
        checkWiring(network);
    }

    /**
     * Every balance term of a device must land on an existing bus.
     */
    private static void checkWiring(IesNetwork network) {
        for (IesDevice device : network.getDevices()) {
            device.getCarriers().forEach(carrier -> {
                if (network.getBus(carrier).isEmpty() && !device.getBalanceTerms(carrier).isEmpty()) {
                    throw new IllegalStateException("Device '" + device.getId() + "' has balance terms on carrier "
                            + carrier + " which has no bus");
                }
            });
        }
    }
}
