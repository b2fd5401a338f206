/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import com.powsybl.openies.network.IesNetwork;
import com.powsybl.openies.network.IesStorageUnit;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.StorageBoundaryPolicy;
import com.powsybl.openies.opt.VariableRef;

import java.util.Objects;

/**
 * State of charge continuity of every storage unit:
 * {@code soc[t] = (1 - standingLoss) * soc[t-1] + chargeEfficiency * charge[t] - discharge[t] / dischargeEfficiency}.
 *
 * @author Open IES developers
 */
public class StorageStateOfChargeConstraintGenerator implements ConstraintGenerator {

    public static final String NAME = "StorageStateOfCharge";

    private final StorageBoundaryPolicy boundaryPolicy;

    public StorageStateOfChargeConstraintGenerator(StorageBoundaryPolicy boundaryPolicy) {
        this.boundaryPolicy = Objects.requireNonNull(boundaryPolicy);
    }

    public StorageBoundaryPolicy getBoundaryPolicy() {
        return boundaryPolicy;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void generate(IesNetwork network, ConstraintSet constraints) {
        int horizon = network.getHorizon();
        for (IesStorageUnit storage : network.getDevices(IesStorageUnit.class)) {
            int num = storage.getNum();
            double retention = 1 - storage.getStandingLoss();
            for (int t = 0; t < horizon; t++) {
                LinearConstraint.Builder builder = LinearConstraint.builder("soc_" + storage.getId() + "_" + t, ConstraintKind.STATE_OF_CHARGE, t)
                        .setCarrier(storage.getCarrier())
                        .setDeviceId(storage.getId())
                        .addTerm(new VariableRef(num, DispatchVariableType.STATE_OF_CHARGE, t), 1)
                        .addTerm(new VariableRef(num, DispatchVariableType.CHARGE, t), -storage.getChargeEfficiency())
                        .addTerm(new VariableRef(num, DispatchVariableType.DISCHARGE, t), 1 / storage.getDischargeEfficiency());
                double rhs = 0;
                if (t > 0) {
                    builder.addTerm(new VariableRef(num, DispatchVariableType.STATE_OF_CHARGE, t - 1), -retention);
                } else if (boundaryPolicy == StorageBoundaryPolicy.CYCLIC) {
                    builder.addTerm(new VariableRef(num, DispatchVariableType.STATE_OF_CHARGE, horizon - 1), -retention);
                } else {
                    rhs = retention * storage.getInitialEnergy();
                }
                constraints.add(builder.equalTo(rhs));
            }
        }
    }
}
