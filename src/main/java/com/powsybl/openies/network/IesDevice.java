/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.opt.CostTerm;
import com.powsybl.openies.opt.DispatchVariableType;

import java.util.List;
import java.util.Set;

/**
 * A dispatchable device of the network. Each variant declares its own variables with their bounds, its
 * contribution to the balance of the buses it is attached to, and its cost terms.
 *
 * @author Open IES developers
 */
public sealed interface IesDevice permits IesGenerator, IesStorageUnit, IesLink {

    String getId();

    int getNum();

    DeviceType getType();

    double getCapacity();

    double getMarginalCost();

    /**
     * Investment flag, recorded but not used by dispatch.
     */
    boolean isExtendable();

    /**
     * Carriers of the buses the device is attached to.
     */
    Set<Carrier> getCarriers();

    List<DispatchVariableType> getVariableTypes();

    default double getMinValue(DispatchVariableType type, int timestep) {
        return 0;
    }

    double getMaxValue(DispatchVariableType type, int timestep);

    /**
     * Balance terms of the device on the bus of the given carrier, empty if the device is not attached to it.
     */
    List<BalanceTerm> getBalanceTerms(Carrier carrier);

    List<CostTerm> getCostTerms(int timestep);
}
