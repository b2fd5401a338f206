/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.opt;

import java.util.Objects;

/**
 * Solver independent reference to a decision variable.
 *
 * @param elementNum number of the device, or of the bus for bus variables
 * @param type variable type
 * @param timestep timestep of the horizon
 *
 * @author Open IES developers
 */
public record VariableRef(int elementNum, DispatchVariableType type, int timestep) {

    public VariableRef {
        Objects.requireNonNull(type);
    }

    public String getName() {
        return type.getSymbol() + "_" + elementNum + "_" + timestep;
    }

    @Override
    public String toString() {
        return getName();
    }
}
