/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.solver;

import com.powsybl.openies.network.Carrier;

import java.util.Objects;

/**
 * Energy missing ({@code shortfall}) or in excess ({@code surplus}) on the bus of a carrier at a timestep to make the
 * problem feasible.
 *
 * @author Open IES developers
 */
public record BalanceViolation(Carrier carrier, int timestep, double shortfall, double surplus) {

    public BalanceViolation {
        Objects.requireNonNull(carrier);
    }

    public double getAmount() {
        return shortfall + surplus;
    }
}
