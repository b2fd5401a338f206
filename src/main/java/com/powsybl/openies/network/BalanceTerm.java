/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.opt.DispatchVariableType;

import java.util.Objects;

/**
 * Contribution of one device variable to the energy balance of a bus: positive injects, negative withdraws.
 *
 * @author Open IES developers
 */
public record BalanceTerm(DispatchVariableType type, double coefficient) {

    public BalanceTerm {
        Objects.requireNonNull(type);
    }

    public boolean isInjection() {
        return coefficient > 0;
    }
}
