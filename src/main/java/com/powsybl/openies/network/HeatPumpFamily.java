/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

/**
 * Heat pump technologies, with their default heating COP and cooling EER.
 *
 * @author Open IES developers
 */
public enum HeatPumpFamily {
    ASHP(3.0, 3.5),
    GSHP_SHALLOW(4.0, 4.5),
    GSHP_DEEP(5.0, 5.5);

    private final double defaultCop;

    private final double defaultEer;

    HeatPumpFamily(double defaultCop, double defaultEer) {
        this.defaultCop = defaultCop;
        this.defaultEer = defaultEer;
    }

    public double getDefaultCop() {
        return defaultCop;
    }

    public double getDefaultEer() {
        return defaultEer;
    }
}
