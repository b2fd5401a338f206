/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

/**
 * Names of the device parameters recognized by the catalog.
 *
 * @author Open IES developers
 */
public final class DeviceParameters {

    public static final String CAPACITY = "capacity";

    public static final String COST = "cost";

    public static final String EFFICIENCY = "efficiency";

    /**
     * Fuel cell heat recovery efficiency.
     */
    public static final String HEAT_EFFICIENCY = "heatEfficiency";

    public static final String MODE_FAMILY = "modeFamily";

    /**
     * Heat pump heating coefficient of performance, defaults to the family one.
     */
    public static final String COP = "cop";

    /**
     * Heat pump cooling energy efficiency ratio, defaults to the family one.
     */
    public static final String EER = "eer";

    public static final String MODE_EXCLUSIVE = "modeExclusive";

    public static final String EXPORT_CAPACITY = "exportCapacity";

    public static final String MAX_HOURS = "maxHours";

    public static final String CHARGE_EFFICIENCY = "chargeEfficiency";

    public static final String DISCHARGE_EFFICIENCY = "dischargeEfficiency";

    public static final String STANDING_LOSS = "standingLoss";

    public static final String MIN_SOC = "minSoc";

    public static final String MAX_SOC = "maxSoc";

    public static final String INITIAL_SOC = "initialSoc";

    public static final String EXTENDABLE = "extendable";

    private DeviceParameters() {
    }
}
