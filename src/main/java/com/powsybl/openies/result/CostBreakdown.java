/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.result;

/**
 * Cost of a dispatch split by category. Grid cost is net of export revenue.
 *
 * @author Open IES developers
 */
public record CostBreakdown(double fuelCost, double gridCost, double cyclingCost) {

    public static final CostBreakdown ZERO = new CostBreakdown(0, 0, 0);

    public double getTotalCost() {
        return fuelCost + gridCost + cyclingCost;
    }
}
