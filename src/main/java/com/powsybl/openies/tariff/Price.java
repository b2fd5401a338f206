/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

/**
 * Grid electricity prices applying to one timestep.
 *
 * @param buy price paid per unit imported from the grid
 * @param sell price received per unit exported to the grid
 *
 * @author Open IES developers
 */
public record Price(double buy, double sell) {
}
