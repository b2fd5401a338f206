/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

/**
 * Maps a timestep of the horizon to the grid buy and sell prices. Timesteps are hourly.
 *
 * @author Open IES developers
 */
public interface TariffSchedule {

    Price priceAt(int timestep);
}
