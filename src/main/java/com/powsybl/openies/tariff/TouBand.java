/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

import java.util.Objects;

/**
 * A band of a time-of-use schedule, from {@code startHour} inclusive to {@code endHour} exclusive.
 *
 * @author Open IES developers
 */
public record TouBand(int startHour, int endHour, double buyRate, double sellRate, TouPeriod period) {

    public TouBand {
        Objects.requireNonNull(period);
    }

    public TouBand(int startHour, int endHour, double buyRate, double sellRate) {
        this(startHour, endHour, buyRate, sellRate, TouPeriod.FLAT);
    }

    public boolean contains(int hourOfDay) {
        return hourOfDay >= startHour && hourOfDay < endHour;
    }

    @Override
    public String toString() {
        return "[" + startHour + "h, " + endHour + "h) " + period + " buy=" + buyRate + " sell=" + sellRate;
    }
}
