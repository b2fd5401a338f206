/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

import java.util.Arrays;
import java.util.Objects;

/**
 * Explicit buy and sell price series. A series shorter than the horizon is repeated.
 *
 * @author Open IES developers
 */
public class SeriesTariff implements TariffSchedule {

    private final double[] buyPrices;

    private final double[] sellPrices;

    public SeriesTariff(double[] buyPrices, double[] sellPrices) {
        Objects.requireNonNull(buyPrices);
        Objects.requireNonNull(sellPrices);
        if (buyPrices.length == 0) {
            throw new TariffConfigException("Empty price series");
        }
        if (buyPrices.length != sellPrices.length) {
            throw new TariffConfigException("Buy and sell price series have different lengths: "
                    + buyPrices.length + " and " + sellPrices.length);
        }
        for (int i = 0; i < buyPrices.length; i++) {
            if (!Double.isFinite(buyPrices[i]) || buyPrices[i] < 0 || !Double.isFinite(sellPrices[i]) || sellPrices[i] < 0) {
                throw new TariffConfigException(i, "Invalid prices at index " + i + ": buy=" + buyPrices[i] + " sell=" + sellPrices[i]);
            }
        }
        this.buyPrices = buyPrices.clone();
        this.sellPrices = sellPrices.clone();
    }

    public SeriesTariff(double[] buyPrices) {
        this(buyPrices, new double[Objects.requireNonNull(buyPrices).length]);
    }

    public int getLength() {
        return buyPrices.length;
    }

    @Override
    public Price priceAt(int timestep) {
        if (timestep < 0) {
            throw new IllegalArgumentException("Negative timestep: " + timestep);
        }
        int i = timestep % buyPrices.length;
        return new Price(buyPrices[i], sellPrices[i]);
    }

    @Override
    public String toString() {
        return "SeriesTariff(buy=" + Arrays.toString(buyPrices) + ", sell=" + Arrays.toString(sellPrices) + ")";
    }
}
