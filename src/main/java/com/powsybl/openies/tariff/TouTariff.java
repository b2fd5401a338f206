/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

import java.util.List;
import java.util.Objects;

/**
 * Time-of-use tariff: bands partitioning a 24-hour cycle, tiled over the horizon.
 *
 * @author Open IES developers
 */
public class TouTariff implements TariffSchedule {

    public static final int HOURS_PER_DAY = 24;

    private final List<TouBand> bands;

    // band index for each hour of the day
    private final int[] bandByHour = new int[HOURS_PER_DAY];

    public TouTariff(List<TouBand> bands) {
        this.bands = List.copyOf(Objects.requireNonNull(bands));
        validate(this.bands);
        for (int i = 0; i < this.bands.size(); i++) {
            TouBand band = this.bands.get(i);
            for (int hour = band.startHour(); hour < band.endHour(); hour++) {
                bandByHour[hour] = i;
            }
        }
    }

    public static TouTariff flat(double buyRate, double sellRate) {
        return new TouTariff(List.of(new TouBand(0, HOURS_PER_DAY, buyRate, sellRate, TouPeriod.FLAT)));
    }

    private static void checkRate(int index, String name, double rate) {
        if (!Double.isFinite(rate) || rate < 0) {
            throw new TariffConfigException(index, "Band " + index + " has an invalid " + name + " rate: " + rate);
        }
    }

    private static void validate(List<TouBand> bands) {
        if (bands.isEmpty()) {
            throw new TariffConfigException("Time-of-use schedule has no band");
        }
        int expectedStart = 0;
        for (int i = 0; i < bands.size(); i++) {
            TouBand band = bands.get(i);
            if (band.startHour() < 0 || band.endHour() > HOURS_PER_DAY) {
                throw new TariffConfigException(i, "Band " + i + " is outside of the 24-hour cycle: " + band);
            }
            if (band.startHour() >= band.endHour()) {
                throw new TariffConfigException(i, "Band " + i + " is empty or reversed: " + band);
            }
            if (band.startHour() < expectedStart) {
                throw new TariffConfigException(i, "Band " + i + " overlaps previous band: starts at " + band.startHour()
                        + "h but previous band ends at " + expectedStart + "h");
            }
            if (band.startHour() > expectedStart) {
                throw new TariffConfigException(i, "Gap between " + expectedStart + "h and " + band.startHour() + "h before band " + i);
            }
            checkRate(i, "buy", band.buyRate());
            checkRate(i, "sell", band.sellRate());
            expectedStart = band.endHour();
        }
        if (expectedStart != HOURS_PER_DAY) {
            int last = bands.size() - 1;
            throw new TariffConfigException(last, "Gap between " + expectedStart + "h and " + HOURS_PER_DAY + "h after band " + last);
        }
    }

    public List<TouBand> getBands() {
        return bands;
    }

    public TouBand bandAt(int timestep) {
        if (timestep < 0) {
            throw new IllegalArgumentException("Negative timestep: " + timestep);
        }
        return bands.get(bandByHour[timestep % HOURS_PER_DAY]);
    }

    public TouPeriod periodAt(int timestep) {
        return bandAt(timestep).period();
    }

    @Override
    public Price priceAt(int timestep) {
        TouBand band = bandAt(timestep);
        return new Price(band.buyRate(), band.sellRate());
    }

    @Override
    public String toString() {
        return "TouTariff(" + bands + ")";
    }
}
