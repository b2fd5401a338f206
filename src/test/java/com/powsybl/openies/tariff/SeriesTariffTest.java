/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open IES developers
 */
class SeriesTariffTest {

    @Test
    void testRepeatedSeries() {
        SeriesTariff tariff = new SeriesTariff(new double[] {0.3, 0.6, 1.0}, new double[] {0.1, 0.2, 0.3});
        assertEquals(3, tariff.getLength());
        assertEquals(new Price(0.3, 0.1), tariff.priceAt(0));
        assertEquals(new Price(1.0, 0.3), tariff.priceAt(2));
        assertEquals(new Price(0.3, 0.1), tariff.priceAt(3));
        assertEquals(new Price(0.6, 0.2), tariff.priceAt(7));
    }

    @Test
    void testBuyOnly() {
        SeriesTariff tariff = new SeriesTariff(new double[] {0.4, 0.9});
        assertEquals(new Price(0.9, 0), tariff.priceAt(1));
    }

    @Test
    void testSeriesCopied() {
        double[] buy = {0.4, 0.9};
        SeriesTariff tariff = new SeriesTariff(buy);
        buy[0] = 100;
        assertEquals(0.4, tariff.priceAt(0).buy());
    }

    @Test
    void testInvalidSeries() {
        double[] empty = {};
        assertThrows(TariffConfigException.class, () -> new SeriesTariff(empty));
        double[] buy = {0.4, 0.9};
        double[] sell = {0.1};
        TariffConfigException e = assertThrows(TariffConfigException.class, () -> new SeriesTariff(buy, sell));
        assertEquals("Buy and sell price series have different lengths: 2 and 1", e.getMessage());
        double[] negative = {0.4, -0.9};
        e = assertThrows(TariffConfigException.class, () -> new SeriesTariff(negative));
        assertEquals(1, e.getBandIndex().orElseThrow());
    }
}
