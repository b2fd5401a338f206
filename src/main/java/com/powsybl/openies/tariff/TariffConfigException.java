/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.tariff;

import com.powsybl.commons.PowsyblException;

import java.util.OptionalInt;

/**
 * Malformed time-of-use schedule.
 *
 * @author Open IES developers
 */
public class TariffConfigException extends PowsyblException {

    private final int bandIndex;

    public TariffConfigException(String message) {
        this(-1, message);
    }

    public TariffConfigException(int bandIndex, String message) {
        super(message);
        this.bandIndex = bandIndex;
    }

    /**
     * Index of the offending band, if the error is attached to a band.
     */
    public OptionalInt getBandIndex() {
        return bandIndex >= 0 ? OptionalInt.of(bandIndex) : OptionalInt.empty();
    }
}
