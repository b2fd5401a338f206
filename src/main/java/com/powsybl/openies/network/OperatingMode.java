/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.opt.DispatchVariableType;

import java.util.Optional;

/**
 * Operating modes of a link. A mode has its own input flow variable; modes of an exclusive link also have an
 * on/off indicator.
 *
 * @author Open IES developers
 */
public enum OperatingMode {
    CONVERSION(DispatchVariableType.LINK_INPUT, null),
    HEATING(DispatchVariableType.HEATING_INPUT, DispatchVariableType.HEATING_ON),
    COOLING(DispatchVariableType.COOLING_INPUT, DispatchVariableType.COOLING_ON);

    private final DispatchVariableType inputVariableType;

    private final DispatchVariableType indicatorVariableType;

    OperatingMode(DispatchVariableType inputVariableType, DispatchVariableType indicatorVariableType) {
        this.inputVariableType = inputVariableType;
        this.indicatorVariableType = indicatorVariableType;
    }

    public DispatchVariableType getInputVariableType() {
        return inputVariableType;
    }

    public Optional<DispatchVariableType> getIndicatorVariableType() {
        return Optional.ofNullable(indicatorVariableType);
    }
}
