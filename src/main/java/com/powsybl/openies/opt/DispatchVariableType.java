/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.opt;

/**
 * Decision variable types. Device variables are indexed by device number, bus variables by bus number.
 *
 * @author Open IES developers
 */
public enum DispatchVariableType {
    GENERATION("p", false, false),
    GRID_IMPORT("imp", false, false),
    GRID_EXPORT("exp", false, false),
    CHARGE("ch", false, false),
    DISCHARGE("dis", false, false),
    STATE_OF_CHARGE("soc", false, false),
    LINK_INPUT("in", false, false),
    HEATING_INPUT("hin", false, false),
    COOLING_INPUT("cin", false, false),
    HEATING_ON("hon", true, false),
    COOLING_ON("con", true, false),
    BALANCE_SHORTFALL("short", false, true),
    BALANCE_SURPLUS("surp", false, true);

    private final String symbol;

    private final boolean binary;

    private final boolean busVariable;

    DispatchVariableType(String symbol, boolean binary, boolean busVariable) {
        this.symbol = symbol;
        this.binary = binary;
        this.busVariable = busVariable;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isBinary() {
        return binary;
    }

    public boolean isBusVariable() {
        return busVariable;
    }
}
