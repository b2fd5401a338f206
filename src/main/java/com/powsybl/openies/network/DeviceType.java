/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

/**
 * Device archetypes known by the {@link DeviceCatalog}.
 *
 * @author Open IES developers
 */
public enum DeviceType {
    PV(Kind.GENERATOR),
    GRID(Kind.GENERATOR),
    ELECTRIC_BOILER(Kind.LINK),
    HEAT_PUMP(Kind.LINK),
    ELECTROLYZER(Kind.LINK),
    FUEL_CELL(Kind.LINK),
    BATTERY(Kind.STORAGE_UNIT),
    HYDROGEN_STORAGE(Kind.STORAGE_UNIT);

    public enum Kind {
        GENERATOR,
        STORAGE_UNIT,
        LINK
    }

    private final Kind kind;

    DeviceType(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
