/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One operating mode of a link with the output carriers it feeds and the output per unit of input for each of them.
 *
 * @author Open IES developers
 */
public record LinkMode(OperatingMode mode, Map<Carrier, Double> efficiencies) {

    public LinkMode {
        Objects.requireNonNull(mode);
        Objects.requireNonNull(efficiencies);
        if (efficiencies.isEmpty()) {
            throw new IllegalArgumentException("Link mode " + mode + " has no output");
        }
        efficiencies = Collections.unmodifiableMap(new EnumMap<>(efficiencies));
    }

    public static LinkMode of(OperatingMode mode, Carrier output, double efficiency) {
        return new LinkMode(mode, Map.of(output, efficiency));
    }

    public double getEfficiency(Carrier carrier) {
        return efficiencies.getOrDefault(carrier, 0.0);
    }

    /**
     * Sum of the outputs per unit of input over all output carriers.
     */
    public double getTotalEfficiency() {
        return efficiencies.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
