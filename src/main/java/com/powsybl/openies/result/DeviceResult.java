/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.result;

import com.powsybl.openies.network.Carrier;
import com.powsybl.openies.network.DeviceType;
import com.powsybl.openies.opt.DispatchVariableType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per timestep schedule of one device: the value series of each of its variables and its net injection series on
 * each carrier it is attached to.
 *
 * @author Open IES developers
 */
public final class DeviceResult {

    private final String deviceId;

    private final DeviceType type;

    private final Map<DispatchVariableType, double[]> series;

    private final Map<Carrier, double[]> injections;

    DeviceResult(String deviceId, DeviceType type, Map<DispatchVariableType, double[]> series, Map<Carrier, double[]> injections) {
        this.deviceId = Objects.requireNonNull(deviceId);
        this.type = Objects.requireNonNull(type);
        this.series = Collections.unmodifiableMap(new EnumMap<>(series));
        this.injections = Collections.unmodifiableMap(new EnumMap<>(injections));
    }

    public String getDeviceId() {
        return deviceId;
    }

    public DeviceType getType() {
        return type;
    }

    public Set<DispatchVariableType> getVariableTypes() {
        return series.keySet();
    }

    public double getValue(DispatchVariableType variableType, int timestep) {
        double[] values = series.get(variableType);
        if (values == null) {
            throw new IllegalArgumentException("Device '" + deviceId + "' has no variable of type " + variableType);
        }
        return values[timestep];
    }

    public Optional<double[]> getSeries(DispatchVariableType variableType) {
        return Optional.ofNullable(series.get(variableType)).map(double[]::clone);
    }

    public Set<Carrier> getCarriers() {
        return injections.keySet();
    }

    /**
     * Net injection on the bus of the carrier, negative when the device withdraws.
     */
    public double getInjection(Carrier carrier, int timestep) {
        double[] values = injections.get(carrier);
        return values != null ? values[timestep] : 0;
    }

    public Optional<double[]> getInjectionSeries(Carrier carrier) {
        return Optional.ofNullable(injections.get(carrier)).map(double[]::clone);
    }

    /**
     * State of charge trajectory, only for storage units.
     */
    public Optional<double[]> getStateOfCharge() {
        return getSeries(DispatchVariableType.STATE_OF_CHARGE);
    }

    @Override
    public String toString() {
        return "DeviceResult(" + deviceId + ")";
    }
}
