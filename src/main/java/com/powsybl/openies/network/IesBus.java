/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Balance point of one carrier: at every timestep the balance terms of the attached devices sum up to the demand.
 *
 * @author Open IES developers
 */
public class IesBus {

    private final Carrier carrier;

    private final int num;

    private final double[] demand;

    private final boolean withDemand;

    private final List<IesDevice> devices = new ArrayList<>();

    IesBus(Carrier carrier, int num, double[] demand) {
        this.carrier = Objects.requireNonNull(carrier);
        this.num = num;
        this.withDemand = demand != null;
        this.demand = demand;
    }

    public String getId() {
        return carrier.getSymbol();
    }

    public Carrier getCarrier() {
        return carrier;
    }

    public int getNum() {
        return num;
    }

    public boolean hasDemand() {
        return withDemand;
    }

    public double getDemand(int timestep) {
        return withDemand ? demand[timestep] : 0;
    }

    void addDevice(IesDevice device) {
        devices.add(Objects.requireNonNull(device));
    }

    public List<IesDevice> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    @Override
    public String toString() {
        return getId();
    }
}
