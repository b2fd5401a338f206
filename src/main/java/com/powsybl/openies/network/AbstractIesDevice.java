/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.VariableRef;

import java.util.Objects;

/**
 * Attributes shared by all devices.
 *
 * @author Open IES developers
 */
public abstract class AbstractIesDevice {

    protected final String id;

    protected final DeviceType type;

    protected final double capacity;

    protected final double marginalCost;

    protected final boolean extendable;

    protected int num = -1;

    protected AbstractIesDevice(String id, DeviceType type, double capacity, double marginalCost, boolean extendable) {
        this.id = Objects.requireNonNull(id);
        this.type = Objects.requireNonNull(type);
        this.capacity = capacity;
        this.marginalCost = marginalCost;
        this.extendable = extendable;
    }

    public String getId() {
        return id;
    }

    public int getNum() {
        return num;
    }

    void setNum(int num) {
        this.num = num;
    }

    public DeviceType getType() {
        return type;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getMarginalCost() {
        return marginalCost;
    }

    public boolean isExtendable() {
        return extendable;
    }

    protected VariableRef variable(DispatchVariableType variableType, int timestep) {
        return new VariableRef(num, variableType, timestep);
    }

    protected IllegalArgumentException unknownVariableType(DispatchVariableType variableType) {
        return new IllegalArgumentException("Device '" + id + "' has no variable of type " + variableType);
    }

    @Override
    public String toString() {
        return id;
    }
}
