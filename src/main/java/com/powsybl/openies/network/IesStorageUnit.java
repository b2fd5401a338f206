/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.opt.CostCategory;
import com.powsybl.openies.opt.CostTerm;
import com.powsybl.openies.opt.DispatchVariableType;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A storage unit charging from and discharging onto one bus. Its energy capacity is the power capacity times
 * {@code maxHours}.
 *
 * @author Open IES developers
 */
public final class IesStorageUnit extends AbstractIesDevice implements IesDevice {

    private final Carrier carrier;

    private final double maxHours;

    private final double chargeEfficiency;

    private final double dischargeEfficiency;

    private final double standingLoss;

    private final double minSoc;

    private final double maxSoc;

    private final double initialSoc;

    public IesStorageUnit(String id, DeviceType type, Carrier carrier, double capacity, double maxHours,
                          double chargeEfficiency, double dischargeEfficiency, double standingLoss,
                          double minSoc, double maxSoc, double initialSoc, double cyclingCost, boolean extendable) {
        super(id, type, capacity, cyclingCost, extendable);
        this.carrier = Objects.requireNonNull(carrier);
        this.maxHours = maxHours;
        this.chargeEfficiency = chargeEfficiency;
        this.dischargeEfficiency = dischargeEfficiency;
        this.standingLoss = standingLoss;
        this.minSoc = minSoc;
        this.maxSoc = maxSoc;
        this.initialSoc = initialSoc;
    }

    public Carrier getCarrier() {
        return carrier;
    }

    public double getMaxHours() {
        return maxHours;
    }

    public double getEnergyCapacity() {
        return capacity * maxHours;
    }

    public double getChargeEfficiency() {
        return chargeEfficiency;
    }

    public double getDischargeEfficiency() {
        return dischargeEfficiency;
    }

    public double getStandingLoss() {
        return standingLoss;
    }

    public double getMinSoc() {
        return minSoc;
    }

    public double getMaxSoc() {
        return maxSoc;
    }

    public double getInitialSoc() {
        return initialSoc;
    }

    /**
     * Initial stored energy, used when the horizon does not wrap around.
     */
    public double getInitialEnergy() {
        return initialSoc * getEnergyCapacity();
    }

    @Override
    public Set<Carrier> getCarriers() {
        return Set.of(carrier);
    }

    @Override
    public List<DispatchVariableType> getVariableTypes() {
        return List.of(DispatchVariableType.CHARGE, DispatchVariableType.DISCHARGE, DispatchVariableType.STATE_OF_CHARGE);
    }

    @Override
    public double getMinValue(DispatchVariableType variableType, int timestep) {
        return variableType == DispatchVariableType.STATE_OF_CHARGE ? minSoc * getEnergyCapacity() : 0;
    }

    @Override
    public double getMaxValue(DispatchVariableType variableType, int timestep) {
        return switch (variableType) {
            case CHARGE, DISCHARGE -> capacity;
            case STATE_OF_CHARGE -> maxSoc * getEnergyCapacity();
            default -> throw unknownVariableType(variableType);
        };
    }

    @Override
    public List<BalanceTerm> getBalanceTerms(Carrier carrier) {
        if (carrier != this.carrier) {
            return List.of();
        }
        return List.of(new BalanceTerm(DispatchVariableType.DISCHARGE, 1), new BalanceTerm(DispatchVariableType.CHARGE, -1));
    }

    @Override
    public List<CostTerm> getCostTerms(int timestep) {
        if (marginalCost == 0) {
            return List.of();
        }
        return List.of(new CostTerm(variable(DispatchVariableType.CHARGE, timestep), marginalCost, CostCategory.CYCLING),
                       new CostTerm(variable(DispatchVariableType.DISCHARGE, timestep), marginalCost, CostCategory.CYCLING));
    }
}
